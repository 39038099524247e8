package lls.proc.service;

import lls.proc.model.AcquisitionParameters;
import lls.proc.model.ProcessingOptions;
import lls.proc.model.WorkUnit;

import java.util.List;

/**
 * Turns a work unit into the literal argument list of the GPU binary.
 */
@FunctionalInterface
public interface ArgumentAssembler {

    List<String> assemble(WorkUnit unit, AcquisitionParameters params, ProcessingOptions options);
}
