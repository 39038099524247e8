package lls.proc.service;

import lls.proc.model.AcquisitionParameters;
import lls.proc.model.ProcessingOptions;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Pre-processing of raw stacks. Both operations write corrected copies and return the
 * folder holding them, which replaces the raw folder for the rest of the pipeline.
 */
public interface ImageCorrectionService {

    Path correctFlash(Path dataset, AcquisitionParameters params, ProcessingOptions options) throws IOException;

    Path medianAndTrim(Path dataset, AcquisitionParameters params, ProcessingOptions options) throws IOException;
}
