package lls.proc.service;

import lls.proc.exceptions.InvalidParametersException;
import lls.proc.model.AcquisitionParameters;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads what is on disk for a dataset: whether raw stacks are present, and the parameter
 * record built from the settings file and the folder contents.
 */
public interface DatasetInspector {

    boolean hasRawData(Path dataset) throws IOException;

    /**
     * @throws InvalidParametersException if the settings file cannot be interpreted
     */
    AcquisitionParameters readParameters(Path dataset) throws IOException, InvalidParametersException;
}
