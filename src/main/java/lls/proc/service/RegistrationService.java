package lls.proc.service;

import lls.proc.model.ProcessingOptions;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Channel registration of processed outputs.
 */
public interface RegistrationService {

    void register(Path dataset, ProcessingOptions options) throws IOException;
}
