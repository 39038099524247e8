package lls.proc.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Merges per-stack maximum intensity projections into a single multi-channel file.
 */
public interface MipService {

    void mergeMips(Path dataset) throws IOException;
}
