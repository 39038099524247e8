package lls.proc.service;

import lls.proc.exceptions.CompressionException;

import java.nio.file.Path;

/**
 * Compresses and decompresses the raw data of a dataset folder.
 */
public interface CompressionService {

    /**
     * @return true if the folder holds a compressed raw archive
     */
    boolean isCompressed(Path dataset);

    void decompress(Path dataset) throws CompressionException;

    void compress(Path dataset) throws CompressionException;
}
