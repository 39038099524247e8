package lls.proc.exceptions;

/**
 * Exception indicating something went wrong with compression or decompression of a dataset folder.
 */
public class CompressionException extends LLSProcessingException {

    public CompressionException(String message) {
        super(message);
    }

    public CompressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
