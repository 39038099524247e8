package lls.proc.exceptions;

/**
 * Raised before any work starts when the processing environment is misconfigured,
 * e.g. no GPU slots are selected.
 */
public class ConfigurationException extends LLSProcessingException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
