package lls.proc.exceptions;

/**
 * Thrown when an external executable cannot be resolved, or is not executable,
 * before a process launch is attempted.
 */
public class MissingBinaryException extends LLSProcessingException {

    private final String binary;

    public MissingBinaryException(String binary) {
        super("Binary not found or not executable: " + binary);
        this.binary = binary;
    }

    /**
     * @return the name or path that failed to resolve
     */
    public String getBinary() {
        return binary;
    }
}
