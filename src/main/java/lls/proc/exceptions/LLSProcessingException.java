package lls.proc.exceptions;

/**
 * Base class for every failure raised while processing a lattice light-sheet dataset.
 *
 * <p>Subclasses distinguish failures that skip an item (see {@link InvalidParametersException})
 * from failures that end it with an error. Callers that only care whether an item can continue
 * may catch this type directly.
 */
public class LLSProcessingException extends Exception {

    /**
     * Constructs a new processing exception with the specified detail message.
     *
     * @param message the detail message
     */
    public LLSProcessingException(String message) {
        super(message);
    }

    /**
     * Constructs a new processing exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public LLSProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
