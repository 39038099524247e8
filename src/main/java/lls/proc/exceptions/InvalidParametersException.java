package lls.proc.exceptions;

/**
 * Indicates that a dataset cannot be processed with the parameters available for it,
 * for example a missing z-step or pixel size, or no wavelength for a requested channel.
 *
 * <p>An item failing with this exception is skipped; the rest of a batch carries on.
 */
public class InvalidParametersException extends LLSProcessingException {

    public InvalidParametersException(String message) {
        super(message);
    }
}
