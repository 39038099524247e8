package lls.proc.model;

/**
 * Thrown when a parameter name outside the fixed {@link AcquisitionParameters} schema is used.
 */
public class UnknownParameterException extends IllegalArgumentException {

    public UnknownParameterException(String name) {
        super("Unknown acquisition parameter: " + name);
    }
}
