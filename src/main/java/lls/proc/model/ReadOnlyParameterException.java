package lls.proc.model;

/**
 * Thrown on an attempt to write one of the computed {@link AcquisitionParameters} fields.
 */
public class ReadOnlyParameterException extends UnsupportedOperationException {

    public ReadOnlyParameterException(String name) {
        super("Acquisition parameter '" + name + "' is computed and cannot be set");
    }
}
