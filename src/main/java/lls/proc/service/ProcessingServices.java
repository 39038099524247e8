package lls.proc.service;

import java.util.Objects;

/**
 * The external collaborators an item pipeline calls into.
 */
public record ProcessingServices(
        DatasetInspector inspector,
        ArgumentAssembler argumentAssembler,
        CompressionService compression,
        ImageCorrectionService correction,
        RegistrationService registration,
        MipService mips
) {
    public ProcessingServices {
        Objects.requireNonNull(inspector, "inspector");
        Objects.requireNonNull(argumentAssembler, "argumentAssembler");
        Objects.requireNonNull(compression, "compression");
        Objects.requireNonNull(correction, "correction");
        Objects.requireNonNull(registration, "registration");
        Objects.requireNonNull(mips, "mips");
    }
}
