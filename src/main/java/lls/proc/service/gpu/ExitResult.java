package lls.proc.service.gpu;

/**
 * Exit code and status of a finished external process.
 */
public record ExitResult(int exitCode, ExitStatus status) {

    public boolean isCrash() {
        return status == ExitStatus.CRASHED;
    }
}
