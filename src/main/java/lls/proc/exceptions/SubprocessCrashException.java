package lls.proc.exceptions;

/**
 * Describes an external GPU process that exited abnormally while it was not being aborted.
 */
public class SubprocessCrashException extends LLSProcessingException {

    private final int slot;
    private final int exitCode;

    /**
     * @param slot GPU slot (device index) the process was bound to
     * @param exitCode the process return code
     */
    public SubprocessCrashException(int slot, int exitCode) {
        super(String.format("cudaDeconv on GPU %d returned a non-zero exit code (%d)", slot, exitCode));
        this.slot = slot;
        this.exitCode = exitCode;
    }

    /**
     * Used when the process could not even be launched on its slot.
     */
    public SubprocessCrashException(int slot, Throwable cause) {
        super(String.format("Failed to launch cudaDeconv on GPU %d: %s", slot, cause.getMessage()), cause);
        this.slot = slot;
        this.exitCode = -1;
    }

    public int getSlot() {
        return slot;
    }

    public int getExitCode() {
        return exitCode;
    }
}
