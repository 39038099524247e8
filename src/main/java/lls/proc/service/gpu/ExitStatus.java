package lls.proc.service.gpu;

/**
 * How an external process ended.
 */
public enum ExitStatus {
    /** Exit code 0. */
    NORMAL,
    /** Non-zero exit while not being aborted. */
    CRASHED,
    /** Killed after an abort request. */
    ABORTED
}
