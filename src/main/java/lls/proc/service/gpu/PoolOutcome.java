package lls.proc.service.gpu;

/**
 * How a dispatch ended when it did not fail.
 */
public enum PoolOutcome {
    /** Every unit ran to completion. */
    COMPLETED,
    /** The dispatch was aborted and every slot has been drained. */
    ABORTED
}
