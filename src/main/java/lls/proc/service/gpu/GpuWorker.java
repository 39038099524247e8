package lls.proc.service.gpu;

/**
 * A running GPU invocation bound to one slot.
 */
public interface GpuWorker {

    int slot();

    /**
     * Kills the invocation and returns once the process has exited. Idempotent.
     */
    void abort();
}
