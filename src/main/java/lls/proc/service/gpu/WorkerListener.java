package lls.proc.service.gpu;

/**
 * Callbacks raised by a GPU worker. They arrive on the worker's reader and waiter threads.
 * For one worker every {@code unitFinished} precedes its single {@code finished}.
 */
public interface WorkerListener {

    default void started(int slot) {}

    /** One output stack of the current unit has been written. */
    void unitFinished(int slot);

    /** The process has exited and its output has been drained. Raised exactly once. */
    void finished(int slot, ExitResult result);
}
