package lls.proc.service.gpu;

/**
 * Progress notifications from a {@link GpuWorkerPool}. Called without the pool lock held,
 * from worker threads or the dispatching thread.
 */
public interface PoolListener {

    /**
     * @param completed output stacks finished so far
     * @param expected  output stacks expected for the whole dispatch
     * @param eta       estimated time remaining, HH:mm:ss
     */
    void unitFinished(int completed, int expected, String eta);

    /** The last queued unit has been handed to a worker. */
    default void queueExhausted() {}

    /** A refill cycle started {@code workers} workers. */
    default void cycleStarted(int workers) {}
}
