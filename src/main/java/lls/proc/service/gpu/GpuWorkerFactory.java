package lls.proc.service.gpu;

import lls.proc.exceptions.MissingBinaryException;
import lls.proc.model.WorkUnit;

import java.io.IOException;

/**
 * Launches GPU workers for the pool.
 */
public interface GpuWorkerFactory {

    /**
     * Starts processing {@code unit} on {@code slot}. The returned worker is already running.
     */
    GpuWorker start(int slot, WorkUnit unit, WorkerListener listener) throws MissingBinaryException, IOException;

    /**
     * Checks that whatever the workers launch is available, before any work is queued.
     */
    default void verify() throws MissingBinaryException {}
}
