package lls.proc.service.gpu;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one cudaDeconv invocation on one GPU slot.
 *
 * <p>Each output stack is announced by a line containing {@code *** Finished!} or
 * {@code Output:}; either one raises {@link WorkerListener#unitFinished(int)}. Iteration progress
 * lines are logged with the slot prefix, everything else is passed through to the log.
 */
public class CudaDeconvWorker extends SubprocessWorker implements GpuWorker {

    /** Parent of the per-slot loggers, {@code lls.proc.worker.gpu<N>}. */
    public static final String LOGGER_PREFIX = "lls.proc.worker.gpu";

    static final String FINISHED_MARKER = "*** Finished!";
    static final String OUTPUT_MARKER = "Output:";
    static final String ITERATION_MARKER = "Iteration";

    private final int slot;
    private final WorkerListener listener;

    public CudaDeconvWorker(int slot, WorkerListener listener) {
        this(slot, listener, LoggerFactory.getLogger(LOGGER_PREFIX + slot));
    }

    public CudaDeconvWorker(int slot, WorkerListener listener, Logger log) {
        super("CudaDeconv", log, String.valueOf(slot));
        this.slot = slot;
        this.listener = listener;
    }

    @Override
    public int slot() {
        return slot;
    }

    @Override
    protected void onStdout(String line) {
        if (line.contains(FINISHED_MARKER) || line.contains(OUTPUT_MARKER)) {
            log.debug("GPU {}: {}", slot, line);
            listener.unitFinished(slot);
        } else if (line.contains(ITERATION_MARKER)) {
            log.info("GPU {}: {}", slot, line.strip());
        } else {
            log.info(line.stripTrailing());
        }
    }

    @Override
    protected void onStderr(String line) {
        log.error("Error in CudaDeconv on GPU {}: {}", slot, line);
    }

    @Override
    protected void onStarted() {
        listener.started(slot);
    }

    @Override
    protected void onExit(ExitResult result) {
        listener.finished(slot, result);
    }
}
