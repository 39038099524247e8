package lls.proc.controller;

import lls.proc.controller.workflow.PostProcessingHelper;
import lls.proc.controller.workflow.PreProcessingHelper;
import lls.proc.controller.workflow.ProcessingLogWriter;
import lls.proc.exceptions.ConfigurationException;
import lls.proc.exceptions.InvalidParametersException;
import lls.proc.exceptions.LLSProcessingException;
import lls.proc.model.AcquisitionParameters;
import lls.proc.model.ItemOutcome;
import lls.proc.model.ItemState;
import lls.proc.model.ProcessingOptions;
import lls.proc.model.WorkUnit;
import lls.proc.service.ProcessingServices;
import lls.proc.service.gpu.GpuWorkerPool;
import lls.proc.service.gpu.PoolListener;
import lls.proc.service.gpu.PoolOutcome;
import lls.proc.service.gpu.WorkloadPartitioner;
import lls.proc.utilities.DatasetLogger;
import lls.proc.utilities.MinorFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Processes one dataset from raw stacks to final outputs.
 *
 * <p>The pipeline runs as a chain of asynchronous stages on a single coordinating executor:
 * <ol>
 *   <li>Decompression, when the raw data is archived</li>
 *   <li>Readiness: raw data present, z-step and pixel size known; otherwise the item is skipped</li>
 *   <li>Pre-processing: flash correction, or trimming and median filtering</li>
 *   <li>GPU stage: partition into work units and dispatch them over the GPU slots</li>
 *   <li>Post-processing: registration, MIP merging, folder clean-up, compression, processing log</li>
 * </ol>
 *
 * <p>{@link #abort()} may be called at any time. During the GPU stage it kills and drains every
 * running worker; outside of it the request is honoured at the next stage boundary. Either way
 * the item ends {@code ABORTED} and post-processing does not run to completion.
 *
 * <p>The listener's {@link PipelineListener#itemFinished(ItemOutcome)} is called exactly once.
 */
public class ItemProcessingWorkflow {
    private static final Logger logger = LoggerFactory.getLogger(ItemProcessingWorkflow.class);

    /** Default single-threaded coordinator, one item task at a time. */
    static final ExecutorService COORDINATOR = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "lls-item-coordinator");
        t.setDaemon(true);
        return t;
    });

    static final String NO_RAW_DATA = "no raw data found";
    static final String INCOMPLETE_PARAMETERS = "missing z-step or pixel size";
    static final String NO_CHANNEL_ARGUMENTS = "no channel arguments";

    private final Path dataset;
    private final ProcessingOptions options;
    private final ProcessingEnvironment environment;
    private final ProcessingServices services;
    private final PipelineListener listener;
    private final Executor coordinator;
    private final GpuWorkerPool pool;
    private final ProcessingLogWriter logWriter;

    private final Object stateLock = new Object();
    private ItemState state = ItemState.PENDING;
    private boolean abortRequested;
    private boolean started;
    private DatasetLogger.Session logSession;

    public ItemProcessingWorkflow(Path dataset, ProcessingOptions options, ProcessingEnvironment environment,
                                  PipelineListener listener) throws ConfigurationException {
        this(dataset, options, environment, listener, COORDINATOR, new ProcessingLogWriter());
    }

    /**
     * @throws ConfigurationException if the environment has no GPU slots
     */
    public ItemProcessingWorkflow(Path dataset, ProcessingOptions options, ProcessingEnvironment environment,
                                  PipelineListener listener, Executor coordinator, ProcessingLogWriter logWriter)
            throws ConfigurationException {
        this.dataset = dataset;
        this.options = options;
        this.environment = environment;
        this.services = environment.services();
        this.listener = listener;
        this.coordinator = coordinator;
        this.logWriter = logWriter;
        this.pool = new GpuWorkerPool(environment.gpuSlots(), environment.workerFactory(), new ProgressRelay());
    }

    /**
     * Mutable state handed from stage to stage. A non-null {@code outcome} short-circuits the
     * remaining stages.
     */
    private static final class ItemContext {
        Path workingDir;
        AcquisitionParameters params;
        ProcessingOptions resolved;
        ItemOutcome outcome;
    }

    /**
     * Starts processing. May be called once.
     *
     * @return future completing with the item's terminal outcome; it never completes exceptionally
     */
    public CompletableFuture<ItemOutcome> execute() {
        synchronized (stateLock) {
            if (started) {
                throw new IllegalStateException("Item already started: " + dataset);
            }
            started = true;
        }
        logger.info("Starting processing of {}", dataset);

        return CompletableFuture.supplyAsync(this::prepare, coordinator)
                .thenCompose(this::runGpuStage)
                .thenApplyAsync(this::postProcess, coordinator)
                .handle(this::finish);
    }

    // ================== STAGES ==================

    private ItemContext prepare() {
        logSession = DatasetLogger.start(dataset);
        ItemContext ctx = new ItemContext();
        ctx.workingDir = dataset;
        try {
            if (services.compression().isCompressed(dataset)) {
                if (abortIfRequested(ctx)) return ctx;
                transition(ItemState.DECOMPRESSING);
                listener.statusUpdate("Decompressing " + MinorFunctions.shortName(dataset) + "...");
                services.compression().decompress(dataset);
            }

            if (abortIfRequested(ctx)) return ctx;
            if (!services.inspector().hasRawData(dataset)) {
                ctx.outcome = ItemOutcome.skipped(dataset, NO_RAW_DATA);
                return ctx;
            }
            ctx.params = services.inspector().readParameters(dataset);
            if (!ctx.params.isReady()) {
                ctx.outcome = ItemOutcome.skipped(dataset,
                        ctx.params.getFileCount() == 0 ? NO_RAW_DATA : INCOMPLETE_PARAMETERS);
                return ctx;
            }
            ctx.resolved = options.resolve(ctx.params);
            logger.info("Parameters for {}: {}", dataset, ctx.params);

            if (PreProcessingHelper.isRequired(ctx.resolved)) {
                if (abortIfRequested(ctx)) return ctx;
                transition(ItemState.PRE_PROCESSING);
                listener.statusUpdate("Pre-processing " + MinorFunctions.shortName(dataset) + "...");
                ctx.workingDir = PreProcessingHelper.run(dataset, ctx.params, ctx.resolved, services.correction());
            }
            return ctx;
        } catch (LLSProcessingException | IOException e) {
            throw new CompletionException(e);
        }
    }

    private CompletableFuture<ItemContext> runGpuStage(ItemContext ctx) {
        if (ctx.outcome != null || abortIfRequested(ctx)) {
            return CompletableFuture.completedFuture(ctx);
        }
        if (!ctx.resolved.needsGpuStage()) {
            logger.info("No deconvolution or deskewed output requested, skipping GPU stage");
            return CompletableFuture.completedFuture(ctx);
        }

        List<WorkUnit> units;
        try {
            environment.workerFactory().verify();
            WorkloadPartitioner partitioner = new WorkloadPartitioner(services.argumentAssembler());
            units = partitioner.partition(ctx.params, ctx.resolved, ctx.workingDir, environment.gpuSlots().size());
        } catch (LLSProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (units.isEmpty()) {
            ctx.outcome = ItemOutcome.skipped(dataset, NO_CHANNEL_ARGUMENTS);
            return CompletableFuture.completedFuture(ctx);
        }

        synchronized (stateLock) {
            if (abortRequested) {
                ctx.outcome = ItemOutcome.aborted(dataset);
                return CompletableFuture.completedFuture(ctx);
            }
            transition(ItemState.GPU_DISPATCHING);
        }
        int expected = ctx.resolved.expectedStacks();
        listener.statusUpdate("Processing " + MinorFunctions.shortName(dataset) + "...");
        listener.progressMaximum(expected);
        listener.progressValue(0);

        return pool.dispatch(units, expected).thenApply(result -> {
            if (result == PoolOutcome.ABORTED || isAbortRequested()) {
                ctx.outcome = ItemOutcome.aborted(dataset);
            }
            return ctx;
        });
    }

    private ItemContext postProcess(ItemContext ctx) {
        if (ctx.outcome != null || abortIfRequested(ctx)) {
            return ctx;
        }
        transition(ItemState.POST_PROCESSING);
        PostProcessingHelper helper = new PostProcessingHelper(services, logWriter,
                this::isAbortRequested, listener::statusUpdate);
        try {
            boolean completed = helper.run(ctx.workingDir, ctx.params, ctx.resolved, environment.outputLogName());
            if (!completed) {
                ctx.outcome = ItemOutcome.aborted(dataset);
            }
        } catch (LLSProcessingException e) {
            throw new CompletionException(e);
        }
        return ctx;
    }

    private ItemOutcome finish(ItemContext ctx, Throwable ex) {
        ItemOutcome outcome;
        if (ex != null) {
            Throwable cause = unwrap(ex);
            if (getState() == ItemState.ABORTING) {
                logger.warn("Error while aborting {}: {}", dataset, cause.getMessage());
                outcome = ItemOutcome.aborted(dataset);
            } else if (cause instanceof InvalidParametersException) {
                outcome = ItemOutcome.skipped(dataset, cause.getMessage());
            } else {
                logger.error("Processing of {} failed", dataset, cause);
                outcome = ItemOutcome.error(dataset, cause);
            }
        } else if (ctx.outcome != null) {
            outcome = ctx.outcome;
        } else {
            outcome = ItemOutcome.finished(dataset);
        }

        ItemState terminal = terminalState(outcome);
        try {
            transition(terminal);
        } catch (IllegalStateException e) {
            logger.error("Forcing terminal state: {}", e.getMessage());
            synchronized (stateLock) {
                state = terminal;
            }
        }
        logger.info("{} finished: {}{}", dataset, outcome.kind(),
                outcome.reason() != null ? " (" + outcome.reason() + ")" : "");

        try {
            switch (outcome.kind()) {
                case SKIPPED -> listener.skipped(outcome.reason());
                case ERROR -> listener.error(outcome.error());
                default -> { }
            }
            listener.itemFinished(outcome);
        } catch (RuntimeException e) {
            logger.error("Pipeline listener failed for {}", dataset, e);
        } finally {
            if (logSession != null) {
                logSession.close();
            }
        }
        return outcome;
    }

    private static ItemState terminalState(ItemOutcome outcome) {
        return switch (outcome.kind()) {
            case FINISHED -> ItemState.DONE;
            case SKIPPED -> ItemState.SKIPPED;
            case ABORTED -> ItemState.ABORTED;
            case ERROR -> ItemState.FAILED;
        };
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable t = ex;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    // ================== ABORT & STATE ==================

    /**
     * Requests an abort. During the GPU stage this blocks until every running worker has exited.
     */
    public void abort() {
        boolean inGpuStage;
        synchronized (stateLock) {
            if (abortRequested || state.isTerminal()) {
                return;
            }
            abortRequested = true;
            logger.info("Abort requested for {} in state {}", dataset, state);
            inGpuStage = state == ItemState.GPU_DISPATCHING || state == ItemState.GPU_DRAINING;
            if (inGpuStage) {
                transition(ItemState.ABORTING);
            }
        }
        if (inGpuStage) {
            listener.statusUpdate("Aborting " + MinorFunctions.shortName(dataset) + "...");
        }
        pool.abort();
    }

    public boolean isAbortRequested() {
        synchronized (stateLock) {
            return abortRequested;
        }
    }

    public ItemState getState() {
        synchronized (stateLock) {
            return state;
        }
    }

    public Path getDataset() {
        return dataset;
    }

    private boolean abortIfRequested(ItemContext ctx) {
        if (isAbortRequested()) {
            ctx.outcome = ItemOutcome.aborted(dataset);
            return true;
        }
        return false;
    }

    private void transition(ItemState next) {
        synchronized (stateLock) {
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal transition " + state + " -> " + next + " for " + dataset);
            }
            logger.debug("{}: {} -> {}", MinorFunctions.shortName(dataset), state, next);
            state = next;
        }
    }

    /**
     * Forwards pool progress to the pipeline listener.
     */
    private final class ProgressRelay implements PoolListener {
        @Override
        public void unitFinished(int completed, int expected, String eta) {
            listener.progressValue(completed);
            listener.clockUpdate(eta);
        }

        @Override
        public void queueExhausted() {
            synchronized (stateLock) {
                if (state == ItemState.GPU_DISPATCHING) {
                    transition(ItemState.GPU_DRAINING);
                }
            }
        }
    }
}
