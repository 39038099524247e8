package lls.proc.controller;

import lls.proc.ProcessingChecks;
import lls.proc.exceptions.ConfigurationException;
import lls.proc.exceptions.MissingBinaryException;
import lls.proc.model.ItemOutcome;
import lls.proc.model.ProcessingOptions;
import lls.proc.service.ProcessingServices;
import lls.proc.service.gpu.CudaWorkerFactory;
import lls.proc.utilities.ProcessingConfigManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Processes a list of datasets one after the other over the same GPU slot set.
 *
 * <p>The next item starts when the previous one reports its terminal outcome, whatever that
 * outcome is. {@link #abort()} aborts the running item and reports every item not yet started
 * as {@code ABORTED} without running it.
 */
public class BatchProcessor {
    private static final Logger logger = LoggerFactory.getLogger(BatchProcessor.class);

    private final ProcessingEnvironment environment;
    private final ProcessingOptions options;
    private final PipelineListener listener;

    private final Object lock = new Object();
    private volatile boolean aborted;
    private ItemProcessingWorkflow current;

    public BatchProcessor(ProcessingEnvironment environment, ProcessingOptions options, PipelineListener listener) {
        this.environment = environment;
        this.options = options;
        this.listener = listener;
    }

    /**
     * Builds a processor from a YAML configuration, after running the environment checks.
     * GPU slots, the cudaDeconv binary, processing defaults and the log name come from the file.
     */
    public static BatchProcessor fromConfig(ProcessingConfigManager config, ProcessingServices services,
                                            PipelineListener listener)
            throws ConfigurationException, MissingBinaryException {
        ProcessingChecks.checkEnvironment(config);
        ProcessingEnvironment env = new ProcessingEnvironment(
                config.getGpuSlots(),
                new CudaWorkerFactory(config.getCudaDeconvBinary()),
                services,
                config.getOutputLogName());
        ProcessingOptions options = config.applyDefaults(ProcessingOptions.builder()).build();
        return new BatchProcessor(env, options, listener);
    }

    /**
     * Processes {@code datasets} in order.
     *
     * @return future completing with one outcome per dataset, in input order
     */
    public CompletableFuture<List<ItemOutcome>> process(List<Path> datasets) {
        List<ItemOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Path dataset : datasets) {
            chain = chain.thenCompose(v -> runItem(dataset)).thenAccept(outcomes::add);
        }
        return chain.thenApply(v -> {
            logger.info("Batch of {} items finished", datasets.size());
            return new ArrayList<>(outcomes);
        });
    }

    private CompletableFuture<ItemOutcome> runItem(Path dataset) {
        if (aborted) {
            ItemOutcome outcome = ItemOutcome.aborted(dataset);
            listener.itemFinished(outcome);
            return CompletableFuture.completedFuture(outcome);
        }
        ItemProcessingWorkflow workflow;
        try {
            workflow = new ItemProcessingWorkflow(dataset, options, environment, listener);
        } catch (ConfigurationException e) {
            logger.error("Cannot process {}", dataset, e);
            ItemOutcome outcome = ItemOutcome.error(dataset, e);
            listener.error(e);
            listener.itemFinished(outcome);
            return CompletableFuture.completedFuture(outcome);
        }
        synchronized (lock) {
            current = workflow;
            if (aborted) {
                workflow.abort();
            }
        }
        return workflow.execute();
    }

    /**
     * Aborts the running item and cancels every item not yet started.
     */
    public void abort() {
        ItemProcessingWorkflow running;
        synchronized (lock) {
            aborted = true;
            running = current;
        }
        logger.info("Batch abort requested");
        if (running != null) {
            running.abort();
        }
    }

    public boolean isAborted() {
        return aborted;
    }
}
