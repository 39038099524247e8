package lls.proc.service.gpu;

import lls.proc.exceptions.ConfigurationException;
import lls.proc.exceptions.MissingBinaryException;
import lls.proc.exceptions.SubprocessCrashException;
import lls.proc.model.WorkUnit;
import lls.proc.utilities.MinorFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.LongSupplier;

/**
 * GpuWorkerPool
 *
 * <p>Runs a queue of work units over a fixed set of GPU slots, one worker per slot at a time.
 *
 * <p>Dispatch works in refill cycles: every idle slot takes the next unit, and a new cycle only
 * starts once all slots have reported {@code finished}. The returned future completes when the
 * queue is empty and every slot is idle, with {@link PoolOutcome#COMPLETED}, or with
 * {@link PoolOutcome#ABORTED} after {@link #abort()} has drained every running worker.
 *
 * <p>A worker that crashes while no abort is in progress ends the dispatch: the queue is
 * cleared, the other workers are aborted, and once every slot is idle the future fails with
 * {@link SubprocessCrashException}.
 *
 * <p>All pool state is guarded by one lock. Worker aborts, listener callbacks and future
 * completion happen outside of it. A pool serves a single dispatch.
 */
public class GpuWorkerPool {
    private static final Logger logger = LoggerFactory.getLogger(GpuWorkerPool.class);

    private final List<Integer> slots;
    private final GpuWorkerFactory factory;
    private final PoolListener listener;
    private final LongSupplier nanoClock;

    private final Object lock = new Object();
    private final Deque<WorkUnit> queue = new ArrayDeque<>();
    private final Map<Integer, GpuWorker> running = new LinkedHashMap<>();
    private final WorkerListener workerListener = new SlotListener();

    private CompletableFuture<PoolOutcome> result;
    private boolean abortRequested;
    private Throwable failure;
    private int completed;
    private int expected;
    private long startNanos;

    public GpuWorkerPool(List<Integer> slots, GpuWorkerFactory factory, PoolListener listener)
            throws ConfigurationException {
        this(slots, factory, listener, System::nanoTime);
    }

    public GpuWorkerPool(List<Integer> slots, GpuWorkerFactory factory, PoolListener listener,
                         LongSupplier nanoClock) throws ConfigurationException {
        if (slots == null || slots.isEmpty()) {
            throw new ConfigurationException("No GPUs selected");
        }
        if (slots.stream().distinct().count() != slots.size()) {
            throw new ConfigurationException("Duplicate GPU slot in " + slots);
        }
        this.slots = List.copyOf(slots);
        this.factory = factory;
        this.listener = listener;
        this.nanoClock = nanoClock;
    }

    /**
     * Queues {@code units} and starts the first refill cycle.
     *
     * @param units         units in dispatch order
     * @param expectedUnits number of completion markers expected overall, for progress and ETA
     */
    public CompletableFuture<PoolOutcome> dispatch(List<WorkUnit> units, int expectedUnits) {
        CycleEffects effects;
        CompletableFuture<PoolOutcome> future;
        synchronized (lock) {
            if (result != null) {
                throw new IllegalStateException("Pool has already dispatched");
            }
            result = new CompletableFuture<>();
            future = result;
            if (abortRequested) {
                logger.info("Dispatch requested after abort, nothing started");
                result.complete(PoolOutcome.ABORTED);
                return future;
            }
            queue.addAll(units);
            expected = expectedUnits;
            completed = 0;
            startNanos = nanoClock.getAsLong();
            logger.info("Dispatching {} units over GPU slots {}", units.size(), slots);
            if (queue.isEmpty()) {
                result.complete(PoolOutcome.COMPLETED);
                return future;
            }
            effects = startCycle();
        }
        effects.apply();
        return future;
    }

    /**
     * Requests an abort: clears the queue and kills every running worker. The dispatch future
     * completes with {@link PoolOutcome#ABORTED} only once every slot has reported back.
     */
    public void abort() {
        List<GpuWorker> toAbort;
        synchronized (lock) {
            if (abortRequested) {
                return;
            }
            abortRequested = true;
            queue.clear();
            toAbort = new ArrayList<>(running.values());
            logger.info("Abort requested, stopping {} running workers", toAbort.size());
        }
        for (GpuWorker w : toAbort) {
            w.abort();
        }
    }

    // Must hold lock. Starts one worker per idle slot.
    private CycleEffects startCycle() {
        CycleEffects effects = new CycleEffects();
        int started = 0;
        for (Integer slot : slots) {
            if (queue.isEmpty() || failure != null) {
                break;
            }
            if (running.containsKey(slot)) {
                continue;
            }
            WorkUnit unit = queue.poll();
            try {
                GpuWorker worker = factory.start(slot, unit, workerListener);
                running.put(slot, worker);
                started++;
                logger.info("GPU {}: started channel {} timepoints {} ({})",
                        slot, unit.channel(), unit.timepoints(), unit.filenamePattern());
            } catch (MissingBinaryException e) {
                logger.error("GPU {}: {}", slot, e.getMessage());
                failure = e;
                queue.clear();
                effects.toAbort.addAll(running.values());
            } catch (IOException | RuntimeException e) {
                logger.error("GPU {}: failed to start worker", slot, e);
                failure = new SubprocessCrashException(slot, e);
                queue.clear();
                effects.toAbort.addAll(running.values());
            }
        }
        if (queue.isEmpty() && failure == null) {
            effects.queueExhausted = true;
        }
        effects.startedWorkers = started;
        if (running.isEmpty() && failure != null) {
            effects.settle(result, null, failure);
        }
        return effects;
    }

    private void onUnitFinished(int slot) {
        int done;
        int total;
        String eta;
        synchronized (lock) {
            completed++;
            done = completed;
            total = expected;
            eta = eta(done, total);
        }
        logger.debug("GPU {}: output finished ({}/{})", slot, done, total);
        listener.unitFinished(done, total, eta);
    }

    private void onWorkerFinished(int slot, ExitResult exit) {
        CycleEffects effects = new CycleEffects();
        synchronized (lock) {
            running.remove(slot);
            if (exit.isCrash() && !abortRequested && failure == null) {
                failure = new SubprocessCrashException(slot, exit.exitCode());
                queue.clear();
                effects.toAbort.addAll(running.values());
                logger.error("GPU {} crashed with exit code {}, stopping remaining workers", slot, exit.exitCode());
            }
            if (running.isEmpty()) {
                if (abortRequested) {
                    queue.clear();
                    effects.settle(result, PoolOutcome.ABORTED, null);
                } else if (failure != null) {
                    effects.settle(result, null, failure);
                } else if (!queue.isEmpty()) {
                    effects = effects.merge(startCycle());
                } else {
                    logger.info("All {} units complete", completed);
                    effects.settle(result, PoolOutcome.COMPLETED, null);
                }
            }
        }
        effects.apply();
    }

    // Must hold lock.
    private String eta(int done, int total) {
        if (done <= 0) {
            return MinorFunctions.formatDuration(Duration.ZERO);
        }
        long elapsed = nanoClock.getAsLong() - startNanos;
        long remaining = Math.max(0, (long) ((double) elapsed / done * (total - done)));
        return MinorFunctions.formatDuration(Duration.ofNanos(remaining));
    }

    // ================== INTROSPECTION ==================

    public List<Integer> getSlots() {
        return slots;
    }

    public List<Integer> occupiedSlots() {
        synchronized (lock) {
            return new ArrayList<>(running.keySet());
        }
    }

    public int queuedUnits() {
        synchronized (lock) {
            return queue.size();
        }
    }

    public int completedUnits() {
        synchronized (lock) {
            return completed;
        }
    }

    public boolean isIdle() {
        synchronized (lock) {
            return running.isEmpty();
        }
    }

    public boolean isAbortRequested() {
        synchronized (lock) {
            return abortRequested;
        }
    }

    /**
     * Work decided under the lock and carried out after releasing it.
     */
    private final class CycleEffects {
        final List<GpuWorker> toAbort = new ArrayList<>();
        boolean queueExhausted;
        int startedWorkers;
        CompletableFuture<PoolOutcome> future;
        PoolOutcome outcome;
        Throwable error;

        void settle(CompletableFuture<PoolOutcome> f, PoolOutcome o, Throwable e) {
            this.future = f;
            this.outcome = o;
            this.error = e;
        }

        CycleEffects merge(CycleEffects other) {
            other.toAbort.addAll(0, toAbort);
            if (future != null && other.future == null) {
                other.settle(future, outcome, error);
            }
            return other;
        }

        void apply() {
            for (GpuWorker w : toAbort) {
                w.abort();
            }
            if (startedWorkers > 0) {
                listener.cycleStarted(startedWorkers);
            }
            if (queueExhausted) {
                listener.queueExhausted();
            }
            if (future != null) {
                if (error != null) {
                    future.completeExceptionally(error);
                } else {
                    future.complete(outcome);
                }
            }
        }
    }

    private final class SlotListener implements WorkerListener {
        @Override
        public void unitFinished(int slot) {
            onUnitFinished(slot);
        }

        @Override
        public void finished(int slot, ExitResult exit) {
            onWorkerFinished(slot, exit);
        }
    }
}
