package lls.proc.service.gpu;

import lls.proc.exceptions.MissingBinaryException;
import lls.proc.model.WorkUnit;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory worker factory. Workers never run anything: tests drive them by calling
 * {@link FakeWorker#emitUnitFinished()}, {@link FakeWorker#exit(int)} and friends.
 * With {@code autoComplete}, each worker reports one unit per timepoint and exits normally on
 * its own thread as soon as it is started.
 */
public class FakeGpuWorkerFactory implements GpuWorkerFactory {

    private final List<FakeWorker> started = Collections.synchronizedList(new ArrayList<>());
    private final boolean autoComplete;
    private Exception startFailure;
    private int failOnStart = -1;
    private MissingBinaryException verifyFailure;

    public FakeGpuWorkerFactory() {
        this(false);
    }

    public FakeGpuWorkerFactory(boolean autoComplete) {
        this.autoComplete = autoComplete;
    }

    /** Makes the {@code index}-th start (0 based) throw {@code failure}. */
    public FakeGpuWorkerFactory failOnStart(int index, Exception failure) {
        this.failOnStart = index;
        this.startFailure = failure;
        return this;
    }

    public FakeGpuWorkerFactory failVerify(MissingBinaryException failure) {
        this.verifyFailure = failure;
        return this;
    }

    @Override
    public GpuWorker start(int slot, WorkUnit unit, WorkerListener listener)
            throws MissingBinaryException, IOException {
        if (started.size() == failOnStart) {
            failOnStart = -1;
            if (startFailure instanceof MissingBinaryException e) throw e;
            if (startFailure instanceof IOException e) throw e;
            throw (RuntimeException) startFailure;
        }
        FakeWorker worker = new FakeWorker(slot, unit, listener);
        started.add(worker);
        listener.started(slot);
        if (autoComplete) {
            Thread t = new Thread(worker::completeAll, "fake-gpu-" + slot);
            t.setDaemon(true);
            t.start();
        }
        return worker;
    }

    @Override
    public void verify() throws MissingBinaryException {
        if (verifyFailure != null) {
            throw verifyFailure;
        }
    }

    public List<FakeWorker> started() {
        synchronized (started) {
            return new ArrayList<>(started);
        }
    }

    public FakeWorker last() {
        List<FakeWorker> all = started();
        return all.get(all.size() - 1);
    }

    public static final class FakeWorker implements GpuWorker {
        private final int slot;
        private final WorkUnit unit;
        private final WorkerListener listener;
        private boolean exited;
        private int abortCalls;

        FakeWorker(int slot, WorkUnit unit, WorkerListener listener) {
            this.slot = slot;
            this.unit = unit;
            this.listener = listener;
        }

        @Override
        public int slot() {
            return slot;
        }

        public WorkUnit unit() {
            return unit;
        }

        public void emitUnitFinished() {
            listener.unitFinished(slot);
        }

        /** Exits with {@code code}: 0 is a normal exit, anything else a crash. */
        public void exit(int code) {
            finish(new ExitResult(code, code == 0 ? ExitStatus.NORMAL : ExitStatus.CRASHED));
        }

        /** Completes every timepoint of the unit, then exits normally. */
        public void completeAll() {
            for (int i = 0; i < unit.size(); i++) {
                emitUnitFinished();
            }
            exit(0);
        }

        @Override
        public void abort() {
            abortCalls++;
            finish(new ExitResult(-9, ExitStatus.ABORTED));
        }

        public int abortCalls() {
            return abortCalls;
        }

        public boolean hasExited() {
            return exited;
        }

        private void finish(ExitResult result) {
            synchronized (this) {
                if (exited) {
                    return;
                }
                exited = true;
            }
            listener.finished(slot, result);
        }
    }
}
