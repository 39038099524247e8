package lls.proc.service.gpu;

import lls.proc.exceptions.MissingBinaryException;
import lls.proc.utilities.MinorFunctions;
import org.slf4j.Logger;
import org.slf4j.MDC;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * SubprocessWorker
 *
 * <p>Runs one external program and reports on it:
 *   - Resolves the binary before launch and fails with {@link MissingBinaryException} if absent.
 *   - Starts the process with environment overrides merged into the current environment.
 *   - Reads stdout and stderr line by line on two reader threads.
 *   - A waiter thread joins both readers after exit and calls {@link #onExit(ExitResult)} once.
 *
 * <p>The log lines of every thread a worker owns carry the MDC key {@value #MDC_KEY} so logback
 * can route them to a per-worker file.
 */
public abstract class SubprocessWorker {

    /** MDC key identifying the worker on its threads. */
    public static final String MDC_KEY = "gpu";

    /** How long the readers may keep draining after an aborted process has exited. */
    static final long ABORT_DRAIN_MILLIS = 2000;

    protected final Logger log;
    protected final String name;
    private final String mdcValue;

    private final Object lifecycleLock = new Object();
    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private final AtomicBoolean exitReported = new AtomicBoolean(false);
    private final CompletableFuture<ExitResult> exitFuture = new CompletableFuture<>();
    private volatile Process process;

    /**
     * @param name     display name used in log lines
     * @param log      logger the worker writes its output to
     * @param mdcValue value for the MDC key on the worker's threads, or null
     */
    protected SubprocessWorker(String name, Logger log, String mdcValue) {
        this.name = name;
        this.log = log;
        this.mdcValue = mdcValue;
    }

    /**
     * Launches the binary.
     *
     * @param binary     executable name (looked up on the PATH) or path
     * @param arguments  argument list, without the executable
     * @param env        variables added to the inherited environment, may be empty
     * @param workingDir working directory, or null for the current one
     * @throws MissingBinaryException if the binary cannot be resolved; nothing is launched
     * @throws IOException if the process cannot be started
     */
    public void start(String binary, List<String> arguments, Map<String, String> env, Path workingDir)
            throws MissingBinaryException, IOException {
        Path exe = MinorFunctions.which(binary).orElseThrow(() -> new MissingBinaryException(binary));

        List<String> cmd = new ArrayList<>();
        cmd.add(exe.toString());
        cmd.addAll(arguments);

        ProcessBuilder pb = new ProcessBuilder(cmd);
        if (env != null) {
            env.forEach((k, v) -> {
                pb.environment().put(k, v);
                log.debug("Setting environment variable: {} = {}", k, v);
            });
        }
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }

        withMdc(() -> log.info("Running {} with args: {}", name, String.join(" ", cmd)));

        Process p;
        synchronized (lifecycleLock) {
            if (process != null) {
                throw new IllegalStateException(name + " already started");
            }
            p = pb.start();
            process = p;
        }
        withMdc(this::onStarted);

        Thread tOut = readerThread(p.getInputStream(), this::onStdout, "stdout");
        Thread tErr = readerThread(p.getErrorStream(), this::onStderr, "stderr");
        tOut.start();
        tErr.start();

        Thread waiter = new Thread(() -> {
            withMdc(() -> {
                int code;
                try {
                    code = p.waitFor();
                    if (aborted.get()) {
                        // a surviving grandchild may still hold the pipes open
                        tOut.join(ABORT_DRAIN_MILLIS);
                        tErr.join(ABORT_DRAIN_MILLIS);
                    } else {
                        tOut.join();
                        tErr.join();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("{} waiter interrupted, killing process", name);
                    p.descendants().forEach(ProcessHandle::destroyForcibly);
                    p.destroyForcibly();
                    code = -1;
                }
                reportExit(code);
            });
        }, threadName("waiter"));
        waiter.setDaemon(true);
        waiter.start();
    }

    private Thread readerThread(InputStream stream, Consumer<String> sink, String label) {
        Thread t = new Thread(() -> withMdc(() -> {
            try (BufferedReader r = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = r.readLine()) != null && !exitReported.get()) {
                    sink.accept(line);
                }
            } catch (IOException e) {
                // stream is closed under us when the process is killed
                log.debug("{} {} closed: {}", name, label, e.getMessage());
            }
        }), threadName(label));
        t.setDaemon(true);
        return t;
    }

    private void reportExit(int code) {
        if (!exitReported.compareAndSet(false, true)) {
            return;
        }
        ExitStatus status;
        if (aborted.get()) {
            status = ExitStatus.ABORTED;
        } else if (code == 0) {
            status = ExitStatus.NORMAL;
        } else {
            status = ExitStatus.CRASHED;
        }
        ExitResult result = new ExitResult(code, status);
        switch (status) {
            case NORMAL -> log.info("{} exited normally with exit code: {}", name, code);
            case ABORTED -> log.info("{} aborted (exit code {})", name, code);
            case CRASHED -> log.error("{} crashed with exit code: {}", name, code);
        }
        try {
            onExit(result);
        } finally {
            exitFuture.complete(result);
        }
    }

    /**
     * Kills the process and everything it spawned, then waits for it to exit. Idempotent; does
     * nothing before start.
     */
    public void abort() {
        Process p;
        synchronized (lifecycleLock) {
            p = process;
            if (p == null || !aborted.compareAndSet(false, true)) {
                return;
            }
            withMdc(() -> log.info("{} notified to abort", name));
            // descendants first, they are reparented once the direct process dies
            p.descendants().forEach(ProcessHandle::destroyForcibly);
            p.destroyForcibly();
        }
        try {
            p.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {} to exit", name);
        }
    }

    public boolean isAborted() {
        return aborted.get();
    }

    public boolean isRunning() {
        Process p = process;
        return p != null && p.isAlive();
    }

    /**
     * Completes with the exit result after output has been drained and {@link #onExit} has run.
     */
    public CompletableFuture<ExitResult> exitFuture() {
        return exitFuture;
    }

    // ================== HOOKS ==================

    /** Called on a reader thread for each stdout line. */
    protected abstract void onStdout(String line);

    /** Called on a reader thread for each stderr line. */
    protected void onStderr(String line) {
        log.warn("{} stderr: {}", name, line);
    }

    /** Called once the process has been launched, before any output is read. */
    protected void onStarted() {}

    /**
     * Called exactly once, after both readers have drained. After an abort the readers get
     * {@value #ABORT_DRAIN_MILLIS} ms; lines arriving later are dropped.
     */
    protected void onExit(ExitResult result) {}

    // ================== HELPERS ==================

    private String threadName(String label) {
        return name + (mdcValue != null ? "-" + mdcValue : "") + "-" + label;
    }

    private void withMdc(Runnable r) {
        if (mdcValue == null) {
            r.run();
            return;
        }
        MDC.put(MDC_KEY, mdcValue);
        try {
            r.run();
        } finally {
            MDC.remove(MDC_KEY);
        }
    }
}
