package lls.proc.service;

import lls.proc.exceptions.MissingBinaryException;
import lls.proc.utilities.MinorFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * CliExecutor
 *
 * <p>Runs short-lived helper commands (tar and friends) to completion:
 *   - Resolves the executable on the PATH.
 *   - Starts the process, applies an optional timeout, captures stdout and stderr.
 *   - Returns stdout, or throws with the captured stderr when the exit code is non-zero.
 */
public class CliExecutor {
    private static final Logger logger = LoggerFactory.getLogger(CliExecutor.class);

    // blocking stream reads stay off the common pool
    private static final ExecutorService DRAIN_EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "cli-output-drain");
        t.setDaemon(true);
        return t;
    });

    /**
     * Execute a command in {@code workingDir}, wait up to {@code timeoutSec} (0 waits forever)
     * and return its standard output.
     *
     * @throws MissingBinaryException if {@code args[0]} cannot be resolved
     * @throws IOException if the command fails, times out or cannot be started
     */
    public static String execCommandAndGetOutput(int timeoutSec, Path workingDir, String... args)
            throws MissingBinaryException, IOException, InterruptedException {

        // 1) Resolve executable path
        Path exePath = MinorFunctions.which(args[0]).orElseThrow(() -> new MissingBinaryException(args[0]));

        // 2) Build command list
        List<String> cmd = new ArrayList<>();
        cmd.add(exePath.toString());
        if (args.length > 1) {
            cmd.addAll(Arrays.asList(args).subList(1, args.length));
        }

        logger.info("Running external command: {} (in {})", cmd, workingDir);

        ProcessBuilder pb = new ProcessBuilder(cmd);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        Process process = pb.start();

        // Drain both streams while waiting so a chatty command cannot block on a full pipe
        CompletableFuture<String> stdout = drain(process, true);
        CompletableFuture<String> stderr = drain(process, false);

        if (timeoutSec > 0) {
            if (!process.waitFor(timeoutSec, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IOException("Command timed out after " + timeoutSec + " seconds");
            }
        } else {
            process.waitFor();
        }

        String out;
        String err;
        try {
            out = stdout.get();
            err = stderr.get();
        } catch (ExecutionException e) {
            throw new IOException("Failed reading output of " + cmd, e.getCause());
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new IOException("Command " + cmd + " failed (exit " + exitCode + "):\n" + err.trim());
        }
        return out.trim();
    }

    private static CompletableFuture<String> drain(Process process, boolean stdout) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                byte[] bytes = stdout
                        ? process.getInputStream().readAllBytes()
                        : process.getErrorStream().readAllBytes();
                return new String(bytes, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, DRAIN_EXECUTOR);
    }
}
