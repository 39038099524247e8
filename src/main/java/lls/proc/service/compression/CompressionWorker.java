package lls.proc.service.compression;

import lls.proc.service.gpu.SubprocessWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one compressor invocation (lbzip2, pigz, ...) over a tarball.
 *
 * <p>These tools print their verbose progress on stderr, so stderr is logged at INFO and the
 * last line carrying a percentage is kept for status reporting.
 */
public class CompressionWorker extends SubprocessWorker {

    private static final Logger WORKER_LOG = LoggerFactory.getLogger("lls.proc.worker.compression");

    private volatile String resultString;

    public CompressionWorker() {
        super("CompressionWorker", WORKER_LOG, "compression");
    }

    @Override
    protected void onStdout(String line) {
        log.info(line.stripTrailing());
    }

    @Override
    protected void onStderr(String line) {
        if (line.contains("%")) {
            resultString = line.strip();
        }
        log.info(line.stripTrailing());
    }

    /**
     * @return the last progress line the compressor printed, or null
     */
    public String getResultString() {
        return resultString;
    }
}
