package lls.proc.utilities;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for mirroring processing logs into a dataset folder.
 *
 * <p>While a session is open, every log line of the {@code lls.proc} hierarchy (GPU worker
 * output included) is also written to {@code <dataset>/lls_processing.log}, next to the data.
 *
 * <pre>{@code
 * try (DatasetLogger.Session session = DatasetLogger.start(datasetDir)) {
 *     logger.info("Processing...");
 * }
 * }</pre>
 */
public class DatasetLogger {
    private static final Logger logger = LoggerFactory.getLogger(DatasetLogger.class);

    public static final String LOG_FILE_NAME = "lls_processing.log";
    static final String ROOT_LOGGER = "lls.proc";
    private static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    /**
     * Starts mirroring logs into {@code datasetDir}. Returns an inactive session when the
     * folder does not exist or logback is not the active backend.
     */
    public static Session start(Path datasetDir) {
        if (datasetDir == null || !Files.isDirectory(datasetDir)) {
            logger.warn("Cannot enable dataset logging: invalid directory: {}", datasetDir);
            return new Session(null, null);
        }
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            logger.warn("Dataset logging requires logback, found {}", factory.getClass().getName());
            return new Session(null, null);
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName("dataset-" + datasetDir.getFileName());
        appender.setFile(datasetDir.resolve(LOG_FILE_NAME).toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        ch.qos.logback.classic.Logger target = context.getLogger(ROOT_LOGGER);
        target.addAppender(appender);
        logger.info("Dataset logging enabled: {}", datasetDir.resolve(LOG_FILE_NAME));
        return new Session(target, appender);
    }

    /**
     * AutoCloseable handle; closing it detaches and stops the file appender.
     */
    public static final class Session implements AutoCloseable {
        private final ch.qos.logback.classic.Logger target;
        private final FileAppender<ILoggingEvent> appender;
        private boolean closed;

        private Session(ch.qos.logback.classic.Logger target, FileAppender<ILoggingEvent> appender) {
            this.target = target;
            this.appender = appender;
        }

        public boolean isActive() {
            return appender != null && !closed;
        }

        /**
         * @return the log file being written, or null for an inactive session
         */
        public String getFile() {
            return appender != null ? appender.getFile() : null;
        }

        @Override
        public synchronized void close() {
            if (appender == null || closed) {
                return;
            }
            closed = true;
            logger.info("Dataset logging disabled: {}", appender.getFile());
            target.detachAppender(appender);
            appender.stop();
        }
    }
}
