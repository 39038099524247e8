package lls.proc.controller.workflow;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import lls.proc.model.AcquisitionParameters;
import lls.proc.model.ProcessingOptions;
import lls.proc.utilities.MinorFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the JSON processing log of a dataset: {@code <dataset>/<basename>_<logName>}.
 *
 * <p>The log records the dataset, when it was processed, the stored acquisition parameters and
 * the options it was processed with.
 */
public class ProcessingLogWriter {
    private static final Logger logger = LoggerFactory.getLogger(ProcessingLogWriter.class);

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .registerTypeHierarchyAdapter(Path.class,
                    (JsonSerializer<Path>) (src, type, ctx) -> new JsonPrimitive(src.toString()))
            .registerTypeAdapter(LocalDateTime.class,
                    (JsonSerializer<LocalDateTime>) (src, type, ctx) ->
                            new JsonPrimitive(src.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)))
            .create();

    private final Clock clock;

    public ProcessingLogWriter() {
        this(Clock.systemDefaultZone());
    }

    public ProcessingLogWriter(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return the file written
     */
    public Path write(Path dataset, AcquisitionParameters params, ProcessingOptions options, String logName)
            throws IOException {
        Path out = dataset.resolve(MinorFunctions.shortName(dataset) + "_" + logName);

        Map<String, Object> log = new LinkedHashMap<>();
        log.put("dataset", dataset.toAbsolutePath().toString());
        log.put("date", LocalDateTime.now(clock));
        log.put("parameters", params.toMap());
        log.put("options", options.toMap());

        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            GSON.toJson(log, w);
        }
        logger.info("Processing log written to {}", out);
        return out;
    }
}
