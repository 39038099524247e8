package lls.proc.utilities;

import lls.proc.exceptions.ConfigurationException;
import lls.proc.model.ProcessingOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * ProcessingConfigManager
 *
 * <p>Loads and queries the processing YAML configuration:
 *   - Parses nested YAML into a Map<String,Object>.
 *   - Offers type safe getters (getDouble, getSection, getList, etc.) over nested keys.
 *   - Validates required keys and reports missing paths.
 *   - Fills a {@link ProcessingOptions.Builder} with the configured processing defaults.
 *
 * <p>Example:
 * <pre>{@code
 * gpus: [0, 1]
 * binaries:
 *   cudaDeconv: cudaDeconv
 *   tar: tar
 *   compression: lbzip2
 * processing:
 *   iterations: 10
 *   background: 90
 *   otfs:
 *     0: /data/otfs/488_otf.tif
 * output_log_name: ProcessingLog.txt
 * }</pre>
 */
public class ProcessingConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ProcessingConfigManager.class);

    public static final String DEFAULT_OUTPUT_LOG_NAME = "ProcessingLog.txt";

    /** Key paths that must be present for a batch to run. */
    public static final List<String[]> REQUIRED_KEYS = List.of(
            new String[]{"gpus"},
            new String[]{"binaries", "cudaDeconv"}
    );

    private final Map<String, Object> configData;
    private final Path configPath;

    ProcessingConfigManager(Map<String, Object> configData, Path configPath) {
        this.configData = configData;
        this.configPath = configPath;
    }

    /**
     * Loads a YAML configuration file.
     *
     * @throws ConfigurationException if the file is missing, unreadable, or its root is not a map
     */
    @SuppressWarnings("unchecked")
    public static ProcessingConfigManager load(Path path) throws ConfigurationException {
        Yaml yaml = new Yaml();
        try (InputStream in = Files.newInputStream(path)) {
            Object loaded = yaml.load(in);
            if (loaded == null) {
                logger.warn("YAML file is empty: {}", path);
                return new ProcessingConfigManager(new LinkedHashMap<>(), path);
            }
            if (!(loaded instanceof Map)) {
                throw new ConfigurationException("YAML root is not a map: " + path);
            }
            logger.info("Loaded processing configuration from {}", path);
            return new ProcessingConfigManager(new LinkedHashMap<>((Map<String, Object>) loaded), path);
        } catch (NoSuchFileException e) {
            throw new ConfigurationException("YAML file not found: " + path, e);
        } catch (IOException | YAMLException e) {
            throw new ConfigurationException("Error parsing YAML: " + path, e);
        }
    }

    public Map<String, Object> getAllConfig() {
        return configData;
    }

    public Path getConfigPath() {
        return configPath;
    }

    // ================== GENERIC GETTERS ==================

    /**
     * Retrieve a nested value following the given keys.
     *
     * @return the value at the end of the key path, or null if not found
     */
    public Object getConfigItem(String... keys) {
        Object current = configData;
        for (int i = 0; i < keys.length; i++) {
            String key = keys[i];
            if (current instanceof Map<?, ?> map) {
                Object next = map.get(key);
                if (next == null) {
                    // YAML keys such as channel indices load as Integers
                    next = lookupNumericKey(map, key);
                }
                if (next != null) {
                    current = next;
                    continue;
                }
            }
            logger.debug("Key '{}' not found at level {} of {}", key, i, Arrays.toString(keys));
            return null;
        }
        return current;
    }

    private static Object lookupNumericKey(Map<?, ?> map, String key) {
        try {
            return map.get(Integer.parseInt(key));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public String getString(String... keys) {
        Object v = getConfigItem(keys);
        return v != null ? v.toString() : null;
    }

    public Integer getInteger(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.intValue();
        try {
            return (v != null) ? Integer.parseInt(v.toString()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected int at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Double getDouble(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.doubleValue();
        try {
            return (v != null) ? Double.parseDouble(v.toString()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected double at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    /**
     * @return the boolean at the key path, or null when absent
     */
    public Boolean getBoolean(String... keys) {
        Object v = getConfigItem(keys);
        if (v == null) return null;
        if (v instanceof Boolean b) return b;
        return Boolean.parseBoolean(v.toString());
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof List<?>) ? (List<Object>) v : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getSection(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof Map<?, ?>) ? (Map<String, Object>) v : null;
    }

    // ================== VALIDATION ==================

    /**
     * Validates that each of the provided key paths exists.
     *
     * @return set of missing paths (empty if all are present)
     */
    public Set<String[]> validateRequiredKeys(List<String[]> requiredPaths) {
        Set<String[]> missing = new LinkedHashSet<>();
        for (String[] path : requiredPaths) {
            if (getConfigItem(path) == null) missing.add(path);
        }
        if (!missing.isEmpty()) {
            logger.error("Missing required configuration keys: {}", describe(missing));
        }
        return missing;
    }

    /**
     * @throws ConfigurationException listing every missing required key, or if no GPU is selected
     */
    public void validateConfiguration() throws ConfigurationException {
        Set<String[]> missing = validateRequiredKeys(REQUIRED_KEYS);
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Missing required configuration keys: " + describe(missing));
        }
        if (getGpuSlots().isEmpty()) {
            throw new ConfigurationException("No GPUs selected in " + configPath);
        }
    }

    private static List<String> describe(Set<String[]> paths) {
        return paths.stream().map(p -> String.join("/", p)).collect(Collectors.toList());
    }

    // ================== TYPED ACCESSORS ==================

    /**
     * @return GPU device indices to schedule on, in configured order
     */
    public List<Integer> getGpuSlots() {
        List<Object> raw = getList("gpus");
        List<Integer> slots = new ArrayList<>();
        if (raw == null) {
            Integer single = getInteger("gpus");
            if (single != null) slots.add(single);
            return slots;
        }
        for (Object o : raw) {
            if (o instanceof Number n) {
                slots.add(n.intValue());
            } else {
                logger.warn("Ignoring non-numeric GPU entry: {}", o);
            }
        }
        return slots;
    }

    public String getCudaDeconvBinary() {
        return getString("binaries", "cudaDeconv");
    }

    public String getTarBinary() {
        String v = getString("binaries", "tar");
        return v != null ? v : "tar";
    }

    public String getCompressionBinary() {
        String v = getString("binaries", "compression");
        return v != null ? v : (MinorFunctions.isWindows() ? "pigz" : "lbzip2");
    }

    public String getOutputLogName() {
        String v = getString("output_log_name");
        return v != null ? v : DEFAULT_OUTPUT_LOG_NAME;
    }

    /**
     * Copies the configured processing defaults onto {@code builder}. Keys absent from the
     * configuration leave the builder's values untouched.
     */
    public ProcessingOptions.Builder applyDefaults(ProcessingOptions.Builder builder) {
        Integer iterations = getInteger("processing", "iterations");
        if (iterations != null) builder.iterations(iterations);
        Integer background = getInteger("processing", "background");
        if (background != null) builder.defaultBackground(background);
        Double deskew = getDouble("processing", "deskew");
        if (deskew != null) builder.deskewOverride(deskew);

        Boolean b;
        if ((b = getBoolean("processing", "save_deskewed_raw")) != null) builder.saveDeskewedRaw(b);
        if ((b = getBoolean("processing", "correct_flash")) != null) builder.correctFlash(b);
        if ((b = getBoolean("processing", "median_filter")) != null) builder.medianFilter(b);
        if ((b = getBoolean("processing", "merge_mips")) != null) builder.mergeMips(b);
        if ((b = getBoolean("processing", "move_corrected")) != null) builder.moveCorrected(b);
        if ((b = getBoolean("processing", "keep_corrected")) != null) builder.keepCorrected(b);
        if ((b = getBoolean("processing", "compress_raw")) != null) builder.compressRaw(b);
        if ((b = getBoolean("processing", "write_log")) != null) builder.writeLog(b);

        String target = getString("processing", "flash_correction_target");
        if (target != null) builder.flashCorrectionTarget(target);
        String camParams = getString("processing", "camera_params");
        if (camParams != null) builder.cameraParamsPath(Paths.get(camParams));

        int[] trim;
        if ((trim = getPair("processing", "trim", "x")) != null) builder.trimX(trim[0], trim[1]);
        if ((trim = getPair("processing", "trim", "y")) != null) builder.trimY(trim[0], trim[1]);
        if ((trim = getPair("processing", "trim", "z")) != null) builder.trimZ(trim[0], trim[1]);

        if ((b = getBoolean("processing", "registration", "enabled")) != null) builder.doRegistration(b);
        Integer refWave = getInteger("processing", "registration", "reference_wave");
        if (refWave != null) builder.registrationReferenceWave(refWave);
        String mode = getString("processing", "registration", "mode");
        if (mode != null) builder.registrationMode(mode);
        String calibration = getString("processing", "registration", "calibration");
        if (calibration != null) builder.registrationCalibrationPath(Paths.get(calibration));
        if ((b = getBoolean("processing", "registration", "delete_unregistered")) != null) {
            builder.deleteUnregistered(b);
        }

        Map<String, Object> otfs = getSection("processing", "otfs");
        if (otfs != null) {
            for (Map.Entry<?, Object> e : ((Map<?, Object>) otfs).entrySet()) {
                builder.otfFile(Integer.parseInt(e.getKey().toString()), Paths.get(e.getValue().toString()));
            }
        }
        Map<String, Object> backgrounds = getSection("processing", "backgrounds");
        if (backgrounds != null) {
            for (Map.Entry<?, Object> e : ((Map<?, Object>) backgrounds).entrySet()) {
                builder.background(Integer.parseInt(e.getKey().toString()),
                        ((Number) e.getValue()).intValue());
            }
        }
        return builder;
    }

    private int[] getPair(String... keys) {
        List<Object> l = getList(keys);
        if (l == null || l.size() != 2) {
            return null;
        }
        return new int[]{((Number) l.get(0)).intValue(), ((Number) l.get(1)).intValue()};
    }
}
