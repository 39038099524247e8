package lls.proc.model;

import lls.proc.exceptions.InvalidParametersException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Per-run user options for processing one dataset: which timepoints and channels to process,
 * the deconvolution settings, and which pre- and post-processing stages to run.
 *
 * <p>Instances are immutable and created with {@link #builder()}. Timepoint and channel ranges
 * may be left unset (meaning "all"); {@link #resolve(AcquisitionParameters)} turns them into
 * concrete ranges against a dataset's parameter record.
 */
public final class ProcessingOptions {

    public static final int DEFAULT_BACKGROUND = 90;

    private final List<Integer> timepoints;
    private final List<Integer> channels;
    private final Map<Integer, Path> otfFiles;
    private final Map<Integer, Integer> backgrounds;
    private final int defaultBackground;
    private final int iterations;
    private final Double deskewOverride;
    private final boolean saveDeskewedRaw;
    private final boolean correctFlash;
    private final String flashCorrectionTarget;
    private final Path cameraParamsPath;
    private final boolean medianFilter;
    private final int[] trimX;
    private final int[] trimY;
    private final int[] trimZ;
    private final boolean doRegistration;
    private final Integer registrationReferenceWave;
    private final String registrationMode;
    private final Path registrationCalibrationPath;
    private final boolean deleteUnregistered;
    private final boolean mergeMips;
    private final boolean moveCorrected;
    private final boolean keepCorrected;
    private final boolean compressRaw;
    private final boolean writeLog;

    private ProcessingOptions(Builder b) {
        this.timepoints = b.timepoints == null ? null : List.copyOf(b.timepoints);
        this.channels = b.channels == null ? null : List.copyOf(b.channels);
        this.otfFiles = Collections.unmodifiableMap(new LinkedHashMap<>(b.otfFiles));
        this.backgrounds = Collections.unmodifiableMap(new LinkedHashMap<>(b.backgrounds));
        this.defaultBackground = b.defaultBackground;
        this.iterations = b.iterations;
        this.deskewOverride = b.deskewOverride;
        this.saveDeskewedRaw = b.saveDeskewedRaw;
        this.correctFlash = b.correctFlash;
        this.flashCorrectionTarget = b.flashCorrectionTarget;
        this.cameraParamsPath = b.cameraParamsPath;
        this.medianFilter = b.medianFilter;
        this.trimX = b.trimX.clone();
        this.trimY = b.trimY.clone();
        this.trimZ = b.trimZ.clone();
        this.doRegistration = b.doRegistration;
        this.registrationReferenceWave = b.registrationReferenceWave;
        this.registrationMode = b.registrationMode;
        this.registrationCalibrationPath = b.registrationCalibrationPath;
        this.deleteUnregistered = b.deleteUnregistered;
        this.mergeMips = b.mergeMips;
        this.moveCorrected = b.moveCorrected;
        this.keepCorrected = b.keepCorrected;
        this.compressRaw = b.compressRaw;
        this.writeLog = b.writeLog;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-filled with this instance's values
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.timepoints = timepoints;
        b.channels = channels;
        b.otfFiles.putAll(otfFiles);
        b.backgrounds.putAll(backgrounds);
        b.defaultBackground = defaultBackground;
        b.iterations = iterations;
        b.deskewOverride = deskewOverride;
        b.saveDeskewedRaw = saveDeskewedRaw;
        b.correctFlash = correctFlash;
        b.flashCorrectionTarget = flashCorrectionTarget;
        b.cameraParamsPath = cameraParamsPath;
        b.medianFilter = medianFilter;
        b.trimX = trimX.clone();
        b.trimY = trimY.clone();
        b.trimZ = trimZ.clone();
        b.doRegistration = doRegistration;
        b.registrationReferenceWave = registrationReferenceWave;
        b.registrationMode = registrationMode;
        b.registrationCalibrationPath = registrationCalibrationPath;
        b.deleteUnregistered = deleteUnregistered;
        b.mergeMips = mergeMips;
        b.moveCorrected = moveCorrected;
        b.keepCorrected = keepCorrected;
        b.compressRaw = compressRaw;
        b.writeLog = writeLog;
        return b;
    }

    /**
     * Returns a copy with concrete timepoint and channel ranges and a concrete deskew angle.
     *
     * <p>Unset ranges become every index of the dataset ({@code 0..nt-1}, {@code 0..nc-1}).
     * Explicit ranges keep their order and drop indices the dataset does not have. An unset
     * deskew override takes the record's computed deskew.
     *
     * @throws InvalidParametersException if deconvolution is requested and a selected channel
     *                                    has no OTF file
     */
    public ProcessingOptions resolve(AcquisitionParameters params) throws InvalidParametersException {
        List<Integer> tRange = filterRange(timepoints, params.getNt());
        List<Integer> cRange = filterRange(channels, params.getNc());

        if (iterations > 0) {
            for (Integer c : cRange) {
                if (!otfFiles.containsKey(c)) {
                    throw new InvalidParametersException("No OTF file available for channel " + c);
                }
            }
        }

        return toBuilder()
                .timepoints(tRange)
                .channels(cRange)
                .deskewOverride(deskewOverride != null ? deskewOverride : params.getDeskew())
                .build();
    }

    private static List<Integer> filterRange(List<Integer> requested, int size) {
        if (requested == null) {
            return IntStream.range(0, size).boxed().collect(Collectors.toList());
        }
        List<Integer> out = new ArrayList<>();
        for (Integer i : requested) {
            if (i != null && i >= 0 && i < size && !out.contains(i)) {
                out.add(i);
            }
        }
        return out;
    }

    // ================== DERIVED ==================

    /**
     * @return deskew angle to apply; 0 until resolved unless explicitly overridden
     */
    public double getDeskew() {
        return deskewOverride != null ? deskewOverride : 0;
    }

    /**
     * GPU work is needed when deconvolving, or when deskewed raw data has to be saved.
     */
    public boolean needsGpuStage() {
        return iterations > 0 || (getDeskew() != 0 && saveDeskewedRaw);
    }

    public boolean needsTrimOrMedian() {
        return medianFilter || isTrimmed(trimX) || isTrimmed(trimY) || isTrimmed(trimZ);
    }

    private static boolean isTrimmed(int[] trim) {
        return trim[0] != 0 || trim[1] != 0;
    }

    /**
     * @return number of stacks the GPU stage produces, |timepoints| x |channels|; 0 if unresolved
     */
    public int expectedStacks() {
        if (timepoints == null || channels == null) {
            return 0;
        }
        return timepoints.size() * channels.size();
    }

    /**
     * @return background for a channel, falling back to the default background
     */
    public int backgroundFor(int channel) {
        return backgrounds.getOrDefault(channel, defaultBackground);
    }

    public Path otfFor(int channel) {
        return otfFiles.get(channel);
    }

    // ================== GETTERS ==================

    public List<Integer> getTimepoints() {
        return timepoints;
    }

    public List<Integer> getChannels() {
        return channels;
    }

    public Map<Integer, Path> getOtfFiles() {
        return otfFiles;
    }

    public Map<Integer, Integer> getBackgrounds() {
        return backgrounds;
    }

    public int getDefaultBackground() {
        return defaultBackground;
    }

    public int getIterations() {
        return iterations;
    }

    public Double getDeskewOverride() {
        return deskewOverride;
    }

    public boolean isSaveDeskewedRaw() {
        return saveDeskewedRaw;
    }

    public boolean isCorrectFlash() {
        return correctFlash;
    }

    public String getFlashCorrectionTarget() {
        return flashCorrectionTarget;
    }

    public Path getCameraParamsPath() {
        return cameraParamsPath;
    }

    public boolean isMedianFilter() {
        return medianFilter;
    }

    public int[] getTrimX() {
        return trimX.clone();
    }

    public int[] getTrimY() {
        return trimY.clone();
    }

    public int[] getTrimZ() {
        return trimZ.clone();
    }

    public boolean isDoRegistration() {
        return doRegistration;
    }

    public Integer getRegistrationReferenceWave() {
        return registrationReferenceWave;
    }

    public String getRegistrationMode() {
        return registrationMode;
    }

    public Path getRegistrationCalibrationPath() {
        return registrationCalibrationPath;
    }

    public boolean isDeleteUnregistered() {
        return deleteUnregistered;
    }

    public boolean isMergeMips() {
        return mergeMips;
    }

    public boolean isMoveCorrected() {
        return moveCorrected;
    }

    public boolean isKeepCorrected() {
        return keepCorrected;
    }

    public boolean isCompressRaw() {
        return compressRaw;
    }

    public boolean isWriteLog() {
        return writeLog;
    }

    /**
     * @return every option by name, in declaration order, for the processing log
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("timepoints", timepoints);
        map.put("channels", channels);
        map.put("otfFiles", otfFiles);
        map.put("backgrounds", backgrounds);
        map.put("defaultBackground", defaultBackground);
        map.put("iterations", iterations);
        map.put("deskew", deskewOverride);
        map.put("saveDeskewedRaw", saveDeskewedRaw);
        map.put("correctFlash", correctFlash);
        map.put("flashCorrectionTarget", flashCorrectionTarget);
        map.put("cameraParamsPath", cameraParamsPath);
        map.put("medianFilter", medianFilter);
        map.put("trimX", trimX.clone());
        map.put("trimY", trimY.clone());
        map.put("trimZ", trimZ.clone());
        map.put("doRegistration", doRegistration);
        map.put("registrationReferenceWave", registrationReferenceWave);
        map.put("registrationMode", registrationMode);
        map.put("registrationCalibrationPath", registrationCalibrationPath);
        map.put("deleteUnregistered", deleteUnregistered);
        map.put("mergeMips", mergeMips);
        map.put("moveCorrected", moveCorrected);
        map.put("keepCorrected", keepCorrected);
        map.put("compressRaw", compressRaw);
        map.put("writeLog", writeLog);
        return map;
    }

    @Override
    public String toString() {
        return "ProcessingOptions{timepoints=" + timepoints
                + ", channels=" + channels
                + ", iterations=" + iterations
                + ", deskew=" + deskewOverride
                + ", correctFlash=" + correctFlash
                + ", doRegistration=" + doRegistration + "}";
    }

    /**
     * Builder for {@link ProcessingOptions}. Every setter returns the builder.
     */
    public static final class Builder {
        private List<Integer> timepoints;
        private List<Integer> channels;
        private final Map<Integer, Path> otfFiles = new LinkedHashMap<>();
        private final Map<Integer, Integer> backgrounds = new LinkedHashMap<>();
        private int defaultBackground = DEFAULT_BACKGROUND;
        private int iterations = 10;
        private Double deskewOverride;
        private boolean saveDeskewedRaw = false;
        private boolean correctFlash = false;
        private String flashCorrectionTarget = "cpu";
        private Path cameraParamsPath;
        private boolean medianFilter = false;
        private int[] trimX = {0, 0};
        private int[] trimY = {0, 0};
        private int[] trimZ = {0, 0};
        private boolean doRegistration = false;
        private Integer registrationReferenceWave;
        private String registrationMode = "2step";
        private Path registrationCalibrationPath;
        private boolean deleteUnregistered = false;
        private boolean mergeMips = true;
        private boolean moveCorrected = true;
        private boolean keepCorrected = false;
        private boolean compressRaw = false;
        private boolean writeLog = true;

        private Builder() {}

        /** Timepoints to process; null means all. */
        public Builder timepoints(List<Integer> timepoints) {
            this.timepoints = timepoints == null ? null : new ArrayList<>(timepoints);
            return this;
        }

        /** Channels to process; null means all. */
        public Builder channels(List<Integer> channels) {
            this.channels = channels == null ? null : new ArrayList<>(channels);
            return this;
        }

        public Builder otfFile(int channel, Path otf) {
            this.otfFiles.put(channel, otf);
            return this;
        }

        public Builder background(int channel, int background) {
            this.backgrounds.put(channel, background);
            return this;
        }

        public Builder defaultBackground(int defaultBackground) {
            this.defaultBackground = defaultBackground;
            return this;
        }

        public Builder iterations(int iterations) {
            if (iterations < 0) {
                throw new IllegalArgumentException("iterations must be >= 0, got " + iterations);
            }
            this.iterations = iterations;
            return this;
        }

        public Builder deskewOverride(Double deskew) {
            this.deskewOverride = deskew;
            return this;
        }

        public Builder saveDeskewedRaw(boolean saveDeskewedRaw) {
            this.saveDeskewedRaw = saveDeskewedRaw;
            return this;
        }

        public Builder correctFlash(boolean correctFlash) {
            this.correctFlash = correctFlash;
            return this;
        }

        public Builder flashCorrectionTarget(String target) {
            this.flashCorrectionTarget = target;
            return this;
        }

        public Builder cameraParamsPath(Path cameraParamsPath) {
            this.cameraParamsPath = cameraParamsPath;
            return this;
        }

        public Builder medianFilter(boolean medianFilter) {
            this.medianFilter = medianFilter;
            return this;
        }

        public Builder trimX(int low, int high) {
            this.trimX = new int[]{low, high};
            return this;
        }

        public Builder trimY(int low, int high) {
            this.trimY = new int[]{low, high};
            return this;
        }

        public Builder trimZ(int low, int high) {
            this.trimZ = new int[]{low, high};
            return this;
        }

        public Builder doRegistration(boolean doRegistration) {
            this.doRegistration = doRegistration;
            return this;
        }

        public Builder registrationReferenceWave(Integer wave) {
            this.registrationReferenceWave = wave;
            return this;
        }

        public Builder registrationMode(String mode) {
            this.registrationMode = mode;
            return this;
        }

        public Builder registrationCalibrationPath(Path path) {
            this.registrationCalibrationPath = path;
            return this;
        }

        public Builder deleteUnregistered(boolean deleteUnregistered) {
            this.deleteUnregistered = deleteUnregistered;
            return this;
        }

        public Builder mergeMips(boolean mergeMips) {
            this.mergeMips = mergeMips;
            return this;
        }

        public Builder moveCorrected(boolean moveCorrected) {
            this.moveCorrected = moveCorrected;
            return this;
        }

        public Builder keepCorrected(boolean keepCorrected) {
            this.keepCorrected = keepCorrected;
            return this;
        }

        public Builder compressRaw(boolean compressRaw) {
            this.compressRaw = compressRaw;
            return this;
        }

        public Builder writeLog(boolean writeLog) {
            this.writeLog = writeLog;
            return this;
        }

        public ProcessingOptions build() {
            return new ProcessingOptions(this);
        }
    }
}
