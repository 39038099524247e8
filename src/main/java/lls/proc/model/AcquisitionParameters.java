package lls.proc.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * AcquisitionParameters
 *
 * <p>Single source of truth for the physical parameters of one lattice light-sheet acquisition.
 * The record is built once per dataset from the settings-file parse and refined afterwards with
 * the shape found on disk (timepoint and channel counts may change once the folder is scanned).
 *
 * <p>Stored fields:
 * <ul>
 *   <li>{@code dz}: the z step actually used (stage scanning or not), null when unknown</li>
 *   <li>{@code dx}: pixel size, null when unknown</li>
 *   <li>{@code angle}: sample angle read from the settings file</li>
 *   <li>{@code samplescan}: whether sample-scan mode was used, null when unset</li>
 *   <li>{@code decimated}: true when channels do not share the same number of timepoints</li>
 *   <li>{@code nc, nt, nz, ny, nx}: dataset shape</li>
 *   <li>{@code mask}: annular mask, when the settings file describes one</li>
 *   <li>{@code roi}: camera region of interest</li>
 *   <li>{@code date}, {@code wavelengths}, {@code fileCount}: acquisition date, per-channel
 *       wavelength in nm, and number of raw stacks found on disk</li>
 * </ul>
 *
 * <p>Computed fields ({@code dzFinal}, {@code deskew}, {@code voxel}) are derived on every read
 * and never stored. They are excluded from {@link #toMap()}, {@link #equals(Object)} and
 * {@link #toString()}.
 */
public class AcquisitionParameters {

    /** Names of the stored fields, in schema order. */
    public static final List<String> STORED_FIELDS = List.of(
            "dz", "dx", "angle", "samplescan", "decimated",
            "nc", "nt", "nz", "ny", "nx",
            "mask", "roi", "date", "wavelengths", "fileCount");

    /** Names of the computed, read-only fields. */
    public static final Set<String> COMPUTED_FIELDS = Set.of("dzFinal", "deskew", "voxel");

    private Double dz;
    private Double dx;
    private Double angle;
    private Boolean samplescan;
    private boolean decimated = false;
    private int nc = 1;
    private int nt = 1;
    private int nz = 1;
    private Integer ny;
    private Integer nx;
    private AnnularMask mask;
    private CameraRoi roi;
    private LocalDateTime date;
    private List<Integer> wavelengths = new ArrayList<>();
    private int fileCount = 0;

    public AcquisitionParameters() {
    }

    /**
     * Creates a record and applies every entry of {@code values} through {@link #set(String, Object)}.
     */
    public AcquisitionParameters(Map<String, ?> values) {
        update(values);
    }

    // ================== STORED FIELDS ==================

    public Double getDz() {
        return dz;
    }

    public void setDz(Double dz) {
        this.dz = dz;
    }

    public Double getDx() {
        return dx;
    }

    public void setDx(Double dx) {
        this.dx = dx;
    }

    public Double getAngle() {
        return angle;
    }

    /**
     * Sets the sample angle. A positive angle latches {@code samplescan} to true; zero or null
     * leaves {@code samplescan} as it was.
     */
    public void setAngle(Double angle) {
        this.angle = angle;
        if (angle != null && angle > 0) {
            this.samplescan = true;
        }
    }

    public Boolean getSamplescan() {
        return samplescan;
    }

    public boolean isSamplescan() {
        return Boolean.TRUE.equals(samplescan);
    }

    public void setSamplescan(Boolean samplescan) {
        this.samplescan = samplescan;
    }

    public boolean isDecimated() {
        return decimated;
    }

    public void setDecimated(boolean decimated) {
        this.decimated = decimated;
    }

    public int getNc() {
        return nc;
    }

    public void setNc(int nc) {
        this.nc = nc;
    }

    public int getNt() {
        return nt;
    }

    public void setNt(int nt) {
        this.nt = nt;
    }

    public int getNz() {
        return nz;
    }

    public void setNz(int nz) {
        this.nz = nz;
    }

    public Integer getNy() {
        return ny;
    }

    public void setNy(Integer ny) {
        this.ny = ny;
    }

    public Integer getNx() {
        return nx;
    }

    public void setNx(Integer nx) {
        this.nx = nx;
    }

    public AnnularMask getMask() {
        return mask;
    }

    public void setMask(AnnularMask mask) {
        this.mask = mask;
    }

    public CameraRoi getRoi() {
        return roi;
    }

    public void setRoi(CameraRoi roi) {
        this.roi = roi;
    }

    public LocalDateTime getDate() {
        return date;
    }

    public void setDate(LocalDateTime date) {
        this.date = date;
    }

    public List<Integer> getWavelengths() {
        return Collections.unmodifiableList(wavelengths);
    }

    public void setWavelengths(List<Integer> wavelengths) {
        this.wavelengths = wavelengths == null ? new ArrayList<>() : new ArrayList<>(wavelengths);
    }

    /**
     * @param channel channel index
     * @return wavelength of the channel in nm, or null when the settings did not list it
     */
    public Integer getWavelength(int channel) {
        return channel >= 0 && channel < wavelengths.size() ? wavelengths.get(channel) : null;
    }

    public int getFileCount() {
        return fileCount;
    }

    public void setFileCount(int fileCount) {
        this.fileCount = fileCount;
    }

    // ================== COMPUTED FIELDS ==================

    /**
     * Effective z step after deskewing, rounded to 4 decimals.
     *
     * @return {@code dz * sin(angle)} in sample-scan mode, {@code dz} otherwise, null if dz is unknown
     */
    public Double getDzFinal() {
        if (dz == null) {
            return null;
        }
        double v = dz;
        if (isSamplescan() && angle != null && angle != 0) {
            v *= Math.sin(angle * Math.PI / 180);
        }
        return round4(v);
    }

    /**
     * @return the deskew angle required: the sample angle in sample-scan mode, otherwise 0
     */
    public double getDeskew() {
        if (isSamplescan()) {
            return angle != null ? angle : 0;
        }
        return 0;
    }

    /**
     * @return voxel size as (dzFinal, dx, dx)
     */
    public List<Double> getVoxel() {
        return Collections.unmodifiableList(Arrays.asList(getDzFinal(), dx, dx));
    }

    /**
     * Returns true if the dataset has data and enough parameters to process.
     */
    public boolean isReady() {
        return fileCount > 0 && dz != null && dx != null;
    }

    // ================== GENERIC ACCESS ==================

    /**
     * Reads a stored or computed field by name.
     *
     * @throws UnknownParameterException if the name is not part of the schema
     */
    public Object get(String name) {
        switch (name) {
            case "dz": return dz;
            case "dx": return dx;
            case "angle": return angle;
            case "samplescan": return samplescan;
            case "decimated": return decimated;
            case "nc": return nc;
            case "nt": return nt;
            case "nz": return nz;
            case "ny": return ny;
            case "nx": return nx;
            case "mask": return mask;
            case "roi": return roi;
            case "date": return date;
            case "wavelengths": return getWavelengths();
            case "fileCount": return fileCount;
            case "dzFinal": return getDzFinal();
            case "deskew": return getDeskew();
            case "voxel": return getVoxel();
            default: throw new UnknownParameterException(name);
        }
    }

    /**
     * Writes a stored field by name, converting numeric values to the field's type.
     *
     * @throws UnknownParameterException if the name is not part of the schema
     * @throws ReadOnlyParameterException if the name is a computed field
     */
    public void set(String name, Object value) {
        if (COMPUTED_FIELDS.contains(name)) {
            throw new ReadOnlyParameterException(name);
        }
        switch (name) {
            case "dz" -> setDz(toDouble(name, value));
            case "dx" -> setDx(toDouble(name, value));
            case "angle" -> setAngle(toDouble(name, value));
            case "samplescan" -> setSamplescan(value == null ? null : toBoolean(name, value));
            case "decimated" -> setDecimated(value != null && toBoolean(name, value));
            case "nc" -> setNc(toInt(name, value, 1));
            case "nt" -> setNt(toInt(name, value, 1));
            case "nz" -> setNz(toInt(name, value, 1));
            case "ny" -> setNy(toInteger(name, value));
            case "nx" -> setNx(toInteger(name, value));
            case "mask" -> setMask((AnnularMask) value);
            case "roi" -> setRoi((CameraRoi) value);
            case "date" -> setDate((LocalDateTime) value);
            case "wavelengths" -> setWavelengths(toIntegerList(name, (List<?>) value));
            case "fileCount" -> setFileCount(toInt(name, value, 0));
            default -> throw new UnknownParameterException(name);
        }
    }

    /**
     * Applies every entry of {@code values}, in iteration order.
     */
    public void update(Map<String, ?> values) {
        if (values == null) {
            return;
        }
        for (Map.Entry<String, ?> e : values.entrySet()) {
            set(e.getKey(), e.getValue());
        }
    }

    /**
     * @return stored fields in schema order; computed fields are never included
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String field : STORED_FIELDS) {
            map.put(field, get(field));
        }
        return map;
    }

    public AcquisitionParameters copy() {
        AcquisitionParameters copy = new AcquisitionParameters();
        // samplescan first so the angle latch cannot alter an explicitly stored value
        copy.angle = angle;
        copy.samplescan = samplescan;
        Map<String, Object> values = toMap();
        values.remove("angle");
        values.remove("samplescan");
        copy.update(values);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AcquisitionParameters other)) return false;
        return toMap().equals(other.toMap());
    }

    @Override
    public int hashCode() {
        return Objects.hash(toMap().values().toArray());
    }

    @Override
    public String toString() {
        return "AcquisitionParameters" + toMap();
    }

    // ================== CONVERSIONS ==================

    // rounds the exact binary value, so 0.12345 gives 0.1235
    private static double round4(double v) {
        return new BigDecimal(v).setScale(4, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static Double toDouble(String name, Object value) {
        if (value == null) return null;
        if (value instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected a number for '" + name + "' but got " + value, e);
        }
    }

    private static Integer toInteger(String name, Object value) {
        Double d = toDouble(name, value);
        return d == null ? null : d.intValue();
    }

    private static int toInt(String name, Object value, int fallback) {
        Integer i = toInteger(name, value);
        return i == null ? fallback : i;
    }

    private static boolean toBoolean(String name, Object value) {
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0;
        String s = value.toString().trim();
        if ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s)) {
            return Boolean.parseBoolean(s);
        }
        throw new IllegalArgumentException("Expected a boolean for '" + name + "' but got " + value);
    }

    private static List<Integer> toIntegerList(String name, List<?> values) {
        List<Integer> out = new ArrayList<>();
        if (values == null) return out;
        for (Object v : values) {
            out.add(toInteger(name, v));
        }
        return out;
    }
}
