package lls.proc.service;

import lls.proc.model.AcquisitionParameters;
import lls.proc.model.ProcessingOptions;
import lls.proc.model.WorkUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builder for cudaDeconv argument lists.
 *
 * <p>Produces the flag-based argument list for one invocation. Required values are the input
 * folder, filename pattern, wavelength and the data spacing; everything else is optional and
 * omitted when unset.
 */
public class CudaDeconvCommandBuilder {
    private static final Logger logger = LoggerFactory.getLogger(CudaDeconvCommandBuilder.class);

    /** Default assembler: one argument list per work unit. */
    public static final ArgumentAssembler ASSEMBLER = CudaDeconvCommandBuilder::forUnit;

    // Required parameters
    private Path inputDir;
    private String filenamePattern;
    private Double wavelength;
    private Double drdata;
    private Double dzdata;

    // Optional parameters
    private Path otfFile;
    private Integer background;
    private Double deskew;
    private int iterations = 0;
    private boolean saveDeskewedRaw;
    private boolean[] mip;

    private CudaDeconvCommandBuilder() {}

    public static CudaDeconvCommandBuilder builder() {
        return new CudaDeconvCommandBuilder();
    }

    /**
     * Assembles the arguments for a work unit from the dataset's parameter record and the
     * resolved processing options.
     */
    public static List<String> forUnit(WorkUnit unit, AcquisitionParameters params, ProcessingOptions options) {
        CudaDeconvCommandBuilder b = builder()
                .inputDir(unit.inputDir())
                .filenamePattern(unit.filenamePattern())
                .wavelength(unit.wavelength())
                .background(unit.background())
                .drdata(params.getDx())
                .dzdata(params.getDz())
                .deskew(options.getDeskew())
                .iterations(options.getIterations())
                .saveDeskewedRaw(options.isSaveDeskewedRaw())
                .mip(false, false, true);
        if (unit.otfFile() != null) {
            b.otfFile(unit.otfFile());
        }
        return b.build();
    }

    public CudaDeconvCommandBuilder inputDir(Path inputDir) {
        this.inputDir = inputDir;
        return this;
    }

    public CudaDeconvCommandBuilder filenamePattern(String filenamePattern) {
        this.filenamePattern = filenamePattern;
        return this;
    }

    /** Wavelength in µm. */
    public CudaDeconvCommandBuilder wavelength(double wavelength) {
        this.wavelength = wavelength;
        return this;
    }

    public CudaDeconvCommandBuilder drdata(Double drdata) {
        this.drdata = drdata;
        return this;
    }

    public CudaDeconvCommandBuilder dzdata(Double dzdata) {
        this.dzdata = dzdata;
        return this;
    }

    public CudaDeconvCommandBuilder otfFile(Path otfFile) {
        this.otfFile = otfFile;
        return this;
    }

    public CudaDeconvCommandBuilder background(int background) {
        this.background = background;
        return this;
    }

    public CudaDeconvCommandBuilder deskew(double deskew) {
        this.deskew = deskew;
        return this;
    }

    public CudaDeconvCommandBuilder iterations(int iterations) {
        this.iterations = iterations;
        return this;
    }

    public CudaDeconvCommandBuilder saveDeskewedRaw(boolean saveDeskewedRaw) {
        this.saveDeskewedRaw = saveDeskewedRaw;
        return this;
    }

    /** Maximum intensity projections to write along x, y and z. */
    public CudaDeconvCommandBuilder mip(boolean x, boolean y, boolean z) {
        this.mip = new boolean[]{x, y, z};
        return this;
    }

    private void validate() {
        List<String> missing = new ArrayList<>();

        if (inputDir == null) missing.add("inputDir");
        if (filenamePattern == null || filenamePattern.isEmpty()) missing.add("filenamePattern");
        if (wavelength == null) missing.add("wavelength");
        if (drdata == null) missing.add("drdata");
        if (dzdata == null) missing.add("dzdata");

        if (!missing.isEmpty()) {
            throw new IllegalStateException("Missing required parameters: " + String.join(", ", missing));
        }
    }

    /**
     * @return the argument list, without the executable
     */
    public List<String> build() {
        validate();

        List<String> args = new ArrayList<>(Arrays.asList(
                "--input-dir", inputDir.toString(),
                "--filename-pattern", filenamePattern,
                "--wavelength", String.valueOf(wavelength),
                "--drdata", String.valueOf(drdata),
                "--dzdata", String.valueOf(dzdata)
        ));

        if (otfFile != null) {
            args.addAll(Arrays.asList("--otf-file", otfFile.toString()));
        }
        if (background != null) {
            args.addAll(Arrays.asList("--background", String.valueOf(background)));
        }
        if (deskew != null && deskew != 0) {
            args.addAll(Arrays.asList("--deskew", String.valueOf(deskew)));
        }
        args.addAll(Arrays.asList("--iterations", String.valueOf(iterations)));
        if (saveDeskewedRaw) {
            args.add("--saveDeskewedRaw");
        }
        if (mip != null) {
            args.add("--MIP");
            for (boolean axis : mip) {
                args.add(axis ? "1" : "0");
            }
        }

        logger.debug("Built cudaDeconv arguments: {}", args);
        return args;
    }
}
