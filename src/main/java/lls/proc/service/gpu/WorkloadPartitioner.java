package lls.proc.service.gpu;

import lls.proc.exceptions.InvalidParametersException;
import lls.proc.model.AcquisitionParameters;
import lls.proc.model.ProcessingOptions;
import lls.proc.model.WorkUnit;
import lls.proc.service.ArgumentAssembler;
import lls.proc.utilities.FilenamePatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits the (channel x timepoint) space of a dataset into GPU work units.
 *
 * <p>Units are emitted channel-major, in the order of the channel range. When there are at least
 * as many timepoints as GPU slots, each channel's timepoints are divided into one balanced,
 * contiguous chunk per slot (earlier chunks take the remainder). Otherwise each channel is a
 * single unit. The output is deterministic for identical inputs.
 */
public class WorkloadPartitioner {
    private static final Logger logger = LoggerFactory.getLogger(WorkloadPartitioner.class);

    private final ArgumentAssembler assembler;

    public WorkloadPartitioner(ArgumentAssembler assembler) {
        this.assembler = assembler;
    }

    /**
     * @param params    parameter record of the dataset
     * @param options   options already resolved against {@code params}
     * @param inputDir  folder holding the stacks to process
     * @param slotCount number of GPU slots, at least 1
     * @return units in dispatch order; empty when the channel or timepoint range is empty
     * @throws InvalidParametersException if a selected channel has no wavelength
     */
    public List<WorkUnit> partition(AcquisitionParameters params, ProcessingOptions options,
                                    Path inputDir, int slotCount) throws InvalidParametersException {
        if (slotCount < 1) {
            throw new IllegalArgumentException("Slot count must be at least 1, got " + slotCount);
        }
        List<Integer> tRange = options.getTimepoints();
        List<Integer> cRange = options.getChannels();
        if (tRange == null || cRange == null) {
            throw new IllegalArgumentException("Processing options must be resolved before partitioning");
        }

        List<WorkUnit> units = new ArrayList<>();
        if (tRange.isEmpty() || cRange.isEmpty()) {
            logger.info("Nothing to partition: {} timepoints, {} channels", tRange.size(), cRange.size());
            return units;
        }

        for (int c : cRange) {
            Integer waveNm = params.getWavelength(c);
            if (waveNm == null) {
                throw new InvalidParametersException("No wavelength known for channel " + c);
            }
            double wavelength = waveNm / 1000.0;
            int background = options.isCorrectFlash() ? 0 : options.backgroundFor(c);
            Path otf = options.otfFor(c);

            if (slotCount <= tRange.size()) {
                for (List<Integer> chunk : split(tRange, slotCount)) {
                    if (chunk.isEmpty()) continue;
                    String filter = chunk.size() == params.getNt()
                            ? FilenamePatterns.channelFilter(c)
                            : FilenamePatterns.channelStackFilter(c, chunk);
                    units.add(unit(c, chunk, inputDir, otf, background, wavelength, filter, params, options));
                }
            } else {
                units.add(unit(c, tRange, inputDir, otf, background, wavelength,
                        FilenamePatterns.channelFilter(c), params, options));
            }
        }

        logger.info("Partitioned {} channels x {} timepoints into {} units for {} GPU slots",
                cRange.size(), tRange.size(), units.size(), slotCount);
        return units;
    }

    private WorkUnit unit(int channel, List<Integer> timepoints, Path inputDir, Path otf, int background,
                          double wavelength, String filter, AcquisitionParameters params,
                          ProcessingOptions options) {
        WorkUnit unit = new WorkUnit(channel, timepoints, inputDir, otf, background, wavelength, filter, null);
        return unit.withArguments(assembler.assemble(unit, params, options));
    }

    /**
     * Splits {@code items} into {@code n} contiguous chunks whose sizes differ by at most one,
     * larger chunks first.
     */
    static <T> List<List<T>> split(List<T> items, int n) {
        int k = items.size() / n;
        int m = items.size() % n;
        List<List<T>> chunks = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            int from = i * k + Math.min(i, m);
            int to = (i + 1) * k + Math.min(i + 1, m);
            chunks.add(new ArrayList<>(items.subList(from, to)));
        }
        return chunks;
    }
}
