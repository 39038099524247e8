package lls.proc.model;

import java.nio.file.Path;
import java.util.List;

/**
 * One invocation's worth of GPU work: a single channel and a contiguous run of timepoints.
 *
 * <p>A unit belongs to the pool queue until it is dispatched, then to exactly one worker.
 *
 * @param channel          channel index
 * @param timepoints       timepoints covered by this unit, in order
 * @param inputDir         folder holding the raw stacks
 * @param otfFile          OTF for the channel, null when not deconvolving
 * @param background       camera background to subtract (0 once flash correction has run)
 * @param wavelength       emission wavelength in µm
 * @param filenamePattern  filter selecting the unit's files inside {@code inputDir}
 * @param arguments        literal argument list for the GPU binary
 */
public record WorkUnit(
        int channel,
        List<Integer> timepoints,
        Path inputDir,
        Path otfFile,
        int background,
        double wavelength,
        String filenamePattern,
        List<String> arguments
) {

    public WorkUnit {
        timepoints = List.copyOf(timepoints);
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    /**
     * @return true when the filename filter carries no timepoint restriction
     */
    public boolean coversFullRange() {
        return !filenamePattern.contains("_stack");
    }

    public WorkUnit withArguments(List<String> newArguments) {
        return new WorkUnit(channel, timepoints, inputDir, otfFile, background, wavelength,
                filenamePattern, newArguments);
    }

    public int size() {
        return timepoints.size();
    }
}
