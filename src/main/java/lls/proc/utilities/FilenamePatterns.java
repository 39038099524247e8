package lls.proc.utilities;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the filename filters that select a channel's raw stacks inside a dataset folder.
 *
 * <p>Raw stacks are named {@code <base>_ch<c>_stack<nnnn>_...}. A filter for a whole channel is
 * {@code _ch<c>_}; a filter for a subset of timepoints appends {@code stack} and an alternation
 * of zero-padded 4-digit stack numbers, e.g. {@code _ch0_stack(0003|0004|0005)}.
 */
public final class FilenamePatterns {

    private FilenamePatterns() {}

    public static String channelFilter(int channel) {
        return "_ch" + channel + "_";
    }

    public static String channelStackFilter(int channel, List<Integer> timepoints) {
        return "_ch" + channel + "_stack" + timepointRegex(timepoints);
    }

    /**
     * @return regex alternation of zero-padded stack numbers, e.g. {@code (0000|0001)}
     */
    public static String timepointRegex(List<Integer> timepoints) {
        if (timepoints.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a filter for an empty timepoint range");
        }
        return timepoints.stream()
                .map(t -> String.format("%04d", t))
                .collect(Collectors.joining("|", "(", ")"));
    }
}
