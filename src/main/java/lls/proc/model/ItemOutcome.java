package lls.proc.model;

import java.nio.file.Path;

/**
 * Terminal outcome of one dataset. Exactly one is reported per item.
 */
public record ItemOutcome(Path dataset, Kind kind, String reason, Throwable error) {

    public enum Kind {
        FINISHED,
        SKIPPED,
        ABORTED,
        ERROR
    }

    public static ItemOutcome finished(Path dataset) {
        return new ItemOutcome(dataset, Kind.FINISHED, null, null);
    }

    public static ItemOutcome skipped(Path dataset, String reason) {
        return new ItemOutcome(dataset, Kind.SKIPPED, reason, null);
    }

    public static ItemOutcome aborted(Path dataset) {
        return new ItemOutcome(dataset, Kind.ABORTED, "aborted", null);
    }

    public static ItemOutcome error(Path dataset, Throwable error) {
        return new ItemOutcome(dataset, Kind.ERROR, error.getMessage(), error);
    }
}
