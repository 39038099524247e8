package lls.proc.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Processing state of one dataset.
 *
 * <pre>
 * PENDING -> DECOMPRESSING? -> PRE_PROCESSING? -> GPU_DISPATCHING -> GPU_DRAINING
 *         -> POST_PROCESSING -> DONE
 * </pre>
 * SKIPPED, ABORTED, FAILED and DONE are absorbing. ABORTING is entered from the GPU stages
 * and always ends in ABORTED.
 */
public enum ItemState {
    PENDING,
    DECOMPRESSING,
    PRE_PROCESSING,
    GPU_DISPATCHING,
    GPU_DRAINING,
    POST_PROCESSING,
    DONE,
    SKIPPED,
    ABORTING,
    ABORTED,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == SKIPPED || this == ABORTED || this == FAILED;
    }

    /**
     * @return true if moving from this state to {@code next} is a legal transition
     */
    public boolean canTransitionTo(ItemState next) {
        return allowedNext().contains(next);
    }

    private Set<ItemState> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(DECOMPRESSING, PRE_PROCESSING, GPU_DISPATCHING, POST_PROCESSING,
                        SKIPPED, ABORTED, FAILED);
            case DECOMPRESSING:
                return EnumSet.of(PRE_PROCESSING, GPU_DISPATCHING, POST_PROCESSING,
                        SKIPPED, ABORTED, FAILED);
            case PRE_PROCESSING:
                return EnumSet.of(GPU_DISPATCHING, POST_PROCESSING, SKIPPED, ABORTED, FAILED);
            case GPU_DISPATCHING:
                return EnumSet.of(GPU_DRAINING, POST_PROCESSING, SKIPPED, ABORTING, FAILED);
            case GPU_DRAINING:
                return EnumSet.of(POST_PROCESSING, ABORTING, FAILED);
            case POST_PROCESSING:
                return EnumSet.of(DONE, ABORTED, FAILED);
            case ABORTING:
                return EnumSet.of(ABORTED);
            default:
                return EnumSet.noneOf(ItemState.class);
        }
    }
}
