package lls.proc.controller;

import lls.proc.model.ItemOutcome;

/**
 * Notifications raised while an item is processed. Calls may arrive from the coordinating
 * thread or from GPU worker threads; implementations that drive a UI must hand off themselves.
 */
public interface PipelineListener {

    default void statusUpdate(String status) {}

    default void progressMaximum(int maximum) {}

    default void progressValue(int value) {}

    /** Estimated time remaining, HH:mm:ss. */
    default void clockUpdate(String eta) {}

    default void skipped(String reason) {}

    default void error(Throwable error) {}

    /**
     * Raised exactly once per item, after any {@link #skipped} or {@link #error} call.
     */
    void itemFinished(ItemOutcome outcome);
}
