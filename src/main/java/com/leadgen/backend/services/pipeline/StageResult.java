package com.leadgen.backend.services.pipeline;

import com.leadgen.backend.enums.FailureReason;
import com.leadgen.backend.models.WorkItem;
import com.leadgen.backend.services.budget.Denial;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of one item stage.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class StageResult {

    public enum Outcome {
        /** The item moved to the stage's target. */
        ADVANCED,
        /** The item was already at or past the target; nothing ran. */
        SKIPPED,
        /** The item is now FAILED and frozen. */
        FAILED,
        /** A budget denial stopped the stage; the item is unchanged. */
        HALTED
    }

    private final Outcome outcome;
    private final WorkItem item;
    private final FailureReason failureReason;
    private final String message;
    private final Denial denial;

    public static StageResult advanced(WorkItem item) {
        return new StageResult(Outcome.ADVANCED, item, null, null, null);
    }

    public static StageResult skipped(WorkItem item) {
        return new StageResult(Outcome.SKIPPED, item, null, null, null);
    }

    public static StageResult failed(WorkItem item, FailureReason reason, String message) {
        return new StageResult(Outcome.FAILED, item, reason, message, null);
    }

    public static StageResult halted(WorkItem item, Denial denial) {
        return new StageResult(Outcome.HALTED, item, null, denial.message(), denial);
    }

    public boolean isAdvanced() {
        return outcome == Outcome.ADVANCED;
    }

    public boolean isHalted() {
        return outcome == Outcome.HALTED;
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }
}
