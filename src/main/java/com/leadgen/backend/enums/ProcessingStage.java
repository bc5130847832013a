package com.leadgen.backend.enums;

/**
 * Stage a work item has reached. Pipeline stages are ordered by {@link #getOrder()};
 * {@link #FAILED} is terminal and sits outside the order.
 */
public enum ProcessingStage {
    DISCOVERED(0),
    RESEARCHED(1),
    SUMMARIZED(2),
    VERIFIED(3),
    FAILED(-1);

    private final int order;

    ProcessingStage(int order) {
        this.order = order;
    }

    public int getOrder() {
        return order;
    }

    public boolean isTerminal() {
        return this == VERIFIED || this == FAILED;
    }

    /**
     * True when this stage is {@code other} or later in the pipeline. A failed item is
     * treated as past every stage, so nothing runs on it again.
     */
    public boolean isAtOrPast(ProcessingStage other) {
        if (this == FAILED) {
            return true;
        }
        if (other == FAILED) {
            return false;
        }
        return order >= other.order;
    }

    /**
     * The stage immediately before this one, or null for the first stage.
     */
    public ProcessingStage previous() {
        return switch (this) {
            case RESEARCHED -> DISCOVERED;
            case SUMMARIZED -> RESEARCHED;
            case VERIFIED -> SUMMARIZED;
            default -> null;
        };
    }

    /**
     * The stage immediately after this one, or null for terminal stages.
     */
    public ProcessingStage next() {
        return switch (this) {
            case DISCOVERED -> RESEARCHED;
            case RESEARCHED -> SUMMARIZED;
            case SUMMARIZED -> VERIFIED;
            default -> null;
        };
    }
}
