package com.leadgen.backend.services.pipeline;

import com.leadgen.backend.enums.ProcessingStage;
import com.leadgen.backend.models.WorkItem;

/**
 * One enrichment step applied to a single work item.
 * <p>
 * Implementations are idempotent: an item already at or past {@link #target()} is skipped.
 * They mutate the item in place (advance or fail it) and leave persistence to the caller.
 * Every grant they acquire is released before they return.
 */
public interface ItemStage {

    ProcessingStage target();

    StageResult run(WorkItem item, StageContext context);

    default boolean isDone(WorkItem item) {
        return item.getProcessingStage().isAtOrPast(target());
    }
}
