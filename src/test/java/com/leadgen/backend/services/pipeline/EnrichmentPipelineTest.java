package com.leadgen.backend.services.pipeline;

import com.leadgen.backend.enums.FailureReason;
import com.leadgen.backend.enums.ProcessingStage;
import com.leadgen.backend.models.WorkItem;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class EnrichmentPipelineTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final StageContext context = new StageContext(1L, List.of("plumber"), null, null);
    private final List<String> persisted = new ArrayList<>();

    private WorkItem item(ProcessingStage stage) {
        return WorkItem.builder().campaignId(1L).unitRank(0).externalId("joe").contactChannel("joe@example.com")
                .processingStage(stage).build();
    }

    private static ItemStage advancing(ProcessingStage target) {
        return new ItemStage() {
            @Override
            public ProcessingStage target() {
                return target;
            }

            @Override
            public StageResult run(WorkItem item, StageContext context) {
                if (isDone(item)) {
                    return StageResult.skipped(item);
                }
                item.advanceTo(target);
                return StageResult.advanced(item);
            }
        };
    }

    private static ItemStage failing(ProcessingStage target) {
        return new ItemStage() {
            @Override
            public ProcessingStage target() {
                return target;
            }

            @Override
            public StageResult run(WorkItem item, StageContext context) {
                item.markFailed(target, FailureReason.SUMMARIZATION_FAILED, "empty");
                return StageResult.failed(item, FailureReason.SUMMARIZATION_FAILED, "empty");
            }
        };
    }

    @Test
    void testRunsStagesInOrderAndPersistsAfterEach() {
        // Given
        EnrichmentPipeline pipeline = new EnrichmentPipeline(List.of(
                advancing(ProcessingStage.RESEARCHED),
                advancing(ProcessingStage.SUMMARIZED),
                advancing(ProcessingStage.VERIFIED)), meterRegistry);
        WorkItem item = item(ProcessingStage.DISCOVERED);

        // When
        StageResult result = pipeline.process(item, context, saved -> persisted.add(saved.getProcessingStage().name()));

        // Then
        assertThat(result.isAdvanced()).isTrue();
        assertThat(item.getProcessingStage()).isEqualTo(ProcessingStage.VERIFIED);
        assertThat(persisted).containsExactly("RESEARCHED", "SUMMARIZED", "VERIFIED");
        assertThat(meterRegistry.find("campaign.stage.duration").tag("stage", "SUMMARIZED").timer()).isNotNull();
    }

    @Test
    void testResumesFromTheItemsStage() {
        // Given
        EnrichmentPipeline pipeline = new EnrichmentPipeline(List.of(
                advancing(ProcessingStage.RESEARCHED),
                advancing(ProcessingStage.SUMMARIZED),
                advancing(ProcessingStage.VERIFIED)), meterRegistry);
        WorkItem item = item(ProcessingStage.SUMMARIZED);

        // When
        pipeline.process(item, context, saved -> persisted.add(saved.getProcessingStage().name()));

        // Then
        assertThat(persisted).containsExactly("VERIFIED");
    }

    @Test
    void testStopsAtFailedStage() {
        // Given
        EnrichmentPipeline pipeline = new EnrichmentPipeline(List.of(
                advancing(ProcessingStage.RESEARCHED),
                failing(ProcessingStage.SUMMARIZED),
                advancing(ProcessingStage.VERIFIED)), meterRegistry);
        WorkItem item = item(ProcessingStage.DISCOVERED);

        // When
        StageResult result = pipeline.process(item, context, saved -> persisted.add(saved.getProcessingStage().name()));

        // Then
        assertThat(result.isFailed()).isTrue();
        assertThat(item.getFailureStage()).isEqualTo(ProcessingStage.SUMMARIZED);
        assertThat(persisted).containsExactly("RESEARCHED", "FAILED");
    }

    @Test
    void testTerminalItemIsSkipped() {
        // Given
        EnrichmentPipeline pipeline = new EnrichmentPipeline(List.of(advancing(ProcessingStage.RESEARCHED)), meterRegistry);

        // When
        StageResult result = pipeline.process(item(ProcessingStage.VERIFIED), context, saved -> persisted.add("x"));

        // Then
        assertThat(result.getOutcome()).isEqualTo(StageResult.Outcome.SKIPPED);
        assertThat(persisted).isEmpty();
    }
}
