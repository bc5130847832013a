package com.leadgen.backend.services.pipeline;

import com.leadgen.backend.models.WorkItem;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Consumer;

/**
 * Runs the item stages in their fixed order: research, summarize, verify.
 */
@Component
@Slf4j
public class EnrichmentPipeline {

    private final List<ItemStage> stages;
    private final MeterRegistry meterRegistry;

    @Autowired
    public EnrichmentPipeline(ResearchStage researchStage, SummarizeStage summarizeStage,
                              VerifyStage verifyStage, MeterRegistry meterRegistry) {
        this(List.of(researchStage, summarizeStage, verifyStage), meterRegistry);
    }

    public EnrichmentPipeline(List<ItemStage> stages, MeterRegistry meterRegistry) {
        this.stages = List.copyOf(stages);
        this.meterRegistry = meterRegistry;
    }

    /**
     * Takes the item through every stage it has not completed yet. {@code persist} is called after
     * each stage that changed the item, before the next stage starts.
     *
     * @return ADVANCED when the item ended VERIFIED by this call, SKIPPED when it was already
     * terminal, otherwise the FAILED or HALTED result that stopped it
     */
    public StageResult process(WorkItem item, StageContext context, Consumer<WorkItem> persist) {
        StageResult last = StageResult.skipped(item);

        for (ItemStage stage : stages) {
            if (item.isFailed()) {
                break;
            }
            Timer.Sample sample = Timer.start(meterRegistry);
            StageResult result = stage.run(item, context);
            sample.stop(Timer.builder("campaign.stage.duration")
                    .description("Item stage duration")
                    .tag("stage", stage.target().name())
                    .tag("outcome", result.getOutcome().name())
                    .register(meterRegistry));

            if (result.getOutcome() == StageResult.Outcome.SKIPPED) {
                continue;
            }
            persist.accept(item);
            last = result;
            if (!result.isAdvanced()) {
                log.debug("Campaign {} item {} stopped at {}: {} {}", context.campaignId(), item.getExternalId(),
                        stage.target(), result.getOutcome(), result.getMessage());
                return result;
            }
        }
        return last;
    }
}
