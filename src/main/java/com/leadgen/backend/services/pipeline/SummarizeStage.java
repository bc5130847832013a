package com.leadgen.backend.services.pipeline;

import com.leadgen.backend.enums.Capability;
import com.leadgen.backend.enums.FailureReason;
import com.leadgen.backend.enums.ProcessingStage;
import com.leadgen.backend.integrations.CapabilityException;
import com.leadgen.backend.integrations.ContactProfile;
import com.leadgen.backend.integrations.OutreachMessage;
import com.leadgen.backend.integrations.Summarizer;
import com.leadgen.backend.integrations.Summary;
import com.leadgen.backend.models.ResearchPayload;
import com.leadgen.backend.models.WorkItem;
import com.leadgen.backend.services.budget.AcquireResult;
import com.leadgen.backend.services.budget.CostCatalog;
import com.leadgen.backend.services.budget.Grant;
import com.leadgen.backend.services.budget.ProviderThrottledException;
import com.leadgen.backend.services.budget.RateBudgetScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Two AI calls per item: summarize the researched content, then compose the outreach message.
 * A summary kept from an earlier, interrupted run is reused.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SummarizeStage implements ItemStage {

    private final Summarizer summarizer;
    private final RateBudgetScheduler scheduler;
    private final CostCatalog costCatalog;

    @Override
    public ProcessingStage target() {
        return ProcessingStage.SUMMARIZED;
    }

    @Override
    public StageResult run(WorkItem item, StageContext context) {
        if (isDone(item)) {
            return StageResult.skipped(item);
        }

        try {
            if (item.getSummary() == null || item.getSummary().isBlank()) {
                AcquireResult<Grant> acquired = acquire(context);
                if (!acquired.isGranted()) {
                    return StageResult.halted(item, acquired.getDenial());
                }
                Summary summary = summarize(acquired.get(), contentFor(item));
                if (!summary.isUsable()) {
                    return fail(item, FailureReason.SUMMARIZATION_FAILED, "Summarizer returned no usable summary");
                }
                item.setSummary(summary.text().trim());
            }

            AcquireResult<Grant> acquired = acquire(context);
            if (!acquired.isGranted()) {
                return StageResult.halted(item, acquired.getDenial());
            }
            OutreachMessage message = compose(acquired.get(), profileOf(item), List.of(item.getSummary()));
            if (!message.isUsable()) {
                return fail(item, FailureReason.SUMMARIZATION_FAILED, "Summarizer returned no usable outreach message");
            }

            item.setOutreachSubject(message.subject());
            item.setOutreachMessage(message.body().trim());
            item.advanceTo(ProcessingStage.SUMMARIZED);
            return StageResult.advanced(item);

        } catch (ProviderThrottledException e) {
            return fail(item, FailureReason.PROVIDER_THROTTLED, e.getMessage());
        } catch (CapabilityException e) {
            return fail(item, FailureReason.CAPABILITY_ERROR, e.getMessage());
        }
    }

    private AcquireResult<Grant> acquire(StageContext context) {
        return scheduler.acquire(context.account(), context.allowance(),
                Capability.SUMMARIZER, costCatalog.estimate(Capability.SUMMARIZER));
    }

    private Summary summarize(Grant grant, String content) throws CapabilityException {
        Summary summary = null;
        try {
            summary = scheduler.call(grant, () -> summarizer.summarize(content));
            return summary;
        } finally {
            release(grant, summary != null ? summary.inputTokens() : -1, summary != null ? summary.outputTokens() : 0);
        }
    }

    private OutreachMessage compose(Grant grant, ContactProfile profile, List<String> summaries) throws CapabilityException {
        OutreachMessage message = null;
        try {
            message = scheduler.call(grant, () -> summarizer.compose(profile, summaries));
            return message;
        } finally {
            release(grant, message != null ? message.inputTokens() : -1, message != null ? message.outputTokens() : 0);
        }
    }

    // Negative input tokens mark a call that returned nothing
    private void release(Grant grant, int inputTokens, int outputTokens) {
        boolean succeeded = inputTokens >= 0;
        BigDecimal cost = succeeded ? costCatalog.summarizerCost(inputTokens, outputTokens) : BigDecimal.ZERO;
        scheduler.release(grant, cost, succeeded);
    }

    private StageResult fail(WorkItem item, FailureReason reason, String message) {
        item.markFailed(ProcessingStage.SUMMARIZED, reason, message);
        log.warn("Campaign {} item {} failed summarization ({}): {}",
                item.getCampaignId(), item.getExternalId(), reason, message);
        return StageResult.failed(item, reason, message);
    }

    /**
     * Researched page text, or a description built from the profile when research found nothing.
     */
    static String contentFor(WorkItem item) {
        ResearchPayload payload = item.getResearchPayload();
        if (payload != null && payload.hasContent()) {
            return payload.getPages().stream()
                    .filter(page -> page.getText() != null && !page.getText().isBlank())
                    .map(page -> (page.getTitle() != null ? page.getTitle() + "\n" : "") + page.getText())
                    .collect(Collectors.joining("\n\n"));
        }

        StringBuilder description = new StringBuilder();
        description.append("Business: ").append(item.getName());
        if (item.getCategory() != null) {
            description.append("\nCategory: ").append(item.getCategory());
        }
        if (item.getAddress() != null) {
            description.append("\nAddress: ").append(item.getAddress());
        }
        if (item.getRating() != null) {
            description.append("\nRating: ").append(item.getRating());
            if (item.getReviewCount() != null) {
                description.append(" (").append(item.getReviewCount()).append(" reviews)");
            }
        }
        if (item.getWebsite() != null) {
            description.append("\nWebsite: ").append(item.getWebsite());
        }
        return description.toString();
    }

    static ContactProfile profileOf(WorkItem item) {
        return ContactProfile.builder()
                .name(item.getName())
                .category(item.getCategory())
                .address(item.getAddress())
                .website(item.getWebsite())
                .rating(item.getRating())
                .reviewCount(item.getReviewCount())
                .build();
    }
}
