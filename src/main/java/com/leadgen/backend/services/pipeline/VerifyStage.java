package com.leadgen.backend.services.pipeline;

import com.leadgen.backend.enums.Capability;
import com.leadgen.backend.enums.ProcessingStage;
import com.leadgen.backend.enums.VerificationStatus;
import com.leadgen.backend.integrations.CapabilityException;
import com.leadgen.backend.integrations.ConfidenceScore;
import com.leadgen.backend.integrations.Verifier;
import com.leadgen.backend.models.WorkItem;
import com.leadgen.backend.services.budget.AcquireResult;
import com.leadgen.backend.services.budget.CostCatalog;
import com.leadgen.backend.services.budget.Grant;
import com.leadgen.backend.services.budget.RateBudgetScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Checks the item's contact channel. A failed check is recorded on the item as
 * {@link VerificationStatus#ERROR} and never blocks it from reaching VERIFIED.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VerifyStage implements ItemStage {

    private final Verifier verifier;
    private final RateBudgetScheduler scheduler;
    private final CostCatalog costCatalog;

    @Override
    public ProcessingStage target() {
        return ProcessingStage.VERIFIED;
    }

    @Override
    public StageResult run(WorkItem item, StageContext context) {
        if (isDone(item)) {
            return StageResult.skipped(item);
        }

        AcquireResult<Grant> acquired = scheduler.acquire(context.account(), context.allowance(),
                Capability.VERIFIER, costCatalog.estimate(Capability.VERIFIER));
        if (!acquired.isGranted()) {
            return StageResult.halted(item, acquired.getDenial());
        }

        Grant grant = acquired.get();
        boolean succeeded = false;
        try {
            ConfidenceScore score = scheduler.call(grant, () -> verifier.verify(item.getContactChannel()));
            succeeded = true;
            item.setVerificationStatus(score.status() != null ? score.status() : VerificationStatus.UNKNOWN);
            item.setConfidenceScore(score.score());
            item.setVerificationNote(score.isSafe() ? "safe" : score.reason());
        } catch (CapabilityException e) {
            log.warn("Campaign {} item {} verification failed: {}",
                    context.campaignId(), item.getExternalId(), e.getMessage());
            item.setVerificationStatus(VerificationStatus.ERROR);
            item.setConfidenceScore(0);
            item.setVerificationNote(e.getMessage());
        } finally {
            scheduler.release(grant, succeeded ? costCatalog.estimate(Capability.VERIFIER) : BigDecimal.ZERO, succeeded);
        }

        item.advanceTo(ProcessingStage.VERIFIED);
        return StageResult.advanced(item);
    }
}
