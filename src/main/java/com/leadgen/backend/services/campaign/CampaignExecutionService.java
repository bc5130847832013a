package com.leadgen.backend.services.campaign;

import com.leadgen.backend.config.EngineProperties;
import com.leadgen.backend.config.SchedulingConfig;
import com.leadgen.backend.enums.CampaignStatus;
import com.leadgen.backend.enums.Capability;
import com.leadgen.backend.enums.FailureReason;
import com.leadgen.backend.enums.ProcessingStage;
import com.leadgen.backend.enums.TerminationReason;
import com.leadgen.backend.enums.UnitStatus;
import com.leadgen.backend.exceptions.StateStoreException;
import com.leadgen.backend.models.BudgetLedgerEntry;
import com.leadgen.backend.models.Campaign;
import com.leadgen.backend.models.CampaignCheckpoint;
import com.leadgen.backend.models.CoverageUnit;
import com.leadgen.backend.models.WorkItem;
import com.leadgen.backend.services.budget.AcquireResult;
import com.leadgen.backend.services.budget.BudgetAccount;
import com.leadgen.backend.services.budget.CostCatalog;
import com.leadgen.backend.services.budget.Denial;
import com.leadgen.backend.services.budget.ItemAllowance;
import com.leadgen.backend.services.budget.LedgerListener;
import com.leadgen.backend.services.budget.RateBudgetScheduler;
import com.leadgen.backend.services.pipeline.DiscoverStage;
import com.leadgen.backend.services.pipeline.DiscoveryResult;
import com.leadgen.backend.services.pipeline.EnrichmentPipeline;
import com.leadgen.backend.services.pipeline.StageContext;
import com.leadgen.backend.services.pipeline.StageResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Campaign state machine and drive loop.
 * <p>
 * PENDING -start-> RUNNING -pause-> PAUSED -resume-> RUNNING, ending in COMPLETED or FAILED.
 * Cancel is accepted from PENDING, RUNNING and PAUSED and ends in FAILED(CANCELLED).
 * <p>
 * Units are processed one at a time in plan order. The items of a unit run on the bounded
 * item worker pool. Pause and cancel are cooperative: they are honoured at unit boundaries
 * and before each item is admitted, and items already admitted finish their stages.
 * <p>
 * Each unit's item phase has a wall-clock limit. Items not admitted before it expires fail with
 * PHASE_TIMEOUT and the unit ends FAILED, while the campaign moves on to the next unit.
 */
@Service
@Slf4j
public class CampaignExecutionService {

    private final CampaignStateStore store;
    private final RateBudgetScheduler scheduler;
    private final DiscoverStage discoverStage;
    private final EnrichmentPipeline pipeline;
    private final CostCatalog costCatalog;
    private final EngineProperties engineProperties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Executor campaignRunner;
    private final Executor itemWorkers;

    private final Map<Long, CampaignRun> activeRuns = new ConcurrentHashMap<>();

    public CampaignExecutionService(CampaignStateStore store,
                                    RateBudgetScheduler scheduler,
                                    DiscoverStage discoverStage,
                                    EnrichmentPipeline pipeline,
                                    CostCatalog costCatalog,
                                    EngineProperties engineProperties,
                                    Clock clock,
                                    MeterRegistry meterRegistry,
                                    @Qualifier(SchedulingConfig.CAMPAIGN_RUNNER) Executor campaignRunner,
                                    @Qualifier(SchedulingConfig.ITEM_WORKERS) Executor itemWorkers) {
        this.store = store;
        this.scheduler = scheduler;
        this.discoverStage = discoverStage;
        this.pipeline = pipeline;
        this.costCatalog = costCatalog;
        this.engineProperties = engineProperties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.campaignRunner = campaignRunner;
        this.itemWorkers = itemWorkers;
    }

    // ===== State machine =====

    public void start(Long campaignId) {
        Campaign campaign = load(campaignId);
        if (!campaign.getStatus().canStart()) {
            throw new IllegalStateException("Campaign " + campaignId + " cannot start from " + campaign.getStatus());
        }
        log.info("Starting campaign {} '{}' in {} ({} units planned)",
                campaignId, campaign.getName(), campaign.getRegion(), campaign.getUnitsPlanned());
        launch(campaignId);
    }

    /**
     * Asks a running campaign to pause. The campaign turns PAUSED once in-flight items finish.
     */
    public void pause(Long campaignId) {
        Campaign campaign = load(campaignId);
        if (campaign.getStatus() != CampaignStatus.RUNNING) {
            throw new IllegalStateException("Campaign " + campaignId + " cannot pause from " + campaign.getStatus());
        }
        CampaignRun run = activeRuns.get(campaignId);
        if (run != null) {
            log.info("Pause requested for campaign {}", campaignId);
            run.requestStop(CampaignRun.StopRequest.PAUSE);
        } else {
            // Nobody is driving it here; the checkpoint is already durable
            store.updateCampaign(campaignId, Campaign::markPaused);
            log.info("Campaign {} had no active run and was paused directly", campaignId);
        }
    }

    public void resume(Long campaignId) {
        Campaign campaign = load(campaignId);
        if (!campaign.getStatus().canResume()) {
            throw new IllegalStateException("Campaign " + campaignId + " cannot resume from " + campaign.getStatus());
        }
        log.info("Resuming campaign {} from its checkpoint", campaignId);
        launch(campaignId);
    }

    public void cancel(Long campaignId) {
        Campaign campaign = load(campaignId);
        if (!campaign.getStatus().canCancel()) {
            throw new IllegalStateException("Campaign " + campaignId + " cannot cancel from " + campaign.getStatus());
        }
        CampaignRun run = activeRuns.get(campaignId);
        if (run != null) {
            log.info("Cancel requested for campaign {}", campaignId);
            run.requestStop(CampaignRun.StopRequest.CANCEL);
        } else {
            store.updateCampaign(campaignId, c -> c.markFailed(now(), TerminationReason.CANCELLED, "Cancelled"));
            log.info("Campaign {} cancelled", campaignId);
        }
    }

    /**
     * Restarts the drive loop of a RUNNING campaign that has no active run in this process,
     * e.g. after a crash. Work continues from the checkpoint.
     */
    public void recover(Long campaignId) {
        Campaign campaign = load(campaignId);
        if (campaign.getStatus() != CampaignStatus.RUNNING) {
            throw new IllegalStateException("Campaign " + campaignId + " is " + campaign.getStatus() + ", not RUNNING");
        }
        if (activeRuns.containsKey(campaignId)) {
            throw new IllegalStateException("Campaign " + campaignId + " is already running here");
        }
        log.warn("Recovering stalled campaign {} from its checkpoint", campaignId);
        launch(campaignId);
    }

    public boolean isRunningLocally(Long campaignId) {
        return activeRuns.containsKey(campaignId);
    }

    public Set<Long> activeCampaignIds() {
        return Set.copyOf(activeRuns.keySet());
    }

    // ===== Liveness =====

    /**
     * Writes a heartbeat for every campaign driven by this process.
     */
    public void writeHeartbeats() {
        OffsetDateTime now = now();
        for (Long campaignId : activeRuns.keySet()) {
            try {
                store.touchHeartbeat(campaignId, now);
            } catch (StateStoreException e) {
                log.warn("Heartbeat for campaign {} not written: {}", campaignId, e.getMessage());
            }
        }
    }

    /**
     * RUNNING campaigns whose heartbeat went stale and that no run in this process owns.
     */
    public List<Campaign> findStalledCampaigns() {
        OffsetDateTime staleBefore = now().minus(engineProperties.staleAfter());
        List<Campaign> stalled = new ArrayList<>();
        for (Campaign campaign : store.findStalledCampaigns(staleBefore)) {
            if (!activeRuns.containsKey(campaign.getId())) {
                stalled.add(campaign);
            }
        }
        return stalled;
    }

    // ===== Drive loop =====

    private void launch(Long campaignId) {
        CampaignRun run = new CampaignRun(campaignId);
        if (activeRuns.putIfAbsent(campaignId, run) != null) {
            throw new IllegalStateException("Campaign " + campaignId + " already has an active run");
        }
        try {
            store.updateCampaign(campaignId, c -> c.markRunning(now()));
            campaignRunner.execute(() -> drive(run));
        } catch (RuntimeException e) {
            activeRuns.remove(campaignId, run);
            throw e;
        }
    }

    private void drive(CampaignRun run) {
        Long campaignId = run.getCampaignId();
        try {
            Campaign campaign = load(campaignId);
            CampaignCheckpoint checkpoint = store.readCheckpoint(campaignId)
                    .orElseGet(() -> CampaignCheckpoint.initial(campaignId));

            synchronized (run.progressLock) {
                run.setCheckpoint(checkpoint);
                run.setUnitsProcessed(campaign.getUnitsProcessed());
                run.setItemsDiscovered(campaign.getItemsDiscovered());
            }
            run.setAccount(openAccount(campaign));

            StageContext context = new StageContext(campaignId, campaign.getKeywords(), run.getAccount(), null);
            List<CoverageUnit> remaining = store.findUnitsAfter(campaignId, checkpoint.getLastCompletedUnitRank());
            log.info("Campaign {} driving {} remaining units after rank {} (spent {} of {})", campaignId,
                    remaining.size(), checkpoint.getLastCompletedUnitRank(), campaign.getCostSpent(),
                    campaign.getCostCeiling());

            for (CoverageUnit unit : remaining) {
                if (run.isStopRequested()) {
                    break;
                }
                processUnit(run, unit, context);
            }

            finish(run);

        } catch (StateStoreException e) {
            log.error("Campaign {} halted by a state store failure: {}", campaignId, e.getMessage(), e);
            failRun(run, e);
        } catch (RuntimeException e) {
            log.error("Campaign {} halted by an unexpected error: {}", campaignId, e.getMessage(), e);
            failRun(run, e);
        } finally {
            activeRuns.remove(campaignId, run);
        }
    }

    private BudgetAccount openAccount(Campaign campaign) {
        Map<Capability, BigDecimal> spentByCapability = new EnumMap<>(Capability.class);
        for (BudgetLedgerEntry entry : store.readLedger(campaign.getId())) {
            spentByCapability.put(entry.getCapability(), entry.getCostAccrued());
        }
        LedgerListener listener = (campaignId, capability, cost, succeeded, committedTotal) ->
                store.recordCost(campaignId, capability, cost, succeeded, now());
        return scheduler.openAccount(campaign.getId(), campaign.getCostCeiling(), campaign.getCostSpent(),
                spentByCapability, listener);
    }

    private void processUnit(CampaignRun run, CoverageUnit unit, StageContext context) {
        Long campaignId = run.getCampaignId();
        DiscoveryResult discovery = null;

        if (!isDiscovered(run, unit)) {
            writeProgress(run, cp -> {
                cp.setCurrentUnitRank(unit.getRank());
                cp.setCurrentUnitDiscovered(false);
                cp.setItemsCompletedInUnit(0);
            });

            discovery = discoverStage.discover(unit, context);
            for (WorkItem item : discovery.items()) {
                store.upsertWorkItem(item);
            }
            unit.setActualCost(unit.getActualCost().add(discovery.cost()));
            unit.setBusinessesFound(discovery.items().size());
            if (discovery.contactsEnriched() > 0) {
                counter("campaign.contacts.enriched", "EMAIL").increment(discovery.contactsEnriched());
            }

            if (discovery.isHalted()) {
                store.upsertUnit(unit);
                budgetDenied(run, discovery.denial());
                return;
            }

            unit.setStatus(UnitStatus.DISCOVERED);
            unit.setFailureMessage(discovery.failureMessage());
            store.upsertUnit(unit);

            int discovered = countItems(campaignId);
            writeProgress(run, cp -> cp.setCurrentUnitDiscovered(true), discovered);
        }

        List<WorkItem> items = store.findWorkItems(campaignId, unit.getRank());
        List<WorkItem> pending = new ArrayList<>();
        for (WorkItem item : items) {
            if (!item.getProcessingStage().isTerminal()) {
                pending.add(item);
            }
        }
        int alreadyDone = items.size() - pending.size();
        writeProgress(run, cp -> cp.setItemsCompletedInUnit(alreadyDone));
        log.info("Campaign {} unit {} ({}): {} items, {} to process",
                campaignId, unit.getRank(), unit.getUnitKey(), items.size(), pending.size());

        StageContext unitContext = context;
        ItemPhase phase = new ItemPhase(clock.instant());
        List<CompletableFuture<Void>> futures = new ArrayList<>(pending.size());
        for (WorkItem item : pending) {
            futures.add(CompletableFuture.runAsync(() -> processItem(run, item, unitContext, phase), itemWorkers));
        }
        awaitAll(futures);

        if (run.isStopRequested()) {
            return;
        }

        int timedOut = phase.timedOut.get();
        if (timedOut > 0) {
            String message = "Item enrichment timed out after " + engineProperties.itemEnrichmentTimeout()
                    + "; " + timedOut + " items not processed";
            log.warn("Campaign {} unit {} ({}): {}", campaignId, unit.getRank(), unit.getUnitKey(), message);
            unit.setStatus(UnitStatus.FAILED);
            unit.setFailureMessage(unit.getFailureMessage() != null ? unit.getFailureMessage() + "; " + message : message);
        } else {
            unit.setStatus(discovery != null && discovery.isFailed() ? UnitStatus.FAILED : UnitStatus.COMPLETED);
        }
        store.upsertUnit(unit);
        writeProgress(run, cp -> {
            cp.setLastCompletedUnitRank(unit.getRank());
            cp.setCurrentUnitRank(null);
            cp.setCurrentUnitDiscovered(false);
            cp.setItemsCompletedInUnit(0);
            run.setUnitsProcessed(run.getUnitsProcessed() + 1);
        });
        log.info("Campaign {} unit {} ({}) {}", campaignId, unit.getRank(), unit.getUnitKey(),
                unit.getStatus() == UnitStatus.FAILED ? "finished with failures" : "completed");
    }

    private boolean isDiscovered(CampaignRun run, CoverageUnit unit) {
        synchronized (run.progressLock) {
            if (run.getCheckpoint().isDiscoveredUnit(unit.getRank())) {
                return true;
            }
        }
        return unit.getStatus() != UnitStatus.PLANNED;
    }

    private void processItem(CampaignRun run, WorkItem item, StageContext context, ItemPhase phase) {
        if (run.isStopRequested()) {
            return;
        }
        if (EngineProperties.isExpired(engineProperties.itemEnrichmentTimeout(), phase.started, clock.instant())) {
            ProcessingStage attempted = item.getProcessingStage().next();
            item.markFailed(attempted != null ? attempted : item.getProcessingStage(), FailureReason.PHASE_TIMEOUT,
                    "Item enrichment timed out after " + engineProperties.itemEnrichmentTimeout());
            persistItem(item);
            phase.timedOut.incrementAndGet();
            counter("campaign.items.failed", FailureReason.PHASE_TIMEOUT.name()).increment();
            writeProgress(run, cp -> cp.setItemsCompletedInUnit(cp.getItemsCompletedInUnit() + 1));
            return;
        }

        AcquireResult<ItemAllowance> admitted = scheduler.admit(run.getAccount(),
                costCatalog.projectedItemCost(item.getProcessingStage()));
        if (!admitted.isGranted()) {
            budgetDenied(run, admitted.getDenial());
            return;
        }

        StageResult result;
        try (ItemAllowance allowance = admitted.get()) {
            result = pipeline.process(item, context.withAllowance(allowance), this::persistItem);
        } catch (StateStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Campaign {} unit {} item {} failed unexpectedly at {}: {}", run.getCampaignId(),
                    item.getUnitRank(), item.getExternalId(), item.getProcessingStage(), e.getMessage(), e);
            ProcessingStage attempted = item.getProcessingStage().next();
            item.markFailed(attempted != null ? attempted : item.getProcessingStage(),
                    FailureReason.UNEXPECTED_ERROR, e.getMessage());
            persistItem(item);
            result = StageResult.failed(item, FailureReason.UNEXPECTED_ERROR, e.getMessage());
        }

        switch (result.getOutcome()) {
            case HALTED -> {
                budgetDenied(run, result.getDenial());
                return;
            }
            case FAILED -> counter("campaign.items.failed", result.getFailureReason().name()).increment();
            case ADVANCED -> counter("campaign.items.processed", "VERIFIED").increment();
            case SKIPPED -> {
                // already terminal when loaded
            }
        }

        writeProgress(run, cp -> cp.setItemsCompletedInUnit(cp.getItemsCompletedInUnit() + 1));
    }

    private void persistItem(WorkItem item) {
        item.setUpdatedAt(now());
        store.upsertWorkItem(item);
    }

    private void budgetDenied(CampaignRun run, Denial denial) {
        if (run.getDenial() == null) {
            counter("campaign.budget.denied", denial.capability() != null ? denial.capability().name() : "ADMISSION")
                    .increment();
            log.info("Campaign {} reached its budget: {}", run.getCampaignId(), denial.message());
        }
        run.budgetDenied(denial);
    }

    private void awaitAll(List<CompletableFuture<Void>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    // ===== Progress and completion =====

    private void writeProgress(CampaignRun run, Consumer<CampaignCheckpoint> change) {
        writeProgress(run, change, -1);
    }

    /**
     * Applies {@code change} to the checkpoint and persists it together with the campaign's
     * spend and counters. Callers commit the state the checkpoint describes first.
     */
    private void writeProgress(CampaignRun run, Consumer<CampaignCheckpoint> change, int itemsDiscovered) {
        synchronized (run.progressLock) {
            CampaignCheckpoint checkpoint = run.getCheckpoint();
            change.accept(checkpoint);
            if (itemsDiscovered >= 0) {
                run.setItemsDiscovered(itemsDiscovered);
            }
            BigDecimal committed = run.getAccount().getCommitted();
            checkpoint.setCostSpent(committed);
            checkpoint.setUpdatedAt(now());
            store.writeCheckpoint(checkpoint);

            int unitsProcessed = run.getUnitsProcessed();
            int discovered = run.getItemsDiscovered();
            store.updateCampaign(run.getCampaignId(), c -> {
                c.raiseCostSpent(committed);
                c.setUnitsProcessed(unitsProcessed);
                c.setItemsDiscovered(discovered);
            });
        }
    }

    private int countItems(Long campaignId) {
        long total = 0;
        for (Long count : store.countItemsByStage(campaignId).values()) {
            total += count;
        }
        return (int) total;
    }

    private void finish(CampaignRun run) {
        Long campaignId = run.getCampaignId();
        writeProgress(run, cp -> { });
        CampaignRun.StopRequest stop = run.getStopRequest();
        OffsetDateTime now = now();

        Campaign campaign;
        if (stop == null) {
            campaign = store.updateCampaign(campaignId, c -> c.markCompleted(now, null));
        } else {
            campaign = switch (stop) {
                case BUDGET -> store.updateCampaign(campaignId,
                        c -> c.markCompleted(now, TerminationReason.BUDGET_EXHAUSTED));
                case PAUSE -> store.updateCampaign(campaignId, Campaign::markPaused);
                case CANCEL -> store.updateCampaign(campaignId,
                        c -> c.markFailed(now, TerminationReason.CANCELLED, "Cancelled"));
            };
        }
        log.info("Campaign {} is {}{} after {} units, spent {} of {}", campaignId, campaign.getStatus(),
                campaign.getTerminationReason() != null ? " (" + campaign.getTerminationReason() + ")" : "",
                campaign.getUnitsProcessed(), campaign.getCostSpent(), campaign.getCostCeiling());
    }

    private void failRun(CampaignRun run, RuntimeException cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        try {
            store.updateCampaign(run.getCampaignId(),
                    c -> c.markFailed(now(), TerminationReason.INFRASTRUCTURE_ERROR, message));
        } catch (RuntimeException e) {
            log.error("Campaign {} could not be marked FAILED; it stays RUNNING until recovered: {}",
                    run.getCampaignId(), e.getMessage());
        }
    }

    private Campaign load(Long campaignId) {
        return store.findCampaign(campaignId)
                .orElseThrow(() -> new EntityNotFoundException("Campaign not found with id: " + campaignId));
    }

    /**
     * Deadline bookkeeping for the items of one unit.
     */
    private static final class ItemPhase {
        private final Instant started;
        private final AtomicInteger timedOut = new AtomicInteger();

        private ItemPhase(Instant started) {
            this.started = started;
        }
    }

    private Counter counter(String name, String tag) {
        return Counter.builder(name)
                .tag("kind", tag)
                .register(meterRegistry);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
