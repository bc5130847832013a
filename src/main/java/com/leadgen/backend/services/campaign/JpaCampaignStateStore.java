package com.leadgen.backend.services.campaign;

import com.leadgen.backend.enums.CampaignStatus;
import com.leadgen.backend.enums.Capability;
import com.leadgen.backend.enums.ProcessingStage;
import com.leadgen.backend.enums.UnitStatus;
import com.leadgen.backend.exceptions.StateStoreException;
import com.leadgen.backend.models.BudgetLedgerEntry;
import com.leadgen.backend.models.Campaign;
import com.leadgen.backend.models.CampaignCheckpoint;
import com.leadgen.backend.models.CoverageUnit;
import com.leadgen.backend.models.WorkItem;
import com.leadgen.backend.repositories.BudgetLedgerRepository;
import com.leadgen.backend.repositories.CampaignCheckpointRepository;
import com.leadgen.backend.repositories.CampaignRepository;
import com.leadgen.backend.repositories.CoverageUnitRepository;
import com.leadgen.backend.repositories.WorkItemRepository;
import com.leadgen.backend.services.coverage.CoveragePlan;
import com.leadgen.backend.services.coverage.PlannedUnit;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityNotFoundException;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * {@link CampaignStateStore} over Spring Data JPA. Each call runs in its own transaction
 * (or joins the caller's) and storage failures surface as {@link StateStoreException}.
 */
@Component
@Slf4j
public class JpaCampaignStateStore implements CampaignStateStore {

    private final CampaignRepository campaignRepository;
    private final CoverageUnitRepository coverageUnitRepository;
    private final WorkItemRepository workItemRepository;
    private final CampaignCheckpointRepository checkpointRepository;
    private final BudgetLedgerRepository ledgerRepository;
    private final TransactionTemplate transactionTemplate;

    @PersistenceContext
    private EntityManager entityManager;

    public JpaCampaignStateStore(CampaignRepository campaignRepository,
                                 CoverageUnitRepository coverageUnitRepository,
                                 WorkItemRepository workItemRepository,
                                 CampaignCheckpointRepository checkpointRepository,
                                 BudgetLedgerRepository ledgerRepository,
                                 PlatformTransactionManager transactionManager) {
        this.campaignRepository = campaignRepository;
        this.coverageUnitRepository = coverageUnitRepository;
        this.workItemRepository = workItemRepository;
        this.checkpointRepository = checkpointRepository;
        this.ledgerRepository = ledgerRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public Campaign upsertCampaign(Campaign campaign) {
        return inTransaction("save campaign " + campaign.getId(), () -> campaignRepository.save(campaign));
    }

    @Override
    public Optional<Campaign> findCampaign(Long campaignId) {
        return inTransaction("read campaign " + campaignId, () -> campaignRepository.findById(campaignId));
    }

    @Override
    public Campaign updateCampaign(Long campaignId, Consumer<Campaign> mutation) {
        return inTransaction("update campaign " + campaignId, () -> {
            Campaign campaign = campaignRepository.findById(campaignId)
                    .orElseThrow(() -> new EntityNotFoundException("Campaign not found with id: " + campaignId));
            mutation.accept(campaign);
            return campaignRepository.save(campaign);
        });
    }

    @Override
    public List<CoverageUnit> savePlan(Long campaignId, CoveragePlan plan) {
        return inTransaction("save plan for campaign " + campaignId, () -> {
            List<CoverageUnit> stored = new ArrayList<>(plan.size());
            for (PlannedUnit planned : plan) {
                CoverageUnit unit = coverageUnitRepository.findByCampaignIdAndRank(campaignId, planned.rank())
                        .orElseGet(() -> coverageUnitRepository.save(CoverageUnit.builder()
                                .campaignId(campaignId)
                                .rank(planned.rank())
                                .unitKey(planned.unitKey())
                                .label(planned.label())
                                .densityClass(planned.densityClass())
                                .expectedBusinesses(planned.expectedBusinesses())
                                .weight(planned.weight())
                                .status(UnitStatus.PLANNED)
                                .build()));
                stored.add(unit);
            }
            return stored;
        });
    }

    @Override
    public List<CoverageUnit> findUnits(Long campaignId) {
        return inTransaction("read units of campaign " + campaignId,
                () -> coverageUnitRepository.findByCampaignIdOrderByRankAsc(campaignId));
    }

    @Override
    public List<CoverageUnit> findUnitsAfter(Long campaignId, int rank) {
        return inTransaction("read units of campaign " + campaignId,
                () -> coverageUnitRepository.findByCampaignIdAndRankGreaterThanOrderByRankAsc(campaignId, rank));
    }

    @Override
    public CoverageUnit upsertUnit(CoverageUnit unit) {
        return inTransaction("save unit " + unit.getRank() + " of campaign " + unit.getCampaignId(),
                () -> coverageUnitRepository.save(unit));
    }

    @Override
    public WorkItem upsertWorkItem(WorkItem item) {
        return inTransaction("save item " + item.getExternalId() + " of campaign " + item.getCampaignId(), () -> {
            Optional<WorkItem> existing = workItemRepository.findByCampaignIdAndExternalId(
                    item.getCampaignId(), item.getExternalId());
            if (existing.isEmpty()) {
                item.setId(null);
                return workItemRepository.save(item);
            }

            WorkItem stored = existing.get();
            if (stored.isFailed()) {
                return stored;
            }
            if (!item.isFailed() && stored.getProcessingStage().getOrder() > item.getProcessingStage().getOrder()) {
                log.debug("Ignoring stale write of item {} at {} (stored at {})",
                        item.getExternalId(), item.getProcessingStage(), stored.getProcessingStage());
                return stored;
            }
            copyProgress(item, stored);
            return workItemRepository.save(stored);
        });
    }

    @Override
    public List<WorkItem> findWorkItems(Long campaignId, int unitRank) {
        return inTransaction("read items of campaign " + campaignId,
                () -> workItemRepository.findByCampaignIdAndUnitRankOrderByIdAsc(campaignId, unitRank));
    }

    @Override
    public List<WorkItem> listWorkItems(Long campaignId, int limit, int offset) {
        return inTransaction("list items of campaign " + campaignId, () -> entityManager
                .createQuery("SELECT w FROM WorkItem w WHERE w.campaignId = :campaignId ORDER BY w.id", WorkItem.class)
                .setParameter("campaignId", campaignId)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList());
    }

    @Override
    public Map<ProcessingStage, Long> countItemsByStage(Long campaignId) {
        return inTransaction("count items of campaign " + campaignId, () -> {
            Map<ProcessingStage, Long> counts = new EnumMap<>(ProcessingStage.class);
            for (ProcessingStage stage : ProcessingStage.values()) {
                counts.put(stage, 0L);
            }
            for (Object[] row : workItemRepository.countByStage(campaignId)) {
                counts.put((ProcessingStage) row[0], ((Number) row[1]).longValue());
            }
            return counts;
        });
    }

    @Override
    public void writeCheckpoint(CampaignCheckpoint checkpoint) {
        inTransaction("write checkpoint of campaign " + checkpoint.getCampaignId(),
                () -> checkpointRepository.save(checkpoint));
    }

    @Override
    public Optional<CampaignCheckpoint> readCheckpoint(Long campaignId) {
        return inTransaction("read checkpoint of campaign " + campaignId,
                () -> checkpointRepository.findById(campaignId));
    }

    @Override
    public void recordCost(Long campaignId, Capability capability, BigDecimal cost, boolean succeeded,
                           OffsetDateTime at) {
        inTransaction("record " + capability + " cost for campaign " + campaignId, () -> {
            BudgetLedgerEntry entry = ledgerRepository.findByCampaignIdAndCapability(campaignId, capability)
                    .orElseGet(() -> BudgetLedgerEntry.builder()
                            .campaignId(campaignId)
                            .capability(capability)
                            .build());
            entry.record(cost, succeeded, at);
            return ledgerRepository.save(entry);
        });
    }

    @Override
    public List<BudgetLedgerEntry> readLedger(Long campaignId) {
        return inTransaction("read ledger of campaign " + campaignId,
                () -> ledgerRepository.findByCampaignId(campaignId));
    }

    @Override
    public void touchHeartbeat(Long campaignId, OffsetDateTime at) {
        inTransaction("heartbeat of campaign " + campaignId, () -> campaignRepository.touchHeartbeat(campaignId, at));
    }

    @Override
    public List<Campaign> findStalledCampaigns(OffsetDateTime before) {
        return inTransaction("find stalled campaigns",
                () -> campaignRepository.findByStatusAndHeartbeatBefore(CampaignStatus.RUNNING, before));
    }

    private static void copyProgress(WorkItem source, WorkItem target) {
        target.setProcessingStage(source.getProcessingStage());
        target.setResearchPayload(source.getResearchPayload());
        target.setSummary(source.getSummary());
        target.setOutreachSubject(source.getOutreachSubject());
        target.setOutreachMessage(source.getOutreachMessage());
        target.setVerificationStatus(source.getVerificationStatus());
        target.setConfidenceScore(source.getConfidenceScore());
        target.setVerificationNote(source.getVerificationNote());
        target.setFailureStage(source.getFailureStage());
        target.setFailureReason(source.getFailureReason());
        target.setFailureMessage(source.getFailureMessage());
        target.setUpdatedAt(source.getUpdatedAt());
    }

    private <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (EntityNotFoundException e) {
            throw e;
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            log.error("State store failed to {}: {}", operation, e.getMessage());
            throw new StateStoreException("Failed to " + operation, e);
        }
    }
}
