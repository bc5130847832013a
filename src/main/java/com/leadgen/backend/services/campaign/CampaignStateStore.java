package com.leadgen.backend.services.campaign;

import com.leadgen.backend.enums.Capability;
import com.leadgen.backend.enums.ProcessingStage;
import com.leadgen.backend.models.BudgetLedgerEntry;
import com.leadgen.backend.models.Campaign;
import com.leadgen.backend.models.CampaignCheckpoint;
import com.leadgen.backend.models.CoverageUnit;
import com.leadgen.backend.models.WorkItem;
import com.leadgen.backend.services.coverage.CoveragePlan;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable campaign state. Every write is committed when the method returns.
 * Implementations throw {@link com.leadgen.backend.exceptions.StateStoreException} when storage fails.
 */
public interface CampaignStateStore {

    Campaign upsertCampaign(Campaign campaign);

    Optional<Campaign> findCampaign(Long campaignId);

    /**
     * Applies {@code mutation} to the stored campaign and saves it in one transaction.
     *
     * @throws jakarta.persistence.EntityNotFoundException when the campaign does not exist
     */
    Campaign updateCampaign(Long campaignId, Consumer<Campaign> mutation);

    /**
     * Stores the plan's units for the campaign. Units already stored for a rank are kept as they are.
     */
    List<CoverageUnit> savePlan(Long campaignId, CoveragePlan plan);

    List<CoverageUnit> findUnits(Long campaignId);

    List<CoverageUnit> findUnitsAfter(Long campaignId, int rank);

    CoverageUnit upsertUnit(CoverageUnit unit);

    /**
     * Inserts or updates an item by (campaign, external id). An update never moves the stored
     * item backwards and never touches an item that is already FAILED.
     *
     * @return the item as stored
     */
    WorkItem upsertWorkItem(WorkItem item);

    List<WorkItem> findWorkItems(Long campaignId, int unitRank);

    List<WorkItem> listWorkItems(Long campaignId, int limit, int offset);

    Map<ProcessingStage, Long> countItemsByStage(Long campaignId);

    void writeCheckpoint(CampaignCheckpoint checkpoint);

    Optional<CampaignCheckpoint> readCheckpoint(Long campaignId);

    /**
     * Adds one call to the campaign's ledger for the capability.
     */
    void recordCost(Long campaignId, Capability capability, BigDecimal cost, boolean succeeded, OffsetDateTime at);

    List<BudgetLedgerEntry> readLedger(Long campaignId);

    void touchHeartbeat(Long campaignId, OffsetDateTime at);

    /**
     * RUNNING campaigns whose heartbeat is missing or older than {@code before}.
     */
    List<Campaign> findStalledCampaigns(OffsetDateTime before);
}
