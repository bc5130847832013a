package com.leadgen.backend.services.campaign;

import com.leadgen.backend.config.EngineProperties;
import com.leadgen.backend.dto.campaign.CampaignStatusDto;
import com.leadgen.backend.dto.campaign.WorkItemResultDto;
import com.leadgen.backend.enums.CampaignStatus;
import com.leadgen.backend.enums.Capability;
import com.leadgen.backend.enums.CoverageProfile;
import com.leadgen.backend.enums.DensityClass;
import com.leadgen.backend.enums.ProcessingStage;
import com.leadgen.backend.models.BudgetLedgerEntry;
import com.leadgen.backend.models.Campaign;
import com.leadgen.backend.models.CampaignCheckpoint;
import com.leadgen.backend.services.budget.CostCatalog;
import com.leadgen.backend.services.coverage.CoveragePlan;
import com.leadgen.backend.services.coverage.CoveragePlanner;
import com.leadgen.backend.services.coverage.DensityEntry;
import com.leadgen.backend.services.coverage.DensityTable;
import com.leadgen.backend.services.coverage.DensityTableProvider;
import com.leadgen.backend.services.coverage.InvalidRegionException;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Operations exposed to the front end: create a campaign, drive it, read its progress and results.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignService {

    private final CampaignStateStore store;
    private final CampaignExecutionService executionService;
    private final CoveragePlanner coveragePlanner;
    private final DensityTableProvider densityTableProvider;
    private final CostCatalog costCatalog;
    private final EngineProperties engineProperties;
    private final Clock clock;

    /**
     * Plans and stores a new PENDING campaign.
     *
     * @throws InvalidRegionException   when the region is blank or no keyword is given
     * @throws IllegalArgumentException when the cost ceiling is missing or negative
     */
    public Long create(String name, String region, List<String> keywords, BigDecimal costCeiling,
                       CoverageProfile profile) {
        if (costCeiling == null || costCeiling.signum() < 0) {
            throw new IllegalArgumentException("Cost ceiling must be zero or positive");
        }
        List<String> cleanKeywords = coveragePlanner.validate(region, keywords);
        CoverageProfile coverageProfile = profile != null ? profile : CoverageProfile.BALANCED;

        CoveragePlan plan = planFor(region.trim(), cleanKeywords, coverageProfile);
        BigDecimal estimatedCost = costCatalog.estimateCampaign(plan.totalExpectedBusinesses());

        Campaign campaign = store.upsertCampaign(Campaign.builder()
                .name(name != null && !name.isBlank() ? name.trim() : region.trim() + " " + String.join(", ", cleanKeywords))
                .region(region.trim())
                .keywords(cleanKeywords)
                .coverageProfile(coverageProfile)
                .status(CampaignStatus.PENDING)
                .costCeiling(costCeiling)
                .estimatedCost(estimatedCost)
                .unitsPlanned(plan.size())
                .createdAt(OffsetDateTime.now(clock))
                .build());

        store.savePlan(campaign.getId(), plan);
        store.writeCheckpoint(CampaignCheckpoint.initial(campaign.getId()));

        if (estimatedCost.compareTo(costCeiling) > 0) {
            log.warn("Campaign {} estimated at {} exceeds its ceiling {}; it will stop when the budget runs out",
                    campaign.getId(), estimatedCost, costCeiling);
        }
        log.info("Created campaign {} '{}' for {} with {} units ({} profile, estimated {})", campaign.getId(),
                campaign.getName(), campaign.getRegion(), plan.size(), coverageProfile, estimatedCost);
        return campaign.getId();
    }

    public void start(Long campaignId) {
        executionService.start(campaignId);
    }

    public void pause(Long campaignId) {
        executionService.pause(campaignId);
    }

    public void resume(Long campaignId) {
        executionService.resume(campaignId);
    }

    public void cancel(Long campaignId) {
        executionService.cancel(campaignId);
    }

    public CampaignStatusDto getStatus(Long campaignId) {
        Campaign campaign = load(campaignId);
        Integer lastCompletedRank = store.readCheckpoint(campaignId)
                .map(CampaignCheckpoint::getLastCompletedUnitRank)
                .orElse(-1);

        Map<Capability, CampaignStatusDto.LedgerLine> ledger = new EnumMap<>(Capability.class);
        for (BudgetLedgerEntry entry : store.readLedger(campaignId)) {
            ledger.put(entry.getCapability(), CampaignStatusDto.LedgerLine.builder()
                    .callsMade(entry.getCallsMade())
                    .callsSucceeded(entry.getCallsSucceeded())
                    .callsFailed(entry.getCallsFailed())
                    .costAccrued(entry.getCostAccrued())
                    .build());
        }
        Map<ProcessingStage, Long> itemsByStage = store.countItemsByStage(campaignId);

        return CampaignStatusDto.builder()
                .campaignId(campaign.getId())
                .name(campaign.getName())
                .region(campaign.getRegion())
                .coverageProfile(campaign.getCoverageProfile())
                .status(campaign.getStatus())
                .terminationReason(campaign.getTerminationReason())
                .errorMessage(campaign.getErrorMessage())
                .unitsPlanned(campaign.getUnitsPlanned())
                .unitsProcessed(campaign.getUnitsProcessed())
                .lastCompletedUnitRank(lastCompletedRank)
                .itemsDiscovered(campaign.getItemsDiscovered())
                .itemsByStage(itemsByStage)
                .costCeiling(campaign.getCostCeiling())
                .costSpent(campaign.getCostSpent())
                .estimatedCost(campaign.getEstimatedCost())
                .ledger(ledger)
                .createdAt(campaign.getCreatedAt())
                .startedAt(campaign.getStartedAt())
                .completedAt(campaign.getCompletedAt())
                .lastHeartbeatAt(campaign.getLastHeartbeatAt())
                .build();
    }

    /**
     * Work items of the campaign in discovery order. {@code limit} is clamped to
     * [1, max page size] and {@code offset} to zero or more.
     */
    public List<WorkItemResultDto> listResults(Long campaignId, int limit, int offset) {
        load(campaignId);
        int clampedLimit = Math.max(1, Math.min(limit, engineProperties.maxResultsPageSize()));
        int clampedOffset = Math.max(0, offset);
        return store.listWorkItems(campaignId, clampedLimit, clampedOffset).stream()
                .map(WorkItemResultDto::from)
                .toList();
    }

    private CoveragePlan planFor(String region, List<String> keywords, CoverageProfile profile) {
        DensityTable table = densityTableProvider.tableFor(region);
        try {
            return coveragePlanner.plan(region, keywords, table, profile);
        } catch (InvalidRegionException e) {
            if (!e.isMissingDensityData()) {
                throw e;
            }
            log.warn("No density data for '{}', planning it as a single unit", region);
            DensityTable fallback = new DensityTable(region, List.of(new DensityEntry(region, region,
                    DensityClass.UNKNOWN, engineProperties.defaultUnitBusinesses())));
            return coveragePlanner.plan(region, keywords, fallback, CoverageProfile.CUSTOM);
        }
    }

    private Campaign load(Long campaignId) {
        return store.findCampaign(campaignId)
                .orElseThrow(() -> new EntityNotFoundException("Campaign not found with id: " + campaignId));
    }
}
