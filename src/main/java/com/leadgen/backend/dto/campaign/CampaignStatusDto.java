package com.leadgen.backend.dto.campaign;

import com.leadgen.backend.enums.CampaignStatus;
import com.leadgen.backend.enums.Capability;
import com.leadgen.backend.enums.CoverageProfile;
import com.leadgen.backend.enums.ProcessingStage;
import com.leadgen.backend.enums.TerminationReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Campaign progress snapshot
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignStatusDto {
    private Long campaignId;
    private String name;
    private String region;
    private CoverageProfile coverageProfile;
    private CampaignStatus status;
    private TerminationReason terminationReason;
    private String errorMessage;

    // ===== Progress =====
    private Integer unitsPlanned;
    private Integer unitsProcessed;
    private Integer lastCompletedUnitRank;
    private Integer itemsDiscovered;
    private Map<ProcessingStage, Long> itemsByStage;

    // ===== Spend =====
    private BigDecimal costCeiling;
    private BigDecimal costSpent;
    private BigDecimal estimatedCost;
    private Map<Capability, LedgerLine> ledger;

    private OffsetDateTime createdAt;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
    private OffsetDateTime lastHeartbeatAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LedgerLine {
        private Long callsMade;
        private Long callsSucceeded;
        private Long callsFailed;
        private BigDecimal costAccrued;
    }
}
