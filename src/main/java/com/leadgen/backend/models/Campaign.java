package com.leadgen.backend.models;

import com.leadgen.backend.enums.CampaignStatus;
import com.leadgen.backend.enums.CoverageProfile;
import com.leadgen.backend.enums.TerminationReason;
import com.leadgen.backend.util.JsonConverters;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "campaigns")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Campaign {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String region;

    @Convert(converter = JsonConverters.StringListConverter.class)
    @Column(name = "keywords", columnDefinition = "TEXT", nullable = false)
    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "coverage_profile", nullable = false, length = 32)
    @Builder.Default
    private CoverageProfile coverageProfile = CoverageProfile.BALANCED;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private CampaignStatus status = CampaignStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "termination_reason", length = 32)
    private TerminationReason terminationReason;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "cost_ceiling", nullable = false, precision = 14, scale = 6)
    private BigDecimal costCeiling;

    @Column(name = "cost_spent", nullable = false, precision = 14, scale = 6)
    @Builder.Default
    private BigDecimal costSpent = BigDecimal.ZERO;

    @Column(name = "estimated_cost", precision = 14, scale = 6)
    private BigDecimal estimatedCost;

    @Column(name = "units_planned", nullable = false)
    @Builder.Default
    private Integer unitsPlanned = 0;

    @Column(name = "units_processed", nullable = false)
    @Builder.Default
    private Integer unitsProcessed = 0;

    @Column(name = "items_discovered", nullable = false)
    @Builder.Default
    private Integer itemsDiscovered = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "last_heartbeat_at")
    private OffsetDateTime lastHeartbeatAt;

    public boolean isFinished() {
        return status.isFinished();
    }

    /**
     * Records the cumulative spend reported by the budget ledger. Spend never decreases,
     * so a lower total than the stored one is ignored.
     */
    public void raiseCostSpent(BigDecimal total) {
        if (total != null && (costSpent == null || total.compareTo(costSpent) > 0)) {
            costSpent = total;
        }
    }

    public void markRunning(OffsetDateTime now) {
        status = CampaignStatus.RUNNING;
        if (startedAt == null) {
            startedAt = now;
        }
        lastHeartbeatAt = now;
    }

    public void markPaused() {
        status = CampaignStatus.PAUSED;
    }

    public void markCompleted(OffsetDateTime now, TerminationReason reason) {
        status = CampaignStatus.COMPLETED;
        terminationReason = reason;
        completedAt = now;
    }

    public void markFailed(OffsetDateTime now, TerminationReason reason, String message) {
        status = CampaignStatus.FAILED;
        terminationReason = reason;
        errorMessage = message;
        completedAt = now;
    }
}
