package com.leadgen.backend.models;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Resumable progress of a campaign. Written only after the state it describes is committed.
 */
@Entity
@Table(name = "campaign_checkpoints")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CampaignCheckpoint {

    @Id
    @Column(name = "campaign_id")
    private Long campaignId;

    // -1 until the first unit completes
    @Column(name = "last_completed_unit_rank", nullable = false)
    @Builder.Default
    private Integer lastCompletedUnitRank = -1;

    @Column(name = "current_unit_rank")
    private Integer currentUnitRank;

    @Column(name = "current_unit_discovered", nullable = false)
    @Builder.Default
    private Boolean currentUnitDiscovered = false;

    @Column(name = "items_completed_in_unit", nullable = false)
    @Builder.Default
    private Integer itemsCompletedInUnit = 0;

    @Column(name = "cost_spent", nullable = false, precision = 14, scale = 6)
    @Builder.Default
    private BigDecimal costSpent = BigDecimal.ZERO;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public static CampaignCheckpoint initial(Long campaignId) {
        return CampaignCheckpoint.builder().campaignId(campaignId).build();
    }

    public boolean isDiscoveredUnit(int rank) {
        return currentUnitRank != null && currentUnitRank == rank && Boolean.TRUE.equals(currentUnitDiscovered);
    }
}
