package com.leadgen.backend.models;

import com.leadgen.backend.enums.Capability;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Entity
@Table(name = "budget_ledger",
        uniqueConstraints = @UniqueConstraint(name = "uk_budget_ledger_capability", columnNames = {"campaign_id", "capability"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetLedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "campaign_id", nullable = false, updatable = false)
    private Long campaignId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private Capability capability;

    @Column(name = "calls_made", nullable = false)
    @Builder.Default
    private Long callsMade = 0L;

    @Column(name = "calls_succeeded", nullable = false)
    @Builder.Default
    private Long callsSucceeded = 0L;

    @Column(name = "calls_failed", nullable = false)
    @Builder.Default
    private Long callsFailed = 0L;

    @Column(name = "cost_accrued", nullable = false, precision = 14, scale = 6)
    @Builder.Default
    private BigDecimal costAccrued = BigDecimal.ZERO;

    @Column(name = "last_call_at")
    private OffsetDateTime lastCallAt;

    public void record(BigDecimal cost, boolean succeeded, OffsetDateTime at) {
        callsMade++;
        if (succeeded) {
            callsSucceeded++;
        } else {
            callsFailed++;
        }
        if (cost != null && cost.signum() > 0) {
            costAccrued = costAccrued.add(cost);
        }
        lastCallAt = at;
    }
}
