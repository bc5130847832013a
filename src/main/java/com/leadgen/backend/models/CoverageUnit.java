package com.leadgen.backend.models;

import com.leadgen.backend.enums.DensityClass;
import com.leadgen.backend.enums.UnitStatus;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * One planned slice of a campaign's region. Rank, key, density and expected count are
 * fixed when the plan is stored; only the progress columns change afterwards.
 */
@Entity
@Table(name = "coverage_units",
        uniqueConstraints = @UniqueConstraint(name = "uk_coverage_unit_rank", columnNames = {"campaign_id", "unit_rank"}))
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CoverageUnit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "campaign_id", nullable = false, updatable = false)
    private Long campaignId;

    @Column(name = "unit_rank", nullable = false, updatable = false)
    private Integer rank;

    @Column(name = "unit_key", nullable = false, updatable = false, length = 64)
    private String unitKey;

    @Column(name = "label", updatable = false)
    private String label;

    @Enumerated(EnumType.STRING)
    @Column(name = "density_class", nullable = false, updatable = false, length = 16)
    private DensityClass densityClass;

    @Column(name = "expected_businesses", nullable = false, updatable = false)
    private Integer expectedBusinesses;

    @Column(name = "weight", nullable = false, updatable = false)
    private Double weight;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private UnitStatus status = UnitStatus.PLANNED;

    @Column(name = "businesses_found")
    @Builder.Default
    private Integer businessesFound = 0;

    @Column(name = "actual_cost", precision = 14, scale = 6)
    @Builder.Default
    private BigDecimal actualCost = BigDecimal.ZERO;

    @Column(name = "failure_message", columnDefinition = "TEXT")
    private String failureMessage;
}
