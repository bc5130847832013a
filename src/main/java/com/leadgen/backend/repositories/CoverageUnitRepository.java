package com.leadgen.backend.repositories;

import com.leadgen.backend.models.CoverageUnit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CoverageUnitRepository extends JpaRepository<CoverageUnit, Long> {

    List<CoverageUnit> findByCampaignIdOrderByRankAsc(Long campaignId);

    /**
     * Remaining plan after a checkpoint, in rank order
     */
    List<CoverageUnit> findByCampaignIdAndRankGreaterThanOrderByRankAsc(Long campaignId, Integer rank);

    Optional<CoverageUnit> findByCampaignIdAndRank(Long campaignId, Integer rank);

    long countByCampaignId(Long campaignId);
}
