package com.leadgen.backend.repositories;

import com.leadgen.backend.enums.ProcessingStage;
import com.leadgen.backend.models.WorkItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface WorkItemRepository extends JpaRepository<WorkItem, Long> {

    Optional<WorkItem> findByCampaignIdAndExternalId(Long campaignId, String externalId);

    List<WorkItem> findByCampaignIdAndUnitRankOrderByIdAsc(Long campaignId, Integer unitRank);

    long countByCampaignId(Long campaignId);

    @Query("SELECT w.processingStage, COUNT(w) FROM WorkItem w WHERE w.campaignId = :campaignId " +
            "GROUP BY w.processingStage")
    List<Object[]> countByStage(@Param("campaignId") Long campaignId);

    long countByCampaignIdAndProcessingStage(Long campaignId, ProcessingStage stage);
}
