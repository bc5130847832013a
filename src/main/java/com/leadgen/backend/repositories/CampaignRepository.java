package com.leadgen.backend.repositories;

import com.leadgen.backend.enums.CampaignStatus;
import com.leadgen.backend.models.Campaign;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface CampaignRepository extends JpaRepository<Campaign, Long> {

    @Query("SELECT c FROM Campaign c WHERE c.status = :status AND " +
            "(c.lastHeartbeatAt IS NULL OR c.lastHeartbeatAt < :before)")
    List<Campaign> findByStatusAndHeartbeatBefore(
            @Param("status") CampaignStatus status,
            @Param("before") OffsetDateTime before
    );

    @Modifying
    @Query("UPDATE Campaign c SET c.lastHeartbeatAt = :at WHERE c.id = :id")
    int touchHeartbeat(@Param("id") Long id, @Param("at") OffsetDateTime at);
}
