package com.leadgen.backend.repositories;

import com.leadgen.backend.models.CampaignCheckpoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CampaignCheckpointRepository extends JpaRepository<CampaignCheckpoint, Long> {
}
