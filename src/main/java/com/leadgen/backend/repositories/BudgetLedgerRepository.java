package com.leadgen.backend.repositories;

import com.leadgen.backend.enums.Capability;
import com.leadgen.backend.models.BudgetLedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BudgetLedgerRepository extends JpaRepository<BudgetLedgerEntry, Long> {

    Optional<BudgetLedgerEntry> findByCampaignIdAndCapability(Long campaignId, Capability capability);

    List<BudgetLedgerEntry> findByCampaignId(Long campaignId);
}
