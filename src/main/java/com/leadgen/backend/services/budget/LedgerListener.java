package com.leadgen.backend.services.budget;

import com.leadgen.backend.enums.Capability;

import java.math.BigDecimal;

/**
 * Notified for every released grant, while the owning account's monitor is held,
 * so notifications for one account arrive one at a time and in order.
 */
@FunctionalInterface
public interface LedgerListener {

    LedgerListener NONE = (campaignId, capability, cost, succeeded, committedTotal) -> { };

    void onCostRecorded(Long campaignId, Capability capability, BigDecimal cost, boolean succeeded,
                        BigDecimal committedTotal);
}
