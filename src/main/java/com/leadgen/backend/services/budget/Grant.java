package com.leadgen.backend.services.budget;

import com.leadgen.backend.enums.Capability;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Permission to make one call to a capability. Holds a concurrency slot and a budget reservation
 * until {@link RateBudgetScheduler#release(Grant, BigDecimal, boolean)} is called.
 */
@Getter
public final class Grant {

    private final BudgetAccount account;
    private final Capability capability;
    private final BigDecimal estimate;
    // Part of the estimate covered by the item allowance; the rest was reserved on the account
    private final BigDecimal fromAllowance;
    private final BigDecimal fromAccount;
    private final OffsetDateTime grantedAt;
    private final AtomicBoolean released = new AtomicBoolean(false);

    Grant(BudgetAccount account, Capability capability, BigDecimal estimate,
          BigDecimal fromAllowance, BigDecimal fromAccount, OffsetDateTime grantedAt) {
        this.account = account;
        this.capability = capability;
        this.estimate = estimate;
        this.fromAllowance = fromAllowance;
        this.fromAccount = fromAccount;
        this.grantedAt = grantedAt;
    }

    public boolean isReleased() {
        return released.get();
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }
}
