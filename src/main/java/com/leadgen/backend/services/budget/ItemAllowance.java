package com.leadgen.backend.services.budget;

import java.math.BigDecimal;

/**
 * Budget reserved for the remaining stages of one work item. Stage grants draw from it first;
 * whatever is left goes back to the account on {@link #close()}.
 * All state is guarded by the owning account's monitor.
 */
public final class ItemAllowance implements AutoCloseable {

    private final BudgetAccount account;
    private final BigDecimal amount;
    private BigDecimal remaining;
    private boolean closed;

    ItemAllowance(BudgetAccount account, BigDecimal amount) {
        this.account = account;
        this.amount = amount;
        this.remaining = amount;
    }

    public BudgetAccount getAccount() {
        return account;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public BigDecimal getRemaining() {
        synchronized (account) {
            return remaining;
        }
    }

    // Caller holds the account monitor
    BigDecimal draw(BigDecimal wanted) {
        if (closed) {
            return BigDecimal.ZERO;
        }
        BigDecimal taken = wanted.min(remaining);
        remaining = remaining.subtract(taken);
        return taken;
    }

    // Caller holds the account monitor
    void giveBack(BigDecimal value) {
        remaining = remaining.add(value);
    }

    // Caller holds the account monitor
    BigDecimal drain() {
        BigDecimal left = closed ? BigDecimal.ZERO : remaining;
        remaining = BigDecimal.ZERO;
        closed = true;
        return left;
    }

    /**
     * Returns the unused part of the allowance to the account. Safe to call more than once.
     */
    @Override
    public void close() {
        account.closeAllowance(this);
    }
}
