package com.leadgen.backend.services.budget;

import com.leadgen.backend.enums.Capability;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Spend of one campaign run: committed cost, outstanding reservations and a per-capability ledger.
 * <p>
 * Every reservation is checked against the ceiling before it is made, so committed plus reserved
 * cost never exceeds the ceiling. Committed cost alone can pass it only when a call costs more
 * than its estimate.
 */
@Slf4j
public class BudgetAccount {

    private final Long campaignId;
    private final BigDecimal ceiling;
    private final Map<Capability, BigDecimal> capabilityCeilings;
    private final LedgerListener listener;

    private BigDecimal committed;
    private BigDecimal reserved = BigDecimal.ZERO;
    private final Map<Capability, LedgerTotals> ledger = new EnumMap<>(Capability.class);
    private final Map<Capability, BigDecimal> capabilityReserved = new EnumMap<>(Capability.class);

    BudgetAccount(Long campaignId, BigDecimal ceiling, BigDecimal alreadySpent,
                  Map<Capability, BigDecimal> spentByCapability,
                  Map<Capability, BigDecimal> capabilityCeilings, LedgerListener listener) {
        if (ceiling == null || ceiling.signum() < 0) {
            throw new IllegalArgumentException("Cost ceiling must be zero or positive");
        }
        this.campaignId = campaignId;
        this.ceiling = ceiling;
        this.committed = alreadySpent != null ? alreadySpent : BigDecimal.ZERO;
        this.capabilityCeilings = capabilityCeilings != null ? capabilityCeilings : Map.of();
        this.listener = listener != null ? listener : LedgerListener.NONE;
        for (Capability capability : Capability.values()) {
            BigDecimal spent = spentByCapability != null ? spentByCapability.get(capability) : null;
            ledger.put(capability, new LedgerTotals(spent != null ? spent : BigDecimal.ZERO));
            capabilityReserved.put(capability, BigDecimal.ZERO);
        }
    }

    public Long getCampaignId() {
        return campaignId;
    }

    public BigDecimal getCeiling() {
        return ceiling;
    }

    public synchronized BigDecimal getCommitted() {
        return committed;
    }

    public synchronized BigDecimal getReserved() {
        return reserved;
    }

    public synchronized BigDecimal getAvailable() {
        return ceiling.subtract(committed).subtract(reserved).max(BigDecimal.ZERO);
    }

    public synchronized Map<Capability, LedgerTotals> getLedger() {
        Map<Capability, LedgerTotals> copy = new EnumMap<>(Capability.class);
        ledger.forEach((capability, totals) -> copy.put(capability, totals.copy()));
        return Collections.unmodifiableMap(copy);
    }

    synchronized ItemAllowance openAllowance(BigDecimal amount) {
        if (!fits(amount)) {
            return null;
        }
        reserved = reserved.add(amount);
        return new ItemAllowance(this, amount);
    }

    synchronized void closeAllowance(ItemAllowance allowance) {
        BigDecimal left = allowance.drain();
        reserved = reserved.subtract(left);
    }

    /**
     * Reserves {@code estimate} for one call, drawing on the allowance before the account.
     *
     * @return the split between allowance and account, or null when the reservation does not fit
     */
    synchronized Reservation reserve(Capability capability, BigDecimal estimate, ItemAllowance allowance) {
        BigDecimal capabilityCeiling = capabilityCeilings.get(capability);
        if (capabilityCeiling != null) {
            BigDecimal projected = ledger.get(capability).cost
                    .add(capabilityReserved.get(capability))
                    .add(estimate);
            if (projected.compareTo(capabilityCeiling) > 0) {
                return null;
            }
        }

        BigDecimal fromAllowance = allowance != null ? allowance.draw(estimate) : BigDecimal.ZERO;
        BigDecimal fromAccount = estimate.subtract(fromAllowance);
        if (fromAccount.signum() > 0 && !fits(fromAccount)) {
            if (allowance != null) {
                allowance.giveBack(fromAllowance);
            }
            return null;
        }

        reserved = reserved.add(fromAccount);
        capabilityReserved.merge(capability, estimate, BigDecimal::add);
        return new Reservation(fromAllowance, fromAccount);
    }

    /**
     * Converts a grant's reservation into committed cost and notifies the listener.
     */
    synchronized BigDecimal settle(Grant grant, BigDecimal actualCost, boolean succeeded) {
        reserved = reserved.subtract(grant.getFromAllowance()).subtract(grant.getFromAccount());
        capabilityReserved.merge(grant.getCapability(), grant.getEstimate().negate(), BigDecimal::add);
        committed = committed.add(actualCost);
        ledger.get(grant.getCapability()).record(actualCost, succeeded);

        if (actualCost.compareTo(grant.getEstimate()) > 0) {
            log.debug("Campaign {} {} call cost {} over its estimate {}",
                    campaignId, grant.getCapability(), actualCost, grant.getEstimate());
        }
        listener.onCostRecorded(campaignId, grant.getCapability(), actualCost, succeeded, committed);
        return committed;
    }

    /**
     * Drops a grant's reservation without recording a call, for grants that never reached the provider.
     */
    synchronized void cancel(Grant grant) {
        reserved = reserved.subtract(grant.getFromAllowance()).subtract(grant.getFromAccount());
        capabilityReserved.merge(grant.getCapability(), grant.getEstimate().negate(), BigDecimal::add);
    }

    synchronized String describe() {
        return "committed " + committed + " + reserved " + reserved + " of ceiling " + ceiling;
    }

    private boolean fits(BigDecimal amount) {
        return committed.add(reserved).add(amount).compareTo(ceiling) <= 0;
    }

    record Reservation(BigDecimal fromAllowance, BigDecimal fromAccount) {
    }

    /**
     * Call counts and cost for one capability within this account.
     */
    public static final class LedgerTotals {
        private long callsMade;
        private long callsSucceeded;
        private long callsFailed;
        private BigDecimal cost;

        LedgerTotals(BigDecimal cost) {
            this.cost = cost;
        }

        void record(BigDecimal actualCost, boolean succeeded) {
            callsMade++;
            if (succeeded) {
                callsSucceeded++;
            } else {
                callsFailed++;
            }
            cost = cost.add(actualCost);
        }

        LedgerTotals copy() {
            LedgerTotals copy = new LedgerTotals(cost);
            copy.callsMade = callsMade;
            copy.callsSucceeded = callsSucceeded;
            copy.callsFailed = callsFailed;
            return copy;
        }

        public long getCallsMade() {
            return callsMade;
        }

        public long getCallsSucceeded() {
            return callsSucceeded;
        }

        public long getCallsFailed() {
            return callsFailed;
        }

        public BigDecimal getCost() {
            return cost;
        }
    }
}
