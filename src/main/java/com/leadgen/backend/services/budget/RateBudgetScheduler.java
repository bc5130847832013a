package com.leadgen.backend.services.budget;

import com.leadgen.backend.config.RateBudgetProperties;
import com.leadgen.backend.config.RateBudgetProperties.CapabilityLimits;
import com.leadgen.backend.enums.Capability;
import com.leadgen.backend.integrations.CapabilityException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Semaphore;

/**
 * Gatekeeper for every external call. Pacing and concurrency limits are shared across campaigns;
 * budgets belong to the {@link BudgetAccount} of each campaign run.
 * <p>
 * The budget check comes first and never blocks. Only a request that fits the budget waits
 * for a concurrency slot and then for the capability's minimum interval.
 */
@Service
@Slf4j
public class RateBudgetScheduler {

    private final Map<Capability, CapabilityGate> gates = new EnumMap<>(Capability.class);
    private final Map<Capability, BigDecimal> capabilityCeilings = new EnumMap<>(Capability.class);
    private final BackoffPolicy backoffPolicy;
    private final Clock clock;

    @Autowired
    public RateBudgetScheduler(RateBudgetProperties properties, Clock clock) {
        this(properties, clock, BackoffPolicy.Sleeper.THREAD);
    }

    public RateBudgetScheduler(RateBudgetProperties properties, Clock clock, BackoffPolicy.Sleeper sleeper) {
        this.clock = clock;
        this.backoffPolicy = new BackoffPolicy(properties.backoff(), sleeper);
        for (Capability capability : Capability.values()) {
            CapabilityLimits limits = properties.limitsFor(capability);
            gates.put(capability, new CapabilityGate(capability, limits));
            if (limits.costCeiling() != null) {
                capabilityCeilings.put(capability, limits.costCeiling());
            }
            log.info("{} limits: max {} concurrent, min interval {} ms, cost ceiling {}",
                    capability, limits.maxConcurrent(), limits.minInterval().toMillis(),
                    limits.costCeiling() != null ? limits.costCeiling() : "none");
        }
    }

    /**
     * Opens the budget account for one campaign run, seeded with what the campaign already spent.
     */
    public BudgetAccount openAccount(Long campaignId, BigDecimal ceiling, BigDecimal alreadySpent,
                                     Map<Capability, BigDecimal> spentByCapability, LedgerListener listener) {
        return new BudgetAccount(campaignId, ceiling, alreadySpent, spentByCapability,
                Map.copyOf(capabilityCeilings), listener);
    }

    /**
     * Reserves the projected cost of a work item's remaining stages.
     */
    public AcquireResult<ItemAllowance> admit(BudgetAccount account, BigDecimal projectedItemCost) {
        BigDecimal amount = nonNegative(projectedItemCost);
        ItemAllowance allowance = account.openAllowance(amount);
        if (allowance == null) {
            String message = "Item needs " + amount + ", " + account.describe();
            log.info("Campaign {} admission denied: {}", account.getCampaignId(), message);
            return AcquireResult.denied(Denial.budgetExceeded(null, message));
        }
        return AcquireResult.granted(allowance);
    }

    /**
     * Requests permission for one call.
     *
     * @param allowance item allowance to draw from first, or null for unit-level calls
     * @return a grant, or a denial when the estimate does not fit the campaign or capability budget
     */
    public AcquireResult<Grant> acquire(BudgetAccount account, ItemAllowance allowance,
                                        Capability capability, BigDecimal estimatedCost) {
        BigDecimal estimate = nonNegative(estimatedCost);
        BudgetAccount.Reservation reservation = account.reserve(capability, estimate, allowance);
        if (reservation == null) {
            String message = capability + " call estimated at " + estimate + " does not fit: " + account.describe();
            log.info("Campaign {} grant denied: {}", account.getCampaignId(), message);
            return AcquireResult.denied(Denial.budgetExceeded(capability, message));
        }

        Grant grant = new Grant(account, capability, estimate, reservation.fromAllowance(),
                reservation.fromAccount(), OffsetDateTime.now(clock));
        try {
            gates.get(capability).enter();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (grant.markReleased()) {
                account.cancel(grant);
            }
            throw new IllegalStateException("Interrupted waiting for a " + capability + " slot", e);
        }
        return AcquireResult.granted(grant);
    }

    /**
     * Runs the call under {@code grant}, backing off while the provider throttles.
     *
     * @throws ProviderThrottledException when throttling outlasts every retry
     */
    public <T> T call(Grant grant, CapabilityCall<T> call) throws CapabilityException {
        if (grant.isReleased()) {
            throw new IllegalStateException("Grant for " + grant.getCapability() + " already released");
        }
        return backoffPolicy.execute(grant.getCapability(), call);
    }

    /**
     * Records the call's actual cost and frees its slot. A second release of the same grant is a no-op.
     */
    public void release(Grant grant, BigDecimal actualCost, boolean succeeded) {
        if (!grant.markReleased()) {
            return;
        }
        try {
            grant.getAccount().settle(grant, nonNegative(actualCost), succeeded);
        } finally {
            gates.get(grant.getCapability()).exit();
        }
    }

    /**
     * Grants currently holding a slot for the capability.
     */
    public int inFlight(Capability capability) {
        return gates.get(capability).inFlight();
    }

    public int maxConcurrent(Capability capability) {
        return gates.get(capability).maxConcurrent;
    }

    private static BigDecimal nonNegative(BigDecimal value) {
        return value == null || value.signum() < 0 ? BigDecimal.ZERO : value;
    }

    /**
     * Concurrency slots plus an optional pacing bucket for one capability.
     */
    private static final class CapabilityGate {
        private final int maxConcurrent;
        private final Semaphore slots;
        private final Bucket pacing;

        CapabilityGate(Capability capability, CapabilityLimits limits) {
            this.maxConcurrent = limits.maxConcurrent();
            this.slots = new Semaphore(limits.maxConcurrent(), true);
            Duration interval = limits.minInterval();
            if (interval.isZero()) {
                this.pacing = null;
            } else {
                // One token refilled greedily: the next grant is a full interval after the last one
                Bandwidth limit = Bandwidth.classic(1, Refill.greedy(1, interval));
                this.pacing = Bucket.builder().addLimit(limit).build();
            }
        }

        void enter() throws InterruptedException {
            slots.acquire();
            if (pacing != null) {
                try {
                    pacing.asBlocking().consume(1);
                } catch (InterruptedException e) {
                    slots.release();
                    throw e;
                }
            }
        }

        void exit() {
            slots.release();
        }

        int inFlight() {
            return maxConcurrent - slots.availablePermits();
        }
    }
}
