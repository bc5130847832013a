package com.leadgen.backend.services.pipeline;

import com.leadgen.backend.config.ResearchProperties;
import com.leadgen.backend.services.budget.BackoffPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Politeness limits per website host: a minimum delay between requests and a temporary block
 * after repeated consecutive failures. State of hosts nobody contacted for a while is dropped.
 */
@Component
@Slf4j
public class DomainThrottle {

    private final Duration minDelay;
    private final int failureThreshold;
    private final Duration blockDuration;
    private final Duration idleEviction;
    private final Clock clock;
    private final BackoffPolicy.Sleeper sleeper;

    private final Map<String, HostState> hosts = new ConcurrentHashMap<>();

    @Autowired
    public DomainThrottle(ResearchProperties properties, Clock clock) {
        this(properties, clock, BackoffPolicy.Sleeper.THREAD);
    }

    public DomainThrottle(ResearchProperties properties, Clock clock, BackoffPolicy.Sleeper sleeper) {
        this.minDelay = properties.domainMinDelay();
        this.failureThreshold = properties.domainFailureThreshold();
        this.blockDuration = properties.domainBlockDuration();
        this.idleEviction = properties.domainIdleEviction();
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * True while the host serves a block. An expired block is lifted here and the failure count reset.
     */
    public boolean isBlocked(String host) {
        HostState state = hosts.get(host);
        if (state == null) {
            return false;
        }
        synchronized (state) {
            if (state.blockedUntilMillis == 0) {
                return false;
            }
            if (clock.millis() < state.blockedUntilMillis) {
                return true;
            }
            state.blockedUntilMillis = 0;
            state.consecutiveFailures = 0;
            log.info("Host {} unblocked", host);
            return false;
        }
    }

    /**
     * Waits until the host may be contacted again and claims the next slot.
     */
    public void awaitTurn(String host) throws InterruptedException {
        if (minDelay.isZero() || minDelay.isNegative()) {
            return;
        }
        HostState state = hosts.computeIfAbsent(host, h -> new HostState());
        long waitMillis;
        synchronized (state) {
            long now = clock.millis();
            long slot = Math.max(now, state.nextSlotMillis);
            state.nextSlotMillis = slot + minDelay.toMillis();
            state.lastUsedMillis = slot;
            waitMillis = slot - now;
        }
        if (waitMillis > 0) {
            sleeper.sleep(Duration.ofMillis(waitMillis));
        }
    }

    public void recordSuccess(String host) {
        HostState state = hosts.computeIfAbsent(host, h -> new HostState());
        synchronized (state) {
            state.consecutiveFailures = 0;
            state.lastUsedMillis = Math.max(state.lastUsedMillis, clock.millis());
        }
    }

    public void recordFailure(String host) {
        HostState state = hosts.computeIfAbsent(host, h -> new HostState());
        synchronized (state) {
            long now = clock.millis();
            state.consecutiveFailures++;
            state.lastUsedMillis = Math.max(state.lastUsedMillis, now);
            if (state.blockedUntilMillis == 0 && failureThreshold > 0
                    && state.consecutiveFailures >= failureThreshold) {
                state.blockedUntilMillis = now + blockDuration.toMillis();
                log.warn("Blocking host {} for {} after {} consecutive failures",
                        host, blockDuration, state.consecutiveFailures);
            }
        }
    }

    /**
     * Drops hosts that were idle for the configured time and are not serving a block.
     */
    @Scheduled(fixedDelayString = "${leadgen.research.domain-idle-eviction:PT1H}",
            initialDelayString = "${leadgen.research.domain-idle-eviction:PT1H}")
    public void evictIdleHosts() {
        long now = clock.millis();
        long idleBefore = now - idleEviction.toMillis();
        int before = hosts.size();
        hosts.entrySet().removeIf(entry -> {
            HostState state = entry.getValue();
            synchronized (state) {
                boolean blocked = state.blockedUntilMillis > now;
                return !blocked && state.lastUsedMillis <= idleBefore;
            }
        });
        int evicted = before - hosts.size();
        if (evicted > 0) {
            log.debug("Evicted {} idle hosts, {} still tracked", evicted, hosts.size());
        }
    }

    int trackedHosts() {
        return hosts.size();
    }

    private static final class HostState {
        private long nextSlotMillis;
        private long lastUsedMillis;
        private int consecutiveFailures;
        private long blockedUntilMillis;
    }
}
