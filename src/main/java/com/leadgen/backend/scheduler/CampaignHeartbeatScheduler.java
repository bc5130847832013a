package com.leadgen.backend.scheduler;

import com.leadgen.backend.config.EngineProperties;
import com.leadgen.backend.models.Campaign;
import com.leadgen.backend.services.campaign.CampaignExecutionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Liveness of running campaigns: heartbeats for the runs owned by this process, and detection
 * of RUNNING campaigns nobody drives any more.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CampaignHeartbeatScheduler {

    private final CampaignExecutionService executionService;
    private final EngineProperties engineProperties;

    @Scheduled(fixedRateString = "${leadgen.engine.heartbeat-interval:PT60S}")
    public void heartbeat() {
        if (executionService.activeCampaignIds().isEmpty()) {
            log.debug("No active campaign runs");
            return;
        }
        executionService.writeHeartbeats();
    }

    /**
     * Stalled campaigns are resumed from their checkpoint when auto-recovery is on, otherwise reported.
     */
    @Scheduled(fixedDelayString = "${leadgen.engine.stale-check-interval:PT5M}",
            initialDelayString = "${leadgen.engine.stale-check-interval:PT5M}")
    public void recoverStalled() {
        List<Campaign> stalled;
        try {
            stalled = executionService.findStalledCampaigns();
        } catch (Exception e) {
            log.error("Stalled campaign check failed: {}", e.getMessage(), e);
            return;
        }

        for (Campaign campaign : stalled) {
            if (!engineProperties.autoRecover()) {
                log.warn("Campaign {} is RUNNING but its heartbeat is older than {} (last {})",
                        campaign.getId(), engineProperties.staleAfter(), campaign.getLastHeartbeatAt());
                continue;
            }
            try {
                executionService.recover(campaign.getId());
            } catch (Exception e) {
                log.error("Failed to recover campaign {}: {}", campaign.getId(), e.getMessage(), e);
            }
        }
    }
}
