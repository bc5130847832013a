package com.leadgen.backend.scheduler;

import com.leadgen.backend.config.EngineProperties;
import com.leadgen.backend.models.Campaign;
import com.leadgen.backend.services.campaign.CampaignExecutionService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CampaignHeartbeatSchedulerTest {

    @Mock
    private CampaignExecutionService executionService;

    private CampaignHeartbeatScheduler scheduler(boolean autoRecover) {
        EngineProperties properties = new EngineProperties(4, Duration.ofSeconds(60), Duration.ofMinutes(5),
                Duration.ofMinutes(5), autoRecover, 1000, 500, 250,
                Duration.ofMinutes(30), Duration.ofMinutes(60), Duration.ofMinutes(90));
        return new CampaignHeartbeatScheduler(executionService, properties);
    }

    @Test
    void testHeartbeat_SkipsWhenNothingRuns() {
        // Given
        when(executionService.activeCampaignIds()).thenReturn(Set.of());

        // When
        scheduler(false).heartbeat();

        // Then
        verify(executionService, never()).writeHeartbeats();
    }

    @Test
    void testHeartbeat_WritesForActiveRuns() {
        // Given
        when(executionService.activeCampaignIds()).thenReturn(Set.of(7L));

        // When
        scheduler(false).heartbeat();

        // Then
        verify(executionService).writeHeartbeats();
    }

    @Test
    void testRecoverStalled_AutoRecoverResumesEachCampaign() {
        // Given
        when(executionService.findStalledCampaigns()).thenReturn(List.of(
                Campaign.builder().id(1L).build(),
                Campaign.builder().id(2L).build()));
        doThrow(new IllegalStateException("Campaign 1 is already running")).when(executionService).recover(1L);

        // When
        scheduler(true).recoverStalled();

        // Then
        verify(executionService).recover(1L);
        verify(executionService).recover(2L);
    }

    @Test
    void testRecoverStalled_ReportOnlyWhenAutoRecoverIsOff() {
        // Given
        when(executionService.findStalledCampaigns()).thenReturn(List.of(Campaign.builder().id(3L).build()));

        // When
        scheduler(false).recoverStalled();

        // Then
        verify(executionService, never()).recover(anyLong());
    }

    @Test
    void testRecoverStalled_LookupFailureIsContained() {
        // Given
        when(executionService.findStalledCampaigns()).thenThrow(new RuntimeException("database down"));

        // When
        scheduler(true).recoverStalled();

        // Then
        verify(executionService, never()).recover(anyLong());
    }
}
