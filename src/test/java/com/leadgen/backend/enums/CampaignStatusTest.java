package com.leadgen.backend.enums;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CampaignStatusTest {

    @Test
    void testTransitionsAllowedPerStatus() {
        assertThat(CampaignStatus.PENDING.canStart()).isTrue();
        assertThat(CampaignStatus.PAUSED.canStart()).isFalse();
        assertThat(CampaignStatus.PAUSED.canResume()).isTrue();
        assertThat(CampaignStatus.RUNNING.canResume()).isFalse();

        assertThat(CampaignStatus.PENDING.canCancel()).isTrue();
        assertThat(CampaignStatus.RUNNING.canCancel()).isTrue();
        assertThat(CampaignStatus.PAUSED.canCancel()).isTrue();
        assertThat(CampaignStatus.COMPLETED.canCancel()).isFalse();
        assertThat(CampaignStatus.FAILED.canCancel()).isFalse();
    }

    @Test
    void testFinishedStatuses() {
        assertThat(CampaignStatus.COMPLETED.isFinished()).isTrue();
        assertThat(CampaignStatus.FAILED.isFinished()).isTrue();
        assertThat(CampaignStatus.RUNNING.isFinished()).isFalse();
        assertThat(CampaignStatus.PAUSED.isFinished()).isFalse();
    }
}
