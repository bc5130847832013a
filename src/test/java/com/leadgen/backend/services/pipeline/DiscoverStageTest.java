package com.leadgen.backend.services.pipeline;

import com.leadgen.backend.config.EngineProperties;
import com.leadgen.backend.config.RateBudgetProperties;
import com.leadgen.backend.enums.Capability;
import com.leadgen.backend.enums.DensityClass;
import com.leadgen.backend.enums.ProcessingStage;
import com.leadgen.backend.integrations.CapabilityException;
import com.leadgen.backend.integrations.ContactEnricher;
import com.leadgen.backend.integrations.DiscoveryProvider;
import com.leadgen.backend.integrations.RawRecord;
import com.leadgen.backend.integrations.ThrottledException;
import com.leadgen.backend.models.CoverageUnit;
import com.leadgen.backend.models.WorkItem;
import com.leadgen.backend.services.budget.BudgetAccount;
import com.leadgen.backend.services.budget.CostCatalog;
import com.leadgen.backend.services.budget.LedgerListener;
import com.leadgen.backend.services.budget.RateBudgetScheduler;
import com.leadgen.backend.support.EngineFixture;
import com.leadgen.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DiscoverStageTest {

    @Mock
    private DiscoveryProvider provider;

    @Mock
    private ContactEnricher facebook;

    @Mock
    private ContactEnricher linkedin;

    private RateBudgetScheduler scheduler;
    private DiscoverStage stage;
    private final CoverageUnit unit = CoverageUnit.builder()
            .campaignId(1L)
            .rank(3)
            .unitKey("90012")
            .label("Downtown LA")
            .densityClass(DensityClass.VERY_HIGH)
            .expectedBusinesses(450)
            .build();

    @BeforeEach
    void setUp() {
        scheduler = new RateBudgetScheduler(new RateBudgetProperties(null,
                new RateBudgetProperties.Backoff(Duration.ZERO, Duration.ZERO, 1)), EngineFixture.CLOCK, d -> { });
        stage = stageWith(List.of(), EngineFixture.CLOCK);
    }

    private DiscoverStage stageWith(List<ContactEnricher> enrichers, Clock clock) {
        EngineProperties engine = new EngineProperties(4, Duration.ofSeconds(60), Duration.ofMinutes(5),
                Duration.ofMinutes(5), false, 100, 500, 250,
                Duration.ofMinutes(30), Duration.ofMinutes(60), Duration.ofMinutes(90));
        return new DiscoverStage(provider, enrichers, scheduler,
                new CostCatalog(EngineFixture.costs("0.01", "0", "0", "0"), EngineFixture.research(0)),
                engine, clock);
    }

    private StageContext context(String ceiling, String... keywords) {
        BudgetAccount account = scheduler.openAccount(1L, new BigDecimal(ceiling), BigDecimal.ZERO, Map.of(),
                LedgerListener.NONE);
        return new StageContext(1L, List.of(keywords), account, null);
    }

    private RawRecord record(String id, String email) {
        return RawRecord.builder().externalId(id).name("Business " + id).email(email).build();
    }

    @Test
    void testSplitsResultsAcrossKeywordsAndDeduplicates() throws Exception {
        // Given
        when(provider.search(unit, "plumber", 50)).thenReturn(List.of(
                record("p1", "a@x.example"), record("p2", null), record("shared", "s@x.example")));
        when(provider.search(unit, "roofer", 50)).thenReturn(List.of(
                record("shared", "s@x.example"), record("r1", " r@x.example ")));
        StageContext context = context("10", "plumber", "roofer");

        // When
        DiscoveryResult result = stage.discover(unit, context);

        // Then
        assertThat(result.items()).extracting(WorkItem::getExternalId).containsExactly("p1", "shared", "r1");
        assertThat(result.items()).extracting(WorkItem::getProcessingStage).containsOnly(ProcessingStage.DISCOVERED);
        assertThat(result.items()).extracting(WorkItem::getUnitRank).containsOnly(3);
        assertThat(result.items().get(2).getContactChannel()).isEqualTo("r@x.example");
        assertThat(result.rawResults()).isEqualTo(5);
        assertThat(result.withoutContact()).isEqualTo(1);
        assertThat(result.cost()).isEqualByComparingTo("0.05");
        assertThat(result.isFailed()).isFalse();
        assertThat(result.isHalted()).isFalse();
        assertThat(context.account().getLedger().get(Capability.DISCOVERY).getCallsMade()).isEqualTo(2);
    }

    @Test
    void testFailedKeywordIsReportedAndOthersStillRun() throws Exception {
        // Given
        when(provider.search(eq(unit), eq("plumber"), anyInt())).thenThrow(new ThrottledException("429"));
        when(provider.search(eq(unit), eq("roofer"), anyInt())).thenReturn(List.of(record("r1", "r@x.example")));

        // When
        DiscoveryResult result = stage.discover(unit, context("10", "plumber", "roofer"));

        // Then
        assertThat(result.isFailed()).isTrue();
        assertThat(result.failureMessage()).startsWith("plumber:");
        assertThat(result.items()).hasSize(1);
        verify(provider, times(2)).search(eq(unit), eq("plumber"), anyInt());
    }

    @Test
    void testBudgetDenialReturnsWhatWasFound() throws Exception {
        // Given - each search reserves 0.5; after the first one spends 0.01 the second no longer fits
        when(provider.search(eq(unit), eq("plumber"), anyInt())).thenReturn(List.of(record("p1", "a@x.example")));

        // When
        DiscoveryResult result = stage.discover(unit, context("0.5", "plumber", "roofer"));

        // Then
        assertThat(result.isHalted()).isTrue();
        assertThat(result.denial().capability()).isEqualTo(Capability.DISCOVERY);
        assertThat(result.items()).extracting(WorkItem::getExternalId).containsExactly("p1");
        verify(provider, never()).search(eq(unit), eq("roofer"), anyInt());
    }

    @Test
    void testEnrichersFillMissingEmailsInOrder() throws Exception {
        // Given
        RawRecord noEmail = record("p2", null);
        RawRecord stillNoEmail = record("p3", " ");
        when(provider.search(unit, "plumber", 100)).thenReturn(List.of(
                record("p1", "a@x.example"), noEmail, stillNoEmail));
        when(facebook.findEmail(noEmail)).thenReturn(Optional.empty());
        when(facebook.findEmail(stillNoEmail)).thenReturn(Optional.empty());
        when(linkedin.source()).thenReturn("linkedin");
        when(linkedin.findEmail(noEmail)).thenReturn(Optional.of(" owner@p2.example "));
        when(linkedin.findEmail(stillNoEmail)).thenReturn(Optional.empty());
        StageContext context = context("10", "plumber");

        // When
        DiscoveryResult result = stageWith(List.of(facebook, linkedin), EngineFixture.CLOCK).discover(unit, context);

        // Then
        assertThat(result.items()).extracting(WorkItem::getExternalId).containsExactly("p1", "p2");
        WorkItem enriched = result.items().get(1);
        assertThat(enriched.getContactChannel()).isEqualTo("owner@p2.example");
        assertThat(enriched.getProfile()).containsEntry("contact_source", "linkedin");
        assertThat(result.contactsEnriched()).isEqualTo(1);
        assertThat(result.withoutContact()).isEqualTo(1);
        assertThat(result.isFailed()).isFalse();
        assertThat(context.account().getLedger().get(Capability.CONTACT_ENRICHMENT).getCallsMade()).isEqualTo(4);

        InOrder order = inOrder(facebook, linkedin);
        order.verify(facebook).findEmail(noEmail);
        order.verify(linkedin).findEmail(noEmail);
    }

    @Test
    void testEnricherFailureDoesNotFailTheUnit() throws Exception {
        // Given
        RawRecord noEmail = record("p2", null);
        when(provider.search(unit, "plumber", 100)).thenReturn(List.of(record("p1", "a@x.example"), noEmail));
        when(facebook.source()).thenReturn("facebook");
        when(facebook.findEmail(noEmail)).thenThrow(new CapabilityException("Graph API returned 500"));
        when(linkedin.source()).thenReturn("linkedin");
        when(linkedin.findEmail(noEmail)).thenReturn(Optional.of("owner@p2.example"));

        // When
        DiscoveryResult result = stageWith(List.of(facebook, linkedin), EngineFixture.CLOCK)
                .discover(unit, context("10", "plumber"));

        // Then
        assertThat(result.isFailed()).isFalse();
        assertThat(result.items()).extracting(WorkItem::getContactChannel)
                .containsExactly("a@x.example", "owner@p2.example");
        assertThat(result.items().get(1).getProfile()).containsEntry("contact_source", "linkedin");
    }

    @Test
    void testRecordFoundWithEmailUnderAnotherKeywordIsNotEnriched() throws Exception {
        // Given
        when(provider.search(unit, "plumber", 50)).thenReturn(List.of(record("shared", null)));
        when(provider.search(unit, "roofer", 50)).thenReturn(List.of(record("shared", "s@x.example")));

        // When
        DiscoveryResult result = stageWith(List.of(facebook), EngineFixture.CLOCK)
                .discover(unit, context("10", "plumber", "roofer"));

        // Then
        assertThat(result.items()).extracting(WorkItem::getContactChannel).containsExactly("s@x.example");
        assertThat(result.withoutContact()).isZero();
        verifyNoInteractions(facebook);
    }

    @Test
    void testDiscoveryTimeoutFailsTheUnitAndSkipsRemainingKeywords() throws Exception {
        // Given
        MutableClock clock = MutableClock.startingAt(EngineFixture.CLOCK);
        when(provider.search(eq(unit), eq("plumber"), anyInt())).thenAnswer(invocation -> {
            clock.advance(Duration.ofMinutes(31));
            return List.of(record("p1", "a@x.example"));
        });

        // When
        DiscoveryResult result = stageWith(List.of(), clock).discover(unit, context("10", "plumber", "roofer"));

        // Then
        assertThat(result.isFailed()).isTrue();
        assertThat(result.failureMessage()).isEqualTo("Discovery timed out after PT30M");
        assertThat(result.items()).extracting(WorkItem::getExternalId).containsExactly("p1");
        verify(provider, never()).search(eq(unit), eq("roofer"), anyInt());
    }
}
