package com.leadgen.backend.services.pipeline;

import com.leadgen.backend.config.CostCatalogProperties;
import com.leadgen.backend.config.RateBudgetProperties;
import com.leadgen.backend.config.ResearchProperties;
import com.leadgen.backend.enums.ProcessingStage;
import com.leadgen.backend.integrations.CapabilityException;
import com.leadgen.backend.integrations.ThrottledException;
import com.leadgen.backend.models.ResearchPayload;
import com.leadgen.backend.models.WorkItem;
import com.leadgen.backend.services.budget.BudgetAccount;
import com.leadgen.backend.services.budget.CostCatalog;
import com.leadgen.backend.services.budget.LedgerListener;
import com.leadgen.backend.services.budget.RateBudgetScheduler;
import com.leadgen.backend.support.EngineFixture;
import com.leadgen.backend.support.FakeContentFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ResearchStageTest {

    private static final String HOME = "https://joes-plumbing.example";

    private FakeContentFetcher fetcher;
    private RateBudgetScheduler scheduler;
    private ResearchStage stage;

    @BeforeEach
    void setUp() {
        fetcher = new FakeContentFetcher();
        scheduler = new RateBudgetScheduler(new RateBudgetProperties(null,
                new RateBudgetProperties.Backoff(Duration.ZERO, Duration.ZERO, 1)), EngineFixture.CLOCK, d -> { });
        stage = stageWith(EngineFixture.costs("0", "0.01", "0", "0"));
    }

    private ResearchStage stageWith(CostCatalogProperties costs) {
        return new ResearchStage(fetcher, scheduler, new CostCatalog(costs, EngineFixture.research(2)),
                new DomainThrottle(EngineFixture.research(2), EngineFixture.CLOCK, d -> { }),
                EngineFixture.research(2));
    }

    private StageContext context(String ceiling) {
        BudgetAccount account = scheduler.openAccount(1L, new BigDecimal(ceiling), BigDecimal.ZERO, Map.of(),
                LedgerListener.NONE);
        return new StageContext(1L, List.of("plumber"), account, null);
    }

    private WorkItem item(String website) {
        return WorkItem.builder()
                .campaignId(1L)
                .unitRank(0)
                .externalId("joe")
                .name("Joe's Plumbing")
                .contactChannel("joe@joes-plumbing.example")
                .website(website)
                .build();
    }

    @Test
    void testReadsHomePageAndLinkedPages() {
        // Given
        fetcher.withPage(HOME, "<html><head><title>Joe's</title></head><body><p>Family plumbers since 1982.</p>" +
                        "<a href='/services'>Services</a><a href='/about'>About</a><a href='/contact'>Contact</a>" +
                        "<a href='/reviews'>Reviews</a></body></html>")
                .withPage(HOME + "/services", "<html><body><p>Drains, water heaters.</p></body></html>");
        WorkItem item = item("joes-plumbing.example");
        StageContext context = context("1");

        // When
        StageResult result = stage.run(item, context);

        // Then
        assertThat(result.isAdvanced()).isTrue();
        assertThat(item.getProcessingStage()).isEqualTo(ProcessingStage.RESEARCHED);
        ResearchPayload payload = item.getResearchPayload();
        assertThat(payload.getPages()).hasSize(3);
        assertThat(payload.getPages().get(0).getTitle()).isEqualTo("Joe's");
        assertThat(payload.getPages().get(0).getText()).contains("Family plumbers");
        assertThat(payload.getPages().get(1).getText()).contains("water heaters");
        assertThat(fetcher.calls()).containsExactly(HOME, HOME + "/services", HOME + "/about");
        assertThat(payload.getNote()).isNull();
        assertThat(context.account().getCommitted()).isEqualByComparingTo("0.03");
    }

    @Test
    void testByteBudgetCoversAllPagesOfOneSite() {
        // Given
        ResearchProperties smallBudget = new ResearchProperties(2, 1000L, 4000, Duration.ofSeconds(7), "test-agent",
                Duration.ZERO, 3, Duration.ofMinutes(30), Duration.ofHours(1));
        ResearchStage budgeted = new ResearchStage(fetcher, scheduler,
                new CostCatalog(EngineFixture.costs("0", "0.01", "0", "0"), smallBudget),
                new DomainThrottle(smallBudget, EngineFixture.CLOCK, d -> { }), smallBudget);
        String homeHtml = "<html><body><a href='/about'>About</a><p>" + "x".repeat(900) + "</p></body></html>";
        fetcher.withPage(HOME, homeHtml)
                .withPage(HOME + "/about", "<html><body><p>" + "y".repeat(950) + "</p></body></html>");
        WorkItem item = item(HOME);

        // When
        StageResult result = budgeted.run(item, context("1"));

        // Then
        assertThat(result.isAdvanced()).isTrue();
        ResearchPayload payload = item.getResearchPayload();
        assertThat(payload.getTotalBytes()).isEqualTo(1000L);
        assertThat(payload.getPages()).hasSize(2);
        assertThat(payload.getPages().get(1).getBytes()).isEqualTo(1000L - homeHtml.length());
        assertThat(payload.getNote()).contains("Byte budget reached");
        assertThat(fetcher.limits()).containsExactly(1000L, 1000L - homeHtml.length());
    }

    @Test
    void testUnreachableSiteAdvancesWithEmptyPayload() {
        // Given
        fetcher.failing(HOME, new CapabilityException("Timed out fetching " + HOME));
        WorkItem item = item(HOME);
        StageContext context = context("1");

        // When
        StageResult result = stage.run(item, context);

        // Then
        assertThat(result.isAdvanced()).isTrue();
        assertThat(item.getResearchPayload().hasContent()).isFalse();
        assertThat(item.getResearchPayload().getNote()).contains("Timed out");
        // Failed fetches are not charged
        assertThat(context.account().getCommitted()).isEqualByComparingTo("0");
    }

    @Test
    void testThrottledSiteIsRetriedThenDegrades() {
        // Given
        fetcher.failingEverything(new ThrottledException("429"));
        WorkItem item = item(HOME);

        // When
        StageResult result = stage.run(item, context("1"));

        // Then
        assertThat(result.isAdvanced()).isTrue();
        assertThat(fetcher.calls()).hasSize(2);
        assertThat(item.getResearchPayload().getNote()).contains("still throttled");
    }

    @Test
    void testItemWithoutWebsiteAdvances() {
        // Given
        WorkItem item = item(null);

        // When
        StageResult result = stage.run(item, context("1"));

        // Then
        assertThat(result.isAdvanced()).isTrue();
        assertThat(item.getResearchPayload().getNote()).isEqualTo("No website");
        assertThat(fetcher.calls()).isEmpty();
    }

    @Test
    void testBudgetDenialHaltsWithoutChangingTheItem() {
        // Given
        WorkItem item = item(HOME);

        // When
        StageResult result = stage.run(item, context("0.005"));

        // Then
        assertThat(result.isHalted()).isTrue();
        assertThat(result.getDenial()).isNotNull();
        assertThat(item.getProcessingStage()).isEqualTo(ProcessingStage.DISCOVERED);
        assertThat(item.getResearchPayload()).isNull();
        assertThat(fetcher.calls()).isEmpty();
    }

    @Test
    void testSkipsItemAlreadyResearched() {
        // Given
        WorkItem item = item(HOME);
        item.setProcessingStage(ProcessingStage.SUMMARIZED);

        // Then
        assertThat(stage.run(item, context("1")).getOutcome()).isEqualTo(StageResult.Outcome.SKIPPED);
        assertThat(fetcher.calls()).isEmpty();
    }

    @Test
    void testNormalizeWebsite() {
        assertThat(ResearchStage.normalizeWebsite(" example.com ")).isEqualTo("https://example.com");
        assertThat(ResearchStage.normalizeWebsite("http://example.com")).isEqualTo("http://example.com");
        assertThat(ResearchStage.normalizeWebsite(" ")).isNull();
    }
}
