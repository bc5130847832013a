package com.leadgen.backend.support;

import com.leadgen.backend.config.CostCatalogProperties;
import com.leadgen.backend.config.EngineProperties;
import com.leadgen.backend.config.RateBudgetProperties;
import com.leadgen.backend.config.ResearchProperties;
import com.leadgen.backend.services.budget.CostCatalog;
import com.leadgen.backend.services.budget.RateBudgetScheduler;
import com.leadgen.backend.services.campaign.CampaignExecutionService;
import com.leadgen.backend.services.campaign.CampaignService;
import com.leadgen.backend.services.coverage.CoveragePlanner;
import com.leadgen.backend.services.coverage.DensityTable;
import com.leadgen.backend.services.pipeline.DiscoverStage;
import com.leadgen.backend.services.pipeline.DomainThrottle;
import com.leadgen.backend.services.pipeline.EnrichmentPipeline;
import com.leadgen.backend.services.pipeline.ResearchStage;
import com.leadgen.backend.services.pipeline.SummarizeStage;
import com.leadgen.backend.services.pipeline.VerifyStage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Fully wired engine over fakes and the in-memory store. Executors run tasks on the calling
 * thread unless a test passes its own, so a whole campaign runs inside {@code start}.
 */
public class EngineFixture {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC);

    public final InMemoryCampaignStateStore store = new InMemoryCampaignStateStore();
    public final FakeDiscoveryProvider discovery = new FakeDiscoveryProvider();
    public final FakeContentFetcher fetcher = new FakeContentFetcher();
    public final FakeSummarizer summarizer = new FakeSummarizer();
    public final FakeVerifier verifier = new FakeVerifier();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final Map<String, DensityTable> densityTables = new HashMap<>();

    public final CostCatalog costCatalog;
    public final RateBudgetScheduler scheduler;
    public final CampaignExecutionService engine;
    public final CampaignService campaigns;

    public EngineFixture() {
        this(freeCosts(), research(0), Runnable::run);
    }

    public EngineFixture(CostCatalogProperties costs, ResearchProperties research, Executor itemWorkers) {
        this(costs, research, itemWorkers, EngineProperties.defaults(), CLOCK);
    }

    public EngineFixture(CostCatalogProperties costs, ResearchProperties research, Executor itemWorkers,
                         EngineProperties engineProperties, Clock clock) {
        RateBudgetProperties limits = new RateBudgetProperties(null,
                new RateBudgetProperties.Backoff(Duration.ZERO, Duration.ZERO, 2));

        costCatalog = new CostCatalog(costs, research);
        scheduler = new RateBudgetScheduler(limits, clock, duration -> { });
        DomainThrottle throttle = new DomainThrottle(research, clock, duration -> { });

        DiscoverStage discoverStage = new DiscoverStage(discovery, List.of(), scheduler, costCatalog,
                engineProperties, clock);
        EnrichmentPipeline pipeline = new EnrichmentPipeline(List.of(
                new ResearchStage(fetcher, scheduler, costCatalog, throttle, research),
                new SummarizeStage(summarizer, scheduler, costCatalog),
                new VerifyStage(verifier, scheduler, costCatalog)), meterRegistry);

        engine = new CampaignExecutionService(store, scheduler, discoverStage, pipeline, costCatalog,
                engineProperties, clock, meterRegistry, Runnable::run, itemWorkers);
        campaigns = new CampaignService(store, engine, new CoveragePlanner(),
                region -> densityTables.getOrDefault(region, DensityTable.empty(region)),
                costCatalog, engineProperties, clock);
    }

    /**
     * Every call free, so budgets never interfere.
     */
    public static CostCatalogProperties freeCosts() {
        return costs("0", "0", "0", "0");
    }

    /**
     * Flat prices per call with token pricing switched off.
     */
    public static CostCatalogProperties costs(String discoveryPerResult, String researchPerFetch,
                                              String summarizerPerCall, String verifierPerCall) {
        return new CostCatalogProperties(new BigDecimal(discoveryPerResult), new BigDecimal(researchPerFetch),
                new BigDecimal(summarizerPerCall), BigDecimal.ZERO, BigDecimal.ZERO, 2000, 400,
                new BigDecimal(verifierPerCall), BigDecimal.ZERO);
    }

    public static ResearchProperties research(int maxLinks) {
        return new ResearchProperties(maxLinks, 524288L, 4000, Duration.ofSeconds(7), "test-agent",
                Duration.ZERO, 3, Duration.ofMinutes(30), Duration.ofHours(1));
    }
}
