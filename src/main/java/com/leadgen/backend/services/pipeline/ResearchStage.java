package com.leadgen.backend.services.pipeline;

import com.leadgen.backend.config.ResearchProperties;
import com.leadgen.backend.enums.Capability;
import com.leadgen.backend.enums.ProcessingStage;
import com.leadgen.backend.integrations.CapabilityException;
import com.leadgen.backend.integrations.ContentFetcher;
import com.leadgen.backend.integrations.FetchedContent;
import com.leadgen.backend.models.ResearchPayload;
import com.leadgen.backend.models.ResearchPayload.ResearchPage;
import com.leadgen.backend.models.WorkItem;
import com.leadgen.backend.services.budget.AcquireResult;
import com.leadgen.backend.services.budget.CostCatalog;
import com.leadgen.backend.services.budget.Denial;
import com.leadgen.backend.services.budget.Grant;
import com.leadgen.backend.services.budget.RateBudgetScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads a business website: the home page plus a few internal pages.
 * <p>
 * Research never fails an item. Unreachable sites, timeouts, throttling and blocked hosts
 * produce an empty or partial payload with a note, and the item still advances.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResearchStage implements ItemStage {

    private final ContentFetcher contentFetcher;
    private final RateBudgetScheduler scheduler;
    private final CostCatalog costCatalog;
    private final DomainThrottle domainThrottle;
    private final ResearchProperties properties;

    @Override
    public ProcessingStage target() {
        return ProcessingStage.RESEARCHED;
    }

    @Override
    public StageResult run(WorkItem item, StageContext context) {
        if (isDone(item)) {
            return StageResult.skipped(item);
        }

        String homeUrl = normalizeWebsite(item.getWebsite());
        if (homeUrl == null) {
            return advance(item, ResearchPayload.empty("No website"));
        }
        String host = LinkExtractor.hostOf(homeUrl);
        if (host == null) {
            return advance(item, ResearchPayload.empty("Invalid website URL: " + item.getWebsite()));
        }
        if (domainThrottle.isBlocked(host)) {
            return advance(item, ResearchPayload.empty("Host " + host + " blocked after repeated failures"));
        }

        FetchOutcome home = fetch(homeUrl, host, properties.maxTotalBytes(), context);
        if (home.denial != null) {
            return StageResult.halted(item, home.denial);
        }
        if (home.content == null) {
            log.info("Campaign {} item {} research degraded: {}", context.campaignId(), item.getExternalId(), home.note);
            return advance(item, ResearchPayload.empty(home.note));
        }

        List<ResearchPage> pages = new ArrayList<>();
        List<String> notes = new ArrayList<>();
        FetchedContent homeContent = home.content.truncatedTo(properties.maxTotalBytes());
        Document homeDocument = Jsoup.parse(homeContent.body(), homeUrl);
        pages.add(toPage(homeContent, homeDocument));
        long totalBytes = homeContent.byteCount();
        List<String> links = LinkExtractor.extract(homeDocument, homeUrl, properties.maxLinks());
        if (homeContent != home.content) {
            notes.add("Byte budget reached");
            links = List.of();
        }

        for (String link : links) {
            long remaining = properties.maxTotalBytes() - totalBytes;
            if (remaining <= 0) {
                notes.add("Byte budget reached");
                break;
            }
            if (domainThrottle.isBlocked(host)) {
                notes.add("Host blocked mid-research");
                break;
            }
            FetchOutcome page = fetch(link, host, remaining, context);
            if (page.denial != null) {
                return StageResult.halted(item, page.denial);
            }
            if (page.content == null) {
                notes.add(page.note);
                continue;
            }
            // Fetchers may ignore the limit, so the page is cut to what is left of the budget
            FetchedContent content = page.content.truncatedTo(remaining);
            pages.add(toPage(content, Jsoup.parse(content.body(), link)));
            totalBytes += content.byteCount();
            if (content != page.content) {
                notes.add("Byte budget reached");
                break;
            }
        }

        ResearchPayload payload = ResearchPayload.builder()
                .pages(pages)
                .totalBytes(totalBytes)
                .note(notes.isEmpty() ? null : String.join("; ", notes))
                .build();
        log.debug("Campaign {} item {} researched {} pages ({} bytes)",
                context.campaignId(), item.getExternalId(), pages.size(), totalBytes);
        return advance(item, payload);
    }

    private StageResult advance(WorkItem item, ResearchPayload payload) {
        item.setResearchPayload(payload);
        item.advanceTo(ProcessingStage.RESEARCHED);
        return StageResult.advanced(item);
    }

    private FetchOutcome fetch(String url, String host, long maxBytes, StageContext context) {
        AcquireResult<Grant> acquired = scheduler.acquire(context.account(), context.allowance(),
                Capability.RESEARCH, costCatalog.estimate(Capability.RESEARCH));
        if (!acquired.isGranted()) {
            return FetchOutcome.halted(acquired.getDenial());
        }

        Grant grant = acquired.get();
        boolean succeeded = false;
        try {
            domainThrottle.awaitTurn(host);
            Optional<FetchedContent> content = scheduler.call(grant, () -> contentFetcher.fetch(url, maxBytes));
            succeeded = true;
            domainThrottle.recordSuccess(host);
            return content.filter(c -> c.body() != null)
                    .map(FetchOutcome::fetched)
                    .orElseGet(() -> FetchOutcome.missing("Not found: " + url));
        } catch (CapabilityException e) {
            domainThrottle.recordFailure(host);
            return FetchOutcome.missing("Fetch failed for " + url + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchOutcome.missing("Interrupted before fetching " + url);
        } finally {
            scheduler.release(grant, succeeded ? costCatalog.researchCost(1) : BigDecimal.ZERO, succeeded);
        }
    }

    private ResearchPage toPage(FetchedContent content, Document document) {
        String text = document.body() != null ? document.body().text() : document.text();
        if (text.length() > properties.maxPageChars()) {
            text = text.substring(0, properties.maxPageChars());
        }
        return ResearchPage.builder()
                .url(content.url())
                .title(document.title())
                .text(text)
                .bytes(content.byteCount())
                .build();
    }

    static String normalizeWebsite(String website) {
        if (website == null || website.isBlank()) {
            return null;
        }
        String url = website.trim();
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            url = "https://" + url;
        }
        return url;
    }

    private static final class FetchOutcome {
        private final FetchedContent content;
        private final String note;
        private final Denial denial;

        private FetchOutcome(FetchedContent content, String note, Denial denial) {
            this.content = content;
            this.note = note;
            this.denial = denial;
        }

        static FetchOutcome fetched(FetchedContent content) {
            return new FetchOutcome(content, null, null);
        }

        static FetchOutcome missing(String note) {
            return new FetchOutcome(null, note, null);
        }

        static FetchOutcome halted(Denial denial) {
            return new FetchOutcome(null, null, denial);
        }
    }
}
