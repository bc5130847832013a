package com.leadgen.backend.services.pipeline;

import com.leadgen.backend.config.EngineProperties;
import com.leadgen.backend.enums.Capability;
import com.leadgen.backend.enums.ProcessingStage;
import com.leadgen.backend.integrations.CapabilityException;
import com.leadgen.backend.integrations.ContactEnricher;
import com.leadgen.backend.integrations.DiscoveryProvider;
import com.leadgen.backend.integrations.RawRecord;
import com.leadgen.backend.models.CoverageUnit;
import com.leadgen.backend.models.WorkItem;
import com.leadgen.backend.services.budget.AcquireResult;
import com.leadgen.backend.services.budget.CostCatalog;
import com.leadgen.backend.services.budget.Denial;
import com.leadgen.backend.services.budget.Grant;
import com.leadgen.backend.services.budget.ProviderThrottledException;
import com.leadgen.backend.services.budget.RateBudgetScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds businesses for one coverage unit, one provider search per keyword.
 * The unit's result budget is split evenly across keywords.
 * <p>
 * Records found without an email are handed to the configured {@link ContactEnricher}s before
 * the contact channel filter applies. Enrichment is best effort: a failing enricher never fails
 * the unit, and running out of enrichment time only leaves the remaining records without email.
 */
@Component
@Slf4j
public class DiscoverStage {

    static final String CONTACT_SOURCE = "contact_source";

    private final DiscoveryProvider discoveryProvider;
    private final List<ContactEnricher> contactEnrichers;
    private final RateBudgetScheduler scheduler;
    private final CostCatalog costCatalog;
    private final EngineProperties engineProperties;
    private final Clock clock;

    @Autowired
    public DiscoverStage(DiscoveryProvider discoveryProvider, ObjectProvider<ContactEnricher> contactEnrichers,
                         RateBudgetScheduler scheduler, CostCatalog costCatalog,
                         EngineProperties engineProperties, Clock clock) {
        this(discoveryProvider, contactEnrichers.orderedStream().toList(), scheduler, costCatalog,
                engineProperties, clock);
    }

    public DiscoverStage(DiscoveryProvider discoveryProvider, List<ContactEnricher> contactEnrichers,
                         RateBudgetScheduler scheduler, CostCatalog costCatalog,
                         EngineProperties engineProperties, Clock clock) {
        this.discoveryProvider = discoveryProvider;
        this.contactEnrichers = List.copyOf(contactEnrichers);
        this.scheduler = scheduler;
        this.costCatalog = costCatalog;
        this.engineProperties = engineProperties;
        this.clock = clock;
    }

    public DiscoveryResult discover(CoverageUnit unit, StageContext context) {
        List<String> keywords = context.keywords();
        int perKeyword = Math.max(1, engineProperties.maxResultsPerUnit() / Math.max(1, keywords.size()));

        // Keyed by external id in first-seen order; a later copy with an email replaces one without
        Map<String, RawRecord> records = new LinkedHashMap<>();
        Tally tally = new Tally();
        List<String> failures = new ArrayList<>();
        Instant started = clock.instant();

        for (String keyword : keywords) {
            if (EngineProperties.isExpired(engineProperties.discoveryTimeout(), started, clock.instant())) {
                log.warn("Campaign {} unit {} discovery timed out before '{}'",
                        context.campaignId(), unit.getUnitKey(), keyword);
                failures.add("Discovery timed out after " + engineProperties.discoveryTimeout());
                break;
            }

            AcquireResult<Grant> acquired = scheduler.acquire(context.account(), null, Capability.DISCOVERY,
                    costCatalog.discoveryCost(perKeyword));
            if (!acquired.isGranted()) {
                log.info("Campaign {} unit {} discovery halted before '{}': {}",
                        context.campaignId(), unit.getUnitKey(), keyword, acquired.getDenial().message());
                return result(unit, records, tally, failures, acquired.getDenial());
            }

            Grant grant = acquired.get();
            BigDecimal actual = BigDecimal.ZERO;
            boolean succeeded = false;
            try {
                List<RawRecord> found = scheduler.call(grant,
                        () -> discoveryProvider.search(unit, keyword, perKeyword));
                succeeded = true;
                actual = costCatalog.discoveryCost(found.size());
                tally.rawResults += found.size();

                for (RawRecord record : found) {
                    if (record.externalId() == null || record.externalId().isBlank()) {
                        continue;
                    }
                    RawRecord existing = records.get(record.externalId());
                    if (existing == null || (!existing.hasContactChannel() && record.hasContactChannel())) {
                        records.put(record.externalId(), record);
                    }
                }
                log.debug("Campaign {} unit {} keyword '{}': {} records",
                        context.campaignId(), unit.getUnitKey(), keyword, found.size());
            } catch (ProviderThrottledException e) {
                log.warn("Campaign {} unit {} discovery throttled for '{}': {}",
                        context.campaignId(), unit.getUnitKey(), keyword, e.getMessage());
                failures.add(keyword + ": " + e.getMessage());
            } catch (CapabilityException e) {
                log.warn("Campaign {} unit {} discovery failed for '{}': {}",
                        context.campaignId(), unit.getUnitKey(), keyword, e.getMessage());
                failures.add(keyword + ": " + e.getMessage());
            } finally {
                scheduler.release(grant, actual, succeeded);
            }
            tally.cost = tally.cost.add(actual);
        }

        Denial denial = enrichContacts(unit, context, records, tally);
        DiscoveryResult result = result(unit, records, tally, failures, denial);
        log.info("Campaign {} unit {} ({}) discovered {} items from {} records, {} enriched, {} without contact channel",
                context.campaignId(), unit.getRank(), unit.getUnitKey(), result.items().size(), tally.rawResults,
                tally.contactsEnriched, result.withoutContact());
        return result;
    }

    /**
     * Tries every enricher on each record still missing an email.
     *
     * @return the denial that stopped enrichment, or null
     */
    private Denial enrichContacts(CoverageUnit unit, StageContext context, Map<String, RawRecord> records,
                                  Tally tally) {
        if (contactEnrichers.isEmpty()) {
            return null;
        }
        Instant started = clock.instant();
        for (Map.Entry<String, RawRecord> entry : records.entrySet()) {
            if (entry.getValue().hasContactChannel()) {
                continue;
            }
            if (EngineProperties.isExpired(engineProperties.contactEnrichmentTimeout(), started, clock.instant())) {
                log.warn("Campaign {} unit {} contact enrichment timed out after {}, remaining records keep no email",
                        context.campaignId(), unit.getUnitKey(), engineProperties.contactEnrichmentTimeout());
                return null;
            }
            for (ContactEnricher enricher : contactEnrichers) {
                AcquireResult<Grant> acquired = scheduler.acquire(context.account(), null,
                        Capability.CONTACT_ENRICHMENT, costCatalog.estimate(Capability.CONTACT_ENRICHMENT));
                if (!acquired.isGranted()) {
                    log.info("Campaign {} unit {} contact enrichment halted: {}",
                            context.campaignId(), unit.getUnitKey(), acquired.getDenial().message());
                    return acquired.getDenial();
                }
                Optional<RawRecord> enriched = lookUp(enricher, entry.getValue(), acquired.get(), tally);
                if (enriched.isPresent()) {
                    entry.setValue(enriched.get());
                    tally.contactsEnriched++;
                    break;
                }
            }
        }
        return null;
    }

    private Optional<RawRecord> lookUp(ContactEnricher enricher, RawRecord record, Grant grant, Tally tally) {
        BigDecimal actual = BigDecimal.ZERO;
        boolean succeeded = false;
        try {
            Optional<String> email = scheduler.call(grant, () -> enricher.findEmail(record));
            succeeded = true;
            actual = costCatalog.estimate(Capability.CONTACT_ENRICHMENT);
            return email.filter(e -> !e.isBlank()).map(e -> withEmail(record, e.trim(), enricher.source()));
        } catch (CapabilityException e) {
            log.warn("Contact enricher '{}' failed for {}: {}", enricher.source(), record.externalId(), e.getMessage());
            return Optional.empty();
        } finally {
            scheduler.release(grant, actual, succeeded);
            tally.cost = tally.cost.add(actual);
        }
    }

    private static RawRecord withEmail(RawRecord record, String email, String source) {
        Map<String, Object> attributes = record.attributes() != null
                ? new LinkedHashMap<>(record.attributes()) : new LinkedHashMap<>();
        attributes.put(CONTACT_SOURCE, source);
        return record.toBuilder().email(email).attributes(attributes).build();
    }

    private DiscoveryResult result(CoverageUnit unit, Map<String, RawRecord> records, Tally tally,
                                   List<String> failures, Denial denial) {
        List<RawRecord> withContact = new ArrayList<>();
        for (RawRecord record : records.values()) {
            if (record.hasContactChannel()) {
                withContact.add(record);
            }
        }
        return new DiscoveryResult(toItems(unit, withContact), tally.rawResults,
                records.size() - withContact.size(), tally.contactsEnriched, tally.cost, joined(failures), denial);
    }

    private List<WorkItem> toItems(CoverageUnit unit, Iterable<RawRecord> records) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<WorkItem> items = new ArrayList<>();
        for (RawRecord record : records) {
            items.add(WorkItem.builder()
                    .campaignId(unit.getCampaignId())
                    .unitRank(unit.getRank())
                    .externalId(record.externalId())
                    .name(record.name())
                    .contactChannel(record.email().trim())
                    .phone(record.phone())
                    .website(record.website())
                    .address(record.address())
                    .category(record.category())
                    .rating(record.rating())
                    .reviewCount(record.reviewCount())
                    .profile(record.attributes() != null ? new LinkedHashMap<>(record.attributes()) : new LinkedHashMap<>())
                    .processingStage(ProcessingStage.DISCOVERED)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
        }
        return items;
    }

    private static String joined(List<String> failures) {
        return failures.isEmpty() ? null : String.join("; ", failures);
    }

    private static final class Tally {
        private int rawResults;
        private int contactsEnriched;
        private BigDecimal cost = BigDecimal.ZERO;
    }
}
