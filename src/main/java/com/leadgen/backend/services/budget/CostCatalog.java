package com.leadgen.backend.services.budget;

import com.leadgen.backend.config.CostCatalogProperties;
import com.leadgen.backend.config.ResearchProperties;
import com.leadgen.backend.enums.Capability;
import com.leadgen.backend.enums.ProcessingStage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Estimated and actual cost of capability calls, in USD.
 */
@Component
@RequiredArgsConstructor
public class CostCatalog {

    private static final int SCALE = 6;
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final CostCatalogProperties costs;
    private final ResearchProperties research;

    /**
     * Pre-call estimate for one call. Discovery is priced per result, see {@link #discoveryCost(int)}.
     */
    public BigDecimal estimate(Capability capability) {
        return switch (capability) {
            case DISCOVERY -> scale(costs.discoveryPerResult());
            case CONTACT_ENRICHMENT -> scale(costs.contactEnrichmentPerLookup());
            case RESEARCH -> scale(costs.researchPerFetch());
            case SUMMARIZER -> summarizerCost(costs.summarizerEstimatedInputTokens(),
                    costs.summarizerEstimatedOutputTokens());
            case VERIFIER -> scale(costs.verifierPerCall());
        };
    }

    public BigDecimal discoveryCost(int results) {
        return scale(costs.discoveryPerResult().multiply(BigDecimal.valueOf(Math.max(results, 0))));
    }

    public BigDecimal researchCost(int fetches) {
        return scale(costs.researchPerFetch().multiply(BigDecimal.valueOf(Math.max(fetches, 0))));
    }

    public BigDecimal summarizerCost(int inputTokens, int outputTokens) {
        BigDecimal input = costs.summarizerInputPerThousandTokens()
                .multiply(BigDecimal.valueOf(Math.max(inputTokens, 0)))
                .divide(THOUSAND, SCALE, RoundingMode.HALF_UP);
        BigDecimal output = costs.summarizerOutputPerThousandTokens()
                .multiply(BigDecimal.valueOf(Math.max(outputTokens, 0)))
                .divide(THOUSAND, SCALE, RoundingMode.HALF_UP);
        return scale(costs.summarizerPerCall().add(input).add(output));
    }

    /**
     * Cost of taking one work item through research, both summarizer calls and verification,
     * assuming every linked page is read.
     */
    public BigDecimal projectedItemCost() {
        return projectedItemCost(ProcessingStage.DISCOVERED);
    }

    /**
     * Cost of the stages still ahead of an item at {@code current}.
     */
    public BigDecimal projectedItemCost(ProcessingStage current) {
        BigDecimal total = BigDecimal.ZERO;
        if (!current.isAtOrPast(ProcessingStage.RESEARCHED)) {
            total = total.add(researchCost(1 + Math.max(research.maxLinks(), 0)));
        }
        if (!current.isAtOrPast(ProcessingStage.SUMMARIZED)) {
            total = total.add(estimate(Capability.SUMMARIZER).multiply(BigDecimal.valueOf(2)));
        }
        if (!current.isAtOrPast(ProcessingStage.VERIFIED)) {
            total = total.add(estimate(Capability.VERIFIER));
        }
        return scale(total);
    }

    /**
     * Rough campaign cost when every expected business is discovered and enriched.
     */
    public BigDecimal estimateCampaign(int expectedBusinesses) {
        BigDecimal perBusiness = costs.discoveryPerResult().add(projectedItemCost());
        return scale(perBusiness.multiply(BigDecimal.valueOf(Math.max(expectedBusinesses, 0))));
    }

    private static BigDecimal scale(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }
}
