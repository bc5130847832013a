package com.leadgen.backend.services.pipeline;

import com.leadgen.backend.models.WorkItem;
import com.leadgen.backend.services.budget.Denial;

import java.math.BigDecimal;
import java.util.List;

/**
 * Records found for one coverage unit.
 *
 * @param items            new work items, de-duplicated and with a contact channel
 * @param rawResults       records returned by the provider before filtering
 * @param withoutContact   distinct records dropped because they still had no contact channel after enrichment
 * @param contactsEnriched distinct records whose email came from a contact enricher
 * @param cost             actual discovery and contact enrichment cost for the unit
 * @param failureMessage   set when a keyword search failed or discovery ran out of time
 * @param denial           set when the budget ran out before discovery finished
 */
public record DiscoveryResult(
        List<WorkItem> items,
        int rawResults,
        int withoutContact,
        int contactsEnriched,
        BigDecimal cost,
        String failureMessage,
        Denial denial
) {
    public boolean isFailed() {
        return failureMessage != null;
    }

    public boolean isHalted() {
        return denial != null;
    }
}
