package com.leadgen.backend.integrations;

import java.util.Optional;

/**
 * Looks up an email for a discovered business that came without one, e.g. from its
 * social media profiles. Enrichers are optional beans tried in {@code @Order}.
 */
public interface ContactEnricher {

    /**
     * Short name recorded on enriched items as their {@code contact_source}.
     */
    String source();

    /**
     * @return the email found for the business, or empty when this source has none
     */
    Optional<String> findEmail(RawRecord record) throws CapabilityException;
}
