package com.leadgen.backend.integrations;

import java.util.List;

/**
 * AI capability used by the summarize stage. Implementations apply their own retry
 * policy; a returned value that is not usable means the capability gave up.
 */
public interface Summarizer {

    Summary summarize(String content) throws CapabilityException;

    OutreachMessage compose(ContactProfile profile, List<String> summaries) throws CapabilityException;
}
