package com.leadgen.backend.enums;

public enum Capability {
    DISCOVERY("Discovery provider"),
    CONTACT_ENRICHMENT("Contact enricher"),
    RESEARCH("Research fetcher"),
    SUMMARIZER("AI summarizer"),
    VERIFIER("Contact verifier");

    private final String displayName;

    Capability(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
