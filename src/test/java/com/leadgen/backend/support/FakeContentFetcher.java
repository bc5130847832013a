package com.leadgen.backend.support;

import com.leadgen.backend.integrations.CapabilityException;
import com.leadgen.backend.integrations.ContentFetcher;
import com.leadgen.backend.integrations.FetchedContent;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Serves a small HTML page for every URL unless told otherwise.
 */
public class FakeContentFetcher implements ContentFetcher {

    private final Map<String, String> pages = new HashMap<>();
    private final Map<String, CapabilityException> failures = new HashMap<>();
    private final List<String> calls = new ArrayList<>();
    private final List<Long> limits = new ArrayList<>();
    private CapabilityException failEverything;

    public FakeContentFetcher withPage(String url, String html) {
        pages.put(url, html);
        return this;
    }

    public FakeContentFetcher failing(String url, CapabilityException failure) {
        failures.put(url, failure);
        return this;
    }

    public FakeContentFetcher failingEverything(CapabilityException failure) {
        failEverything = failure;
        return this;
    }

    public synchronized List<String> calls() {
        return new ArrayList<>(calls);
    }

    /**
     * Byte limits passed with each fetch, in call order. Pages are served whole regardless.
     */
    public synchronized List<Long> limits() {
        return new ArrayList<>(limits);
    }

    @Override
    public synchronized Optional<FetchedContent> fetch(String url, long maxBytes) throws CapabilityException {
        calls.add(url);
        limits.add(maxBytes);
        if (failEverything != null) {
            throw failEverything;
        }
        CapabilityException failure = failures.get(url);
        if (failure != null) {
            throw failure;
        }
        String html = pages.getOrDefault(url,
                "<html><head><title>Home</title></head><body><p>We fix pipes at " + url + "</p></body></html>");
        return Optional.of(new FetchedContent(url, "text/html", html));
    }
}
