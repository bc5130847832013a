package com.leadgen.backend.support;

import com.leadgen.backend.integrations.CapabilityException;
import com.leadgen.backend.integrations.ContactProfile;
import com.leadgen.backend.integrations.OutreachMessage;
import com.leadgen.backend.integrations.Summarizer;
import com.leadgen.backend.integrations.Summary;

import java.util.ArrayList;
import java.util.List;

public class FakeSummarizer implements Summarizer {

    private final List<String> summarized = new ArrayList<>();
    private final List<String> composed = new ArrayList<>();
    private CapabilityException failure;
    private boolean unusable;

    public FakeSummarizer failingWith(CapabilityException exception) {
        this.failure = exception;
        return this;
    }

    public FakeSummarizer returningNothing() {
        this.unusable = true;
        return this;
    }

    public synchronized List<String> summarized() {
        return new ArrayList<>(summarized);
    }

    public synchronized List<String> composed() {
        return new ArrayList<>(composed);
    }

    @Override
    public synchronized Summary summarize(String content) throws CapabilityException {
        summarized.add(content);
        if (failure != null) {
            throw failure;
        }
        return new Summary(unusable ? "" : "Summary: " + content.lines().findFirst().orElse(""), 100, 20);
    }

    @Override
    public synchronized OutreachMessage compose(ContactProfile profile, List<String> summaries)
            throws CapabilityException {
        composed.add(profile.name());
        if (failure != null) {
            throw failure;
        }
        return new OutreachMessage("Quick question about " + profile.name(),
                "Hi " + profile.name() + ", loved what I read about you.", 150, 40);
    }
}
