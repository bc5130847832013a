package com.leadgen.backend.integrations;

public record Summary(String text, int inputTokens, int outputTokens) {

    public boolean isUsable() {
        return text != null && !text.isBlank();
    }
}
