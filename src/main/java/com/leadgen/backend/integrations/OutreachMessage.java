package com.leadgen.backend.integrations;

public record OutreachMessage(String subject, String body, int inputTokens, int outputTokens) {

    public boolean isUsable() {
        return body != null && !body.isBlank();
    }
}
