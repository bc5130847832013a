package com.leadgen.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "leadgen.anthropic")
public record AnthropicProperties(
        String apiKey,
        @DefaultValue("https://api.anthropic.com/v1/messages") String url,
        @DefaultValue("claude-3-5-haiku-20241022") String model,
        @DefaultValue("2023-06-01") String version,
        @DefaultValue("400") int maxTokens
) {
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
