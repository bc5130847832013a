package com.leadgen.backend.integrations;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadgen.backend.config.AnthropicProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * {@link Summarizer} backed by the Anthropic messages API. Token usage from the response
 * is reported so the caller can price each call.
 */
@Component
@Slf4j
public class ClaudeSummarizer implements Summarizer {

    static final int MAX_CONTENT_CHARS = 12000;
    static final int MAX_SUBJECT_CHARS = 50;

    private static final String SUMMARY_SYSTEM_PROMPT =
            "You summarize small business websites for a sales team. " +
            "Write 3-5 plain sentences covering what the business does, who it serves " +
            "and anything distinctive. Never invent facts that are not in the text.";

    private static final String OUTREACH_SYSTEM_PROMPT =
            "You are a helpful, intelligent sales assistant. Write a short, personal cold email opener " +
            "(2-4 sentences) for the business described, plus a specific subject line of 25-45 characters. " +
            "Always answer with JSON: {\"subject_line\": \"...\", \"icebreaker\": \"...\"}";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final AnthropicProperties properties;

    public ClaudeSummarizer(RestTemplate restTemplate, ObjectMapper objectMapper, AnthropicProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public Summary summarize(String content) throws CapabilityException {
        String text = content == null ? "" : content;
        if (text.length() > MAX_CONTENT_CHARS) {
            text = text.substring(0, MAX_CONTENT_CHARS);
        }
        Completion completion = complete(SUMMARY_SYSTEM_PROMPT, "Website content:\n\n" + text);
        return new Summary(completion.text(), completion.inputTokens(), completion.outputTokens());
    }

    @Override
    public OutreachMessage compose(ContactProfile profile, List<String> summaries) throws CapabilityException {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Business name: ").append(profile.name()).append('\n');
        if (profile.category() != null) {
            prompt.append("Business type: ").append(profile.category()).append('\n');
        }
        if (profile.address() != null) {
            prompt.append("Location: ").append(profile.address()).append('\n');
        }
        if (profile.rating() != null) {
            prompt.append("Google rating: ").append(profile.rating());
            if (profile.reviewCount() != null) {
                prompt.append(" from ").append(profile.reviewCount()).append(" reviews");
            }
            prompt.append('\n');
        }
        prompt.append("\nWebsite summaries:\n").append(String.join("\n\n", summaries));

        Completion completion = complete(OUTREACH_SYSTEM_PROMPT, prompt.toString());
        String subject = null;
        String body = completion.text();
        try {
            JsonNode parsed = objectMapper.readTree(extractJson(completion.text()));
            body = parsed.path("icebreaker").asText(null);
            subject = parsed.path("subject_line").asText(null);
        } catch (JsonProcessingException e) {
            log.debug("Outreach reply for '{}' was not JSON, using it as the message body", profile.name());
        }
        return new OutreachMessage(subjectFor(subject, profile.name()), body,
                completion.inputTokens(), completion.outputTokens());
    }

    private Completion complete(String systemPrompt, String userPrompt) throws CapabilityException {
        if (!properties.isConfigured()) {
            throw new CapabilityException("Anthropic API key not configured");
        }

        Map<String, Object> requestBody = Map.of(
                "model", properties.model(),
                "max_tokens", properties.maxTokens(),
                "system", systemPrompt,
                "messages", List.of(Map.of("role", "user", "content", userPrompt))
        );

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-api-key", properties.apiKey());
        headers.set("anthropic-version", properties.version());

        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.postForEntity(properties.url(), new HttpEntity<>(requestBody, headers), JsonNode.class);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 429 || status == 529) {
                throw new ThrottledException("Anthropic API returned " + status, e);
            }
            throw new CapabilityException("Anthropic API returned " + status + ": " + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new CapabilityException("Anthropic API unreachable: " + e.getMessage(), e);
        }

        JsonNode body = response.getBody();
        if (body == null) {
            return new Completion(null, 0, 0);
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode block : body.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText());
            }
        }
        JsonNode usage = body.path("usage");
        return new Completion(text.toString().trim(), usage.path("input_tokens").asInt(0),
                usage.path("output_tokens").asInt(0));
    }

    static String extractJson(String text) {
        if (text == null) {
            return "";
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        return start >= 0 && end > start ? text.substring(start, end + 1) : text;
    }

    static String subjectFor(String subject, String businessName) {
        String result = subject != null ? subject.trim() : "";
        if (result.isEmpty()) {
            String name = businessName != null ? businessName.trim() : "";
            result = name.isEmpty() ? "Quick question" : "Quick question about " + truncate(name, 20);
        }
        if (result.length() > MAX_SUBJECT_CHARS) {
            result = result.substring(0, MAX_SUBJECT_CHARS - 3) + "...";
        }
        return result;
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    private record Completion(String text, int inputTokens, int outputTokens) {
    }
}
