package com.leadgen.backend.integrations;

import java.nio.charset.StandardCharsets;

/**
 * Body of a fetched web resource. {@code body} is the raw HTML as received.
 */
public record FetchedContent(String url, String contentType, String body) {

    public long byteCount() {
        return body == null ? 0 : body.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * The same content cut to at most {@code maxBytes} UTF-8 bytes, never splitting a character.
     */
    public FetchedContent truncatedTo(long maxBytes) {
        if (body == null || byteCount() <= maxBytes) {
            return this;
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        int end = (int) Math.max(0, maxBytes);
        // Step back over continuation bytes so the cut lands on a character boundary
        while (end > 0 && (bytes[end] & 0xC0) == 0x80) {
            end--;
        }
        return new FetchedContent(url, contentType, new String(bytes, 0, end, StandardCharsets.UTF_8));
    }
}
