package com.leadgen.backend.integrations;

import lombok.Builder;

import java.util.Map;

/**
 * A business record as returned by the discovery provider, before it becomes a work item.
 */
@Builder(toBuilder = true)
public record RawRecord(
        String externalId,
        String name,
        String email,
        String phone,
        String website,
        String address,
        String category,
        Double rating,
        Integer reviewCount,
        Map<String, Object> attributes
) {
    public boolean hasContactChannel() {
        return email != null && !email.isBlank();
    }
}
