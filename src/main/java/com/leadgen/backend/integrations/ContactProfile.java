package com.leadgen.backend.integrations;

import lombok.Builder;

/**
 * Fields of a work item the AI capability may use when composing an outreach message.
 */
@Builder
public record ContactProfile(
        String name,
        String category,
        String address,
        String website,
        Double rating,
        Integer reviewCount
) {
}
