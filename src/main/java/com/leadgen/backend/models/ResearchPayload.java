package com.leadgen.backend.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Website content gathered for a work item by the research stage.
 * An empty payload with a note is a valid result: research never fails an item.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchPayload {

    @Builder.Default
    private List<ResearchPage> pages = new ArrayList<>();

    private long totalBytes;

    // Set when research degraded (site unreachable, blocked domain, byte budget hit)
    private String note;

    public static ResearchPayload empty(String note) {
        return ResearchPayload.builder().note(note).build();
    }

    public boolean hasContent() {
        return pages != null && pages.stream().anyMatch(p -> p.getText() != null && !p.getText().isBlank());
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResearchPage {
        private String url;
        private String title;
        private String text;
        private long bytes;
    }
}
