package com.leadgen.backend.models;

import com.leadgen.backend.enums.FailureReason;
import com.leadgen.backend.enums.ProcessingStage;
import com.leadgen.backend.enums.VerificationStatus;
import com.leadgen.backend.util.JsonConverters;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@Table(name = "work_items",
        uniqueConstraints = @UniqueConstraint(name = "uk_work_item_external", columnNames = {"campaign_id", "external_id"}),
        indexes = {
                @Index(name = "idx_work_item_unit", columnList = "campaign_id, unit_rank"),
                @Index(name = "idx_work_item_stage", columnList = "campaign_id, processing_stage")
        })
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "campaign_id", nullable = false, updatable = false)
    private Long campaignId;

    @Column(name = "unit_rank", nullable = false)
    private Integer unitRank;

    @Column(name = "external_id", nullable = false, updatable = false)
    private String externalId;

    private String name;

    // Email address used for outreach; items without one are never stored
    @Column(name = "contact_channel", nullable = false)
    private String contactChannel;

    private String phone;

    private String website;

    private String address;

    private String category;

    private Double rating;

    @Column(name = "review_count")
    private Integer reviewCount;

    @Convert(converter = JsonConverters.MapConverter.class)
    @Column(name = "profile", columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> profile = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_stage", nullable = false, length = 16)
    @Builder.Default
    private ProcessingStage processingStage = ProcessingStage.DISCOVERED;

    @Convert(converter = JsonConverters.ResearchPayloadConverter.class)
    @Column(name = "research_payload", columnDefinition = "TEXT")
    private ResearchPayload researchPayload;

    @Column(name = "summary", columnDefinition = "TEXT")
    private String summary;

    @Column(name = "outreach_subject")
    private String outreachSubject;

    @Column(name = "outreach_message", columnDefinition = "TEXT")
    private String outreachMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_status", length = 16)
    private VerificationStatus verificationStatus;

    @Column(name = "confidence_score")
    private Integer confidenceScore;

    @Column(name = "verification_note", columnDefinition = "TEXT")
    private String verificationNote;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_stage", length = 16)
    private ProcessingStage failureStage;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", length = 32)
    private FailureReason failureReason;

    @Column(name = "failure_message", columnDefinition = "TEXT")
    private String failureMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public boolean isFailed() {
        return processingStage == ProcessingStage.FAILED;
    }

    /**
     * Moves the item to {@code next}. Only the immediate successor of the current stage is
     * accepted and a failed item never moves again.
     */
    public void advanceTo(ProcessingStage next) {
        if (isFailed()) {
            throw new IllegalStateException("Work item " + externalId + " is failed and frozen");
        }
        if (next == ProcessingStage.FAILED || next.previous() != processingStage) {
            throw new IllegalStateException("Work item " + externalId + " cannot move from "
                    + processingStage + " to " + next);
        }
        processingStage = next;
    }

    /**
     * Freezes the item as failed while attempting {@code attemptedStage}.
     */
    public void markFailed(ProcessingStage attemptedStage, FailureReason reason, String message) {
        if (isFailed()) {
            return;
        }
        failureStage = attemptedStage;
        failureReason = reason;
        failureMessage = message;
        processingStage = ProcessingStage.FAILED;
    }
}
