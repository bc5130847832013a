package com.leadgen.backend.dto.campaign;

import com.leadgen.backend.enums.FailureReason;
import com.leadgen.backend.enums.ProcessingStage;
import com.leadgen.backend.enums.VerificationStatus;
import com.leadgen.backend.integrations.ConfidenceScore;
import com.leadgen.backend.models.WorkItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkItemResultDto {
    private Long id;
    private String externalId;
    private Integer unitRank;
    private String name;
    private String contactChannel;
    private String phone;
    private String website;
    private String address;
    private String category;
    private Double rating;
    private Integer reviewCount;
    private ProcessingStage processingStage;
    private String summary;
    private String outreachSubject;
    private String outreachMessage;
    private VerificationStatus verificationStatus;
    private Integer confidenceScore;
    private Boolean safeToContact;
    private FailureReason failureReason;
    private String failureMessage;

    public static WorkItemResultDto from(WorkItem item) {
        boolean safe = item.getVerificationStatus() == VerificationStatus.DELIVERABLE
                && item.getConfidenceScore() != null
                && item.getConfidenceScore() >= ConfidenceScore.SAFE_SCORE_THRESHOLD;
        return WorkItemResultDto.builder()
                .id(item.getId())
                .externalId(item.getExternalId())
                .unitRank(item.getUnitRank())
                .name(item.getName())
                .contactChannel(item.getContactChannel())
                .phone(item.getPhone())
                .website(item.getWebsite())
                .address(item.getAddress())
                .category(item.getCategory())
                .rating(item.getRating())
                .reviewCount(item.getReviewCount())
                .processingStage(item.getProcessingStage())
                .summary(item.getSummary())
                .outreachSubject(item.getOutreachSubject())
                .outreachMessage(item.getOutreachMessage())
                .verificationStatus(item.getVerificationStatus())
                .confidenceScore(item.getConfidenceScore())
                .safeToContact(safe)
                .failureReason(item.getFailureReason())
                .failureMessage(item.getFailureMessage())
                .build();
    }
}
