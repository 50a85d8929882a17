package com.pushit.dto.response;

import com.pushit.entity.Submission;
import com.pushit.entity.SubmissionStatus;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionResponse {
    private Long id;
    private Long campaignId;
    private Long influencerId;
    private String proofLink;
    private SubmissionStatus status;
    private String adminNotes;
    private LocalDateTime submittedAt;
    private LocalDateTime reviewedAt;

    public static SubmissionResponse fromEntity(Submission submission) {
        return SubmissionResponse.builder()
                .id(submission.getId())
                .campaignId(submission.getCampaign().getId())
                .influencerId(submission.getInfluencer().getId())
                .proofLink(submission.getProofLink())
                .status(submission.getStatus())
                .adminNotes(submission.getAdminNotes())
                .submittedAt(submission.getSubmittedAt())
                .reviewedAt(submission.getReviewedAt())
                .build();
    }
}
