package com.pushit.service.job;

import com.pushit.entity.Influencer;
import com.pushit.entity.NotificationType;
import com.pushit.entity.Submission;
import com.pushit.entity.SubmissionStatus;
import com.pushit.entity.User;
import com.pushit.exception.ApiException;
import com.pushit.exception.ResourceNotFoundException;
import com.pushit.repository.SubmissionRepository;
import com.pushit.service.notification.NotificationService;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubmissionService {

    private static final Set<SubmissionStatus> PROOF_ACCEPTED_FROM =
            EnumSet.of(SubmissionStatus.NEW, SubmissionStatus.NEEDS_REUPLOAD);

    private final SubmissionRepository submissionRepository;
    private final NotificationService notificationService;

    /** Attaches the proof link and sends the submission to review. */
    @Transactional
    public Submission submitProof(Influencer influencer, Long submissionId, String proofLink) {
        Submission submission =
                submissionRepository
                        .findById(submissionId)
                        .filter(s -> s.getInfluencer().getId().equals(influencer.getId()))
                        .orElseThrow(
                                () -> new ResourceNotFoundException("Submission", submissionId));

        if (!PROOF_ACCEPTED_FROM.contains(submission.getStatus())) {
            throw new ApiException(
                    "Proof cannot be submitted while the submission is "
                            + submission.getStatus(),
                    HttpStatus.CONFLICT,
                    "SUBMISSION_NOT_OPEN");
        }
        submission.setProofLink(proofLink.trim());
        submission.setStatus(SubmissionStatus.IN_REVIEW);
        Submission saved = submissionRepository.save(submission);
        log.info("Submission {} sent to review", submissionId);
        return saved;
    }

    @Transactional
    public Submission reviewSubmission(
            User admin, Long submissionId, ReviewAction action, String notes) {
        Submission submission =
                submissionRepository
                        .findById(submissionId)
                        .orElseThrow(
                                () -> new ResourceNotFoundException("Submission", submissionId));

        submission.setStatus(action.resultingStatus());
        submission.setAdminNotes(notes);
        submission.setReviewedAt(LocalDateTime.now());
        submission.setReviewedBy(admin);
        Submission saved = submissionRepository.save(submission);
        log.info("Submission {} reviewed by {}: {}", submissionId, admin.getId(), action);

        User influencerUser = submission.getInfluencer().getUser();
        String campaignName = submission.getCampaign().getName();
        switch (action) {
            case APPROVE -> notificationService.notify(
                    influencerUser,
                    NotificationType.SUBMISSION_VERIFIED,
                    "Submission approved",
                    "Your submission for '" + campaignName + "' has been approved.",
                    submissionId,
                    null);
            case FLAG -> notificationService.notify(
                    influencerUser,
                    NotificationType.SUBMISSION_FLAGGED,
                    "Submission flagged",
                    "Your submission for '" + campaignName + "' needs attention.",
                    submissionId,
                    null);
            case REJECT -> notificationService.notify(
                    influencerUser,
                    NotificationType.GENERAL,
                    "Re-upload needed",
                    "Please upload new proof for '" + campaignName + "'.",
                    submissionId,
                    null);
        }
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Submission> listForInfluencer(Long influencerId) {
        return submissionRepository.findByInfluencerIdOrderBySubmittedAtDesc(influencerId);
    }

    @Transactional(readOnly = true)
    public List<Submission> listByStatus(SubmissionStatus status) {
        return submissionRepository.findByStatusOrderBySubmittedAtAsc(status);
    }
}
