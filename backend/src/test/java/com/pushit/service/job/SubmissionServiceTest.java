package com.pushit.service.job;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.pushit.entity.Campaign;
import com.pushit.entity.Influencer;
import com.pushit.entity.NotificationType;
import com.pushit.entity.Submission;
import com.pushit.entity.SubmissionStatus;
import com.pushit.entity.User;
import com.pushit.entity.UserRole;
import com.pushit.exception.ApiException;
import com.pushit.exception.ResourceNotFoundException;
import com.pushit.repository.SubmissionRepository;
import com.pushit.service.notification.NotificationService;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SubmissionServiceTest {

    @Mock private SubmissionRepository submissionRepository;

    @Mock private NotificationService notificationService;

    @InjectMocks private SubmissionService submissionService;

    private final User admin = User.builder().id(1L).role(UserRole.ADMIN).build();
    private final User influencerUser = User.builder().id(2L).role(UserRole.INFLUENCER).build();
    private final Influencer influencer = Influencer.builder().id(7L).user(influencerUser).build();
    private Submission submission;

    @BeforeEach
    void setUp() {
        submission =
                Submission.builder()
                        .id(80L)
                        .influencer(influencer)
                        .campaign(Campaign.builder().id(100L).name("Jollof launch").build())
                        .status(SubmissionStatus.NEW)
                        .build();
        when(submissionRepository.findById(80L)).thenReturn(Optional.of(submission));
        when(submissionRepository.save(any(Submission.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void submitProof_NewSubmission_GoesToReview() {
        Submission saved =
                submissionService.submitProof(
                        influencer, 80L, " https://www.tiktok.com/@ama.cooks/video/1 ");

        assertEquals(SubmissionStatus.IN_REVIEW, saved.getStatus());
        assertEquals("https://www.tiktok.com/@ama.cooks/video/1", saved.getProofLink());
    }

    @Test
    void submitProof_AfterReuploadRequest_IsAccepted() {
        submission.setStatus(SubmissionStatus.NEEDS_REUPLOAD);

        assertEquals(
                SubmissionStatus.IN_REVIEW,
                submissionService.submitProof(influencer, 80L, "https://x.test/v").getStatus());
    }

    @Test
    void submitProof_AlreadyVerified_IsConflict() {
        submission.setStatus(SubmissionStatus.VERIFIED);

        ApiException ex =
                assertThrows(
                        ApiException.class,
                        () -> submissionService.submitProof(influencer, 80L, "https://x.test/v"));
        assertEquals("SUBMISSION_NOT_OPEN", ex.getErrorCode());
    }

    @Test
    void submitProof_SomeoneElsesSubmission_IsNotFound() {
        Influencer other = Influencer.builder().id(8L).build();

        assertThrows(
                ResourceNotFoundException.class,
                () -> submissionService.submitProof(other, 80L, "https://x.test/v"));
    }

    @Test
    void reviewSubmission_Approve_VerifiesAndNotifies() {
        submission.setStatus(SubmissionStatus.IN_REVIEW);

        Submission reviewed =
                submissionService.reviewSubmission(admin, 80L, ReviewAction.APPROVE, "Looks good");

        assertEquals(SubmissionStatus.VERIFIED, reviewed.getStatus());
        assertSame(admin, reviewed.getReviewedBy());
        assertNotNull(reviewed.getReviewedAt());
        verify(notificationService)
                .notify(
                        eq(influencerUser),
                        eq(NotificationType.SUBMISSION_VERIFIED),
                        anyString(),
                        contains("Jollof launch"),
                        eq(80L),
                        isNull());
    }

    @Test
    void reviewSubmission_Reject_AsksForReupload() {
        Submission reviewed =
                submissionService.reviewSubmission(admin, 80L, ReviewAction.REJECT, "Blurry");

        assertEquals(SubmissionStatus.NEEDS_REUPLOAD, reviewed.getStatus());
        assertEquals("Blurry", reviewed.getAdminNotes());
    }

    @Test
    void reviewSubmission_Flag_NotifiesFlagged() {
        submissionService.reviewSubmission(admin, 80L, ReviewAction.FLAG, null);

        assertEquals(SubmissionStatus.FLAGGED, submission.getStatus());
        verify(notificationService)
                .notify(
                        eq(influencerUser),
                        eq(NotificationType.SUBMISSION_FLAGGED),
                        anyString(),
                        anyString(),
                        eq(80L),
                        isNull());
    }

    @Test
    void parse_IsCaseInsensitive() {
        assertEquals(ReviewAction.FLAG, ReviewAction.parse(" flag "));
        assertThrows(IllegalArgumentException.class, () -> ReviewAction.parse("escalate"));
    }
}
