package com.pushit.service.influencer;

import com.pushit.dto.request.InfluencerProfileRequest;
import com.pushit.entity.Influencer;
import com.pushit.entity.InfluencerVerificationStatus;
import com.pushit.entity.NotificationType;
import com.pushit.entity.QueueSubjectType;
import com.pushit.entity.User;
import com.pushit.exception.ApiException;
import com.pushit.exception.ResourceNotFoundException;
import com.pushit.repository.InfluencerRepository;
import com.pushit.service.currency.CurrencyService;
import com.pushit.service.notification.NotificationService;
import com.pushit.service.queue.VerificationQueueService;
import java.time.LocalDateTime;
import java.util.ArrayList;
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
public class InfluencerService {

    private static final Set<InfluencerVerificationStatus> REVIEW_DECISIONS =
            EnumSet.of(
                    InfluencerVerificationStatus.APPROVED,
                    InfluencerVerificationStatus.REJECTED,
                    InfluencerVerificationStatus.REQUEST_INFO);

    private final InfluencerRepository influencerRepository;
    private final CurrencyService currencyService;
    private final VerificationQueueService verificationQueueService;
    private final NotificationService notificationService;

    @Transactional(readOnly = true)
    public Influencer getByUser(Long userId) {
        return influencerRepository
                .findByUserId(userId)
                .orElseThrow(
                        () -> new ResourceNotFoundException("Influencer profile for user", userId));
    }

    @Transactional(readOnly = true)
    public Influencer getById(Long influencerId) {
        return influencerRepository
                .findById(influencerId)
                .orElseThrow(() -> new ResourceNotFoundException("Influencer", influencerId));
    }

    @Transactional(readOnly = true)
    public List<Influencer> listAll() {
        return influencerRepository.findAll();
    }

    /** Applies the non-null fields of the request. */
    @Transactional
    public Influencer updateProfile(Long userId, InfluencerProfileRequest request) {
        Influencer influencer = getByUser(userId);
        if (request.getDisplayName() != null) {
            influencer.setDisplayName(request.getDisplayName().trim());
        }
        if (request.getBio() != null) {
            influencer.setBio(request.getBio().trim());
        }
        if (request.getNiche() != null) {
            influencer.setNiche(request.getNiche().trim());
        }
        if (request.getPrimaryPlatform() != null) {
            influencer.setPrimaryPlatform(request.getPrimaryPlatform());
        }
        if (request.getCurrencyCode() != null) {
            influencer.setCurrency(currencyService.getByCode(request.getCurrencyCode()));
        }
        return influencerRepository.save(influencer);
    }

    /** Marks the profile complete and queues it for verification. */
    @Transactional
    public Influencer completeProfile(Long userId) {
        Influencer influencer = getByUser(userId);
        List<String> missing = new ArrayList<>();
        if (influencer.getDisplayName() == null || influencer.getDisplayName().isBlank()) {
            missing.add("displayName");
        }
        if (influencer.getNiche() == null || influencer.getNiche().isBlank()) {
            missing.add("niche");
        }
        if (influencer.getPrimaryPlatform() == null) {
            missing.add("primaryPlatform");
        }
        if (!missing.isEmpty()) {
            throw new ApiException(
                    "Profile is incomplete, missing: " + String.join(", ", missing),
                    HttpStatus.BAD_REQUEST,
                    "PROFILE_INCOMPLETE");
        }

        influencer.setProfileCompleted(true);
        Influencer saved = influencerRepository.save(influencer);
        verificationQueueService.schedule(QueueSubjectType.INFLUENCER, influencer.getId());
        log.info("Influencer {} completed their profile", influencer.getId());
        return saved;
    }

    /** Admin decision on an influencer account. */
    @Transactional
    public Influencer review(
            Long influencerId, InfluencerVerificationStatus decision, String notes) {
        if (!REVIEW_DECISIONS.contains(decision)) {
            throw new IllegalArgumentException(
                    "Unsupported influencer review decision: " + decision);
        }
        Influencer influencer = getById(influencerId);
        influencer.setVerificationStatus(decision);
        if (notes != null && !notes.isBlank()) {
            influencer.setAdminNotes(notes.trim());
        }
        Influencer saved = influencerRepository.save(influencer);
        log.info("Influencer {} manually set to {}", influencerId, decision);

        if (decision == InfluencerVerificationStatus.APPROVED) {
            notificationService.notify(
                    influencer.getUser(),
                    NotificationType.ACCOUNT_VERIFIED,
                    "Account approved",
                    "Your influencer account has been approved by our team.");
        }
        return saved;
    }

    @Transactional
    public Influencer pause(User admin, Long influencerId, String reason) {
        Influencer influencer = getById(influencerId);
        influencer.setVerificationStatus(InfluencerVerificationStatus.PAUSED);
        influencer.setPausedBy(admin);
        influencer.setPausedAt(LocalDateTime.now());
        influencer.setPauseReason(reason);
        Influencer saved = influencerRepository.save(influencer);
        log.info("Influencer {} paused by admin {}: {}", influencerId, admin.getId(), reason);
        return saved;
    }

    /** Lifts a pause. The influencer goes back to PENDING and is verified again. */
    @Transactional
    public Influencer unpause(Long influencerId) {
        Influencer influencer = getById(influencerId);
        if (influencer.getVerificationStatus() != InfluencerVerificationStatus.PAUSED) {
            throw new ApiException("Influencer is not paused", HttpStatus.CONFLICT, "NOT_PAUSED");
        }
        influencer.setVerificationStatus(InfluencerVerificationStatus.PENDING);
        influencer.setPausedBy(null);
        influencer.setPausedAt(null);
        influencer.setPauseReason(null);
        Influencer saved = influencerRepository.save(influencer);
        if (influencer.isProfileCompleted()) {
            verificationQueueService.schedule(QueueSubjectType.INFLUENCER, influencerId);
        }
        log.info("Influencer {} unpaused", influencerId);
        return saved;
    }
}
