package com.pushit.service.queue;

import com.pushit.config.AppProperties;
import com.pushit.entity.Brand;
import com.pushit.entity.BrandVerificationStatus;
import com.pushit.entity.Influencer;
import com.pushit.entity.InfluencerVerificationStatus;
import com.pushit.entity.QueueSubjectType;
import com.pushit.entity.VerificationQueueEntry;
import com.pushit.monitoring.VerificationMetrics;
import com.pushit.repository.BrandRepository;
import com.pushit.repository.InfluencerRepository;
import com.pushit.repository.VerificationQueueRepository;
import com.pushit.service.verification.BrandVerificationService;
import com.pushit.service.verification.ConnectionVerificationService;
import io.micrometer.core.instrument.Timer;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Delayed verification queue. Completing a profile schedules a single row per subject a few
 * minutes ahead; {@link #drain()} picks up due rows, claims each one with a conditional update and
 * runs verification for it.
 *
 * <p>Each item is claimed, processed and completed in its own transaction, so one failing subject
 * does not roll back the rest of the pass and concurrent drains never run the same row twice while
 * the lease is live.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationQueueService {

    private static final int MAX_OUTCOME_LENGTH = 50;

    private final VerificationQueueRepository queueRepository;
    private final BrandRepository brandRepository;
    private final InfluencerRepository influencerRepository;
    private final BrandVerificationService brandVerificationService;
    private final ConnectionVerificationService connectionVerificationService;
    private final VerificationMetrics verificationMetrics;
    private final TransactionTemplate transactionTemplate;
    private final AppProperties appProperties;

    /**
     * Schedules verification for the subject. Calling it again before the row is processed moves
     * the same row instead of adding another one.
     */
    @Transactional
    public VerificationQueueEntry schedule(QueueSubjectType subjectType, Long subjectId) {
        LocalDateTime scheduledAt = LocalDateTime.now().plusSeconds(randomDelaySeconds());

        VerificationQueueEntry entry =
                queueRepository
                        .findBySubjectTypeAndSubjectId(subjectType, subjectId)
                        .orElseGet(
                                () ->
                                        VerificationQueueEntry.builder()
                                                .subjectType(subjectType)
                                                .subjectId(subjectId)
                                                .build());
        entry.setScheduledAt(scheduledAt);
        entry.setProcessed(false);
        entry.setProcessedAt(null);
        entry.setClaimToken(null);
        entry.setClaimedAt(null);

        VerificationQueueEntry saved = queueRepository.save(entry);
        log.info("Scheduled {} {} for verification at {}", subjectType, subjectId, scheduledAt);
        return saved;
    }

    /** Processes every due row this worker manages to claim, up to the configured batch size. */
    public DrainStats drain() {
        AppProperties.Verification settings = appProperties.verification();
        Timer.Sample sample = verificationMetrics.startDrain();

        LocalDateTime now = LocalDateTime.now();
        LocalDateTime leaseExpiredBefore = now.minusMinutes(settings.claimLeaseMinutes());
        List<Long> candidates =
                transactionTemplate.execute(
                        status ->
                                queueRepository
                                        .findClaimable(
                                                now,
                                                leaseExpiredBefore,
                                                PageRequest.of(0, settings.drainBatchSize()))
                                        .stream()
                                        .map(VerificationQueueEntry::getId)
                                        .toList());
        if (candidates == null || candidates.isEmpty()) {
            verificationMetrics.stopDrain(sample);
            return DrainStats.empty();
        }

        int processed = 0;
        int approved = 0;
        int pending = 0;
        int skipped = 0;
        int failed = 0;

        for (Long entryId : candidates) {
            String token = UUID.randomUUID().toString();
            Integer claimed =
                    transactionTemplate.execute(
                            status ->
                                    queueRepository.claim(
                                            entryId, token, now, leaseExpiredBefore));
            if (claimed == null || claimed == 0) {
                log.debug("Queue entry {} was claimed by another worker", entryId);
                continue;
            }

            try {
                QueueOutcome outcome = transactionTemplate.execute(status -> process(entryId));
                if (outcome == null) {
                    outcome = QueueOutcome.SKIPPED;
                }
                String label = outcome.label();
                transactionTemplate.execute(
                        status ->
                                queueRepository.complete(
                                        entryId, token, LocalDateTime.now(), label));
                processed++;
                switch (outcome) {
                    case APPROVED -> approved++;
                    case PENDING -> pending++;
                    case SKIPPED -> skipped++;
                }
                verificationMetrics.recordQueueItem(label);
            } catch (RuntimeException e) {
                failed++;
                log.error("Verification of queue entry {} failed, releasing claim", entryId, e);
                String reason = truncate("error: " + e.getClass().getSimpleName());
                transactionTemplate.execute(
                        status -> queueRepository.release(entryId, token, reason));
                verificationMetrics.recordQueueItem("failed");
            }
        }

        verificationMetrics.stopDrain(sample);
        DrainStats stats = new DrainStats(processed, approved, pending, skipped, failed);
        log.info("Verification queue drained: {}", stats);
        return stats;
    }

    @Transactional(readOnly = true)
    public long backlog() {
        return queueRepository.countByProcessedFalse();
    }

    private QueueOutcome process(Long entryId) {
        Optional<VerificationQueueEntry> entry = queueRepository.findById(entryId);
        if (entry.isEmpty()) {
            return QueueOutcome.SKIPPED;
        }
        Long subjectId = entry.get().getSubjectId();
        return switch (entry.get().getSubjectType()) {
            case BRAND -> brandRepository
                    .findById(subjectId)
                    .map(this::processBrand)
                    .orElseGet(() -> missingSubject(entryId));
            case INFLUENCER -> influencerRepository
                    .findById(subjectId)
                    .map(this::processInfluencer)
                    .orElseGet(() -> missingSubject(entryId));
        };
    }

    private QueueOutcome processBrand(Brand brand) {
        BrandVerificationStatus status = brand.getVerificationStatus();
        if (status == BrandVerificationStatus.PAUSED
                || status == BrandVerificationStatus.VERIFIED) {
            log.info("Brand {} is {}, skipping verification", brand.getId(), status);
            return QueueOutcome.SKIPPED;
        }
        brandVerificationService.verifyBrand(brand);
        return brand.getVerificationStatus() == BrandVerificationStatus.VERIFIED
                ? QueueOutcome.APPROVED
                : QueueOutcome.PENDING;
    }

    private QueueOutcome processInfluencer(Influencer influencer) {
        InfluencerVerificationStatus status = influencer.getVerificationStatus();
        if (status == InfluencerVerificationStatus.PAUSED
                || status == InfluencerVerificationStatus.APPROVED) {
            log.info("Influencer {} is {}, skipping verification", influencer.getId(), status);
            return QueueOutcome.SKIPPED;
        }
        connectionVerificationService.verifyInfluencerPlatforms(influencer);
        return connectionVerificationService.autoApproveInfluencer(influencer)
                ? QueueOutcome.APPROVED
                : QueueOutcome.PENDING;
    }

    private QueueOutcome missingSubject(Long entryId) {
        log.warn("Queue entry {} points at a subject that no longer exists", entryId);
        return QueueOutcome.SKIPPED;
    }

    private long randomDelaySeconds() {
        AppProperties.Verification settings = appProperties.verification();
        long min = settings.queueDelayMinMinutes() * 60L;
        long max = Math.max(min, settings.queueDelayMaxMinutes() * 60L);
        return ThreadLocalRandom.current().nextLong(min, max + 1);
    }

    private static String truncate(String value) {
        return value.length() <= MAX_OUTCOME_LENGTH
                ? value
                : value.substring(0, MAX_OUTCOME_LENGTH);
    }
}
