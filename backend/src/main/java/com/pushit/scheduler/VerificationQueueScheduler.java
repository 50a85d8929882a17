package com.pushit.scheduler;

import com.pushit.service.queue.DrainStats;
import com.pushit.service.queue.VerificationQueueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodic drain of the verification queue. */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        name = "app.scheduling.verification-drain.enabled",
        havingValue = "true",
        matchIfMissing = true)
public class VerificationQueueScheduler {

    private final VerificationQueueService verificationQueueService;

    @Scheduled(
            fixedDelayString = "${app.verification.drain-interval-ms:90000}",
            initialDelayString = "${app.scheduling.verification-drain.initial-delay-ms:30000}")
    public void drainVerificationQueue() {
        try {
            DrainStats stats = verificationQueueService.drain();
            if (stats.processed() > 0 || stats.failed() > 0) {
                log.info(
                        "Scheduled drain: {} processed, {} approved, {} failed",
                        stats.processed(),
                        stats.approved(),
                        stats.failed());
            }
        } catch (RuntimeException e) {
            log.error("Scheduled verification drain failed", e);
        }
    }
}
