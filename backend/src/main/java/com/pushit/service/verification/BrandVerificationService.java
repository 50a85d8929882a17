package com.pushit.service.verification;

import com.pushit.config.AppProperties;
import com.pushit.entity.Brand;
import com.pushit.entity.BrandVerificationStatus;
import com.pushit.entity.NotificationType;
import com.pushit.entity.VerificationMethod;
import com.pushit.exception.ResourceNotFoundException;
import com.pushit.monitoring.VerificationMetrics;
import com.pushit.repository.BrandRepository;
import com.pushit.service.notification.NotificationService;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class BrandVerificationService {

    private static final Set<BrandVerificationStatus> REVIEW_DECISIONS =
            EnumSet.of(
                    BrandVerificationStatus.VERIFIED,
                    BrandVerificationStatus.REJECTED,
                    BrandVerificationStatus.REQUEST_INFO);

    private final BrandRepository brandRepository;
    private final BrandVerifier brandVerifier;
    private final NotificationService notificationService;
    private final VerificationMetrics verificationMetrics;
    private final AppProperties appProperties;

    /**
     * Scores the brand profile. Confidence, flags and method are always stored; the status only
     * moves to VERIFIED when auto-approval is enabled and the profile passed.
     */
    @Transactional
    public VerificationResult verifyBrand(Brand brand) {
        VerificationResult result = brandVerifier.verify(brand);

        brand.setVerificationConfidence(result.confidence());
        brand.setVerificationFlags(new ArrayList<>(result.flags()));
        brand.setVerificationMethod(VerificationMethod.AUTO);

        boolean approve = result.passed() && appProperties.verification().autoApprove();
        if (approve) {
            brand.setVerificationStatus(BrandVerificationStatus.VERIFIED);
            brand.setVerifiedAt(LocalDateTime.now());
        }
        brandRepository.save(brand);
        verificationMetrics.recordOutcome("brand", approve ? "approved" : "pending");

        log.info(
                "Brand {} verification: passed={}, confidence={}, flags={}",
                brand.getId(),
                result.passed(),
                String.format("%.2f", result.confidence()),
                result.flags().size());

        if (approve) {
            notificationService.notify(
                    brand.getUser(),
                    NotificationType.ACCOUNT_VERIFIED,
                    "Brand verified",
                    "Your brand profile has been verified. You can now launch campaigns.");
        }
        return result;
    }

    /** Admin decision on a brand profile. */
    @Transactional
    public Brand reviewBrand(Long brandId, BrandVerificationStatus decision, String notes) {
        if (!REVIEW_DECISIONS.contains(decision)) {
            throw new IllegalArgumentException("Unsupported brand review decision: " + decision);
        }
        Brand brand =
                brandRepository
                        .findById(brandId)
                        .orElseThrow(() -> new ResourceNotFoundException("Brand", brandId));

        brand.setVerificationStatus(decision);
        brand.setVerificationMethod(VerificationMethod.MANUAL);
        if (decision == BrandVerificationStatus.VERIFIED) {
            brand.setVerifiedAt(LocalDateTime.now());
        }
        if (notes != null && !notes.isBlank()) {
            var flags = new ArrayList<>(brand.getVerificationFlags());
            flags.add("Admin: " + notes.trim());
            brand.setVerificationFlags(flags);
        }
        Brand saved = brandRepository.save(brand);
        log.info("Brand {} manually set to {}", brandId, decision);

        if (decision == BrandVerificationStatus.VERIFIED) {
            notificationService.notify(
                    brand.getUser(),
                    NotificationType.ACCOUNT_VERIFIED,
                    "Brand verified",
                    "Your brand profile has been verified by our team.");
        }
        return saved;
    }
}
