package com.pushit.service.brand;

import com.pushit.dto.request.BrandProfileRequest;
import com.pushit.entity.Brand;
import com.pushit.entity.BrandVerificationStatus;
import com.pushit.entity.QueueSubjectType;
import com.pushit.entity.User;
import com.pushit.exception.ApiException;
import com.pushit.exception.ResourceNotFoundException;
import com.pushit.repository.BrandRepository;
import com.pushit.service.currency.CurrencyService;
import com.pushit.service.queue.VerificationQueueService;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class BrandService {

    private final BrandRepository brandRepository;
    private final CurrencyService currencyService;
    private final VerificationQueueService verificationQueueService;

    @Transactional(readOnly = true)
    public Brand getByUser(Long userId) {
        return brandRepository
                .findByUserId(userId)
                .orElseThrow(
                        () -> new ResourceNotFoundException("Brand profile for user", userId));
    }

    @Transactional(readOnly = true)
    public Brand getById(Long brandId) {
        return brandRepository
                .findById(brandId)
                .orElseThrow(() -> new ResourceNotFoundException("Brand", brandId));
    }

    @Transactional(readOnly = true)
    public List<Brand> listAll() {
        return brandRepository.findAll();
    }

    /** Applies the non-null fields of the request. */
    @Transactional
    public Brand updateProfile(Long userId, BrandProfileRequest request) {
        Brand brand = getByUser(userId);
        if (request.getCompanyName() != null) {
            brand.setCompanyName(request.getCompanyName().trim());
        }
        if (request.getIndustry() != null) {
            brand.setIndustry(request.getIndustry().trim());
        }
        if (request.getDescription() != null) {
            brand.setDescription(request.getDescription().trim());
        }
        if (request.getWebsite() != null) {
            brand.setWebsite(request.getWebsite().isBlank() ? null : request.getWebsite().trim());
        }
        if (request.getContactEmail() != null) {
            brand.setContactEmail(request.getContactEmail().trim());
        }
        if (request.getPhoneNumber() != null) {
            brand.setPhoneNumber(request.getPhoneNumber().trim());
        }
        if (request.getAddress() != null) {
            brand.setAddress(request.getAddress().trim());
        }
        if (request.getCurrencyCode() != null) {
            brand.setCurrency(currencyService.getByCode(request.getCurrencyCode()));
        }
        return brandRepository.save(brand);
    }

    /** Marks the profile complete and queues it for verification. */
    @Transactional
    public Brand completeProfile(Long userId) {
        Brand brand = getByUser(userId);
        List<String> missing = new ArrayList<>();
        if (isBlank(brand.getCompanyName())) {
            missing.add("companyName");
        }
        if (isBlank(brand.getIndustry())) {
            missing.add("industry");
        }
        if (isBlank(brand.getDescription())) {
            missing.add("description");
        }
        if (isBlank(brand.getContactEmail()) && isBlank(brand.getPhoneNumber())) {
            missing.add("contactEmail or phoneNumber");
        }
        if (!missing.isEmpty()) {
            throw new ApiException(
                    "Profile is incomplete, missing: " + String.join(", ", missing),
                    HttpStatus.BAD_REQUEST,
                    "PROFILE_INCOMPLETE");
        }

        brand.setProfileCompleted(true);
        Brand saved = brandRepository.save(brand);
        verificationQueueService.schedule(QueueSubjectType.BRAND, brand.getId());
        log.info("Brand {} completed its profile", brand.getId());
        return saved;
    }

    @Transactional
    public Brand pause(User admin, Long brandId, String reason) {
        Brand brand = getById(brandId);
        brand.setVerificationStatus(BrandVerificationStatus.PAUSED);
        brand.setPausedBy(admin);
        brand.setPausedAt(LocalDateTime.now());
        brand.setPauseReason(reason);
        Brand saved = brandRepository.save(brand);
        log.info("Brand {} paused by admin {}: {}", brandId, admin.getId(), reason);
        return saved;
    }

    /** Lifts a pause. The brand goes back to PENDING and is verified again. */
    @Transactional
    public Brand unpause(Long brandId) {
        Brand brand = getById(brandId);
        if (brand.getVerificationStatus() != BrandVerificationStatus.PAUSED) {
            throw new ApiException("Brand is not paused", HttpStatus.CONFLICT, "NOT_PAUSED");
        }
        brand.setVerificationStatus(BrandVerificationStatus.PENDING);
        brand.setPausedBy(null);
        brand.setPausedAt(null);
        brand.setPauseReason(null);
        Brand saved = brandRepository.save(brand);
        if (brand.isProfileCompleted()) {
            verificationQueueService.schedule(QueueSubjectType.BRAND, brandId);
        }
        log.info("Brand {} unpaused", brandId);
        return saved;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
