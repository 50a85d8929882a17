package com.pushit.service.campaign;

import com.pushit.dto.request.CampaignRequest;
import com.pushit.entity.Brand;
import com.pushit.entity.BrandVerificationStatus;
import com.pushit.entity.Campaign;
import com.pushit.entity.CampaignStatus;
import com.pushit.exception.ApiException;
import com.pushit.exception.IllegalCampaignStateException;
import com.pushit.exception.InsufficientBalanceException;
import com.pushit.exception.ResourceNotFoundException;
import com.pushit.repository.BrandRepository;
import com.pushit.repository.CampaignRepository;
import com.pushit.service.currency.CurrencyService;
import com.pushit.service.wallet.WalletService;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.HttpStatus;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Campaign lifecycle. Creation pays for the campaign out of the brand wallet in the same
 * transaction; activation only charges when no successful payment exists for the campaign yet.
 *
 * <p>Operations taking a {@code brandId} act on behalf of that brand and only see its campaigns.
 * A null {@code brandId} means an administrator is acting.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignService {

    private final CampaignRepository campaignRepository;
    private final BrandRepository brandRepository;
    private final WalletService walletService;
    private final CurrencyService currencyService;

    @Transactional(rollbackFor = Exception.class)
    @Retryable(
            retryFor = {
                ObjectOptimisticLockingFailureException.class,
                CannotAcquireLockException.class
            },
            maxAttempts = 3,
            backoff = @Backoff(delay = 100, multiplier = 2, random = true))
    public Campaign createCampaign(Long brandId, CampaignRequest request) {
        Brand brand =
                brandRepository
                        .findByIdWithLock(brandId)
                        .orElseThrow(() -> new ResourceNotFoundException("Brand", brandId));
        requireNotPaused(brand);

        String walletCurrency = walletService.walletCurrency(brand);
        String currency = resolveCurrency(request.getCurrency(), walletCurrency);
        BigDecimal required =
                currencyService.convert(request.getBudget(), currency, walletCurrency);
        if (brand.getWalletBalance().compareTo(required) < 0) {
            throw new InsufficientBalanceException(
                    String.format(
                            "Insufficient wallet balance. Available: %s, required: %s",
                            currencyService.format(brand.getWalletBalance(), walletCurrency),
                            currencyService.format(required, walletCurrency)));
        }

        Campaign campaign =
                Campaign.builder()
                        .brand(brand)
                        .name(request.getName().trim())
                        .description(request.getDescription())
                        .platform(request.getPlatform())
                        .niche(request.getNiche())
                        .packageVideos(request.getPackageVideos())
                        .budget(request.getBudget())
                        .currency(currency)
                        .startDate(request.getStartDate())
                        .dueDate(request.getDueDate())
                        .status(CampaignStatus.DRAFT)
                        .build();
        campaign = campaignRepository.save(campaign);

        walletService.debitForCampaign(brandId, campaign);

        log.info(
                "Brand {} created campaign {} '{}' with budget {} {}",
                brandId,
                campaign.getId(),
                campaign.getName(),
                campaign.getBudget(),
                currency);
        return campaign;
    }

    /** Edits a campaign that is not live. The budget is fixed once paid. */
    @Transactional
    public Campaign updateCampaign(Long brandId, Long campaignId, CampaignRequest request) {
        Campaign campaign = getCampaign(campaignId, brandId);
        if (!campaign.getStatus().isEditable()) {
            throw new IllegalCampaignStateException(
                    campaignId,
                    campaign.getStatus(),
                    "Campaign cannot be edited while " + campaign.getStatus());
        }
        if (request.getBudget() != null
                && request.getBudget().compareTo(campaign.getBudget()) != 0) {
            throw new ApiException(
                    "Campaign budget cannot be changed after payment",
                    HttpStatus.BAD_REQUEST,
                    "BUDGET_LOCKED");
        }

        campaign.setName(request.getName().trim());
        campaign.setDescription(request.getDescription());
        campaign.setPlatform(request.getPlatform());
        campaign.setNiche(request.getNiche());
        campaign.setPackageVideos(request.getPackageVideos());
        campaign.setStartDate(request.getStartDate());
        campaign.setDueDate(request.getDueDate());
        Campaign saved = campaignRepository.save(campaign);
        log.info("Campaign {} updated", campaignId);
        return saved;
    }

    /**
     * Moves a draft campaign live. Charges the wallet only when the campaign has no successful
     * payment on record, so a campaign paid at creation is never charged twice.
     */
    @Transactional(rollbackFor = Exception.class)
    @Retryable(
            retryFor = {
                ObjectOptimisticLockingFailureException.class,
                CannotAcquireLockException.class
            },
            maxAttempts = 3,
            backoff = @Backoff(delay = 100, multiplier = 2, random = true))
    public Campaign activateCampaign(Long brandId, Long campaignId) {
        Campaign campaign = getCampaign(campaignId, brandId);
        if (campaign.getStatus() != CampaignStatus.DRAFT) {
            throw new IllegalCampaignStateException(
                    campaignId, campaign.getStatus(), "Only draft campaigns can be activated");
        }
        requireNotPaused(campaign.getBrand());

        if (walletService.isCampaignPaid(campaignId)) {
            log.info("Campaign {} already paid, activating without a new charge", campaignId);
        } else {
            walletService.debitForCampaign(campaign.getBrand().getId(), campaign);
        }

        campaign.setStatus(CampaignStatus.ACTIVE);
        Campaign saved = campaignRepository.save(campaign);
        log.info("Campaign {} activated", campaignId);
        return saved;
    }

    @Transactional
    public Campaign pauseCampaign(Long brandId, Long campaignId) {
        return transition(brandId, campaignId, CampaignStatus.PAUSED);
    }

    /** Puts a paused campaign back live. Nothing is charged, the budget was paid already. */
    @Transactional
    public Campaign resumeCampaign(Long brandId, Long campaignId) {
        Campaign campaign = getCampaign(campaignId, brandId);
        if (campaign.getStatus() != CampaignStatus.PAUSED) {
            throw new IllegalCampaignStateException(
                    campaignId, campaign.getStatus(), "Only paused campaigns can be resumed");
        }
        requireNotPaused(campaign.getBrand());

        campaign.setStatus(CampaignStatus.ACTIVE);
        Campaign saved = campaignRepository.save(campaign);
        log.info("Campaign {} resumed", campaignId);
        return saved;
    }

    @Transactional
    public Campaign completeCampaign(Long brandId, Long campaignId) {
        return transition(brandId, campaignId, CampaignStatus.COMPLETED);
    }

    /** Cancels a draft or paused campaign. The budget is not refunded automatically. */
    @Transactional
    public Campaign cancelCampaign(Long brandId, Long campaignId) {
        return transition(brandId, campaignId, CampaignStatus.CANCELLED);
    }

    @Transactional(readOnly = true)
    public Campaign getCampaign(Long campaignId, Long brandId) {
        Campaign campaign =
                campaignRepository
                        .findById(campaignId)
                        .orElseThrow(() -> new ResourceNotFoundException("Campaign", campaignId));
        if (brandId != null && !campaign.getBrand().getId().equals(brandId)) {
            throw new ResourceNotFoundException("Campaign", campaignId);
        }
        return campaign;
    }

    @Transactional(readOnly = true)
    public List<Campaign> listForBrand(Long brandId) {
        return campaignRepository.findByBrandIdOrderByCreatedAtDesc(brandId);
    }

    @Transactional(readOnly = true)
    public List<Campaign> listActive() {
        return campaignRepository.findByStatusOrderByCreatedAtDesc(CampaignStatus.ACTIVE);
    }

    /** Moves to a non-live status. Going live is only possible through activate or resume. */
    private Campaign transition(Long brandId, Long campaignId, CampaignStatus target) {
        Campaign campaign = getCampaign(campaignId, brandId);
        CampaignStatus current = campaign.getStatus();
        if (!current.canTransitionTo(target) || target == CampaignStatus.ACTIVE) {
            throw new IllegalCampaignStateException(
                    campaignId,
                    current,
                    String.format("Campaign cannot move from %s to %s", current, target));
        }
        campaign.setStatus(target);
        Campaign saved = campaignRepository.save(campaign);
        log.info(
                "Campaign {} moved from {} to {} by {}",
                campaignId,
                current,
                target,
                brandId == null ? "admin" : "brand " + brandId);
        return saved;
    }

    private String resolveCurrency(String requested, String walletCurrency) {
        if (requested == null || requested.isBlank()) {
            return walletCurrency;
        }
        return currencyService.getByCode(requested.trim().toUpperCase(Locale.ROOT)).getCode();
    }

    private static void requireNotPaused(Brand brand) {
        if (brand.getVerificationStatus() == BrandVerificationStatus.PAUSED) {
            throw new ApiException(
                    "Brand account is paused", HttpStatus.FORBIDDEN, "ACCOUNT_PAUSED");
        }
    }
}
