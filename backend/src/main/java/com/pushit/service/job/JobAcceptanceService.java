package com.pushit.service.job;

import com.pushit.config.AppProperties;
import com.pushit.entity.Campaign;
import com.pushit.entity.CampaignStatus;
import com.pushit.entity.ConnectionVerificationStatus;
import com.pushit.entity.Influencer;
import com.pushit.entity.InfluencerVerificationStatus;
import com.pushit.entity.Payout;
import com.pushit.entity.PayoutStatus;
import com.pushit.entity.PlatformConnection;
import com.pushit.entity.Submission;
import com.pushit.entity.SubmissionStatus;
import com.pushit.exception.JobAcceptanceException;
import com.pushit.exception.ResourceNotFoundException;
import com.pushit.repository.CampaignRepository;
import com.pushit.repository.PayoutRepository;
import com.pushit.repository.PlatformConnectionRepository;
import com.pushit.repository.SubmissionRepository;
import com.pushit.service.currency.CurrencyService;
import com.pushit.service.verification.ConnectionVerificationService;
import com.pushit.service.verification.PlatformSettingsService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Influencer takes on a campaign slot: a submission to fill and a payout reserved for it. */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobAcceptanceService {

    private final CampaignRepository campaignRepository;
    private final SubmissionRepository submissionRepository;
    private final PayoutRepository payoutRepository;
    private final PlatformConnectionRepository connectionRepository;
    private final PlatformSettingsService platformSettingsService;
    private final CurrencyService currencyService;
    private final AppProperties appProperties;

    public record Acceptance(Submission submission, Payout payout) {}

    @Transactional(rollbackFor = Exception.class)
    public Acceptance acceptJob(Influencer influencer, Long campaignId) {
        Campaign campaign =
                campaignRepository
                        .findById(campaignId)
                        .orElseThrow(() -> new ResourceNotFoundException("Campaign", campaignId));

        if (influencer.getVerificationStatus() == InfluencerVerificationStatus.PAUSED) {
            throw new JobAcceptanceException("Your account is paused");
        }
        if (campaign.getStatus() != CampaignStatus.ACTIVE) {
            throw new JobAcceptanceException("Campaign is not accepting influencers");
        }
        if (submissionRepository.existsByCampaignIdAndInfluencerId(
                campaignId, influencer.getId())) {
            throw new JobAcceptanceException("You have already accepted this campaign");
        }
        requireQualifyingConnection(influencer, campaign);

        BigDecimal amount = payoutAmount(campaign, influencer);
        String settlementCurrency = settlementCurrency(influencer);

        Submission submission =
                submissionRepository.save(
                        Submission.builder()
                                .campaign(campaign)
                                .influencer(influencer)
                                .status(SubmissionStatus.NEW)
                                .build());

        LocalDate dueDate =
                campaign.getDueDate() != null
                        ? campaign.getDueDate()
                        : LocalDate.now().plusDays(appProperties.wallet().payoutDueDays());
        Payout payout =
                payoutRepository.save(
                        Payout.builder()
                                .submission(submission)
                                .influencer(influencer)
                                .campaign(campaign)
                                .amount(amount)
                                .currency(settlementCurrency)
                                .dueDate(dueDate)
                                .status(PayoutStatus.PENDING)
                                .build());

        log.info(
                "Influencer {} accepted campaign {}: submission {}, payout {} {} due {}",
                influencer.getId(),
                campaignId,
                submission.getId(),
                amount,
                settlementCurrency,
                dueDate);
        return new Acceptance(submission, payout);
    }

    /**
     * Budget per video converted into the influencer's settlement currency. A campaign without a
     * video count pays its whole budget.
     */
    BigDecimal payoutAmount(Campaign campaign, Influencer influencer) {
        BigDecimal perVideo =
                campaign.getPackageVideos() > 0
                        ? campaign.getBudget()
                                .divide(
                                        BigDecimal.valueOf(campaign.getPackageVideos()),
                                        2,
                                        RoundingMode.HALF_UP)
                        : campaign.getBudget();
        String campaignCurrency =
                campaign.getCurrency() != null
                        ? campaign.getCurrency()
                        : currencyService.getDefaultCode();
        return currencyService.convert(perVideo, campaignCurrency, settlementCurrency(influencer));
    }

    private String settlementCurrency(Influencer influencer) {
        return influencer.getCurrency() != null
                ? influencer.getCurrency().getCode()
                : currencyService.getDefaultCode();
    }

    private void requireQualifyingConnection(Influencer influencer, Campaign campaign) {
        PlatformConnection connection =
                connectionRepository
                        .findByInfluencerIdAndPlatform(influencer.getId(), campaign.getPlatform())
                        .filter(
                                c ->
                                        c.getVerificationStatus()
                                                == ConnectionVerificationStatus.VERIFIED)
                        .orElseThrow(
                                () ->
                                        new JobAcceptanceException(
                                                "A verified "
                                                        + campaign.getPlatform().getDisplayName()
                                                        + " account is required"));

        long minimum = platformSettingsService.minimumFollowers(campaign.getPlatform());
        long followers = ConnectionVerificationService.effectiveFollowers(connection);
        if (followers < minimum) {
            throw new JobAcceptanceException(
                    String.format(
                            Locale.US,
                            "At least %,d followers on %s are required, you have %,d",
                            minimum, campaign.getPlatform().getDisplayName(), followers));
        }
    }
}
