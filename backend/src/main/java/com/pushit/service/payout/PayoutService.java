package com.pushit.service.payout;

import com.pushit.dto.response.PayoutResponse;
import com.pushit.dto.response.WalletSummaryResponse;
import com.pushit.entity.Influencer;
import com.pushit.entity.NotificationType;
import com.pushit.entity.Payout;
import com.pushit.entity.PayoutStatus;
import com.pushit.entity.SubmissionStatus;
import com.pushit.entity.User;
import com.pushit.entity.WithdrawalRequest;
import com.pushit.exception.ApiException;
import com.pushit.exception.ResourceNotFoundException;
import com.pushit.repository.PayoutRepository;
import com.pushit.service.currency.CurrencyService;
import com.pushit.service.notification.NotificationService;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Influencer payouts. A payout is reserved as PENDING when a job is accepted and settled by an
 * administrator once the money has actually moved.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PayoutService {

    private static final int RECENT_PAYOUTS = 10;

    private final PayoutRepository payoutRepository;
    private final CurrencyService currencyService;
    private final NotificationService notificationService;

    @Transactional
    public Payout markPayoutSent(User admin, Long payoutId, String reference, String notes) {
        Payout payout = getPayout(payoutId);
        if (payout.getStatus() != PayoutStatus.PENDING) {
            throw new ApiException(
                    "Only pending payouts can be marked as sent, payout is " + payout.getStatus(),
                    HttpStatus.CONFLICT,
                    "PAYOUT_NOT_PENDING");
        }
        payout.setStatus(PayoutStatus.SENT);
        payout.setSentAt(LocalDateTime.now());
        payout.setSentBy(admin);
        payout.setReference(reference);
        payout.setNotes(notes);
        Payout saved = payoutRepository.save(payout);
        log.info(
                "Payout {} of {} {} marked sent by admin {}",
                payoutId,
                payout.getAmount(),
                payout.getCurrency(),
                admin.getId());

        notificationService.notify(
                payout.getInfluencer().getUser(),
                NotificationType.PAYOUT_SENT,
                "Payout sent",
                "Your payout of "
                        + currencyService.format(payout.getAmount(), payout.getCurrency())
                        + " has been sent.",
                payout.getSubmission().getId(),
                payoutId);
        return saved;
    }

    @Transactional
    public Payout markPayoutFailed(User admin, Long payoutId, String notes) {
        Payout payout = getPayout(payoutId);
        if (payout.getStatus() == PayoutStatus.SENT) {
            throw new ApiException(
                    "Payout " + payoutId + " was already sent",
                    HttpStatus.CONFLICT,
                    "PAYOUT_ALREADY_SENT");
        }
        payout.setStatus(PayoutStatus.FAILED);
        payout.setNotes(notes);
        Payout saved = payoutRepository.save(payout);
        log.warn("Payout {} marked failed by admin {}: {}", payoutId, admin.getId(), notes);
        return saved;
    }

    /** Pending payouts whose due date has passed, oldest first. */
    @Transactional(readOnly = true)
    public List<Payout> overduePayouts() {
        return payoutRepository.findOverdue(LocalDate.now());
    }

    @Transactional(readOnly = true)
    public List<Payout> listForInfluencer(Long influencerId) {
        return payoutRepository.findByInfluencerIdOrderByCreatedAtDesc(influencerId);
    }

    /**
     * Payouts ready to withdraw: pending, with the work already approved and not yet claimed by
     * a withdrawal request.
     */
    @Transactional(readOnly = true)
    public BigDecimal availableBalance(Influencer influencer) {
        return sumInCurrency(withdrawablePayouts(influencer), settlementCurrency(influencer));
    }

    @Transactional(readOnly = true)
    public List<Payout> withdrawablePayouts(Influencer influencer) {
        return payoutRepository.findWithdrawable(influencer.getId());
    }

    /** Ties the payouts to the request so they stop counting towards the available balance. */
    @Transactional
    public void claimForWithdrawal(List<Payout> payouts, WithdrawalRequest request) {
        payouts.forEach(p -> p.setWithdrawalRequest(request));
        payoutRepository.saveAll(payouts);
    }

    /** Earnings overview in the influencer's settlement currency. */
    @Transactional(readOnly = true)
    public WalletSummaryResponse walletSummary(Influencer influencer) {
        String currency = settlementCurrency(influencer);
        LocalDate today = LocalDate.now();

        BigDecimal available = availableBalance(influencer);
        BigDecimal pendingClearance =
                sumInCurrency(
                        payoutRepository.findPendingByInfluencerAndSubmissionStatus(
                                influencer.getId(),
                                EnumSet.of(SubmissionStatus.NEW, SubmissionStatus.IN_REVIEW)),
                        currency);
        BigDecimal totalEarned =
                sumInCurrency(
                        payoutRepository.findByInfluencerIdAndStatus(
                                influencer.getId(), PayoutStatus.SENT),
                        currency);

        List<Payout> payouts = listForInfluencer(influencer.getId());
        long overdueCount = payouts.stream().filter(p -> p.isOverdue(today)).count();
        List<PayoutResponse> recent =
                payouts.stream()
                        .limit(RECENT_PAYOUTS)
                        .map(p -> PayoutResponse.fromEntity(p, today))
                        .toList();

        return WalletSummaryResponse.builder()
                .currency(currency)
                .available(available)
                .pendingClearance(pendingClearance)
                .totalEarned(totalEarned)
                .availableFormatted(currencyService.format(available, currency))
                .overdueCount(overdueCount)
                .recentPayouts(recent)
                .build();
    }

    public String settlementCurrency(Influencer influencer) {
        return influencer.getCurrency() != null
                ? influencer.getCurrency().getCode()
                : currencyService.getDefaultCode();
    }

    public BigDecimal sumInCurrency(Collection<Payout> payouts, String currency) {
        return payouts.stream()
                .map(p -> currencyService.convert(p.getAmount(), p.getCurrency(), currency))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private Payout getPayout(Long payoutId) {
        return payoutRepository
                .findById(payoutId)
                .orElseThrow(() -> new ResourceNotFoundException("Payout", payoutId));
    }
}
