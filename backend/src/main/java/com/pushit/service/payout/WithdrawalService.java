package com.pushit.service.payout;

import com.pushit.config.AppProperties;
import com.pushit.entity.Influencer;
import com.pushit.entity.PaymentMethod;
import com.pushit.entity.Payout;
import com.pushit.entity.WithdrawalRequest;
import com.pushit.entity.WithdrawalStatus;
import com.pushit.exception.ApiException;
import com.pushit.exception.InvalidAmountException;
import com.pushit.exception.ResourceNotFoundException;
import com.pushit.repository.InfluencerRepository;
import com.pushit.repository.WithdrawalRequestRepository;
import com.pushit.service.currency.CurrencyService;
import com.pushit.service.payment.PaymentMethodService;
import java.math.BigDecimal;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class WithdrawalService {

    private final WithdrawalRequestRepository withdrawalRequestRepository;
    private final InfluencerRepository influencerRepository;
    private final PayoutService payoutService;
    private final PaymentMethodService paymentMethodService;
    private final CurrencyService currencyService;
    private final AppProperties appProperties;

    /**
     * Requests withdrawal of the whole available balance to the influencer's default payment
     * method. The minimum is configured in the default currency and converted first.
     *
     * <p>The influencer row is locked for the duration, and the payouts drawn on are linked to
     * the new request, so the same earnings cannot be requested twice.
     */
    @Transactional
    public WithdrawalRequest requestWithdrawal(Influencer influencer) {
        Influencer locked =
                influencerRepository
                        .findByIdWithLock(influencer.getId())
                        .orElseThrow(
                                () ->
                                        new ResourceNotFoundException(
                                                "Influencer", influencer.getId()));
        String currency = payoutService.settlementCurrency(locked);
        List<Payout> payouts = payoutService.withdrawablePayouts(locked);
        BigDecimal available = payoutService.sumInCurrency(payouts, currency);
        if (available.signum() <= 0) {
            throw new InvalidAmountException("No funds available for withdrawal");
        }

        BigDecimal minimum =
                currencyService.convert(
                        appProperties.wallet().minimumWithdrawal(),
                        currencyService.getDefaultCode(),
                        currency);
        if (available.compareTo(minimum) < 0) {
            throw new InvalidAmountException(
                    "Minimum withdrawal is " + currencyService.format(minimum, currency));
        }

        PaymentMethod method =
                paymentMethodService
                        .findDefault(locked.getId())
                        .orElseThrow(
                                () ->
                                        new ApiException(
                                                "Add a default payment method before withdrawing",
                                                HttpStatus.BAD_REQUEST,
                                                "NO_PAYMENT_METHOD"));

        WithdrawalRequest request =
                withdrawalRequestRepository.save(
                        WithdrawalRequest.builder()
                                .influencer(locked)
                                .paymentMethod(method)
                                .amount(available)
                                .currency(currency)
                                .status(WithdrawalStatus.PENDING)
                                .build());
        payoutService.claimForWithdrawal(payouts, request);
        log.info(
                "Influencer {} requested withdrawal of {} {} to method {} covering {} payouts",
                locked.getId(),
                available,
                currency,
                method.getId(),
                payouts.size());
        return request;
    }

    @Transactional(readOnly = true)
    public List<WithdrawalRequest> listForInfluencer(Long influencerId) {
        return withdrawalRequestRepository.findByInfluencerIdOrderByCreatedAtDesc(influencerId);
    }
}
