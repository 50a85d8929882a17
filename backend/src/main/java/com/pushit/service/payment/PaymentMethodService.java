package com.pushit.service.payment;

import com.pushit.dto.request.PaymentMethodRequest;
import com.pushit.entity.Influencer;
import com.pushit.entity.PaymentMethod;
import com.pushit.entity.PaymentMethodType;
import com.pushit.exception.ResourceNotFoundException;
import com.pushit.repository.PaymentMethodRepository;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Influencer payout destinations. Each influencer has at most one default method; the first method
 * added becomes it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentMethodService {

    private final PaymentMethodRepository paymentMethodRepository;

    @Transactional(readOnly = true)
    public List<PaymentMethod> list(Long influencerId) {
        return paymentMethodRepository.findByInfluencer(influencerId);
    }

    @Transactional(readOnly = true)
    public Optional<PaymentMethod> findDefault(Long influencerId) {
        return paymentMethodRepository.findDefault(influencerId);
    }

    @Transactional
    public PaymentMethod add(Influencer influencer, PaymentMethodRequest request) {
        validate(request);
        boolean first = paymentMethodRepository.countByInfluencerId(influencer.getId()) == 0;

        PaymentMethod method = PaymentMethod.builder().influencer(influencer).build();
        apply(method, request);
        method.setDefault(first || request.isMakeDefault());
        PaymentMethod saved = paymentMethodRepository.saveAndFlush(method);

        if (saved.isDefault()) {
            paymentMethodRepository.clearDefaultExcept(influencer.getId(), saved.getId());
        }
        log.info(
                "Influencer {} added {} payment method {}{}",
                influencer.getId(),
                saved.getMethodType(),
                saved.getId(),
                saved.isDefault() ? " (default)" : "");
        return saved;
    }

    @Transactional
    public PaymentMethod update(Long influencerId, Long methodId, PaymentMethodRequest request) {
        validate(request);
        PaymentMethod method = getOwned(influencerId, methodId);
        apply(method, request);
        PaymentMethod saved = paymentMethodRepository.save(method);
        if (request.isMakeDefault() && !saved.isDefault()) {
            return setDefault(influencerId, methodId);
        }
        return saved;
    }

    /** Makes the method the influencer's default and clears every other default in one unit. */
    @Transactional
    public PaymentMethod setDefault(Long influencerId, Long methodId) {
        PaymentMethod method = getOwned(influencerId, methodId);
        method.setDefault(true);
        paymentMethodRepository.saveAndFlush(method);
        int cleared = paymentMethodRepository.clearDefaultExcept(influencerId, methodId);
        log.info(
                "Payment method {} is now the default for influencer {} ({} cleared)",
                methodId,
                influencerId,
                cleared);
        return paymentMethodRepository
                .findById(methodId)
                .orElseThrow(() -> new ResourceNotFoundException("PaymentMethod", methodId));
    }

    /** Removes the method. When it was the default, the most recent remaining method takes over. */
    @Transactional
    public void delete(Long influencerId, Long methodId) {
        PaymentMethod method = getOwned(influencerId, methodId);
        boolean wasDefault = method.isDefault();
        paymentMethodRepository.delete(method);
        paymentMethodRepository.flush();

        if (wasDefault) {
            paymentMethodRepository.findByInfluencer(influencerId).stream()
                    .findFirst()
                    .ifPresent(
                            next -> {
                                next.setDefault(true);
                                paymentMethodRepository.save(next);
                                log.info(
                                        "Payment method {} promoted to default for influencer {}",
                                        next.getId(),
                                        influencerId);
                            });
        }
        log.info("Payment method {} removed for influencer {}", methodId, influencerId);
    }

    private PaymentMethod getOwned(Long influencerId, Long methodId) {
        return paymentMethodRepository
                .findById(methodId)
                .filter(m -> m.getInfluencer().getId().equals(influencerId))
                .orElseThrow(() -> new ResourceNotFoundException("PaymentMethod", methodId));
    }

    private static void apply(PaymentMethod method, PaymentMethodRequest request) {
        method.setMethodType(request.getMethodType());
        if (request.getMethodType() == PaymentMethodType.BANK) {
            method.setBankName(request.getBankName());
            method.setAccountNumber(request.getAccountNumber());
            method.setAccountName(request.getAccountName());
            method.setMobileMoneyNetwork(null);
            method.setMobileMoneyNumber(null);
            method.setMobileMoneyName(null);
        } else {
            method.setMobileMoneyNetwork(request.getMobileMoneyNetwork());
            method.setMobileMoneyNumber(request.getMobileMoneyNumber());
            method.setMobileMoneyName(request.getMobileMoneyName());
            method.setBankName(null);
            method.setAccountNumber(null);
            method.setAccountName(null);
        }
    }

    private static void validate(PaymentMethodRequest request) {
        if (request.getMethodType() == PaymentMethodType.BANK
                && (isBlank(request.getBankName())
                        || isBlank(request.getAccountNumber())
                        || isBlank(request.getAccountName()))) {
            throw new IllegalArgumentException(
                    "Bank name, account number and account name are required for bank transfers");
        }
        if (request.getMethodType() == PaymentMethodType.MOBILE_MONEY
                && (request.getMobileMoneyNetwork() == null
                        || isBlank(request.getMobileMoneyNumber()))) {
            throw new IllegalArgumentException(
                    "Network and number are required for mobile money");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
