package com.pushit.service.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pushit.client.PaystackClient;
import com.pushit.config.AppProperties;
import com.pushit.dto.response.TopUpResponse;
import com.pushit.entity.Brand;
import com.pushit.entity.PaymentTransaction;
import com.pushit.entity.TransactionStatus;
import com.pushit.entity.TransactionType;
import com.pushit.exception.ApiException;
import com.pushit.exception.InvalidAmountException;
import com.pushit.exception.PaymentGatewayException;
import com.pushit.exception.ResourceNotFoundException;
import com.pushit.repository.PaymentTransactionRepository;
import com.pushit.service.wallet.WalletService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
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
 * Wallet top-ups through Paystack. A top-up is recorded as PENDING when checkout starts and only
 * credits the wallet once Paystack confirms it, either through the signed webhook or by polling the
 * verify endpoint. Both paths apply the same state change and ignore transactions that are
 * already final.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaystackService {

    static final String SIGNATURE_ALGORITHM = "HmacSHA512";

    private static final BigDecimal MINOR_UNITS = BigDecimal.valueOf(100);
    static final String AMOUNT_MISMATCH = "AMOUNT_MISMATCH";

    private final PaystackClient paystackClient;
    private final PaymentTransactionRepository transactionRepository;
    private final WalletService walletService;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    /** Starts a hosted checkout for a wallet top-up. */
    @Transactional(rollbackFor = Exception.class)
    public TopUpResponse initializeTopUp(Brand brand, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidAmountException("Top-up amount must be greater than zero");
        }
        requireSecretKey();

        BigDecimal scaled = amount.setScale(2, RoundingMode.HALF_UP);
        String currency = walletService.walletCurrency(brand);
        String reference = WalletService.newReference(WalletService.TOPUP_REFERENCE_PREFIX);
        long amountMinor = scaled.multiply(MINOR_UNITS).longValueExact();

        PaystackClient.Initialization initialization =
                paystackClient.initialize(
                        brand.getUser().getEmail(),
                        amountMinor,
                        currency,
                        reference,
                        Map.of(
                                "brand_id", brand.getId(),
                                "type", TransactionType.WALLET_TOPUP.name()));

        transactionRepository.save(
                PaymentTransaction.builder()
                        .user(brand.getUser())
                        .brand(brand)
                        .amount(scaled)
                        .currency(currency)
                        .reference(reference)
                        .type(TransactionType.WALLET_TOPUP)
                        .status(TransactionStatus.PENDING)
                        .description("Wallet top-up")
                        .build());
        log.info("Brand {} started top-up {} of {} {}", brand.getId(), reference, scaled, currency);

        return TopUpResponse.builder()
                .reference(reference)
                .authorizationUrl(initialization.authorizationUrl())
                .accessCode(initialization.accessCode())
                .amount(scaled)
                .currency(currency)
                .build();
    }

    /**
     * Asks Paystack for the transaction's final status and applies it. Used by the checkout
     * callback and as a fallback when the webhook has not arrived.
     */
    @Transactional(rollbackFor = Exception.class)
    @Retryable(
            retryFor = {
                ObjectOptimisticLockingFailureException.class,
                CannotAcquireLockException.class
            },
            maxAttempts = 3,
            backoff = @Backoff(delay = 100, multiplier = 2, random = true))
    public PaymentTransaction verifyTransaction(String reference) {
        requireSecretKey();
        PaystackClient.Verification verification = paystackClient.verify(reference);
        if (verification.isSuccess()) {
            return applySuccess(
                            reference,
                            verification.amountMinor(),
                            verification.authorizationCode(),
                            verification.customerCode())
                    .orElseThrow(() -> new ResourceNotFoundException("Transaction", reference));
        }
        if (verification.isFailed()) {
            return applyFailure(reference)
                    .orElseThrow(() -> new ResourceNotFoundException("Transaction", reference));
        }
        return transactionRepository
                .findByReference(reference)
                .orElseThrow(() -> new ResourceNotFoundException("Transaction", reference));
    }

    /**
     * Handles a Paystack event delivered to the webhook. The signature must be the hex HMAC-SHA512
     * of the raw body under the secret key.
     *
     * @throws ApiException with status 400 when the signature is missing or wrong, or the body is
     *     not JSON
     */
    @Transactional(rollbackFor = Exception.class)
    @Retryable(
            retryFor = {
                ObjectOptimisticLockingFailureException.class,
                CannotAcquireLockException.class
            },
            maxAttempts = 3,
            backoff = @Backoff(delay = 100, multiplier = 2, random = true))
    public void handleWebhook(String rawBody, String signature) {
        if (!isValidSignature(rawBody, signature)) {
            log.warn("Rejected Paystack webhook with a missing or invalid signature");
            throw new ApiException(
                    "Invalid webhook signature", HttpStatus.BAD_REQUEST, "INVALID_SIGNATURE");
        }

        JsonNode event;
        try {
            event = objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new ApiException(
                    "Webhook body is not valid JSON", e, HttpStatus.BAD_REQUEST, "MALFORMED_JSON");
        }

        String type = event.path("event").asText("");
        JsonNode data = event.path("data");
        String reference = data.path("reference").asText(null);
        if (reference == null) {
            log.warn("Paystack {} event without a reference ignored", type);
            return;
        }

        switch (type) {
            case "charge.success" -> applySuccess(
                    reference,
                    data.path("amount").asLong(0),
                    data.path("authorization").path("authorization_code").asText(null),
                    data.path("customer").path("customer_code").asText(null));
            case "charge.failed" -> applyFailure(reference);
            default -> log.info("Paystack {} event for {} ignored", type, reference);
        }
    }

    /** Constant-time comparison of the expected and presented signatures. */
    public boolean isValidSignature(String rawBody, String signature) {
        String secret = appProperties.paystack().secretKey();
        if (rawBody == null || signature == null || signature.isBlank() || !hasText(secret)) {
            return false;
        }
        String expected = sign(rawBody, secret);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
    }

    static String sign(String payload, String secret) {
        try {
            Mac mac = Mac.getInstance(SIGNATURE_ALGORITHM);
            mac.init(
                    new SecretKeySpec(
                            secret.getBytes(StandardCharsets.UTF_8), SIGNATURE_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Cannot compute webhook signature", e);
        }
    }

    private Optional<PaymentTransaction> applySuccess(
            String reference, long amountMinor, String authorizationCode, String customerCode) {
        Optional<PaymentTransaction> found =
                transactionRepository.findByReferenceWithLock(reference);
        if (found.isEmpty()) {
            log.warn("Paystack success for unknown reference {}", reference);
            return found;
        }
        PaymentTransaction transaction = found.get();
        if (transaction.getStatus().isFinal()) {
            log.info(
                    "Transaction {} already {}, success ignored",
                    reference,
                    transaction.getStatus());
            return found;
        }

        long expectedMinor = transaction.getAmount().multiply(MINOR_UNITS).longValue();
        if (amountMinor > 0 && amountMinor != expectedMinor) {
            // The amount Paystack settled is what the ledger records and the wallet receives.
            BigDecimal verified =
                    BigDecimal.valueOf(amountMinor)
                            .divide(MINOR_UNITS, 2, RoundingMode.UNNECESSARY);
            log.warn(
                    "Paystack amount for {} is {} {}, requested {}. Recording the verified amount",
                    reference,
                    verified,
                    transaction.getCurrency(),
                    transaction.getAmount());
            transaction.setMetadata(
                    objectMapper
                            .createObjectNode()
                            .put("flag", AMOUNT_MISMATCH)
                            .put("requestedAmount", transaction.getAmount().toPlainString())
                            .put("verifiedAmount", verified.toPlainString())
                            .toString());
            transaction.setAmount(verified);
        }

        transaction.setStatus(TransactionStatus.SUCCESS);
        transaction.setAuthorizationCode(authorizationCode);
        transaction.setCustomerCode(customerCode);
        transaction.setPaidAt(LocalDateTime.now());
        transactionRepository.save(transaction);

        if (transaction.getType() == TransactionType.WALLET_TOPUP) {
            walletService.creditTopUp(transaction);
        }
        log.info("Transaction {} confirmed by Paystack", reference);
        return Optional.of(transaction);
    }

    private Optional<PaymentTransaction> applyFailure(String reference) {
        Optional<PaymentTransaction> found =
                transactionRepository.findByReferenceWithLock(reference);
        if (found.isEmpty()) {
            log.warn("Paystack failure for unknown reference {}", reference);
            return found;
        }
        PaymentTransaction transaction = found.get();
        if (transaction.getStatus().isFinal()) {
            log.info(
                    "Transaction {} already {}, failure ignored",
                    reference,
                    transaction.getStatus());
            return found;
        }
        transaction.setStatus(TransactionStatus.FAILED);
        transactionRepository.save(transaction);
        log.warn("Transaction {} failed at Paystack", reference);
        return found;
    }

    private void requireSecretKey() {
        String secret = appProperties.paystack().secretKey();
        if (!hasText(secret)
                || !(secret.startsWith("sk_test_") || secret.startsWith("sk_live_"))) {
            throw new PaymentGatewayException("Paystack secret key is not configured correctly");
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
