package com.pushit.service.wallet;

import com.pushit.entity.Brand;
import com.pushit.entity.Campaign;
import com.pushit.entity.PaymentTransaction;
import com.pushit.entity.TransactionStatus;
import com.pushit.entity.TransactionType;
import com.pushit.exception.InsufficientBalanceException;
import com.pushit.exception.InvalidAmountException;
import com.pushit.exception.ResourceNotFoundException;
import com.pushit.repository.BrandRepository;
import com.pushit.repository.PaymentTransactionRepository;
import com.pushit.service.currency.CurrencyService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Brand wallet ledger. Every balance change locks the brand row and writes a {@link
 * PaymentTransaction} with the balance before and after. Methods join the caller's transaction so a
 * debit commits or rolls back together with whatever it pays for.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WalletService {

    public static final String CAMPAIGN_REFERENCE_PREFIX = "CAMPAIGN";
    public static final String TOPUP_REFERENCE_PREFIX = "WALLET";

    private static final int SCALE = 2;
    private static final RoundingMode ROUNDING_MODE = RoundingMode.HALF_UP;

    private final BrandRepository brandRepository;
    private final PaymentTransactionRepository transactionRepository;
    private final CurrencyService currencyService;

    /** Wallet currency of the brand, or the platform default when the brand has none. */
    public String walletCurrency(Brand brand) {
        return brand.getCurrency() != null
                ? brand.getCurrency().getCode()
                : currencyService.getDefaultCode();
    }

    /**
     * Debits the campaign budget from the brand wallet and records a successful CAMPAIGN_PAYMENT.
     * The budget is converted from the campaign currency into the wallet currency first.
     *
     * @throws InsufficientBalanceException when the wallet cannot cover the budget
     */
    @Transactional(propagation = Propagation.REQUIRED, timeout = 10, rollbackFor = Exception.class)
    public PaymentTransaction debitForCampaign(Long brandId, Campaign campaign) {
        Objects.requireNonNull(campaign, "Campaign cannot be null");
        Objects.requireNonNull(campaign.getId(), "Campaign must be saved before it is paid for");

        Brand brand = lockBrand(brandId);
        String walletCurrency = walletCurrency(brand);
        BigDecimal amount =
                scale(
                        currencyService.convert(
                                campaign.getBudget(), campaign.getCurrency(), walletCurrency));
        validateAmount(amount);

        BigDecimal before = brand.getWalletBalance();
        if (before.compareTo(amount) < 0) {
            throw new InsufficientBalanceException(
                    String.format(
                            "Insufficient wallet balance. Available: %s, required: %s",
                            currencyService.format(before, walletCurrency),
                            currencyService.format(amount, walletCurrency)));
        }
        BigDecimal after = before.subtract(amount);
        brand.setWalletBalance(after);
        brandRepository.save(brand);

        PaymentTransaction transaction =
                PaymentTransaction.builder()
                        .user(brand.getUser())
                        .brand(brand)
                        .amount(amount)
                        .currency(walletCurrency)
                        .reference(newReference(CAMPAIGN_REFERENCE_PREFIX))
                        .type(TransactionType.CAMPAIGN_PAYMENT)
                        .status(TransactionStatus.SUCCESS)
                        .campaignId(campaign.getId())
                        .balanceBefore(before)
                        .balanceAfter(after)
                        .description("Payment for campaign: " + campaign.getName())
                        .paidAt(LocalDateTime.now())
                        .build();
        PaymentTransaction saved = transactionRepository.save(transaction);

        log.info(
                "Debited {} {} from brand {} for campaign {}. New balance: {}",
                amount,
                walletCurrency,
                brandId,
                campaign.getId(),
                after);
        return saved;
    }

    /** Whether the campaign has already been paid for. */
    @Transactional(readOnly = true)
    public boolean isCampaignPaid(Long campaignId) {
        return transactionRepository.existsByCampaignIdAndTypeAndStatus(
                campaignId, TransactionType.CAMPAIGN_PAYMENT, TransactionStatus.SUCCESS);
    }

    /**
     * Credits a confirmed top-up to the wallet. The transaction must already be marked SUCCESS by
     * the caller; the balance snapshot is written onto it.
     *
     * @return the new balance
     */
    @Transactional(propagation = Propagation.REQUIRED, timeout = 10, rollbackFor = Exception.class)
    public BigDecimal creditTopUp(PaymentTransaction transaction) {
        if (transaction.getType() != TransactionType.WALLET_TOPUP) {
            throw new IllegalArgumentException(
                    "Only wallet top-ups can be credited: " + transaction.getReference());
        }
        Brand brand = lockBrand(transaction.getBrand().getId());
        String walletCurrency = walletCurrency(brand);
        BigDecimal amount =
                scale(
                        currencyService.convert(
                                transaction.getAmount(),
                                transaction.getCurrency(),
                                walletCurrency));
        validateAmount(amount);

        BigDecimal before = brand.getWalletBalance();
        BigDecimal after = before.add(amount);
        brand.setWalletBalance(after);
        brandRepository.save(brand);

        transaction.setBalanceBefore(before);
        transaction.setBalanceAfter(after);
        transactionRepository.save(transaction);

        log.info(
                "Credited {} {} to brand {} from top-up {}. New balance: {}",
                amount,
                walletCurrency,
                brand.getId(),
                transaction.getReference(),
                after);
        return after;
    }

    @Transactional(readOnly = true)
    public List<PaymentTransaction> history(Long brandId) {
        return transactionRepository.findByBrandIdOrderByCreatedAtDesc(brandId);
    }

    /** {@code PREFIX_} followed by 12 upper-case hex characters. */
    public static String newReference(String prefix) {
        String hex = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        return prefix + "_" + hex.toUpperCase(Locale.ROOT);
    }

    private Brand lockBrand(Long brandId) {
        return brandRepository
                .findByIdWithLock(brandId)
                .orElseThrow(() -> new ResourceNotFoundException("Brand", brandId));
    }

    private static void validateAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidAmountException("Amount must be greater than zero");
        }
    }

    private static BigDecimal scale(BigDecimal amount) {
        return amount == null ? null : amount.setScale(SCALE, ROUNDING_MODE);
    }
}
