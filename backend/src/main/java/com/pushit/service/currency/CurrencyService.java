package com.pushit.service.currency;

import com.pushit.config.AppProperties;
import com.pushit.dto.request.CurrencyRequest;
import com.pushit.entity.Currency;
import com.pushit.exception.CurrencyConversionException;
import com.pushit.exception.ResourceNotFoundException;
import com.pushit.repository.CurrencyRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Currency catalogue and conversion. Every rate is expressed against the single default currency,
 * so conversion always goes through the default: {@code from -> default -> to}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CurrencyService {

    private static final int MONEY_SCALE = 2;

    private final CurrencyRepository currencyRepository;
    private final AppProperties appProperties;

    /**
     * The platform default currency, falling back to the configured fallback code when no row is
     * flagged as default.
     */
    @Transactional(readOnly = true)
    public Optional<Currency> getDefault() {
        List<Currency> defaults = currencyRepository.findDefaults();
        if (!defaults.isEmpty()) {
            if (defaults.size() > 1) {
                log.error(
                        "Found {} default currencies, using {}",
                        defaults.size(),
                        defaults.get(0));
            }
            return Optional.of(defaults.get(0));
        }
        return currencyRepository.findByCode(appProperties.wallet().fallbackCurrencyCode());
    }

    public String getDefaultCode() {
        return getDefault()
                .map(Currency::getCode)
                .orElse(appProperties.wallet().fallbackCurrencyCode());
    }

    @Transactional(readOnly = true)
    public Currency getByCode(String code) {
        return currencyRepository
                .findByCode(normalize(code))
                .orElseThrow(() -> new ResourceNotFoundException("Currency", code));
    }

    @Transactional(readOnly = true)
    public List<Currency> listActive() {
        return currencyRepository.findActive();
    }

    @Transactional(readOnly = true)
    public List<Currency> listAll() {
        return currencyRepository.findAll();
    }

    @Transactional
    public Currency create(CurrencyRequest request) {
        String code = normalize(request.getCode());
        if (currencyRepository.findByCode(code).isPresent()) {
            throw new IllegalArgumentException("Currency " + code + " already exists");
        }
        Currency currency =
                Currency.builder()
                        .code(code)
                        .name(request.getName())
                        .symbol(request.getSymbol())
                        .exchangeRate(
                                request.getExchangeRate() != null
                                        ? request.getExchangeRate()
                                        : BigDecimal.ONE)
                        .isActive(request.isActive())
                        .build();
        Currency saved = currencyRepository.save(currency);
        log.info("Created currency {} with rate {}", saved.getCode(), saved.getExchangeRate());
        return saved;
    }

    @Transactional
    public Currency update(String code, CurrencyRequest request) {
        Currency currency = getByCode(code);
        currency.setName(request.getName());
        currency.setSymbol(request.getSymbol());
        if (request.getExchangeRate() != null) {
            currency.setExchangeRate(request.getExchangeRate());
        }
        if (!request.isActive() && currency.isDefault()) {
            throw new IllegalArgumentException("The default currency cannot be deactivated");
        }
        currency.setActive(request.isActive());
        log.info("Updated currency {}: rate {}", currency.getCode(), currency.getExchangeRate());
        return currencyRepository.save(currency);
    }

    @Transactional
    public void delete(String code) {
        Currency currency = getByCode(code);
        if (currency.isDefault()) {
            throw new IllegalArgumentException("The default currency cannot be deleted");
        }
        currencyRepository.delete(currency);
        log.info("Deleted currency {}", currency.getCode());
    }

    /**
     * Makes {@code code} the default. The previous default is cleared in the same transaction, so
     * exactly one default is visible once it commits.
     */
    @Transactional
    public Currency setDefault(String code) {
        Currency currency = getByCode(code);
        if (!currency.isActive()) {
            throw new IllegalArgumentException("Inactive currency cannot be the default");
        }
        currency.setDefault(true);
        Currency saved = currencyRepository.saveAndFlush(currency);
        int cleared = currencyRepository.clearDefaultExcept(saved.getId());
        log.info(
                "Default currency set to {} ({} previous default cleared)",
                saved.getCode(),
                cleared);
        return saved;
    }

    /**
     * Converts between two currency codes through the default currency. Unknown codes, or a missing
     * default, leave the amount unchanged.
     */
    @Transactional(readOnly = true)
    public BigDecimal convert(BigDecimal amount, String fromCode, String toCode) {
        if (amount == null) {
            throw new CurrencyConversionException("Amount is required for conversion");
        }
        if (fromCode == null || toCode == null || fromCode.equalsIgnoreCase(toCode)) {
            return amount;
        }

        Optional<Currency> from = currencyRepository.findByCode(normalize(fromCode));
        Optional<Currency> to = currencyRepository.findByCode(normalize(toCode));
        Optional<Currency> defaultCurrency = getDefault();
        if (from.isEmpty() || to.isEmpty() || defaultCurrency.isEmpty()) {
            log.warn(
                    "Cannot convert {} -> {}: unknown currency or no default, amount unchanged",
                    fromCode,
                    toCode);
            return amount;
        }
        return convert(amount, from.get(), to.get(), defaultCurrency.get().getCode());
    }

    BigDecimal convert(BigDecimal amount, Currency from, Currency to, String defaultCode) {
        BigDecimal inDefault = amount;
        if (!from.getCode().equals(defaultCode) && isUsableRate(from.getExchangeRate())) {
            inDefault = amount.multiply(from.getExchangeRate());
        }

        BigDecimal result = inDefault;
        if (!to.getCode().equals(defaultCode) && isUsableRate(to.getExchangeRate())) {
            result = inDefault.divide(to.getExchangeRate(), 10, RoundingMode.HALF_UP);
        }
        return result.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /** Formats an amount with the currency symbol, e.g. {@code GH₵1,250.00}. */
    public String format(BigDecimal amount, String code) {
        String symbol =
                code == null
                        ? ""
                        : currencyRepository
                                .findByCode(normalize(code))
                                .map(Currency::getSymbol)
                                .orElse(code + " ");
        return symbol
                + String.format(
                        Locale.US, "%,.2f", amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP));
    }

    private boolean isUsableRate(BigDecimal rate) {
        return rate != null && rate.signum() > 0;
    }

    private String normalize(String code) {
        return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
    }
}
