package com.pushit.service;

import com.pushit.config.AppProperties;
import com.pushit.entity.Currency;
import com.pushit.entity.User;
import com.pushit.entity.UserRole;
import com.pushit.repository.CurrencyRepository;
import com.pushit.repository.UserRepository;
import java.math.BigDecimal;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/** Seeds the first admin account and the default currency on an empty database. */
@Slf4j
@Service
@RequiredArgsConstructor
public class StartupService implements ApplicationRunner {

    private final UserRepository userRepository;
    private final CurrencyRepository currencyRepository;
    private final PasswordEncoder passwordEncoder;
    private final AppProperties appProperties;

    @Value("${ADMIN_EMAIL:admin@pushit.local}")
    private String adminEmail;

    @Value("${ADMIN_PASSWORD:}")
    private String adminPassword;

    @Override
    @Transactional(propagation = Propagation.REQUIRED)
    public void run(ApplicationArguments args) {
        createDefaultCurrency();
        createDefaultAdmin();
    }

    private void createDefaultCurrency() {
        if (currencyRepository.count() > 0) {
            return;
        }
        String code = appProperties.wallet().fallbackCurrencyCode();
        currencyRepository.save(
                Currency.builder()
                        .code(code)
                        .name("GHS".equals(code) ? "Ghanaian Cedi" : code)
                        .symbol("GHS".equals(code) ? "GH₵" : code)
                        .isDefault(true)
                        .isActive(true)
                        .exchangeRate(BigDecimal.ONE)
                        .build());
        log.info("Created default currency {}", code);
    }

    private void createDefaultAdmin() {
        if (userRepository.existsByRole(UserRole.ADMIN)) {
            return;
        }
        if (adminPassword == null || adminPassword.isBlank()) {
            log.warn("No admin account exists and ADMIN_PASSWORD is not set, skipping admin seed");
            return;
        }
        User admin =
                User.builder()
                        .email(adminEmail.trim().toLowerCase(Locale.ROOT))
                        .passwordHash(passwordEncoder.encode(adminPassword))
                        .role(UserRole.ADMIN)
                        .emailVerified(true)
                        .active(true)
                        .build();
        userRepository.save(admin);
        log.info("Created default admin user {} (password configured via environment)", adminEmail);
    }
}
