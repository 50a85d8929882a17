package com.pushit.service.account;

import com.pushit.dto.request.RegisterRequest;
import com.pushit.entity.Brand;
import com.pushit.entity.Currency;
import com.pushit.entity.Influencer;
import com.pushit.entity.User;
import com.pushit.entity.UserRole;
import com.pushit.exception.ApiException;
import com.pushit.exception.InvalidTokenException;
import com.pushit.exception.ResourceNotFoundException;
import com.pushit.repository.BrandRepository;
import com.pushit.repository.InfluencerRepository;
import com.pushit.repository.UserRepository;
import com.pushit.security.EmailVerificationTokenService;
import com.pushit.security.EmailVerificationTokenService.VerifiedToken;
import com.pushit.service.currency.CurrencyService;
import com.pushit.service.email.EmailService;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    private final UserRepository userRepository;
    private final BrandRepository brandRepository;
    private final InfluencerRepository influencerRepository;
    private final CurrencyService currencyService;
    private final PasswordEncoder passwordEncoder;
    private final EmailVerificationTokenService tokenService;
    private final EmailService emailService;

    /**
     * Creates the user with an empty brand or influencer profile in the default currency, then
     * sends the email verification link.
     */
    @Transactional
    public User register(RegisterRequest request) {
        String email = request.getEmail().trim().toLowerCase(Locale.ROOT);
        if (userRepository.existsByEmailIgnoreCase(email)) {
            throw new ApiException(
                    "An account with this email already exists",
                    HttpStatus.CONFLICT,
                    "EMAIL_TAKEN");
        }
        UserRole role = UserRole.valueOf(request.getRole());
        if (role == UserRole.ADMIN) {
            throw new ApiException(
                    "Administrators cannot self-register",
                    HttpStatus.FORBIDDEN,
                    "ROLE_NOT_ALLOWED");
        }

        User user =
                userRepository.save(
                        User.builder()
                                .email(email)
                                .passwordHash(passwordEncoder.encode(request.getPassword()))
                                .role(role)
                                .build());

        Currency currency = currencyService.getDefault().orElse(null);
        if (role == UserRole.BRAND) {
            brandRepository.save(Brand.builder().user(user).currency(currency).build());
        } else {
            influencerRepository.save(Influencer.builder().user(user).currency(currency).build());
        }
        log.info("Registered {} account {}", role, user.getId());

        emailService.sendVerificationEmail(email, tokenService.generateToken(user));
        return user;
    }

    /**
     * Marks the email as verified. A token only works once, and only while the account still has
     * the address it was issued for.
     */
    @Transactional
    public User confirmEmail(String token) {
        VerifiedToken verified = tokenService.parse(token);
        User user =
                userRepository
                        .findById(verified.userId())
                        .orElseThrow(
                                () -> new ResourceNotFoundException("User", verified.userId()));

        if (user.isEmailVerified()) {
            throw new InvalidTokenException("Email address is already verified");
        }
        if (verified.email() == null || !verified.email().equalsIgnoreCase(user.getEmail())) {
            throw new InvalidTokenException("Verification link no longer matches this account");
        }
        user.setEmailVerified(true);
        User saved = userRepository.save(user);
        log.info("User {} verified their email address", user.getId());
        return saved;
    }

    /** Sends a fresh verification link to an unverified account. */
    @Transactional(readOnly = true)
    public void resendVerification(User user) {
        if (user.isEmailVerified()) {
            throw new ApiException(
                    "Email address is already verified", HttpStatus.CONFLICT, "ALREADY_VERIFIED");
        }
        emailService.sendVerificationEmail(user.getEmail(), tokenService.generateToken(user));
    }
}
