package com.pushit.security;

import com.pushit.config.AppProperties;
import com.pushit.entity.User;
import com.pushit.exception.InvalidTokenException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import javax.crypto.SecretKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Signed, time-limited tokens embedded in email verification links. */
@Slf4j
@Service
public class EmailVerificationTokenService {

    static final String PURPOSE_CLAIM = "purpose";
    static final String EMAIL_CLAIM = "email";
    static final String EMAIL_VERIFICATION = "email-verification";

    private final SecretKey key;
    private final AppProperties.Email settings;

    public EmailVerificationTokenService(AppProperties appProperties) {
        this.settings = appProperties.email();
        this.key = Keys.hmacShaKeyFor(settings.tokenSecret().getBytes(StandardCharsets.UTF_8));
    }

    public String generateToken(User user) {
        Date now = new Date();
        Date expiry = new Date(now.getTime() + settings.tokenTtl().toMillis());
        return Jwts.builder()
                .subject(String.valueOf(user.getId()))
                .claim(PURPOSE_CLAIM, EMAIL_VERIFICATION)
                .claim(EMAIL_CLAIM, user.getEmail())
                .issuer(settings.tokenIssuer())
                .issuedAt(now)
                .expiration(expiry)
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Validates signature, issuer, expiry and purpose.
     *
     * @throws InvalidTokenException when any of them does not hold
     */
    public VerifiedToken parse(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Verification token is missing");
        }
        Claims claims;
        try {
            claims =
                    Jwts.parser()
                            .requireIssuer(settings.tokenIssuer())
                            .verifyWith(key)
                            .build()
                            .parseSignedClaims(token)
                            .getPayload();
        } catch (ExpiredJwtException e) {
            log.warn("Expired email verification token");
            throw new InvalidTokenException("Verification link has expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Invalid email verification token: {}", e.getMessage());
            throw new InvalidTokenException("Verification link is invalid", e);
        }

        if (!EMAIL_VERIFICATION.equals(claims.get(PURPOSE_CLAIM, String.class))) {
            throw new InvalidTokenException("Token was not issued for email verification");
        }
        try {
            return new VerifiedToken(
                    Long.valueOf(claims.getSubject()), claims.get(EMAIL_CLAIM, String.class));
        } catch (NumberFormatException e) {
            throw new InvalidTokenException("Verification link is invalid", e);
        }
    }

    public record VerifiedToken(Long userId, String email) {}
}
