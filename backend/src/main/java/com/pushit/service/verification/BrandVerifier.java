package com.pushit.service.verification;

import com.pushit.config.AppProperties;
import com.pushit.entity.Brand;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Rule checks over a brand profile. Company name, industry, description and contact are always
 * scored; the website only counts when one is given.
 */
@Component
public class BrandVerifier {

    private static final List<Pattern> SUSPICIOUS_NAME_PATTERNS =
            List.of(
                    Pattern.compile("^test", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("^demo", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("^example", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("\\d{10,}"));

    private static final List<String> COMMON_INDUSTRIES =
            List.of(
                    "fashion", "tech", "food", "beauty", "fitness", "travel", "finance", "health",
                    "education", "entertainment", "sports", "automotive", "real estate", "retail",
                    "e-commerce");

    private static final List<String> SUSPICIOUS_KEYWORDS =
            List.of("test", "demo", "example", "lorem ipsum");

    private static final Pattern DOMAIN =
            Pattern.compile(
                    "^[a-zA-Z0-9]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?"
                            + "(\\.[a-zA-Z0-9]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?)*$");

    private static final List<String> COMMON_TLDS =
            List.of(".com", ".net", ".org", ".io", ".co", ".app", ".dev", ".tech", ".ai");

    private static final Pattern PHONE = Pattern.compile("^\\+?\\d{7,15}$");
    private static final Pattern PHONE_SEPARATORS = Pattern.compile("[\\s\\-()]");

    private final double passThreshold;

    public BrandVerifier(AppProperties appProperties) {
        this.passThreshold = appProperties.verification().brandPassThreshold();
    }

    public VerificationResult verify(Brand brand) {
        List<String> flags = new ArrayList<>();
        double totalScore = 0.0;
        int counted = 0;

        CheckResult name = checkCompanyName(brand.getCompanyName());
        CheckResult industry = checkIndustry(brand.getIndustry());
        CheckResult description = checkDescription(brand.getDescription());
        CheckResult contact = checkContact(brand.getContactEmail(), brand.getPhoneNumber());

        List<CheckResult> scored = new ArrayList<>(List.of(name, industry, description));
        if (hasText(brand.getWebsite())) {
            scored.add(checkWebsite(brand.getWebsite()));
        }
        scored.add(contact);

        for (CheckResult check : scored) {
            totalScore += check.score();
            counted++;
            flags.addAll(check.flags());
        }

        double confidence = counted > 0 ? totalScore / counted : 0.0;
        boolean requiredPassed =
                name.valid() && industry.valid() && description.valid() && contact.valid();
        boolean passed = requiredPassed && confidence >= passThreshold;

        return new VerificationResult(
                passed,
                passed ? "All checks passed" : "Some verification checks failed",
                Math.min(1.0, confidence),
                flags,
                false,
                null);
    }

    CheckResult checkCompanyName(String rawName) {
        if (!hasText(rawName)) {
            return CheckResult.of(false, 0.0, "Company name is required");
        }
        String name = rawName.trim();
        if (name.length() < 2) {
            return CheckResult.of(false, 0.2, "Company name too short");
        }

        List<String> flags = new ArrayList<>();
        for (Pattern pattern : SUSPICIOUS_NAME_PATTERNS) {
            if (pattern.matcher(name).find()) {
                flags.add("Suspicious company name pattern");
            }
        }
        if (!flags.isEmpty()) {
            return new CheckResult(true, 0.5, flags);
        }

        if (name.length() >= 3 && name.length() <= 100) {
            return CheckResult.of(true, 1.0);
        }
        return CheckResult.of(true, 0.8, "Company name length unusual");
    }

    CheckResult checkIndustry(String rawIndustry) {
        if (!hasText(rawIndustry)) {
            return CheckResult.of(false, 0.0, "Industry is required");
        }
        String industry = rawIndustry.trim().toLowerCase(Locale.ROOT);
        if (industry.length() < 2) {
            return CheckResult.of(false, 0.3, "Industry too short");
        }
        boolean common = COMMON_INDUSTRIES.stream().anyMatch(industry::contains);
        return common
                ? CheckResult.of(true, 1.0)
                : CheckResult.of(true, 0.7, "Uncommon industry - may need review");
    }

    CheckResult checkDescription(String rawDescription) {
        if (!hasText(rawDescription)) {
            return CheckResult.of(false, 0.0, "Description is required");
        }
        String description = rawDescription.trim();
        if (description.length() < 20) {
            return CheckResult.of(false, 0.3, "Description too short (minimum 20 characters)");
        }

        List<String> flags = new ArrayList<>();
        String lower = description.toLowerCase(Locale.ROOT);
        for (String keyword : SUSPICIOUS_KEYWORDS) {
            if (lower.contains(keyword)) {
                flags.add("Suspicious keyword found: " + keyword);
            }
        }

        double score;
        if (description.length() >= 50) {
            score = 1.0;
        } else if (description.length() >= 30) {
            score = 0.8;
        } else {
            score = 0.6;
        }
        return new CheckResult(true, score, flags);
    }

    CheckResult checkWebsite(String website) {
        URI uri;
        try {
            uri = new URI(website.trim());
        } catch (URISyntaxException e) {
            return CheckResult.of(false, 0.2, "Website URL parsing failed");
        }
        String host = uri.getHost() != null ? uri.getHost() : uri.getAuthority();
        if (uri.getScheme() == null || host == null) {
            return CheckResult.of(false, 0.3, "Invalid website URL format");
        }
        if (!DOMAIN.matcher(host).matches()) {
            return CheckResult.of(false, 0.3, "Invalid domain format");
        }
        String lowerHost = host.toLowerCase(Locale.ROOT);
        boolean commonTld = COMMON_TLDS.stream().anyMatch(lowerHost::endsWith);
        return commonTld
                ? CheckResult.of(true, 0.8)
                : CheckResult.of(true, 0.6, "Uncommon TLD - may need manual review");
    }

    CheckResult checkContact(String email, String phone) {
        List<String> flags = new ArrayList<>();
        double score = 0.0;

        if (hasText(email)) {
            int at = email.indexOf('@');
            if (at >= 0 && email.substring(at + 1).contains(".")) {
                score += 0.5;
            } else {
                flags.add("Invalid contact email format");
            }
        } else {
            flags.add("No contact email provided");
        }

        if (hasText(phone)) {
            String clean = PHONE_SEPARATORS.matcher(phone).replaceAll("");
            if (PHONE.matcher(clean).matches()) {
                score += 0.5;
            } else {
                flags.add("Invalid phone number format");
            }
        } else {
            flags.add("No phone number provided");
        }

        return new CheckResult(score > 0, score, flags);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
