package com.pushit.client;

import com.pushit.config.AppProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Last-resort follower lookup from public profile pages. Platforms change their markup often and
 * block scrapers, so every parse step is best effort.
 */
@Slf4j
@Component
public class ProfilePageScraper {

    private static final String USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko)"
                    + " Chrome/120.0.0.0 Safari/537.36";

    private static final Pattern EDGE_FOLLOWED_BY =
            Pattern.compile("\"edge_followed_by\":\\s*\\{\\s*\"count\":\\s*(\\d+)");
    private static final Pattern DIGITS = Pattern.compile("\\d{1,18}");
    private static final Pattern FOLLOWERS_TEXT =
            Pattern.compile("(\\d+(?:,\\d+)*)\\s+followers?", Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> FACEBOOK_TEXT_PATTERNS =
            List.of(
                    Pattern.compile("(\\d+(?:,\\d+)*)\\s+followers", Pattern.CASE_INSENSITIVE),
                    Pattern.compile(
                            "(\\d+(?:,\\d+)*)\\s+people\\s+follow", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("followers[:\\s]+(\\d+(?:,\\d+)*)", Pattern.CASE_INSENSITIVE));

    private final CircuitBreaker circuitBreaker;
    private final Retry retry;
    private final int timeoutMs;

    public ProfilePageScraper(
            @Qualifier("pageScrapeCircuitBreaker") CircuitBreaker circuitBreaker,
            @Qualifier("pageScrapeRetry") Retry retry,
            AppProperties appProperties) {
        this.circuitBreaker = circuitBreaker;
        this.retry = retry;
        this.timeoutMs = (int) appProperties.integrations().scrapeTimeout().toMillis();
    }

    public OptionalLong scrapeInstagram(String username) {
        Document document = fetch("https://www.instagram.com/" + username + "/");
        return parseInstagramFollowers(document);
    }

    /** Tries the desktop and mobile page variants in turn. */
    public OptionalLong scrapeFacebook(String username) {
        List<String> urls =
                List.of(
                        "https://www.facebook.com/" + username,
                        "https://www.facebook.com/" + username + "/",
                        "https://m.facebook.com/" + username);
        for (String url : urls) {
            try {
                OptionalLong count = parseFacebookFollowers(fetch(url));
                if (count.isPresent()) {
                    return count;
                }
            } catch (RuntimeException e) {
                log.debug("Facebook scrape of {} failed: {}", url, e.getMessage());
            }
        }
        return OptionalLong.empty();
    }

    static OptionalLong parseInstagramFollowers(Document document) {
        for (Element script : document.select("script")) {
            Matcher matcher = EDGE_FOLLOWED_BY.matcher(script.data());
            if (matcher.find()) {
                return OptionalLong.of(Long.parseLong(matcher.group(1)));
            }
        }

        OptionalLong fromMeta = firstNumberInFollowerMeta(document);
        if (fromMeta.isPresent()) {
            return fromMeta;
        }

        return largestMatch(FOLLOWERS_TEXT, document.text());
    }

    static OptionalLong parseFacebookFollowers(Document document) {
        OptionalLong fromMeta = firstNumberInFollowerMeta(document);
        if (fromMeta.isPresent()) {
            return fromMeta;
        }
        String text = document.text();
        for (Pattern pattern : FACEBOOK_TEXT_PATTERNS) {
            OptionalLong count = largestMatch(pattern, text);
            if (count.isPresent()) {
                return count;
            }
        }
        return OptionalLong.empty();
    }

    private Document fetch(String url) {
        return circuitBreaker.executeSupplier(
                () ->
                        retry.executeSupplier(
                                () -> {
                                    try {
                                        return Jsoup.connect(url)
                                                .userAgent(USER_AGENT)
                                                .header("Accept-Language", "en-US,en;q=0.9")
                                                .followRedirects(true)
                                                .timeout(timeoutMs)
                                                .get();
                                    } catch (IOException e) {
                                        throw new UncheckedIOException(e);
                                    }
                                }));
    }

    private static OptionalLong firstNumberInFollowerMeta(Document document) {
        for (Element meta : document.select("meta")) {
            String content = meta.attr("content");
            String property = meta.attr("property");
            if (content.toLowerCase(Locale.ROOT).contains("followers")
                    || property.toLowerCase(Locale.ROOT).contains("follower")) {
                Matcher matcher = DIGITS.matcher(content.replace(",", "").replace(".", ""));
                if (matcher.find()) {
                    long count = Long.parseLong(matcher.group());
                    if (count > 0) {
                        return OptionalLong.of(count);
                    }
                }
            }
        }
        return OptionalLong.empty();
    }

    private static OptionalLong largestMatch(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        long best = -1;
        while (matcher.find()) {
            best = Math.max(best, Long.parseLong(matcher.group(1).replace(",", "")));
        }
        return best >= 0 ? OptionalLong.of(best) : OptionalLong.empty();
    }
}
