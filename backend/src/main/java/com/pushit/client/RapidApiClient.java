package com.pushit.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.net.URI;
import java.util.OptionalLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/** Keyed scraping proxy on the RapidAPI marketplace, used when official APIs are unavailable. */
@Slf4j
@Component
public class RapidApiClient {

    static final String INSTAGRAM_HOST = "instagram-scraper-api2.p.rapidapi.com";
    static final String FACEBOOK_HOST = "facebook-profile-scraper.p.rapidapi.com";

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;

    public RapidApiClient(
            @Qualifier("scrapeRestTemplate") RestTemplate restTemplate,
            @Qualifier("rapidApiCircuitBreaker") CircuitBreaker circuitBreaker) {
        this.restTemplate = restTemplate;
        this.circuitBreaker = circuitBreaker;
    }

    public OptionalLong fetchInstagramFollowers(String username, String apiKey) {
        URI uri =
                UriComponentsBuilder.fromHttpUrl("https://" + INSTAGRAM_HOST + "/userinfo")
                        .queryParam("username_or_id_or_url", username)
                        .build()
                        .toUri();
        JsonNode body = get(uri, INSTAGRAM_HOST, apiKey);
        if (body == null) {
            return OptionalLong.empty();
        }
        JsonNode data = body.path("data");
        OptionalLong count =
                firstPositive(
                        data.path("edge_followed_by").path("count"),
                        data.path("follower_count"),
                        data.path("followers"),
                        data.path("followers_count"));
        if (count.isPresent()) {
            return count;
        }
        return firstPositive(body.path("follower_count"), body.path("followers"));
    }

    public OptionalLong fetchFacebookFollowers(String username, String apiKey) {
        URI uri =
                UriComponentsBuilder.fromHttpUrl("https://" + FACEBOOK_HOST + "/profile")
                        .queryParam("username", username)
                        .build()
                        .toUri();
        JsonNode body = get(uri, FACEBOOK_HOST, apiKey);
        if (body == null) {
            return OptionalLong.empty();
        }
        return firstPositive(
                body.path("followers_count"),
                body.path("followers"),
                body.path("follower_count"),
                body.path("data").path("followers_count"));
    }

    private JsonNode get(URI uri, String host, String apiKey) {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-RapidAPI-Key", apiKey);
        headers.set("X-RapidAPI-Host", host);
        return circuitBreaker.executeSupplier(
                () ->
                        restTemplate
                                .exchange(
                                        uri,
                                        HttpMethod.GET,
                                        new HttpEntity<>(headers),
                                        JsonNode.class)
                                .getBody());
    }

    private static OptionalLong firstPositive(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            OptionalLong count = PlatformApiClient.readCount(candidate);
            if (count.isPresent() && count.getAsLong() > 0) {
                return count;
            }
        }
        return OptionalLong.empty();
    }
}
