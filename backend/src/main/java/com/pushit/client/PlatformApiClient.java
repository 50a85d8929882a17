package com.pushit.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.pushit.config.AppProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Official follower-count endpoints: TikTok v2, the Facebook/Instagram Graph API and the YouTube
 * Data API v3. Each method returns an empty result when the platform answers without a count;
 * transport and HTTP errors propagate to the caller.
 */
@Slf4j
@Component
public class PlatformApiClient {

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;
    private final AppProperties.Integrations integrations;

    public PlatformApiClient(
            @Qualifier("platformApiRestTemplate") RestTemplate restTemplate,
            @Qualifier("platformApiCircuitBreaker") CircuitBreaker circuitBreaker,
            @Qualifier("platformApiRetry") Retry retry,
            AppProperties appProperties) {
        this.restTemplate = restTemplate;
        this.circuitBreaker = circuitBreaker;
        this.retry = retry;
        this.integrations = appProperties.integrations();
    }

    /** GET /user/info/ with the influencer's own OAuth token. */
    public OptionalLong fetchTikTokFollowersWithToken(String accessToken) {
        URI uri =
                UriComponentsBuilder.fromHttpUrl(integrations.tiktokBaseUrl())
                        .path("/user/info/")
                        .queryParam("fields", "follower_count")
                        .build()
                        .toUri();
        JsonNode body = get(uri, bearer(accessToken));
        return readCount(body.path("data").path("user").path("follower_count"));
    }

    /** GET /research/user/info/ with the platform API key and the influencer's open id. */
    public OptionalLong fetchTikTokFollowersWithApiKey(String apiKey, String openId) {
        URI uri =
                UriComponentsBuilder.fromHttpUrl(integrations.tiktokBaseUrl())
                        .path("/research/user/info/")
                        .queryParam("fields", "follower_count")
                        .queryParam("open_id", openId)
                        .build()
                        .toUri();
        JsonNode body = get(uri, bearer(apiKey));
        return readCount(body.path("data").path("follower_count"));
    }

    /** Followers of an Instagram business account. */
    public OptionalLong fetchInstagramFollowers(String accountId, String accessToken) {
        JsonNode body = get(graphUri(accountId, "followers_count,username", accessToken), null);
        return readCount(body.path("followers_count"));
    }

    /**
     * Looks for the Instagram business account linked to one of the token's Facebook pages whose
     * username matches {@code handle}.
     */
    public Optional<String> findInstagramAccountId(String handle, String accessToken) {
        URI pagesUri =
                UriComponentsBuilder.fromHttpUrl(graphBase())
                        .path("/me/accounts")
                        .queryParam("fields", "id,name,instagram_business_account")
                        .queryParam("limit", 100)
                        .queryParam("access_token", accessToken)
                        .build()
                        .toUri();
        JsonNode pages = get(pagesUri, null).path("data");
        for (JsonNode page : pages) {
            String accountId = page.path("instagram_business_account").path("id").asText(null);
            if (accountId == null) {
                continue;
            }
            JsonNode account = get(graphUri(accountId, "id,username", accessToken), null);
            if (handle.equalsIgnoreCase(account.path("username").asText(""))) {
                return Optional.of(accountId);
            }
        }
        return Optional.empty();
    }

    /** First page id returned by the Graph page search for {@code handle}. */
    public Optional<String> searchFacebookPageId(String handle, String accessToken) {
        URI uri =
                UriComponentsBuilder.fromHttpUrl(graphBase())
                        .path("/search")
                        .queryParam("q", handle)
                        .queryParam("type", "page")
                        .queryParam("limit", 1)
                        .queryParam("access_token", accessToken)
                        .build()
                        .toUri();
        JsonNode data = get(uri, null).path("data");
        if (data.isArray() && data.size() > 0) {
            return Optional.ofNullable(data.get(0).path("id").asText(null));
        }
        return Optional.empty();
    }

    /** Followers of a Facebook page, addressed by page id or vanity name. */
    public OptionalLong fetchFacebookFollowers(String pageIdOrHandle, String accessToken) {
        JsonNode body =
                get(graphUri(pageIdOrHandle, "followers_count,name,username", accessToken), null);
        return readCount(body.path("followers_count"));
    }

    /** Resolves the channel through search, then reads its statistics. */
    public OptionalLong fetchYouTubeSubscribers(String handle, String apiKey) {
        URI searchUri =
                UriComponentsBuilder.fromHttpUrl(integrations.youtubeBaseUrl())
                        .path("/search")
                        .queryParam("part", "snippet")
                        .queryParam("q", handle)
                        .queryParam("type", "channel")
                        .queryParam("maxResults", 1)
                        .queryParam("key", apiKey)
                        .build()
                        .toUri();
        JsonNode items = get(searchUri, null).path("items");
        if (!items.isArray() || items.size() == 0) {
            log.debug("No YouTube channel found for {}", handle);
            return OptionalLong.empty();
        }
        String channelId = items.get(0).path("id").path("channelId").asText(null);
        if (channelId == null) {
            return OptionalLong.empty();
        }

        URI statsUri =
                UriComponentsBuilder.fromHttpUrl(integrations.youtubeBaseUrl())
                        .path("/channels")
                        .queryParam("part", "statistics")
                        .queryParam("id", channelId)
                        .queryParam("key", apiKey)
                        .build()
                        .toUri();
        JsonNode channels = get(statsUri, null).path("items");
        if (!channels.isArray() || channels.size() == 0) {
            return OptionalLong.empty();
        }
        return readCount(channels.get(0).path("statistics").path("subscriberCount"));
    }

    private JsonNode get(URI uri, HttpHeaders headers) {
        return circuitBreaker.executeSupplier(
                () ->
                        retry.executeSupplier(
                                () -> {
                                    HttpHeaders requestHeaders =
                                            headers != null ? headers : new HttpHeaders();
                                    requestHeaders.setAccept(
                                            List.of(MediaType.APPLICATION_JSON));
                                    ResponseEntity<JsonNode> response =
                                            restTemplate.exchange(
                                                    uri,
                                                    HttpMethod.GET,
                                                    new HttpEntity<>(requestHeaders),
                                                    JsonNode.class);
                                    JsonNode body = response.getBody();
                                    return body != null ? body : MissingNode.getInstance();
                                }));
    }

    private URI graphUri(String node, String fields, String accessToken) {
        return UriComponentsBuilder.fromHttpUrl(graphBase())
                .pathSegment(node)
                .queryParam("fields", fields)
                .queryParam("access_token", accessToken)
                .build()
                .toUri();
    }

    private String graphBase() {
        return integrations.graphBaseUrl() + "/" + integrations.graphApiVersion();
    }

    private HttpHeaders bearer(String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        return headers;
    }

    static OptionalLong readCount(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return OptionalLong.empty();
        }
        if (node.isNumber()) {
            return OptionalLong.of(node.asLong());
        }
        String text = node.asText("").replace(",", "").trim();
        if (text.matches("\\d+")) {
            return OptionalLong.of(Long.parseLong(text));
        }
        return OptionalLong.empty();
    }
}
