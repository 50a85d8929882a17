package com.pushit.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.pushit.config.AppProperties;
import com.pushit.exception.PaymentGatewayException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Paystack transaction API. Initialization is a write and is not retried; verification is a read
 * and is retried on transport and 5xx errors.
 */
@Slf4j
@Component
public class PaystackClient {

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final Retry readRetry;
    private final Retry writeRetry;
    private final AppProperties.Paystack paystack;

    public PaystackClient(
            @Qualifier("paystackRestTemplate") RestTemplate restTemplate,
            @Qualifier("paystackCircuitBreaker") CircuitBreaker circuitBreaker,
            @Qualifier("paystackReadRetry") Retry readRetry,
            @Qualifier("paystackWriteRetry") Retry writeRetry,
            AppProperties appProperties) {
        this.restTemplate = restTemplate;
        this.circuitBreaker = circuitBreaker;
        this.readRetry = readRetry;
        this.writeRetry = writeRetry;
        this.paystack = appProperties.paystack();
    }

    public record Initialization(String authorizationUrl, String accessCode, String reference) {}

    /**
     * @param status Paystack transaction status, e.g. {@code success}, {@code failed}, {@code
     *     abandoned}
     * @param amountMinor amount in minor units (pesewas, kobo)
     */
    public record Verification(
            String status,
            String reference,
            long amountMinor,
            String currency,
            String authorizationCode,
            String customerCode) {

        public boolean isSuccess() {
            return "success".equalsIgnoreCase(status);
        }

        public boolean isFailed() {
            return "failed".equalsIgnoreCase(status) || "abandoned".equalsIgnoreCase(status);
        }
    }

    /** POST /transaction/initialize. */
    public Initialization initialize(
            String email,
            long amountMinor,
            String currency,
            String reference,
            Map<String, Object> metadata) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("email", email);
        body.put("amount", String.valueOf(amountMinor));
        body.put("currency", currency);
        body.put("reference", reference);
        body.put("callback_url", paystack.callbackUrl());
        body.put("metadata", metadata);

        String url =
                UriComponentsBuilder.fromHttpUrl(paystack.baseUrl())
                        .path("/transaction/initialize")
                        .toUriString();
        JsonNode response =
                call(writeRetry, url, HttpMethod.POST, new HttpEntity<>(body, headers()));
        JsonNode data = requireSuccess(response, "initialize " + reference);

        String authorizationUrl = data.path("authorization_url").asText(null);
        if (authorizationUrl == null) {
            throw new PaymentGatewayException("Paystack returned no authorization URL");
        }
        log.info("Paystack transaction {} initialized", reference);
        return new Initialization(
                authorizationUrl,
                data.path("access_code").asText(null),
                data.path("reference").asText(reference));
    }

    /** GET /transaction/verify/{reference}. */
    public Verification verify(String reference) {
        String url =
                UriComponentsBuilder.fromHttpUrl(paystack.baseUrl())
                        .path("/transaction/verify/{reference}")
                        .buildAndExpand(reference)
                        .toUriString();
        JsonNode response = call(readRetry, url, HttpMethod.GET, new HttpEntity<>(headers()));
        JsonNode data = requireSuccess(response, "verify " + reference);
        return new Verification(
                data.path("status").asText(""),
                data.path("reference").asText(reference),
                data.path("amount").asLong(0),
                data.path("currency").asText(null),
                data.path("authorization").path("authorization_code").asText(null),
                data.path("customer").path("customer_code").asText(null));
    }

    private JsonNode call(Retry retry, String url, HttpMethod method, HttpEntity<?> entity) {
        try {
            ResponseEntity<JsonNode> response =
                    circuitBreaker.executeSupplier(
                            () ->
                                    retry.executeSupplier(
                                            () ->
                                                    restTemplate.exchange(
                                                            url, method, entity, JsonNode.class)));
            JsonNode body = response.getBody();
            return body != null ? body : MissingNode.getInstance();
        } catch (CallNotPermittedException e) {
            throw new PaymentGatewayException("Payment gateway temporarily unavailable", e);
        } catch (RestClientException e) {
            log.warn("Paystack {} call failed: {}", method, e.getMessage());
            throw new PaymentGatewayException("Payment gateway request failed", e);
        }
    }

    private static JsonNode requireSuccess(JsonNode response, String operation) {
        if (!response.path("status").asBoolean(false)) {
            String message = response.path("message").asText("no message");
            log.warn("Paystack {} rejected: {}", operation, message);
            throw new PaymentGatewayException("Paystack rejected the request: " + message);
        }
        return response.path("data");
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(paystack.secretKey());
        return headers;
    }
}
