package com.pushit.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

/** Circuit breakers and retries for every outbound HTTP dependency. */
@Slf4j
@Configuration
public class ResilienceConfig {

    public static final String PLATFORM_API = "platformApi";
    public static final String RAPID_API = "rapidApi";
    public static final String PAGE_SCRAPE = "pageScrape";
    public static final String PAYSTACK = "paystack";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig externalApiConfig =
                CircuitBreakerConfig.custom()
                        .failureRateThreshold(50.0f)
                        .slowCallRateThreshold(50.0f)
                        .slowCallDurationThreshold(Duration.ofSeconds(8))
                        .waitDurationInOpenState(Duration.ofSeconds(60))
                        .minimumNumberOfCalls(10)
                        .slidingWindowSize(20)
                        .permittedNumberOfCallsInHalfOpenState(3)
                        .automaticTransitionFromOpenToHalfOpenEnabled(true)
                        .ignoreExceptions(HttpClientErrorException.NotFound.class)
                        .build();

        // Public pages are flaky by nature, so the scrape breaker tolerates more failures.
        CircuitBreakerConfig scrapeConfig =
                CircuitBreakerConfig.custom()
                        .failureRateThreshold(80.0f)
                        .slowCallDurationThreshold(Duration.ofSeconds(14))
                        .waitDurationInOpenState(Duration.ofMinutes(5))
                        .minimumNumberOfCalls(10)
                        .slidingWindowSize(20)
                        .permittedNumberOfCallsInHalfOpenState(2)
                        .automaticTransitionFromOpenToHalfOpenEnabled(true)
                        .build();

        CircuitBreakerConfig paymentConfig =
                CircuitBreakerConfig.custom()
                        .failureRateThreshold(40.0f)
                        .slowCallRateThreshold(50.0f)
                        .slowCallDurationThreshold(Duration.ofSeconds(8))
                        .waitDurationInOpenState(Duration.ofMinutes(1))
                        .minimumNumberOfCalls(8)
                        .slidingWindowSize(25)
                        .permittedNumberOfCallsInHalfOpenState(3)
                        .automaticTransitionFromOpenToHalfOpenEnabled(true)
                        .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.ofDefaults();
        registry.circuitBreaker(PLATFORM_API, externalApiConfig);
        registry.circuitBreaker(RAPID_API, externalApiConfig);
        registry.circuitBreaker(PAGE_SCRAPE, scrapeConfig);
        registry.circuitBreaker(PAYSTACK, paymentConfig);
        return registry;
    }

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig idempotentConfig =
                RetryConfig.custom()
                        .maxAttempts(3)
                        .waitDuration(Duration.ofMillis(500))
                        .retryExceptions(
                                ResourceAccessException.class,
                                HttpServerErrorException.InternalServerError.class,
                                HttpServerErrorException.BadGateway.class,
                                HttpServerErrorException.ServiceUnavailable.class,
                                HttpServerErrorException.GatewayTimeout.class)
                        .ignoreExceptions(
                                HttpClientErrorException.BadRequest.class,
                                HttpClientErrorException.Unauthorized.class,
                                HttpClientErrorException.Forbidden.class,
                                HttpClientErrorException.NotFound.class,
                                HttpClientErrorException.TooManyRequests.class)
                        .build();

        RetryConfig singleAttemptConfig = RetryConfig.custom().maxAttempts(1).build();

        RetryRegistry registry = RetryRegistry.ofDefaults();
        registry.retry(PLATFORM_API, idempotentConfig);
        registry.retry(PAYSTACK + "Read", idempotentConfig);
        // Scrapes fall through to manual review quickly, and writes to the gateway are not
        // idempotent.
        registry.retry(PAGE_SCRAPE, singleAttemptConfig);
        registry.retry(PAYSTACK + "Write", singleAttemptConfig);
        return registry;
    }

    @Bean
    public CircuitBreaker platformApiCircuitBreaker(CircuitBreakerRegistry registry) {
        return withTransitionLogging(registry.circuitBreaker(PLATFORM_API), "Platform API");
    }

    @Bean
    public CircuitBreaker rapidApiCircuitBreaker(CircuitBreakerRegistry registry) {
        return withTransitionLogging(registry.circuitBreaker(RAPID_API), "RapidAPI");
    }

    @Bean
    public CircuitBreaker pageScrapeCircuitBreaker(CircuitBreakerRegistry registry) {
        return withTransitionLogging(registry.circuitBreaker(PAGE_SCRAPE), "Page scrape");
    }

    @Bean
    public CircuitBreaker paystackCircuitBreaker(CircuitBreakerRegistry registry) {
        return withTransitionLogging(registry.circuitBreaker(PAYSTACK), "Paystack");
    }

    @Bean
    public Retry platformApiRetry(RetryRegistry registry) {
        return withRetryLogging(registry.retry(PLATFORM_API), "Platform API");
    }

    @Bean
    public Retry pageScrapeRetry(RetryRegistry registry) {
        return registry.retry(PAGE_SCRAPE);
    }

    @Bean
    public Retry paystackReadRetry(RetryRegistry registry) {
        return withRetryLogging(registry.retry(PAYSTACK + "Read"), "Paystack read");
    }

    @Bean
    public Retry paystackWriteRetry(RetryRegistry registry) {
        return registry.retry(PAYSTACK + "Write");
    }

    private CircuitBreaker withTransitionLogging(CircuitBreaker circuitBreaker, String name) {
        circuitBreaker
                .getEventPublisher()
                .onStateTransition(
                        event -> log.info("{} circuit breaker state transition: {}", name, event));
        return circuitBreaker;
    }

    private Retry withRetryLogging(Retry retry, String name) {
        retry.getEventPublisher()
                .onRetry(
                        event ->
                                log.warn(
                                        "{} retry attempt {}: {}",
                                        name,
                                        event.getNumberOfRetryAttempts(),
                                        event.getLastThrowable().getMessage()));
        return retry;
    }
}
