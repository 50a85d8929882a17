package com.pushit.config;

import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * One pooled RestTemplate per outbound concern. Platform APIs and the payment gateway use the API
 * timeout, the scraping proxy and public pages use the longer scrape timeout.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(3);

    private final AppProperties appProperties;

    @Bean
    @Primary
    public RestTemplate restTemplate() {
        return createRestTemplate("Default", 50, 20, appProperties.integrations().apiTimeout());
    }

    @Bean("platformApiRestTemplate")
    public RestTemplate platformApiRestTemplate() {
        return createRestTemplate(
                "PlatformApi", 50, 20, appProperties.integrations().apiTimeout());
    }

    @Bean("scrapeRestTemplate")
    public RestTemplate scrapeRestTemplate() {
        return createRestTemplate("Scrape", 20, 10, appProperties.integrations().scrapeTimeout());
    }

    @Bean("paystackRestTemplate")
    public RestTemplate paystackRestTemplate() {
        return createRestTemplate("Paystack", 20, 10, appProperties.integrations().apiTimeout());
    }

    private RestTemplate createRestTemplate(
            String clientName, int maxTotal, int maxPerRoute, Duration readTimeout) {
        ConnectionConfig connectionConfig =
                ConnectionConfig.custom()
                        .setConnectTimeout(Timeout.ofMilliseconds(CONNECT_TIMEOUT.toMillis()))
                        .setSocketTimeout(Timeout.ofMilliseconds(readTimeout.toMillis()))
                        .build();

        PoolingHttpClientConnectionManager connectionManager =
                PoolingHttpClientConnectionManagerBuilder.create()
                        .setMaxConnTotal(maxTotal)
                        .setMaxConnPerRoute(maxPerRoute)
                        .setDefaultConnectionConfig(connectionConfig)
                        .build();

        RequestConfig requestConfig =
                RequestConfig.custom()
                        .setConnectionRequestTimeout(
                                Timeout.ofMilliseconds(CONNECT_TIMEOUT.toMillis()))
                        .setResponseTimeout(Timeout.ofMilliseconds(readTimeout.toMillis()))
                        .build();

        CloseableHttpClient httpClient =
                HttpClients.custom()
                        .setConnectionManager(connectionManager)
                        .setDefaultRequestConfig(requestConfig)
                        .setUserAgent("PushIt/" + clientName + "/1.0")
                        .build();

        RestTemplate restTemplate =
                new RestTemplate(new HttpComponentsClientHttpRequestFactory(httpClient));

        log.info(
                "{} RestTemplate configured with maxTotal: {}, maxPerRoute: {}, read timeout: {}ms",
                clientName,
                maxTotal,
                maxPerRoute,
                readTimeout.toMillis());

        return restTemplate;
    }
}
