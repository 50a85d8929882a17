package com.pushit.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    private static final String SECURITY_SCHEME_BASIC = "basicAuth";
    private static final String API_TITLE = "PushIt API";
    private static final String API_VERSION = "1.0.0";

    private static final String API_DESCRIPTION =
            """
        Marketplace API connecting brands with influencers.

        ### Authentication
        HTTP Basic with the account email and password. Registration, email confirmation and the
        Paystack callbacks are public.

        ### Error Format
        ```json
        {
          "status": 402,
          "error": "Payment Required",
          "errorCode": "INSUFFICIENT_BALANCE",
          "message": "Insufficient wallet balance",
          "path": "/api/v1/campaigns"
        }
        ```
        """;

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .servers(
                        List.of(
                                new Server()
                                        .url("http://localhost:" + serverPort)
                                        .description("Local Development Server")))
                .security(List.of(new SecurityRequirement().addList(SECURITY_SCHEME_BASIC)))
                .components(
                        new Components()
                                .addSecuritySchemes(
                                        SECURITY_SCHEME_BASIC,
                                        new SecurityScheme()
                                                .name(SECURITY_SCHEME_BASIC)
                                                .type(SecurityScheme.Type.HTTP)
                                                .scheme("basic")))
                .info(
                        new Info()
                                .title(API_TITLE)
                                .description(API_DESCRIPTION)
                                .version(API_VERSION));
    }

    @Bean
    public GroupedOpenApi apiV1() {
        return GroupedOpenApi.builder()
                .group("v1-apis")
                .displayName("API Version 1")
                .pathsToMatch("/api/v1/**")
                .pathsToExclude("/api/v1/admin/**")
                .build();
    }

    @Bean
    public GroupedOpenApi adminApi() {
        return GroupedOpenApi.builder()
                .group("admin-apis")
                .displayName("Admin APIs")
                .pathsToMatch("/api/v1/admin/**")
                .build();
    }
}
