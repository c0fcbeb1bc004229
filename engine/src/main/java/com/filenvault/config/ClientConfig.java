package com.filenvault.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * The three HTTP endpoints the engine talks to: the JSON gateway, chunk ingest and chunk
 * egest. Each carries the session's bearer token.
 */
@Configuration
public class ClientConfig {

    @Bean
    public WebClient gatewayWebClient(WebClient.Builder builder, FilenProperties properties) {
        return authorized(builder.clone().baseUrl(properties.gatewayUrl()), properties).build();
    }

    @Bean
    public WebClient ingestWebClient(WebClient.Builder builder, FilenProperties properties) {
        return authorized(builder.clone().baseUrl(properties.ingestUrl()), properties).build();
    }

    @Bean
    public WebClient egestWebClient(WebClient.Builder builder, FilenProperties properties) {
        return authorized(builder.clone().baseUrl(properties.egestUrl()), properties).build();
    }

    private static WebClient.Builder authorized(WebClient.Builder builder, FilenProperties properties) {
        if (properties.apiKey() != null && !properties.apiKey().isEmpty()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey());
        }
        return builder;
    }
}
