package com.seatwatch.monitor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * One client per outbound dependency. The provider read timeout bounds every availability check;
 * the gateway client has its own, shorter limits since deliveries retry.
 */
@Configuration
public class RestClientConfiguration {

    public static final String PROVIDER_REST_TEMPLATE = "providerRestTemplate";
    public static final String GATEWAY_REST_TEMPLATE = "notificationGatewayRestTemplate";

    @Bean(PROVIDER_REST_TEMPLATE)
    public RestTemplate providerRestTemplate(
            RestTemplateBuilder builder,
            ObjectMapper objectMapper,
            @Value("${provider.connect-timeout-ms:5000}") long connectTimeoutMs,
            @Value("${provider.read-timeout-ms:15000}") long readTimeoutMs) {
        return jsonClient(builder, objectMapper, connectTimeoutMs, readTimeoutMs);
    }

    @Bean(GATEWAY_REST_TEMPLATE)
    public RestTemplate notificationGatewayRestTemplate(
            RestTemplateBuilder builder,
            ObjectMapper objectMapper,
            @Value("${notification-gateway.connect-timeout-ms:3000}") long connectTimeoutMs,
            @Value("${notification-gateway.read-timeout-ms:10000}") long readTimeoutMs) {
        return jsonClient(builder, objectMapper, connectTimeoutMs, readTimeoutMs);
    }

    private static RestTemplate jsonClient(RestTemplateBuilder builder, ObjectMapper objectMapper,
                                           long connectTimeoutMs, long readTimeoutMs) {
        MappingJackson2HttpMessageConverter jsonConverter = new MappingJackson2HttpMessageConverter(objectMapper);
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .additionalMessageConverters(jsonConverter)
                .build();
    }
}
