package com.seatwatch.monitor.service.notification;

import com.seatwatch.monitor.config.RestClientConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hands plain-text mail to an HTTP mail gateway.
 */
@Component
@Slf4j
public class HttpNotificationSender implements NotificationSender {

    private final RestTemplate restTemplate;
    private final String gatewayUrl;

    public HttpNotificationSender(
            @Qualifier(RestClientConfiguration.GATEWAY_REST_TEMPLATE) RestTemplate restTemplate,
            @Value("${notification-gateway.url}") String gatewayUrl) {
        this.restTemplate = restTemplate;
        this.gatewayUrl = gatewayUrl;
    }

    @Override
    public boolean send(String recipient, String subject, String body) {
        if (!StringUtils.hasText(recipient)) {
            log.warn("No recipient address for notification '{}'", subject);
            return false;
        }

        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("to", recipient);
        payload.put("subject", subject);
        payload.put("body", body);

        try {
            restTemplate.postForEntity(gatewayUrl, payload, String.class);
            log.debug("Notification accepted by gateway: recipient={}", recipient);
            return true;
        } catch (Exception e) {
            log.error("Failed to send notification to {}: {}", recipient, e.getMessage());
            return false;
        }
    }
}
