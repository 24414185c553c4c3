package com.seatwatch.monitor.service.notification;

import com.seatwatch.monitor.config.AsyncConfiguration;
import com.seatwatch.monitor.constants.MonitorConstants;
import com.seatwatch.monitor.dto.NotificationMessage;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Delivers one message with exponential backoff. A message that exhausts its attempts is
 * dropped with an error log; nothing is reported back to the route.
 */
@Component
@Slf4j
public class NotificationDeliveryWorker {

    private final NotificationSender notificationSender;
    private final MeterRegistry meterRegistry;
    private final int maxAttempts;
    private final long initialBackoffMs;

    public NotificationDeliveryWorker(
            NotificationSender notificationSender,
            MeterRegistry meterRegistry,
            @Value("${monitor.notification.max-attempts:" + MonitorConstants.DEFAULT_NOTIFICATION_MAX_ATTEMPTS + "}") int maxAttempts,
            @Value("${monitor.notification.initial-backoff-ms:" + MonitorConstants.DEFAULT_NOTIFICATION_INITIAL_BACKOFF_MS + "}") long initialBackoffMs) {
        this.notificationSender = notificationSender;
        this.meterRegistry = meterRegistry;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = initialBackoffMs;
    }

    @Async(AsyncConfiguration.NOTIFICATION_EXECUTOR)
    public void deliver(NotificationMessage message) {
        deliverWithRetry(message);
    }

    public boolean deliverWithRetry(NotificationMessage message) {
        long backoffMs = initialBackoffMs;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (trySend(message)) {
                meterRegistry.counter(MonitorConstants.METRIC_NOTIFICATION_TOTAL, "result", "success").increment();
                log.info("Notification delivered: routeId={}, recipient={}, attempt={}",
                        message.getRouteId(), message.getRecipient(), attempt);
                return true;
            }

            if (attempt < maxAttempts) {
                log.warn("Notification attempt {}/{} failed: routeId={}, recipient={}, retrying in {}ms",
                        attempt, maxAttempts, message.getRouteId(), message.getRecipient(), backoffMs);
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Notification retry interrupted: routeId={}, recipient={}",
                            message.getRouteId(), message.getRecipient());
                    break;
                }
                backoffMs *= 2;
            }
        }

        meterRegistry.counter(MonitorConstants.METRIC_NOTIFICATION_TOTAL, "result", "failure").increment();
        log.error("Notification dropped after {} attempts: routeId={}, recipient={}",
                maxAttempts, message.getRouteId(), message.getRecipient());
        return false;
    }

    private boolean trySend(NotificationMessage message) {
        try {
            return notificationSender.send(message.getRecipient(), message.getSubject(), message.getBody());
        } catch (RuntimeException e) {
            log.warn("Notification transport error: routeId={}, recipient={}, error={}",
                    message.getRouteId(), message.getRecipient(), e.getMessage());
            return false;
        }
    }
}
