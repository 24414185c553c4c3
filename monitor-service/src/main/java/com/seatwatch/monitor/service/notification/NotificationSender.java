package com.seatwatch.monitor.service.notification;

/**
 * Interface for the notification transport.
 * Retries are the caller's concern, not the transport's.
 */
public interface NotificationSender {

    /**
     * @return true if the transport accepted the message
     */
    boolean send(String recipient, String subject, String body);
}
