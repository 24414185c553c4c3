package com.seatwatch.monitor.exception;

/**
 * Thrown when a user cancels monitoring of a route they are not subscribed to.
 */
public class SubscriptionNotFoundException extends MonitoringException {

    private static final String ERROR_CODE = "SUBSCRIPTION_NOT_FOUND";

    public SubscriptionNotFoundException(Long userId, Long routeId) {
        super(ERROR_CODE, "No monitoring subscription for user " + userId + " on route " + routeId);
    }
}
