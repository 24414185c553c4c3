package com.seatwatch.monitor.exception;

/**
 * Thrown when the caller is not allowed to act on a route, e.g. restarting a route they do not watch.
 */
public class MonitoringPolicyException extends MonitoringException {

    public MonitoringPolicyException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static MonitoringPolicyException notSubscribed(Long userId, Long routeId) {
        return new MonitoringPolicyException("NOT_SUBSCRIBED",
                "User " + userId + " does not monitor route " + routeId);
    }
}
