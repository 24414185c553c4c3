package com.seatwatch.monitor.exception;

import com.seatwatch.monitor.enums.RouteStatus;

/**
 * Thrown when a route is not in the state an operation requires.
 */
public class MonitoringConflictException extends MonitoringException {

    public MonitoringConflictException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static MonitoringConflictException notRestartable(Long routeId, RouteStatus current) {
        return new MonitoringConflictException("ROUTE_NOT_RESTARTABLE",
                "Route " + routeId + " cannot be restarted from status " + current + " (expected FOUND)");
    }

    public static MonitoringConflictException departed(Long routeId) {
        return new MonitoringConflictException("ROUTE_DEPARTED",
                "Route " + routeId + " has already departed and cannot be restarted");
    }

    public static MonitoringConflictException subscriptionTargetRemoved(Long userId, Long routeId) {
        return new MonitoringConflictException("SUBSCRIPTION_TARGET_REMOVED",
                "Route " + routeId + " or user " + userId + " was removed while subscribing; resubmit the request");
    }

    public static MonitoringConflictException insertConflict(String what) {
        return new MonitoringConflictException("PERSISTENCE_CONFLICT",
                "Could not store " + what + " after repeated conflicts");
    }
}
