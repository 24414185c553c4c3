package com.seatwatch.monitor.enums;

/**
 * Lifecycle of a monitored route.
 * MONITORING is initial, EXPIRED is terminal and reachable from both other states.
 */
public enum RouteStatus {
    MONITORING,
    FOUND,
    EXPIRED
}
