package com.seatwatch.monitor.enums;

/**
 * Result of one per-route check unit, also used as the metric tag.
 */
public enum CheckOutcome {
    LEASE_HELD,
    INACTIVE,
    NOT_AVAILABLE,
    FOUND,
    ALREADY_TRANSITIONED,
    UPSTREAM_UNAVAILABLE,
    ERROR;

    public String tag() {
        return name().toLowerCase();
    }
}
