package com.seatwatch.monitor.enums;

/**
 * Result of a monitor request: either seats exist right now, or a monitoring subscription was stored.
 */
public enum MonitorOutcome {
    AVAILABLE_NOW,
    MONITORING
}
