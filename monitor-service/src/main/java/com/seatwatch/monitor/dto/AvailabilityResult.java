package com.seatwatch.monitor.dto;

import lombok.Value;

/**
 * Answer of one availability check. Details are present only when seats are available.
 */
@Value
public class AvailabilityResult {

    private static final AvailabilityResult NOT_AVAILABLE = new AvailabilityResult(false, null);

    boolean available;
    AvailabilityDetails details;

    public static AvailabilityResult notAvailable() {
        return NOT_AVAILABLE;
    }

    public static AvailabilityResult available(AvailabilityDetails details) {
        return new AvailabilityResult(true, details);
    }
}
