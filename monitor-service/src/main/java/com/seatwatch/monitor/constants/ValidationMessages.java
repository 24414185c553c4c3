package com.seatwatch.monitor.constants;

public final class ValidationMessages {

    private ValidationMessages() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Monitor Request Messages ==========

    public static final String MONITOR_REQUEST_REQUIRED = "Monitor request is required";
    public static final String EXTERNAL_ROUTE_ID_REQUIRED = "External route ID is required";
    public static final String FROM_LOCATION_ID_REQUIRED = "Origin location ID is required";
    public static final String TO_LOCATION_ID_REQUIRED = "Destination location ID is required";
    public static final String FROM_LOCATION_TYPE_REQUIRED = "Origin location type is required";
    public static final String TO_LOCATION_TYPE_REQUIRED = "Destination location type is required";
    public static final String LOCATION_TYPE_INVALID = "Location type must be CITY or STATION";
    public static final String LOCATIONS_SAME = "Origin and destination cannot be the same";
    public static final String IDENTIFIER_TOO_LONG = "Route and location IDs must be at most 64 characters";

    public static final String DEPARTURE_REQUIRED = "Departure time is required";
    public static final String ARRIVAL_AFTER_DEPARTURE = "Arrival must be after departure";

    // ========== Route Search Messages ==========

    public static final String DEPARTURE_DATE_REQUIRED = "Departure date is required";

    // ========== Identity Messages ==========

    public static final String USER_ID_REQUIRED = "User ID is required";
    public static final String ROUTE_ID_REQUIRED = "Route ID is required";
}
