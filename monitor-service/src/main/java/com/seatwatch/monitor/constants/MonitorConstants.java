package com.seatwatch.monitor.constants;

public final class MonitorConstants {

    private MonitorConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Scheduling ==========

    public static final long DEFAULT_CHECK_INTERVAL_MS = 60_000;
    public static final long DEFAULT_SWEEP_INTERVAL_MS = 300_000;
    public static final long DEFAULT_LEASE_TTL_MS = 60_000;
    public static final int DEFAULT_CHECK_EXECUTOR_THREADS = 8;

    // ========== Registry ==========

    public static final int DEFAULT_MAX_INSERT_ATTEMPTS = 3;
    public static final int MAX_IDENTIFIER_LENGTH = 64;

    // ========== Location Cache ==========

    public static final long DEFAULT_LOCATION_CACHE_TTL_SECONDS = 24 * 60 * 60;
    public static final long DEFAULT_LOCATION_MEMO_TTL_SECONDS = 5 * 60;
    public static final long LOCATION_STORE_RETENTION_DAYS = 7;

    // ========== Notifications ==========

    public static final int DEFAULT_NOTIFICATION_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_NOTIFICATION_INITIAL_BACKOFF_MS = 1000;
    public static final int DEFAULT_NOTIFICATION_EXECUTOR_THREADS = 4;
    public static final String DEFAULT_ZONE_ID = "Europe/Prague";
    public static final String DATE_TIME_PATTERN = "dd.MM.yyyy HH:mm";
    public static final String UNKNOWN_VALUE = "(unknown)";
    public static final String CURRENCY = "CZK";

    // ========== Provider API ==========

    public static final String ROUTE_STATUS_PATH = "/routes/{routeId}/simple";
    public static final String LOCATIONS_PATH = "/consts/locations";
    public static final String ROUTE_SEARCH_PATH = "/routes/search/simple";
    public static final String SEARCH_TARIFF = "REGULAR";
    public static final String HEADER_LANG = "X-Lang";
    public static final String HEADER_CURRENCY = "X-Currency";
    public static final String PROVIDER_LANG = "cs";
    public static final String PROVIDER_CURRENCY = "CZK";

    public static final String FIELD_FREE_SEATS = "freeSeatsCount";
    public static final String FIELD_PRICE_FROM = "priceFrom";
    public static final String FIELD_PRICE_TO = "priceTo";
    public static final String FIELD_ARRIVAL_TIME = "arrivalTime";

    // ========== Redis Keys ==========

    public static final String REDIS_LEASE_PREFIX = "lease:route:";
    public static final String REDIS_LOCATIONS_KEY = "locations:directory";

    // ========== Metrics ==========

    public static final String METRIC_CHECK_TOTAL = "monitor.check.total";
    public static final String METRIC_CHECK_DURATION = "monitor.check.duration";
    public static final String METRIC_SWEEP_EXPIRED = "monitor.sweep.expired";
    public static final String METRIC_NOTIFICATION_TOTAL = "monitor.notification.total";
    public static final String METRIC_LOCATION_REFRESH = "monitor.location_cache.refresh";
}
