package com.seatwatch.monitor.exception;

/**
 * Thrown when a monitored route does not exist.
 */
public class RouteNotFoundException extends MonitoringException {

    private static final String ERROR_CODE = "ROUTE_NOT_FOUND";

    public RouteNotFoundException(Long routeId) {
        super(ERROR_CODE, "Monitored route not found: " + routeId);
    }
}
