package com.seatwatch.monitor.exception;

/**
 * The provider could not be queried at all (timeout, connection failure, error status).
 * Distinct from a negative answer: callers cannot tell whether seats exist.
 */
public class UpstreamUnavailableException extends MonitoringException {

    private static final String ERROR_CODE = "UPSTREAM_UNAVAILABLE";

    public UpstreamUnavailableException(String message) {
        super(ERROR_CODE, message, true);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(ERROR_CODE, message, true, cause);
    }
}
