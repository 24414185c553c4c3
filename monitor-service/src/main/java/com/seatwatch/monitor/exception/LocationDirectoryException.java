package com.seatwatch.monitor.exception;

/**
 * The provider's location directory could not be parsed. The whole refresh is rejected.
 */
public class LocationDirectoryException extends MonitoringException {

    private static final String ERROR_CODE = "LOCATION_DIRECTORY_INVALID";

    public LocationDirectoryException(String message) {
        super(ERROR_CODE, message);
    }
}
