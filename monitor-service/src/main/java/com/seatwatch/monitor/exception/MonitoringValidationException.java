package com.seatwatch.monitor.exception;

public class MonitoringValidationException extends MonitoringException {

    private static final String ERROR_CODE = "VALIDATION_ERROR";

    public MonitoringValidationException(String message) {
        super(ERROR_CODE, message);
    }
}
