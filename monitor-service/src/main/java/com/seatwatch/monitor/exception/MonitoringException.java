package com.seatwatch.monitor.exception;

import lombok.Getter;

@Getter
public class MonitoringException extends RuntimeException {

    private final String errorCode;
    private final boolean retryable;

    public MonitoringException(String errorCode, String message) {
        this(errorCode, message, false, null);
    }

    public MonitoringException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, retryable, null);
    }

    public MonitoringException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, false, cause);
    }

    public MonitoringException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
}
