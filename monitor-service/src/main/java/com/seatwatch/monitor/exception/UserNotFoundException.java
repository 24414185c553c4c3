package com.seatwatch.monitor.exception;

public class UserNotFoundException extends MonitoringException {

    private static final String ERROR_CODE = "USER_NOT_FOUND";

    public UserNotFoundException(Long userId) {
        super(ERROR_CODE, "User not found: " + userId);
    }
}
