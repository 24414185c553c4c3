package com.seatwatch.monitor.enums;

public enum LocationType {
    CITY,
    STATION;

    public static boolean isValid(String value) {
        if (value == null) {
            return false;
        }
        for (LocationType type : values()) {
            if (type.name().equals(value)) {
                return true;
            }
        }
        return false;
    }
}
