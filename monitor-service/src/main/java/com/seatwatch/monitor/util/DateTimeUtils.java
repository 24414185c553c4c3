package com.seatwatch.monitor.util;

import com.seatwatch.monitor.constants.MonitorConstants;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

public final class DateTimeUtils {

    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern(MonitorConstants.DATE_TIME_PATTERN);

    private DateTimeUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static LocalDate localDate(Instant instant, ZoneId zone) {
        return instant.atZone(zone).toLocalDate();
    }

    public static String formatLocal(Instant instant, ZoneId zone) {
        if (instant == null) {
            return MonitorConstants.UNKNOWN_VALUE;
        }
        return DISPLAY_FORMAT.format(instant.atZone(zone));
    }
}
