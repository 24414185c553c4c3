package com.seatwatch.monitor.validator;

import com.seatwatch.monitor.constants.MonitorConstants;
import com.seatwatch.monitor.constants.ValidationMessages;
import com.seatwatch.monitor.dto.RouteMonitorRequest;
import com.seatwatch.monitor.dto.RouteSearchQuery;
import com.seatwatch.monitor.enums.LocationType;
import com.seatwatch.monitor.exception.MonitoringValidationException;

import java.time.OffsetDateTime;

import static org.springframework.util.StringUtils.hasText;

public final class MonitorRequestValidator {

    private MonitorRequestValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void validateMonitorRequest(RouteMonitorRequest request) {
        if (request == null) {
            throw new MonitoringValidationException(ValidationMessages.MONITOR_REQUEST_REQUIRED);
        }

        requireText(request.getExternalRouteId(), ValidationMessages.EXTERNAL_ROUTE_ID_REQUIRED);
        requireText(request.getFromLocationId(), ValidationMessages.FROM_LOCATION_ID_REQUIRED);
        requireText(request.getToLocationId(), ValidationMessages.TO_LOCATION_ID_REQUIRED);
        requireText(request.getFromLocationType(), ValidationMessages.FROM_LOCATION_TYPE_REQUIRED);
        requireText(request.getToLocationType(), ValidationMessages.TO_LOCATION_TYPE_REQUIRED);

        validateIdentifierLength(request.getExternalRouteId());
        validateIdentifierLength(request.getFromLocationId());
        validateIdentifierLength(request.getToLocationId());

        validateLocationType(request.getFromLocationType());
        validateLocationType(request.getToLocationType());
        validateLocationsDiffer(request.getFromLocationId(), request.getToLocationId());

        if (request.getDepartureAt() == null) {
            throw new MonitoringValidationException(ValidationMessages.DEPARTURE_REQUIRED);
        }
        validateArrivalAfterDeparture(request.getDepartureAt(), request.getArrivalAt());
    }

    public static void validateSearchQuery(RouteSearchQuery query) {
        requireText(query.getFromLocationId(), ValidationMessages.FROM_LOCATION_ID_REQUIRED);
        requireText(query.getToLocationId(), ValidationMessages.TO_LOCATION_ID_REQUIRED);
        requireText(query.getFromLocationType(), ValidationMessages.FROM_LOCATION_TYPE_REQUIRED);
        requireText(query.getToLocationType(), ValidationMessages.TO_LOCATION_TYPE_REQUIRED);

        validateIdentifierLength(query.getFromLocationId());
        validateIdentifierLength(query.getToLocationId());
        validateLocationType(query.getFromLocationType());
        validateLocationType(query.getToLocationType());
        validateLocationsDiffer(query.getFromLocationId(), query.getToLocationId());

        if (query.getDepartureDate() == null) {
            throw new MonitoringValidationException(ValidationMessages.DEPARTURE_DATE_REQUIRED);
        }
    }

    public static void validateLocationType(String type) {
        if (!LocationType.isValid(type)) {
            throw new MonitoringValidationException(ValidationMessages.LOCATION_TYPE_INVALID);
        }
    }

    public static void validateIdentifierLength(String identifier) {
        if (identifier.trim().length() > MonitorConstants.MAX_IDENTIFIER_LENGTH) {
            throw new MonitoringValidationException(ValidationMessages.IDENTIFIER_TOO_LONG);
        }
    }

    public static void validateLocationsDiffer(String fromLocationId, String toLocationId) {
        if (fromLocationId.trim().equals(toLocationId.trim())) {
            throw new MonitoringValidationException(ValidationMessages.LOCATIONS_SAME);
        }
    }

    public static void validateArrivalAfterDeparture(OffsetDateTime departure, OffsetDateTime arrival) {
        if (arrival == null) {
            return;
        }
        if (!arrival.isAfter(departure)) {
            throw new MonitoringValidationException(ValidationMessages.ARRIVAL_AFTER_DEPARTURE);
        }
    }

    public static void validateUserId(Long userId) {
        if (userId == null) {
            throw new MonitoringValidationException(ValidationMessages.USER_ID_REQUIRED);
        }
    }

    public static void validateRouteId(Long routeId) {
        if (routeId == null) {
            throw new MonitoringValidationException(ValidationMessages.ROUTE_ID_REQUIRED);
        }
    }

    private static void requireText(String value, String message) {
        if (!hasText(value)) {
            throw new MonitoringValidationException(message);
        }
    }
}
