package com.seatwatch.monitor.dto;

import com.seatwatch.monitor.constants.MonitorConstants;
import com.seatwatch.monitor.constants.ValidationMessages;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class RouteMonitorRequest {

    @NotBlank(message = ValidationMessages.EXTERNAL_ROUTE_ID_REQUIRED)
    @Size(max = MonitorConstants.MAX_IDENTIFIER_LENGTH, message = ValidationMessages.IDENTIFIER_TOO_LONG)
    String externalRouteId;

    @NotBlank(message = ValidationMessages.FROM_LOCATION_ID_REQUIRED)
    @Size(max = MonitorConstants.MAX_IDENTIFIER_LENGTH, message = ValidationMessages.IDENTIFIER_TOO_LONG)
    String fromLocationId;

    @NotBlank(message = ValidationMessages.FROM_LOCATION_TYPE_REQUIRED)
    String fromLocationType;

    @NotBlank(message = ValidationMessages.TO_LOCATION_ID_REQUIRED)
    @Size(max = MonitorConstants.MAX_IDENTIFIER_LENGTH, message = ValidationMessages.IDENTIFIER_TOO_LONG)
    String toLocationId;

    @NotBlank(message = ValidationMessages.TO_LOCATION_TYPE_REQUIRED)
    String toLocationType;

    @NotNull(message = ValidationMessages.DEPARTURE_REQUIRED)
    OffsetDateTime departureAt;

    OffsetDateTime arrivalAt;
}
