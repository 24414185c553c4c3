package com.seatwatch.monitor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MonitoredRouteEntry {

    Long id;

    String externalRouteId;

    String fromLocationId;

    String fromLocationType;

    String fromLocationName;

    String toLocationId;

    String toLocationType;

    String toLocationName;

    Instant departureAt;

    Instant arrivalAt;

    String status;

    Instant lastCheckedAt;

    Instant subscribedAt;
}
