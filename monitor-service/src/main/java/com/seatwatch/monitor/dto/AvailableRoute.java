package com.seatwatch.monitor.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * One connection returned by a route search. {@code routeId} with the two station ids is
 * the segment a user can then ask to monitor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class AvailableRoute {

    String routeId;

    OffsetDateTime departureTime;

    OffsetDateTime arrivalTime;

    int freeSeatsCount;

    List<String> vehicleTypes;

    String fromStationId;

    String toStationId;
}
