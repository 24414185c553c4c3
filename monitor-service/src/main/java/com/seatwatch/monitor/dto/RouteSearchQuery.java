package com.seatwatch.monitor.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class RouteSearchQuery {

    String fromLocationId;

    String fromLocationType;

    String toLocationId;

    String toLocationType;

    LocalDate departureDate;
}
