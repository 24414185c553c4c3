package com.seatwatch.monitor.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

/**
 * One entry of the provider's location directory (a city or a station).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Location {

    String id;

    String name;

    String type;

    String normalizedName;
}
