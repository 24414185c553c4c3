package com.seatwatch.monitor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AvailabilityDetails {

    int freeSeatsCount;

    BigDecimal priceFrom;

    BigDecimal priceTo;

    String bookingLink;

    String arrivalTime;
}
