package com.seatwatch.monitor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.seatwatch.monitor.enums.MonitorOutcome;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MonitorResponse {

    MonitorOutcome outcome;

    boolean available;

    String message;

    Long routeId;

    AvailabilityDetails details;

    public static MonitorResponse availableNow(AvailabilityDetails details) {
        return MonitorResponse.builder()
                .outcome(MonitorOutcome.AVAILABLE_NOW)
                .available(true)
                .message("Seats are currently available for this route. Monitoring was not started.")
                .details(details)
                .build();
    }

    public static MonitorResponse monitoring(Long routeId) {
        return MonitorResponse.builder()
                .outcome(MonitorOutcome.MONITORING)
                .available(false)
                .message("Monitoring started.")
                .routeId(routeId)
                .build();
    }
}
