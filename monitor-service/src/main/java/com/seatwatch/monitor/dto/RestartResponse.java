package com.seatwatch.monitor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RestartResponse {

    boolean restarted;

    String message;

    AvailabilityDetails details;

    public static RestartResponse stillAvailable(AvailabilityDetails details) {
        return RestartResponse.builder()
                .restarted(false)
                .message("Seats are still available for this route. Monitoring was not restarted.")
                .details(details)
                .build();
    }

    public static RestartResponse restarted() {
        return RestartResponse.builder()
                .restarted(true)
                .message("Monitoring restarted.")
                .build();
    }
}
