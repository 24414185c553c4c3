package com.seatwatch.monitor.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.Instant;
import java.util.List;

/**
 * The whole location directory as stored in the shared cache, with its logical expiry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class LocationDirectory {

    Instant fetchedAt;

    Instant expiresAt;

    List<Location> locations;

    public boolean isExpired(Instant now) {
        return expiresAt == null || !now.isBefore(expiresAt);
    }
}
