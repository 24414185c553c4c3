package com.seatwatch.monitor.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only view of a route handed to the checker and the notification path.
 * {@code routeId} is null for a request that has not been persisted yet.
 */
@Value
@Builder
public class RouteSnapshot {
    Long routeId;
    String externalRouteId;
    String fromLocationId;
    String fromLocationType;
    String toLocationId;
    String toLocationType;
    Instant departureAt;
    Instant arrivalAt;
}
