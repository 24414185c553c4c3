package com.seatwatch.monitor.mapper;

import com.seatwatch.monitor.dto.MonitoredRouteEntry;
import com.seatwatch.monitor.dto.RouteMonitorRequest;
import com.seatwatch.monitor.dto.RouteSnapshot;
import com.seatwatch.monitor.enums.RouteStatus;
import com.seatwatch.monitor.model.MonitoredRoute;
import com.seatwatch.monitor.model.Subscription;

import java.util.Map;

public final class MonitoredRouteMapper {

    private MonitoredRouteMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static RouteSnapshot toSnapshot(MonitoredRoute route) {
        if (route == null) {
            return null;
        }

        return RouteSnapshot.builder()
                .routeId(route.getId())
                .externalRouteId(route.getExternalRouteId())
                .fromLocationId(route.getFromLocationId())
                .fromLocationType(route.getFromLocationType())
                .toLocationId(route.getToLocationId())
                .toLocationType(route.getToLocationType())
                .departureAt(route.getDepartureAt())
                .arrivalAt(route.getArrivalAt())
                .build();
    }

    public static RouteSnapshot toSnapshot(RouteMonitorRequest request) {
        if (request == null) {
            return null;
        }

        return RouteSnapshot.builder()
                .externalRouteId(request.getExternalRouteId().trim())
                .fromLocationId(request.getFromLocationId().trim())
                .fromLocationType(request.getFromLocationType())
                .toLocationId(request.getToLocationId().trim())
                .toLocationType(request.getToLocationType())
                .departureAt(request.getDepartureAt().toInstant())
                .arrivalAt(request.getArrivalAt() != null ? request.getArrivalAt().toInstant() : null)
                .build();
    }

    public static MonitoredRoute toEntity(RouteSnapshot snapshot) {
        if (snapshot == null) {
            return null;
        }

        return MonitoredRoute.builder()
                .externalRouteId(snapshot.getExternalRouteId())
                .fromLocationId(snapshot.getFromLocationId())
                .fromLocationType(snapshot.getFromLocationType())
                .toLocationId(snapshot.getToLocationId())
                .toLocationType(snapshot.getToLocationType())
                .departureAt(snapshot.getDepartureAt())
                .arrivalAt(snapshot.getArrivalAt())
                .status(RouteStatus.MONITORING)
                .build();
    }

    public static MonitoredRouteEntry toEntry(Subscription subscription, Map<String, String> locationNames) {
        MonitoredRoute route = subscription.getRoute();

        return MonitoredRouteEntry.builder()
                .id(route.getId())
                .externalRouteId(route.getExternalRouteId())
                .fromLocationId(route.getFromLocationId())
                .fromLocationType(route.getFromLocationType())
                .fromLocationName(locationNames.get(route.getFromLocationId()))
                .toLocationId(route.getToLocationId())
                .toLocationType(route.getToLocationType())
                .toLocationName(locationNames.get(route.getToLocationId()))
                .departureAt(route.getDepartureAt())
                .arrivalAt(route.getArrivalAt())
                .status(route.getStatus() != null ? route.getStatus().name() : null)
                .lastCheckedAt(route.getLastCheckedAt())
                .subscribedAt(subscription.getCreatedAt())
                .build();
    }
}
