package com.seatwatch.monitor.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.seatwatch.monitor.dto.AvailableRoute;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the provider's route search response. Entries that are malformed or depart on a
 * different day are skipped one by one; a response without a routes list yields no routes.
 */
@Slf4j
public final class AvailableRouteMapper {

    private AvailableRouteMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static List<AvailableRoute> fromSearchResponse(JsonNode response, LocalDate departureDate) {
        if (response == null || !response.isObject() || !response.path("routes").isArray()) {
            log.warn("Unexpected route search response, expected an object with a routes list");
            return List.of();
        }

        List<AvailableRoute> routes = new ArrayList<>();
        for (JsonNode entry : response.get("routes")) {
            AvailableRoute route = toAvailableRoute(entry);
            if (route != null && route.getDepartureTime().toLocalDate().equals(departureDate)) {
                routes.add(route);
            }
        }
        return routes;
    }

    static AvailableRoute toAvailableRoute(JsonNode entry) {
        if (!entry.isObject()) {
            log.warn("Skipping route entry that is not an object: {}", entry);
            return null;
        }

        String routeId = entry.path("id").asText("UNKNOWN");
        JsonNode fromStation = entry.get("departureStationId");
        JsonNode toStation = entry.get("arrivalStationId");
        JsonNode freeSeats = entry.get("freeSeatsCount");
        JsonNode vehicleTypes = entry.get("vehicleTypes");
        if (isMissing(entry.get("id")) || isMissing(fromStation) || isMissing(toStation)
                || isMissing(entry.get("departureTime")) || isMissing(entry.get("arrivalTime"))
                || isMissing(freeSeats) || isMissing(vehicleTypes)) {
            log.warn("Skipping route {} with missing fields", routeId);
            return null;
        }
        if (!vehicleTypes.isArray() || !(freeSeats.isIntegralNumber() || freeSeats.isTextual())) {
            log.warn("Skipping route {} with malformed seats or vehicle types", routeId);
            return null;
        }

        try {
            List<String> types = new ArrayList<>();
            vehicleTypes.forEach(type -> types.add(type.asText()));
            return AvailableRoute.builder()
                    .routeId(routeId)
                    .departureTime(OffsetDateTime.parse(entry.get("departureTime").asText()))
                    .arrivalTime(OffsetDateTime.parse(entry.get("arrivalTime").asText()))
                    .freeSeatsCount(Integer.parseInt(freeSeats.asText().trim()))
                    .vehicleTypes(types)
                    .fromStationId(fromStation.asText())
                    .toStationId(toStation.asText())
                    .build();
        } catch (DateTimeParseException | NumberFormatException e) {
            log.warn("Skipping route {}: {}", routeId, e.getMessage());
            return null;
        }
    }

    private static boolean isMissing(JsonNode node) {
        return node == null || node.isNull();
    }
}
