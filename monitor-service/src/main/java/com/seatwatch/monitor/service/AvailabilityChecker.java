package com.seatwatch.monitor.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.seatwatch.monitor.client.ProviderApiClient;
import com.seatwatch.monitor.constants.MonitorConstants;
import com.seatwatch.monitor.dto.AvailabilityDetails;
import com.seatwatch.monitor.dto.AvailabilityResult;
import com.seatwatch.monitor.dto.RouteSnapshot;
import com.seatwatch.monitor.exception.UpstreamUnavailableException;
import com.seatwatch.monitor.util.DateTimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Asks the provider whether a route segment has free seats.
 * Malformed answers and unknown routes count as "not available"; only failures to reach
 * the provider raise {@link UpstreamUnavailableException}.
 */
@Service
@Slf4j
public class AvailabilityChecker {

    private final ProviderApiClient providerApiClient;
    private final String bookingBaseUrl;
    private final ZoneId zone;

    public AvailabilityChecker(
            ProviderApiClient providerApiClient,
            @Value("${provider.booking-base-url}") String bookingBaseUrl,
            @Value("${monitor.zone-id:" + MonitorConstants.DEFAULT_ZONE_ID + "}") String zoneId) {
        this.providerApiClient = providerApiClient;
        this.bookingBaseUrl = bookingBaseUrl;
        this.zone = ZoneId.of(zoneId);
    }

    public AvailabilityResult check(RouteSnapshot route) throws UpstreamUnavailableException {
        Optional<JsonNode> response = providerApiClient.fetchRouteStatus(
                route.getExternalRouteId(), route.getFromLocationId(), route.getToLocationId());

        if (response.isEmpty()) {
            return AvailabilityResult.notAvailable();
        }

        JsonNode body = response.get();
        if (!body.isObject()) {
            log.error("Unexpected provider response type for route {}: {}",
                    route.getExternalRouteId(), body.getNodeType());
            return AvailabilityResult.notAvailable();
        }

        JsonNode freeSeats = body.get(MonitorConstants.FIELD_FREE_SEATS);
        if (freeSeats == null || !freeSeats.isNumber()) {
            log.error("Missing or non-numeric {} for route {}", MonitorConstants.FIELD_FREE_SEATS, route.getExternalRouteId());
            return AvailabilityResult.notAvailable();
        }

        int seats = freeSeats.asInt();
        if (seats <= 0) {
            log.info("No seats for route {}", route.getExternalRouteId());
            return AvailabilityResult.notAvailable();
        }

        log.info("Seats found for route {}: {} seats", route.getExternalRouteId(), seats);
        return AvailabilityResult.available(AvailabilityDetails.builder()
                .freeSeatsCount(seats)
                .priceFrom(decimalOrNull(body.get(MonitorConstants.FIELD_PRICE_FROM)))
                .priceTo(decimalOrNull(body.get(MonitorConstants.FIELD_PRICE_TO)))
                .arrivalTime(textOrNull(body.get(MonitorConstants.FIELD_ARRIVAL_TIME)))
                .bookingLink(buildBookingLink(route))
                .build());
    }

    /**
     * Deep link into the provider's booking page for the departure day (in the provider's zone) and both endpoints.
     */
    public String buildBookingLink(RouteSnapshot route) {
        return UriComponentsBuilder.fromHttpUrl(bookingBaseUrl)
                .queryParam("departureDate", DateTimeUtils.localDate(route.getDepartureAt(), zone))
                .queryParam("fromLocationId", route.getFromLocationId())
                .queryParam("toLocationId", route.getToLocationId())
                .queryParam("fromLocationType", route.getFromLocationType())
                .queryParam("toLocationType", route.getToLocationType())
                .encode()
                .toUriString();
    }

    private static BigDecimal decimalOrNull(JsonNode node) {
        return node != null && node.isNumber() ? node.decimalValue() : null;
    }

    private static String textOrNull(JsonNode node) {
        return node != null && !node.isNull() ? node.asText() : null;
    }
}
