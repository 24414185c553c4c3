package com.seatwatch.monitor.service;

import com.seatwatch.monitor.client.ProviderApiClient;
import com.seatwatch.monitor.dto.AvailabilityResult;
import com.seatwatch.monitor.dto.RouteSnapshot;
import com.seatwatch.monitor.exception.UpstreamUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@DisplayName("AvailabilityChecker Tests")
class AvailabilityCheckerTest {

    private static final String BASE_URL = "https://provider.test/restapi";
    private static final String STATUS_URL = BASE_URL + "/routes/R1/simple?fromStationId=A&toStationId=B";

    private MockRestServiceServer server;
    private AvailabilityChecker checker;
    private RouteSnapshot route;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        ProviderApiClient client = new ProviderApiClient(restTemplate, BASE_URL);
        checker = new AvailabilityChecker(client, "https://booking.test/", "Europe/Prague");

        route = RouteSnapshot.builder()
                .routeId(1L)
                .externalRouteId("R1")
                .fromLocationId("A")
                .fromLocationType("CITY")
                .toLocationId("B")
                .toLocationType("CITY")
                .departureAt(OffsetDateTime.parse("2025-08-15T10:30:00+02:00").toInstant())
                .build();
    }

    private void respondWith(String json) {
        server.expect(requestTo(STATUS_URL))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(json, MediaType.APPLICATION_JSON));
    }

    @Nested
    @DisplayName("Available Tests")
    class AvailableTests {

        @Test
        @DisplayName("Should report seats with prices and a booking link")
        void check_FreeSeats_Available() {
            server.expect(requestTo(STATUS_URL))
                    .andExpect(method(HttpMethod.GET))
                    .andExpect(header("X-Lang", "cs"))
                    .andExpect(header("X-Currency", "CZK"))
                    .andRespond(withSuccess(
                            "{\"freeSeatsCount\":5,\"priceFrom\":199.0,\"priceTo\":349,\"arrivalTime\":\"2025-08-15T13:05:00.000+02:00\"}",
                            MediaType.APPLICATION_JSON));

            AvailabilityResult result = checker.check(route);

            assertThat(result.isAvailable()).isTrue();
            assertThat(result.getDetails().getFreeSeatsCount()).isEqualTo(5);
            assertThat(result.getDetails().getPriceFrom()).isEqualByComparingTo(new BigDecimal("199"));
            assertThat(result.getDetails().getPriceTo()).isEqualByComparingTo(new BigDecimal("349"));
            assertThat(result.getDetails().getArrivalTime()).isEqualTo("2025-08-15T13:05:00.000+02:00");
            assertThat(result.getDetails().getBookingLink()).isEqualTo(
                    "https://booking.test/?departureDate=2025-08-15&fromLocationId=A&toLocationId=B"
                            + "&fromLocationType=CITY&toLocationType=CITY");
            server.verify();
        }

        @Test
        @DisplayName("Should use the departure day in the provider's zone for the link")
        void buildBookingLink_LateEveningUtc_UsesLocalDate() {
            RouteSnapshot lateDeparture = RouteSnapshot.builder()
                    .fromLocationId("A")
                    .fromLocationType("STATION")
                    .toLocationId("B")
                    .toLocationType("CITY")
                    .departureAt(OffsetDateTime.parse("2025-08-14T23:30:00Z").toInstant())
                    .build();

            assertThat(checker.buildBookingLink(lateDeparture)).contains("departureDate=2025-08-15");
        }
    }

    @Nested
    @DisplayName("Not Available Tests")
    class NotAvailableTests {

        @Test
        @DisplayName("Should report no seats for zero free seats")
        void check_ZeroSeats_NotAvailable() {
            respondWith("{\"freeSeatsCount\":0,\"priceFrom\":199}");

            AvailabilityResult result = checker.check(route);

            assertThat(result.isAvailable()).isFalse();
            assertThat(result.getDetails()).isNull();
        }

        @Test
        @DisplayName("Should fail closed when the seat count is missing")
        void check_MissingSeatCount_NotAvailable() {
            respondWith("{\"priceFrom\":199}");

            assertThat(checker.check(route).isAvailable()).isFalse();
        }

        @Test
        @DisplayName("Should fail closed when the seat count is not a number")
        void check_TextSeatCount_NotAvailable() {
            respondWith("{\"freeSeatsCount\":\"5\"}");

            assertThat(checker.check(route).isAvailable()).isFalse();
        }

        @Test
        @DisplayName("Should fail closed for a non-object response")
        void check_ArrayResponse_NotAvailable() {
            respondWith("[{\"freeSeatsCount\":5}]");

            assertThat(checker.check(route).isAvailable()).isFalse();
        }

        @Test
        @DisplayName("Should fail closed for an unreadable body")
        void check_MalformedJson_NotAvailable() {
            respondWith("{\"freeSeatsCount\":");

            assertThat(checker.check(route).isAvailable()).isFalse();
        }

        @Test
        @DisplayName("Should treat 404 as not available")
        void check_NotFound_NotAvailable() {
            server.expect(requestTo(STATUS_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

            assertThat(checker.check(route).isAvailable()).isFalse();
            server.verify();
        }
    }

    @Nested
    @DisplayName("Check Failed Tests")
    class CheckFailedTests {

        @Test
        @DisplayName("Should raise check-failed for a server error")
        void check_ServerError_Throws() {
            server.expect(requestTo(STATUS_URL)).andRespond(withServerError());

            assertThatThrownBy(() -> checker.check(route))
                    .isInstanceOf(UpstreamUnavailableException.class)
                    .hasFieldOrPropertyWithValue("retryable", true);
        }

        @Test
        @DisplayName("Should raise check-failed for a non-404 client error")
        void check_Forbidden_Throws() {
            server.expect(requestTo(STATUS_URL)).andRespond(withStatus(HttpStatus.FORBIDDEN));

            assertThatThrownBy(() -> checker.check(route))
                    .isInstanceOf(UpstreamUnavailableException.class);
        }

        @Test
        @DisplayName("Should raise check-failed for a timeout")
        void check_Timeout_Throws() {
            server.expect(requestTo(STATUS_URL)).andRespond(request -> {
                throw new SocketTimeoutException("Read timed out");
            });

            assertThatThrownBy(() -> checker.check(route))
                    .isInstanceOf(UpstreamUnavailableException.class)
                    .hasMessageContaining("unreachable");
        }
    }
}
