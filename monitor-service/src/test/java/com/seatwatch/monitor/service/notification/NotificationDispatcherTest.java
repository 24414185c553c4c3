package com.seatwatch.monitor.service.notification;

import com.seatwatch.monitor.dto.AvailabilityDetails;
import com.seatwatch.monitor.dto.NotificationMessage;
import com.seatwatch.monitor.dto.RouteSnapshot;
import com.seatwatch.monitor.model.AppUser;
import com.seatwatch.monitor.service.LocationCache;
import com.seatwatch.monitor.service.RouteRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("NotificationDispatcher Unit Tests")
class NotificationDispatcherTest {

    @Mock
    private RouteRegistry routeRegistry;

    @Mock
    private LocationCache locationCache;

    @Mock
    private NotificationDeliveryWorker deliveryWorker;

    private NotificationDispatcher dispatcher;
    private RouteSnapshot route;
    private AvailabilityDetails details;

    @BeforeEach
    void setUp() {
        dispatcher = new NotificationDispatcher(routeRegistry, locationCache, deliveryWorker, "Europe/Prague");

        route = RouteSnapshot.builder()
                .routeId(1L)
                .externalRouteId("R1")
                .fromLocationId("A")
                .fromLocationType("CITY")
                .toLocationId("B")
                .toLocationType("CITY")
                .departureAt(OffsetDateTime.parse("2025-08-15T10:30:00+02:00").toInstant())
                .build();

        details = AvailabilityDetails.builder()
                .freeSeatsCount(5)
                .priceFrom(new BigDecimal("199.00"))
                .bookingLink("https://booking.test/?departureDate=2025-08-15")
                .build();

        when(routeRegistry.findVerifiedSubscribers(1L)).thenReturn(List.of(
                AppUser.builder().id(1L).email("alice@example.com").verified(true).build(),
                AppUser.builder().id(2L).email("bob@example.com").verified(true).build()));
        when(locationCache.getNamesById()).thenReturn(Map.of("A", "Praha", "B", "Brno"));
    }

    @Test
    @DisplayName("Should queue one message per verified subscriber")
    void dispatchFound_TwoSubscribers_QueuesTwo() {
        int queued = dispatcher.dispatchFound(route, details);

        assertThat(queued).isEqualTo(2);
        ArgumentCaptor<NotificationMessage> captor = ArgumentCaptor.forClass(NotificationMessage.class);
        verify(deliveryWorker, times(2)).deliver(captor.capture());
        assertThat(captor.getAllValues()).extracting(NotificationMessage::getRecipient)
                .containsExactly("alice@example.com", "bob@example.com");

        NotificationMessage first = captor.getAllValues().get(0);
        assertThat(first.getSubject()).isEqualTo("Seats available: Praha -> Brno (15.08.2025 10:30)");
        assertThat(first.getBody())
                .contains("Departure: 15.08.2025 10:30")
                .contains("Arrival: (unknown)")
                .contains("Free seats: 5")
                .contains("Price from: 199.00 CZK")
                .contains("https://booking.test/?departureDate=2025-08-15");
    }

    @Test
    @DisplayName("Should fall back to raw ids when names are not cached")
    void dispatchFound_CacheMiss_UsesIds() {
        when(locationCache.getNamesById()).thenReturn(Map.of());

        dispatcher.dispatchFound(route, details);

        ArgumentCaptor<NotificationMessage> captor = ArgumentCaptor.forClass(NotificationMessage.class);
        verify(deliveryWorker, times(2)).deliver(captor.capture());
        assertThat(captor.getValue().getSubject()).startsWith("Seats available: ID A -> ID B");
    }

    @Test
    @DisplayName("Should queue nothing without verified subscribers")
    void dispatchFound_NoSubscribers_QueuesNothing() {
        when(routeRegistry.findVerifiedSubscribers(1L)).thenReturn(List.of());

        assertThat(dispatcher.dispatchFound(route, details)).isZero();

        verifyNoInteractions(deliveryWorker);
        verify(locationCache, never()).getNamesById();
    }
}
