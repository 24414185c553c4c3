package com.seatwatch.monitor.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.seatwatch.monitor.client.ProviderApiClient;
import com.seatwatch.monitor.dto.Location;
import com.seatwatch.monitor.dto.LocationDirectory;
import com.seatwatch.monitor.exception.LocationDirectoryException;
import com.seatwatch.monitor.exception.UpstreamUnavailableException;
import com.seatwatch.monitor.service.cache.LocationStoreOperations;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("LocationCache Unit Tests")
class LocationCacheTest {

    private static final Instant NOW = Instant.parse("2025-08-01T08:00:00Z");
    private static final String TREE = """
            [{"code":"CZ","cities":[{"id":1,"name":"Praha","stations":[{"id":11,"fullname":"Praha - Florenc"}]}]}]
            """;

    @Mock
    private ProviderApiClient providerApiClient;

    @Mock
    private LocationStoreOperations locationStore;

    @Mock
    private Clock clock;

    private SimpleMeterRegistry meterRegistry;
    private LocationCache locationCache;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws Exception {
        meterRegistry = new SimpleMeterRegistry();
        when(clock.instant()).thenReturn(NOW);
        when(providerApiClient.fetchLocationTree()).thenReturn(objectMapper.readTree(TREE));
        when(locationStore.load()).thenReturn(Optional.empty());

        locationCache = new LocationCache(providerApiClient, locationStore, meterRegistry, clock,
                86400, // ttlSeconds
                300    // memoTtlSeconds
        );
    }

    private static LocationDirectory directory(Instant expiresAt, String name) {
        return LocationDirectory.builder()
                .fetchedAt(expiresAt.minus(Duration.ofDays(1)))
                .expiresAt(expiresAt)
                .locations(List.of(Location.builder()
                        .id("1").name(name).type("CITY").normalizedName(name.toLowerCase()).build()))
                .build();
    }

    private double refreshCount(String result) {
        return meterRegistry.counter("monitor.location_cache.refresh", "result", result).count();
    }

    @Nested
    @DisplayName("Refresh Tests")
    class RefreshTests {

        @Test
        @DisplayName("Should serve a fresh stored directory without calling the provider")
        void getLocations_FreshStored_NoProviderCall() {
            when(locationStore.load()).thenReturn(Optional.of(directory(NOW.plusSeconds(3600), "Praha")));

            List<Location> locations = locationCache.getLocations();

            assertThat(locations).extracting(Location::getName).containsExactly("Praha");
            verify(providerApiClient, never()).fetchLocationTree();
        }

        @Test
        @DisplayName("Should fetch and store the directory on a miss")
        void getLocations_Miss_RefreshesAndStores() {
            List<Location> locations = locationCache.getLocations();

            assertThat(locations).extracting(Location::getId).containsExactly("1", "11");
            ArgumentCaptor<LocationDirectory> stored = ArgumentCaptor.forClass(LocationDirectory.class);
            verify(locationStore).save(stored.capture());
            assertThat(stored.getValue().getFetchedAt()).isEqualTo(NOW);
            assertThat(stored.getValue().getExpiresAt()).isEqualTo(NOW.plus(Duration.ofDays(1)));
            assertThat(refreshCount("success")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should refresh an expired stored directory")
        void getLocations_Expired_Refreshes() {
            when(locationStore.load()).thenReturn(Optional.of(directory(NOW.minusSeconds(1), "Old Praha")));

            List<Location> locations = locationCache.getLocations();

            assertThat(locations).extracting(Location::getName).contains("Praha - Florenc");
            verify(providerApiClient).fetchLocationTree();
        }

        @Test
        @DisplayName("Should refresh when the stored directory fails validation")
        void getLocations_InvalidStored_Refreshes() {
            LocationDirectory broken = directory(NOW.plusSeconds(3600), "Praha");
            broken.getLocations().get(0).setType("PLANET");
            when(locationStore.load()).thenReturn(Optional.of(broken));

            List<Location> locations = locationCache.getLocations();

            assertThat(locations).hasSize(2);
            verify(providerApiClient).fetchLocationTree();
        }
    }

    @Nested
    @DisplayName("Fallback Tests")
    class FallbackTests {

        @Test
        @DisplayName("Should serve the stale directory when the provider is down")
        void getLocations_ProviderDown_ServesStale() {
            when(locationStore.load()).thenReturn(Optional.of(directory(NOW.minusSeconds(60), "Praha")));
            when(providerApiClient.fetchLocationTree()).thenThrow(new UpstreamUnavailableException("down"));

            List<Location> locations = locationCache.getLocations();

            assertThat(locations).extracting(Location::getName).containsExactly("Praha");
            verify(locationStore, never()).save(any());
            assertThat(refreshCount("failure")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should serve the stale directory when the new one is malformed")
        void getLocations_MalformedTree_ServesStale() throws Exception {
            when(locationStore.load()).thenReturn(Optional.of(directory(NOW.minusSeconds(60), "Praha")));
            when(providerApiClient.fetchLocationTree())
                    .thenReturn(objectMapper.readTree("[{\"cities\":[{\"name\":\"No id\"}]}]"));

            assertThat(locationCache.getLocations()).extracting(Location::getName).containsExactly("Praha");
            verify(locationStore, never()).save(any());
        }

        @Test
        @DisplayName("Should hold the stale directory for one memo period during an outage")
        void getLocations_ProviderDown_MemoizesStale() {
            when(locationStore.load()).thenReturn(Optional.of(directory(NOW.minusSeconds(60), "Praha")));
            when(providerApiClient.fetchLocationTree()).thenThrow(new UpstreamUnavailableException("down"));

            locationCache.getLocations();
            when(clock.instant()).thenReturn(NOW.plusSeconds(299));
            assertThat(locationCache.getNamesById()).containsEntry("1", "Praha");

            verify(providerApiClient, times(1)).fetchLocationTree();

            when(clock.instant()).thenReturn(NOW.plusSeconds(301));
            assertThat(locationCache.getLocations()).extracting(Location::getName).containsExactly("Praha");
            verify(providerApiClient, times(2)).fetchLocationTree();
        }

        @Test
        @DisplayName("Should return empty when nothing was ever fetched")
        void getLocations_NeverFetched_Empty() {
            when(providerApiClient.fetchLocationTree()).thenThrow(new LocationDirectoryException("bad"));

            assertThat(locationCache.getLocations()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Memo Tests")
    class MemoTests {

        @Test
        @DisplayName("Should answer repeated calls from the memo")
        void getLocations_Repeated_UsesMemo() {
            locationCache.getLocations();
            locationCache.getLocations();

            verify(locationStore, times(1)).load();
            verify(providerApiClient, times(1)).fetchLocationTree();
        }

        @Test
        @DisplayName("Should go back to the store after the memo expires")
        void getLocations_MemoExpired_ReadsStore() {
            locationCache.getLocations();
            when(clock.instant()).thenReturn(NOW.plusSeconds(301));
            when(locationStore.load()).thenReturn(Optional.of(directory(NOW.plusSeconds(3600), "Praha")));

            assertThat(locationCache.getLocations()).extracting(Location::getName).containsExactly("Praha");
            verify(locationStore, times(2)).load();
        }

        @Test
        @DisplayName("Should never keep the memo longer than the shared TTL")
        void getLocations_ShortSharedTtl_ClampsMemo() {
            LocationCache shortLived = new LocationCache(providerApiClient, locationStore, meterRegistry, clock, 60, 300);
            shortLived.getLocations();
            when(clock.instant()).thenReturn(NOW.plusSeconds(61));

            shortLived.getLocations();

            verify(providerApiClient, times(2)).fetchLocationTree();
        }

        @Test
        @DisplayName("Should map ids to display names")
        void getNamesById_ResolvesNames() {
            Map<String, String> names = locationCache.getNamesById();

            assertThat(names).containsEntry("1", "Praha").containsEntry("11", "Praha - Florenc");
        }
    }
}
