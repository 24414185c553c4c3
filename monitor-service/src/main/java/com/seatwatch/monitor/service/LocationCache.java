package com.seatwatch.monitor.service;

import com.seatwatch.monitor.client.ProviderApiClient;
import com.seatwatch.monitor.constants.MonitorConstants;
import com.seatwatch.monitor.dto.Location;
import com.seatwatch.monitor.dto.LocationDirectory;
import com.seatwatch.monitor.exception.LocationDirectoryException;
import com.seatwatch.monitor.exception.UpstreamUnavailableException;
import com.seatwatch.monitor.mapper.LocationDirectoryMapper;
import com.seatwatch.monitor.service.cache.LocationStoreOperations;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Location directory backed by the shared store, refreshed from the provider on miss or expiry.
 * A failed refresh serves the previous directory, memoized for one memo period before the
 * provider is tried again; an empty list is returned only when no directory was ever fetched.
 * The in-process memo never outlives the shared TTL.
 */
@Service
@Slf4j
public class LocationCache {

    private final ProviderApiClient providerApiClient;
    private final LocationStoreOperations locationStore;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Duration ttl;
    private final Duration memoTtl;

    private final AtomicReference<Memo> memo = new AtomicReference<>();

    public LocationCache(
            ProviderApiClient providerApiClient,
            LocationStoreOperations locationStore,
            MeterRegistry meterRegistry,
            Clock clock,
            @Value("${monitor.location-cache.ttl-seconds:" + MonitorConstants.DEFAULT_LOCATION_CACHE_TTL_SECONDS + "}") long ttlSeconds,
            @Value("${monitor.location-cache.memo-ttl-seconds:" + MonitorConstants.DEFAULT_LOCATION_MEMO_TTL_SECONDS + "}") long memoTtlSeconds) {
        this.providerApiClient = providerApiClient;
        this.locationStore = locationStore;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.ttl = Duration.ofSeconds(ttlSeconds);
        this.memoTtl = Duration.ofSeconds(Math.min(memoTtlSeconds, ttlSeconds));
    }

    public List<Location> getLocations() {
        Instant now = clock.instant();

        Memo current = memo.get();
        if (current != null && current.isFresh(now)) {
            return current.directory().getLocations();
        }

        Optional<LocationDirectory> stored = loadValid();
        if (stored.isPresent() && !stored.get().isExpired(now)) {
            remember(stored.get(), now);
            return stored.get().getLocations();
        }

        try {
            LocationDirectory refreshed = refresh(now);
            remember(refreshed, now);
            return refreshed.getLocations();
        } catch (UpstreamUnavailableException | LocationDirectoryException e) {
            meterRegistry.counter(MonitorConstants.METRIC_LOCATION_REFRESH, "result", "failure").increment();
            if (stored.isPresent()) {
                log.warn("Location refresh failed, serving stale directory fetched at {}: {}",
                        stored.get().getFetchedAt(), e.getMessage());
                // Stale copy is held for one memo period before the provider is tried again.
                memo.set(new Memo(stored.get(), now.plus(memoTtl)));
                return stored.get().getLocations();
            }
            log.error("Location refresh failed and no directory is cached: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * @return id to display name; a later entry with the same id replaces an earlier one
     */
    public Map<String, String> getNamesById() {
        Map<String, String> names = new LinkedHashMap<>();
        for (Location location : getLocations()) {
            names.put(location.getId(), location.getName());
        }
        return names;
    }

    private LocationDirectory refresh(Instant now) {
        log.info("Refreshing location directory from provider");
        List<Location> locations = LocationDirectoryMapper.fromTree(providerApiClient.fetchLocationTree());

        LocationDirectory directory = LocationDirectory.builder()
                .fetchedAt(now)
                .expiresAt(now.plus(ttl))
                .locations(locations)
                .build();
        locationStore.save(directory);

        meterRegistry.counter(MonitorConstants.METRIC_LOCATION_REFRESH, "result", "success").increment();
        log.info("Location directory refreshed: entries={}", locations.size());
        return directory;
    }

    private Optional<LocationDirectory> loadValid() {
        Optional<LocationDirectory> stored = locationStore.load();
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        try {
            LocationDirectoryMapper.validate(stored.get().getLocations());
            return stored;
        } catch (LocationDirectoryException e) {
            log.warn("Discarding invalid cached location directory: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void remember(LocationDirectory directory, Instant now) {
        Instant memoExpiry = now.plus(memoTtl);
        if (directory.getExpiresAt() != null && directory.getExpiresAt().isBefore(memoExpiry)) {
            memoExpiry = directory.getExpiresAt();
        }
        memo.set(new Memo(directory, memoExpiry));
    }

    private record Memo(LocationDirectory directory, Instant expiresAt) {
        boolean isFresh(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
