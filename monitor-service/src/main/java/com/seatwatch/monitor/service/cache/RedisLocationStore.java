package com.seatwatch.monitor.service.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.seatwatch.monitor.constants.MonitorConstants;
import com.seatwatch.monitor.dto.LocationDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the whole directory as one JSON value. The Redis TTL only bounds retention;
 * logical freshness is the {@code expiresAt} inside the value, so an expired directory
 * stays readable as a fallback.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedisLocationStore implements LocationStoreOperations {

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<LocationDirectory> load() {
        try {
            String value = stringRedisTemplate.opsForValue().get(MonitorConstants.REDIS_LOCATIONS_KEY);
            if (value != null) {
                return Optional.of(objectMapper.readValue(value, LocationDirectory.class));
            }
        } catch (Exception e) {
            log.warn("Failed to load location directory: {}", e.getMessage());
        }
        return Optional.empty();
    }

    @Override
    public void save(LocationDirectory directory) {
        try {
            String value = objectMapper.writeValueAsString(directory);
            stringRedisTemplate.opsForValue().set(MonitorConstants.REDIS_LOCATIONS_KEY, value,
                    MonitorConstants.LOCATION_STORE_RETENTION_DAYS, TimeUnit.DAYS);
            log.debug("Stored location directory: entries={}", directory.getLocations().size());
        } catch (Exception e) {
            log.error("Failed to store location directory: {}", e.getMessage());
        }
    }
}
