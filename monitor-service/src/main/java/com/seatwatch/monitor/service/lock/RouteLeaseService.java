package com.seatwatch.monitor.service.lock;

import com.seatwatch.monitor.constants.MonitorConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Redis lease keyed by route id. Acquisition never waits: a held lease means another
 * worker is checking the route and this tick skips it. The TTL frees leases of crashed workers.
 */
@Service
@Slf4j
public class RouteLeaseService implements LeaseOperations {

    private static final String RELEASE_LEASE_SCRIPT = "if redis.call('GET', KEYS[1]) == ARGV[1] then " +
            "return redis.call('DEL', KEYS[1]) " +
            "else return 0 end";

    private final StringRedisTemplate stringRedisTemplate;
    private final Duration leaseTtl;

    public RouteLeaseService(
            StringRedisTemplate stringRedisTemplate,
            @Value("${monitor.check.lease-ttl-ms:" + MonitorConstants.DEFAULT_LEASE_TTL_MS + "}") long leaseTtlMs) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.leaseTtl = Duration.ofMillis(leaseTtlMs);
    }

    public LeaseHandle tryAcquire(String resourceId) {
        String leaseKey = MonitorConstants.REDIS_LEASE_PREFIX + resourceId;
        String leaseValue = UUID.randomUUID().toString();

        Boolean acquired = stringRedisTemplate.opsForValue()
                .setIfAbsent(leaseKey, leaseValue, leaseTtl.toMillis(), TimeUnit.MILLISECONDS);

        if (Boolean.TRUE.equals(acquired)) {
            log.debug("Acquired lease: leaseKey={}", leaseKey);
            return new LeaseHandle(leaseKey, leaseValue, true);
        }

        log.debug("Lease held elsewhere: leaseKey={}", leaseKey);
        return new LeaseHandle(leaseKey, leaseValue, false);
    }

    public void release(LeaseHandle handle) {
        if (handle == null || !handle.isAcquired()) {
            return;
        }

        DefaultRedisScript<Long> script = new DefaultRedisScript<>(RELEASE_LEASE_SCRIPT, Long.class);
        Long result = stringRedisTemplate.execute(script,
                Collections.singletonList(handle.getLeaseKey()),
                handle.getLeaseValue());

        if (result != null && result == 1L) {
            log.debug("Released lease: leaseKey={}", handle.getLeaseKey());
        } else {
            log.warn("Lease release failed (expired or taken over): leaseKey={}", handle.getLeaseKey());
        }
    }

    @Override
    public <T> Optional<T> executeIfLeased(String resourceId, Supplier<T> action) {
        LeaseHandle handle = tryAcquire(resourceId);
        if (!handle.isAcquired()) {
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(action.get());
        } finally {
            release(handle);
        }
    }

    @lombok.Value
    public static class LeaseHandle {
        String leaseKey;
        String leaseValue;
        boolean acquired;
    }
}
