package com.seatwatch.monitor.service.scheduler;

import com.seatwatch.monitor.constants.MonitorConstants;
import com.seatwatch.monitor.service.RouteRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Expires every non-EXPIRED route whose departure lies in the past, FOUND routes included.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RouteExpirySweeper {

    private final RouteRegistry routeRegistry;
    private final MeterRegistry meterRegistry;

    @Scheduled(fixedRateString = "${monitor.sweep.interval-ms:300000}",
            initialDelayString = "${monitor.sweep.initial-delay-ms:30000}")
    public void sweepExpiredRoutes() {
        expireDepartedRoutes();
    }

    public int expireDepartedRoutes() {
        List<Long> routeIds = routeRegistry.findIdsToExpire();
        if (routeIds.isEmpty()) {
            return 0;
        }

        log.info("Expiring {} departed routes", routeIds.size());
        int expired = 0;
        for (Long routeId : routeIds) {
            try {
                if (routeRegistry.markExpired(routeId)) {
                    expired++;
                }
            } catch (Exception e) {
                log.error("Error expiring route {}: {}", routeId, e.getMessage());
            }
        }

        meterRegistry.counter(MonitorConstants.METRIC_SWEEP_EXPIRED).increment(expired);
        log.info("Sweep finished: expired={}, candidates={}", expired, routeIds.size());
        return expired;
    }
}
