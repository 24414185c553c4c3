package com.seatwatch.monitor.service.scheduler;

import com.seatwatch.monitor.service.RouteRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Periodic driver: stamps every MONITORING route and hands each one to the check pool.
 * The tick itself never waits on a check.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RouteCheckScheduler {

    private final RouteRegistry routeRegistry;
    private final RouteCheckWorker routeCheckWorker;

    @Scheduled(fixedRateString = "${monitor.check.interval-ms:60000}",
            initialDelayString = "${monitor.check.initial-delay-ms:10000}")
    public void scheduleChecks() {
        List<Long> routeIds = routeRegistry.findIdsToCheck();
        if (routeIds.isEmpty()) {
            log.debug("No monitored routes to check");
            return;
        }

        routeRegistry.stampLastChecked(routeIds);
        log.info("Dispatching checks for {} routes", routeIds.size());

        int rejected = 0;
        for (Long routeId : routeIds) {
            try {
                routeCheckWorker.checkRoute(routeId);
            } catch (TaskRejectedException e) {
                rejected++;
                log.warn("Check pool saturated, route {} deferred to the next tick", routeId);
            }
        }
        if (rejected > 0) {
            log.warn("{} of {} route checks deferred", rejected, routeIds.size());
        }
    }
}
