package com.seatwatch.monitor.service.scheduler;

import com.seatwatch.monitor.config.AsyncConfiguration;
import com.seatwatch.monitor.constants.MonitorConstants;
import com.seatwatch.monitor.dto.AvailabilityResult;
import com.seatwatch.monitor.dto.RouteSnapshot;
import com.seatwatch.monitor.enums.CheckOutcome;
import com.seatwatch.monitor.enums.RouteStatus;
import com.seatwatch.monitor.exception.UpstreamUnavailableException;
import com.seatwatch.monitor.mapper.MonitoredRouteMapper;
import com.seatwatch.monitor.model.MonitoredRoute;
import com.seatwatch.monitor.service.AvailabilityChecker;
import com.seatwatch.monitor.service.RouteRegistry;
import com.seatwatch.monitor.service.lock.LeaseOperations;
import com.seatwatch.monitor.service.notification.NotificationDispatcher;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * One check unit: lease the route, re-read it, ask the provider, and on seats queue the
 * notifications and then flip the route to FOUND. The route leaves MONITORING only after
 * its notifications were queued.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RouteCheckWorker {

    private final LeaseOperations leaseOperations;
    private final RouteRegistry routeRegistry;
    private final AvailabilityChecker availabilityChecker;
    private final NotificationDispatcher notificationDispatcher;
    private final MeterRegistry meterRegistry;

    @Async(AsyncConfiguration.ROUTE_CHECK_EXECUTOR)
    public void checkRoute(Long routeId) {
        runCheck(routeId);
    }

    public CheckOutcome runCheck(Long routeId) {
        Timer.Sample sample = Timer.start(meterRegistry);
        CheckOutcome outcome;
        try {
            outcome = leaseOperations.executeIfLeased(String.valueOf(routeId), () -> checkLeased(routeId))
                    .orElse(CheckOutcome.LEASE_HELD);
        } catch (UpstreamUnavailableException e) {
            log.warn("Check failed, provider unavailable: routeId={}, error={}", routeId, e.getMessage());
            outcome = CheckOutcome.UPSTREAM_UNAVAILABLE;
        } catch (Exception e) {
            log.error("Error checking route {}: {}", routeId, e.getMessage(), e);
            outcome = CheckOutcome.ERROR;
        } finally {
            sample.stop(Timer.builder(MonitorConstants.METRIC_CHECK_DURATION).register(meterRegistry));
        }

        if (outcome == CheckOutcome.LEASE_HELD) {
            log.debug("Route {} is being checked elsewhere, skipped", routeId);
        }
        meterRegistry.counter(MonitorConstants.METRIC_CHECK_TOTAL, "result", outcome.tag()).increment();
        return outcome;
    }

    private CheckOutcome checkLeased(Long routeId) {
        Optional<MonitoredRoute> route = routeRegistry.findRoute(routeId);
        if (route.isEmpty() || route.get().getStatus() != RouteStatus.MONITORING) {
            log.debug("Route {} no longer monitored, skipped", routeId);
            return CheckOutcome.INACTIVE;
        }

        RouteSnapshot snapshot = MonitoredRouteMapper.toSnapshot(route.get());
        AvailabilityResult result = availabilityChecker.check(snapshot);
        if (!result.isAvailable()) {
            return CheckOutcome.NOT_AVAILABLE;
        }

        // Queued before the route leaves MONITORING; a failure here leaves it for the next tick.
        int queued = notificationDispatcher.dispatchFound(snapshot, result.getDetails());

        if (!routeRegistry.markFound(routeId)) {
            log.warn("Route {} left MONITORING while notifications were queued: recipients={}", routeId, queued);
            return CheckOutcome.ALREADY_TRANSITIONED;
        }
        return CheckOutcome.FOUND;
    }
}
