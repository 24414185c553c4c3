package com.seatwatch.monitor.service;

import com.seatwatch.monitor.dto.AvailabilityResult;
import com.seatwatch.monitor.dto.Location;
import com.seatwatch.monitor.dto.MonitorResponse;
import com.seatwatch.monitor.dto.MonitoredRouteEntry;
import com.seatwatch.monitor.dto.RestartResponse;
import com.seatwatch.monitor.dto.RouteMonitorRequest;
import com.seatwatch.monitor.dto.RouteSnapshot;
import com.seatwatch.monitor.exception.SubscriptionNotFoundException;
import com.seatwatch.monitor.exception.UserNotFoundException;
import com.seatwatch.monitor.mapper.MonitoredRouteMapper;
import com.seatwatch.monitor.model.MonitoredRoute;
import com.seatwatch.monitor.model.Subscription;
import com.seatwatch.monitor.repository.AppUserRepository;
import com.seatwatch.monitor.validator.MonitorRequestValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Request-path operations on a user's monitored routes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonitoringService {

    private final RouteRegistry routeRegistry;
    private final AvailabilityChecker availabilityChecker;
    private final LocationCache locationCache;
    private final AppUserRepository appUserRepository;

    /**
     * Checks the route once. If seats exist the caller is told so and nothing is stored;
     * otherwise the route is registered and the user subscribed. A provider failure
     * propagates and nothing is stored.
     */
    public MonitorResponse requestMonitoring(Long userId, RouteMonitorRequest request) {
        MonitorRequestValidator.validateUserId(userId);
        MonitorRequestValidator.validateMonitorRequest(request);
        requireUser(userId);

        RouteSnapshot snapshot = MonitoredRouteMapper.toSnapshot(request);
        AvailabilityResult result = availabilityChecker.check(snapshot);
        if (result.isAvailable()) {
            log.info("Seats already available, monitoring not started: userId={}, externalRouteId={}",
                    userId, snapshot.getExternalRouteId());
            return MonitorResponse.availableNow(result.getDetails());
        }

        MonitoredRoute route = routeRegistry.getOrCreate(snapshot);
        routeRegistry.addSubscription(userId, route.getId());

        log.info("Monitoring started: userId={}, routeId={}, externalRouteId={}",
                userId, route.getId(), route.getExternalRouteId());
        return MonitorResponse.monitoring(route.getId());
    }

    public List<MonitoredRouteEntry> listMonitored(Long userId) {
        MonitorRequestValidator.validateUserId(userId);

        List<Subscription> subscriptions = routeRegistry.findSubscriptionsWithRoute(userId);
        if (subscriptions.isEmpty()) {
            return List.of();
        }

        Map<String, String> names = locationCache.getNamesById();
        return subscriptions.stream()
                .map(subscription -> MonitoredRouteMapper.toEntry(subscription, names))
                .toList();
    }

    public void cancel(Long userId, Long routeId) {
        MonitorRequestValidator.validateUserId(userId);
        MonitorRequestValidator.validateRouteId(routeId);

        if (!routeRegistry.removeSubscription(userId, routeId)) {
            throw new SubscriptionNotFoundException(userId, routeId);
        }
        log.info("Monitoring cancelled: userId={}, routeId={}", userId, routeId);
    }

    public RestartResponse restart(Long userId, Long routeId) {
        MonitorRequestValidator.validateUserId(userId);
        MonitorRequestValidator.validateRouteId(routeId);

        return routeRegistry.restart(routeId, userId);
    }

    public List<Location> locations() {
        return locationCache.getLocations();
    }

    private void requireUser(Long userId) {
        if (!appUserRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
    }
}
