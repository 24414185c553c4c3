package com.seatwatch.monitor.service;

import com.seatwatch.monitor.config.MonitorConfiguration;
import com.seatwatch.monitor.constants.MonitorConstants;
import com.seatwatch.monitor.dto.AvailabilityResult;
import com.seatwatch.monitor.dto.RestartResponse;
import com.seatwatch.monitor.dto.RouteSnapshot;
import com.seatwatch.monitor.enums.RouteStatus;
import com.seatwatch.monitor.exception.MonitoringConflictException;
import com.seatwatch.monitor.exception.MonitoringPolicyException;
import com.seatwatch.monitor.exception.RouteNotFoundException;
import com.seatwatch.monitor.mapper.MonitoredRouteMapper;
import com.seatwatch.monitor.model.AppUser;
import com.seatwatch.monitor.model.MonitoredRoute;
import com.seatwatch.monitor.model.Subscription;
import com.seatwatch.monitor.repository.MonitoredRouteRepository;
import com.seatwatch.monitor.repository.SubscriptionRepository;
import com.seatwatch.monitor.util.ConstraintViolations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Owns the write paths of monitored routes and subscriptions.
 * <p>
 * Status changes are conditional updates, so concurrent callers cannot apply the same
 * transition twice. Creation races on unique keys are resolved by inserting in a fresh
 * transaction, catching the conflict and re-reading, a bounded number of times.
 */
@Service
@Slf4j
public class RouteRegistry {

    private final MonitoredRouteRepository routeRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final AvailabilityChecker availabilityChecker;
    private final TransactionOperations requiresNewTransaction;
    private final Clock clock;
    private final int maxInsertAttempts;

    public RouteRegistry(
            MonitoredRouteRepository routeRepository,
            SubscriptionRepository subscriptionRepository,
            AvailabilityChecker availabilityChecker,
            @Qualifier(MonitorConfiguration.REQUIRES_NEW_TRANSACTION) TransactionOperations requiresNewTransaction,
            Clock clock,
            @Value("${monitor.registry.max-insert-attempts:" + MonitorConstants.DEFAULT_MAX_INSERT_ATTEMPTS + "}") int maxInsertAttempts) {
        this.routeRepository = routeRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.availabilityChecker = availabilityChecker;
        this.requiresNewTransaction = requiresNewTransaction;
        this.clock = clock;
        this.maxInsertAttempts = maxInsertAttempts;
    }

    /**
     * Returns the route for the segment key, inserting it in MONITORING if absent.
     * An existing FOUND or EXPIRED route is put back to MONITORING.
     */
    public MonitoredRoute getOrCreate(RouteSnapshot snapshot) {
        for (int attempt = 1; attempt <= maxInsertAttempts; attempt++) {
            Optional<MonitoredRoute> existing = findSegment(snapshot);
            if (existing.isPresent()) {
                return reactivate(existing.get());
            }

            try {
                MonitoredRoute created = requiresNewTransaction.execute(status ->
                        routeRepository.saveAndFlush(MonitoredRouteMapper.toEntity(snapshot)));
                log.info("Monitored route created: id={}, externalRouteId={}, from={}, to={}",
                        created.getId(), created.getExternalRouteId(),
                        created.getFromLocationId(), created.getToLocationId());
                return created;
            } catch (DataIntegrityViolationException e) {
                if (!ConstraintViolations.isUniqueViolation(e) && findSegment(snapshot).isEmpty()) {
                    log.error("Route {} {}->{} rejected by the database: {}",
                            snapshot.getExternalRouteId(), snapshot.getFromLocationId(), snapshot.getToLocationId(),
                            e.getMostSpecificCause().getMessage());
                    throw e;
                }
                log.warn("Concurrent insert of route {} {}->{}, re-reading (attempt {}/{})",
                        snapshot.getExternalRouteId(), snapshot.getFromLocationId(), snapshot.getToLocationId(),
                        attempt, maxInsertAttempts);
            }
        }
        throw MonitoringConflictException.insertConflict("route " + snapshot.getExternalRouteId());
    }

    /**
     * Creates the subscription if absent. Calling it again for the same pair returns the existing row.
     */
    public Subscription addSubscription(Long userId, Long routeId) {
        for (int attempt = 1; attempt <= maxInsertAttempts; attempt++) {
            Optional<Subscription> existing = subscriptionRepository.findByUserIdAndRouteId(userId, routeId);
            if (existing.isPresent()) {
                log.debug("Subscription already exists: userId={}, routeId={}", userId, routeId);
                return existing.get();
            }

            try {
                Subscription created = requiresNewTransaction.execute(status ->
                        subscriptionRepository.saveAndFlush(Subscription.builder()
                                .userId(userId)
                                .routeId(routeId)
                                .build()));
                log.info("Subscription created: userId={}, routeId={}", userId, routeId);
                return created;
            } catch (DataIntegrityViolationException e) {
                if (ConstraintViolations.isForeignKeyViolation(e)) {
                    log.warn("Route or user removed while subscribing: userId={}, routeId={}", userId, routeId);
                    throw MonitoringConflictException.subscriptionTargetRemoved(userId, routeId);
                }
                if (!ConstraintViolations.isUniqueViolation(e)
                        && !subscriptionRepository.existsByUserIdAndRouteId(userId, routeId)) {
                    log.error("Subscription userId={}, routeId={} rejected by the database: {}",
                            userId, routeId, e.getMostSpecificCause().getMessage());
                    throw e;
                }
                log.warn("Concurrent insert of subscription userId={}, routeId={}, re-reading (attempt {}/{})",
                        userId, routeId, attempt, maxInsertAttempts);
            }
        }
        throw MonitoringConflictException.insertConflict("subscription of user " + userId + " on route " + routeId);
    }

    /**
     * Deletes the subscription and, if it was the last one, the route. The route row is locked
     * first so a concurrent subscribe cannot attach to a route that is about to be deleted.
     *
     * @return false if the user had no subscription on the route
     */
    @Transactional
    public boolean removeSubscription(Long userId, Long routeId) {
        if (routeRepository.findByIdForUpdate(routeId).isEmpty()) {
            return false;
        }

        int deleted = subscriptionRepository.deleteByUserIdAndRouteId(userId, routeId);
        if (deleted == 0) {
            return false;
        }

        long remaining = subscriptionRepository.countByRouteId(routeId);
        if (remaining == 0) {
            routeRepository.deleteById(routeId);
            log.info("Last subscription removed, route deleted: routeId={}", routeId);
        } else {
            log.info("Subscription removed: userId={}, routeId={}, remaining={}", userId, routeId, remaining);
        }
        return true;
    }

    /**
     * MONITORING -> FOUND.
     *
     * @return true only for the caller that performed the transition
     */
    @Transactional
    public boolean markFound(Long routeId) {
        int updated = routeRepository.transition(routeId, RouteStatus.MONITORING, RouteStatus.FOUND, clock.instant());
        if (updated == 0) {
            log.debug("Route {} not in MONITORING, mark found skipped", routeId);
            return false;
        }
        log.info("Route marked FOUND: routeId={}", routeId);
        return true;
    }

    /**
     * Any non-EXPIRED status -> EXPIRED. Idempotent.
     */
    @Transactional
    public boolean markExpired(Long routeId) {
        int updated = routeRepository.expire(routeId, clock.instant());
        if (updated == 0) {
            return false;
        }
        log.info("Route marked EXPIRED: routeId={}", routeId);
        return true;
    }

    /**
     * Puts a FOUND route back to MONITORING for a subscriber, unless a live check still sees seats.
     * Routes whose departure has passed are rejected without contacting the provider.
     */
    public RestartResponse restart(Long routeId, Long userId) {
        MonitoredRoute route = routeRepository.findById(routeId)
                .orElseThrow(() -> new RouteNotFoundException(routeId));

        if (!subscriptionRepository.existsByUserIdAndRouteId(userId, routeId)) {
            throw MonitoringPolicyException.notSubscribed(userId, routeId);
        }
        if (route.getStatus() != RouteStatus.FOUND) {
            throw MonitoringConflictException.notRestartable(routeId, route.getStatus());
        }
        if (route.getDepartureAt().isBefore(clock.instant())) {
            throw MonitoringConflictException.departed(routeId);
        }

        AvailabilityResult result = availabilityChecker.check(MonitoredRouteMapper.toSnapshot(route));
        if (result.isAvailable()) {
            log.info("Restart skipped, seats still available: routeId={}", routeId);
            return RestartResponse.stillAvailable(result.getDetails());
        }

        int updated = requiresNewTransaction.execute(status -> routeRepository.transitionAndStamp(
                routeId, RouteStatus.FOUND, RouteStatus.MONITORING, clock.instant()));
        if (updated == 0) {
            RouteStatus current = routeRepository.findById(routeId)
                    .map(MonitoredRoute::getStatus)
                    .orElseThrow(() -> new RouteNotFoundException(routeId));
            throw MonitoringConflictException.notRestartable(routeId, current);
        }

        log.info("Monitoring restarted: routeId={}, userId={}", routeId, userId);
        return RestartResponse.restarted();
    }

    @Transactional
    public int stampLastChecked(Collection<Long> routeIds) {
        if (routeIds.isEmpty()) {
            return 0;
        }
        return routeRepository.stampLastChecked(routeIds, clock.instant());
    }

    public List<Long> findIdsToCheck() {
        return routeRepository.findIdsByStatus(RouteStatus.MONITORING);
    }

    public List<Long> findIdsToExpire() {
        return routeRepository.findIdsDepartedBefore(clock.instant(), RouteStatus.EXPIRED);
    }

    public Optional<MonitoredRoute> findRoute(Long routeId) {
        return routeRepository.findById(routeId);
    }

    public List<AppUser> findVerifiedSubscribers(Long routeId) {
        return subscriptionRepository.findVerifiedSubscribers(routeId);
    }

    @Transactional(readOnly = true)
    public List<Subscription> findSubscriptionsWithRoute(Long userId) {
        return subscriptionRepository.findWithRouteByUserId(userId);
    }

    private MonitoredRoute reactivate(MonitoredRoute route) {
        if (route.getStatus() == RouteStatus.MONITORING) {
            return route;
        }

        RouteStatus previous = route.getStatus();
        int updated = requiresNewTransaction.execute(status -> routeRepository.transition(
                route.getId(), previous, RouteStatus.MONITORING, clock.instant()));
        if (updated == 1) {
            log.info("Route reactivated: routeId={}, previousStatus={}", route.getId(), previous);
        }
        return routeRepository.findById(route.getId()).orElse(route);
    }

    private Optional<MonitoredRoute> findSegment(RouteSnapshot snapshot) {
        return routeRepository.findByExternalRouteIdAndFromLocationIdAndToLocationId(
                snapshot.getExternalRouteId(), snapshot.getFromLocationId(), snapshot.getToLocationId());
    }
}
