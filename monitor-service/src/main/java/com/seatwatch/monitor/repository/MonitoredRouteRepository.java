package com.seatwatch.monitor.repository;

import com.seatwatch.monitor.enums.RouteStatus;
import com.seatwatch.monitor.model.MonitoredRoute;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface MonitoredRouteRepository extends JpaRepository<MonitoredRoute, Long> {

    Optional<MonitoredRoute> findByExternalRouteIdAndFromLocationIdAndToLocationId(
            String externalRouteId, String fromLocationId, String toLocationId);

    @Query("SELECT r.id FROM MonitoredRoute r WHERE r.status = :status ORDER BY r.id")
    List<Long> findIdsByStatus(@Param("status") RouteStatus status);

    @Query("SELECT r.id FROM MonitoredRoute r WHERE r.status <> :excluded AND r.departureAt < :now ORDER BY r.id")
    List<Long> findIdsDepartedBefore(@Param("now") Instant now, @Param("excluded") RouteStatus excluded);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM MonitoredRoute r WHERE r.id = :id")
    Optional<MonitoredRoute> findByIdForUpdate(@Param("id") Long id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE MonitoredRoute r SET r.lastCheckedAt = :now, r.updatedAt = :now WHERE r.id IN :ids")
    int stampLastChecked(@Param("ids") Collection<Long> ids, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE MonitoredRoute r SET r.status = :target, r.updatedAt = :now " +
            "WHERE r.id = :id AND r.status = :expected")
    int transition(@Param("id") Long id,
                   @Param("expected") RouteStatus expected,
                   @Param("target") RouteStatus target,
                   @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE MonitoredRoute r SET r.status = :target, r.lastCheckedAt = :now, r.updatedAt = :now " +
            "WHERE r.id = :id AND r.status = :expected")
    int transitionAndStamp(@Param("id") Long id,
                           @Param("expected") RouteStatus expected,
                           @Param("target") RouteStatus target,
                           @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE MonitoredRoute r SET r.status = com.seatwatch.monitor.enums.RouteStatus.EXPIRED, " +
            "r.updatedAt = :now WHERE r.id = :id AND r.status <> com.seatwatch.monitor.enums.RouteStatus.EXPIRED")
    int expire(@Param("id") Long id, @Param("now") Instant now);
}
