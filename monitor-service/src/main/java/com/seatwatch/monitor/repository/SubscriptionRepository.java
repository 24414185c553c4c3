package com.seatwatch.monitor.repository;

import com.seatwatch.monitor.model.AppUser;
import com.seatwatch.monitor.model.Subscription;
import com.seatwatch.monitor.model.SubscriptionId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, SubscriptionId> {

    Optional<Subscription> findByUserIdAndRouteId(Long userId, Long routeId);

    boolean existsByUserIdAndRouteId(Long userId, Long routeId);

    long countByRouteId(Long routeId);

    @Query("SELECT s FROM Subscription s JOIN FETCH s.route WHERE s.userId = :userId ORDER BY s.createdAt DESC")
    List<Subscription> findWithRouteByUserId(@Param("userId") Long userId);

    @Query("SELECT u FROM Subscription s JOIN s.user u WHERE s.routeId = :routeId AND u.verified = true ORDER BY u.id")
    List<AppUser> findVerifiedSubscribers(@Param("routeId") Long routeId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Subscription s WHERE s.userId = :userId AND s.routeId = :routeId")
    int deleteByUserIdAndRouteId(@Param("userId") Long userId, @Param("routeId") Long routeId);
}
