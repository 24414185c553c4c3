package com.seatwatch.monitor.model;

import com.seatwatch.monitor.constants.MonitorConstants;
import com.seatwatch.monitor.enums.RouteStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.Instant;

/**
 * One transport segment watched on behalf of every subscriber interested in it.
 * The segment key (external route id, origin, destination) is unique.
 */
@Entity
@Table(name = "monitored_routes",
        uniqueConstraints = @UniqueConstraint(name = "uq_monitored_route_segment",
                columnNames = {"external_route_id", "from_location_id", "to_location_id"}),
        indexes = @Index(name = "ix_monitored_routes_status_departure", columnList = "status, departure_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class MonitoredRoute {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    Long id;

    @Column(name = "external_route_id", nullable = false, length = MonitorConstants.MAX_IDENTIFIER_LENGTH)
    String externalRouteId;

    @Column(name = "from_location_id", nullable = false, length = MonitorConstants.MAX_IDENTIFIER_LENGTH)
    String fromLocationId;

    @Column(name = "from_location_type", nullable = false, length = 16)
    String fromLocationType;

    @Column(name = "to_location_id", nullable = false, length = MonitorConstants.MAX_IDENTIFIER_LENGTH)
    String toLocationId;

    @Column(name = "to_location_type", nullable = false, length = 16)
    String toLocationType;

    @Column(name = "departure_at", nullable = false)
    Instant departureAt;

    @Column(name = "arrival_at")
    Instant arrivalAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, columnDefinition = "VARCHAR(20)")
    @Builder.Default
    RouteStatus status = RouteStatus.MONITORING;

    @Column(name = "last_checked_at")
    Instant lastCheckedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
