package com.seatwatch.monitor.service.notification;

import com.seatwatch.monitor.constants.MonitorConstants;
import com.seatwatch.monitor.dto.AvailabilityDetails;
import com.seatwatch.monitor.dto.NotificationMessage;
import com.seatwatch.monitor.dto.RouteSnapshot;
import com.seatwatch.monitor.model.AppUser;
import com.seatwatch.monitor.service.LocationCache;
import com.seatwatch.monitor.service.RouteRegistry;
import com.seatwatch.monitor.util.DateTimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Fans a "seats found" event out to the route's verified subscribers.
 * Subscribers are read once; anyone subscribing after that read may not be notified.
 */
@Service
@Slf4j
public class NotificationDispatcher {

    private final RouteRegistry routeRegistry;
    private final LocationCache locationCache;
    private final NotificationDeliveryWorker deliveryWorker;
    private final ZoneId zone;

    public NotificationDispatcher(
            RouteRegistry routeRegistry,
            LocationCache locationCache,
            NotificationDeliveryWorker deliveryWorker,
            @Value("${monitor.zone-id:" + MonitorConstants.DEFAULT_ZONE_ID + "}") String zoneId) {
        this.routeRegistry = routeRegistry;
        this.locationCache = locationCache;
        this.deliveryWorker = deliveryWorker;
        this.zone = ZoneId.of(zoneId);
    }

    /**
     * Queues one delivery per verified subscriber.
     *
     * @return number of deliveries queued
     */
    public int dispatchFound(RouteSnapshot route, AvailabilityDetails details) {
        List<AppUser> recipients = routeRegistry.findVerifiedSubscribers(route.getRouteId());
        if (recipients.isEmpty()) {
            log.info("No verified subscribers to notify: routeId={}", route.getRouteId());
            return 0;
        }

        Map<String, String> names = locationCache.getNamesById();
        String fromName = displayName(names, route.getFromLocationId());
        String toName = displayName(names, route.getToLocationId());
        String subject = buildSubject(route, fromName, toName);
        String body = buildBody(route, details, fromName, toName);

        for (AppUser recipient : recipients) {
            deliveryWorker.deliver(NotificationMessage.builder()
                    .routeId(route.getRouteId())
                    .recipient(recipient.getEmail())
                    .subject(subject)
                    .body(body)
                    .build());
        }

        log.info("Notifications queued: routeId={}, recipients={}", route.getRouteId(), recipients.size());
        return recipients.size();
    }

    String buildSubject(RouteSnapshot route, String fromName, String toName) {
        return "Seats available: " + fromName + " -> " + toName
                + " (" + DateTimeUtils.formatLocal(route.getDepartureAt(), zone) + ")";
    }

    String buildBody(RouteSnapshot route, AvailabilityDetails details, String fromName, String toName) {
        StringBuilder body = new StringBuilder();
        body.append("Hello,\n\n");
        body.append("seats are now available on a route you are monitoring.\n\n");
        body.append("Route: ").append(fromName).append(" -> ").append(toName).append('\n');
        body.append("Departure: ").append(DateTimeUtils.formatLocal(route.getDepartureAt(), zone)).append('\n');
        body.append("Arrival: ").append(DateTimeUtils.formatLocal(route.getArrivalAt(), zone)).append('\n');
        body.append("Free seats: ").append(details.getFreeSeatsCount()).append('\n');
        body.append("Price from: ").append(formatPrice(details.getPriceFrom())).append('\n');
        if (details.getBookingLink() != null) {
            body.append("\nBook here: ").append(details.getBookingLink()).append('\n');
        }
        body.append("\nMonitoring of this route has stopped. You can restart it from your list of monitored routes.\n");
        return body.toString();
    }

    private static String displayName(Map<String, String> names, String locationId) {
        String name = names.get(locationId);
        return name != null ? name : "ID " + locationId;
    }

    private static String formatPrice(BigDecimal price) {
        return price != null ? price.toPlainString() + " " + MonitorConstants.CURRENCY : MonitorConstants.UNKNOWN_VALUE;
    }
}
