package com.seatwatch.monitor.controller.v1;

import com.seatwatch.monitor.dto.MonitorResponse;
import com.seatwatch.monitor.dto.MonitoredRouteEntry;
import com.seatwatch.monitor.dto.RestartResponse;
import com.seatwatch.monitor.dto.RouteMonitorRequest;
import com.seatwatch.monitor.enums.MonitorOutcome;
import com.seatwatch.monitor.service.MonitoringService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/monitoring")
@RequiredArgsConstructor
@Slf4j
public class MonitoringController {

    static final String USER_HEADER = "X-User-Id";

    private final MonitoringService monitoringService;

    @PostMapping
    public ResponseEntity<MonitorResponse> monitor(
            @RequestHeader(USER_HEADER) Long userId,
            @Valid @RequestBody RouteMonitorRequest request) {

        log.info("POST /v1/monitoring - user={}, externalRouteId={}, from={}, to={}",
                userId, request.getExternalRouteId(), request.getFromLocationId(), request.getToLocationId());

        MonitorResponse response = monitoringService.requestMonitoring(userId, request);
        HttpStatus status = response.getOutcome() == MonitorOutcome.MONITORING ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    @GetMapping
    public ResponseEntity<List<MonitoredRouteEntry>> list(@RequestHeader(USER_HEADER) Long userId) {
        log.debug("GET /v1/monitoring - user={}", userId);
        return ResponseEntity.ok(monitoringService.listMonitored(userId));
    }

    @DeleteMapping("/{routeId}")
    public ResponseEntity<Void> cancel(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long routeId) {

        log.info("DELETE /v1/monitoring/{} - user={}", routeId, userId);
        monitoringService.cancel(userId, routeId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{routeId}/restart")
    public ResponseEntity<RestartResponse> restart(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long routeId) {

        log.info("POST /v1/monitoring/{}/restart - user={}", routeId, userId);
        return ResponseEntity.ok(monitoringService.restart(userId, routeId));
    }
}
