package com.seatwatch.monitor.controller.v1;

import com.seatwatch.monitor.dto.Location;
import com.seatwatch.monitor.service.MonitoringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/locations")
@RequiredArgsConstructor
@Slf4j
public class LocationController {

    private final MonitoringService monitoringService;

    @GetMapping
    public ResponseEntity<List<Location>> list() {
        log.debug("GET /v1/locations");
        return ResponseEntity.ok(monitoringService.locations());
    }
}
