package com.seatwatch.monitor.controller.v1;

import com.seatwatch.monitor.dto.AvailableRoute;
import com.seatwatch.monitor.dto.RouteSearchQuery;
import com.seatwatch.monitor.service.RouteSearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/v1/routes")
@RequiredArgsConstructor
@Slf4j
public class RouteSearchController {

    private final RouteSearchService routeSearchService;

    @GetMapping("/available")
    public ResponseEntity<List<AvailableRoute>> available(
            @RequestParam String fromLocationId,
            @RequestParam String fromLocationType,
            @RequestParam String toLocationId,
            @RequestParam String toLocationType,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate departureDate) {

        log.info("GET /v1/routes/available: {} ({}) -> {} ({}) on {}",
                fromLocationId, fromLocationType, toLocationId, toLocationType, departureDate);

        RouteSearchQuery query = RouteSearchQuery.builder()
                .fromLocationId(fromLocationId.trim())
                .fromLocationType(fromLocationType.trim())
                .toLocationId(toLocationId.trim())
                .toLocationType(toLocationType.trim())
                .departureDate(departureDate)
                .build();
        return ResponseEntity.ok(routeSearchService.search(query));
    }
}
