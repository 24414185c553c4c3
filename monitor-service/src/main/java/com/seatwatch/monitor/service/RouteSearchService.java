package com.seatwatch.monitor.service;

import com.seatwatch.monitor.client.ProviderApiClient;
import com.seatwatch.monitor.dto.AvailableRoute;
import com.seatwatch.monitor.dto.RouteSearchQuery;
import com.seatwatch.monitor.mapper.AvailableRouteMapper;
import com.seatwatch.monitor.validator.MonitorRequestValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Looks up bookable connections so a user can pick the segment to monitor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RouteSearchService {

    private final ProviderApiClient providerApiClient;

    public List<AvailableRoute> search(RouteSearchQuery query) {
        MonitorRequestValidator.validateSearchQuery(query);

        List<AvailableRoute> routes = providerApiClient.searchRoutes(query)
                .map(response -> AvailableRouteMapper.fromSearchResponse(response, query.getDepartureDate()))
                .orElse(List.of());

        log.info("Route search {} -> {} on {}: routes={}", query.getFromLocationId(), query.getToLocationId(),
                query.getDepartureDate(), routes.size());
        return routes;
    }
}
