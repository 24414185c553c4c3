package com.seatwatch.monitor.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.seatwatch.monitor.config.RestClientConfiguration;
import com.seatwatch.monitor.constants.MonitorConstants;
import com.seatwatch.monitor.dto.RouteSearchQuery;
import com.seatwatch.monitor.exception.LocationDirectoryException;
import com.seatwatch.monitor.exception.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Read-only client for the transport provider's public API.
 */
@Component
@Slf4j
public class ProviderApiClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public ProviderApiClient(
            @Qualifier(RestClientConfiguration.PROVIDER_REST_TEMPLATE) RestTemplate restTemplate,
            @Value("${provider.base-url}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
    }

    /**
     * Fetches the live status of one route segment.
     *
     * @return the response body, or empty when the provider does not know the route (404)
     *         or the body cannot be read
     * @throws UpstreamUnavailableException on timeouts, connection failures and other error statuses
     */
    public Optional<JsonNode> fetchRouteStatus(String externalRouteId, String fromLocationId, String toLocationId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path(MonitorConstants.ROUTE_STATUS_PATH)
                .queryParam("fromStationId", fromLocationId)
                .queryParam("toStationId", toLocationId)
                .buildAndExpand(externalRouteId)
                .encode()
                .toUri();
        log.debug("Calling provider: GET {}", uri);

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    uri, HttpMethod.GET, new HttpEntity<>(routeHeaders()), JsonNode.class);
            return Optional.ofNullable(response.getBody());
        } catch (HttpClientErrorException.NotFound e) {
            log.warn("Route not found on provider (404), treating as unavailable: routeId={}", externalRouteId);
            return Optional.empty();
        } catch (RestClientResponseException e) {
            log.error("Provider error status for route {}: status={}", externalRouteId, e.getStatusCode().value());
            throw new UpstreamUnavailableException(
                    "Provider returned status " + e.getStatusCode().value() + " for route " + externalRouteId, e);
        } catch (ResourceAccessException e) {
            log.error("Provider unreachable for route {}: {}", externalRouteId, e.getMessage());
            throw new UpstreamUnavailableException("Provider unreachable for route " + externalRouteId, e);
        } catch (RestClientException e) {
            log.error("Unreadable provider response for route {}: {}", externalRouteId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Searches the connections between two locations on one day.
     *
     * @return the response body, or empty when it cannot be read
     * @throws UpstreamUnavailableException on timeouts, connection failures and error statuses
     */
    public Optional<JsonNode> searchRoutes(RouteSearchQuery query) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path(MonitorConstants.ROUTE_SEARCH_PATH)
                .queryParam("departureDate", query.getDepartureDate())
                .queryParam("fromLocationId", query.getFromLocationId())
                .queryParam("toLocationId", query.getToLocationId())
                .queryParam("fromLocationType", query.getFromLocationType())
                .queryParam("toLocationType", query.getToLocationType())
                .queryParam("tariffs", MonitorConstants.SEARCH_TARIFF)
                .build()
                .encode()
                .toUri();
        log.debug("Calling provider: GET {}", uri);

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    uri, HttpMethod.GET, new HttpEntity<>(routeHeaders()), JsonNode.class);
            return Optional.ofNullable(response.getBody());
        } catch (RestClientResponseException e) {
            log.error("Provider error status for route search {} -> {}: status={}",
                    query.getFromLocationId(), query.getToLocationId(), e.getStatusCode().value());
            throw new UpstreamUnavailableException(
                    "Provider returned status " + e.getStatusCode().value() + " for route search", e);
        } catch (ResourceAccessException e) {
            log.error("Provider unreachable for route search: {}", e.getMessage());
            throw new UpstreamUnavailableException("Provider unreachable for route search", e);
        } catch (RestClientException e) {
            log.error("Unreadable route search response: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Fetches the raw country -> city -> station tree.
     *
     * @throws UpstreamUnavailableException when the directory cannot be fetched
     * @throws LocationDirectoryException when the body cannot be read
     */
    public JsonNode fetchLocationTree() {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path(MonitorConstants.LOCATIONS_PATH)
                .build()
                .toUri();
        log.info("Calling provider: GET {}", uri);

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(MonitorConstants.HEADER_LANG, MonitorConstants.PROVIDER_LANG);

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    uri, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class);
            JsonNode body = response.getBody();
            if (body == null) {
                throw new LocationDirectoryException("Provider returned an empty location directory");
            }
            return body;
        } catch (RestClientResponseException e) {
            log.error("Provider error status for locations: status={}", e.getStatusCode().value());
            throw new UpstreamUnavailableException(
                    "Provider returned status " + e.getStatusCode().value() + " for locations", e);
        } catch (ResourceAccessException e) {
            log.error("Provider unreachable for locations: {}", e.getMessage());
            throw new UpstreamUnavailableException("Provider unreachable for locations", e);
        } catch (RestClientException e) {
            log.error("Unreadable location directory: {}", e.getMessage());
            throw new LocationDirectoryException("Unreadable location directory: " + e.getMessage());
        }
    }

    private HttpHeaders routeHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(MonitorConstants.HEADER_LANG, MonitorConstants.PROVIDER_LANG);
        headers.set(MonitorConstants.HEADER_CURRENCY, MonitorConstants.PROVIDER_CURRENCY);
        return headers;
    }
}
