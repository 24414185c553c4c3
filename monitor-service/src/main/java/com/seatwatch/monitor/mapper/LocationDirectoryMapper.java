package com.seatwatch.monitor.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.seatwatch.monitor.dto.Location;
import com.seatwatch.monitor.enums.LocationType;
import com.seatwatch.monitor.exception.LocationDirectoryException;
import com.seatwatch.monitor.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens the provider's country -> city -> station tree into directory entries.
 * Any malformed node rejects the whole tree.
 */
public final class LocationDirectoryMapper {

    private LocationDirectoryMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static List<Location> fromTree(JsonNode countries) {
        if (countries == null || !countries.isArray()) {
            throw new LocationDirectoryException("Location directory must be a list of countries");
        }

        List<Location> locations = new ArrayList<>();
        for (JsonNode country : countries) {
            if (!country.isObject()) {
                throw new LocationDirectoryException("Country entry is not an object");
            }
            for (JsonNode city : childArray(country, "cities", country.path("code").asText("?"))) {
                if (!city.isObject()) {
                    throw new LocationDirectoryException("City entry is not an object");
                }
                String cityName = requiredText(city, "name", "city");
                locations.add(toLocation(requiredId(city, "city"), cityName, LocationType.CITY));

                for (JsonNode station : childArray(city, "stations", cityName)) {
                    if (!station.isObject()) {
                        throw new LocationDirectoryException("Station entry is not an object in city " + cityName);
                    }
                    String stationName = station.hasNonNull("fullname")
                            ? requiredText(station, "fullname", "station")
                            : requiredText(station, "name", "station");
                    locations.add(toLocation(requiredId(station, "station"), stationName, LocationType.STATION));
                }
            }
        }
        return locations;
    }

    /**
     * Validates entries read back from the shared cache.
     */
    public static void validate(List<Location> locations) {
        if (locations == null) {
            throw new LocationDirectoryException("Cached directory has no entries list");
        }
        for (int i = 0; i < locations.size(); i++) {
            Location location = locations.get(i);
            if (location == null
                    || !org.springframework.util.StringUtils.hasText(location.getId())
                    || !org.springframework.util.StringUtils.hasText(location.getName())
                    || !LocationType.isValid(location.getType())
                    || location.getNormalizedName() == null) {
                throw new LocationDirectoryException("Cached directory entry " + i + " is invalid: " + location);
            }
        }
    }

    private static Location toLocation(String id, String name, LocationType type) {
        return Location.builder()
                .id(id)
                .name(name)
                .type(type.name())
                .normalizedName(StringUtils.normalizeLocationName(name))
                .build();
    }

    private static JsonNode childArray(JsonNode parent, String field, String owner) {
        JsonNode children = parent.get(field);
        if (children == null || children.isNull()) {
            return JsonNodeFactory.instance.arrayNode();
        }
        if (!children.isArray()) {
            throw new LocationDirectoryException("'" + field + "' of " + owner + " is not a list");
        }
        return children;
    }

    private static String requiredId(JsonNode node, String kind) {
        JsonNode id = node.get("id");
        if (id == null || id.isNull() || !(id.isNumber() || id.isTextual()) || id.asText().isBlank()) {
            throw new LocationDirectoryException("Missing id in " + kind + " entry: " + node);
        }
        return id.asText();
    }

    private static String requiredText(JsonNode node, String field, String kind) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new LocationDirectoryException("Missing " + field + " in " + kind + " entry: " + node);
        }
        return value.asText();
    }
}
