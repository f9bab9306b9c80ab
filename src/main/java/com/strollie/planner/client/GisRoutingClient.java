package com.strollie.planner.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strollie.planner.config.ApiKeysConfig;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Leg;
import com.strollie.planner.model.Maneuver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pedestrian routing through the 2GIS Routing API.
 * <p>
 * The returned {@link Mono} is lazy and signals an error on any failure; retries and fallbacks belong to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GisRoutingClient {

    private static final String ROUTING_ENDPOINT = "/routing/7.0.0/global";
    private static final String DEFAULT_BASE_URL = "https://routing.api.2gis.com";

    private final WebClient webClient;
    private final ApiKeysConfig config;
    private final ObjectMapper mapper;

    public Mono<Leg> route(GeoPoint from, GeoPoint to) {
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl())
                .path(ROUTING_ENDPOINT)
                .queryParam("key", config.routingKey())
                .queryParam("locale", "ru")
                .build()
                .toUriString();

        Map<String, Object> body = Map.of(
                "points", List.of(
                        Map.of("type", "stop", "lat", from.lat(), "lon", from.lon()),
                        Map.of("type", "stop", "lat", to.lat(), "lon", to.lon())
                ),
                "transport", "pedestrian",
                "route_mode", "fastest",
                "output", "detailed"
        );

        return Mono.defer(() -> {
            log.debug(">>> ROUTE REQUEST: {} -> {}", from, to);
            return webClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class);
        }).map(raw -> parse(raw, from, to));
    }

    Leg parse(String raw, GeoPoint from, GeoPoint to) {
        JsonNode root;
        try {
            root = mapper.readTree(raw);
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable routing response: " + e.getMessage(), e);
        }

        JsonNode result = root.path("result");
        JsonNode route = result.isArray() ? result.path(0) : result;
        if (route.isMissingNode() || route.isEmpty()) {
            String status = root.path("status").asText("");
            String message = root.path("message").asText("");
            throw new IllegalStateException("Routing returned no route (" + status + " " + message + ")");
        }

        double meters = route.path("total_distance").asDouble(route.path("distance").asDouble(-1));
        double seconds = route.path("total_duration").asDouble(route.path("duration").asDouble(-1));
        if (meters < 0 || seconds < 0) {
            throw new IllegalStateException("Routing response has no distance or duration");
        }

        List<GeoPoint> geometry = new ArrayList<>();
        List<Maneuver> maneuvers = new ArrayList<>();
        for (JsonNode maneuver : route.path("maneuvers")) {
            JsonNode path = maneuver.path("outcoming_path");
            for (JsonNode piece : path.path("geometry")) {
                geometry.addAll(parseLineString(piece.path("selection").asText("")));
            }
            String instruction = maneuver.path("comment").asText(
                    maneuver.path("instruction").path("text").asText(""));
            if (!instruction.isBlank()) {
                maneuvers.add(Maneuver.builder()
                        .instruction(instruction)
                        .streetName(path.path("names").path(0).asText(maneuver.path("street_name").asText(null)))
                        .distanceMeters(path.path("distance").asDouble(path.path("length").asDouble(0)))
                        .durationSeconds(path.path("duration").asDouble(0))
                        .build());
            }
        }
        if (geometry.size() < 2) {
            geometry = List.of(from, to);
        }

        return Leg.builder()
                .from(from)
                .to(to)
                .distanceKm(meters / 1000.0)
                .durationMinutes(seconds / 60.0)
                .geometry(geometry)
                .maneuvers(maneuvers)
                .source(Leg.Source.ROUTED)
                .build();
    }

    /**
     * Reads {@code LINESTRING(lon lat, lon lat, ...)}. Anything else yields no points.
     */
    static List<GeoPoint> parseLineString(String wkt) {
        List<GeoPoint> points = new ArrayList<>();
        int open = wkt.indexOf('(');
        int close = wkt.lastIndexOf(')');
        if (!wkt.trim().toUpperCase(Locale.ROOT).startsWith("LINESTRING") || open < 0 || close <= open) {
            return points;
        }
        for (String pair : wkt.substring(open + 1, close).split(",")) {
            String[] parts = pair.trim().split("\\s+");
            if (parts.length < 2) {
                continue;
            }
            try {
                double lon = Double.parseDouble(parts[0]);
                double lat = Double.parseDouble(parts[1]);
                points.add(GeoPoint.of(lat, lon));
            } catch (NumberFormatException e) {
                log.debug("Skipping malformed coordinate '{}'", pair);
            }
        }
        return points;
    }

    private String baseUrl() {
        if (config.getRouting() == null || config.getRouting().getBaseUrl() == null
                || config.getRouting().getBaseUrl().isBlank()) {
            return DEFAULT_BASE_URL;
        }
        return config.getRouting().getBaseUrl();
    }
}
