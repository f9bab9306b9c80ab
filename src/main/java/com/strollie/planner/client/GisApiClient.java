package com.strollie.planner.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strollie.planner.config.ApiKeysConfig;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.OpeningHoursWindow;
import com.strollie.planner.model.Poi;
import com.strollie.planner.service.CategoryCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 2GIS Catalog API: place search and geocoding. Items are converted to {@link Poi} here and nowhere else.
 * <p>
 * Every method returns a lazy {@link Mono} that signals an error when the API fails; an empty result is not a failure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GisApiClient {

    private static final String ITEMS_ENDPOINT = "/3.0/items";
    private static final String GEOCODE_ENDPOINT = "/3.0/items/geocode";
    static final int MAX_PAGE_SIZE = 10;
    private static final int NOT_FOUND_CODE = 404;

    private static final String EXTENDED_FIELDS = String.join(",",
            "items.point",
            "items.rubrics",
            "items.reviews",
            "items.schedule",
            "items.address",
            "items.description"
    );

    private static final String[] SCHEDULE_DAYS = {"Mon", "Tue", "Wed", "Thu", "Fri", "Sat", "Sun"};

    private final WebClient webClient;
    private final ApiKeysConfig config;
    private final CategoryCacheService categoryService;
    private final ObjectMapper mapper;

    /**
     * Places matching {@code query} around {@code center}, sorted by rating.
     *
     * @param defaultCategory category assigned when the rubrics do not name a known one
     */
    public Mono<List<Poi>> searchItems(String query, String defaultCategory, GeoPoint center,
                                       int radiusMeters, int pageSize) {
        String itemsUrl = UriComponentsBuilder.newInstance()
                .scheme("https")
                .host(extractHost(config.getGis().getBaseUrl()))
                .path(ITEMS_ENDPOINT)
                .queryParam("q", query)
                .queryParam("point", center.lon() + "," + center.lat())
                .queryParam("radius", radiusMeters)
                .queryParam("sort", "rating")
                .queryParam("sort_point", center.lon() + "," + center.lat())
                .queryParam("type", "branch")
                .queryParam("page_size", Math.min(pageSize, MAX_PAGE_SIZE))
                .queryParam("fields", EXTENDED_FIELDS)
                .queryParam("key", apiKey())
                .build()
                .toUriString();

        return Mono.defer(() -> {
            log.info(">>> SEARCH '{}': {}", query, sanitizeUrl(itemsUrl));
            return webClient.get()
                    .uri(itemsUrl)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class)
                    .defaultIfEmpty("");
        }).map(body -> {
            List<Poi> places = parseItemsResponse(body, defaultCategory);
            log.info(">>> SEARCH '{}' found {} places", query, places.size());
            return places;
        });
    }

    /**
     * Coordinates of an address within the configured city; empty when nothing matches.
     */
    public Mono<Optional<GeoPoint>> geocode(String address, String city) {
        String query = city == null || city.isBlank() ? address : address + ", " + city;
        String geocodeUrl = UriComponentsBuilder.newInstance()
                .scheme("https")
                .host(extractHost(config.getGis().getBaseUrl()))
                .path(GEOCODE_ENDPOINT)
                .queryParam("q", query)
                .queryParam("fields", "items.point")
                .queryParam("key", apiKey())
                .build()
                .toUriString();

        return Mono.defer(() -> {
            log.info(">>> GEOCODE: {}", sanitizeUrl(geocodeUrl));
            return webClient.get()
                    .uri(geocodeUrl)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class)
                    .defaultIfEmpty("");
        }).map(this::parseGeocodeResponse);
    }

    List<Poi> parseItemsResponse(String responseBody, String defaultCategory) {
        JsonNode items = resultItems(responseBody);
        List<Poi> places = new ArrayList<>();
        for (JsonNode item : items) {
            Poi place = mapToPoi(item, defaultCategory);
            if (place != null) {
                places.add(place);
            }
        }
        log.debug(">>> PARSE: {} of {} items usable", places.size(), items.size());
        return places;
    }

    Optional<GeoPoint> parseGeocodeResponse(String responseBody) {
        for (JsonNode item : resultItems(responseBody)) {
            JsonNode point = item.path("point");
            if (point.has("lat") && point.has("lon")) {
                return Optional.of(GeoPoint.of(point.path("lat").asDouble(), point.path("lon").asDouble()));
            }
        }
        return Optional.empty();
    }

    private JsonNode resultItems(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            throw new IllegalStateException("2GIS returned an empty body");
        }
        JsonNode root;
        try {
            root = mapper.readTree(responseBody);
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable 2GIS response: " + e.getMessage(), e);
        }

        JsonNode meta = root.path("meta");
        int code = meta.path("code").asInt(0);
        if (code == NOT_FOUND_CODE) {
            return mapper.createArrayNode();
        }
        if (code != 200) {
            JsonNode error = meta.path("error");
            log.error(">>> PARSE: API error - type={}, message={}",
                    error.path("type").asText(), error.path("message").asText());
            throw new IllegalStateException("2GIS error " + code + ": " + error.path("message").asText());
        }

        JsonNode items = root.path("result").path("items");
        if (items.isMissingNode() || !items.isArray()) {
            log.warn(">>> PARSE: Items missing or not array");
            return mapper.createArrayNode();
        }
        return items;
    }

    private Poi mapToPoi(JsonNode item, String defaultCategory) {
        String id = item.path("id").asText(null);
        String name = item.path("name").asText(null);
        JsonNode point = item.path("point");
        if (id == null || name == null || !point.has("lat") || !point.has("lon")) {
            return null;
        }

        Poi.PoiBuilder poi = Poi.builder()
                .id(id)
                .name(name)
                .location(GeoPoint.of(point.path("lat").asDouble(), point.path("lon").asDouble()))
                .address(item.path("address_name").asText(null))
                .description(item.path("description").asText(null));

        String category = null;
        for (JsonNode rubric : item.path("rubrics")) {
            String rubricName = rubric.path("name").asText(null);
            if (rubricName == null) {
                continue;
            }
            poi.tag(rubricName.toLowerCase(Locale.ROOT));
            if (category == null) {
                category = categoryService.categoryForRubric(rubricName).orElse(null);
            }
        }
        poi.category(category != null ? category : defaultCategory);

        JsonNode reviews = item.path("reviews");
        String rating = reviews.path("general_rating").asText(reviews.path("rating").asText(""));
        if (!rating.isEmpty()) {
            try {
                poi.rating(Double.parseDouble(rating));
            } catch (NumberFormatException e) {
                log.debug("Ignoring rating '{}' of {}", rating, id);
            }
        }

        JsonNode schedule = item.path("schedule");
        if (!schedule.isMissingNode()) {
            poi.weeklyWindows(parseSchedule(schedule));
        }
        return poi.build();
    }

    /**
     * Working hours per weekday. Days without hours stay closed; {@code is_24x7} means open around the clock.
     */
    static List<OpeningHoursWindow> parseSchedule(JsonNode schedule) {
        List<OpeningHoursWindow> windows = new ArrayList<>();
        if (schedule.path("is_24x7").asBoolean(false)) {
            windows.add(OpeningHoursWindow.everyDay(LocalTime.MIDNIGHT, LocalTime.MIDNIGHT));
            return windows;
        }
        for (int i = 0; i < SCHEDULE_DAYS.length; i++) {
            DayOfWeek day = DayOfWeek.of(i + 1);
            for (JsonNode hours : schedule.path(SCHEDULE_DAYS[i]).path("working_hours")) {
                LocalTime from = parseTime(hours.path("from").asText(""));
                LocalTime to = parseTime(hours.path("to").asText(""));
                if (from != null && to != null) {
                    windows.add(OpeningHoursWindow.of(EnumSet.of(day), from, to));
                }
            }
        }
        return windows;
    }

    private static LocalTime parseTime(String value) {
        if (value.isEmpty()) {
            return null;
        }
        if ("24:00".equals(value)) {
            return LocalTime.MIDNIGHT;
        }
        try {
            return LocalTime.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private String extractHost(String url) {
        if (url == null) return "catalog.api.2gis.com";
        return url.replace("https://", "").replace("http://", "").split("/")[0];
    }

    static String sanitizeUrl(String url) {
        return url == null ? null : url.replaceAll("(key=)[^&]+", "$1***");
    }

    private String apiKey() {
        return Optional.ofNullable(config.getGis())
                .map(ApiKeysConfig.Gis::getKey)
                .map(String::trim)
                .orElse("");
    }

}
