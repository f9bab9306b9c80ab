package com.strollie.planner.service;

import com.strollie.planner.catalog.PoiCatalog;
import com.strollie.planner.client.EmbeddingClient;
import com.strollie.planner.client.WeatherClient;
import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.explain.ExplanationService;
import com.strollie.planner.explain.RouteExplanation;
import com.strollie.planner.model.BreakPreferences;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Intensity;
import com.strollie.planner.model.Itinerary;
import com.strollie.planner.model.Leg;
import com.strollie.planner.model.Maneuver;
import com.strollie.planner.model.PlannedStop;
import com.strollie.planner.model.PlanningContext;
import com.strollie.planner.model.Poi;
import com.strollie.planner.model.SocialMode;
import com.strollie.planner.model.WeatherSnapshot;
import com.strollie.planner.model.dto.LegDto;
import com.strollie.planner.model.dto.RouteRequest;
import com.strollie.planner.model.dto.RouteResponse;
import com.strollie.planner.model.dto.StopDto;
import com.strollie.planner.schedule.OpeningHoursResolver;
import com.strollie.planner.schedule.StartTimeResolver;
import com.strollie.planner.util.Deadline;
import com.strollie.planner.util.DirectionsLinkBuilder;
import com.strollie.planner.util.RetryingCall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Request-level pipeline: start point, start time, external data, itinerary, explanation, response.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoutePlanningService {

    private final StartLocationResolver startLocationResolver;
    private final StartTimeResolver startTimeResolver;
    private final PoiCatalog poiCatalog;
    private final WeatherClient weatherClient;
    private final EmbeddingClient embeddingClient;
    private final ItineraryAssembler assembler;
    private final ExplanationService explanationService;
    private final CategoryCacheService categoryService;
    private final PlannerProperties properties;
    private final Clock clock;

    /** Catalog places with their embeddings attached, plus the profile vector. */
    record EmbeddedCatalog(List<Poi> pois, double[] queryEmbedding) {
    }

    public RouteResponse generateRoute(RouteRequest request) {
        Deadline deadline = Deadline.after(properties.getRequestTimeout(), clock);
        Intensity intensity = request.getIntensity() != null ? request.getIntensity() : Intensity.MEDIUM;
        SocialMode socialMode = request.getSocialMode() != null ? request.getSocialMode() : SocialMode.SOLO;

        log.info("=== ROUTE GENERATION START ===");
        log.info("Categories: {}, Duration: {}h, Intensity: {}, Mode: {}",
                request.getCategories(), request.getHours(), intensity.key(), socialMode.key());

        log.info("Step 1/6: Resolving start location...");
        GeoPoint start = startLocationResolver.resolve(request.getLat(), request.getLon(),
                request.getAddress(), deadline);
        log.info("Start point: {}, {}", start.lat(), start.lon());

        log.info("Step 2/6: Resolving start time...");
        StartTimeResolver.StartTime startTime = startTimeResolver.resolve(request.getStartTime(),
                request.getTimezone(), request.getHours());

        log.info("Step 3/6: Fetching places, weather and embeddings...");
        String profileText = ExplanationService.profileText(request.getInterests(),
                categoryNames(request.getCategories()), socialMode, intensity, request.getHours());
        Tuple2<EmbeddedCatalog, Optional<WeatherSnapshot>> external = Mono.zip(
                        poiCatalog.query(request.getCategories(), start, deadline)
                                .flatMap(pois -> embed(pois, profileText, deadline)),
                        weatherClient.snapshot(start, intensity).map(Optional::of).defaultIfEmpty(Optional.empty()))
                .block();
        EmbeddedCatalog catalog = external.getT1();
        WeatherSnapshot weather = external.getT2().orElse(null);
        log.info("Catalog: {} places, embeddings: {}, weather: {}", catalog.pois().size(),
                catalog.queryEmbedding() != null ? "yes" : "no", weather != null ? weather.getDescription() : "n/a");

        log.info("Step 4/6: Assembling itinerary...");
        PlanningContext context = PlanningContext.builder()
                .start(start)
                .startTime(startTime.start())
                .hours(request.getHours())
                .intensity(intensity)
                .socialMode(socialMode)
                .weather(weather)
                .breakPreferences(breakPreferences(request.getBreaks()))
                .queryEmbedding(catalog.queryEmbedding())
                .warnings(startTime.warnings())
                .deadline(deadline)
                .build();
        Itinerary itinerary = assembler.assemble(catalog.pois(), context);

        log.info("Step 5/6: Generating explanation...");
        Map<String, Poi> poisById = catalog.pois().stream()
                .collect(Collectors.toMap(Poi::getId, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        RouteExplanation explanation = explanationService.explain(itinerary, poisById, socialMode,
                profileText, deadline);

        log.info("Step 6/6: Building response...");
        RouteResponse response = toResponse(itinerary, explanation, start, startTime, weather);
        log.info("=== ROUTE GENERATION COMPLETE: {} stops, {} km, {} min ===",
                response.getStops().size(), String.format("%.2f", response.getTotalDistanceKm()),
                response.getTotalMinutes());
        return response;
    }

    /**
     * Attaches embeddings to the places. Any failure leaves the catalog as is, so that relevance falls back to neutral.
     */
    Mono<EmbeddedCatalog> embed(List<Poi> pois, String profileText, Deadline deadline) {
        if (pois.isEmpty() || !embeddingClient.isConfigured() || deadline.isExpired()) {
            return Mono.just(new EmbeddedCatalog(pois, null));
        }
        List<String> texts = new ArrayList<>(pois.size() + 1);
        texts.add(profileText);
        pois.forEach(poi -> texts.add(embeddingText(poi)));

        return RetryingCall.withRetry("embeddings", embeddingClient.embed(texts),
                        properties.getRetry().toPolicy(), deadline.cap(properties.getCallTimeout()))
                .map(vectors -> {
                    List<Poi> embedded = new ArrayList<>(pois.size());
                    for (int i = 0; i < pois.size(); i++) {
                        embedded.add(pois.get(i).toBuilder().embedding(vectors.get(i + 1)).build());
                    }
                    return new EmbeddedCatalog(embedded, vectors.get(0));
                })
                .onErrorResume(e -> {
                    log.warn("Embeddings unavailable, relevance will be neutral: {}", e.toString());
                    return Mono.just(new EmbeddedCatalog(pois, null));
                });
    }

    static String embeddingText(Poi poi) {
        StringBuilder text = new StringBuilder(poi.getName());
        if (poi.getCategory() != null) {
            text.append(". ").append(poi.getCategory());
        }
        if (!poi.getTags().isEmpty()) {
            text.append(". ").append(String.join(", ", poi.getTags()));
        }
        if (poi.getDescription() != null && !poi.getDescription().isBlank()) {
            text.append(". ").append(poi.getDescription().trim());
        }
        return text.toString();
    }

    BreakPreferences breakPreferences(RouteRequest.Breaks breaks) {
        PlannerProperties.Breaks defaults = properties.getBreaks();
        boolean enabled = breaks != null && breaks.getEnabled() != null ? breaks.getEnabled() : defaults.isEnabledByDefault();
        int interval = breaks != null && breaks.getIntervalMinutes() != null
                ? breaks.getIntervalMinutes() : defaults.getDefaultIntervalMinutes();
        double radius = breaks != null && breaks.getSearchRadiusKm() != null
                ? breaks.getSearchRadiusKm() : defaults.getSearchRadiusKm();
        return BreakPreferences.builder()
                .enabled(enabled)
                .intervalMinutes(interval)
                .searchRadiusKm(radius)
                .build();
    }

    private List<String> categoryNames(List<String> categoryIds) {
        if (categoryIds == null) {
            return List.of();
        }
        return categoryIds.stream()
                .map(id -> Optional.ofNullable(categoryService.getCategoryNameById(id)).orElse(id))
                .toList();
    }

    RouteResponse toResponse(Itinerary itinerary, RouteExplanation explanation, GeoPoint start,
                             StartTimeResolver.StartTime startTime, WeatherSnapshot weather) {
        Map<Integer, RouteExplanation.StopExplanation> texts = explanation.getStops().stream()
                .collect(Collectors.toMap(RouteExplanation.StopExplanation::getOrder, Function.identity(), (a, b) -> a));

        List<StopDto> stops = itinerary.getStops().stream()
                .map(stop -> toStopDto(stop, texts.get(stop.getOrder())))
                .toList();

        List<LegDto> legs = new ArrayList<>();
        if (itinerary.getApproachLeg() != null) {
            legs.add(toLegDto(itinerary.getApproachLeg(), 0, 1));
        }
        for (int i = 0; i < itinerary.getLegs().size(); i++) {
            legs.add(toLegDto(itinerary.getLegs().get(i), i + 1, i + 2));
        }

        List<String> notes = new ArrayList<>(explanation.getNotes());
        if (weather != null && weather.getAdvice() != null && !notes.contains(weather.getAdvice())) {
            notes.add(weather.getAdvice());
        }

        return RouteResponse.builder()
                .summary(explanation.getSummary())
                .startTime(itinerary.getStartTime().toString())
                .timezone(startTime.zone().getId())
                .stops(stops)
                .legs(legs)
                .totalDistanceKm(Math.round(itinerary.getTotalDistanceKm() * 100) / 100.0)
                .totalMinutes(itinerary.getTotalMinutes())
                .warnings(itinerary.getWarnings())
                .notes(notes)
                .weather(weather == null ? null : RouteResponse.WeatherDto.builder()
                        .description(weather.getDescription())
                        .temperatureC(weather.getTemperatureC())
                        .advice(weather.getAdvice())
                        .build())
                .directionsUrl(DirectionsLinkBuilder.build2GisLink(start, itinerary.getStops()))
                .build();
    }

    private static StopDto toStopDto(PlannedStop stop, RouteExplanation.StopExplanation text) {
        return StopDto.builder()
                .order(stop.getOrder())
                .id(stop.getPoiId())
                .name(stop.getName())
                .category(stop.getCategory())
                .lat(stop.getLocation().lat())
                .lon(stop.getLocation().lon())
                .arrivalTime(OpeningHoursResolver.HH_MM.format(stop.getArrivalTime()))
                .leaveTime(OpeningHoursResolver.HH_MM.format(stop.getLeaveTime()))
                .visitMinutes(stop.getVisitMinutes())
                .open(stop.isOpen())
                .openingHours(stop.getOpeningHoursLabel())
                .note(stop.getAvailabilityNote())
                .coffeeBreak(stop.isBreakStop())
                .why(text != null ? text.getWhy() : null)
                .tip(text != null && text.getTip() != null && !text.getTip().isBlank() ? text.getTip() : null)
                .distanceFromPreviousKm(Math.round(stop.getDistanceFromPreviousKm() * 100) / 100.0)
                .build();
    }

    private static LegDto toLegDto(Leg leg, int fromOrder, int toOrder) {
        return LegDto.builder()
                .fromOrder(fromOrder)
                .toOrder(toOrder)
                .distanceKm(Math.round(leg.getDistanceKm() * 100) / 100.0)
                .durationMinutes(Math.round(leg.getDurationMinutes()))
                .estimated(leg.getSource() == Leg.Source.ESTIMATED)
                .geometry(leg.getGeometry().stream().map(p -> new double[]{p.lon(), p.lat()}).toList())
                .instructions(leg.getManeuvers().stream()
                        .map(Maneuver::getInstruction)
                        .filter(s -> s != null && !s.isBlank())
                        .toList())
                .build();
    }
}
