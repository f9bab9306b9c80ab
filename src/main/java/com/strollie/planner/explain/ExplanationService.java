package com.strollie.planner.explain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strollie.planner.client.LlmApiClient;
import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.model.Intensity;
import com.strollie.planner.model.Itinerary;
import com.strollie.planner.model.PlannedStop;
import com.strollie.planner.model.Poi;
import com.strollie.planner.model.SocialMode;
import com.strollie.planner.schedule.TimePhase;
import com.strollie.planner.util.Deadline;
import com.strollie.planner.util.RetryingCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Human-readable texts for an itinerary. Uses the LLM when it is configured and answers in time,
 * otherwise builds the texts from templates. Stops the model skipped get a templated reason.
 */
@Slf4j
@Service
public class ExplanationService {

    static final String EMPTY_SUMMARY = "Не удалось сформировать описание маршрута.";
    static final String DEFAULT_DESCRIPTION = "Уникальная точка маршрута.";

    private static final Map<String, String> CATEGORY_REASONS = Map.of(
            "museum", "музей с сильной экспозицией",
            "memorial", "место памяти и истории",
            "monument", "знаковая городская скульптура",
            "art_object", "яркий арт-объект",
            "mosaic", "редкая мозаика",
            "decorative_art", "необычная инсталляция",
            "park", "спокойный городской парк",
            "embankment", "видовая набережная",
            "viewpoint", "место с красивым видом",
            "architecture", "выразительный архитектурный объект"
    );

    private static final Map<SocialMode, String> SOCIAL_REASONS = Map.of(
            SocialMode.SOLO, "подходит для спокойного созерцания",
            SocialMode.FRIENDS, "можно разделить эмоции с друзьями",
            SocialMode.COUPLE, "создаёт тёплую атмосферу для двоих",
            SocialMode.FAMILY, "комфортно всей семье"
    );

    private static final Map<TimePhase, String> PHASE_REASONS = Map.of(
            TimePhase.EARLY_MORNING, "мягкий старт утра",
            TimePhase.MORNING, "идеально для утреннего визита",
            TimePhase.LUNCH, "как раз к обеденной паузе",
            TimePhase.DAY, "центр дневной программы",
            TimePhase.EVENING, "уютно завершает закатную часть",
            TimePhase.NIGHT, "безопасное место на вечер"
    );

    private final LlmApiClient llmApiClient;
    private final PlannerProperties properties;
    private final ExplanationParser parser;

    public ExplanationService(LlmApiClient llmApiClient, PlannerProperties properties, ObjectMapper objectMapper) {
        this.llmApiClient = llmApiClient;
        this.properties = properties;
        this.parser = new ExplanationParser(objectMapper);
    }

    public RouteExplanation explain(Itinerary itinerary, Map<String, Poi> poisById, SocialMode socialMode,
                                    String profileText, Deadline deadline) {
        RouteExplanation fallback = fallback(itinerary, poisById, socialMode);
        if (itinerary.getStops().isEmpty() || !llmApiClient.isConfigured() || deadline.isExpired()) {
            return fallback;
        }

        Duration timeout = deadline.cap(properties.getCallTimeout());
        Optional<RouteExplanation> generated;
        try {
            generated = RetryingCall.withRetry("llm-explain",
                            llmApiClient.explain(itinerary.getStops(), profileText),
                            properties.getRetry().toPolicy(), timeout)
                    .map(parser::parse)
                    .onErrorResume(e -> {
                        log.warn("LLM explanation unavailable, using templates: {}", e.toString());
                        return Mono.just(Optional.<RouteExplanation>empty());
                    })
                    .blockOptional()
                    .flatMap(result -> result);
        } catch (RuntimeException e) {
            log.warn("LLM explanation failed, using templates: {}", e.getMessage());
            generated = Optional.empty();
        }
        return generated.map(explanation -> merge(explanation, fallback)).orElse(fallback);
    }

    /**
     * Model output completed with templated entries for the stops it left out.
     */
    static RouteExplanation merge(RouteExplanation generated, RouteExplanation fallback) {
        Map<Integer, RouteExplanation.StopExplanation> byOrder = new HashMap<>();
        if (generated.getStops() != null) {
            for (RouteExplanation.StopExplanation stop : generated.getStops()) {
                if (stop.getWhy() != null && !stop.getWhy().isBlank()) {
                    byOrder.putIfAbsent(stop.getOrder(), stop);
                }
            }
        }
        List<RouteExplanation.StopExplanation> stops = new ArrayList<>();
        for (RouteExplanation.StopExplanation templated : fallback.getStops()) {
            stops.add(byOrder.getOrDefault(templated.getOrder(), templated));
        }
        return RouteExplanation.builder()
                .summary(generated.getSummary())
                .stops(stops)
                .notes(generated.getNotes() != null ? generated.getNotes() : new ArrayList<>())
                .build();
    }

    RouteExplanation fallback(Itinerary itinerary, Map<String, Poi> poisById, SocialMode socialMode) {
        List<String> names = itinerary.getStops().stream()
                .filter(stop -> !stop.isBreakStop())
                .map(PlannedStop::getName)
                .toList();
        List<RouteExplanation.StopExplanation> stops = itinerary.getStops().stream()
                .map(stop -> RouteExplanation.StopExplanation.builder()
                        .order(stop.getOrder())
                        .why(stop.isBreakStop() ? breakReason(stop) : stopReason(stop, poisById.get(stop.getPoiId()), socialMode))
                        .tip(stop.getAvailabilityNote())
                        .build())
                .collect(Collectors.toCollection(ArrayList::new));
        return RouteExplanation.builder()
                .summary(summary(names))
                .stops(stops)
                .notes(new ArrayList<>(itinerary.getWarnings()))
                .build();
    }

    static String summary(List<String> names) {
        if (names.isEmpty()) {
            return EMPTY_SUMMARY;
        }
        return "Предлагаем прогулку по Нижнему Новгороду через точки: " + String.join(", ", names) + ".";
    }

    static String breakReason(PlannedStop stop) {
        return "Сделайте паузу в " + stop.getName() + ": уютное место неподалёку для кофе и отдыха.";
    }

    static String stopReason(PlannedStop stop, Poi poi, SocialMode socialMode) {
        List<String> highlights = new ArrayList<>();
        if (stop.getArrivalTime() != null) {
            String phase = PHASE_REASONS.get(TimePhase.of(stop.getArrivalTime().toLocalTime()));
            if (phase != null) {
                highlights.add(phase);
            }
        }
        String category = stop.getCategory() != null ? stop.getCategory().toLowerCase(Locale.ROOT) : "";
        if (CATEGORY_REASONS.containsKey(category)) {
            highlights.add(CATEGORY_REASONS.get(category));
        }
        if (socialMode != null) {
            highlights.add(SOCIAL_REASONS.get(socialMode));
        }
        String reason = highlights.stream().limit(2).collect(Collectors.joining(". "));
        String description = poi != null && poi.getDescription() != null && !poi.getDescription().isBlank()
                ? poi.getDescription().trim()
                : DEFAULT_DESCRIPTION;
        return stop.getName() + ": " + reason + ". " + description;
    }

    public static String profileText(String interests, List<String> categories, SocialMode socialMode,
                                     Intensity intensity, double hours) {
        List<String> parts = new ArrayList<>();
        if (interests != null && !interests.isBlank()) {
            parts.add("Интересы: " + interests.trim());
        }
        if (categories != null && !categories.isEmpty()) {
            parts.add("Категории: " + String.join(", ", categories));
        }
        parts.add("Формат прогулки: " + (socialMode != null ? socialMode.key() : SocialMode.SOLO.key()));
        parts.add("Интенсивность: " + (intensity != null ? intensity.key() : Intensity.MEDIUM.key()));
        parts.add(String.format(Locale.US, "Длительность: %.1f часа", hours));
        return String.join(". ", parts);
    }
}
