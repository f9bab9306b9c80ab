package com.strollie.planner.scoring;

import com.strollie.planner.geo.GeoMath;
import com.strollie.planner.model.CandidateScore;
import com.strollie.planner.model.Intensity;
import com.strollie.planner.model.PlanningContext;
import com.strollie.planner.model.Poi;
import com.strollie.planner.schedule.TimePhase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ranks candidate places for one request.
 * <p>
 * Every candidate gets an embedding match (0-100), a contextual fit (0-100) and a popularity bonus (0-30),
 * combined into a base score. Walking the candidates best-first, repeats of recent categories are then
 * penalised so that the top of the list stays varied.
 */
@Slf4j
@Component
public class CandidateScorer {

    static final double NEUTRAL_EMBEDDING = 55.0;
    static final double NEUTRAL_POPULARITY = 18.0;
    static final int RECENT_WINDOW = 3;

    public List<CandidateScore> score(List<Poi> pois, PlanningContext context) {
        if (pois == null || pois.isEmpty()) {
            return List.of();
        }
        Intensity intensity = context.getIntensity();
        double slotMinutes = Math.max(30.0,
                intensity.effectiveVisitMinutes(null) + intensity.getTransitionPaddingMinutes());

        List<CandidateScore> enriched = new ArrayList<>(pois.size());
        for (int index = 0; index < pois.size(); index++) {
            Poi poi = pois.get(index);
            LocalDateTime arrival = context.getStartTime().plusSeconds(Math.round(index * slotMinutes * 60));
            double distance = GeoMath.haversineKm(context.getStart(), poi.getLocation());
            double embedding = embeddingComponent(context.getQueryEmbedding(), poi.getEmbedding());
            double contextual = contextualComponent(poi, arrival, distance, context);
            double popularity = popularityComponent(poi.getRating());
            double base = embedding * 0.4 + contextual * 0.3 + popularity * 0.15;

            enriched.add(CandidateScore.builder()
                    .poi(poi)
                    .embeddingComponent(embedding)
                    .contextualComponent(contextual)
                    .popularityComponent(popularity)
                    .baseScore(base)
                    .distanceKm(distance)
                    .projectedArrival(arrival)
                    .build());
        }

        enriched.sort(Comparator.comparingDouble(CandidateScore::getBaseScore)
                .thenComparingDouble(CandidateScore::getEmbeddingComponent)
                .reversed());

        LinkedList<String> recent = new LinkedList<>();
        List<CandidateScore> scored = new ArrayList<>(enriched.size());
        for (CandidateScore candidate : enriched) {
            String category = candidate.category();
            double penalty = diversityPenalty(category, recent);
            if (penalty > 0) {
                log.debug("Diversity penalty {} for '{}' (recent: {})", penalty, category, recent);
            }
            double finalScore = Math.max(0.0, candidate.getBaseScore() - penalty * 0.15);
            scored.add(candidate.toBuilder().diversityPenalty(penalty).finalScore(finalScore).build());

            recent.addLast(category);
            if (recent.size() > RECENT_WINDOW) {
                recent.removeFirst();
            }
        }

        scored.sort(Comparator.comparingDouble(CandidateScore::getFinalScore)
                .thenComparingDouble(CandidateScore::getEmbeddingComponent)
                .reversed());
        return scored;
    }

    static double embeddingComponent(double[] query, double[] poi) {
        if (query == null || poi == null || query.length == 0 || query.length != poi.length) {
            return NEUTRAL_EMBEDDING;
        }
        double similarity = cosineSimilarity(query, poi);
        if (Double.isNaN(similarity)) {
            return NEUTRAL_EMBEDDING;
        }
        return ContextPreferences.clamp(similarity * 100.0, 0.0, 100.0);
    }

    static double contextualComponent(Poi poi, LocalDateTime arrival, double distanceKm, PlanningContext context) {
        String category = normalize(poi.getCategory());
        if (category.isEmpty()) {
            category = "unknown";
        }
        Set<String> tags = poi.getTags().stream()
                .filter(t -> t != null && !t.isBlank())
                .map(CandidateScorer::normalize)
                .collect(Collectors.toSet());

        double time = ContextPreferences.timeAlignment(category, tags, TimePhase.of(arrival.toLocalTime()));
        double weather = ContextPreferences.weatherAlignment(category, tags, context.getWeather());
        double social = ContextPreferences.socialAlignment(category, tags, context.getSocialMode());
        double access = ContextPreferences.accessibility(distanceKm, context.getIntensity().getSearchRadiusKm());

        double combined = 0.4 * bounded(time) + 0.25 * bounded(weather) + 0.2 * bounded(social) + 0.15 * bounded(access);
        return ContextPreferences.clamp(combined * 100.0, 0.0, 100.0);
    }

    static double popularityComponent(Double rating) {
        if (rating == null || rating <= 0) {
            return NEUTRAL_POPULARITY;
        }
        return ContextPreferences.clamp(rating / 5.0, 0.0, 1.0) * 30.0;
    }

    static double diversityPenalty(String category, List<String> recent) {
        if (category == null || category.isEmpty() || recent.isEmpty()) {
            return 0.0;
        }
        if (category.equals(recent.get(recent.size() - 1))) {
            return 30.0;
        }
        return recent.contains(category) ? 15.0 : 0.0;
    }

    static double cosineSimilarity(double[] a, double[] b) {
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return Double.NaN;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static double bounded(double value) {
        return ContextPreferences.clamp(value, 0.0, 1.1);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
