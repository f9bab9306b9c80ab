package com.strollie.planner.scoring;

import com.strollie.planner.model.SocialMode;
import com.strollie.planner.model.WeatherSnapshot;
import com.strollie.planner.schedule.TimePhase;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Context alignment tables: how well a category suits a time of day, a company and the weather.
 * All scores are fractions around 0.5-1.0.
 */
public final class ContextPreferences {

    private static final String DEFAULT = "default";

    public static final Set<String> INDOOR_CATEGORIES = Set.of(
            "museum", "gallery", "church", "religious_site", "cafe", "restaurant");

    public static final Set<String> OUTDOOR_CATEGORIES = Set.of(
            "park", "embankment", "viewpoint", "mosaic", "art_object", "decorative_art", "monument", "memorial");

    private static final Map<TimePhase, Map<String, Double>> TIME_PHASE_PREFS = new EnumMap<>(TimePhase.class);
    private static final Map<SocialMode, Map<String, Double>> SOCIAL_MODE_PREFS = new EnumMap<>(SocialMode.class);

    static {
        TIME_PHASE_PREFS.put(TimePhase.EARLY_MORNING, Map.of(
                "park", 1.0, "embankment", 0.95, "viewpoint", 0.92, "memorial", 0.82, DEFAULT, 0.75));
        TIME_PHASE_PREFS.put(TimePhase.MORNING, Map.of(
                "museum", 0.95, "art_object", 0.88, "architecture", 0.86, "memorial", 0.84, DEFAULT, 0.78));
        TIME_PHASE_PREFS.put(TimePhase.LUNCH, Map.of(
                "cafe", 1.0, "restaurant", 0.95, "market", 0.92, "embankment", 0.8, DEFAULT, 0.74));
        TIME_PHASE_PREFS.put(TimePhase.DAY, Map.of(
                "museum", 0.9, "art_object", 0.88, "memorial", 0.86, "park", 0.82, "architecture", 0.85,
                DEFAULT, 0.78));
        TIME_PHASE_PREFS.put(TimePhase.EVENING, Map.of(
                "art_object", 0.94, "architecture", 0.95, "viewpoint", 0.92, "embankment", 0.9, "memorial", 0.88,
                DEFAULT, 0.8));
        TIME_PHASE_PREFS.put(TimePhase.NIGHT, Map.of(
                "art_object", 0.9, "memorial", 0.88, "monument", 0.88, "embankment", 0.85, "park", 0.52,
                DEFAULT, 0.72));
        TIME_PHASE_PREFS.put(TimePhase.DEFAULT, Map.of(DEFAULT, 0.75));

        SOCIAL_MODE_PREFS.put(SocialMode.SOLO, Map.of(
                "museum", 0.95, "memorial", 0.9, "park", 0.82, "art_object", 0.8, DEFAULT, 0.76));
        SOCIAL_MODE_PREFS.put(SocialMode.FRIENDS, Map.of(
                "art_object", 0.96, "mosaic", 0.94, "decorative_art", 0.92, "market", 0.86, DEFAULT, 0.74));
        SOCIAL_MODE_PREFS.put(SocialMode.COUPLE, Map.of(
                "embankment", 0.95, "viewpoint", 0.94, "architecture", 0.88, "cafe", 0.9, DEFAULT, 0.78));
        SOCIAL_MODE_PREFS.put(SocialMode.FAMILY, Map.of(
                "museum", 0.9, "park", 0.9, "memorial", 0.85, DEFAULT, 0.8));
    }

    private ContextPreferences() {
    }

    /**
     * Category first, then any tag that names a listed category, then the phase default.
     */
    public static double timeAlignment(String category, Collection<String> tags, TimePhase phase) {
        Map<String, Double> prefs = TIME_PHASE_PREFS.getOrDefault(phase, TIME_PHASE_PREFS.get(TimePhase.DEFAULT));
        Double byCategory = prefs.get(category);
        if (byCategory != null) {
            return byCategory;
        }
        for (String tag : tags) {
            Double byTag = prefs.get(tag);
            if (byTag != null) {
                return byTag;
            }
        }
        return prefs.getOrDefault(DEFAULT, 0.75);
    }

    public static double weatherAlignment(String category, Collection<String> tags, WeatherSnapshot weather) {
        if (weather == null) {
            return 0.75;
        }
        boolean indoor = INDOOR_CATEGORIES.contains(category);
        double score;
        if (indoor) {
            score = 0.92;
        } else if (OUTDOOR_CATEGORIES.contains(category)) {
            score = 0.65;
        } else {
            score = 0.75;
        }

        if (weather.isFoggy()) {
            score += indoor ? 0.05 : -0.08;
        }
        if (weather.isPrecipitation()) {
            score += indoor ? 0.06 : -0.12;
        }
        Double temperature = weather.getTemperatureC();
        if (temperature != null && temperature <= 2.0) {
            score += indoor ? 0.04 : -0.06;
        }
        if (temperature != null && temperature >= 24.0) {
            score += indoor ? -0.04 : 0.05;
        }

        if (anyContains(tags, List.of("крыт"))) {
            score += 0.05;
        }
        if (anyContains(tags, List.of("outdoor", "street"))) {
            score -= 0.04;
        }
        return clamp(score, 0.45, 1.05);
    }

    public static double socialAlignment(String category, Collection<String> tags, SocialMode mode) {
        Map<String, Double> prefs = SOCIAL_MODE_PREFS.getOrDefault(mode, Map.of(DEFAULT, 0.75));
        double score = prefs.getOrDefault(category, prefs.getOrDefault(DEFAULT, 0.75));
        switch (mode) {
            case FRIENDS -> score += anyContains(tags, List.of("инст")) ? 0.05 : 0;
            case FAMILY -> score += anyContains(tags, List.of("дет")) ? 0.04 : 0;
            case COUPLE -> score += anyContains(tags, List.of("панорама", "вид")) ? 0.05 : 0;
            case SOLO -> score += anyContains(tags, List.of("тихий", "спокой")) ? 0.04 : 0;
            default -> {
            }
        }
        return clamp(score, 0.5, 1.0);
    }

    /**
     * Steps down with the distance from the start relative to the intensity search radius.
     */
    public static double accessibility(double distanceKm, double radiusKm) {
        if (distanceKm <= radiusKm * 0.35) {
            return 1.0;
        }
        if (distanceKm <= radiusKm * 0.65) {
            return 0.85;
        }
        if (distanceKm <= radiusKm * 0.9) {
            return 0.7;
        }
        if (distanceKm <= radiusKm * 1.15) {
            return 0.55;
        }
        return 0.4;
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(value, max));
    }

    private static boolean anyContains(Collection<String> tags, List<String> fragments) {
        for (String tag : tags) {
            for (String fragment : fragments) {
                if (tag.contains(fragment)) {
                    return true;
                }
            }
        }
        return false;
    }
}
