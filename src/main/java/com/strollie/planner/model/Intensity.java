package com.strollie.planner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Locale;

/**
 * Pacing profile of a walk. Controls visit durations, padding between stops,
 * the candidate search radius and how often a break is suggested.
 */
@Getter
public enum Intensity {

    RELAXED(1.3, 55, 40, 90, 8, 20, 1.5, 5.0, 90),
    MEDIUM(2.0, 42, 30, 70, 6, 15, 2.0, 7.5, 90),
    INTENSE(2.8, 30, 20, 55, 4, 10, 2.5, 10.0, 100);

    private final double targetPerHour;
    private final int defaultVisitMinutes;
    private final int minVisitMinutes;
    private final int maxVisitMinutes;
    private final int transitionPaddingMinutes;
    private final int safetyBufferMinutes;
    private final double candidateMultiplier;
    private final double searchRadiusKm;
    private final int breakIntervalMinutes;

    Intensity(double targetPerHour, int defaultVisitMinutes, int minVisitMinutes, int maxVisitMinutes,
              int transitionPaddingMinutes, int safetyBufferMinutes, double candidateMultiplier,
              double searchRadiusKm, int breakIntervalMinutes) {
        this.targetPerHour = targetPerHour;
        this.defaultVisitMinutes = defaultVisitMinutes;
        this.minVisitMinutes = minVisitMinutes;
        this.maxVisitMinutes = maxVisitMinutes;
        this.transitionPaddingMinutes = transitionPaddingMinutes;
        this.safetyBufferMinutes = safetyBufferMinutes;
        this.candidateMultiplier = candidateMultiplier;
        this.searchRadiusKm = searchRadiusKm;
        this.breakIntervalMinutes = breakIntervalMinutes;
    }

    /**
     * Visit length bounded by this profile. A missing or non-positive base falls back to the default.
     */
    public int effectiveVisitMinutes(Integer baseMinutes) {
        double baseline = baseMinutes == null || baseMinutes <= 0 ? defaultVisitMinutes : baseMinutes;
        double bounded = Math.max(minVisitMinutes, Math.min(baseline, maxVisitMinutes));
        return (int) Math.round(bounded);
    }

    public int targetVisitCount(double hours) {
        return Math.max(1, (int) Math.round(hours * targetPerHour));
    }

    @JsonCreator
    public static Intensity fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "relaxed", "low" -> RELAXED;
            case "intense", "high" -> INTENSE;
            default -> MEDIUM;
        };
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
