package com.strollie.planner.model;

import com.strollie.planner.util.Deadline;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Everything the engine needs to know about one request once the start point and time are resolved.
 */
@Value
@Builder(toBuilder = true)
public class PlanningContext {
    GeoPoint start;
    LocalDateTime startTime;
    double hours;
    @Builder.Default
    Intensity intensity = Intensity.MEDIUM;
    @Builder.Default
    SocialMode socialMode = SocialMode.SOLO;
    WeatherSnapshot weather;
    BreakPreferences breakPreferences;
    double[] queryEmbedding;
    @Builder.Default
    List<String> warnings = List.of();
    @Builder.Default
    Deadline deadline = Deadline.none();

    public int timeLimitMinutes() {
        return (int) Math.round(hours * 60);
    }

    public boolean breaksEnabled() {
        return breakPreferences != null && breakPreferences.isEnabled();
    }
}
