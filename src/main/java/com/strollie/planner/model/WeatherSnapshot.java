package com.strollie.planner.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;

@Value
@Builder
public class WeatherSnapshot {

    private static final List<String> PRECIPITATION_MARKERS = List.of("rain", "snow", "дожд", "снег", "ливень");

    String description;
    String conditionKey;
    Double temperatureC;
    double precipitationMm;
    Double windKmph;
    String advice;

    public boolean isFoggy() {
        if (conditionKey == null) {
            return false;
        }
        String lowered = conditionKey.toLowerCase(Locale.ROOT);
        return lowered.contains("fog") || lowered.contains("туман");
    }

    public boolean isPrecipitation() {
        if (precipitationMm >= 0.2) {
            return true;
        }
        if (conditionKey == null) {
            return false;
        }
        String lowered = conditionKey.toLowerCase(Locale.ROOT);
        return PRECIPITATION_MARKERS.stream().anyMatch(lowered::contains);
    }
}
