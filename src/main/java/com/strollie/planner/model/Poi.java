package com.strollie.planner.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalTime;
import java.util.List;
import java.util.Set;

/**
 * Point of interest as supplied by the catalog. Read-only for the duration of a request.
 */
@Value
@Builder(toBuilder = true)
public class Poi {
    String id;
    String name;
    GeoPoint location;
    String category;
    @Singular
    Set<String> tags;
    Double rating;
    Integer avgVisitMinutes;
    LocalTime openTime;
    LocalTime closeTime;
    /** Weekly expression such as {@code Mo-Fr 10:00-18:00; Sa 11:00-16:00}. */
    String openingHours;
    /** Windows already structured by the catalog; takes precedence over {@link #openingHours}. */
    @Singular
    List<OpeningHoursWindow> weeklyWindows;
    double[] embedding;
    String address;
    String description;

    public double lat() {
        return location.lat();
    }

    public double lon() {
        return location.lon();
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
