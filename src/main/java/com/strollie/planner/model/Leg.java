package com.strollie.planner.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class Leg {

    public enum Source {
        /** Produced by the routing service along real streets. */
        ROUTED,
        /** Straight-line haversine estimate. */
        ESTIMATED
    }

    GeoPoint from;
    GeoPoint to;
    double distanceKm;
    double durationMinutes;
    @Singular("point")
    List<GeoPoint> geometry;
    @Singular
    List<Maneuver> maneuvers;
    Source source;
}
