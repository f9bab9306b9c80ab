package com.strollie.planner.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

@Value
@Builder
public class Itinerary {
    LocalDateTime startTime;
    @Singular
    List<PlannedStop> stops;
    /** Leg from the start point to the first stop; {@code null} for an empty itinerary. */
    Leg approachLeg;
    /** Legs between consecutive stops, one fewer than the stops. */
    @Singular
    List<Leg> legs;
    double totalDistanceKm;
    long totalMinutes;
    @Singular
    List<String> warnings;

    public int breakCount() {
        return (int) stops.stream().filter(PlannedStop::isBreakStop).count();
    }
}
