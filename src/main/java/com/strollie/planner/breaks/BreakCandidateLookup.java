package com.strollie.planner.breaks;

import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Poi;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Finds places suitable for a coffee break around a point.
 */
public interface BreakCandidateLookup {

    Mono<List<Poi>> findNearby(GeoPoint point, double radiusKm);
}
