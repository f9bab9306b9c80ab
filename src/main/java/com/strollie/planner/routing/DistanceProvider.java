package com.strollie.planner.routing;

import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Leg;
import com.strollie.planner.util.Deadline;
import reactor.core.publisher.Mono;

/**
 * Walking distance, duration and geometry between two points. Implementations never signal an error.
 */
public interface DistanceProvider {

    Mono<Leg> leg(GeoPoint from, GeoPoint to, Deadline deadline);

    default Mono<Leg> leg(GeoPoint from, GeoPoint to) {
        return leg(from, to, Deadline.none());
    }
}
