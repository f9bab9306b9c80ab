package com.strollie.planner.routing;

import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.geo.GeoMath;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Leg;
import com.strollie.planner.util.Deadline;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Straight-line estimate at walking speed.
 */
@Component
@RequiredArgsConstructor
public class HaversineDistanceProvider implements DistanceProvider {

    private final PlannerProperties properties;

    @Override
    public Mono<Leg> leg(GeoPoint from, GeoPoint to, Deadline deadline) {
        return Mono.fromSupplier(() -> estimate(from, to));
    }

    public Leg estimate(GeoPoint from, GeoPoint to) {
        double km = GeoMath.haversineKm(from, to);
        return Leg.builder()
                .from(from)
                .to(to)
                .distanceKm(km)
                .durationMinutes(GeoMath.walkingMinutes(km, properties.getWalkSpeedKmh()))
                .point(from)
                .point(to)
                .source(Leg.Source.ESTIMATED)
                .build();
    }
}
