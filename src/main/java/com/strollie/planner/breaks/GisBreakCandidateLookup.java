package com.strollie.planner.breaks;

import com.strollie.planner.client.GisApiClient;
import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Poi;
import com.strollie.planner.util.RetryingCall;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

@Component
@RequiredArgsConstructor
public class GisBreakCandidateLookup implements BreakCandidateLookup {

    static final String CAFE_QUERY = "кофейня";

    private final GisApiClient gisApiClient;
    private final PlannerProperties properties;

    @Override
    public Mono<List<Poi>> findNearby(GeoPoint point, double radiusKm) {
        int radiusMeters = (int) Math.max(100, Math.round(radiusKm * 1000));
        return RetryingCall.withRetry("cafes",
                gisApiClient.searchItems(CAFE_QUERY, "cafe", point, radiusMeters,
                        properties.getBreaks().getLookupLimit()),
                properties.getRetry().toPolicy(),
                properties.getCallTimeout());
    }
}
