package com.strollie.planner.routing;

import com.strollie.planner.cache.RoutingCache;
import com.strollie.planner.client.GisRoutingClient;
import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Leg;
import com.strollie.planner.util.Deadline;
import com.strollie.planner.util.RetryingCall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache, then street routing with timeout and retry, then a straight-line estimate.
 */
@Slf4j
@Primary
@Component
@RequiredArgsConstructor
public class RoutingDistanceProvider implements DistanceProvider {

    private final RoutingCache cache;
    private final GisRoutingClient routingClient;
    private final HaversineDistanceProvider fallback;
    private final PlannerProperties properties;

    @Override
    public Mono<Leg> leg(GeoPoint from, GeoPoint to, Deadline deadline) {
        return Mono.defer(() -> {
            Optional<Leg> cached = cache.getLeg(from, to);
            if (cached.isPresent()) {
                return Mono.just(cached.get());
            }
            if (deadline.isExpired()) {
                log.debug("Deadline passed, estimating leg {} -> {}", from, to);
                return Mono.just(fallback.estimate(from, to));
            }
            Duration timeout = deadline.cap(properties.getCallTimeout());
            return RetryingCall.withRetry("routing", routingClient.route(from, to),
                            properties.getRetry().toPolicy(), timeout)
                    .doOnNext(cache::putLeg)
                    .onErrorResume(e -> {
                        log.warn("Routing failed for {} -> {}, using estimate: {}", from, to, e.toString());
                        return Mono.just(fallback.estimate(from, to));
                    });
        });
    }
}
