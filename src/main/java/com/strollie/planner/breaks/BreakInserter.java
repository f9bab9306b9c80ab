package com.strollie.planner.breaks;

import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.geo.GeoMath;
import com.strollie.planner.model.BreakPreferences;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Intensity;
import com.strollie.planner.model.Leg;
import com.strollie.planner.model.PlannedStop;
import com.strollie.planner.model.PlanningContext;
import com.strollie.planner.model.Poi;
import com.strollie.planner.routing.DistanceProvider;
import com.strollie.planner.schedule.Timeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Suggests a café once enough time has passed since the start or the previous break.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BreakInserter {

    public static final String BREAK_CATEGORY = "coffee_break";
    static final int MIN_INTERVAL_MINUTES = 30;

    private final BreakCandidateLookup lookup;
    private final DistanceProvider distanceProvider;
    private final PlannerProperties properties;

    public record Insertion(PlannedStop stop, Leg leg) {
    }

    /**
     * The intensity's recommended interval, raised to the user's one when breaks are enabled.
     */
    public static int intervalMinutes(Intensity intensity, BreakPreferences preferences) {
        int baseline = intensity.getBreakIntervalMinutes();
        if (preferences == null || !preferences.isEnabled()) {
            return baseline;
        }
        return Math.max(baseline, Math.max(MIN_INTERVAL_MINUTES, preferences.getIntervalMinutes()));
    }

    /**
     * Minutes to hold back from the visit budget for the breaks a walk of this length is expected to get.
     */
    public static int reservedMinutes(double totalMinutes, Intensity intensity, BreakPreferences preferences) {
        if (preferences == null || !preferences.isEnabled() || totalMinutes <= 0) {
            return 0;
        }
        double interval = intervalMinutes(intensity, preferences);
        if (totalMinutes < interval * 0.75) {
            return 0;
        }
        int breaks = (int) (totalMinutes / interval);
        double remainder = totalMinutes - breaks * interval;
        if (remainder >= interval * 0.6) {
            breaks++;
        }
        breaks = Math.max(1, breaks);
        breaks = Math.min(breaks, Math.max(1, (int) (totalMinutes / 105) + 1));
        double baseStay = Math.max(18, Math.min(35, interval / 3.2));
        return breaks * intensity.effectiveVisitMinutes((int) Math.round(baseStay));
    }

    /**
     * Inserts at most one break after the stop just left, when the interval has elapsed and a café is found.
     *
     * @param limit the break must end by this moment
     */
    public Optional<Insertion> maybeInsert(BreakTracker tracker, Timeline timeline, GeoPoint from,
                                           PlanningContext context, int order, LocalDateTime limit) {
        if (!context.breaksEnabled()) {
            return Optional.empty();
        }
        BreakPreferences preferences = context.getBreakPreferences();
        int interval = intervalMinutes(context.getIntensity(), preferences);
        long elapsed = tracker.minutesSinceLastBreak(timeline.now());
        if (elapsed < interval) {
            return Optional.empty();
        }

        double radius = preferences.getSearchRadiusKm() > 0
                ? preferences.getSearchRadiusKm()
                : properties.getBreaks().getSearchRadiusKm();
        Optional<Poi> cafe = nearestCafe(tracker, from, radius, context);
        if (cafe.isEmpty()) {
            log.info("No café within {} km after {} min of walking, will retry at the next stop", radius, elapsed);
            return Optional.empty();
        }

        Poi place = cafe.get();
        Leg leg = distanceProvider.leg(from, place.getLocation(), context.getDeadline()).block();
        if (leg == null) {
            return Optional.empty();
        }
        Intensity intensity = context.getIntensity();
        int stay = intensity.effectiveVisitMinutes(Math.max(15, Math.min(30, preferences.getIntervalMinutes() / 3)));
        LocalDateTime arrival = timeline.peekAfter(leg.getDurationMinutes());
        LocalDateTime leave = arrival.plusMinutes(stay + intensity.getTransitionPaddingMinutes());
        if (leave.isAfter(limit)) {
            log.info("Break at '{}' would end at {}, after the walk limit {}", place.getName(), leave, limit);
            return Optional.empty();
        }

        timeline.advanceTo(leave);
        tracker.breakTaken(place.getId(), leave);
        log.info("Coffee break #{} at '{}' ({} min since last break)", order, place.getName(), elapsed);

        PlannedStop stop = PlannedStop.builder()
                .order(order)
                .poiId(place.getId())
                .name(place.getName())
                .location(place.getLocation())
                .category(BREAK_CATEGORY)
                .arrivalTime(arrival)
                .leaveTime(leave)
                .visitMinutes(stay)
                .open(true)
                .breakStop(true)
                .distanceFromPreviousKm(leg.getDistanceKm())
                .build();
        return Optional.of(new Insertion(stop, leg));
    }

    private Optional<Poi> nearestCafe(BreakTracker tracker, GeoPoint from, double radiusKm, PlanningContext context) {
        List<Poi> cafes;
        try {
            cafes = lookup.findNearby(from, radiusKm)
                    .timeout(context.getDeadline().cap(properties.getCallTimeout()))
                    .onErrorResume(e -> {
                        log.warn("Café lookup failed: {}", e.toString());
                        return Mono.just(List.of());
                    })
                    .block();
        } catch (RuntimeException e) {
            log.warn("Café lookup failed: {}", e.toString());
            return Optional.empty();
        }
        if (cafes == null) {
            return Optional.empty();
        }
        return cafes.stream()
                .filter(c -> c.getLocation() != null && !tracker.isUsed(c.getId()))
                .filter(c -> GeoMath.haversineKm(from, c.getLocation()) <= radiusKm)
                .min(Comparator.comparingDouble(c -> GeoMath.haversineKm(from, c.getLocation())));
    }
}
