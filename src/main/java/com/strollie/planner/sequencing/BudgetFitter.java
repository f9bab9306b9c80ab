package com.strollie.planner.sequencing;

import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.exception.RouteInfeasibleException;
import com.strollie.planner.geo.GeoMath;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Intensity;
import com.strollie.planner.model.Poi;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts an optimized order down to what fits into the time budget.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BudgetFitter {

    static final int MIN_AVAILABLE_MINUTES = 15;

    private final PlannerProperties properties;

    public record Fit(List<Poi> stops, double estimatedMinutes, int shortenedVisits) {
    }

    public static double availableMinutes(double hours, Intensity intensity, int reservedBreakMinutes) {
        return Math.max(MIN_AVAILABLE_MINUTES,
                hours * 60 - reservedBreakMinutes - intensity.getSafetyBufferMinutes());
    }

    /**
     * Walks the order accumulating travel, visit and padding and stops at the first stop that does not fit.
     * That stop is still taken when a visit shortened to no less than the intensity minimum fits.
     *
     * @throws RouteInfeasibleException when not even the first stop can be reached within the budget
     */
    public Fit fit(List<Poi> ordered, GeoPoint start, Intensity intensity, double availableMinutes) {
        List<Poi> fitted = new ArrayList<>();
        if (ordered.isEmpty()) {
            return new Fit(fitted, 0, 0);
        }
        double speed = properties.getWalkSpeedKmh();
        int padding = intensity.getTransitionPaddingMinutes();
        double elapsed = 0;
        int shortened = 0;
        GeoPoint current = start;

        for (Poi poi : ordered) {
            double travel = GeoMath.walkingMinutes(GeoMath.haversineKm(current, poi.getLocation()), speed);
            int visit = intensity.effectiveVisitMinutes(poi.getAvgVisitMinutes());
            if (elapsed + travel + visit + padding <= availableMinutes) {
                fitted.add(poi);
                elapsed += travel + visit + padding;
                current = poi.getLocation();
                continue;
            }
            int remainingVisit = (int) Math.floor(availableMinutes - elapsed - travel - padding);
            if (remainingVisit >= intensity.getMinVisitMinutes()) {
                fitted.add(poi.toBuilder().avgVisitMinutes(remainingVisit).build());
                elapsed += travel + remainingVisit + padding;
                shortened++;
            }
            break;
        }

        if (fitted.isEmpty()) {
            Poi first = ordered.get(0);
            double travel = GeoMath.walkingMinutes(GeoMath.haversineKm(start, first.getLocation()), speed);
            if (travel > availableMinutes) {
                throw new RouteInfeasibleException(String.format(
                        "Даже ближайшая точка '%s' недоступна за отведённое время (%.0f мин пешком при бюджете %.0f мин)",
                        first.getName(), travel, availableMinutes));
            }
            log.warn("No stop fits the budget of {} min, keeping '{}' with a minimal visit",
                    Math.round(availableMinutes), first.getName());
            fitted.add(first.toBuilder().avgVisitMinutes(intensity.getMinVisitMinutes()).build());
            elapsed = travel + intensity.getMinVisitMinutes() + padding;
            shortened++;
        }

        log.info("Budget fit: {} of {} stops, ~{} of {} min", fitted.size(), ordered.size(),
                Math.round(elapsed), Math.round(availableMinutes));
        return new Fit(fitted, elapsed, shortened);
    }

    /**
     * Travel, visit and padding minutes of walking the stops in the given order.
     */
    public double estimateMinutes(List<Poi> route, GeoPoint start, Intensity intensity) {
        double speed = properties.getWalkSpeedKmh();
        int padding = intensity.getTransitionPaddingMinutes();
        double total = 0;
        GeoPoint current = start;
        for (Poi poi : route) {
            total += GeoMath.walkingMinutes(GeoMath.haversineKm(current, poi.getLocation()), speed)
                    + intensity.effectiveVisitMinutes(poi.getAvgVisitMinutes()) + padding;
            current = poi.getLocation();
        }
        return total;
    }

    /**
     * Drops stops from the tail of a reordered route until it fits the budget again. The first stop always stays.
     */
    public List<Poi> trimToBudget(List<Poi> route, GeoPoint start, Intensity intensity, double availableMinutes) {
        List<Poi> trimmed = new ArrayList<>(route);
        double estimate = estimateMinutes(trimmed, start, intensity);
        while (trimmed.size() > 1 && estimate > availableMinutes) {
            trimmed.remove(trimmed.size() - 1);
            estimate = estimateMinutes(trimmed, start, intensity);
        }
        if (trimmed.size() < route.size()) {
            log.info("Reordered route trimmed to {} of {} stops, ~{} of {} min", trimmed.size(), route.size(),
                    Math.round(estimate), Math.round(availableMinutes));
        }
        return trimmed;
    }
}
