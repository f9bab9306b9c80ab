package com.strollie.planner.sequencing;

import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.exception.RouteInfeasibleException;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Intensity;
import com.strollie.planner.model.Poi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BudgetFitter")
class BudgetFitterTest {

    private static final GeoPoint START = GeoPoint.of(56.3287, 44.0020);

    private BudgetFitter fitter;

    @BeforeEach
    void setUp() {
        fitter = new BudgetFitter(new PlannerProperties());
    }

    private static Poi poi(String id, double lat, double lon, int visit) {
        return Poi.builder().id(id).name(id).location(GeoPoint.of(lat, lon)).category("museum")
                .avgVisitMinutes(visit).build();
    }

    @Test
    @DisplayName("Available minutes subtract breaks and the safety buffer, never below 15")
    void testAvailableMinutes() {
        assertEquals(120 - 10 - Intensity.MEDIUM.getSafetyBufferMinutes(),
                BudgetFitter.availableMinutes(2, Intensity.MEDIUM, 10), 1e-9);
        assertEquals(15, BudgetFitter.availableMinutes(0.25, Intensity.MEDIUM, 30), 1e-9);
    }

    @Test
    @DisplayName("Two close stops with 30-minute visits fit into two hours")
    void testScenarioBothFit() {
        List<Poi> ordered = List.of(poi("a", 56.3269, 44.0042, 30), poi("b", 56.3255, 43.9895, 30));
        BudgetFitter.Fit fit = fitter.fit(ordered, START, Intensity.MEDIUM,
                BudgetFitter.availableMinutes(2, Intensity.MEDIUM, 0));
        assertEquals(2, fit.stops().size());
        assertEquals(0, fit.shortenedVisits());
        assertTrue(fit.estimatedMinutes() > 60);
    }

    @Test
    @DisplayName("Stops at the first stop that does not fit")
    void testCutsTail() {
        List<Poi> ordered = List.of(
                poi("a", 56.3269, 44.0042, 60),
                poi("b", 56.3270, 44.0045, 60),
                poi("c", 56.3271, 44.0048, 60));
        BudgetFitter.Fit fit = fitter.fit(ordered, START, Intensity.MEDIUM, 100);
        assertEquals(1, fit.stops().size());
        assertEquals("a", fit.stops().get(0).getId());
    }

    @Test
    @DisplayName("A stop that fits with a shorter visit is kept shortened")
    void testShortenedVisit() {
        List<Poi> ordered = List.of(poi("a", 56.3269, 44.0042, 60), poi("b", 56.3270, 44.0045, 60));
        BudgetFitter.Fit fit = fitter.fit(ordered, START, Intensity.MEDIUM, 120);
        assertEquals(2, fit.stops().size());
        assertEquals(1, fit.shortenedVisits());
        int shortened = fit.stops().get(1).getAvgVisitMinutes();
        assertTrue(shortened >= Intensity.MEDIUM.getMinVisitMinutes() && shortened < 60);
    }

    @Test
    @DisplayName("When nothing fits the first stop is kept with a minimal visit")
    void testKeepsFirstWithMinimalVisit() {
        List<Poi> ordered = List.of(poi("a", 56.3269, 44.0042, 70));
        BudgetFitter.Fit fit = fitter.fit(ordered, START, Intensity.MEDIUM, 20);
        assertEquals(1, fit.stops().size());
        assertEquals(Intensity.MEDIUM.getMinVisitMinutes(), fit.stops().get(0).getAvgVisitMinutes());
    }

    @Test
    @DisplayName("Unreachable first stop is infeasible")
    void testInfeasible() {
        List<Poi> ordered = List.of(poi("far", 56.40, 44.15, 30));
        assertThrows(RouteInfeasibleException.class, () -> fitter.fit(ordered, START, Intensity.MEDIUM, 15));
    }

    @Test
    @DisplayName("Empty order gives an empty fit")
    void testEmpty() {
        BudgetFitter.Fit fit = fitter.fit(List.of(), START, Intensity.RELAXED, 100);
        assertTrue(fit.stops().isEmpty());
    }

    @Test
    @DisplayName("A reordered route that no longer fits loses stops from its tail")
    void testTrimReorderedRoute() {
        Poi near1 = poi("near-1", 56.3290, 44.0020, 30);
        Poi near2 = poi("near-2", 56.3293, 44.0020, 30);
        Poi far = poi("far", 56.3557, 44.0020, 30);
        Poi near3 = poi("near-3", 56.3296, 44.0020, 30);
        double budget = 195;

        assertTrue(fitter.estimateMinutes(List.of(near1, near2, near3, far), START, Intensity.MEDIUM) <= budget);
        List<Poi> reordered = List.of(near1, near2, far, near3);
        assertTrue(fitter.estimateMinutes(reordered, START, Intensity.MEDIUM) > budget);

        List<Poi> trimmed = fitter.trimToBudget(reordered, START, Intensity.MEDIUM, budget);

        assertEquals(List.of(near1, near2, far), trimmed);
        assertTrue(fitter.estimateMinutes(trimmed, START, Intensity.MEDIUM) <= budget);
    }

    @Test
    @DisplayName("Trimming keeps the first stop even when it alone exceeds the budget")
    void testTrimKeepsFirstStop() {
        List<Poi> route = List.of(poi("far", 56.3557, 44.0020, 30), poi("near", 56.3290, 44.0020, 30));
        assertEquals(List.of(route.get(0)), fitter.trimToBudget(route, START, Intensity.MEDIUM, 20));
    }
}
