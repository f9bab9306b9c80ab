package com.strollie.planner.service;

import com.strollie.planner.breaks.BreakCandidateLookup;
import com.strollie.planner.breaks.BreakInserter;
import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.exception.NoCandidatesFoundException;
import com.strollie.planner.model.BreakPreferences;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Intensity;
import com.strollie.planner.model.Itinerary;
import com.strollie.planner.model.Leg;
import com.strollie.planner.model.PlannedStop;
import com.strollie.planner.model.PlanningContext;
import com.strollie.planner.model.Poi;
import com.strollie.planner.routing.HaversineDistanceProvider;
import com.strollie.planner.schedule.OpeningHoursResolver;
import com.strollie.planner.schedule.ScheduleAligner;
import com.strollie.planner.scoring.CandidatePrefilter;
import com.strollie.planner.scoring.CandidateScorer;
import com.strollie.planner.scoring.TimeWindowFilter;
import com.strollie.planner.sequencing.BudgetFitter;
import com.strollie.planner.sequencing.RouteSequencer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ItineraryAssembler")
class ItineraryAssemblerTest {

    private static final GeoPoint MINIMA_SQUARE = GeoPoint.of(56.3269, 44.0059);
    private static final LocalDateTime MONDAY_MORNING = LocalDateTime.of(2025, 6, 2, 10, 0);

    private ItineraryAssembler assembler;
    private BreakCandidateLookup lookup;

    @BeforeEach
    void setUp() {
        PlannerProperties properties = new PlannerProperties();
        OpeningHoursResolver resolver = new OpeningHoursResolver(properties);
        HaversineDistanceProvider distances = new HaversineDistanceProvider(properties);
        lookup = mock(BreakCandidateLookup.class);
        when(lookup.findNearby(any(), anyDouble())).thenReturn(Mono.just(List.of()));

        assembler = new ItineraryAssembler(
                new CandidatePrefilter(properties),
                new CandidateScorer(),
                new TimeWindowFilter(resolver),
                new RouteSequencer(properties),
                new BudgetFitter(properties),
                new ScheduleAligner(resolver, properties),
                new BreakInserter(lookup, distances, properties),
                distances,
                properties);
    }

    private static List<Poi> centre() {
        return List.of(
                poi("1", "Нижегородский кремль", "architecture", 56.3287, 44.0020, 4.9),
                poi("2", "Чкаловская лестница", "architecture", 56.3316, 44.0112, 4.8),
                poi("3", "Художественный музей", "museum", 56.3285, 44.0098, 4.7),
                poi("4", "Александровский сад", "park", 56.3306, 44.0150, 4.6),
                poi("5", "Памятник Минину и Пожарскому", "monument", 56.3265, 44.0065, 4.5),
                poi("6", "Верхне-Волжская набережная", "embankment", 56.3290, 44.0200, 4.8),
                poi("7", "Рождественская церковь", "religious_site", 56.3275, 43.9950, 4.7),
                poi("8", "Дмитриевская башня", "architecture", 56.3270, 44.0040, 4.6));
    }

    private static Poi poi(String id, String name, String category, double lat, double lon, double rating) {
        return Poi.builder()
                .id(id)
                .name(name)
                .category(category)
                .location(GeoPoint.of(lat, lon))
                .rating(rating)
                .openTime(LocalTime.of(8, 0))
                .closeTime(LocalTime.of(22, 0))
                .build();
    }

    private static PlanningContext context(double hours, boolean breaks) {
        return PlanningContext.builder()
                .start(MINIMA_SQUARE)
                .startTime(MONDAY_MORNING)
                .hours(hours)
                .intensity(Intensity.MEDIUM)
                .breakPreferences(BreakPreferences.builder().enabled(breaks).build())
                .build();
    }

    @Test
    @DisplayName("Walk through the centre is ordered, timed and fits the limit")
    void testCentreWalk() {
        Itinerary itinerary = assembler.assemble(centre(), context(3, false));

        List<PlannedStop> stops = itinerary.getStops();
        assertFalse(stops.isEmpty());
        assertEquals(stops.size() - 1, itinerary.getLegs().size());
        assertNotNull(itinerary.getApproachLeg());

        Set<String> ids = new HashSet<>();
        LocalDateTime previousLeave = MONDAY_MORNING;
        for (int i = 0; i < stops.size(); i++) {
            PlannedStop stop = stops.get(i);
            assertEquals(i + 1, stop.getOrder());
            assertTrue(ids.add(stop.getPoiId()), "duplicate stop " + stop.getPoiId());
            assertFalse(stop.getArrivalTime().isBefore(previousLeave));
            assertTrue(stop.getLeaveTime().isAfter(stop.getArrivalTime()));
            assertTrue(stop.isOpen());
            previousLeave = stop.getLeaveTime();
        }

        double legsKm = itinerary.getApproachLeg().getDistanceKm()
                + itinerary.getLegs().stream().mapToDouble(Leg::getDistanceKm).sum();
        assertEquals(legsKm, itinerary.getTotalDistanceKm(), 1e-9);
        assertTrue(itinerary.getTotalMinutes() <= 180 + Intensity.MEDIUM.getMaxVisitMinutes());
    }

    @Test
    @DisplayName("Without cafés nearby a long walk has no breaks")
    void testNoBreakCandidates() {
        Itinerary itinerary = assembler.assemble(centre(), context(4, true));
        assertEquals(0, itinerary.breakCount());
    }

    @Test
    @DisplayName("Short walk keeps at least one stop")
    void testShortWalk() {
        Itinerary itinerary = assembler.assemble(centre(), context(0.5, false));
        assertFalse(itinerary.getStops().isEmpty());
    }

    @Test
    @DisplayName("Empty catalog is rejected")
    void testEmptyCatalog() {
        assertThrows(NoCandidatesFoundException.class, () -> assembler.assemble(List.of(), context(3, false)));
    }

    @Test
    @DisplayName("Candidate limit grows with duration and intensity")
    void testCandidateLimit() {
        assertEquals(10, ItineraryAssembler.candidateLimit(50, 3, Intensity.MEDIUM));
        assertEquals(3, ItineraryAssembler.candidateLimit(3, 3, Intensity.MEDIUM));
        assertEquals(28, ItineraryAssembler.candidateLimit(50, 8, Intensity.INTENSE));
    }

    @Test
    @DisplayName("Breaking up a run of one category re-checks the time budget")
    void testRebalancedRouteStillFits() {
        Poi museum1 = poi("m1", "Музей 1", "museum", 56.3272, 44.0059, 4.9).toBuilder().avgVisitMinutes(30).build();
        Poi museum2 = poi("m2", "Музей 2", "museum", 56.3275, 44.0059, 4.8).toBuilder().avgVisitMinutes(30).build();
        Poi museum3 = poi("m3", "Музей 3", "museum", 56.3278, 44.0059, 4.7).toBuilder().avgVisitMinutes(30).build();
        Poi tower = poi("far", "Дальняя башня", "architecture", 56.3539, 44.0059, 4.6)
                .toBuilder().avgVisitMinutes(30).build();
        PlanningContext context = context(3.5, false);
        double budget = BudgetFitter.availableMinutes(3.5, Intensity.MEDIUM, 0);
        BudgetFitter fitter = new BudgetFitter(new PlannerProperties());
        assertTrue(fitter.estimateMinutes(List.of(museum1, museum2, museum3, tower), MINIMA_SQUARE,
                Intensity.MEDIUM) <= budget);

        Itinerary itinerary = assembler.assemble(List.of(museum1, museum2, museum3, tower), context);

        List<String> ids = itinerary.getStops().stream().map(PlannedStop::getPoiId).toList();
        assertEquals(List.of("m1", "m2", "far"), ids);
        assertTrue(fitter.estimateMinutes(List.of(museum1, museum2, tower), MINIMA_SQUARE,
                Intensity.MEDIUM) <= budget);
    }
}
