package com.strollie.planner.service;

import com.strollie.planner.breaks.BreakInserter;
import com.strollie.planner.breaks.BreakTracker;
import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.exception.NoCandidatesFoundException;
import com.strollie.planner.model.CandidateScore;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Intensity;
import com.strollie.planner.model.Itinerary;
import com.strollie.planner.model.Leg;
import com.strollie.planner.model.PlannedStop;
import com.strollie.planner.model.PlanningContext;
import com.strollie.planner.model.Poi;
import com.strollie.planner.routing.DistanceProvider;
import com.strollie.planner.schedule.ScheduleAligner;
import com.strollie.planner.schedule.Timeline;
import com.strollie.planner.scoring.CandidatePrefilter;
import com.strollie.planner.scoring.CandidateScorer;
import com.strollie.planner.scoring.CategoryDiversity;
import com.strollie.planner.scoring.TimeWindowFilter;
import com.strollie.planner.sequencing.BudgetFitter;
import com.strollie.planner.sequencing.RouteSequencer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a catalog and a resolved context into a timed itinerary.
 * <p>
 * Prefilter, scoring, time-window filter and candidate limit decide <i>what</i> to visit; the sequencer and the
 * budget fit decide <i>in which order and how many</i>; the aligner and the break inserter put it on the clock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ItineraryAssembler {

    static final int MIN_TARGET = 6;
    static final int MIN_BUFFER = 4;
    static final int MAX_SEQUENCED = 80;

    static final String WARNING_TOO_LONG =
            "Маршрут получился чуть длиннее указанного времени — скорректируйте длительность или интересы.";

    private final CandidatePrefilter prefilter;
    private final CandidateScorer scorer;
    private final TimeWindowFilter timeWindowFilter;
    private final RouteSequencer sequencer;
    private final BudgetFitter budgetFitter;
    private final ScheduleAligner aligner;
    private final BreakInserter breakInserter;
    private final DistanceProvider distanceProvider;
    private final PlannerProperties properties;

    public Itinerary assemble(List<Poi> catalog, PlanningContext context) {
        if (catalog == null || catalog.isEmpty()) {
            throw new NoCandidatesFoundException("Не найдено ни одного подходящего места по выбранным интересам");
        }
        Intensity intensity = context.getIntensity();

        List<Poi> working = prefilter.prefilter(catalog, context.getStart(), intensity);
        log.info("Prefilter: {} -> {} candidates", catalog.size(), working.size());

        List<CandidateScore> ranked = scorer.score(working, context);
        List<CandidateScore> available = timeWindowFilter.filter(ranked, context.getStartTime());
        if (available.isEmpty()) {
            throw new NoCandidatesFoundException("После фильтрации не осталось мест для маршрута");
        }

        int limit = candidateLimit(available.size(), context.getHours(), intensity);
        List<Poi> selected = available.stream().limit(limit).map(CandidateScore::getPoi).toList();
        log.info("Selected top {} of {} ranked candidates", selected.size(), available.size());

        List<Poi> ordered = sequencer.sequence(selected, Poi::getLocation, context.getStart());

        int reserved = BreakInserter.reservedMinutes(context.getHours() * 60, intensity, context.getBreakPreferences());
        double budget = BudgetFitter.availableMinutes(context.getHours(), intensity, reserved);
        BudgetFitter.Fit fit = budgetFitter.fit(ordered, context.getStart(), intensity, budget);

        List<Poi> rebalanced = CategoryDiversity.rebalance(fit.stops(), properties.getMaxConsecutiveCategory(),
                Poi::getCategory);
        List<Poi> route = rebalanced.equals(fit.stops())
                ? rebalanced
                : budgetFitter.trimToBudget(rebalanced, context.getStart(), intensity, budget);

        return schedule(route, context);
    }

    static int candidateLimit(int available, double hours, Intensity intensity) {
        int target = Math.max(MIN_TARGET, (int) Math.round(hours * intensity.getCandidateMultiplier()));
        int buffer = Math.max(MIN_BUFFER, (int) (target * 0.4));
        return Math.min(available, Math.min(target + buffer, MAX_SEQUENCED));
    }

    Itinerary schedule(List<Poi> route, PlanningContext context) {
        List<Leg> legs = fetchLegs(route, context);
        LocalDateTime start = context.getStartTime();
        LocalDateTime limit = start.plusMinutes(context.timeLimitMinutes());
        Intensity intensity = context.getIntensity();

        Timeline timeline = new Timeline(start);
        BreakTracker tracker = new BreakTracker(start);
        route.forEach(poi -> tracker.exclude(poi.getId()));

        List<PlannedStop> stops = new ArrayList<>();
        List<Leg> between = new ArrayList<>();
        Leg approach = legs.get(0);
        GeoPoint position = context.getStart();
        boolean afterBreak = false;

        for (int i = 0; i < route.size(); i++) {
            Poi poi = route.get(i);
            Leg incoming = legs.get(i);
            if (afterBreak) {
                incoming = distanceProvider.leg(position, poi.getLocation(), context.getDeadline()).block();
                afterBreak = false;
            }
            if (i == 0) {
                approach = incoming;
            } else {
                between.add(incoming);
            }

            PlannedStop stop = aligner.visit(timeline, poi, incoming, intensity, stops.size() + 1);
            stops.add(stop);
            position = poi.getLocation();

            if (i < route.size() - 1) {
                Optional<BreakInserter.Insertion> insertion = breakInserter.maybeInsert(
                        tracker, timeline, position, context, stops.size() + 1, limit);
                if (insertion.isPresent()) {
                    stops.add(insertion.get().stop());
                    between.add(insertion.get().leg());
                    position = insertion.get().stop().getLocation();
                    afterBreak = true;
                }
            }
        }

        double totalKm = approach.getDistanceKm() + between.stream().mapToDouble(Leg::getDistanceKm).sum();
        LocalDateTime end = stops.get(stops.size() - 1).getLeaveTime();
        long totalMinutes = Duration.between(start, end).toMinutes();

        Itinerary.ItineraryBuilder itinerary = Itinerary.builder()
                .startTime(start)
                .stops(stops)
                .approachLeg(approach)
                .legs(between)
                .totalDistanceKm(totalKm)
                .totalMinutes(totalMinutes)
                .warnings(context.getWarnings());

        if (totalMinutes > context.timeLimitMinutes()) {
            itinerary.warning(WARNING_TOO_LONG);
        }
        for (PlannedStop stop : stops) {
            if (!stop.isOpen() && !stop.isBreakStop()) {
                itinerary.warning(String.format("«%s»: %s", stop.getName(), stop.getAvailabilityNote()));
            }
        }

        log.info("Itinerary: {} stops ({} breaks), {} km, {} min",
                stops.size(), stops.stream().filter(PlannedStop::isBreakStop).count(),
                String.format("%.2f", totalKm), totalMinutes);
        return itinerary.build();
    }

    /**
     * Approach leg plus one leg per consecutive pair, fetched concurrently and returned in route order.
     */
    private List<Leg> fetchLegs(List<Poi> route, PlanningContext context) {
        List<GeoPoint[]> pairs = new ArrayList<>(route.size());
        GeoPoint previous = context.getStart();
        for (Poi poi : route) {
            pairs.add(new GeoPoint[]{previous, poi.getLocation()});
            previous = poi.getLocation();
        }
        return Flux.fromIterable(pairs)
                .flatMapSequential(pair -> distanceProvider.leg(pair[0], pair[1], context.getDeadline()),
                        Math.max(1, properties.getLegConcurrency()))
                .collectList()
                .block();
    }
}
