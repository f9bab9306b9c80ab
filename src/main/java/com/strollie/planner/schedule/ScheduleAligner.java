package com.strollie.planner.schedule;

import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.model.Intensity;
import com.strollie.planner.model.Leg;
import com.strollie.planner.model.PlannedStop;
import com.strollie.planner.model.Poi;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Places an ordered sequence of visits on the clock.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleAligner {

    public static final String NOTE_CLOSED = "Закрыто в момент прибытия";

    private final OpeningHoursResolver resolver;
    private final PlannerProperties properties;

    /**
     * Aligns the given stops without breaks. {@code incoming.get(i)} is the leg that leads to {@code pois.get(i)}.
     */
    public List<PlannedStop> align(List<Poi> pois, List<Leg> incoming, LocalDateTime start, Intensity intensity) {
        if (pois.size() != incoming.size()) {
            throw new IllegalArgumentException("Expected one incoming leg per stop, got "
                    + incoming.size() + " for " + pois.size());
        }
        Timeline timeline = new Timeline(start);
        List<PlannedStop> stops = new ArrayList<>(pois.size());
        for (int i = 0; i < pois.size(); i++) {
            stops.add(visit(timeline, pois.get(i), incoming.get(i), intensity, i + 1));
        }
        return stops;
    }

    /**
     * Walks the incoming leg, waits for opening when allowed, visits, then pads. Moves the timeline to the leave time.
     */
    public PlannedStop visit(Timeline timeline, Poi poi, Leg incoming, Intensity intensity, int order) {
        LocalDateTime arrival = timeline.advance(incoming.getDurationMinutes());
        OpeningStatus status = resolver.resolve(poi, arrival, properties.getMaxWaitMinutes());

        LocalDateTime visitStart = arrival;
        boolean open = status.isOpen();
        String note = null;

        if (open && status.getWaitMinutes() > 0) {
            visitStart = arrival.plusMinutes(status.getWaitMinutes());
            note = "Ждём открытия до " + OpeningHoursResolver.HH_MM.format(status.getOpensAt());
        } else if (!open) {
            note = NOTE_CLOSED;
            log.debug("POI {} is closed at {}", poi.getId(), arrival);
        }

        LocalDateTime visitEnd = visitStart.plusMinutes(intensity.effectiveVisitMinutes(poi.getAvgVisitMinutes()));
        if (open && status.getClosesAt() != null && visitEnd.isAfter(status.getClosesAt())) {
            visitEnd = status.getClosesAt().isAfter(visitStart) ? status.getClosesAt() : visitStart;
            open = false;
            note = "Место закрывается в " + OpeningHoursResolver.HH_MM.format(status.getClosesAt())
                    + " — планируйте быстрее";
        }

        LocalDateTime leave = visitEnd.plusMinutes(intensity.getTransitionPaddingMinutes());
        timeline.advanceTo(leave);

        return PlannedStop.builder()
                .order(order)
                .poiId(poi.getId())
                .name(poi.getName())
                .location(poi.getLocation())
                .category(poi.getCategory())
                .arrivalTime(arrival)
                .leaveTime(leave)
                .visitMinutes((int) Duration.between(visitStart, visitEnd).toMinutes())
                .open(open)
                .openingHoursLabel(status.getLabel())
                .availabilityNote(note)
                .breakStop(false)
                .distanceFromPreviousKm(incoming.getDistanceKm())
                .build();
    }
}
