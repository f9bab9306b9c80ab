package com.strollie.planner.schedule;

import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.exception.InvalidScheduleExpressionException;
import com.strollie.planner.model.OpeningHoursWindow;
import com.strollie.planner.model.Poi;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a place can be visited at a given moment.
 * <p>
 * Hours are taken, in order, from the windows the catalog supplied, the weekly expression, the explicit
 * open/close pair, the category's typical hours and finally a generic 09:00-21:00 day.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpeningHoursResolver {

    public static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private final PlannerProperties properties;

    public OpeningStatus resolve(Poi poi, LocalDateTime at) {
        return resolve(poi, at, properties.getMaxWaitMinutes());
    }

    public OpeningStatus resolve(Poi poi, LocalDateTime at, int maxWaitMinutes) {
        Schedule schedule = scheduleOf(poi);
        return evaluate(schedule.windows(), schedule.exact(), at, maxWaitMinutes);
    }

    /**
     * Evaluates a weekly expression directly. Malformed text falls back to the generic day.
     */
    public OpeningStatus resolve(String expression, LocalDateTime at, int maxWaitMinutes) {
        try {
            return evaluate(OpeningHoursParser.parse(expression), true, at, maxWaitMinutes);
        } catch (InvalidScheduleExpressionException e) {
            log.warn("Opening hours ignored: {}", e.getMessage());
            return evaluate(List.of(TypicalOpeningHours.GENERIC), false, at, maxWaitMinutes);
        }
    }

    Schedule scheduleOf(Poi poi) {
        if (poi.getWeeklyWindows() != null && !poi.getWeeklyWindows().isEmpty()) {
            return new Schedule(poi.getWeeklyWindows(), true);
        }
        if (poi.getOpeningHours() != null && !poi.getOpeningHours().isBlank()) {
            try {
                return new Schedule(OpeningHoursParser.parse(poi.getOpeningHours()), true);
            } catch (InvalidScheduleExpressionException e) {
                log.warn("Data quality: POI {} ('{}') has unreadable hours, using fallback. {}",
                        poi.getId(), poi.getName(), e.getMessage());
            }
        }
        if (poi.getOpenTime() != null && poi.getCloseTime() != null) {
            return new Schedule(List.of(OpeningHoursWindow.everyDay(poi.getOpenTime(), poi.getCloseTime())), true);
        }
        return new Schedule(List.of(TypicalOpeningHours.forCategory(poi.getCategory())), false);
    }

    OpeningStatus evaluate(List<OpeningHoursWindow> windows, boolean exact, LocalDateTime at, int maxWaitMinutes) {
        List<Interval> intervals = intervalsAround(windows, at.toLocalDate());

        Optional<Interval> current = intervals.stream()
                .filter(i -> i.contains(at))
                .max(Comparator.comparing(Interval::end));
        if (current.isPresent()) {
            return status(current.get(), true, 0, exact);
        }

        Optional<Interval> upcoming = intervals.stream()
                .filter(i -> i.start().isAfter(at) && i.start().toLocalDate().equals(at.toLocalDate()))
                .min(Comparator.comparing(Interval::start));
        if (upcoming.isPresent()) {
            long wait = ceilMinutes(Duration.between(at, upcoming.get().start()));
            return status(upcoming.get(), wait <= maxWaitMinutes, wait, exact);
        }

        return OpeningStatus.builder()
                .open(false)
                .waitMinutes(0)
                .label("закрыто" + (exact ? " (точное)" : " (ориентировочно)"))
                .exact(exact)
                .build();
    }

    private List<Interval> intervalsAround(List<OpeningHoursWindow> windows, LocalDate date) {
        LocalDate yesterday = date.minusDays(1);
        List<Interval> intervals = new ArrayList<>();
        for (OpeningHoursWindow window : windows) {
            if (window.wrapsPastMidnight() && window.appliesTo(yesterday.getDayOfWeek())) {
                intervals.add(new Interval(yesterday.atTime(window.getStart()),
                        date.atTime(window.getEnd()), window));
            }
            if (window.appliesTo(date.getDayOfWeek())) {
                LocalDate endDate = window.wrapsPastMidnight() ? date.plusDays(1) : date;
                intervals.add(new Interval(date.atTime(window.getStart()), endDate.atTime(window.getEnd()), window));
            }
        }
        return intervals;
    }

    private OpeningStatus status(Interval interval, boolean open, long wait, boolean exact) {
        return OpeningStatus.builder()
                .open(open)
                .waitMinutes(wait)
                .opensAt(interval.start())
                .closesAt(interval.end())
                .label(label(interval.window(), exact))
                .exact(exact)
                .build();
    }

    public static String label(OpeningHoursWindow window, boolean exact) {
        StringBuilder sb = new StringBuilder();
        if (window.getStart().equals(window.getEnd())) {
            sb.append("круглосуточно");
        } else {
            sb.append(HH_MM.format(window.getStart())).append('–').append(HH_MM.format(window.getEnd()));
            if (window.wrapsPastMidnight() && !LocalTime.MIDNIGHT.equals(window.getEnd())) {
                sb.append(" (+1 день)");
            }
        }
        sb.append(exact ? " (точное)" : " (ориентировочно)");
        return sb.toString();
    }

    private static long ceilMinutes(Duration duration) {
        long seconds = duration.getSeconds();
        return (seconds + 59) / 60;
    }

    record Schedule(List<OpeningHoursWindow> windows, boolean exact) {
    }

    private record Interval(LocalDateTime start, LocalDateTime end, OpeningHoursWindow window) {
        boolean contains(LocalDateTime at) {
            return !at.isBefore(start) && at.isBefore(end);
        }
    }
}
