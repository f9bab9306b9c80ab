package com.strollie.planner.model;

import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.Set;

@Value
public class OpeningHoursWindow {
    Set<DayOfWeek> days;
    LocalTime start;
    LocalTime end;

    public static OpeningHoursWindow of(Set<DayOfWeek> days, LocalTime start, LocalTime end) {
        return new OpeningHoursWindow(days.isEmpty() ? EnumSet.noneOf(DayOfWeek.class) : EnumSet.copyOf(days), start, end);
    }

    public static OpeningHoursWindow everyDay(LocalTime start, LocalTime end) {
        return new OpeningHoursWindow(EnumSet.allOf(DayOfWeek.class), start, end);
    }

    /** A close time at or before the open time means the window ends on the next day. */
    public boolean wrapsPastMidnight() {
        return !end.isAfter(start);
    }

    public boolean appliesTo(DayOfWeek day) {
        return days.contains(day);
    }
}
