package com.strollie.planner.schedule;

import java.time.LocalTime;

/**
 * Part of the day a visit falls into. Hours are half-open: [startHour, endHour).
 */
public enum TimePhase {
    EARLY_MORNING(6, 9),
    MORNING(9, 12),
    LUNCH(12, 14),
    DAY(14, 17),
    EVENING(17, 19),
    NIGHT(19, 22),
    DEFAULT(-1, -1);

    private final int startHour;
    private final int endHour;

    TimePhase(int startHour, int endHour) {
        this.startHour = startHour;
        this.endHour = endHour;
    }

    public static TimePhase of(LocalTime time) {
        int hour = time.getHour();
        for (TimePhase phase : values()) {
            if (hour >= phase.startHour && hour < phase.endHour) {
                return phase;
            }
        }
        return DEFAULT;
    }
}
