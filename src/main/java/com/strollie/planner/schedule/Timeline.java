package com.strollie.planner.schedule;

import java.time.LocalDateTime;

/**
 * Time cursor of a walk. It only moves forward.
 */
public final class Timeline {

    private final LocalDateTime start;
    private LocalDateTime cursor;

    public Timeline(LocalDateTime start) {
        this.start = start;
        this.cursor = start;
    }

    public LocalDateTime start() {
        return start;
    }

    public LocalDateTime now() {
        return cursor;
    }

    public LocalDateTime peekAfter(double minutes) {
        return cursor.plusSeconds(Math.round(Math.max(0, minutes) * 60));
    }

    public LocalDateTime advance(double minutes) {
        cursor = peekAfter(minutes);
        return cursor;
    }

    public LocalDateTime advanceTo(LocalDateTime moment) {
        if (moment.isAfter(cursor)) {
            cursor = moment;
        }
        return cursor;
    }
}
