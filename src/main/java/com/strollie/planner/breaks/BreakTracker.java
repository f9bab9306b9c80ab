package com.strollie.planner.breaks;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

/**
 * Per-walk state of the break inserter.
 */
public class BreakTracker {

    private LocalDateTime lastBreak;
    private final Set<String> usedPlaceIds = new HashSet<>();

    public BreakTracker(LocalDateTime start) {
        this.lastBreak = start;
    }

    public long minutesSinceLastBreak(LocalDateTime now) {
        return Duration.between(lastBreak, now).toMinutes();
    }

    public void breakTaken(String placeId, LocalDateTime leaveTime) {
        lastBreak = leaveTime;
        if (placeId != null) {
            usedPlaceIds.add(placeId);
        }
    }

    public void exclude(String placeId) {
        if (placeId != null) {
            usedPlaceIds.add(placeId);
        }
    }

    public boolean isUsed(String placeId) {
        return placeId != null && usedPlaceIds.contains(placeId);
    }

    public LocalDateTime lastBreak() {
        return lastBreak;
    }
}
