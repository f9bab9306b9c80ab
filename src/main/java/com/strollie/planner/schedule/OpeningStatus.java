package com.strollie.planner.schedule;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class OpeningStatus {
    /** Open now, or opening within the allowed wait. */
    boolean open;
    long waitMinutes;
    /** Bounds of the window that applies; both {@code null} when nothing opens for the rest of the day. */
    LocalDateTime opensAt;
    LocalDateTime closesAt;
    String label;
    /** {@code true} when the hours come from the place itself rather than from its category. */
    boolean exact;

    public boolean hasWindow() {
        return opensAt != null && closesAt != null;
    }
}
