package com.strollie.planner.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BreakPreferences {
    @Builder.Default
    boolean enabled = true;
    @Builder.Default
    int intervalMinutes = 90;
    @Builder.Default
    double searchRadiusKm = 0.6;
}
