package com.strollie.planner.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Maneuver {
    String instruction;
    String streetName;
    double distanceMeters;
    double durationSeconds;
}
