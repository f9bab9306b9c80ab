package com.strollie.planner.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder(toBuilder = true)
public class PlannedStop {
    int order;
    String poiId;
    String name;
    GeoPoint location;
    LocalDateTime arrivalTime;
    LocalDateTime leaveTime;
    int visitMinutes;
    boolean open;
    String openingHoursLabel;
    String availabilityNote;
    boolean breakStop;
    String category;
    double distanceFromPreviousKm;
}
