package com.strollie.planner.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Selection ranking of one POI for one request. Independent of the final visit order.
 */
@Value
@Builder(toBuilder = true)
public class CandidateScore {
    Poi poi;
    double embeddingComponent;
    double contextualComponent;
    double popularityComponent;
    double baseScore;
    double diversityPenalty;
    double finalScore;
    double distanceKm;
    /** Arrival time projected for scoring only; the schedule decides the real one. */
    LocalDateTime projectedArrival;

    public String category() {
        return poi.getCategory() == null || poi.getCategory().isBlank() ? "unknown" : poi.getCategory();
    }
}
