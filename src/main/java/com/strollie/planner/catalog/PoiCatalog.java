package com.strollie.planner.catalog;

import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Poi;
import com.strollie.planner.util.Deadline;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Source of candidate places for a request.
 */
public interface PoiCatalog {

    /**
     * Places of the given categories around {@code center}, without duplicates.
     */
    Mono<List<Poi>> query(List<String> categoryIds, GeoPoint center, Deadline deadline);
}
