package com.strollie.planner.catalog;

import com.strollie.planner.client.GisApiClient;
import com.strollie.planner.config.ApiKeysConfig;
import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.exception.ExternalServiceUnavailableException;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Poi;
import com.strollie.planner.service.CategoryCacheService;
import com.strollie.planner.util.Deadline;
import com.strollie.planner.util.RetryingCall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Balanced 2GIS search: one query per category so that every chosen interest is represented.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GisPoiCatalog implements PoiCatalog {

    static final int DEFAULT_PER_CATEGORY = 10;

    private final GisApiClient gisApiClient;
    private final CategoryCacheService categoryService;
    private final ApiKeysConfig apiConfig;
    private final PlannerProperties properties;

    @Override
    public Mono<List<Poi>> query(List<String> categoryIds, GeoPoint center, Deadline deadline) {
        if (categoryIds == null || categoryIds.isEmpty()) {
            return Mono.just(List.of());
        }
        int perCategory = Optional.ofNullable(apiConfig.getGis())
                .map(ApiKeysConfig.Gis::getMaxPlacesPerCategory)
                .filter(n -> n > 0)
                .orElse(DEFAULT_PER_CATEGORY);
        int radius = Optional.ofNullable(apiConfig.getGis())
                .map(ApiKeysConfig.Gis::getSearchRadiusMeters)
                .filter(n -> n > 0)
                .orElse(5000);
        AtomicInteger failures = new AtomicInteger();

        log.info(">>> Balanced search: {} categories, {} items per category", categoryIds.size(), perCategory);

        return Flux.fromIterable(categoryIds)
                .flatMapSequential(category -> RetryingCall.withRetry("catalog:" + category,
                                gisApiClient.searchItems(categoryService.searchQueryFor(category), category,
                                        center, radius, perCategory),
                                properties.getRetry().toPolicy(),
                                deadline.cap(properties.getCallTimeout()))
                        .onErrorResume(e -> {
                            failures.incrementAndGet();
                            log.warn("Failed to search category '{}': {}", category, e.toString());
                            return Mono.just(List.of());
                        }))
                .collectList()
                .flatMap(perCategoryResults -> {
                    if (failures.get() == categoryIds.size()) {
                        return Mono.error(new ExternalServiceUnavailableException("2gis-catalog",
                                "Каталог мест 2GIS недоступен", null));
                    }
                    Map<String, Poi> unique = new LinkedHashMap<>();
                    perCategoryResults.forEach(list -> list.forEach(p -> unique.putIfAbsent(p.getId(), p)));
                    log.info(">>> Catalog returned {} unique places", unique.size());
                    return Mono.just(List.copyOf(unique.values()));
                });
    }
}
