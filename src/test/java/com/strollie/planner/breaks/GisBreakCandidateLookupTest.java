package com.strollie.planner.breaks;

import com.strollie.planner.client.GisApiClient;
import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Poi;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("GisBreakCandidateLookup")
class GisBreakCandidateLookupTest {

    private static final GeoPoint HERE = GeoPoint.of(56.3269, 44.0042);

    @Test
    @DisplayName("Cafés are searched around the point with the radius in metres")
    void testFindNearby() {
        GisApiClient gis = mock(GisApiClient.class);
        PlannerProperties properties = new PlannerProperties();
        Poi cafe = Poi.builder().id("c").name("Кофейня").category("cafe").location(HERE).build();
        when(gis.searchItems(anyString(), anyString(), eq(HERE), anyInt(), anyInt())).thenReturn(Mono.just(List.of(cafe)));

        StepVerifier.create(new GisBreakCandidateLookup(gis, properties).findNearby(HERE, 0.6))
                .expectNext(List.of(cafe))
                .verifyComplete();
        verify(gis).searchItems(GisBreakCandidateLookup.CAFE_QUERY, "cafe", HERE, 600,
                properties.getBreaks().getLookupLimit());
    }

    @Test
    @DisplayName("Tiny radius is raised to one hundred metres")
    void testMinimumRadius() {
        GisApiClient gis = mock(GisApiClient.class);
        PlannerProperties properties = new PlannerProperties();
        when(gis.searchItems(anyString(), anyString(), eq(HERE), anyInt(), anyInt())).thenReturn(Mono.just(List.of()));

        new GisBreakCandidateLookup(gis, properties).findNearby(HERE, 0.01).block();
        verify(gis).searchItems(GisBreakCandidateLookup.CAFE_QUERY, "cafe", HERE, 100,
                properties.getBreaks().getLookupLimit());
    }
}
