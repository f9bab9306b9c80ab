package com.strollie.planner.util;

import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.PlannedStop;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DirectionsLinkBuilder")
class DirectionsLinkBuilderTest {

    private static final String PREFIX = "https://2gis.ru/directions/tab/pedestrian/points/";

    @Test
    @DisplayName("Start and stops are joined as lon,lat with object ids")
    void testBuildLink() {
        List<PlannedStop> stops = List.of(
                PlannedStop.builder().order(1).poiId("70000001020764757_abc")
                        .location(GeoPoint.of(56.3285, 44.0098)).build(),
                PlannedStop.builder().order(2).poiId("cafe-local")
                        .location(GeoPoint.of(56.3260, 44.0050)).build());

        String link = DirectionsLinkBuilder.build2GisLink(GeoPoint.of(56.3287, 44.0020), stops);

        assertTrue(link.startsWith(PREFIX));
        String points = URLDecoder.decode(link.substring(PREFIX.length()), StandardCharsets.UTF_8);
        assertEquals("44.002000,56.328700|44.009800,56.328500;70000001020764757|44.005000,56.326000", points);
    }

    @Test
    @DisplayName("Only numeric ids are 2GIS objects")
    void testObjectId() {
        assertEquals("123", DirectionsLinkBuilder.objectId("123_x"));
        assertEquals("123", DirectionsLinkBuilder.objectId("123"));
        assertNull(DirectionsLinkBuilder.objectId("abc_123"));
        assertNull(DirectionsLinkBuilder.objectId(null));
    }
}
