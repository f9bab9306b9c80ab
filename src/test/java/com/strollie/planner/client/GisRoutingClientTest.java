package com.strollie.planner.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strollie.planner.config.ApiKeysConfig;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Leg;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("GisRoutingClient parsing")
class GisRoutingClientTest {

    private static final GeoPoint FROM = GeoPoint.of(56.3287, 44.0020);
    private static final GeoPoint TO = GeoPoint.of(56.3255, 43.9895);

    private final GisRoutingClient client =
            new GisRoutingClient(mock(WebClient.class), new ApiKeysConfig(), new ObjectMapper());

    @Test
    @DisplayName("Distance, duration, geometry and maneuvers are read from the first route")
    void testParseRoute() {
        String body = """
                {"status": "OK", "result": [{
                  "total_distance": 1240,
                  "total_duration": 960,
                  "maneuvers": [
                    {"comment": "Направо на Рождественскую",
                     "outcoming_path": {"distance": 800, "duration": 600, "names": ["Рождественская"],
                       "geometry": [{"selection": "LINESTRING(44.0020 56.3287, 44.0000 56.3270)"}]}},
                    {"instruction": {"text": "Прямо"},
                     "outcoming_path": {"geometry": [{"selection": "LINESTRING(44.0000 56.3270, 43.9895 56.3255)"}]}}
                  ]
                }]}
                """;
        Leg leg = client.parse(body, FROM, TO);
        assertEquals(1.24, leg.getDistanceKm(), 1e-9);
        assertEquals(16.0, leg.getDurationMinutes(), 1e-9);
        assertEquals(Leg.Source.ROUTED, leg.getSource());
        assertEquals(4, leg.getGeometry().size());
        assertEquals(GeoPoint.of(56.3287, 44.0020), leg.getGeometry().get(0));
        assertEquals(2, leg.getManeuvers().size());
        assertEquals("Рождественская", leg.getManeuvers().get(0).getStreetName());
        assertEquals("Прямо", leg.getManeuvers().get(1).getInstruction());
    }

    @Test
    @DisplayName("Missing geometry falls back to a straight segment")
    void testNoGeometry() {
        Leg leg = client.parse("{\"result\": [{\"total_distance\": 500, \"total_duration\": 400}]}", FROM, TO);
        assertEquals(List.of(FROM, TO), leg.getGeometry());
    }

    @Test
    @DisplayName("Empty result or missing totals are errors")
    void testErrors() {
        assertThrows(IllegalStateException.class,
                () -> client.parse("{\"status\": \"FAIL\", \"result\": []}", FROM, TO));
        assertThrows(IllegalStateException.class,
                () -> client.parse("{\"result\": [{\"maneuvers\": []}]}", FROM, TO));
        assertThrows(IllegalStateException.class, () -> client.parse("<html>", FROM, TO));
    }

    @Test
    @DisplayName("Line strings are read as lon/lat pairs")
    void testParseLineString() {
        assertEquals(List.of(GeoPoint.of(56.1, 44.1), GeoPoint.of(56.2, 44.2)),
                GisRoutingClient.parseLineString("LINESTRING(44.1 56.1, 44.2 56.2)"));
        assertTrue(GisRoutingClient.parseLineString("POINT(44.1 56.1)").isEmpty());
    }
}
