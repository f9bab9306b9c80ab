package com.strollie.planner.geo;

import com.strollie.planner.model.GeoPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GeoMath")
class GeoMathTest {

    private static final GeoPoint KREMLIN = GeoPoint.of(56.3287, 44.0020);
    private static final GeoPoint CHKALOV_STAIRS = GeoPoint.of(56.3309, 44.0093);

    @Test
    @DisplayName("Haversine is symmetric")
    void testHaversineSymmetric() {
        assertEquals(GeoMath.haversineKm(KREMLIN, CHKALOV_STAIRS),
                GeoMath.haversineKm(CHKALOV_STAIRS, KREMLIN), 1e-12);
    }

    @Test
    @DisplayName("Distance to itself is zero")
    void testHaversineZero() {
        assertEquals(0.0, GeoMath.haversineKm(KREMLIN, KREMLIN), 1e-12);
    }

    @Test
    @DisplayName("One degree of latitude is about 111 km")
    void testHaversineOneDegree() {
        assertEquals(111.19, GeoMath.haversineKm(56.0, 44.0, 57.0, 44.0), 0.05);
    }

    @Test
    @DisplayName("Walking minutes follow the speed, non-positive speed uses the default")
    void testWalkingMinutes() {
        assertEquals(60.0, GeoMath.walkingMinutes(4.5, 4.5), 1e-9);
        assertEquals(30.0, GeoMath.walkingMinutes(2.5, 5.0), 1e-9);
        assertEquals(GeoMath.walkingMinutes(1.0, GeoMath.DEFAULT_WALK_SPEED_KMH), GeoMath.walkingMinutes(1.0, 0), 1e-9);
    }

    @Test
    @DisplayName("Distance matrix is symmetric with a zero diagonal")
    void testDistanceMatrix() {
        double[][] matrix = GeoMath.distanceMatrix(List.of(KREMLIN, CHKALOV_STAIRS, GeoPoint.of(56.3255, 43.9895)));
        assertEquals(3, matrix.length);
        for (int i = 0; i < 3; i++) {
            assertEquals(0.0, matrix[i][i]);
            for (int j = 0; j < 3; j++) {
                assertEquals(matrix[i][j], matrix[j][i], 1e-12);
            }
        }
        assertTrue(matrix[0][1] > 0);
    }
}
