package com.strollie.planner.geo;

import com.strollie.planner.model.GeoPoint;

import java.util.List;

public final class GeoMath {

    public static final double EARTH_RADIUS_KM = 6371.0;
    public static final double DEFAULT_WALK_SPEED_KMH = 4.5;

    private GeoMath() {
    }

    /**
     * Great-circle distance in kilometres.
     */
    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);
        double sinPhi = Math.sin(dPhi / 2);
        double sinLambda = Math.sin(dLambda / 2);
        double h = sinPhi * sinPhi + Math.cos(phi1) * Math.cos(phi2) * sinLambda * sinLambda;
        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
        return EARTH_RADIUS_KM * c;
    }

    public static double haversineKm(GeoPoint a, GeoPoint b) {
        return haversineKm(a.lat(), a.lon(), b.lat(), b.lon());
    }

    public static double walkingMinutes(double distanceKm, double speedKmh) {
        double speed = speedKmh > 0 ? speedKmh : DEFAULT_WALK_SPEED_KMH;
        return distanceKm / speed * 60.0;
    }

    /**
     * Symmetric distance matrix over the given points, index 0 being the first point.
     */
    public static double[][] distanceMatrix(List<GeoPoint> points) {
        int n = points.size();
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = haversineKm(points.get(i), points.get(j));
                matrix[i][j] = d;
                matrix[j][i] = d;
            }
        }
        return matrix;
    }
}
