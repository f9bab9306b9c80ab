package com.strollie.planner.model;

public record GeoPoint(double lat, double lon) {

    public static GeoPoint of(double lat, double lon) {
        return new GeoPoint(lat, lon);
    }

}
