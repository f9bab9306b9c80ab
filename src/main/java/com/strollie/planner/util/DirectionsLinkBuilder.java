package com.strollie.planner.util;

import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.PlannedStop;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class DirectionsLinkBuilder {

    private DirectionsLinkBuilder() {
    }

    /**
     * Walking directions in the 2GIS web app: the start point followed by every stop.
     * Stops with a 2GIS object id are linked to the object, the rest are plain coordinates.
     */
    public static String build2GisLink(GeoPoint start, List<PlannedStop> stops) {
        List<String> points = new ArrayList<>();
        if (start != null) {
            points.add(formatPoint(start.lon(), start.lat(), null));
        }
        for (PlannedStop stop : stops) {
            if (stop.getLocation() == null) {
                continue;
            }
            points.add(formatPoint(stop.getLocation().lon(), stop.getLocation().lat(), objectId(stop.getPoiId())));
        }
        String pointsEnc = URLEncoder.encode(String.join("|", points), StandardCharsets.UTF_8);
        return String.format("https://2gis.ru/directions/tab/pedestrian/points/%s", pointsEnc);
    }

    static String objectId(String poiId) {
        if (poiId == null) {
            return null;
        }
        String head = poiId.split("_", 2)[0];
        return head.matches("\\d+") ? head : null;
    }

    private static String formatPoint(double lon, double lat, String id) {
        String coordinates = String.format(Locale.US, "%.6f,%.6f", lon, lat);
        return id == null ? coordinates : coordinates + ";" + id;
    }
}
