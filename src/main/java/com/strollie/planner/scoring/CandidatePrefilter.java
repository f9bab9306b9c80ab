package com.strollie.planner.scoring;

import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.geo.GeoMath;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Intensity;
import com.strollie.planner.model.Poi;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Bounds the working set by proximity to the start before any scoring happens.
 */
@Component
@RequiredArgsConstructor
public class CandidatePrefilter {

    static final double NEAR_FACTOR = 1.25;

    private final PlannerProperties properties;

    public List<Poi> prefilter(List<Poi> pois, GeoPoint start, Intensity intensity) {
        return prefilter(pois, start, intensity, properties.getMaxCandidates());
    }

    public List<Poi> prefilter(List<Poi> pois, GeoPoint start, Intensity intensity, int maxCandidates) {
        if (pois.size() <= maxCandidates) {
            return pois;
        }
        double nearRadius = intensity.getSearchRadiusKm() * NEAR_FACTOR;
        List<Ranked> near = new ArrayList<>();
        List<Ranked> far = new ArrayList<>();
        for (Poi poi : pois) {
            double distance = GeoMath.haversineKm(start, poi.getLocation());
            (distance <= nearRadius ? near : far).add(new Ranked(poi, distance));
        }
        Comparator<Ranked> byDistance = Comparator.comparingDouble(Ranked::distanceKm);
        near.sort(byDistance);
        far.sort(byDistance);

        List<Poi> selected = new ArrayList<>(maxCandidates);
        for (Ranked ranked : near) {
            if (selected.size() == maxCandidates) {
                break;
            }
            selected.add(ranked.poi());
        }
        for (Ranked ranked : far) {
            if (selected.size() == maxCandidates) {
                break;
            }
            selected.add(ranked.poi());
        }
        return selected;
    }

    private record Ranked(Poi poi, double distanceKm) {
    }
}
