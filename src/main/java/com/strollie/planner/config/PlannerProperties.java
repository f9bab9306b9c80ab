package com.strollie.planner.config;

import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.util.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Tunables of the planning engine ({@code planner.*}).
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "planner")
public class PlannerProperties {

    private String city = "Нижний Новгород";
    private String defaultZone = "Europe/Moscow";
    private int maxCandidates = 60;
    private int maxConsecutiveCategory = 2;
    private int maxWaitMinutes = 45;
    private double walkSpeedKmh = 4.5;
    private int sequencerMaxIterations = 100;
    private Duration requestTimeout = Duration.ofSeconds(25);
    private Duration callTimeout = Duration.ofSeconds(8);
    private Duration weatherTimeout = Duration.ofSeconds(3);
    private int legConcurrency = 4;
    private Retry retry = new Retry();
    private Cache cache = new Cache();
    private Breaks breaks = new Breaks();
    private ServiceArea serviceArea = new ServiceArea();
    private StartWindow startWindow = new StartWindow();

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private Duration maxBackoff = Duration.ofSeconds(2);

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff);
        }
    }

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofMinutes(30);
        private int maxLegs = 5000;
        private int maxGeocodes = 1000;
    }

    @Data
    public static class Breaks {
        private boolean enabledByDefault = true;
        private int defaultIntervalMinutes = 90;
        private double searchRadiusKm = 0.6;
        private int lookupLimit = 5;
    }

    @Data
    public static class ServiceArea {
        private double minLat = 56.20;
        private double maxLat = 56.40;
        private double minLon = 43.75;
        private double maxLon = 44.15;

        public boolean contains(GeoPoint point) {
            return point.lat() >= minLat && point.lat() <= maxLat
                    && point.lon() >= minLon && point.lon() <= maxLon;
        }
    }

    @Data
    public static class StartWindow {
        private int earliestHour = 9;
        private int latestHour = 22;
        /** Minutes past {@code latestHour} a walk may still finish at. */
        private int finishGraceMinutes = 30;
    }
}
