package com.strollie.planner.service;

import com.strollie.planner.cache.RoutingCache;
import com.strollie.planner.client.GisApiClient;
import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.exception.ExternalServiceUnavailableException;
import com.strollie.planner.exception.StartLocationUnresolvedException;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.util.Deadline;
import com.strollie.planner.util.RetryingCall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Start point of a walk: explicit coordinates, or an address geocoded inside the city.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StartLocationResolver {

    static final String OUTSIDE_AREA = "Точка старта находится за пределами Нижнего Новгорода";

    private final GisApiClient gisApiClient;
    private final RoutingCache cache;
    private final PlannerProperties properties;

    public GeoPoint resolve(Double lat, Double lon, String address, Deadline deadline) {
        if (lat != null && lon != null) {
            return validate(lat, lon);
        }
        if (address == null || address.isBlank()) {
            throw new StartLocationUnresolvedException("Укажите координаты или адрес точки старта");
        }

        String key = address.trim().toLowerCase(Locale.ROOT);
        Optional<GeoPoint> cached = cache.getGeocode(key);
        if (cached.isPresent()) {
            log.debug("Geocode cache hit for '{}'", address);
            return cached.get();
        }

        Optional<GeoPoint> found;
        try {
            found = RetryingCall.withRetry("geocode",
                            gisApiClient.geocode(address.trim(), properties.getCity()),
                            properties.getRetry().toPolicy(),
                            deadline.cap(properties.getCallTimeout()))
                    .blockOptional()
                    .flatMap(result -> result);
        } catch (RuntimeException e) {
            log.error("Geocoding of '{}' failed: {}", address, e.getMessage());
            throw new ExternalServiceUnavailableException("2gis-geocoder",
                    "Сервис геокодирования временно недоступен", e);
        }

        GeoPoint point = found.orElseThrow(() ->
                new StartLocationUnresolvedException("Не удалось найти адрес: " + address.trim()));
        requireInsideArea(point);
        cache.putGeocode(key, point);
        log.info("Geocoded '{}' -> {}, {}", address, point.lat(), point.lon());
        return point;
    }

    public GeoPoint validate(double lat, double lon) {
        GeoPoint point = GeoPoint.of(lat, lon);
        requireInsideArea(point);
        return point;
    }

    private void requireInsideArea(GeoPoint point) {
        if (!properties.getServiceArea().contains(point)) {
            throw new StartLocationUnresolvedException(OUTSIDE_AREA);
        }
    }
}
