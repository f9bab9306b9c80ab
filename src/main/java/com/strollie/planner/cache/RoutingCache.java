package com.strollie.planner.cache;

import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Leg;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory TTL cache for routed legs and geocoded addresses. Writes are idempotent overwrites.
 */
@Slf4j
@Component
public class RoutingCache {

    private final Map<String, CacheEntry<Leg>> legs = new ConcurrentHashMap<>();
    private final Map<String, CacheEntry<GeoPoint>> geocodes = new ConcurrentHashMap<>();

    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();

    private final Duration ttl;
    private final int maxLegs;
    private final int maxGeocodes;
    private final Clock clock;

    public RoutingCache(PlannerProperties properties, Clock clock) {
        this.ttl = properties.getCache().getTtl();
        this.maxLegs = properties.getCache().getMaxLegs();
        this.maxGeocodes = properties.getCache().getMaxGeocodes();
        this.clock = clock;
    }

    public Optional<Leg> getLeg(GeoPoint from, GeoPoint to) {
        return getFromCache(legs, legKey(from, to));
    }

    public void putLeg(Leg leg) {
        putToCache(legs, legKey(leg.getFrom(), leg.getTo()), leg, maxLegs);
    }

    public Optional<GeoPoint> getGeocode(String address) {
        return getFromCache(geocodes, normalizeKey(address));
    }

    public void putGeocode(String address, GeoPoint point) {
        putToCache(geocodes, normalizeKey(address), point, maxGeocodes);
    }

    private <T> Optional<T> getFromCache(Map<String, CacheEntry<T>> cache, String key) {
        CacheEntry<T> entry = cache.get(key);

        if (entry == null) {
            cacheMisses.incrementAndGet();
            return Optional.empty();
        }

        if (entry.isExpired(clock.instant())) {
            cache.remove(key, entry);
            cacheMisses.incrementAndGet();
            return Optional.empty();
        }

        cacheHits.incrementAndGet();
        return Optional.of(entry.value());
    }

    private <T> void putToCache(Map<String, CacheEntry<T>> cache, String key, T value, int maxEntries) {
        Instant now = clock.instant();
        if (!cache.containsKey(key) && cache.size() >= maxEntries) {
            evict(cache, now);
        }
        cache.put(key, new CacheEntry<>(value, now.plus(ttl)));
    }

    /**
     * Drops expired entries; when none expired, drops the entry closest to expiry.
     */
    private <T> void evict(Map<String, CacheEntry<T>> cache, Instant now) {
        int before = cache.size();
        cache.entrySet().removeIf(e -> e.getValue().isExpired(now));
        if (cache.size() == before) {
            cache.entrySet().stream()
                    .min(Comparator.comparing(e -> e.getValue().expiresAt()))
                    .ifPresent(e -> cache.remove(e.getKey(), e.getValue()));
        }
        log.debug("Cache eviction: {} -> {} entries", before, cache.size());
    }

    static String legKey(GeoPoint from, GeoPoint to) {
        return String.format(Locale.ROOT, "%.5f,%.5f->%.5f,%.5f", from.lat(), from.lon(), to.lat(), to.lon());
    }

    private String normalizeKey(String key) {
        return key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
    }

    public CacheStats getStats() {
        return new CacheStats(
                legs.size(),
                geocodes.size(),
                cacheHits.get(),
                cacheMisses.get()
        );
    }

    public void clearAll() {
        legs.clear();
        geocodes.clear();
        cacheHits.set(0);
        cacheMisses.set(0);
        log.info("Cache cleared");
    }

    private record CacheEntry<T>(T value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return now.isAfter(expiresAt);
        }
    }

    public record CacheStats(int legEntries, int geocodeEntries, long hits, long misses) {
        public double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0 : (double) hits / total;
        }
    }

}
