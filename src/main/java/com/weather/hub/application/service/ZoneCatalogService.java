package com.weather.hub.application.service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.weather.hub.application.port.in.GetZonesUseCase;
import com.weather.hub.application.port.out.WeatherCache;
import com.weather.hub.application.port.out.WeatherMetrics;
import com.weather.hub.application.port.out.ZoneRepository;
import com.weather.hub.application.port.out.ZoneSource;
import com.weather.hub.domain.entity.Zone;
import com.weather.hub.domain.valueobject.CacheResult;

/**
 * Zone catalog: cache-or-load over the bundled zone snapshot.
 * <p>
 * On a cache miss:
 * <ol>
 * <li><b>Load</b>: read the raw snapshot</li>
 * <li><b>Clean</b>: drop zones without observation stations, keep the first
 * occurrence of every key</li>
 * <li><b>Mirror</b>: upsert into the relational store (if enabled)</li>
 * <li><b>Cache</b>: store with a fixed expiration</li>
 * </ol>
 * </p>
 *
 * <p>
 * <b>Error Handling:</b>
 * </p>
 * <ul>
 * <li>ZoneSource errors → rethrow (nothing to serve)</li>
 * <li>ZoneRepository errors → log + continue (mirror is secondary)</li>
 * </ul>
 *
 * <p>
 * Concurrent misses may each load the snapshot; the last write wins in the
 * cache and the upsert keeps the mirror consistent.
 * </p>
 */
public class ZoneCatalogService implements GetZonesUseCase {

    private static final Logger log = Logger.getLogger(ZoneCatalogService.class.getName());

    static final String CACHE_NAME = "zones";

    private final ZoneSource zoneSource;
    private final WeatherCache weatherCache;
    private final ZoneRepository zoneRepository;
    private final WeatherMetrics metrics;
    private final Duration cacheTtl;
    private final boolean persistenceEnabled;

    public ZoneCatalogService(ZoneSource zoneSource,
            WeatherCache weatherCache,
            ZoneRepository zoneRepository,
            WeatherMetrics metrics,
            Duration cacheTtl,
            boolean persistenceEnabled) {
        if (zoneSource == null)
            throw new IllegalArgumentException("zoneSource cannot be null");
        if (weatherCache == null)
            throw new IllegalArgumentException("weatherCache cannot be null");
        if (zoneRepository == null)
            throw new IllegalArgumentException("zoneRepository cannot be null");
        if (metrics == null)
            throw new IllegalArgumentException("metrics cannot be null");
        if (cacheTtl == null || cacheTtl.isNegative() || cacheTtl.isZero())
            throw new IllegalArgumentException("cacheTtl must be positive");

        this.zoneSource = zoneSource;
        this.weatherCache = weatherCache;
        this.zoneRepository = zoneRepository;
        this.metrics = metrics;
        this.cacheTtl = cacheTtl;
        this.persistenceEnabled = persistenceEnabled;
    }

    @Override
    public List<Zone> getZones() {
        Optional<List<Zone>> cached = weatherCache.getZones();
        if (cached.isPresent()) {
            metrics.cacheLookup(CACHE_NAME, CacheResult.HIT);
            log.fine(String.format("action=zones_cache_hit count=%d", cached.get().size()));
            return cached.get();
        }

        metrics.cacheLookup(CACHE_NAME, CacheResult.MISS);
        Instant startTime = Instant.now();

        List<Zone> raw = zoneSource.loadZones();
        List<Zone> zones = clean(raw);

        if (persistenceEnabled) {
            mirror(zones);
        }

        weatherCache.putZones(zones, cacheTtl);

        log.info(String.format(
                "action=zones_loaded rawCount=%d servedCount=%d ttl=%s persisted=%s latency=%dms",
                raw.size(), zones.size(), cacheTtl, persistenceEnabled,
                Duration.between(startTime, Instant.now()).toMillis()));
        return zones;
    }

    @Override
    public List<Zone> findZones(String state, String nameFragment) {
        boolean anyState = state == null || state.isBlank();
        List<Zone> matches = new ArrayList<>();
        for (Zone zone : getZones()) {
            if ((anyState || zone.inState(state)) && zone.nameContains(nameFragment)) {
                matches.add(zone);
            }
        }
        return matches;
    }

    // ─────────────────── Private Steps ───────────────────

    /**
     * Drops station-less zones and duplicate keys. First occurrence wins so
     * the result keeps source order.
     */
    static List<Zone> clean(List<Zone> raw) {
        Map<String, Zone> byKey = new LinkedHashMap<>();
        int skippedNoStations = 0;
        for (Zone zone : raw) {
            if (!zone.hasObservationStations()) {
                skippedNoStations++;
                continue;
            }
            byKey.putIfAbsent(zone.getKey(), zone);
        }
        if (skippedNoStations > 0) {
            log.fine(String.format("action=zones_without_stations_skipped count=%d", skippedNoStations));
        }
        return List.copyOf(byKey.values());
    }

    /**
     * Mirror failures must not fail the request: the zones are still served
     * and cached.
     */
    private void mirror(List<Zone> zones) {
        try {
            int rows = zoneRepository.saveAll(zones);
            long mirrored = zoneRepository.countAll();
            log.info(String.format("action=zones_persisted count=%d rows=%d mirrored=%d",
                    zones.size(), rows, mirrored));
        } catch (Exception e) {
            metrics.requestFailed("persistence");
            log.log(Level.SEVERE, String.format(
                    "action=zones_persist_error count=%d error=%s", zones.size(), e.getMessage()), e);
        }
    }
}
