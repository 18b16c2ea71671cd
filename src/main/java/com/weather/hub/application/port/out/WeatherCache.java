package com.weather.hub.application.port.out;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import com.weather.hub.domain.entity.Forecast;
import com.weather.hub.domain.entity.Zone;
import com.weather.hub.domain.valueobject.ZoneId;

/**
 * Secondary (outbound) port: time-limited output cache.
 * <p>
 * Implementations must never fail a request: an unavailable backend reads as
 * a miss and writes are dropped.
 * </p>
 */
public interface WeatherCache {

    /**
     * @return cached zone list, or empty on a miss
     */
    Optional<List<Zone>> getZones();

    /**
     * Stores the zone list with a fixed expiration.
     */
    void putZones(List<Zone> zones, Duration ttl);

    /**
     * @return cached forecast for the zone, or empty on a miss
     */
    Optional<List<Forecast>> getForecast(ZoneId zoneId);

    /**
     * Stores a zone forecast with a fixed expiration.
     */
    void putForecast(ZoneId zoneId, List<Forecast> forecasts, Duration ttl);
}
