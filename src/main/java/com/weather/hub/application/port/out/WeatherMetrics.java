package com.weather.hub.application.port.out;

import java.time.Duration;

import com.weather.hub.domain.valueobject.CacheResult;

/**
 * Secondary (outbound) port: application metrics.
 * <p>
 * Keeps the application services free of any metrics library.
 * </p>
 */
public interface WeatherMetrics {

    /** Counts a forecast request, cached or not. */
    void forecastRequested();

    /**
     * Records how long an upstream forecast fetch took.
     *
     * @param outcome {@code success} or a failure reason
     */
    void forecastFetched(Duration duration, String outcome);

    /** Counts a failed request by reason ({@code upstream}, {@code not_found}, {@code simulated}). */
    void requestFailed(String reason);

    /** Counts a cache lookup against the named cache. */
    void cacheLookup(String cacheName, CacheResult result);
}
