package com.weather.hub.application.service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.weather.hub.application.port.in.GetForecastUseCase;
import com.weather.hub.application.port.out.ForecastProvider;
import com.weather.hub.application.port.out.WeatherCache;
import com.weather.hub.application.port.out.WeatherMetrics;
import com.weather.hub.domain.entity.Forecast;
import com.weather.hub.domain.exception.ForecastUnavailableException;
import com.weather.hub.domain.exception.SimulatedFailureException;
import com.weather.hub.domain.exception.ZoneNotFoundException;
import com.weather.hub.domain.valueobject.CacheResult;
import com.weather.hub.domain.valueobject.ZoneId;

/**
 * Zone forecast lookup through the output cache.
 * <p>
 * Only cache misses reach the upstream provider. Those calls are numbered by
 * a shared counter; when failure injection is on, every n-th call fails with
 * {@link SimulatedFailureException} before contacting upstream.
 * </p>
 *
 * <p>
 * <b>Error Handling:</b> upstream failures are logged, counted and rethrown.
 * Nothing is cached on failure. No retries.
 * </p>
 */
public class ForecastService implements GetForecastUseCase {

    private static final Logger log = Logger.getLogger(ForecastService.class.getName());

    static final String CACHE_NAME = "forecast";

    private final ForecastProvider forecastProvider;
    private final WeatherCache weatherCache;
    private final WeatherMetrics metrics;
    private final Duration cacheTtl;
    private final int failureInterval;

    private final AtomicLong upstreamCalls = new AtomicLong();

    /**
     * @param failureInterval inject a failure on every n-th upstream call; 0 disables
     */
    public ForecastService(ForecastProvider forecastProvider,
            WeatherCache weatherCache,
            WeatherMetrics metrics,
            Duration cacheTtl,
            int failureInterval) {
        if (forecastProvider == null)
            throw new IllegalArgumentException("forecastProvider cannot be null");
        if (weatherCache == null)
            throw new IllegalArgumentException("weatherCache cannot be null");
        if (metrics == null)
            throw new IllegalArgumentException("metrics cannot be null");
        if (cacheTtl == null || cacheTtl.isNegative() || cacheTtl.isZero())
            throw new IllegalArgumentException("cacheTtl must be positive");
        if (failureInterval < 0)
            throw new IllegalArgumentException("failureInterval must be >= 0");

        this.forecastProvider = forecastProvider;
        this.weatherCache = weatherCache;
        this.metrics = metrics;
        this.cacheTtl = cacheTtl;
        this.failureInterval = failureInterval;
    }

    @Override
    public List<Forecast> getForecast(ZoneId zoneId) {
        String zone = zoneId.value();
        metrics.forecastRequested();

        Optional<List<Forecast>> cached = weatherCache.getForecast(zoneId);
        if (cached.isPresent()) {
            metrics.cacheLookup(CACHE_NAME, CacheResult.HIT);
            log.fine(String.format("action=forecast_cache_hit zoneId=%s periods=%d", zone, cached.get().size()));
            return cached.get();
        }
        metrics.cacheLookup(CACHE_NAME, CacheResult.MISS);

        long callNumber = upstreamCalls.incrementAndGet();
        if (failureInterval > 0 && callNumber % failureInterval == 0) {
            metrics.requestFailed("simulated");
            log.warning(String.format("action=forecast_simulated_failure zoneId=%s call=%d", zone, callNumber));
            throw new SimulatedFailureException(callNumber);
        }

        Instant startTime = Instant.now();
        try {
            List<Forecast> forecasts = forecastProvider.fetchForecast(zoneId);
            Duration latency = Duration.between(startTime, Instant.now());
            metrics.forecastFetched(latency, "success");

            weatherCache.putForecast(zoneId, forecasts, cacheTtl);
            log.info(String.format("action=forecast_fetched zoneId=%s periods=%d call=%d latency=%dms",
                    zone, forecasts.size(), callNumber, latency.toMillis()));
            return forecasts;

        } catch (ZoneNotFoundException e) {
            metrics.forecastFetched(Duration.between(startTime, Instant.now()), "not_found");
            metrics.requestFailed("not_found");
            log.warning(String.format("action=forecast_zone_not_found zoneId=%s", zone));
            throw e;

        } catch (ForecastUnavailableException e) {
            metrics.forecastFetched(Duration.between(startTime, Instant.now()), "error");
            metrics.requestFailed("upstream");
            log.log(Level.SEVERE, String.format(
                    "action=forecast_fetch_error zoneId=%s call=%d error=%s", zone, callNumber, e.getMessage()), e);
            throw e;
        }
    }

    /**
     * @return number of calls that reached the upstream stage, including injected failures
     */
    long upstreamCallCount() {
        return upstreamCalls.get();
    }
}
