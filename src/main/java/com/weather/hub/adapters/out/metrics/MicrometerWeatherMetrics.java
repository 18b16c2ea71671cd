package com.weather.hub.adapters.out.metrics;

import java.time.Duration;

import org.springframework.stereotype.Component;

import com.weather.hub.application.port.out.WeatherMetrics;
import com.weather.hub.domain.valueobject.CacheResult;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Micrometer implementation of the WeatherMetrics outbound port.
 * <p>
 * Meter names follow Micrometer's dot convention; the OTLP and Prometheus
 * registries render them as {@code forecast_requests_total},
 * {@code forecast_request_duration_seconds}, {@code failed_requests_total},
 * {@code cache_hits_total} and {@code cache_misses_total}.
 * </p>
 */
@Component
public class MicrometerWeatherMetrics implements WeatherMetrics {

    static final String METER_SCOPE = "NwsManagerMetrics";

    static final String FORECAST_REQUESTS = "forecast.requests";
    static final String FORECAST_DURATION = "forecast.request.duration";
    static final String FAILED_REQUESTS = "failed.requests";
    static final String CACHE_HITS = "cache.hits";
    static final String CACHE_MISSES = "cache.misses";

    private final MeterRegistry meterRegistry;

    public MicrometerWeatherMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void forecastRequested() {
        Counter.builder(FORECAST_REQUESTS)
                .description("Forecast requests received")
                .tag("meter", METER_SCOPE)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void forecastFetched(Duration duration, String outcome) {
        Timer.builder(FORECAST_DURATION)
                .description("Upstream forecast fetch duration")
                .tag("meter", METER_SCOPE)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(duration);
    }

    @Override
    public void requestFailed(String reason) {
        Counter.builder(FAILED_REQUESTS)
                .description("Failed requests by reason")
                .tag("meter", METER_SCOPE)
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void cacheLookup(String cacheName, CacheResult result) {
        String name = result == CacheResult.HIT ? CACHE_HITS : CACHE_MISSES;
        Counter.builder(name)
                .description("Cache lookups by outcome")
                .tag("meter", METER_SCOPE)
                .tag("cache", cacheName)
                .register(meterRegistry)
                .increment();
    }
}
