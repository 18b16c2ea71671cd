package com.weather.hub.application.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.weather.hub.application.port.out.ForecastProvider;
import com.weather.hub.application.port.out.WeatherCache;
import com.weather.hub.application.port.out.WeatherMetrics;
import com.weather.hub.domain.entity.Forecast;
import com.weather.hub.domain.exception.ForecastUnavailableException;
import com.weather.hub.domain.exception.SimulatedFailureException;
import com.weather.hub.domain.exception.ZoneNotFoundException;
import com.weather.hub.domain.valueobject.CacheResult;
import com.weather.hub.domain.valueobject.ZoneId;

@ExtendWith(MockitoExtension.class)
class ForecastServiceTest {

    private static final Duration TTL = Duration.ofMinutes(15);
    private static final ZoneId SEATTLE = ZoneId.parse("WAZ315");
    private static final List<Forecast> PERIODS = List.of(
        Forecast.narrative(1, "Tonight", "Rain likely. Lows around 45."),
        Forecast.narrative(2, "Monday", "Showers. Highs in the mid 50s."));

    @Mock
    private ForecastProvider forecastProvider;

    @Mock
    private WeatherCache weatherCache;

    @Mock
    private WeatherMetrics metrics;

    private ForecastService service;

    @BeforeEach
    void setUp() {
        service = new ForecastService(forecastProvider, weatherCache, metrics, TTL, 5);
    }

    @Test
    void getForecast_cacheHit_skipsUpstreamAndCounter() {
        when(weatherCache.getForecast(SEATTLE)).thenReturn(Optional.of(PERIODS));

        List<Forecast> forecasts = service.getForecast(SEATTLE);

        assertThat(forecasts).isEqualTo(PERIODS);
        verify(metrics).forecastRequested();
        verify(metrics).cacheLookup("forecast", CacheResult.HIT);
        verify(forecastProvider, never()).fetchForecast(any());
        assertThat(service.upstreamCallCount()).isZero();
    }

    @Test
    void getForecast_cacheMiss_fetchesRecordsAndCaches() {
        when(weatherCache.getForecast(SEATTLE)).thenReturn(Optional.empty());
        when(forecastProvider.fetchForecast(SEATTLE)).thenReturn(PERIODS);

        List<Forecast> forecasts = service.getForecast(SEATTLE);

        assertThat(forecasts).extracting(Forecast::getName).containsExactly("Tonight", "Monday");
        verify(metrics).cacheLookup("forecast", CacheResult.MISS);
        verify(metrics).forecastFetched(any(Duration.class), eq("success"));
        verify(weatherCache).putForecast(SEATTLE, PERIODS, TTL);
        assertThat(service.upstreamCallCount()).isEqualTo(1);
    }

    @Test
    void getForecast_everyFifthUpstreamCallFails() {
        when(weatherCache.getForecast(SEATTLE)).thenReturn(Optional.empty());
        when(forecastProvider.fetchForecast(SEATTLE)).thenReturn(PERIODS);

        List<Integer> failedCalls = new ArrayList<>();
        for (int call = 1; call <= 10; call++) {
            try {
                service.getForecast(SEATTLE);
            } catch (SimulatedFailureException e) {
                failedCalls.add(call);
                assertThat(e.getCallNumber()).isEqualTo(call);
            }
        }

        assertThat(failedCalls).containsExactly(5, 10);
        verify(forecastProvider, times(8)).fetchForecast(SEATTLE);
        verify(metrics, times(2)).requestFailed("simulated");
        verify(metrics, times(10)).forecastRequested();
    }

    @Test
    void getForecast_zeroInterval_neverInjectsFailure() {
        service = new ForecastService(forecastProvider, weatherCache, metrics, TTL, 0);
        when(weatherCache.getForecast(SEATTLE)).thenReturn(Optional.empty());
        when(forecastProvider.fetchForecast(SEATTLE)).thenReturn(PERIODS);

        for (int call = 1; call <= 10; call++) {
            service.getForecast(SEATTLE);
        }

        verify(forecastProvider, times(10)).fetchForecast(SEATTLE);
        verify(metrics, never()).requestFailed(any());
    }

    @Test
    void getForecast_upstreamFailure_isCountedAndRethrown() {
        ForecastUnavailableException upstream =
            new ForecastUnavailableException("WAZ315", "NWS forecast request failed with status 503", null);
        when(weatherCache.getForecast(SEATTLE)).thenReturn(Optional.empty());
        when(forecastProvider.fetchForecast(SEATTLE)).thenThrow(upstream);

        assertThatThrownBy(() -> service.getForecast(SEATTLE)).isSameAs(upstream);

        verify(metrics).requestFailed("upstream");
        verify(metrics).forecastFetched(any(Duration.class), eq("error"));
        verify(weatherCache, never()).putForecast(any(), anyList(), any());
    }

    @Test
    void getForecast_unknownZone_isCountedAndRethrown() {
        ZoneId unknown = ZoneId.parse("XXZ999");
        when(weatherCache.getForecast(unknown)).thenReturn(Optional.empty());
        when(forecastProvider.fetchForecast(unknown)).thenThrow(new ZoneNotFoundException("XXZ999"));

        assertThatThrownBy(() -> service.getForecast(unknown)).isInstanceOf(ZoneNotFoundException.class);

        verify(metrics).requestFailed("not_found");
        verify(metrics).forecastFetched(any(Duration.class), eq("not_found"));
        verify(weatherCache, never()).putForecast(any(), anyList(), any());
    }

    @Test
    void constructor_rejectsNegativeInterval() {
        assertThatThrownBy(() -> new ForecastService(forecastProvider, weatherCache, metrics, TTL, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
