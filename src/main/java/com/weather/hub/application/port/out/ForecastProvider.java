package com.weather.hub.application.port.out;

import java.util.List;

import com.weather.hub.domain.entity.Forecast;
import com.weather.hub.domain.valueobject.ZoneId;

/**
 * Secondary (outbound) port: upstream forecast source.
 * <p>
 * Implementations make one call per invocation; no retries.
 * </p>
 */
public interface ForecastProvider {

    /**
     * @param zoneId zone to fetch
     * @return forecast periods in source order
     * @throws com.weather.hub.domain.exception.ZoneNotFoundException        if the zone does not exist
     * @throws com.weather.hub.domain.exception.ForecastUnavailableException on any other failure
     */
    List<Forecast> fetchForecast(ZoneId zoneId);
}
