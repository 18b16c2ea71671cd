package com.weather.hub.application.port.in;

import java.util.List;

import com.weather.hub.domain.entity.Forecast;
import com.weather.hub.domain.valueobject.ZoneId;

/**
 * Primary (inbound) port: forecast lookup for a single zone.
 */
public interface GetForecastUseCase {

    /**
     * Returns the forecast periods for a zone in source order.
     *
     * @param zoneId validated zone id
     * @return forecast periods, never null
     * @throws com.weather.hub.domain.exception.ZoneNotFoundException        if the zone is unknown upstream
     * @throws com.weather.hub.domain.exception.ForecastUnavailableException if the upstream call fails
     * @throws com.weather.hub.domain.exception.SimulatedFailureException    on an injected failure
     */
    List<Forecast> getForecast(ZoneId zoneId);
}
