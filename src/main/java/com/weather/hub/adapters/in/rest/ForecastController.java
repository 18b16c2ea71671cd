package com.weather.hub.adapters.in.rest;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.weather.hub.application.port.in.GetForecastUseCase;
import com.weather.hub.domain.entity.Forecast;
import com.weather.hub.domain.valueobject.ZoneId;

/**
 * Zone forecast endpoint, proxying the NWS zone forecast.
 * <p>
 * Usage: GET /forecast/{zoneId}, e.g. GET /forecast/WAZ315
 * </p>
 */
@RestController
@RequestMapping("/forecast")
public class ForecastController {

    private static final Logger log = LoggerFactory.getLogger(ForecastController.class);

    private final GetForecastUseCase getForecastUseCase;

    public ForecastController(GetForecastUseCase getForecastUseCase) {
        this.getForecastUseCase = getForecastUseCase;
    }

    @GetMapping("/{zoneId}")
    public ResponseEntity<List<Forecast>> getForecast(@PathVariable String zoneId) {
        ZoneId id = ZoneId.parse(zoneId);
        try {
            MDC.put("zoneId", id.value());
            List<Forecast> forecasts = getForecastUseCase.getForecast(id);
            log.debug("action=forecast_served zoneId={} periods={}", id, forecasts.size());
            return ResponseEntity.ok(forecasts);
        } finally {
            MDC.remove("zoneId");
        }
    }
}
