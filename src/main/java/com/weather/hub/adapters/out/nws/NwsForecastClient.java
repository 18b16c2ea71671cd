package com.weather.hub.adapters.out.nws;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.weather.hub.application.port.out.ForecastProvider;
import com.weather.hub.bootstrap.config.WeatherHubProperties;
import com.weather.hub.domain.entity.Forecast;
import com.weather.hub.domain.exception.ForecastUnavailableException;
import com.weather.hub.domain.exception.ZoneNotFoundException;
import com.weather.hub.domain.valueobject.ZoneId;

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;

/**
 * ForecastProvider backed by the public NWS API.
 * <p>
 * Calls {@code GET /zones/forecast/{zoneId}/forecast} once per request and
 * maps {@code properties.periods[]} in source order. Each call runs inside an
 * {@code nws.forecast} observation, exported as a span and a timer.
 * </p>
 */
@Component
public class NwsForecastClient implements ForecastProvider {

    private static final Logger log = LoggerFactory.getLogger(NwsForecastClient.class);

    static final String OBSERVATION_NAME = "nws.forecast";
    private static final String GEO_JSON = "application/geo+json";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final ObservationRegistry observationRegistry;
    private final String baseUrl;

    public NwsForecastClient(RestTemplate restTemplate,
            ObjectMapper objectMapper,
            ObservationRegistry observationRegistry,
            WeatherHubProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.observationRegistry = observationRegistry;
        this.baseUrl = properties.getNws().getBaseUrl();
    }

    @Override
    public List<Forecast> fetchForecast(ZoneId zoneId) {
        return Observation.createNotStarted(OBSERVATION_NAME, observationRegistry)
                .lowCardinalityKeyValue("zone.type", zoneType(zoneId))
                .highCardinalityKeyValue("zone.id", zoneId.value())
                .observe(() -> fetch(zoneId));
    }

    private List<Forecast> fetch(ZoneId zoneId) {
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/zones/forecast/{zoneId}/forecast")
                .buildAndExpand(zoneId.value())
                .toUriString();

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.ACCEPT, GEO_JSON + ", application/json");

        log.debug("action=nws_request zoneId={} url={}", zoneId, url);

        String body;
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    url, HttpMethod.GET, new HttpEntity<>(headers), String.class);
            body = response.getBody();
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                throw new ZoneNotFoundException(zoneId.value());
            }
            log.error("action=nws_http_error zoneId={} status={} error={}",
                    zoneId, e.getStatusCode().value(), e.getMessage());
            throw new ForecastUnavailableException(zoneId.value(),
                    "NWS forecast request failed with status " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            log.error("action=nws_transport_error zoneId={} error={}", zoneId, e.getMessage());
            throw new ForecastUnavailableException(zoneId.value(), "NWS forecast request failed", e);
        }

        return parse(zoneId, body);
    }

    List<Forecast> parse(ZoneId zoneId, String body) {
        if (body == null || body.isBlank()) {
            throw new ForecastUnavailableException(zoneId.value(), "NWS forecast response body empty", null);
        }

        JsonNode periods;
        try {
            periods = objectMapper.readTree(body).path("properties").path("periods");
        } catch (JsonProcessingException e) {
            log.warn("action=nws_parse_error zoneId={} len={}", zoneId, body.length());
            throw new ForecastUnavailableException(zoneId.value(), "NWS forecast response unreadable", e);
        }
        if (!periods.isArray()) {
            throw new ForecastUnavailableException(zoneId.value(), "NWS forecast response missing periods", null);
        }

        List<Forecast> forecasts = new ArrayList<>(periods.size());
        int position = 0;
        for (JsonNode period : periods) {
            position++;
            try {
                forecasts.add(new Forecast(
                        period.path("number").asInt(position),
                        periodName(period, position),
                        period.path("temperature").isNumber() ? period.path("temperature").asInt() : null,
                        textOrNull(period, "temperatureUnit"),
                        textOrNull(period, "windSpeed"),
                        textOrNull(period, "windDirection"),
                        textOrNull(period, "shortForecast"),
                        period.path("detailedForecast").asText("")));
            } catch (IllegalArgumentException e) {
                // Upstream data, not the caller, is at fault
                log.warn("action=nws_invalid_period zoneId={} position={} error={}",
                        zoneId, position, e.getMessage());
                throw new ForecastUnavailableException(zoneId.value(),
                        "NWS forecast period " + position + " invalid: " + e.getMessage(), e);
            }
        }
        return forecasts;
    }

    private static String periodName(JsonNode period, int position) {
        String name = textOrNull(period, "name");
        return name != null ? name : "Period " + position;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }

    /** "Z" public zone, "C" county. */
    private static String zoneType(ZoneId zoneId) {
        return zoneId.value().charAt(2) == 'C' ? "county" : "public";
    }
}
