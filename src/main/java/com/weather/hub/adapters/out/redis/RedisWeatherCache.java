package com.weather.hub.adapters.out.redis;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.weather.hub.application.port.out.WeatherCache;
import com.weather.hub.bootstrap.config.WeatherHubProperties;
import com.weather.hub.domain.entity.Forecast;
import com.weather.hub.domain.entity.Zone;
import com.weather.hub.domain.valueobject.ZoneId;

/**
 * Redis implementation of the WeatherCache outbound port.
 * <p>
 * Key pattern: {@code {prefix}zones} and {@code {prefix}forecast:{zoneId}}
 * TTL: supplied per write
 * Serialization: JSON via Jackson
 * </p>
 * <p>
 * Redis errors and unreadable entries are logged and read as misses; failed
 * writes are logged and dropped.
 * </p>
 */
@Component
public class RedisWeatherCache implements WeatherCache {

    private static final Logger log = LoggerFactory.getLogger(RedisWeatherCache.class);

    private static final TypeReference<List<ZoneDto>> ZONE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<ForecastDto>> FORECAST_LIST = new TypeReference<>() {
    };

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisWeatherCache(StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            WeatherHubProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = properties.getRedis().getKeyPrefix();
    }

    @Override
    public Optional<List<Zone>> getZones() {
        return read(zonesKey(), ZONE_LIST, dtos -> {
            List<Zone> zones = new ArrayList<>(dtos.size());
            for (ZoneDto dto : dtos) {
                zones.add(dto.toDomain());
            }
            return List.copyOf(zones);
        });
    }

    @Override
    public void putZones(List<Zone> zones, Duration ttl) {
        List<ZoneDto> dtos = new ArrayList<>(zones.size());
        for (Zone zone : zones) {
            dtos.add(ZoneDto.fromDomain(zone));
        }
        write(zonesKey(), dtos, ttl);
    }

    @Override
    public Optional<List<Forecast>> getForecast(ZoneId zoneId) {
        return read(forecastKey(zoneId), FORECAST_LIST, dtos -> {
            List<Forecast> forecasts = new ArrayList<>(dtos.size());
            for (ForecastDto dto : dtos) {
                forecasts.add(dto.toDomain());
            }
            return List.copyOf(forecasts);
        });
    }

    @Override
    public void putForecast(ZoneId zoneId, List<Forecast> forecasts, Duration ttl) {
        List<ForecastDto> dtos = new ArrayList<>(forecasts.size());
        for (Forecast forecast : forecasts) {
            dtos.add(ForecastDto.fromDomain(forecast));
        }
        write(forecastKey(zoneId), dtos, ttl);
    }

    // ─────────────────── Private Helpers ───────────────────

    private <T, R> Optional<R> read(String key, TypeReference<T> type, Function<T, R> toDomain) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(key);
        } catch (DataAccessException e) {
            log.warn("action=cache_read_error key={} error={}", key, e.getMessage());
            return Optional.empty();
        }

        if (json == null) {
            log.debug("action=cache_miss key={}", key);
            return Optional.empty();
        }

        try {
            return Optional.of(toDomain.apply(objectMapper.readValue(json, type)));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("action=cache_entry_unreadable key={} error={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void write(String key, Object value, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("action=cache_serialize_error key={} error={}", key, e.getMessage());
            throw new IllegalStateException("Failed to serialize cache entry: " + key, e);
        }

        try {
            redisTemplate.opsForValue().set(key, json, ttl);
            log.debug("action=cache_stored key={} ttl={}", key, ttl);
        } catch (DataAccessException e) {
            log.warn("action=cache_write_error key={} error={}", key, e.getMessage());
        }
    }

    String zonesKey() {
        return keyPrefix + "zones";
    }

    String forecastKey(ZoneId zoneId) {
        return keyPrefix + "forecast:" + zoneId.value();
    }

    // ─────────────────── Inner DTOs ───────────────────

    public static class ZoneDto {

        @JsonProperty("key")
        private String key;

        @JsonProperty("name")
        private String name;

        @JsonProperty("state")
        private String state;

        @JsonProperty("observation_stations")
        private List<String> observationStations;

        public ZoneDto() {
        } // Jackson

        public static ZoneDto fromDomain(Zone zone) {
            ZoneDto dto = new ZoneDto();
            dto.key = zone.getKey();
            dto.name = zone.getName();
            dto.state = zone.getState();
            dto.observationStations = zone.getObservationStations();
            return dto;
        }

        public Zone toDomain() {
            return new Zone(key, name, state, observationStations);
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getState() {
            return state;
        }

        public void setState(String state) {
            this.state = state;
        }

        public List<String> getObservationStations() {
            return observationStations;
        }

        public void setObservationStations(List<String> observationStations) {
            this.observationStations = observationStations;
        }
    }

    public static class ForecastDto {

        @JsonProperty("number")
        private int number;

        @JsonProperty("name")
        private String name;

        @JsonProperty("temperature")
        private Integer temperature;

        @JsonProperty("temperature_unit")
        private String temperatureUnit;

        @JsonProperty("wind_speed")
        private String windSpeed;

        @JsonProperty("wind_direction")
        private String windDirection;

        @JsonProperty("short_forecast")
        private String shortForecast;

        @JsonProperty("detailed_forecast")
        private String detailedForecast;

        public ForecastDto() {
        } // Jackson

        public static ForecastDto fromDomain(Forecast forecast) {
            ForecastDto dto = new ForecastDto();
            dto.number = forecast.getNumber();
            dto.name = forecast.getName();
            dto.temperature = forecast.getTemperature();
            dto.temperatureUnit = forecast.getTemperatureUnit();
            dto.windSpeed = forecast.getWindSpeed();
            dto.windDirection = forecast.getWindDirection();
            dto.shortForecast = forecast.getShortForecast();
            dto.detailedForecast = forecast.getDetailedForecast();
            return dto;
        }

        public Forecast toDomain() {
            return new Forecast(number, name, temperature, temperatureUnit,
                    windSpeed, windDirection, shortForecast, detailedForecast);
        }

        public int getNumber() {
            return number;
        }

        public void setNumber(int number) {
            this.number = number;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public Integer getTemperature() {
            return temperature;
        }

        public void setTemperature(Integer temperature) {
            this.temperature = temperature;
        }

        public String getTemperatureUnit() {
            return temperatureUnit;
        }

        public void setTemperatureUnit(String temperatureUnit) {
            this.temperatureUnit = temperatureUnit;
        }

        public String getWindSpeed() {
            return windSpeed;
        }

        public void setWindSpeed(String windSpeed) {
            this.windSpeed = windSpeed;
        }

        public String getWindDirection() {
            return windDirection;
        }

        public void setWindDirection(String windDirection) {
            this.windDirection = windDirection;
        }

        public String getShortForecast() {
            return shortForecast;
        }

        public void setShortForecast(String shortForecast) {
            this.shortForecast = shortForecast;
        }

        public String getDetailedForecast() {
            return detailedForecast;
        }

        public void setDetailedForecast(String detailedForecast) {
            this.detailedForecast = detailedForecast;
        }
    }
}
