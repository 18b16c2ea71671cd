package com.weather.hub.adapters.out.redis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.weather.hub.bootstrap.config.WeatherHubProperties;
import com.weather.hub.domain.entity.Forecast;
import com.weather.hub.domain.entity.Zone;
import com.weather.hub.domain.valueobject.ZoneId;

@ExtendWith(MockitoExtension.class)
class RedisWeatherCacheTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisWeatherCache cache;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        cache = new RedisWeatherCache(redisTemplate, new ObjectMapper(), new WeatherHubProperties());
    }

    @Test
    void putZones_writesJsonWithTtl_andGetZonesReadsItBack() {
        Zone seattle = new Zone("WAZ315", "City of Seattle", "WA", List.of("KSEA"));
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);

        cache.putZones(List.of(seattle), Duration.ofHours(1));

        verify(valueOperations).set(eq("weatherhub:zones"), json.capture(), eq(Duration.ofHours(1)));
        assertThat(json.getValue()).contains("\"observation_stations\":[\"KSEA\"]");

        when(valueOperations.get("weatherhub:zones")).thenReturn(json.getValue());
        assertThat(cache.getZones()).hasValueSatisfying(zones -> {
            assertThat(zones).containsExactly(seattle);
            assertThat(zones.get(0).getName()).isEqualTo("City of Seattle");
        });
    }

    @Test
    void getForecast_readsEntryUnderZoneKey() {
        String json = "[{\"number\":1,\"name\":\"Tonight\",\"temperature\":45,"
            + "\"wind_speed\":\"5 mph\",\"detailed_forecast\":\"Rain likely.\"}]";
        when(valueOperations.get("weatherhub:forecast:WAZ315")).thenReturn(json);

        assertThat(cache.getForecast(ZoneId.parse("WAZ315"))).hasValueSatisfying(forecasts -> {
            Forecast tonight = forecasts.get(0);
            assertThat(tonight.getName()).isEqualTo("Tonight");
            assertThat(tonight.getTemperature()).isEqualTo(45);
            assertThat(tonight.getWindSpeed()).isEqualTo("5 mph");
        });
    }

    @Test
    void get_missingKey_isMiss() {
        when(valueOperations.get("weatherhub:zones")).thenReturn(null);

        assertThat(cache.getZones()).isEmpty();
    }

    @Test
    void get_corruptEntry_isMiss() {
        when(valueOperations.get("weatherhub:forecast:WAZ315")).thenReturn("{not json");

        assertThat(cache.getForecast(ZoneId.parse("WAZ315"))).isEmpty();
    }

    @Test
    void get_redisDown_isMiss() {
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("refused"));

        assertThat(cache.getZones()).isEmpty();
    }

    @Test
    void put_redisDown_isDropped() {
        doThrow(new RedisConnectionFailureException("refused"))
            .when(valueOperations).set(anyString(), anyString(), eq(Duration.ofMinutes(15)));

        cache.putForecast(ZoneId.parse("WAZ315"),
            List.of(Forecast.narrative(1, "Tonight", "Rain likely.")), Duration.ofMinutes(15));

        verify(valueOperations).set(eq("weatherhub:forecast:WAZ315"), anyString(), eq(Duration.ofMinutes(15)));
    }
}
