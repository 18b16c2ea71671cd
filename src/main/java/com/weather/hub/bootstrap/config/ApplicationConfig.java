package com.weather.hub.bootstrap.config;

import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.weather.hub.application.port.out.ForecastProvider;
import com.weather.hub.application.port.out.WeatherCache;
import com.weather.hub.application.port.out.WeatherMetrics;
import com.weather.hub.application.port.out.ZoneRepository;
import com.weather.hub.application.port.out.ZoneSource;
import com.weather.hub.application.service.ForecastService;
import com.weather.hub.application.service.ZoneCatalogService;

/**
 * Application-level bean configuration.
 * <p>
 * Wires the framework-free application services with their adapter
 * implementations via constructor injection.
 * </p>
 */
@Configuration
@EnableConfigurationProperties(WeatherHubProperties.class)
public class ApplicationConfig {

    /**
     * Tunes Boot's ObjectMapper, shared by MVC, the cache adapter and the NWS client.
     * - ISO-8601 dates (JavaTimeModule is registered by Boot)
     * - Lenient deserialization (NWS payloads carry many unused fields)
     * Boot's own customizers still apply, so ProblemDetail extension members
     * stay top-level in error bodies.
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer objectMapperCustomizer() {
        return builder -> builder.featuresToDisable(
                SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * RestTemplate for the NWS API. Built from Boot's builder so outbound calls
     * get HTTP client observations (metrics + spans). NWS rejects requests
     * without a User-Agent.
     */
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, WeatherHubProperties properties) {
        WeatherHubProperties.Nws nws = properties.getNws();
        return builder
                .setConnectTimeout(nws.getConnectTimeout())
                .setReadTimeout(nws.getReadTimeout())
                .defaultHeader(HttpHeaders.USER_AGENT, nws.getUserAgent())
                .build();
    }

    @Bean
    public ZoneCatalogService zoneCatalogService(
            ZoneSource zoneSource,
            WeatherCache weatherCache,
            ZoneRepository zoneRepository,
            WeatherMetrics weatherMetrics,
            WeatherHubProperties properties) {
        return new ZoneCatalogService(
                zoneSource, weatherCache, zoneRepository, weatherMetrics,
                properties.getZones().getCacheTtl(),
                properties.getPersistence().isEnabled());
    }

    @Bean
    public ForecastService forecastService(
            ForecastProvider forecastProvider,
            WeatherCache weatherCache,
            WeatherMetrics weatherMetrics,
            WeatherHubProperties properties) {
        return new ForecastService(
                forecastProvider, weatherCache, weatherMetrics,
                properties.getForecast().getCacheTtl(),
                properties.getForecast().getFailureInterval());
    }
}
