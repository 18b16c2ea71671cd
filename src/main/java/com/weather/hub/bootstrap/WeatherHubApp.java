package com.weather.hub.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * WeatherHub API - Application Entry Point.
 * <p>
 * Serves NWS forecast zones and zone forecasts behind a Redis output cache,
 * mirrors zones into PostgreSQL and exports metrics and traces over OTLP.
 * </p>
 *
 * <pre>
 * Architecture: Hexagonal (Ports &amp; Adapters)
 * Endpoints:    GET /zones, GET /forecast/{zoneId}, GET /health, GET /alive
 * Tech:         Spring Boot 3.2 + Redis + PostgreSQL + Micrometer/OpenTelemetry
 * </pre>
 */
@SpringBootApplication(scanBasePackages = "com.weather.hub")
public class WeatherHubApp {

    public static void main(String[] args) {
        SpringApplication.run(WeatherHubApp.class, args);
    }
}
