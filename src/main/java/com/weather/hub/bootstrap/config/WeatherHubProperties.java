package com.weather.hub.bootstrap.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "weatherhub")
public class WeatherHubProperties {

    private final Zones zones = new Zones();
    private final Forecast forecast = new Forecast();
    private final Nws nws = new Nws();
    private final Redis redis = new Redis();
    private final Persistence persistence = new Persistence();

    public Zones getZones() {
        return zones;
    }

    public Forecast getForecast() {
        return forecast;
    }

    public Nws getNws() {
        return nws;
    }

    public Redis getRedis() {
        return redis;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public static class Zones {
        private String resource = "classpath:data/zones.json";
        private Duration cacheTtl = Duration.ofHours(1);

        public String getResource() {
            return resource;
        }

        public void setResource(String resource) {
            this.resource = resource;
        }

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }
    }

    public static class Forecast {
        private Duration cacheTtl = Duration.ofMinutes(15);
        private int failureInterval = 5;

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }

        public int getFailureInterval() {
            return failureInterval;
        }

        public void setFailureInterval(int failureInterval) {
            this.failureInterval = failureInterval;
        }
    }

    public static class Nws {
        private String baseUrl = "https://api.weather.gov";
        private String userAgent = "(weather-hub, ops@weatherhub.example)";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    public static class Redis {
        private String keyPrefix = "weatherhub:";

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    public static class Persistence {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
