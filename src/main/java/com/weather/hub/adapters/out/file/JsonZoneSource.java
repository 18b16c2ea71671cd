package com.weather.hub.adapters.out.file;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.weather.hub.application.port.out.ZoneSource;
import com.weather.hub.bootstrap.config.WeatherHubProperties;
import com.weather.hub.domain.entity.Zone;

/**
 * ZoneSource backed by a GeoJSON snapshot of {@code /zones?type=forecast}.
 * <p>
 * Reads {@code features[].properties} and maps id, name, state and
 * observationStations. Features that cannot form a valid zone (missing id or
 * name) are skipped with a warning; the rest of the snapshot is still served.
 * </p>
 */
@Component
public class JsonZoneSource implements ZoneSource {

    private static final Logger log = LoggerFactory.getLogger(JsonZoneSource.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String location;

    public JsonZoneSource(ResourceLoader resourceLoader,
            ObjectMapper objectMapper,
            WeatherHubProperties properties) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.location = properties.getZones().getResource();
    }

    @Override
    public List<Zone> loadZones() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.error("action=zone_snapshot_missing location={}", location);
            throw new IllegalStateException("Zone snapshot not found: " + location);
        }

        ZonesDocument document;
        try (InputStream in = resource.getInputStream()) {
            document = objectMapper.readValue(in, ZonesDocument.class);
        } catch (IOException e) {
            log.error("action=zone_snapshot_parse_error location={} error={}", location, e.getMessage());
            throw new IllegalStateException("Failed to read zone snapshot: " + location, e);
        }

        List<Zone> zones = new ArrayList<>();
        if (document.getFeatures() == null) {
            log.warn("action=zone_snapshot_empty location={}", location);
            return zones;
        }

        int skipped = 0;
        for (Feature feature : document.getFeatures()) {
            Properties props = feature.getProperties();
            if (props == null) {
                skipped++;
                continue;
            }
            try {
                zones.add(props.toDomain());
            } catch (IllegalArgumentException e) {
                skipped++;
                log.warn("action=zone_feature_invalid id={} error={}", props.getId(), e.getMessage());
            }
        }

        log.debug("action=zone_snapshot_read location={} zones={} skipped={}", location, zones.size(), skipped);
        return zones;
    }

    // ─────────────────── Inner DTO Classes ───────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ZonesDocument {

        @JsonProperty("features")
        private List<Feature> features;

        public List<Feature> getFeatures() {
            return features;
        }

        public void setFeatures(List<Feature> features) {
            this.features = features;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Feature {

        @JsonProperty("properties")
        private Properties properties;

        public Properties getProperties() {
            return properties;
        }

        public void setProperties(Properties properties) {
            this.properties = properties;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Properties {

        @JsonProperty("id")
        private String id;

        @JsonProperty("name")
        private String name;

        @JsonProperty("state")
        private String state;

        @JsonProperty("observationStations")
        private List<String> observationStations;

        public Zone toDomain() {
            return new Zone(id, name, state, observationStations);
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
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
}
