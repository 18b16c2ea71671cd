package com.weather.hub.adapters.out.postgres;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.weather.hub.application.port.out.ZoneRepository;
import com.weather.hub.domain.entity.Zone;

/**
 * PostgreSQL implementation of the ZoneRepository outbound port.
 * <p>
 * Uses JDBC batch upserts keyed on zone_key, so reloading the snapshot
 * refreshes rows instead of failing on duplicates. Observation stations are
 * stored as a JSONB array.
 * </p>
 */
@Component
public class PostgresZoneRepository implements ZoneRepository {

    private static final Logger log = LoggerFactory.getLogger(PostgresZoneRepository.class);

    static final String UPSERT_ZONE_SQL = "INSERT INTO zones (zone_key, name, state, observation_stations, updated_at) "
            +
            "VALUES (?, ?, ?, ?::jsonb, ?) " +
            "ON CONFLICT (zone_key) DO UPDATE SET " +
            "name = EXCLUDED.name, state = EXCLUDED.state, " +
            "observation_stations = EXCLUDED.observation_stations, updated_at = EXCLUDED.updated_at";

    static final String COUNT_ALL_SQL = "SELECT COUNT(*) FROM zones";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public PostgresZoneRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public int saveAll(List<Zone> zones) {
        if (zones.isEmpty()) {
            return 0;
        }

        Timestamp now = Timestamp.from(Instant.now());
        List<Object[]> batch = new ArrayList<>(zones.size());
        for (Zone zone : zones) {
            batch.add(new Object[] {
                    zone.getKey(),
                    zone.getName(),
                    zone.getState(),
                    stationsJson(zone),
                    now });
        }

        int[] counts = jdbcTemplate.batchUpdate(UPSERT_ZONE_SQL, batch);
        int rows = 0;
        for (int count : counts) {
            // SUCCESS_NO_INFO (-2) still means one row written
            rows += count >= 0 ? count : 1;
        }
        log.debug("action=zones_upserted count={} rows={}", zones.size(), rows);
        return rows;
    }

    @Override
    public long countAll() {
        Long count = jdbcTemplate.queryForObject(COUNT_ALL_SQL, Long.class);
        return count != null ? count : 0;
    }

    private String stationsJson(Zone zone) {
        try {
            return objectMapper.writeValueAsString(zone.getObservationStations());
        } catch (JsonProcessingException e) {
            log.error("action=zone_serialize_error zoneKey={} error={}", zone.getKey(), e.getMessage());
            throw new IllegalStateException("Failed to serialize stations for zone: " + zone.getKey(), e);
        }
    }
}
