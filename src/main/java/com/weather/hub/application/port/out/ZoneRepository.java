package com.weather.hub.application.port.out;

import java.util.List;

import com.weather.hub.domain.entity.Zone;

/**
 * Secondary (outbound) port: relational mirror of the zone catalog.
 */
public interface ZoneRepository {

    /**
     * Inserts or updates every zone, keyed by zone key.
     * Must be idempotent: saving the same list twice leaves one row per key.
     *
     * @param zones zones to upsert
     * @return number of rows affected
     */
    int saveAll(List<Zone> zones);

    /**
     * @return number of mirrored zones
     */
    long countAll();
}
