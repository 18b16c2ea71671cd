package com.weather.hub.application.port.out;

import java.util.List;

import com.weather.hub.domain.entity.Zone;

/**
 * Secondary (outbound) port: raw zone snapshot.
 * <p>
 * Returns the zones exactly as the source lists them: duplicates and zones
 * without observation stations included. Cleaning is the caller's job.
 * </p>
 */
public interface ZoneSource {

    /**
     * @return all zones in source order
     * @throws IllegalStateException if the snapshot cannot be read or parsed
     */
    List<Zone> loadZones();
}
