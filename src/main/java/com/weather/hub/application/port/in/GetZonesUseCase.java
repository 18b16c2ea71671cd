package com.weather.hub.application.port.in;

import java.util.List;

import com.weather.hub.domain.entity.Zone;

/**
 * Primary (inbound) port: zone catalog queries.
 */
public interface GetZonesUseCase {

    /**
     * Returns all servable zones, from cache when warm.
     * <p>
     * Zones without observation stations are excluded, keys are unique,
     * source order is preserved.
     * </p>
     *
     * @return zones, never null
     */
    List<Zone> getZones();

    /**
     * Returns the zones matching the optional filters. Null or blank filters
     * match everything.
     *
     * @param state        exact state code, case-insensitive
     * @param nameFragment case-insensitive substring of the zone name
     * @return matching zones in catalog order
     */
    List<Zone> findZones(String state, String nameFragment);
}
