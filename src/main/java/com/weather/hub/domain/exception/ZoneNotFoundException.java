package com.weather.hub.domain.exception;

import java.util.NoSuchElementException;

/**
 * The upstream weather service does not know the requested zone.
 */
public class ZoneNotFoundException extends NoSuchElementException {

    private final String zoneId;

    public ZoneNotFoundException(String zoneId) {
        super("No forecast zone found for id: " + zoneId);
        this.zoneId = zoneId;
    }

    public String getZoneId() {
        return zoneId;
    }
}
