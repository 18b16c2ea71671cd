package com.weather.hub.domain.exception;

/**
 * The upstream forecast call failed (transport error, 5xx, unreadable body).
 */
public class ForecastUnavailableException extends RuntimeException {

    private final String zoneId;

    public ForecastUnavailableException(String zoneId, String message, Throwable cause) {
        super(message, cause);
        this.zoneId = zoneId;
    }

    public String getZoneId() {
        return zoneId;
    }
}
