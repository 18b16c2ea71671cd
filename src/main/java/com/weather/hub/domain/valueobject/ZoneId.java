package com.weather.hub.domain.valueobject;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validated NWS zone identifier.
 * <p>
 * Format: two-letter state or marine area, {@code Z} (public zone) or
 * {@code C} (county), three digits. Examples: {@code WAZ315}, {@code TXC201}.
 * Input is trimmed and upper-cased before validation.
 * </p>
 */
public record ZoneId(String value) {

    private static final Pattern FORMAT = Pattern.compile("^[A-Z]{2}[CZ][0-9]{3}$");

    public ZoneId {
        if (value == null || !FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid NWS zone id: " + value);
        }
    }

    /**
     * Normalizes raw user input into a zone id.
     *
     * @throws IllegalArgumentException if the input is not a valid zone id
     */
    public static ZoneId parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Zone id cannot be blank");
        }
        return new ZoneId(raw.trim().toUpperCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return value;
    }
}
