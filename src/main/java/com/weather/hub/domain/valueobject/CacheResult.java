package com.weather.hub.domain.valueobject;

import java.util.Locale;

/**
 * Outcome of a cache lookup, used as a metric tag and in log lines.
 */
public enum CacheResult {

    HIT,
    MISS;

    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
