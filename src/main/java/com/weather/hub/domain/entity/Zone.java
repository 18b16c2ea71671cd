package com.weather.hub.domain.entity;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * NWS forecast zone.
 * <p>
 * Immutable. Identity is the zone key: two zones with the same key are the
 * same zone even if their names differ between snapshots.
 * </p>
 *
 * <p>
 * <b>Invariants:</b>
 * </p>
 * <ul>
 * <li>key is non-null, non-blank</li>
 * <li>name is non-null, non-blank</li>
 * <li>state is never null (blank for marine and offshore zones)</li>
 * <li>observationStations is never null (empty list if not provided)</li>
 * </ul>
 */
public final class Zone {

    private final String key;
    private final String name;
    private final String state;
    private final List<String> observationStations;

    public Zone(String key, String name, String state, List<String> observationStations) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank for zone " + key);
        }

        this.key = key;
        this.name = name;
        this.state = state != null ? state : "";
        this.observationStations = observationStations != null
                ? List.copyOf(observationStations)
                : Collections.emptyList();
    }

    // ─────────────────── Behavior Methods ───────────────────

    /**
     * Zones without observation stations have no live data behind them and are
     * not served.
     *
     * @return true if at least one observation station is listed
     */
    public boolean hasObservationStations() {
        return !observationStations.isEmpty();
    }

    /**
     * @param stateCode two-letter state code, any case
     * @return true if this zone belongs to the given state
     */
    public boolean inState(String stateCode) {
        return stateCode != null && state.equalsIgnoreCase(stateCode.trim());
    }

    /**
     * Case-insensitive substring match on the zone name.
     */
    public boolean nameContains(String fragment) {
        if (fragment == null || fragment.isBlank()) {
            return true;
        }
        return name.toLowerCase(Locale.ROOT).contains(fragment.trim().toLowerCase(Locale.ROOT));
    }

    // ─────────────────── Getters ───────────────────

    public String getKey() {
        return key;
    }

    public String getName() {
        return name;
    }

    public String getState() {
        return state;
    }

    public List<String> getObservationStations() {
        return observationStations;
    }

    // ─────────────────── Identity ───────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Zone zone = (Zone) o;
        return Objects.equals(key, zone.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key);
    }

    @Override
    public String toString() {
        return "Zone{key='" + key + "', name='" + name + "', state='" + state
                + "', stations=" + observationStations.size() + "}";
    }
}
