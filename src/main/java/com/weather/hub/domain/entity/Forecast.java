package com.weather.hub.domain.entity;

import java.util.Objects;

/**
 * One forecast period for a zone ("Tonight", "Monday", ...).
 * <p>
 * Zone forecasts from the NWS API carry only the narrative text; gridpoint
 * forecasts also carry temperature and wind. Those fields are therefore
 * nullable, while name and narrative are always present.
 * </p>
 */
public final class Forecast {

    private final int number;
    private final String name;
    private final Integer temperature;
    private final String temperatureUnit;
    private final String windSpeed;
    private final String windDirection;
    private final String shortForecast;
    private final String detailedForecast;

    public Forecast(int number, String name, Integer temperature, String temperatureUnit,
            String windSpeed, String windDirection, String shortForecast, String detailedForecast) {
        if (number < 1) {
            throw new IllegalArgumentException("number must be >= 1, got: " + number);
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }

        this.number = number;
        this.name = name;
        this.temperature = temperature;
        this.temperatureUnit = temperatureUnit;
        this.windSpeed = windSpeed;
        this.windDirection = windDirection;
        this.shortForecast = shortForecast;
        this.detailedForecast = detailedForecast != null ? detailedForecast : "";
    }

    /**
     * Narrative-only period, the shape returned for zone forecasts.
     */
    public static Forecast narrative(int number, String name, String detailedForecast) {
        return new Forecast(number, name, null, null, null, null, null, detailedForecast);
    }

    public int getNumber() {
        return number;
    }

    public String getName() {
        return name;
    }

    public Integer getTemperature() {
        return temperature;
    }

    public String getTemperatureUnit() {
        return temperatureUnit;
    }

    public String getWindSpeed() {
        return windSpeed;
    }

    public String getWindDirection() {
        return windDirection;
    }

    public String getShortForecast() {
        return shortForecast;
    }

    public String getDetailedForecast() {
        return detailedForecast;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Forecast that = (Forecast) o;
        return number == that.number
                && Objects.equals(name, that.name)
                && Objects.equals(temperature, that.temperature)
                && Objects.equals(temperatureUnit, that.temperatureUnit)
                && Objects.equals(windSpeed, that.windSpeed)
                && Objects.equals(windDirection, that.windDirection)
                && Objects.equals(shortForecast, that.shortForecast)
                && Objects.equals(detailedForecast, that.detailedForecast);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, name, temperature, temperatureUnit, windSpeed, windDirection,
                shortForecast, detailedForecast);
    }

    @Override
    public String toString() {
        return "Forecast{number=" + number + ", name='" + name + "', temperature=" + temperature + "}";
    }
}
