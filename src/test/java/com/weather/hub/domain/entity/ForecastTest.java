package com.weather.hub.domain.entity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ForecastTest {

    @Test
    void narrative_leavesGridFieldsEmpty() {
        Forecast forecast = Forecast.narrative(1, "Tonight", "Mostly cloudy. Lows around 45.");

        assertThat(forecast.getTemperature()).isNull();
        assertThat(forecast.getWindSpeed()).isNull();
        assertThat(forecast.getDetailedForecast()).isEqualTo("Mostly cloudy. Lows around 45.");
    }

    @Test
    void nullNarrative_becomesEmpty() {
        assertThat(Forecast.narrative(2, "Monday", null).getDetailedForecast()).isEmpty();
    }

    @Test
    void rejectsNonPositiveNumberAndBlankName() {
        assertThatThrownBy(() -> Forecast.narrative(0, "Tonight", "x"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Forecast.narrative(1, " ", "x"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void equality_coversEveryField() {
        Forecast today = new Forecast(1, "Today", 58, "F", "10 mph", "SW", "Light Rain", "Light rain.");

        assertThat(today).isEqualTo(new Forecast(1, "Today", 58, "F", "10 mph", "SW", "Light Rain", "Light rain."));
        assertThat(today).hasSameHashCodeAs(
            new Forecast(1, "Today", 58, "F", "10 mph", "SW", "Light Rain", "Light rain."));
        assertThat(today).isNotEqualTo(new Forecast(1, "Today", 58, "C", "10 mph", "SW", "Light Rain", "Light rain."));
        assertThat(today).isNotEqualTo(new Forecast(1, "Today", 58, "F", "10 mph", "NE", "Light Rain", "Light rain."));
        assertThat(today).isNotEqualTo(new Forecast(1, "Today", 58, "F", "10 mph", "SW", "Sunny", "Light rain."));
    }
}
