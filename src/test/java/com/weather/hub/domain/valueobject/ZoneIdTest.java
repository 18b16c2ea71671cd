package com.weather.hub.domain.valueobject;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ZoneIdTest {

    @Test
    void parse_normalizesCaseAndWhitespace() {
        assertThat(ZoneId.parse(" waz315 ").value()).isEqualTo("WAZ315");
    }

    @Test
    void parse_acceptsCountyZones() {
        assertThat(ZoneId.parse("TXC201").value()).isEqualTo("TXC201");
    }

    @Test
    void parse_rejectsMalformedIds() {
        assertThatThrownBy(() -> ZoneId.parse("WA315")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ZoneId.parse("WAX315")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ZoneId.parse("../zones")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ZoneId.parse("")).isInstanceOf(IllegalArgumentException.class);
    }
}
