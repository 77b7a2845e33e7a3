package com.ewsmon.service.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class ClockConfigTest {

    private final ClockConfig config = new ClockConfig();

    @Test
    void probeClockRunsInUtc() {
        assertThat(config.utcClock().getZone()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    void alertZoneDefaultsToToronto() {
        assertThat(config.alertZone(new EwsmonProperties())).isEqualTo(ZoneId.of("America/Toronto"));
    }

    @Test
    void alertZoneFollowsConfiguration() {
        EwsmonProperties properties = new EwsmonProperties();
        properties.getAlerts().setTimeZone("Europe/Paris");

        assertThat(config.alertZone(properties)).isEqualTo(ZoneId.of("Europe/Paris"));
    }

    @Test
    void unknownAlertZoneFailsFast() {
        EwsmonProperties properties = new EwsmonProperties();
        properties.getAlerts().setTimeZone("Mars/Olympus_Mons");

        assertThatThrownBy(() -> config.alertZone(properties)).isInstanceOf(DateTimeException.class);
    }
}
