package com.ewsmon.service.core.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Time sources for the monitor. Probe timestamps, cooldowns and retention all run on a UTC clock; only alert text is
 * rendered in the operator's zone ({@code ewsmon.alerts.time-zone}), which is resolved once at startup so a bad zone
 * id fails the boot instead of the first alert.
 */
@Configuration
public class ClockConfig {

    public static final String ALERT_ZONE = "alertZone";

    @Bean
    public Clock utcClock() {
        return Clock.systemUTC();
    }

    @Bean
    @Qualifier(ALERT_ZONE)
    public ZoneId alertZone(EwsmonProperties properties) {
        return ZoneId.of(properties.getAlerts().getTimeZone());
    }
}
