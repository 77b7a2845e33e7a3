package com.ewsmon.service.core.probe;

import com.ewsmon.service.core.config.EwsmonProperties.EnvironmentCredentials;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/** Values substituted into a template for one target in one cycle. */
record ProbeContext(LocalDate today, EnvironmentCredentials credentials) {

    String isoDate() {
        return today.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }
}
