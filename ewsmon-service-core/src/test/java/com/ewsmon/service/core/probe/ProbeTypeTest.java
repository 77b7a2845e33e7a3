package com.ewsmon.service.core.probe;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ProbeTypeTest {

    @Test
    void fromTagIgnoresCaseAndWhitespace() {
        assertThat(ProbeType.fromTag(" Validate ")).isEqualTo(ProbeType.VALIDATE);
        assertThat(ProbeType.fromTag("SA")).isEqualTo(ProbeType.SERVICE_AVAILABILITY);
        assertThat(ProbeType.fromTag("shiptrack")).isEqualTo(ProbeType.SHIP_TRACK);
    }

    @Test
    void unknownOrMissingTagsAreUnsupported() {
        assertThat(ProbeType.fromTag("courier")).isEqualTo(ProbeType.UNSUPPORTED);
        assertThat(ProbeType.fromTag("")).isEqualTo(ProbeType.UNSUPPORTED);
        assertThat(ProbeType.fromTag(null)).isEqualTo(ProbeType.UNSUPPORTED);
        assertThat(ProbeType.UNSUPPORTED.isSupported()).isFalse();
        assertThat(ProbeType.UNSUPPORTED.templateLocation()).isNull();
    }

    @Test
    void everySupportedTypeHasTemplateOnClasspath() {
        for (ProbeType type : ProbeType.values()) {
            if (type.isSupported()) {
                assertThat(getClass().getClassLoader().getResource(type.templateLocation()))
                        .as(type.name())
                        .isNotNull();
            }
        }
    }
}
