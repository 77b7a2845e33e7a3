package com.ewsmon.service.core.probe;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of EWS operations the monitor knows how to call.
 *
 * <p>Tags that match none of the known operations resolve to {@link #UNSUPPORTED}; such targets are still probed
 * every cycle and recorded as failures.
 */
public enum ProbeType {
    VALIDATE("validate"),
    TRACK("track"),
    FREIGHT_TRACK("freighttrack"),
    FREIGHT_ESTIMATE("freightestimate"),
    LOCATE("locate"),
    ESTIMATE("estimate"),
    PICKUP("pickup"),
    SERVICE_AVAILABILITY("sa"),
    SHIP_TRACK("shiptrack"),
    RETURN("return"),
    UNSUPPORTED(null);

    private static final Map<String, ProbeType> BY_TAG = Arrays.stream(values())
            .filter(t -> t.tag != null)
            .collect(Collectors.toUnmodifiableMap(ProbeType::tag, Function.identity()));

    private final String tag;

    ProbeType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public boolean isSupported() {
        return this != UNSUPPORTED;
    }

    /** Classpath location of the SOAP envelope template, {@code null} for {@link #UNSUPPORTED}. */
    String templateLocation() {
        return tag == null ? null : "soap/" + tag + ".xml";
    }

    public static ProbeType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return UNSUPPORTED;
        }
        return BY_TAG.getOrDefault(tag.trim().toLowerCase(Locale.ROOT), UNSUPPORTED);
    }
}
