package com.ewsmon.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Availability events pushed to operators and webhook subscribers. */
public enum AlertEventType {
    DOWN("down", "DOWN"),
    UP("up", "RECOVERED");

    private final String wireValue;
    private final String headline;

    AlertEventType(String wireValue, String headline) {
        this.wireValue = wireValue;
        this.headline = headline;
    }

    /** Name used in subscription event lists and webhook payloads. */
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /** Word appended to the target name in operator card titles. */
    public String headline() {
        return headline;
    }
}
