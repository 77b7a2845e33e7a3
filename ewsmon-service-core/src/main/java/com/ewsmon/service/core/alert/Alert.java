package com.ewsmon.service.core.alert;

import com.ewsmon.model.AlertEventType;
import com.ewsmon.model.ProbeOutcome;
import com.ewsmon.model.Target;
import java.time.Instant;
import java.util.Objects;

/** An availability change about to be announced, with the probe that triggered it. */
public record Alert(AlertEventType type, Target target, ProbeOutcome outcome, Instant at) {

    public Alert {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(at, "at");
    }
}
