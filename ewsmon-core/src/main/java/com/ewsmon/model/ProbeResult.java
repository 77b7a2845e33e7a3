package com.ewsmon.model;

import java.time.Instant;
import java.util.Objects;

/** Stored probe row. Rows are append-only and only removed by retention pruning. */
public record ProbeResult(
        Long id, long targetId, Instant timestamp, boolean ok, Integer httpStatus, Double durationMs, String error) {

    public ProbeResult {
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static ProbeResult of(long targetId, Instant timestamp, ProbeOutcome outcome) {
        return new ProbeResult(
                null, targetId, timestamp, outcome.ok(), outcome.httpStatus(), outcome.durationMs(), outcome.error());
    }
}
