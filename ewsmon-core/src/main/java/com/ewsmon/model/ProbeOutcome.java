package com.ewsmon.model;

/**
 * Classified result of a single probe before it is stored.
 *
 * @param ok         {@code true} only for an HTTP 200 answer
 * @param httpStatus status code when a response was received
 * @param durationMs elapsed wall time of the call, absent when no call was attempted
 * @param error      diagnostic text for failed probes
 */
public record ProbeOutcome(boolean ok, Integer httpStatus, Double durationMs, String error) {

    public static ProbeOutcome success(int httpStatus, double durationMs) {
        return new ProbeOutcome(true, httpStatus, durationMs, null);
    }

    public static ProbeOutcome failure(Integer httpStatus, Double durationMs, String error) {
        return new ProbeOutcome(false, httpStatus, durationMs, error);
    }

    /** Failure recorded without any network attempt. */
    public static ProbeOutcome notAttempted(String error) {
        return new ProbeOutcome(false, null, null, error);
    }
}
