package com.ewsmon.service.core.notify;

import com.ewsmon.model.AlertEventType;
import com.ewsmon.model.ProbeOutcome;
import com.ewsmon.model.Target;
import com.ewsmon.service.core.alert.Alert;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Rendered form of an {@link Alert}: the card title, subtitle and facts for operators and the JSON payload for
 * customer webhooks. Both channels show the same status, latency and local time values.
 */
public record AlertMessage(
        AlertEventType type,
        long targetId,
        String title,
        String subtitle,
        Map<String, String> facts,
        Map<String, Object> webhookPayload) {

    static final String SUBTITLE = "State change detected by EWS Monitoring";
    static final String NO_STATUS = "timeout";
    static final String NO_VALUE = "-";

    private static final DateTimeFormatter LOCAL_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd hh:mm:ss a 'ET'", Locale.ENGLISH);

    public static AlertMessage from(Alert alert, ZoneId zone) {
        Target target = alert.target();
        ProbeOutcome outcome = alert.outcome();
        String status = outcome.httpStatus() != null ? String.valueOf(outcome.httpStatus()) : NO_STATUS;
        String latency = outcome.durationMs() != null ? "%.0f ms".formatted(outcome.durationMs()) : NO_VALUE;
        String time = LOCAL_TIME.format(alert.at().atZone(zone));
        String environment = target.environment().label();

        Map<String, String> facts = new LinkedHashMap<>();
        facts.put("Service", target.name());
        facts.put("Environment", environment);
        facts.put("URL", target.url().isBlank() ? NO_VALUE : target.url());
        facts.put("HTTP Status", status);
        facts.put("Last Latency", latency);
        facts.put("Time", time);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event_type", alert.type().wireValue());
        payload.put("service", target.name());
        payload.put("environment", environment);
        payload.put("url", target.url());
        payload.put("http_status", status);
        payload.put("last_latency_ms", outcome.durationMs());
        payload.put("time", time);

        String subtitle = alert.type() == AlertEventType.UP ? SUBTITLE + " (stable)" : SUBTITLE;
        return new AlertMessage(
                alert.type(),
                target.id(),
                target.name() + " " + alert.type().headline(),
                subtitle,
                Collections.unmodifiableMap(facts),
                Collections.unmodifiableMap(payload));
    }
}
