package com.ewsmon.service.core.alert;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Per-target alerting memory kept for the lifetime of the process.
 *
 * <p>Not persisted: a restart starts from an empty tracker, so the first cycle after start-up only re-establishes
 * the baseline. Only the scheduling thread touches it, one cycle at a time, so no synchronisation is needed.
 */
@Component
public class AlertTracker {

    private final Map<Long, Entry> entries = new HashMap<>();

    public Optional<Boolean> lastKnownUp(long targetId) {
        Entry entry = entries.get(targetId);
        return entry == null ? Optional.empty() : Optional.of(entry.lastKnownUp);
    }

    public boolean isPendingRecovery(long targetId) {
        Entry entry = entries.get(targetId);
        return entry != null && entry.pendingRecovery;
    }

    public Optional<Instant> lastDownAlertAt(long targetId) {
        Entry entry = entries.get(targetId);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.lastDownAlertAt);
    }

    void observe(long targetId, boolean up) {
        entry(targetId).lastKnownUp = up;
    }

    void setPendingRecovery(long targetId, boolean pending) {
        entry(targetId).pendingRecovery = pending;
    }

    void markDownAlertSent(long targetId, Instant at) {
        entry(targetId).lastDownAlertAt = at;
    }

    private Entry entry(long targetId) {
        return entries.computeIfAbsent(targetId, id -> new Entry());
    }

    private static final class Entry {
        private boolean lastKnownUp;
        private boolean pendingRecovery;
        private Instant lastDownAlertAt;
    }
}
