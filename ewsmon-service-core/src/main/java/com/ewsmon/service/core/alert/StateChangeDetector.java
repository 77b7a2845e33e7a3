package com.ewsmon.service.core.alert;

import com.ewsmon.model.AlertEventType;
import com.ewsmon.service.core.config.EwsmonProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Decides whether an availability observation is worth an alert.
 *
 * <ul>
 *   <li>First observation of a target (no stored previous state): never alerts.
 *   <li>UP to DOWN: alerts immediately unless a DOWN alert for the same target went out less than the cooldown
 *       ago. Any pending recovery is abandoned.
 *   <li>DOWN to UP: no alert yet, recovery becomes pending.
 *   <li>UP while recovery is pending: second consecutive UP, alerts RECOVERED.
 * </ul>
 *
 * The cooldown clock only advances when a DOWN alert is actually emitted.
 */
@Component
@Slf4j
public class StateChangeDetector {

    private final AlertTracker tracker;
    private final Duration cooldown;

    @Autowired
    public StateChangeDetector(AlertTracker tracker, EwsmonProperties properties) {
        this(tracker, properties.getAlerts().getCooldown());
    }

    public StateChangeDetector(AlertTracker tracker, Duration cooldown) {
        this.tracker = tracker;
        this.cooldown = cooldown;
    }

    /**
     * @param previousUp latest stored state before this cycle, {@code null} when the target was never probed
     * @param currentUp  state observed in this cycle
     * @return the alert to send, if any
     */
    public Optional<AlertEventType> evaluate(long targetId, Boolean previousUp, boolean currentUp, Instant now) {
        tracker.observe(targetId, currentUp);
        if (previousUp == null) {
            return Optional.empty();
        }

        if (previousUp == currentUp) {
            if (currentUp && tracker.isPendingRecovery(targetId)) {
                tracker.setPendingRecovery(targetId, false);
                return Optional.of(AlertEventType.UP);
            }
            return Optional.empty();
        }

        if (currentUp) {
            tracker.setPendingRecovery(targetId, true);
            log.debug("Recovery pending targetId={}", targetId);
            return Optional.empty();
        }

        tracker.setPendingRecovery(targetId, false);
        Optional<Instant> lastDown = tracker.lastDownAlertAt(targetId);
        if (lastDown.isPresent() && Duration.between(lastDown.get(), now).compareTo(cooldown) < 0) {
            log.info(
                    "DOWN alert suppressed by cooldown targetId={} lastAlertAt={} cooldown={}",
                    targetId,
                    lastDown.get(),
                    cooldown);
            return Optional.empty();
        }
        tracker.markDownAlertSent(targetId, now);
        return Optional.of(AlertEventType.DOWN);
    }
}
