package com.ewsmon.service.core.cycle;

import com.ewsmon.service.core.config.EwsmonProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives {@link ProbeCycleRunner} with a fixed delay, so the next cycle starts only after the previous one has
 * finished. Losing the database altogether is fatal and stops the process; other failures are left to the
 * scheduler's error handler and the next cycle runs as usual.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ProbeCycleScheduler {

    private final ProbeCycleRunner runner;
    private final ProcessTerminator terminator;
    private final EwsmonProperties properties;

    @Value("${ewsmon.scheduler.enabled:true}")
    private boolean enabled = true;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        log.info(
                "Worker started enabled={} interval={} probeTimeout={} cooldown={}",
                enabled,
                properties.getPollInterval(),
                properties.getProbe().getTimeout(),
                properties.getAlerts().getCooldown());
    }

    @Scheduled(fixedDelayString = "#{@ewsmonProperties.pollInterval.toMillis()}")
    public void scheduledRun() {
        if (!enabled) {
            return;
        }
        try {
            runner.runCycle();
        } catch (DataAccessResourceFailureException ex) {
            log.error("Storage unreachable, stopping monitor", ex);
            terminator.terminate(1);
        }
    }
}
