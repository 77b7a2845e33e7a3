package com.ewsmon.service.core.cycle;

import com.ewsmon.service.core.config.EwsmonProperties;
import com.ewsmon.service.core.repo.ProbeResultRepository;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Age-based pruning of probe rows, throttled to one run per cleanup interval. The first call after start-up always
 * runs. A failed run still resets the timer, so the next attempt waits for the regular interval.
 */
@Component
@Slf4j
public class RetentionCleaner {

    private final ProbeResultRepository results;
    private final int retentionDays;
    private final Duration interval;

    private Instant lastCleanup;

    @Autowired
    public RetentionCleaner(ProbeResultRepository results, EwsmonProperties properties) {
        this(results, properties.getRetention().getDays(), properties.getRetention().getCleanupInterval());
    }

    RetentionCleaner(ProbeResultRepository results, int retentionDays, Duration interval) {
        this.results = results;
        this.retentionDays = retentionDays;
        this.interval = interval;
    }

    /** @return rows deleted, 0 when the interval has not elapsed yet or the delete failed */
    public int maybeCleanup(Instant now) {
        if (lastCleanup != null && Duration.between(lastCleanup, now).compareTo(interval) < 0) {
            return 0;
        }
        Instant cutoff = now.minus(Duration.ofDays(retentionDays));
        try {
            int deleted = results.deleteOlderThan(cutoff);
            log.info("Cleanup deleted old probes deleted={} retentionDays={} cutoff={}", deleted, retentionDays, cutoff);
            return deleted;
        } catch (DataAccessException ex) {
            log.error("Probe retention cleanup failed, next attempt in {}", interval, ex);
            return 0;
        } finally {
            lastCleanup = now;
        }
    }
}
