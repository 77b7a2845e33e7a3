package com.ewsmon.service.core.cycle;

import com.ewsmon.model.AlertEventType;
import com.ewsmon.model.ProbeOutcome;
import com.ewsmon.model.ProbeResult;
import com.ewsmon.model.Target;
import com.ewsmon.service.core.alert.Alert;
import com.ewsmon.service.core.alert.StateChangeDetector;
import com.ewsmon.service.core.config.EwsmonProperties;
import com.ewsmon.service.core.notify.NotificationDispatcher;
import com.ewsmon.service.core.probe.ProbeExecutor;
import com.ewsmon.service.core.repo.ProbeResultRepository;
import com.ewsmon.service.core.repo.TargetRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * One probe cycle: snapshot the enabled targets, probe them all concurrently, then persist and evaluate the results
 * as a single step on the calling thread.
 *
 * <p>The previous-state snapshot is read before this cycle's rows are inserted, so a target's own new result never
 * feeds its own transition decision. Alerts are delivered on the {@link NotificationDispatcher} pool; the cycle waits
 * for their outcome before returning. Callers must not run two cycles at once.
 */
@Component
@Slf4j
public class ProbeCycleRunner {

    private final TargetRegistry targets;
    private final ProbeExecutor probeExecutor;
    private final ProbeResultRepository results;
    private final StateChangeDetector detector;
    private final NotificationDispatcher dispatcher;
    private final RetentionCleaner cleaner;
    private final Clock clock;
    private final ExecutorService probePool;

    @Autowired
    public ProbeCycleRunner(
            TargetRegistry targets,
            ProbeExecutor probeExecutor,
            ProbeResultRepository results,
            StateChangeDetector detector,
            NotificationDispatcher dispatcher,
            RetentionCleaner cleaner,
            Clock clock,
            EwsmonProperties properties) {
        this(
                targets,
                probeExecutor,
                results,
                detector,
                dispatcher,
                cleaner,
                clock,
                Executors.newFixedThreadPool(properties.getProbe().getMaxConcurrency(), namedThreads()));
        log.info("Probe pool started maxConcurrency={}", properties.getProbe().getMaxConcurrency());
    }

    ProbeCycleRunner(
            TargetRegistry targets,
            ProbeExecutor probeExecutor,
            ProbeResultRepository results,
            StateChangeDetector detector,
            NotificationDispatcher dispatcher,
            RetentionCleaner cleaner,
            Clock clock,
            ExecutorService probePool) {
        this.targets = targets;
        this.probeExecutor = probeExecutor;
        this.results = results;
        this.detector = detector;
        this.dispatcher = dispatcher;
        this.cleaner = cleaner;
        this.clock = clock;
        this.probePool = probePool;
    }

    public CycleReport runCycle() {
        List<Target> snapshot = targets.findEnabled();
        if (snapshot.isEmpty()) {
            log.warn("No enabled targets");
            return CycleReport.empty();
        }

        List<ProbeOutcome> outcomes = probeAll(snapshot);

        Instant now = clock.instant();
        List<Long> ids = snapshot.stream().map(Target::id).toList();
        Map<Long, Boolean> previous = results.latestStates(ids);

        List<ProbeResult> rows = new ArrayList<>(snapshot.size());
        for (int i = 0; i < snapshot.size(); i++) {
            rows.add(ProbeResult.of(snapshot.get(i).id(), now, outcomes.get(i)));
        }
        int inserted = results.insertAll(rows);

        List<CompletableFuture<Void>> deliveries = new ArrayList<>();
        for (int i = 0; i < snapshot.size(); i++) {
            Target target = snapshot.get(i);
            ProbeOutcome outcome = outcomes.get(i);
            Boolean previousUp = previous.get(target.id());
            Optional<AlertEventType> event = detector.evaluate(target.id(), previousUp, outcome.ok(), now);
            if (event.isPresent()) {
                log.info(
                        "State change alert targetId={} event={} prevUp={} currentUp={} status={} latencyMs={}",
                        target.id(),
                        event.get().wireValue(),
                        previousUp,
                        outcome.ok(),
                        outcome.httpStatus(),
                        outcome.durationMs());
                deliveries.add(dispatcher.dispatch(new Alert(event.get(), target, outcome, now)));
            }
        }
        // dispatch futures never complete exceptionally and every send is bounded by the alert timeout
        CompletableFuture.allOf(deliveries.toArray(CompletableFuture[]::new)).join();

        cleaner.maybeCleanup(now);

        int ok = (int) outcomes.stream().filter(ProbeOutcome::ok).count();
        log.info("Probe cycle completed targets={} ok={} alerts={}", inserted, ok, deliveries.size());
        return new CycleReport(inserted, ok, deliveries.size());
    }

    private List<ProbeOutcome> probeAll(List<Target> snapshot) {
        List<CompletableFuture<ProbeOutcome>> futures = snapshot.stream()
                .map(target -> CompletableFuture.supplyAsync(() -> probeExecutor.probe(target), probePool)
                        .exceptionally(ex -> {
                            log.error("Probe crashed target={}", target.name(), ex);
                            return ProbeOutcome.failure(null, null, "probe crashed: " + ex.getMessage());
                        }))
                .toList();
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    @PreDestroy
    void stop() {
        probePool.shutdownNow();
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ewsmon-probe-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
