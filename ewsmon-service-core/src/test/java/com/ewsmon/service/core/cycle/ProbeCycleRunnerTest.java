package com.ewsmon.service.core.cycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ewsmon.model.AlertEventType;
import com.ewsmon.model.ProbeOutcome;
import com.ewsmon.model.ProbeResult;
import com.ewsmon.model.Target;
import com.ewsmon.service.core.alert.Alert;
import com.ewsmon.service.core.alert.AlertTracker;
import com.ewsmon.service.core.alert.StateChangeDetector;
import com.ewsmon.service.core.config.EwsmonProperties;
import com.ewsmon.service.core.notify.NotificationDispatcher;
import com.ewsmon.service.core.probe.ProbeExecutor;
import com.ewsmon.service.core.repo.ProbeResultRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ProbeCycleRunnerTest {

    private static final Instant T0 = Instant.parse("2024-03-05T12:00:00Z");

    private final Target validate = target(1L, "Validate", "validate");
    private final Target fax = target(2L, "Fax", "fax");

    private final List<Target> enabled = new ArrayList<>();
    private final FakeResults results = new FakeResults();
    private final ProbeExecutor probeExecutor = mock(ProbeExecutor.class);
    private final NotificationDispatcher dispatcher = mock(NotificationDispatcher.class);
    private final RetentionCleaner cleaner = mock(RetentionCleaner.class);
    private final Clock clock = mock(Clock.class);
    private ExecutorService pool;
    private ProbeCycleRunner runner;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
        when(dispatcher.dispatch(any())).thenReturn(CompletableFuture.completedFuture(null));
        StateChangeDetector detector = new StateChangeDetector(new AlertTracker(), Duration.ofSeconds(300));
        runner = new ProbeCycleRunner(
                () -> List.copyOf(enabled), probeExecutor, results, detector, dispatcher, cleaner, clock, pool);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void noEnabledTargetsSkipsTheCycle() {
        CycleReport report = runner.runCycle();

        assertThat(report).isEqualTo(new CycleReport(0, 0, 0));
        assertThat(results.rows).isEmpty();
        verifyNoInteractions(probeExecutor, cleaner);
    }

    @Test
    void firstCycleStoresOneRowPerTargetAndNeverAlerts() {
        enabled.addAll(List.of(validate, fax));
        when(probeExecutor.probe(validate)).thenReturn(ProbeOutcome.success(200, 12.5));
        when(probeExecutor.probe(fax)).thenReturn(ProbeOutcome.notAttempted("payload not implemented for api_type=fax"));
        when(clock.instant()).thenReturn(T0);

        CycleReport report = runner.runCycle();

        assertThat(report).isEqualTo(new CycleReport(2, 1, 0));
        assertThat(results.rows).hasSize(2).allSatisfy(row -> assertThat(row.timestamp()).isEqualTo(T0));
        assertThat(results.rows)
                .extracting(ProbeResult::targetId, ProbeResult::ok)
                .containsExactly(
                        tuple(1L, true), tuple(2L, false));
        verify(dispatcher, never()).dispatch(any());
        verify(cleaner).maybeCleanup(T0);
    }

    @Test
    void transitionIsJudgedAgainstStateBeforeThisCycle() {
        enabled.add(validate);
        when(probeExecutor.probe(validate))
                .thenReturn(ProbeOutcome.success(200, 10.0))
                .thenReturn(ProbeOutcome.failure(503, 15.0, "[PROD] http 503"));
        when(clock.instant()).thenReturn(T0, T0.plusSeconds(10));

        runner.runCycle();
        CycleReport second = runner.runCycle();

        assertThat(second.alerts()).isEqualTo(1);
        assertThat(results.snapshotSizesBeforeInsert).containsExactly(0, 1);
        ArgumentCaptor<Alert> alert = ArgumentCaptor.forClass(Alert.class);
        verify(dispatcher).dispatch(alert.capture());
        assertThat(alert.getValue().type()).isEqualTo(AlertEventType.DOWN);
        assertThat(alert.getValue().target()).isEqualTo(validate);
        assertThat(alert.getValue().outcome().httpStatus()).isEqualTo(503);
        assertThat(alert.getValue().at()).isEqualTo(T0.plusSeconds(10));
    }

    @Test
    void unsupportedTargetIsRecordedEveryCycleButNeverAlerts() {
        enabled.add(fax);
        when(probeExecutor.probe(fax)).thenReturn(ProbeOutcome.notAttempted("payload not implemented for api_type=fax"));
        when(clock.instant()).thenReturn(T0, T0.plusSeconds(10), T0.plusSeconds(20));

        runner.runCycle();
        runner.runCycle();
        runner.runCycle();

        assertThat(results.rows).hasSize(3).allSatisfy(row -> {
            assertThat(row.ok()).isFalse();
            assertThat(row.error()).startsWith("payload not implemented");
        });
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void crashingProbeIsStoredAsFailure() {
        enabled.add(validate);
        when(probeExecutor.probe(validate)).thenThrow(new IllegalStateException("bug"));
        when(clock.instant()).thenReturn(T0);

        CycleReport report = runner.runCycle();

        assertThat(report.ok()).isZero();
        assertThat(results.rows).singleElement().satisfies(row -> {
            assertThat(row.ok()).isFalse();
            assertThat(row.error()).startsWith("probe crashed");
        });
    }

    @Test
    void cycleReturnsOnlyAfterAlertDeliveryFinished() {
        enabled.add(validate);
        when(probeExecutor.probe(validate))
                .thenReturn(ProbeOutcome.success(200, 10.0))
                .thenReturn(ProbeOutcome.failure(503, 15.0, "[PROD] http 503"));
        when(clock.instant()).thenReturn(T0, T0.plusSeconds(10));
        List<CompletableFuture<Void>> deliveries = new ArrayList<>();
        when(dispatcher.dispatch(any())).thenAnswer(invocation -> {
            CompletableFuture<Void> delivery = CompletableFuture.runAsync(
                    () -> {}, CompletableFuture.delayedExecutor(200, TimeUnit.MILLISECONDS));
            deliveries.add(delivery);
            return delivery;
        });

        runner.runCycle();
        CycleReport report = runner.runCycle();

        assertThat(report.alerts()).isEqualTo(1);
        assertThat(deliveries).singleElement().satisfies(delivery -> assertThat(delivery).isDone());
    }

    @Test
    void probesOfOneCycleRunConcurrently() {
        enabled.addAll(List.of(validate, fax));
        CyclicBarrier bothInFlight = new CyclicBarrier(2);
        when(probeExecutor.probe(any())).thenAnswer(invocation -> {
            bothInFlight.await(5, TimeUnit.SECONDS);
            return ProbeOutcome.success(200, 1.0);
        });
        when(clock.instant()).thenReturn(T0);

        CycleReport report = runner.runCycle();

        assertThat(report.ok()).isEqualTo(2);
    }

    @Test
    void maxConcurrencyOfOneRunsProbesOneAtATime() {
        enabled.addAll(List.of(validate, fax, target(3L, "Locator", "locate")));
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(probeExecutor.probe(any())).thenAnswer(invocation -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            Thread.sleep(50);
            inFlight.decrementAndGet();
            return ProbeOutcome.success(200, 50.0);
        });
        when(clock.instant()).thenReturn(T0);
        EwsmonProperties properties = new EwsmonProperties();
        properties.getProbe().setMaxConcurrency(1);
        ProbeCycleRunner serial = new ProbeCycleRunner(
                () -> List.copyOf(enabled),
                probeExecutor,
                results,
                new StateChangeDetector(new AlertTracker(), Duration.ofSeconds(300)),
                dispatcher,
                cleaner,
                clock,
                properties);

        try {
            CycleReport report = serial.runCycle();

            assertThat(report.ok()).isEqualTo(3);
            assertThat(maxInFlight).hasValue(1);
        } finally {
            serial.stop();
        }
    }

    private static Target target(long id, String name, String apiType) {
        return new Target(id, name, "https://webservices.purolator.com/EWS/" + name, null, apiType, true);
    }

    static class FakeResults implements ProbeResultRepository {
        final List<ProbeResult> rows = new ArrayList<>();
        final List<Integer> snapshotSizesBeforeInsert = new ArrayList<>();
        private long nextId = 1;

        @Override
        public Map<Long, Boolean> latestStates(Collection<Long> targetIds) {
            snapshotSizesBeforeInsert.add(rows.size());
            Map<Long, ProbeResult> latest = new HashMap<>();
            Comparator<ProbeResult> order =
                    Comparator.comparing(ProbeResult::timestamp).thenComparing(ProbeResult::id);
            for (ProbeResult row : rows) {
                if (targetIds.contains(row.targetId())) {
                    latest.merge(row.targetId(), row, (a, b) -> order.compare(a, b) >= 0 ? a : b);
                }
            }
            Map<Long, Boolean> states = new HashMap<>();
            latest.forEach((id, row) -> states.put(id, row.ok()));
            return states;
        }

        @Override
        public int insertAll(List<ProbeResult> results) {
            for (ProbeResult r : results) {
                rows.add(new ProbeResult(
                        nextId++, r.targetId(), r.timestamp(), r.ok(), r.httpStatus(), r.durationMs(), r.error()));
            }
            return results.size();
        }

        @Override
        public int deleteOlderThan(Instant cutoff) {
            int before = rows.size();
            rows.removeIf(row -> row.timestamp().isBefore(cutoff));
            return before - rows.size();
        }
    }
}
