package com.company.podwatch.scheduled;

import com.company.podwatch.cache.SnapshotStore;
import com.company.podwatch.domain.AlertRecord;
import com.company.podwatch.domain.ChangeEvent;
import com.company.podwatch.domain.MetricSample;
import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.domain.ResourceSnapshot;
import com.company.podwatch.domain.enums.CycleState;
import com.company.podwatch.domain.enums.ResourceKind;
import com.company.podwatch.event.CycleCompletedEvent;
import com.company.podwatch.inventory.InventoryClient;
import com.company.podwatch.service.AlertEvaluation;
import com.company.podwatch.service.AlertService;
import com.company.podwatch.service.BatchWriteResult;
import com.company.podwatch.service.ChangeDetectionService;
import com.company.podwatch.service.HistoryStore;
import com.company.podwatch.settings.MonitoringSettings;
import com.company.podwatch.settings.PodWatchSettings;
import com.company.podwatch.settings.SettingsService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One poll cycle: fetch, diff, persist, swap the baseline, evaluate and dispatch.
 *
 * <p>Cycles never overlap. A failure before the swap leaves the previous baseline in place, so the
 * same transitions are detected again on the next successful cycle.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MonitoringCycle {

    private final InventoryClient inventoryClient;
    private final ChangeDetectionService changeDetectionService;
    private final HistoryStore historyStore;
    private final SnapshotStore snapshotStore;
    private final AlertService alertService;
    private final SettingsService settingsService;
    private final BackoffPolicy backoffPolicy;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicReference<CycleState> state = new AtomicReference<>(CycleState.IDLE);
    private final AtomicReference<CycleResult> lastResult = new AtomicReference<>();

    /**
     * Runs a cycle unless one is already in progress, in which case a skipped result is returned immediately
     */
    public CycleResult run() {
        if (!cycleLock.tryLock()) {
            log.info("Poll cycle already running, skipping");
            return CycleResult.skipped(Instant.now(clock));
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            CycleResult result = execute();
            lastResult.set(result);
            return result;
        } finally {
            state.set(CycleState.IDLE);
            sample.stop(meterRegistry.timer("podwatch.cycle.duration"));
            cycleLock.unlock();
        }
    }

    private CycleResult execute() {
        Instant startedAt = Instant.now(clock);
        PodWatchSettings settings = settingsService.current();
        MonitoringSettings monitoring = settings.getMonitoring();
        CycleResult.CycleResultBuilder result = CycleResult.builder().startedAt(startedAt);
        int nonFatal = 0;

        try {
            enter(CycleState.FETCHING);
            Set<ResourceKind> kinds = Boolean.TRUE.equals(monitoring.getMonitorNodes())
                    ? EnumSet.of(ResourceKind.POD, ResourceKind.NODE)
                    : EnumSet.of(ResourceKind.POD);
            List<ResourceSnapshot> current = inventoryClient.listResources(kinds, monitoring.getNamespaces());
            result.resourceCount(current.size());

            enter(CycleState.DIFFING);
            Map<ResourceKey, ResourceSnapshot> previous = snapshotStore.isInitialized() ? snapshotStore.snapshot() : null;
            List<ChangeEvent> events = changeDetectionService.diff(previous, current, startedAt);
            Set<ResourceKey> removed = changeDetectionService.removedKeys(previous, current);
            result.changeCount(events.size());

            enter(CycleState.PERSISTING);
            historyStore.recordChanges(events);
            historyStore.saveCurrentState(current, removed);
            nonFatal += persistSecondary(current, monitoring);

            snapshotStore.swap(current);

            enter(CycleState.EVALUATING);
            AlertEvaluation evaluation = alertService.evaluate(events, settings);
            List<AlertRecord> alerts = evaluation.getAlerts();
            result.alertsRecorded(alerts.size());

            enter(CycleState.DISPATCHING);
            result.deliveriesSent(alertService.dispatch(alerts, settings));

            eventPublisher.publishEvent(new CycleCompletedEvent(Instant.now(clock), events.size(), current.size()));

            if (evaluation.hasWriteFailures()) {
                // recorded alerts are dispatched regardless; the swapped baseline is kept
                BatchWriteResult writes = evaluation.getWrites();
                backoffPolicy.recordFailure();
                meterRegistry.counter("podwatch.cycle.runs", "outcome", "failure",
                        "state", CycleState.EVALUATING.name()).increment();
                log.error("Poll cycle completed with {} of {} alerts not recorded: {}",
                        writes.getFailed(), writes.getFailed() + writes.getWritten(), writes.getFailures());
                return result.success(false)
                        .failedIn(CycleState.EVALUATING)
                        .error(writes.getFailed() + " alerts could not be recorded")
                        .nonFatalFailures(nonFatal)
                        .finishedAt(Instant.now(clock))
                        .build();
            }

            backoffPolicy.recordSuccess();
            meterRegistry.counter("podwatch.cycle.runs", "outcome", "success").increment();
            meterRegistry.counter("podwatch.changes.detected").increment(events.size());
            log.info("Poll cycle completed: {} resources, {} changes, {} alerts recorded",
                    current.size(), events.size(), alerts.size());
            return result.success(true).nonFatalFailures(nonFatal).finishedAt(Instant.now(clock)).build();

        } catch (Exception e) {
            CycleState failedIn = state.get();
            backoffPolicy.recordFailure();
            meterRegistry.counter("podwatch.cycle.runs", "outcome", "failure", "state", failedIn.name()).increment();
            log.error("Poll cycle failed while {}: {}", failedIn, e.getMessage(), e);
            return result.success(false)
                    .failedIn(failedIn)
                    .error(e.getMessage())
                    .nonFatalFailures(nonFatal)
                    .finishedAt(Instant.now(clock))
                    .build();
        }
    }

    /**
     * Metric samples, ports and node statistics. Failures are counted, not propagated.
     */
    private int persistSecondary(List<ResourceSnapshot> current, MonitoringSettings monitoring) {
        int failures = 0;
        try {
            List<MetricSample> samples = current.stream()
                    .filter(s -> s.getUsage().isObtained())
                    .map(MetricSample::of)
                    .toList();
            historyStore.recordMetrics(samples);
        } catch (Exception e) {
            failures++;
            log.warn("Metric samples not recorded this cycle: {}", e.getMessage());
        }
        try {
            historyStore.savePorts(current);
        } catch (Exception e) {
            failures++;
            log.warn("Port information not recorded this cycle: {}", e.getMessage());
        }
        if (Boolean.TRUE.equals(monitoring.getMonitorNodes())) {
            try {
                historyStore.saveNodeStats(inventoryClient.collectNodeStats());
            } catch (Exception e) {
                failures++;
                log.warn("Node statistics not recorded this cycle: {}", e.getMessage());
            }
        }
        if (failures > 0) {
            meterRegistry.counter("podwatch.cycle.nonfatal.failures").increment(failures);
        }
        return failures;
    }

    private void enter(CycleState next) {
        state.set(next);
        log.debug("Poll cycle state: {}", next);
    }

    public CycleState getState() {
        return state.get();
    }

    public CycleResult getLastResult() {
        return lastResult.get();
    }

    public boolean isRunning() {
        return cycleLock.isLocked();
    }
}
