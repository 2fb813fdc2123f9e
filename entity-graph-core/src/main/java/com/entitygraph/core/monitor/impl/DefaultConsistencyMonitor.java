package com.entitygraph.core.monitor.impl;

import com.entitygraph.core.integrity.IntegrityChecker;
import com.entitygraph.core.integrity.RepairOptions;
import com.entitygraph.core.model.DriftChanges;
import com.entitygraph.core.model.DriftResult;
import com.entitygraph.core.model.IntegrityReport;
import com.entitygraph.core.model.MonitorEvent;
import com.entitygraph.core.model.MonitorEventType;
import com.entitygraph.core.model.MonitorStatus;
import com.entitygraph.core.model.NormalizedEntities;
import com.entitygraph.core.model.RepairResult;
import com.entitygraph.core.model.StateSnapshot;
import com.entitygraph.core.monitor.ConsistencyMonitor;
import com.entitygraph.core.monitor.ConsistencyMonitorConfig;
import com.entitygraph.core.monitor.MonitorEventListener;
import com.entitygraph.core.monitor.Subscription;
import com.entitygraph.core.util.BoundedBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Default {@link ConsistencyMonitor}.
 *
 * <p>Scheduled checks run on a single daemon thread owned by the monitor. A failing tick
 * is logged and reported through the error event; the schedule keeps running.
 */
public class DefaultConsistencyMonitor implements ConsistencyMonitor {

    private static final Logger log = LoggerFactory.getLogger(DefaultConsistencyMonitor.class);

    private static final String THREAD_NAME = "entity-graph-monitor";

    private final ConsistencyMonitorConfig config;
    private final IntegrityChecker checker;
    private final Clock clock;

    private final Set<MonitorEventListener> listeners = new CopyOnWriteArraySet<>();
    private final BoundedBuffer<MonitorEvent> history;
    private final BoundedBuffer<StateSnapshot> snapshots;

    private volatile MonitorStatus status = MonitorStatus.IDLE;
    private volatile IntegrityReport lastReport;
    private volatile RepairResult lastRepairResult;

    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tick;
    private volatile boolean active;

    public DefaultConsistencyMonitor(ConsistencyMonitorConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Creates a monitor with an explicit clock for event and snapshot timestamps.
     *
     * @param config configuration
     * @param clock time source
     */
    public DefaultConsistencyMonitor(ConsistencyMonitorConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.checker = config.integrityChecker();
        this.history = new BoundedBuffer<>(config.maxHistory());
        this.snapshots = new BoundedBuffer<>(config.maxSnapshots());
    }

    @Override
    public MonitorStatus getStatus() {
        return status;
    }

    @Override
    public Optional<IntegrityReport> getLastReport() {
        return Optional.ofNullable(lastReport);
    }

    @Override
    public Optional<RepairResult> getLastRepairResult() {
        return Optional.ofNullable(lastRepairResult);
    }

    @Override
    public IntegrityReport check(NormalizedEntities entities) {
        Objects.requireNonNull(entities, "entities must not be null");
        setStatus(MonitorStatus.CHECKING);
        emit(MonitorEventType.CHECK_START, null);

        IntegrityReport report;
        try {
            report = checker.check(entities);
        } catch (RuntimeException e) {
            fail(e);
            throw e;
        }
        lastReport = report;

        if (report.hasViolations()) {
            setStatus(MonitorStatus.INVALID);
            emit(MonitorEventType.VIOLATION_DETECTED, report.violations());
            notify(config.onViolation(), report.violations());
            if (config.autoRepair()) {
                repair(entities, config.repairOptions());
            }
        } else {
            setStatus(MonitorStatus.VALID);
        }

        emit(MonitorEventType.CHECK_COMPLETE, report);
        log.debug("Check complete: {} violation(s), status {}", report.violations().size(), status);
        return report;
    }

    @Override
    public RepairResult repair(NormalizedEntities entities, RepairOptions options) {
        Objects.requireNonNull(entities, "entities must not be null");
        RepairOptions effective = options != null ? options : RepairOptions.defaults();

        RepairResult result;
        try {
            IntegrityReport report = lastReport;
            if (report == null) {
                report = checker.check(entities);
                lastReport = report;
            }
            setStatus(MonitorStatus.REPAIRING);
            emit(MonitorEventType.REPAIR_START, null);
            result = checker.repair(entities, report, effective);
        } catch (RuntimeException e) {
            fail(e);
            throw e;
        }
        lastRepairResult = result;

        emit(MonitorEventType.REPAIR_COMPLETE, result);
        setStatus(result.isComplete() ? MonitorStatus.VALID : MonitorStatus.INVALID);
        log.debug("Repair complete: {} applied, {} remaining", result.repairs().size(), result.remaining().size());
        return result;
    }

    @Override
    public StateSnapshot createSnapshot(NormalizedEntities entities, String label) {
        StateSnapshot snapshot = snapshotOf(entities, label);
        snapshots.add(snapshot);
        emit(MonitorEventType.SNAPSHOT_CREATED, snapshot);
        return snapshot;
    }

    @Override
    public List<StateSnapshot> getSnapshots() {
        return snapshots.toList();
    }

    @Override
    public Optional<DriftResult> detectDrift(NormalizedEntities entities) {
        return snapshots.last().map(latest -> compare(latest, entities));
    }

    @Override
    public Optional<DriftResult> compareWithSnapshot(NormalizedEntities entities, String snapshotId) {
        Optional<StateSnapshot> source = snapshots.find(snapshot -> snapshot.id().equals(snapshotId));
        if (source.isEmpty()) {
            log.debug("Snapshot not found: {}", snapshotId);
        }
        return source.map(snapshot -> compare(snapshot, entities));
    }

    @Override
    public void start(Supplier<NormalizedEntities> entities) {
        Objects.requireNonNull(entities, "entities must not be null");
        synchronized (lifecycleLock) {
            if (active) {
                return;
            }
            active = true;
            if (config.isScheduled()) {
                if (scheduler == null || scheduler.isShutdown()) {
                    scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                        Thread thread = new Thread(runnable, THREAD_NAME);
                        thread.setDaemon(true);
                        return thread;
                    });
                }
                long periodMillis = config.checkInterval().toMillis();
                tick = scheduler.scheduleAtFixedRate(() -> runScheduledCheck(entities),
                    periodMillis, periodMillis, TimeUnit.MILLISECONDS);
                log.info("Consistency monitor started, checking every {} ms", periodMillis);
            } else {
                log.info("Consistency monitor started, checks on demand");
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (tick != null) {
                tick.cancel(false);
                tick = null;
            }
            if (active) {
                log.info("Consistency monitor stopped");
            }
            active = false;
        }
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public Subscription subscribe(MonitorEventListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public List<MonitorEvent> getHistory() {
        return history.toList();
    }

    @Override
    public void clearHistory() {
        history.clear();
    }

    @Override
    public void dispose() {
        stop();
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                scheduler.shutdownNow();
                scheduler = null;
            }
        }
        listeners.clear();
        history.clear();
        snapshots.clear();
        lastReport = null;
        lastRepairResult = null;
        status = MonitorStatus.IDLE;
    }

    private void runScheduledCheck(Supplier<NormalizedEntities> entities) {
        try {
            check(entities.get());
        } catch (RuntimeException e) {
            // Keeps the schedule alive; the failure already went through the error event
            log.error("Scheduled consistency check failed: {}", e.getMessage(), e);
        }
    }

    private DriftResult compare(StateSnapshot source, NormalizedEntities entities) {
        StateSnapshot target = snapshotOf(entities, null);
        DriftChanges changes = StateDigest.changes(source, target);
        boolean drift = !source.hash().equals(target.hash());
        DriftResult result = new DriftResult(drift, source, target, changes, changes.total());

        if (drift) {
            emit(MonitorEventType.DRIFT_DETECTED, result);
            notify(config.onDrift(), result);
        }
        return result;
    }

    private StateSnapshot snapshotOf(NormalizedEntities entities, String label) {
        Objects.requireNonNull(entities, "entities must not be null");
        return new StateSnapshot(
            UUID.randomUUID().toString(),
            clock.millis(),
            entities.counts(),
            StateDigest.hash(entities),
            lastReport,
            label
        );
    }

    private void fail(RuntimeException e) {
        log.warn("Integrity checker failed: {}", e.getMessage());
        setStatus(MonitorStatus.ERROR);
        emit(MonitorEventType.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getName());
        notify(config.onError(), e);
    }

    private void setStatus(MonitorStatus next) {
        MonitorStatus previous = status;
        if (previous == next) {
            return;
        }
        status = next;
        emit(MonitorEventType.STATUS_CHANGE, new MonitorEvent.StatusChange(previous, next));
    }

    private void emit(MonitorEventType type, Object data) {
        MonitorEvent event = new MonitorEvent(type, clock.millis(), data);
        history.add(event);
        for (MonitorEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Monitor listener failed on {} event: {}", type, e.getMessage(), e);
            }
        }
    }

    private <T> void notify(Consumer<T> callback, T value) {
        if (callback == null) {
            return;
        }
        try {
            callback.accept(value);
        } catch (RuntimeException e) {
            log.error("Monitor callback failed: {}", e.getMessage(), e);
        }
    }
}
