package com.entitygraph.core.monitor;

import com.entitygraph.core.integrity.RepairOptions;
import com.entitygraph.core.model.DriftResult;
import com.entitygraph.core.model.IntegrityReport;
import com.entitygraph.core.model.MonitorEvent;
import com.entitygraph.core.model.MonitorStatus;
import com.entitygraph.core.model.NormalizedEntities;
import com.entitygraph.core.model.RepairResult;
import com.entitygraph.core.model.StateSnapshot;
import com.entitygraph.core.monitor.impl.DefaultConsistencyMonitor;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs integrity checks on demand or on a timer, keeps snapshots of store state,
 * detects drift between them and emits a typed event stream.
 *
 * <p>The monitor never writes to the caller's store: repaired stores are returned (and
 * kept as {@link #getLastRepairResult()}) for the caller to apply.
 *
 * <p>Checks are not serialized. Two concurrent checks race on the last report and the
 * status; the last one to finish wins. Callers needing ordered checks serialize them.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * ConsistencyMonitor monitor = ConsistencyMonitor.create(
 *     ConsistencyMonitorConfig.builder(checker).checkInterval(Duration.ofSeconds(30)).build());
 * monitor.subscribe(event -> log.info("{}", event.type()));
 * monitor.start(store::current);
 * ...
 * monitor.dispose();
 * }</pre>
 */
public interface ConsistencyMonitor {

    /**
     * Creates a monitor.
     *
     * @param config configuration
     * @return new monitor, idle and not started
     */
    static ConsistencyMonitor create(ConsistencyMonitorConfig config) {
        return new DefaultConsistencyMonitor(config);
    }

    MonitorStatus getStatus();

    /**
     * @return report of the last completed check, if any
     */
    Optional<IntegrityReport> getLastReport();

    /**
     * @return result of the last completed repair, if any
     */
    Optional<RepairResult> getLastRepairResult();

    /**
     * Runs a check, repairing afterwards when auto repair is enabled and violations were found.
     *
     * @param entities store to check
     * @return report
     * @throws RuntimeException whatever the checker threw, after the monitor entered {@link MonitorStatus#ERROR}
     */
    IntegrityReport check(NormalizedEntities entities);

    /**
     * Repairs using the last report, checking first when there is none.
     *
     * @param entities store to repair, left unchanged
     * @return repair result
     */
    default RepairResult repair(NormalizedEntities entities) {
        return repair(entities, RepairOptions.defaults());
    }

    /**
     * Repairs using the last report, checking first when there is none.
     *
     * @param entities store to repair, left unchanged
     * @param options repair options
     * @return repair result
     */
    RepairResult repair(NormalizedEntities entities, RepairOptions options);

    default StateSnapshot createSnapshot(NormalizedEntities entities) {
        return createSnapshot(entities, null);
    }

    /**
     * Records the store's per-type counts and id hash.
     *
     * @param entities store to snapshot
     * @param label optional label
     * @return snapshot, also retained by the monitor
     */
    StateSnapshot createSnapshot(NormalizedEntities entities, String label);

    /**
     * @return retained snapshots, oldest first
     */
    List<StateSnapshot> getSnapshots();

    /**
     * Compares a store with the newest snapshot.
     *
     * @param entities current store
     * @return drift, or empty when no snapshot exists
     */
    Optional<DriftResult> detectDrift(NormalizedEntities entities);

    /**
     * Compares a store with a retained snapshot.
     *
     * @param entities current store
     * @param snapshotId snapshot id
     * @return drift, or empty when the snapshot is unknown or evicted
     */
    Optional<DriftResult> compareWithSnapshot(NormalizedEntities entities, String snapshotId);

    /**
     * Starts monitoring. With a non-zero interval, the store is fetched from the
     * supplier and checked on every tick. Calling start while active does nothing.
     *
     * @param entities supplies the current store on every tick
     */
    void start(Supplier<NormalizedEntities> entities);

    void stop();

    boolean isActive();

    /**
     * @param listener listener to add
     * @return handle that removes the listener
     */
    Subscription subscribe(MonitorEventListener listener);

    /**
     * @return retained events, oldest first
     */
    List<MonitorEvent> getHistory();

    void clearHistory();

    /**
     * Stops the timer, releases its thread and clears listeners, history, snapshots,
     * reports and status.
     */
    void dispose();
}
