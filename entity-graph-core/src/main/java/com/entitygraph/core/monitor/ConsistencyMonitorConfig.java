package com.entitygraph.core.monitor;

import com.entitygraph.core.integrity.IntegrityChecker;
import com.entitygraph.core.integrity.RepairOptions;
import com.entitygraph.core.model.DriftResult;
import com.entitygraph.core.model.IntegrityViolation;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Configuration of a {@link ConsistencyMonitor}.
 *
 * @param integrityChecker checker used for every check and repair
 * @param checkInterval period of scheduled checks; zero means on demand only
 * @param autoRepair repair right after a check that found violations
 * @param repairOptions options for automatic repairs
 * @param maxSnapshots number of retained snapshots
 * @param maxHistory number of retained events
 * @param onViolation called with the violations of a check that found any, may be null
 * @param onDrift called when drift is detected, may be null
 * @param onError called when the checker fails, may be null
 */
public record ConsistencyMonitorConfig(
    IntegrityChecker integrityChecker,
    Duration checkInterval,
    boolean autoRepair,
    RepairOptions repairOptions,
    int maxSnapshots,
    int maxHistory,
    Consumer<List<IntegrityViolation>> onViolation,
    Consumer<DriftResult> onDrift,
    Consumer<Throwable> onError
) {
    public static final int DEFAULT_MAX_SNAPSHOTS = 10;
    public static final int DEFAULT_MAX_HISTORY = 100;

    /**
     * Compact constructor with validation and defaults.
     */
    public ConsistencyMonitorConfig {
        Objects.requireNonNull(integrityChecker, "integrityChecker must not be null");
        if (checkInterval == null || checkInterval.isNegative()) {
            checkInterval = Duration.ZERO;
        }
        if (repairOptions == null) {
            repairOptions = RepairOptions.defaults();
        }
        if (maxSnapshots <= 0) {
            maxSnapshots = DEFAULT_MAX_SNAPSHOTS;
        }
        if (maxHistory <= 0) {
            maxHistory = DEFAULT_MAX_HISTORY;
        }
    }

    /**
     * @param integrityChecker checker to wrap
     * @return builder with defaults: on demand, no auto repair, 10 snapshots, 100 events
     */
    public static Builder builder(IntegrityChecker integrityChecker) {
        return new Builder(integrityChecker);
    }

    /**
     * @return true if checks run on a timer once started
     */
    public boolean isScheduled() {
        return !checkInterval.isZero();
    }

    /**
     * Builder for ConsistencyMonitorConfig.
     */
    public static class Builder {
        private final IntegrityChecker integrityChecker;
        private Duration checkInterval = Duration.ZERO;
        private boolean autoRepair;
        private RepairOptions repairOptions = RepairOptions.defaults();
        private int maxSnapshots = DEFAULT_MAX_SNAPSHOTS;
        private int maxHistory = DEFAULT_MAX_HISTORY;
        private Consumer<List<IntegrityViolation>> onViolation;
        private Consumer<DriftResult> onDrift;
        private Consumer<Throwable> onError;

        private Builder(IntegrityChecker integrityChecker) {
            this.integrityChecker = integrityChecker;
        }

        public Builder checkInterval(Duration interval) {
            this.checkInterval = interval;
            return this;
        }

        public Builder autoRepair(boolean enabled) {
            this.autoRepair = enabled;
            return this;
        }

        public Builder repairOptions(RepairOptions options) {
            this.repairOptions = options;
            return this;
        }

        public Builder maxSnapshots(int count) {
            this.maxSnapshots = count;
            return this;
        }

        public Builder maxHistory(int count) {
            this.maxHistory = count;
            return this;
        }

        public Builder onViolation(Consumer<List<IntegrityViolation>> callback) {
            this.onViolation = callback;
            return this;
        }

        public Builder onDrift(Consumer<DriftResult> callback) {
            this.onDrift = callback;
            return this;
        }

        public Builder onError(Consumer<Throwable> callback) {
            this.onError = callback;
            return this;
        }

        public ConsistencyMonitorConfig build() {
            return new ConsistencyMonitorConfig(integrityChecker, checkInterval, autoRepair, repairOptions,
                maxSnapshots, maxHistory, onViolation, onDrift, onError);
        }
    }
}
