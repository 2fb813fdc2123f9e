package com.entitygraph.core.model;

import java.util.Objects;

/**
 * Comparison between two snapshots.
 *
 * @param hasDrift true when the snapshot hashes differ
 * @param snapshots the compared snapshots
 * @param changes per-type count deltas
 * @param totalChanges sum of change magnitudes
 */
public record DriftResult(
    boolean hasDrift,
    Snapshots snapshots,
    DriftChanges changes,
    int totalChanges
) {
    /**
     * Compact constructor with validation.
     */
    public DriftResult {
        Objects.requireNonNull(snapshots, "snapshots must not be null");
        Objects.requireNonNull(changes, "changes must not be null");
    }

    public DriftResult(boolean hasDrift, StateSnapshot source, StateSnapshot target,
                       DriftChanges changes, int totalChanges) {
        this(hasDrift, new Snapshots(source, target), changes, totalChanges);
    }

    /**
     * Baseline and current snapshot of a comparison.
     *
     * @param source baseline snapshot
     * @param target snapshot of the current store
     */
    public record Snapshots(StateSnapshot source, StateSnapshot target) {
        public Snapshots {
            Objects.requireNonNull(source, "source must not be null");
            Objects.requireNonNull(target, "target must not be null");
        }
    }
}
