package com.entitygraph.core.model;

import com.entitygraph.core.util.Values;

import java.util.Map;

/**
 * Per-type count deltas between two snapshots.
 *
 * <p>{@code modified} stays empty while drift is count based.
 *
 * @param added types that grew, with the number of entities gained
 * @param removed types that shrank, with the number of entities lost
 * @param modified types with changed contents, reserved for content hashing
 */
public record DriftChanges(
    Map<String, Integer> added,
    Map<String, Integer> removed,
    Map<String, Integer> modified
) {
    /**
     * Compact constructor with validation.
     */
    public DriftChanges {
        added = added != null ? Values.orderedCopy(added) : Map.of();
        removed = removed != null ? Values.orderedCopy(removed) : Map.of();
        modified = modified != null ? Values.orderedCopy(modified) : Map.of();
    }

    /**
     * @return sum of all change magnitudes
     */
    public int total() {
        return sum(added) + sum(removed) + sum(modified);
    }

    private static int sum(Map<String, Integer> changes) {
        return changes.values().stream().mapToInt(Integer::intValue).sum();
    }
}
