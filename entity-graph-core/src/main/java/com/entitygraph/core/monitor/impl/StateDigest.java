package com.entitygraph.core.monitor.impl;

import com.entitygraph.core.model.DriftChanges;
import com.entitygraph.core.model.NormalizedEntities;
import com.entitygraph.core.model.StateSnapshot;
import com.entitygraph.core.util.Digests;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Hashing and comparison of store states for snapshots and drift detection.
 */
final class StateDigest {

    private static final String PREFIX = "entity-graph-state";

    private StateDigest() {
        // Utility class
    }

    /**
     * Hashes the type names and the sorted ids of each type. Independent of insertion order,
     * blind to field contents.
     *
     * @param entities store to hash
     * @return 64-character hex digest
     */
    static String hash(NormalizedEntities entities) {
        StringBuilder canonical = new StringBuilder(PREFIX);
        Map<String, Set<String>> sorted = new TreeMap<>();
        entities.types().forEach((type, byId) -> sorted.put(type, new TreeSet<>(byId.keySet())));
        sorted.forEach((type, ids) -> canonical
            .append('|').append(type)
            .append(':').append(ids.size())
            .append(':').append(String.join(",", ids)));
        return Digests.fullDigest(canonical.toString());
    }

    /**
     * Computes count deltas per type over the union of both snapshots' types.
     *
     * @param source earlier snapshot
     * @param target later snapshot
     * @return added and removed magnitudes; modification is not tracked
     */
    static DriftChanges changes(StateSnapshot source, StateSnapshot target) {
        Set<String> types = new LinkedHashSet<>(source.entityCounts().keySet());
        types.addAll(target.entityCounts().keySet());

        Map<String, Integer> added = new LinkedHashMap<>();
        Map<String, Integer> removed = new LinkedHashMap<>();
        for (String type : types) {
            int delta = target.entityCounts().getOrDefault(type, 0) - source.entityCounts().getOrDefault(type, 0);
            if (delta > 0) {
                added.put(type, delta);
            } else if (delta < 0) {
                removed.put(type, -delta);
            }
        }
        return new DriftChanges(added, removed, Map.of());
    }
}
