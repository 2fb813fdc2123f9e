package com.entitygraph.core.model;

import com.entitygraph.core.util.Values;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time summary of a store.
 *
 * <p>The hash covers entity types and their sorted id lists, not entity contents:
 * two stores with the same ids per type hash equally even if field values differ.
 *
 * @param id snapshot id
 * @param timestamp creation time, epoch milliseconds
 * @param entityCounts entity count per type
 * @param hash store digest
 * @param report last integrity report known when the snapshot was taken, may be null
 * @param label optional caller label
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StateSnapshot(
    String id,
    long timestamp,
    Map<String, Integer> entityCounts,
    String hash,
    IntegrityReport report,
    String label
) {
    /**
     * Compact constructor with validation.
     */
    public StateSnapshot {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(hash, "hash must not be null");
        entityCounts = entityCounts != null ? Values.orderedCopy(entityCounts) : Map.of();
    }
}
