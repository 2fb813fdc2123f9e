package com.entitygraph.core.model;

import java.util.Objects;

/**
 * Reference to an entity by type and id.
 *
 * @param entityType entity type name
 * @param entityId entity id
 */
public record EntityRef(
    String entityType,
    String entityId
) {
    /**
     * Compact constructor with validation.
     */
    public EntityRef {
        Objects.requireNonNull(entityType, "entityType must not be null");
        Objects.requireNonNull(entityId, "entityId must not be null");
    }
}
