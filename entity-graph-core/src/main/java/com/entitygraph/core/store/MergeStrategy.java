package com.entitygraph.core.store;

/**
 * How {@link EntityStore#mergeEntities(com.entitygraph.core.model.NormalizedEntities,
 * com.entitygraph.core.model.NormalizedEntities, MergeStrategy)} resolves an id present
 * in both stores.
 */
public enum MergeStrategy {
    /** The incoming record replaces the existing one. */
    OVERWRITE,

    /** The existing record is kept. */
    KEEP,

    /** Incoming fields are shallow-merged over the existing record. */
    MERGE
}
