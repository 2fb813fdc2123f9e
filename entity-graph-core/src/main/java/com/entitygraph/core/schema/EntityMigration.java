package com.entitygraph.core.schema;

import com.entitygraph.core.model.Entity;

/**
 * Migrates a stored record one schema version forward.
 */
@FunctionalInterface
public interface EntityMigration {

    /**
     * @param entity record at {@code fromVersion}
     * @param fromVersion version the record is currently at
     * @return record at {@code fromVersion + 1}
     */
    Entity migrate(Entity entity, int fromVersion);
}
