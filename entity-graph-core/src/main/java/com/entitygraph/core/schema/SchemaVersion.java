package com.entitygraph.core.schema;

/**
 * Version of a registered schema, with the migration that brings older records up to it.
 *
 * @param version current version, at least 1
 * @param migration single-step migration, may be null when records need no change
 */
public record SchemaVersion(
    int version,
    EntityMigration migration
) {
    /** Version of a schema registered without one. */
    public static final SchemaVersion INITIAL = new SchemaVersion(1, null);

    /**
     * Compact constructor with validation.
     */
    public SchemaVersion {
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1, was " + version);
        }
    }

    public static SchemaVersion of(int version, EntityMigration migration) {
        return new SchemaVersion(version, migration);
    }
}
