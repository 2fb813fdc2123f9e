package com.entitygraph.core.schema;

/**
 * Passthrough schema: values are returned unchanged and never stored.
 */
public record ValueSchema() implements Schema {

    static final ValueSchema INSTANCE = new ValueSchema();

    @Override
    public SchemaKind kind() {
        return SchemaKind.VALUE;
    }
}
