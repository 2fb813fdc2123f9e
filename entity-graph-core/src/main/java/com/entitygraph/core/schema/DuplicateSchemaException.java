package com.entitygraph.core.schema;

/**
 * Thrown when a schema name is registered twice without the overwrite flag.
 */
public class DuplicateSchemaException extends SchemaRegistryException {

    private final String schemaName;

    public DuplicateSchemaException(String schemaName) {
        super("Schema \"" + schemaName + "\" is already registered");
        this.schemaName = schemaName;
    }

    public String getSchemaName() {
        return schemaName;
    }
}
