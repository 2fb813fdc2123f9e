package com.entitygraph.core.schema;

/**
 * Thrown when a schema name is looked up but not registered.
 */
public class SchemaNotFoundException extends SchemaRegistryException {

    private final String schemaName;

    public SchemaNotFoundException(String schemaName) {
        super("Schema \"" + schemaName + "\" is not registered");
        this.schemaName = schemaName;
    }

    public String getSchemaName() {
        return schemaName;
    }
}
