package com.entitygraph.core.schema;

/**
 * Thrown when a {@link SchemaRegistry} is used incorrectly.
 */
public class SchemaRegistryException extends RuntimeException {

    public SchemaRegistryException(String message) {
        super(message);
    }
}
