package com.entitygraph.core.schema;

import java.util.Objects;

/**
 * Schema of a list whose elements all follow one schema.
 *
 * @param element element schema
 */
public record ArraySchema(Schema element) implements Schema {

    /**
     * Compact constructor with validation.
     */
    public ArraySchema {
        Objects.requireNonNull(element, "element must not be null");
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.ARRAY;
    }
}
