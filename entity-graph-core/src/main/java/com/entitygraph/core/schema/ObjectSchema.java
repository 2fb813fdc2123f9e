package com.entitygraph.core.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Schema of a plain object. Declared fields follow their schema, other fields pass
 * through unchanged.
 *
 * @param shape field name to schema
 */
public record ObjectSchema(Map<String, Schema> shape) implements Schema {

    /**
     * Compact constructor with validation.
     */
    public ObjectSchema {
        Objects.requireNonNull(shape, "shape must not be null");
        shape = Collections.unmodifiableMap(new LinkedHashMap<>(shape));
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.OBJECT;
    }
}
