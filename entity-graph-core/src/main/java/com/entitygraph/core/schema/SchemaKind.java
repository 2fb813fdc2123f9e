package com.entitygraph.core.schema;

/**
 * Variants of {@link Schema}.
 */
public enum SchemaKind {
    /** A named entity stored flat by id. */
    ENTITY,

    /** A list whose elements share one schema. */
    ARRAY,

    /** A plain object with some schema-governed fields. */
    OBJECT,

    /** One of several entity schemas, chosen per value. */
    UNION,

    /** A passthrough value. */
    VALUE
}
