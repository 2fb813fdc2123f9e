package com.entitygraph.core.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Schema of a value that is one of several entity types.
 *
 * <p>The member is chosen by tag: either the value of a discriminator field in the
 * input (default {@value #DEFAULT_DISCRIMINATOR}) or the result of a resolver
 * function. Normalized union values keep the tag next to the id, as
 * {@code {"id": ..., "schema": tag}}, so the type never has to be guessed from the store.
 *
 * @param schemas tag to member schema
 * @param discriminator input field holding the tag, used when no resolver is given
 * @param resolver computes the tag from the raw input, may be null
 */
public record UnionSchema(
    Map<String, EntitySchema> schemas,
    String discriminator,
    Function<Map<String, Object>, String> resolver
) implements Schema {

    /** Discriminator field used when none is given. */
    public static final String DEFAULT_DISCRIMINATOR = "__typename";

    /** Key of the id in a normalized union value. */
    public static final String ID_KEY = "id";

    /** Key of the tag in a normalized union value. */
    public static final String SCHEMA_KEY = "schema";

    /**
     * Compact constructor with validation.
     */
    public UnionSchema {
        Objects.requireNonNull(schemas, "schemas must not be null");
        if (schemas.isEmpty()) {
            throw new IllegalArgumentException("Union must have at least one member schema");
        }
        schemas = Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
        if (discriminator == null || discriminator.isBlank()) {
            discriminator = DEFAULT_DISCRIMINATOR;
        }
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.UNION;
    }

    /**
     * Computes the tag of a raw input value.
     *
     * @param input raw input
     * @return tag, or null when the input carries none
     */
    public String tagOf(Map<String, Object> input) {
        if (resolver != null) {
            return resolver.apply(input);
        }
        Object tag = input.get(discriminator);
        return tag != null ? String.valueOf(tag) : null;
    }

    /**
     * @param tag member tag
     * @return member schema for the tag, if any
     */
    public Optional<EntitySchema> member(String tag) {
        return tag == null ? Optional.empty() : Optional.ofNullable(schemas.get(tag));
    }
}
