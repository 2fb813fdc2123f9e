package com.entitygraph.core.schema;

import com.entitygraph.core.model.Entity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

/**
 * Schema of a named entity type.
 *
 * <p>The name is also the type key in the flat store. Relations map field names to the
 * schema of the nested value held in that field; fields without a relation are copied
 * as-is.
 *
 * <p>Relations can be added after construction with {@link #define(Map)}, which is how
 * mutually recursive schemas are built:
 * <pre>{@code
 * EntitySchema user = Schemas.entity("users");
 * EntitySchema post = Schemas.entity("posts", Map.of("author", user));
 * user.define(Map.of("posts", Schemas.array(post)));
 * }</pre>
 */
public final class EntitySchema implements Schema {

    private final String name;
    private final Map<String, Schema> relations = new LinkedHashMap<>();
    private Options options;

    /**
     * Creates an entity schema without relations and with default options.
     *
     * @param name entity type name
     */
    public EntitySchema(String name) {
        this(name, Map.of(), Options.defaults());
    }

    /**
     * Creates an entity schema.
     *
     * @param name entity type name
     * @param relations field name to nested schema
     * @param options id attribute, strategies and excluded fields
     */
    public EntitySchema(String name, Map<String, ? extends Schema> relations, Options options) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        define(relations);
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.ENTITY;
    }

    public String name() {
        return name;
    }

    public String idAttribute() {
        return options.idAttribute();
    }

    /**
     * @return field name to nested schema, in definition order
     */
    public Map<String, Schema> relations() {
        return Collections.unmodifiableMap(relations);
    }

    public Options options() {
        return options;
    }

    /**
     * Adds or replaces relations.
     *
     * @param additional field name to nested schema
     * @return this schema
     */
    public EntitySchema define(Map<String, ? extends Schema> additional) {
        Objects.requireNonNull(additional, "relations must not be null");
        additional.forEach((field, schema) -> relations.put(
            Objects.requireNonNull(field, "relation field must not be null"),
            Objects.requireNonNull(schema, "relation schema must not be null for field " + field)));
        return this;
    }

    /**
     * @param field field name
     * @return true if the field holds a schema-governed value
     */
    public boolean hasRelation(String field) {
        return relations.containsKey(field);
    }

    /**
     * @param field field name
     * @return true if the field is dropped during normalization
     */
    public boolean isExcluded(String field) {
        return options.excludeFields().contains(field);
    }

    /**
     * Reads the id of a raw input record.
     *
     * @param input raw record
     * @return id value, or null when absent
     */
    public Object rawId(Map<String, ?> input) {
        return input.get(options.idAttribute());
    }

    /**
     * Applies the process strategy to a freshly extracted record.
     *
     * @param entity extracted record
     * @return processed record
     */
    public Entity process(Entity entity) {
        return options.processStrategy().apply(entity);
    }

    /**
     * Combines a stored record with a newly extracted one for the same id.
     *
     * @param existing stored record
     * @param incoming new record
     * @return merged record
     */
    public Entity merge(Entity existing, Entity incoming) {
        return options.mergeStrategy().apply(existing, incoming);
    }

    // Builder support: a forward-declared placeholder receives its final options when built.
    void configure(Options replacement) {
        this.options = Objects.requireNonNull(replacement, "options must not be null");
    }

    @Override
    public String toString() {
        return "EntitySchema[" + name + ", relations=" + relations.keySet() + "]";
    }

    /**
     * Per-schema normalization options.
     *
     * @param idAttribute name of the id field
     * @param processStrategy transforms each extracted record before it is stored
     * @param mergeStrategy combines a stored record with an incoming one for the same id
     * @param excludeFields fields dropped during normalization
     */
    public record Options(
        String idAttribute,
        UnaryOperator<Entity> processStrategy,
        BinaryOperator<Entity> mergeStrategy,
        Set<String> excludeFields
    ) {
        /** Shallow merge, last write wins per field. */
        public static final BinaryOperator<Entity> SHALLOW_MERGE = Entity::merge;

        /**
         * Compact constructor applying defaults.
         */
        public Options {
            if (idAttribute == null || idAttribute.isBlank()) {
                idAttribute = Entity.DEFAULT_ID_FIELD;
            }
            if (processStrategy == null) {
                processStrategy = UnaryOperator.identity();
            }
            if (mergeStrategy == null) {
                mergeStrategy = SHALLOW_MERGE;
            }
            excludeFields = excludeFields != null ? Set.copyOf(excludeFields) : Set.of();
        }

        public static Options defaults() {
            return new Options(null, null, null, null);
        }

        public static Options withIdAttribute(String idAttribute) {
            return new Options(idAttribute, null, null, null);
        }

        public Options withProcessStrategy(UnaryOperator<Entity> strategy) {
            return new Options(idAttribute, strategy, mergeStrategy, excludeFields);
        }

        public Options withMergeStrategy(BinaryOperator<Entity> strategy) {
            return new Options(idAttribute, processStrategy, strategy, excludeFields);
        }

        public Options withExcludeFields(Set<String> fields) {
            return new Options(idAttribute, processStrategy, mergeStrategy, fields);
        }
    }
}
