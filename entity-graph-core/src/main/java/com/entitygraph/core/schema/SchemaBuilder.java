package com.entitygraph.core.schema;

import com.entitygraph.core.model.Entity;
import com.entitygraph.core.schema.ExportedSchemas.RelationKind;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

/**
 * Fluent definition of an entity schema whose relations reference other types by name.
 *
 * <p>Targets that are not registered yet are declared in the registry, so schemas can
 * be built in any order:
 * <pre>{@code
 * SchemaBuilder.define("posts", registry)
 *     .belongsTo("author", "users")
 *     .hasMany("comments", "comments")
 *     .exclude("_links")
 *     .build();
 * SchemaBuilder.define("users", registry).hasMany("posts", "posts").build();
 * }</pre>
 */
public final class SchemaBuilder {

    private final String name;
    private final SchemaRegistry registry;
    private final Map<String, RelationSpec> relations = new LinkedHashMap<>();
    private final Set<String> excludeFields = new LinkedHashSet<>();
    private String idAttribute;
    private UnaryOperator<Entity> processStrategy;
    private BinaryOperator<Entity> mergeStrategy;
    private SchemaVersion version = SchemaVersion.INITIAL;

    private SchemaBuilder(String name, SchemaRegistry registry) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Starts a definition.
     *
     * @param name entity type name
     * @param registry registry to build into
     * @return new builder
     */
    public static SchemaBuilder define(String name, SchemaRegistry registry) {
        return new SchemaBuilder(name, registry);
    }

    public SchemaBuilder idAttribute(String attribute) {
        this.idAttribute = attribute;
        return this;
    }

    /**
     * Adds a singular relation.
     *
     * @param field field holding the nested entity
     * @param target target entity type
     * @return this builder
     */
    public SchemaBuilder belongsTo(String field, String target) {
        relations.put(field, new RelationSpec(field, RelationKind.ENTITY, Map.of(target, target), null));
        return this;
    }

    /**
     * Adds an array relation.
     *
     * @param field field holding the nested entities
     * @param target target entity type
     * @return this builder
     */
    public SchemaBuilder hasMany(String field, String target) {
        relations.put(field, new RelationSpec(field, RelationKind.ARRAY, Map.of(target, target), null));
        return this;
    }

    /**
     * Adds a union relation.
     *
     * @param field field holding the nested entity
     * @param members union tag to entity type
     * @param discriminator input field holding the tag, null for the default
     * @return this builder
     */
    public SchemaBuilder union(String field, Map<String, String> members, String discriminator) {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("Union must have at least one schema for field " + field);
        }
        relations.put(field, new RelationSpec(field, RelationKind.UNION, new LinkedHashMap<>(members), discriminator));
        return this;
    }

    public SchemaBuilder exclude(String... fields) {
        excludeFields.addAll(Arrays.asList(fields));
        return this;
    }

    public SchemaBuilder process(UnaryOperator<Entity> strategy) {
        this.processStrategy = strategy;
        return this;
    }

    public SchemaBuilder merge(BinaryOperator<Entity> strategy) {
        this.mergeStrategy = strategy;
        return this;
    }

    /**
     * Sets the schema version.
     *
     * @param number version, at least 1
     * @param migration single-step migration from older versions, may be null
     * @return this builder
     */
    public SchemaBuilder version(int number, EntityMigration migration) {
        this.version = SchemaVersion.of(number, migration);
        return this;
    }

    /**
     * Builds the schema and registers it. A placeholder previously declared under the
     * same name is completed in place so existing references see the final schema.
     *
     * @return registered entity schema
     * @throws DuplicateSchemaException if a complete schema is already registered under the name
     */
    public EntitySchema build() {
        EntitySchema.Options options = new EntitySchema.Options(
            idAttribute, processStrategy, mergeStrategy, excludeFields);

        EntitySchema schema;
        if (registry.isPlaceholder(name)) {
            schema = registry.getEntity(name);
            schema.configure(options);
        } else {
            if (registry.has(name)) {
                throw new DuplicateSchemaException(name);
            }
            schema = new EntitySchema(name, Map.of(), options);
            registry.register(name, schema, version);
        }

        // Resolve targets after registration so self references find this schema
        for (RelationSpec relation : relations.values()) {
            schema.define(Map.of(relation.field(), relation.resolve(registry)));
        }
        registry.register(name, schema, version, true);
        return schema;
    }

    private record RelationSpec(
        String field,
        RelationKind kind,
        Map<String, String> members,
        String discriminator
    ) {
        Schema resolve(SchemaRegistry registry) {
            return switch (kind) {
                case ENTITY -> registry.declare(members.values().iterator().next());
                case ARRAY -> Schemas.array(registry.declare(members.values().iterator().next()));
                case UNION -> {
                    Map<String, EntitySchema> resolved = new LinkedHashMap<>();
                    members.forEach((tag, target) -> resolved.put(tag, registry.declare(target)));
                    yield Schemas.union(resolved, discriminator);
                }
            };
        }
    }
}
