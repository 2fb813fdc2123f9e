package com.entitygraph.core.schema;

import com.entitygraph.core.denormalize.DenormalizeOptions;
import com.entitygraph.core.denormalize.Denormalizer;
import com.entitygraph.core.model.Entity;
import com.entitygraph.core.model.NormalizationResult;
import com.entitygraph.core.model.NormalizedEntities;
import com.entitygraph.core.normalize.Normalizer;
import com.entitygraph.core.schema.ExportedSchemas.ExportedRelation;
import com.entitygraph.core.schema.ExportedSchemas.ExportedSchema;
import com.entitygraph.core.schema.ExportedSchemas.RelationKind;
import com.entitygraph.core.schema.SchemaValidationResult.Issue;
import com.entitygraph.core.schema.SchemaValidationResult.IssueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Named collection of schemas owned by the caller.
 *
 * <p>Each registry is independent: create one per store (or per test) and pass it
 * where it is needed. Entity schemas are registered under their own name, which is
 * also their type key in the flat store.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * SchemaRegistry registry = new SchemaRegistry();
 * EntitySchema users = registry.declare("users");
 * registry.register("posts", Schemas.entity("posts", Map.of("author", users)));
 *
 * SchemaValidationResult result = registry.validate();
 * NormalizationResult normalized = registry.normalize(payload, "posts");
 * }</pre>
 *
 * <p>Not thread-safe; registration is expected to happen during setup.
 */
public class SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

    private final Map<String, Schema> schemas = new LinkedHashMap<>();
    private final Map<String, SchemaVersion> versions = new LinkedHashMap<>();
    private final Set<String> placeholders = new HashSet<>();

    /**
     * Registers a schema under a new name.
     *
     * @param name registered name
     * @param schema schema
     * @throws DuplicateSchemaException if the name is taken
     */
    public void register(String name, Schema schema) {
        register(name, schema, SchemaVersion.INITIAL, false);
    }

    /**
     * Registers a schema, optionally replacing an existing registration.
     *
     * @param name registered name
     * @param schema schema
     * @param overwrite replace an existing schema instead of failing
     * @throws DuplicateSchemaException if the name is taken and overwrite is false
     */
    public void register(String name, Schema schema, boolean overwrite) {
        register(name, schema, SchemaVersion.INITIAL, overwrite);
    }

    /**
     * Registers a versioned schema under a new name.
     *
     * @param name registered name
     * @param schema schema
     * @param version version and migration
     * @throws DuplicateSchemaException if the name is taken
     */
    public void register(String name, Schema schema, SchemaVersion version) {
        register(name, schema, version, false);
    }

    /**
     * Registers a versioned schema.
     *
     * @param name registered name
     * @param schema schema
     * @param version version and migration
     * @param overwrite replace an existing schema instead of failing
     * @throws DuplicateSchemaException if the name is taken and overwrite is false
     * @throws IllegalArgumentException if an entity schema is registered under another name
     */
    public void register(String name, Schema schema, SchemaVersion version, boolean overwrite) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(version, "version must not be null");
        if (schema instanceof EntitySchema entity && !entity.name().equals(name)) {
            throw new IllegalArgumentException(
                "Entity schema \"" + entity.name() + "\" must be registered under its own name, not \"" + name + "\"");
        }
        if (schemas.containsKey(name) && !overwrite) {
            throw new DuplicateSchemaException(name);
        }

        schemas.put(name, schema);
        versions.put(name, version);
        placeholders.remove(name);
        log.debug("Registered schema '{}' ({}, version {})", name, schema.kind(), version.version());
    }

    /**
     * Returns the entity schema for a name, registering an empty placeholder when the
     * name is unknown. The placeholder is the instance later filled in with
     * {@link EntitySchema#define(Map)} or {@link SchemaBuilder#build()}, so it can be
     * referenced before it is complete.
     *
     * @param name entity type name
     * @return registered or newly declared entity schema
     * @throws SchemaRegistryException if the name is bound to a non-entity schema
     */
    public EntitySchema declare(String name) {
        Schema existing = schemas.get(name);
        if (existing != null) {
            return asEntity(name, existing);
        }
        EntitySchema placeholder = new EntitySchema(name);
        schemas.put(name, placeholder);
        versions.put(name, SchemaVersion.INITIAL);
        placeholders.add(name);
        log.debug("Declared schema '{}'", name);
        return placeholder;
    }

    /**
     * @param name registered name
     * @return true if the name is registered only through {@link #declare(String)}
     */
    public boolean isPlaceholder(String name) {
        return placeholders.contains(name);
    }

    /**
     * @param name registered name
     * @return schema
     * @throws SchemaNotFoundException if the name is not registered
     */
    public Schema get(String name) {
        Schema schema = schemas.get(name);
        if (schema == null) {
            throw new SchemaNotFoundException(name);
        }
        return schema;
    }

    /**
     * @param name registered name
     * @return entity schema
     * @throws SchemaNotFoundException if the name is not registered
     * @throws SchemaRegistryException if the name is bound to a non-entity schema
     */
    public EntitySchema getEntity(String name) {
        return asEntity(name, get(name));
    }

    /**
     * @param name registered name
     * @return schema, if registered
     */
    public Optional<Schema> find(String name) {
        return Optional.ofNullable(schemas.get(name));
    }

    public boolean has(String name) {
        return schemas.containsKey(name);
    }

    /**
     * @return registered names in registration order
     */
    public List<String> getNames() {
        return List.copyOf(schemas.keySet());
    }

    /**
     * @return registered name to schema, in registration order
     */
    public Map<String, Schema> getAll() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
    }

    /**
     * @param name registered name
     * @return true if something was removed
     */
    public boolean unregister(String name) {
        versions.remove(name);
        placeholders.remove(name);
        boolean removed = schemas.remove(name) != null;
        if (removed) {
            log.debug("Unregistered schema '{}'", name);
        }
        return removed;
    }

    public void clear() {
        schemas.clear();
        versions.clear();
        placeholders.clear();
    }

    /**
     * Normalizes input with a registered schema.
     *
     * @param input nested input
     * @param schemaName registered name
     * @return normalization result
     * @throws SchemaNotFoundException if the name is not registered
     */
    public NormalizationResult normalize(Object input, String schemaName) {
        return Normalizer.normalize(input, get(schemaName));
    }

    /**
     * Denormalizes input with a registered schema.
     *
     * @param input normalized input
     * @param schemaName registered name
     * @param entities store to read from
     * @param options denormalization options
     * @return nested view, or null
     * @throws SchemaNotFoundException if the name is not registered
     */
    public Object denormalize(Object input, String schemaName, NormalizedEntities entities,
                              DenormalizeOptions options) {
        return Denormalizer.denormalize(input, get(schemaName), entities, options);
    }

    /**
     * Checks that every relation target is a registered entity schema.
     *
     * <p>Entity types no other schema references are reported as warnings when more
     * than one schema is registered; roots legitimately have no incoming relation.
     *
     * @return validation result
     */
    public SchemaValidationResult validate() {
        List<Issue> errors = new ArrayList<>();
        List<Issue> warnings = new ArrayList<>();
        Set<String> referenced = new HashSet<>();

        schemas.forEach((name, schema) -> {
            for (Map.Entry<String, Schema> relation : relationsOf(schema).entrySet()) {
                for (EntitySchema target : targetsOf(relation.getValue())) {
                    referenced.add(target.name());
                    String where = relation.getKey().isEmpty()
                        ? "Schema"
                        : "Relation \"" + relation.getKey() + "\"";
                    Schema registered = schemas.get(target.name());
                    if (registered == null) {
                        errors.add(new Issue(name, IssueType.MISSING_RELATION,
                            where + " references undefined schema \"" + target.name() + "\""));
                    } else if (!(registered instanceof EntitySchema)) {
                        errors.add(new Issue(name, IssueType.INVALID_DEFINITION,
                            where + " references \"" + target.name() + "\", which is not an entity schema"));
                    }
                }
            }
        });

        if (schemas.size() > 1) {
            schemas.forEach((name, schema) -> {
                if (schema instanceof EntitySchema && !referenced.contains(name)) {
                    warnings.add(new Issue(name, IssueType.UNUSED_SCHEMA,
                        "Schema \"" + name + "\" is not referenced by any other schema"));
                }
            });
        }

        log.debug("Validated {} schemas: {} errors, {} warnings", schemas.size(), errors.size(), warnings.size());
        return SchemaValidationResult.of(errors, warnings);
    }

    /**
     * @param name registered name
     * @return entity type names the schema references directly, in relation order
     */
    public List<String> getDependencies(String name) {
        Schema schema = schemas.get(name);
        if (schema == null) {
            return List.of();
        }
        Set<String> dependencies = new LinkedHashSet<>();
        relationsOf(schema).values().forEach(relation ->
            targetsOf(relation).forEach(target -> dependencies.add(target.name())));
        return List.copyOf(dependencies);
    }

    /**
     * @param name entity type name
     * @return other registered names whose schemas reference the type
     */
    public List<String> getReverseDependencies(String name) {
        return schemas.keySet().stream()
            .filter(other -> !other.equals(name))
            .filter(other -> getDependencies(other).contains(name))
            .toList();
    }

    /**
     * @param name registered name
     * @return registered version, 0 when the name is unknown
     */
    public int getVersion(String name) {
        SchemaVersion version = versions.get(name);
        return version != null ? version.version() : 0;
    }

    /**
     * Brings a record stored at an older version up to the registered version, one
     * step at a time.
     *
     * @param name registered name
     * @param entity record to migrate
     * @param fromVersion version the record was written with
     * @return migrated record, or the same record when no migration applies
     */
    public Entity migrateEntity(String name, Entity entity, int fromVersion) {
        SchemaVersion version = versions.get(name);
        if (version == null || fromVersion >= version.version() || version.migration() == null) {
            return entity;
        }
        Entity migrated = entity;
        for (int step = fromVersion; step < version.version(); step++) {
            migrated = version.migration().migrate(migrated, step);
        }
        log.debug("Migrated '{}' entity from version {} to {}", name, fromVersion, version.version());
        return migrated;
    }

    /**
     * Exports registered entity schemas. Non-entity registrations and relations that
     * cannot be expressed by name are left out.
     *
     * @return serializable definitions
     */
    public ExportedSchemas exportSchemas() {
        Map<String, ExportedSchema> exported = new LinkedHashMap<>();
        schemas.forEach((name, schema) -> {
            if (!(schema instanceof EntitySchema entity)) {
                log.debug("Skipping export of non-entity schema '{}'", name);
                return;
            }
            Map<String, ExportedRelation> relations = new LinkedHashMap<>();
            entity.relations().forEach((field, relation) ->
                exportRelation(name, field, relation).ifPresent(value -> relations.put(field, value)));
            String idAttribute = Entity.DEFAULT_ID_FIELD.equals(entity.idAttribute()) ? null : entity.idAttribute();
            List<String> excluded = entity.options().excludeFields().stream().sorted().toList();
            exported.put(name, new ExportedSchema(idAttribute, relations, excluded, getVersion(name)));
        });
        return new ExportedSchemas(ExportedSchemas.FORMAT_VERSION, exported, Instant.now().toString());
    }

    /**
     * Replaces the registry contents with imported definitions.
     *
     * <p>Relations may reference types in any order. A target missing from the export
     * stays unregistered so that {@link #validate()} reports it.
     *
     * @param exported definitions to import
     */
    public void importSchemas(ExportedSchemas exported) {
        Objects.requireNonNull(exported, "exported must not be null");
        clear();

        exported.schemas().forEach((name, definition) -> {
            EntitySchema.Options options = EntitySchema.Options.withIdAttribute(definition.idAttribute())
                .withExcludeFields(Set.copyOf(definition.excludeFields()));
            int version = definition.version() != null ? definition.version() : 1;
            register(name, new EntitySchema(name, Map.of(), options), SchemaVersion.of(version, null));
        });

        Map<String, EntitySchema> unresolved = new LinkedHashMap<>();
        exported.schemas().forEach((name, definition) -> {
            EntitySchema entity = getEntity(name);
            definition.relations().forEach((field, relation) ->
                entity.define(Map.of(field, importRelation(relation, unresolved))));
        });
        if (!unresolved.isEmpty()) {
            log.warn("Imported schemas reference unregistered types: {}", unresolved.keySet());
        }
        log.info("Imported {} schemas", exported.schemas().size());
    }

    private Schema importRelation(ExportedRelation relation, Map<String, EntitySchema> unresolved) {
        return switch (relation.type()) {
            case ENTITY -> resolveTarget(relation.schema(), unresolved);
            case ARRAY -> Schemas.array(resolveTarget(relation.schema(), unresolved));
            case UNION -> {
                Map<String, EntitySchema> members = new LinkedHashMap<>();
                Map<String, String> tags = relation.schemas().isEmpty()
                    ? Map.of(relation.schema(), relation.schema())
                    : relation.schemas();
                tags.forEach((tag, target) -> members.put(tag, resolveTarget(target, unresolved)));
                yield Schemas.union(members, relation.discriminator());
            }
        };
    }

    private EntitySchema resolveTarget(String target, Map<String, EntitySchema> unresolved) {
        Schema registered = schemas.get(target);
        if (registered instanceof EntitySchema entity) {
            return entity;
        }
        return unresolved.computeIfAbsent(target, EntitySchema::new);
    }

    private Optional<ExportedRelation> exportRelation(String schemaName, String field, Schema relation) {
        if (relation instanceof EntitySchema entity) {
            return Optional.of(ExportedRelation.entity(entity.name()));
        }
        if (relation instanceof ArraySchema array && array.element() instanceof EntitySchema element) {
            return Optional.of(ExportedRelation.array(element.name()));
        }
        if (relation instanceof UnionSchema union && union.resolver() == null) {
            Map<String, String> tags = new LinkedHashMap<>();
            union.schemas().forEach((tag, member) -> tags.put(tag, member.name()));
            String first = tags.values().iterator().next();
            return Optional.of(new ExportedRelation(first, RelationKind.UNION, tags, union.discriminator()));
        }
        log.warn("Relation '{}.{}' ({}) cannot be exported and is skipped", schemaName, field, relation.kind());
        return Optional.empty();
    }

    /**
     * Relations to inspect for a registered schema: the entity's relations by field, or
     * the schema itself under an empty field name.
     */
    private static Map<String, Schema> relationsOf(Schema schema) {
        if (schema instanceof EntitySchema entity) {
            return entity.relations();
        }
        return Map.of("", schema);
    }

    /**
     * Entity schemas reachable from a relation schema without passing through another entity.
     */
    private static List<EntitySchema> targetsOf(Schema schema) {
        List<EntitySchema> targets = new ArrayList<>();
        collectTargets(schema, targets);
        return targets;
    }

    private static void collectTargets(Schema schema, List<EntitySchema> targets) {
        switch (schema.kind()) {
            case ENTITY -> targets.add((EntitySchema) schema);
            case ARRAY -> collectTargets(((ArraySchema) schema).element(), targets);
            case OBJECT -> ((ObjectSchema) schema).shape().values().forEach(nested -> collectTargets(nested, targets));
            case UNION -> targets.addAll(((UnionSchema) schema).schemas().values());
            case VALUE -> {
                // Values reference nothing
            }
        }
    }

    private static EntitySchema asEntity(String name, Schema schema) {
        if (schema instanceof EntitySchema entity) {
            return entity;
        }
        throw new SchemaRegistryException("Schema \"" + name + "\" is a " + schema.kind() + " schema, not an entity schema");
    }
}
