package com.entitygraph.core.normalize;

import com.entitygraph.core.model.Entity;
import com.entitygraph.core.model.NormalizationResult;
import com.entitygraph.core.model.NormalizedEntities;
import com.entitygraph.core.schema.ArraySchema;
import com.entitygraph.core.schema.EntitySchema;
import com.entitygraph.core.schema.ObjectSchema;
import com.entitygraph.core.schema.Schema;
import com.entitygraph.core.schema.UnionSchema;
import com.entitygraph.core.util.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Flattens nested input into entity records keyed by type and id.
 *
 * <p>Each schema variant is handled as follows:
 * <ul>
 *   <li>entity: the id is read from the id attribute, relation fields are normalized
 *       recursively and replaced by their normalized value, excluded fields are dropped,
 *       and the record is merged into the store. Returns the id as a string.</li>
 *   <li>array: each element is normalized; returns the list of results.</li>
 *   <li>object: declared fields are normalized, other fields pass through.</li>
 *   <li>union: the member is chosen by tag; returns {@code {"id": id, "schema": tag}}.</li>
 *   <li>value: returned unchanged.</li>
 * </ul>
 * A {@code null} input yields {@code null}. The caller's store is never modified.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * NormalizationResult result = Normalizer.normalize(post, postSchema);
 * NormalizedEntities store = EntityStore.mergeEntities(current, result.entities());
 * }</pre>
 */
public final class Normalizer {

    private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

    private Normalizer() {
        // Utility class
    }

    /**
     * Normalizes input into a fresh store.
     *
     * @param input nested input: maps, lists and scalars
     * @param schema schema describing the input
     * @return normalized skeleton and extracted entities
     * @throws MissingIdException if an entity has no id
     * @throws SchemaMismatchException if a value does not fit its schema
     */
    public static NormalizationResult normalize(Object input, Schema schema) {
        return run(input, schema, new LinkedHashMap<>());
    }

    /**
     * Normalizes input on top of a copy of an existing store. Records for ids already
     * present are merged with the schema's merge strategy.
     *
     * @param input nested input
     * @param schema schema describing the input
     * @param existing store to start from, left unchanged
     * @return normalized skeleton and the combined store
     */
    public static NormalizationResult normalizeAndMerge(Object input, Schema schema, NormalizedEntities existing) {
        Objects.requireNonNull(existing, "existing must not be null");
        return run(input, schema, existing.toMutableMap());
    }

    /**
     * Normalizes a list of records of one entity type.
     *
     * @param items records
     * @param schema entity schema of every record
     * @return list of ids and extracted entities
     */
    public static NormalizationResult normalizeBatch(List<?> items, EntitySchema schema) {
        return normalize(items, new ArraySchema(schema));
    }

    private static NormalizationResult run(Object input, Schema schema, Map<String, Map<String, Entity>> store) {
        Objects.requireNonNull(schema, "schema must not be null");
        Context context = new Context(store);
        Object result = context.visit(input, schema);
        NormalizedEntities entities = NormalizedEntities.of(context.store);
        log.debug("Normalized {} entities across {} types", entities.totalCount(), entities.typeNames().size());
        return new NormalizationResult(result, entities);
    }

    private static final class Context {

        private final Map<String, Map<String, Entity>> store;
        // type:id keys of entities on the current recursion path
        private final Set<String> path = new HashSet<>();

        private Context(Map<String, Map<String, Entity>> store) {
            this.store = store;
        }

        Object visit(Object value, Schema schema) {
            if (value == null) {
                return null;
            }
            return switch (schema.kind()) {
                case ENTITY -> visitEntity(value, (EntitySchema) schema);
                case ARRAY -> visitArray(value, (ArraySchema) schema);
                case OBJECT -> visitObject(value, (ObjectSchema) schema);
                case UNION -> visitUnion(value, (UnionSchema) schema);
                case VALUE -> value;
            };
        }

        private String visitEntity(Object value, EntitySchema schema) {
            Map<String, Object> input = requireMap(value, "entity \"" + schema.name() + "\"");
            String id = Values.idString(schema.rawId(input));
            if (id == null) {
                throw new MissingIdException(schema.name(), schema.idAttribute());
            }

            String key = schema.name() + ":" + id;
            if (!path.add(key)) {
                return id;
            }
            try {
                Map<String, Object> record = new LinkedHashMap<>();
                input.forEach((field, fieldValue) -> {
                    if (schema.isExcluded(field)) {
                        return;
                    }
                    Schema relation = schema.relations().get(field);
                    record.put(field, relation != null ? visit(fieldValue, relation) : fieldValue);
                });
                store(schema, id, schema.process(Entity.of(record)));
            } finally {
                path.remove(key);
            }
            return id;
        }

        private void store(EntitySchema schema, String id, Entity entity) {
            Map<String, Entity> entities = store.computeIfAbsent(schema.name(), type -> new LinkedHashMap<>());
            Entity existing = entities.get(id);
            entities.put(id, existing == null ? entity : schema.merge(existing, entity));
        }

        private List<Object> visitArray(Object value, ArraySchema schema) {
            if (!(value instanceof List<?> items)) {
                throw new SchemaMismatchException("Expected a list for array schema but got " + describe(value));
            }
            List<Object> results = new ArrayList<>(items.size());
            for (Object item : items) {
                results.add(visit(item, schema.element()));
            }
            return results;
        }

        private Map<String, Object> visitObject(Object value, ObjectSchema schema) {
            Map<String, Object> input = requireMap(value, "object schema");
            Map<String, Object> result = new LinkedHashMap<>();
            input.forEach((field, fieldValue) -> {
                Schema fieldSchema = schema.shape().get(field);
                result.put(field, fieldSchema != null ? visit(fieldValue, fieldSchema) : fieldValue);
            });
            return result;
        }

        private Map<String, Object> visitUnion(Object value, UnionSchema schema) {
            Map<String, Object> input = requireMap(value, "union schema");
            String tag = schema.tagOf(input);
            EntitySchema member = schema.member(tag)
                .orElseThrow(() -> new SchemaMismatchException(tag == null
                    ? "Union value has no \"" + schema.discriminator() + "\" discriminant"
                    : "Unknown union member \"" + tag + "\", expected one of " + schema.schemas().keySet()));
            String id = visitEntity(input, member);
            Map<String, Object> result = new LinkedHashMap<>();
            result.put(UnionSchema.ID_KEY, id);
            result.put(UnionSchema.SCHEMA_KEY, tag);
            return result;
        }

        private static Map<String, Object> requireMap(Object value, String expectedFor) {
            Map<String, Object> map = Values.asMap(value);
            if (map == null) {
                throw new SchemaMismatchException("Expected an object for " + expectedFor + " but got " + describe(value));
            }
            return map;
        }

        private static String describe(Object value) {
            return value.getClass().getSimpleName() + " " + value;
        }
    }
}
