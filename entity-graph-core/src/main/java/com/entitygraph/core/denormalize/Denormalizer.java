package com.entitygraph.core.denormalize;

import com.entitygraph.core.model.Entity;
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
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Rebuilds nested views from the flat store.
 *
 * <p>Missing data never causes an exception: a reference to an absent entity resolves
 * to its bare id, and a {@code null} input yields {@code null}. Cycles are cut
 * according to {@link DenormalizeOptions#circularBehavior()}; the set of entities on the
 * current path is copied per branch so sibling subtrees do not interfere.
 *
 * <p>Within one call, results are memoized per (type, id, depth): the same entity at the
 * same depth is emitted as the same object reference.
 *
 * <p>Emitted objects are unmodifiable maps and lists.
 */
public final class Denormalizer {

    private static final Logger log = LoggerFactory.getLogger(Denormalizer.class);

    private Denormalizer() {
        // Utility class
    }

    /**
     * Denormalizes with default options.
     *
     * @param input normalized value: id, id list or normalized object
     * @param schema schema of the value
     * @param entities store to read from
     * @return nested view, or null
     */
    public static Object denormalize(Object input, Schema schema, NormalizedEntities entities) {
        return denormalize(input, schema, entities, DenormalizeOptions.defaults());
    }

    /**
     * Denormalizes a normalized value.
     *
     * @param input normalized value: id, id list or normalized object
     * @param schema schema of the value
     * @param entities store to read from
     * @param options depth, field and cycle options
     * @return nested view, or null
     */
    public static Object denormalize(Object input, Schema schema, NormalizedEntities entities,
                                     DenormalizeOptions options) {
        Objects.requireNonNull(schema, "schema must not be null");
        if (input == null) {
            return null;
        }
        return new Context(entities, options).visit(input, schema, 0, Set.of());
    }

    /**
     * Denormalizes one entity by type and id.
     *
     * @param type entity type the caller expects
     * @param id entity id
     * @param schema entity schema
     * @param entities store
     * @param options options
     * @return entity view, its bare id when absent, or null when skipped
     */
    public static Object denormalizeEntity(String type, String id, EntitySchema schema,
                                           NormalizedEntities entities, DenormalizeOptions options) {
        if (!schema.name().equals(type)) {
            log.warn("Schema name mismatch: denormalizing '{}' with schema '{}'", type, schema.name());
        }
        return denormalize(id, schema, entities, options);
    }

    /**
     * Denormalizes several entities sharing one memoization cache. Missing entities are
     * dropped.
     *
     * @param ids entity ids
     * @param schema entity schema
     * @param entities store
     * @param options options
     * @return views of the present entities, in id order
     */
    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> denormalizeMany(Collection<String> ids, EntitySchema schema,
                                                            NormalizedEntities entities,
                                                            DenormalizeOptions options) {
        Context context = new Context(entities, options);
        List<Map<String, Object>> views = new ArrayList<>(ids.size());
        for (String id : ids) {
            Object view = context.visit(id, schema, 0, Set.of());
            if (view instanceof Map<?, ?>) {
                views.add((Map<String, Object>) view);
            }
        }
        return Collections.unmodifiableList(views);
    }

    /**
     * Denormalizes emitting only the given fields (plus ids).
     *
     * @param input normalized value
     * @param schema schema of the value
     * @param entities store
     * @param fields fields to emit
     * @return nested view, or null
     */
    public static Object denormalizeSelect(Object input, Schema schema, NormalizedEntities entities,
                                           Collection<String> fields) {
        return denormalize(input, schema, entities, DenormalizeOptions.builder().includeFields(fields).build());
    }

    /**
     * Denormalizes the root and its direct relations only; deeper entities stay ids.
     *
     * @param input normalized value
     * @param schema schema of the value
     * @param entities store
     * @return nested view, or null
     */
    public static Object denormalizeShallow(Object input, Schema schema, NormalizedEntities entities) {
        return denormalize(input, schema, entities, DenormalizeOptions.builder().maxDepth(1).build());
    }

    /**
     * Checks whether every reference directly reachable from the input resolves in the store.
     *
     * @param input normalized value
     * @param schema schema of the value
     * @param entities store
     * @return true if no reference would degrade to a bare id
     */
    public static boolean canDenormalize(Object input, Schema schema, NormalizedEntities entities) {
        if (input == null) {
            return true;
        }
        return switch (schema.kind()) {
            case ENTITY -> input instanceof Map<?, ?>
                || entities.contains(((EntitySchema) schema).name(), Values.idString(input));
            case ARRAY -> input instanceof List<?> items
                && items.stream().allMatch(item -> canDenormalize(item, ((ArraySchema) schema).element(), entities));
            case OBJECT -> {
                Map<String, Object> object = Values.asMap(input);
                yield object != null && ((ObjectSchema) schema).shape().entrySet().stream()
                    .allMatch(field -> canDenormalize(object.get(field.getKey()), field.getValue(), entities));
            }
            case UNION -> resolveUnion(input, (UnionSchema) schema)
                .map(target -> entities.contains(target.schema().name(), target.id()))
                .orElseGet(() -> ((UnionSchema) schema).schemas().values().stream()
                    .anyMatch(member -> entities.contains(member.name(), Values.idString(input))));
            case VALUE -> true;
        };
    }

    private static Optional<UnionTarget> resolveUnion(Object value, UnionSchema schema) {
        Map<String, Object> tagged = Values.asMap(value);
        if (tagged == null) {
            return Optional.empty();
        }
        Object tag = tagged.get(UnionSchema.SCHEMA_KEY);
        String id = Values.idString(tagged.get(UnionSchema.ID_KEY));
        if (tag == null || id == null) {
            return Optional.empty();
        }
        return schema.member(String.valueOf(tag)).map(member -> new UnionTarget(member, id));
    }

    private record UnionTarget(EntitySchema schema, String id) {
    }

    private static final class Context {

        private final NormalizedEntities entities;
        private final DenormalizeOptions options;
        private final Map<String, Object> cache = new HashMap<>();

        private Context(NormalizedEntities entities, DenormalizeOptions options) {
            this.entities = Objects.requireNonNull(entities, "entities must not be null");
            this.options = options != null ? options : DenormalizeOptions.defaults();
        }

        Object visit(Object value, Schema schema, int depth, Set<String> visited) {
            if (value == null) {
                return null;
            }
            return switch (schema.kind()) {
                case ENTITY -> visitEntity(value, (EntitySchema) schema, depth, visited);
                case ARRAY -> visitArray(value, (ArraySchema) schema, depth, visited);
                case OBJECT -> visitObject(value, (ObjectSchema) schema, depth, visited);
                case UNION -> visitUnion(value, (UnionSchema) schema, depth, visited);
                case VALUE -> value;
            };
        }

        private Object visitEntity(Object value, EntitySchema schema, int depth, Set<String> visited) {
            if (value instanceof Map<?, ?>) {
                // Already denormalized
                return value;
            }
            String id = Values.idString(value);
            String key = schema.name() + ":" + id;

            if (depth > options.maxDepth()) {
                return id;
            }
            if (visited.contains(key)) {
                return switch (options.circularBehavior()) {
                    case SKIP -> null;
                    case ID_ONLY -> id;
                    case SHALLOW -> entities.find(schema.name(), id)
                        .<Object>map(entity -> shallowView(entity, schema)).orElse(id);
                };
            }

            String cacheKey = key + ":" + depth;
            if (options.memoize()) {
                Object cached = cache.get(cacheKey);
                if (cached != null) {
                    return cached;
                }
            }

            Optional<Entity> stored = entities.find(schema.name(), id);
            if (stored.isEmpty()) {
                return id;
            }

            Set<String> branch = new HashSet<>(visited);
            branch.add(key);
            Map<String, Object> view = new LinkedHashMap<>();
            stored.get().fields().forEach((field, fieldValue) -> {
                if (!options.includesField(field, schema.idAttribute())) {
                    return;
                }
                Schema relation = schema.relations().get(field);
                view.put(field, relation != null ? visit(fieldValue, relation, depth + 1, branch) : fieldValue);
            });

            Map<String, Object> result = Collections.unmodifiableMap(view);
            if (options.memoize()) {
                cache.put(cacheKey, result);
            }
            return result;
        }

        private Map<String, Object> shallowView(Entity entity, EntitySchema schema) {
            Map<String, Object> view = new LinkedHashMap<>();
            entity.fields().forEach((field, fieldValue) -> {
                if (options.includesField(field, schema.idAttribute())) {
                    view.put(field, fieldValue);
                }
            });
            return Collections.unmodifiableMap(view);
        }

        private Object visitArray(Object value, ArraySchema schema, int depth, Set<String> visited) {
            if (!(value instanceof List<?> items)) {
                log.debug("Expected a list for array schema, returning {} unchanged", value.getClass().getSimpleName());
                return value;
            }
            List<Object> results = new ArrayList<>(items.size());
            for (Object item : items) {
                Object result = visit(item, schema.element(), depth, visited);
                if (result != null) {
                    results.add(result);
                }
            }
            return Collections.unmodifiableList(results);
        }

        private Object visitObject(Object value, ObjectSchema schema, int depth, Set<String> visited) {
            Map<String, Object> input = Values.asMap(value);
            if (input == null) {
                log.debug("Expected an object for object schema, returning {} unchanged", value.getClass().getSimpleName());
                return value;
            }
            Map<String, Object> result = new LinkedHashMap<>();
            input.forEach((field, fieldValue) -> {
                if (!options.includesField(field, null)) {
                    return;
                }
                Schema fieldSchema = schema.shape().get(field);
                result.put(field, fieldSchema != null ? visit(fieldValue, fieldSchema, depth, visited) : fieldValue);
            });
            return Collections.unmodifiableMap(result);
        }

        private Object visitUnion(Object value, UnionSchema schema, int depth, Set<String> visited) {
            Optional<UnionTarget> target = resolveUnion(value, schema);
            if (target.isPresent()) {
                return visitEntity(target.get().id(), target.get().schema(), depth, visited);
            }
            Map<String, Object> tagged = Values.asMap(value);
            if (tagged != null && tagged.containsKey(UnionSchema.ID_KEY)) {
                // Unknown tag: keep the id
                return Values.idString(tagged.get(UnionSchema.ID_KEY));
            }
            return value;
        }
    }
}
