package com.entitygraph.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The canonical flat store: entity type name to (id to {@link Entity}).
 *
 * <p>Immutable. Operations that change the store (see
 * {@link com.entitygraph.core.store.EntityStore}) return a new instance and leave
 * this one untouched. Type and id order follow insertion order.
 *
 * <p>Serializes as {@code {"users": {"1": {...}}, "posts": {...}}}.
 *
 * @param types entity type name to entity map
 */
public record NormalizedEntities(Map<String, Map<String, Entity>> types) {

    private static final NormalizedEntities EMPTY = new NormalizedEntities(Map.of());

    /**
     * Compact constructor with validation.
     */
    public NormalizedEntities {
        Objects.requireNonNull(types, "types must not be null");
        Map<String, Map<String, Entity>> copy = new LinkedHashMap<>();
        types.forEach((type, entities) -> {
            Objects.requireNonNull(type, "entity type must not be null");
            Map<String, Entity> entityCopy = new LinkedHashMap<>();
            if (entities != null) {
                entities.forEach((id, entity) ->
                    entityCopy.put(id, Objects.requireNonNull(entity, "entity must not be null")));
            }
            copy.put(type, Collections.unmodifiableMap(entityCopy));
        });
        types = Collections.unmodifiableMap(copy);
    }

    /**
     * @return the empty store
     */
    public static NormalizedEntities empty() {
        return EMPTY;
    }

    /**
     * Creates a store from a type map.
     *
     * @param types type name to entity map
     * @return new store
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static NormalizedEntities of(Map<String, Map<String, Entity>> types) {
        return new NormalizedEntities(types);
    }

    @Override
    @JsonValue
    public Map<String, Map<String, Entity>> types() {
        return types;
    }

    /**
     * @param type entity type name
     * @return entities of that type, empty when the type is absent
     */
    public Map<String, Entity> entityMap(String type) {
        return types.getOrDefault(type, Map.of());
    }

    /**
     * @param type entity type name
     * @return true if the store has a map for the type, even an empty one
     */
    public boolean hasType(String type) {
        return types.containsKey(type);
    }

    /**
     * @param type entity type name
     * @param id entity id
     * @return entity, if present
     */
    public Optional<Entity> find(String type, String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entityMap(type).get(id));
    }

    /**
     * @param type entity type name
     * @param id entity id
     * @return true if the entity exists
     */
    public boolean contains(String type, String id) {
        return id != null && entityMap(type).containsKey(id);
    }

    /**
     * @return entity type names in insertion order
     */
    public Set<String> typeNames() {
        return types.keySet();
    }

    /**
     * @return entity count per type, including empty types
     */
    public Map<String, Integer> counts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        types.forEach((type, entities) -> counts.put(type, entities.size()));
        return Collections.unmodifiableMap(counts);
    }

    /**
     * @return total number of entities across types
     */
    public int totalCount() {
        return types.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Returns a deep mutable copy of the type maps. Entities themselves are immutable
     * and shared.
     *
     * @return mutable copy for building a new store
     */
    public Map<String, Map<String, Entity>> toMutableMap() {
        Map<String, Map<String, Entity>> copy = new LinkedHashMap<>();
        types.forEach((type, entities) -> copy.put(type, new LinkedHashMap<>(entities)));
        return copy;
    }
}
