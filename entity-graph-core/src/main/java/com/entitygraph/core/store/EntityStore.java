package com.entitygraph.core.store;

import com.entitygraph.core.model.Entity;
import com.entitygraph.core.model.NormalizedEntities;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Copy-on-write operations on a {@link NormalizedEntities} store.
 *
 * <p>Every operation leaves its arguments untouched and returns a new store, or the
 * same instance when nothing changes.
 */
public final class EntityStore {

    private EntityStore() {
        // Utility class
    }

    /**
     * @param type entity type
     * @param id entity id
     * @param entities store
     * @return entity, if present
     */
    public static Optional<Entity> getEntity(String type, String id, NormalizedEntities entities) {
        return entities.find(type, id);
    }

    /**
     * Looks up several entities, skipping missing ids.
     *
     * @param type entity type
     * @param ids ids in the wanted order
     * @param entities store
     * @return present entities in id order
     */
    public static List<Entity> getEntities(String type, List<String> ids, NormalizedEntities entities) {
        Map<String, Entity> entityMap = entities.entityMap(type);
        List<Entity> found = new ArrayList<>(ids.size());
        for (String id : ids) {
            Entity entity = entityMap.get(id);
            if (entity != null) {
                found.add(entity);
            }
        }
        return List.copyOf(found);
    }

    /**
     * @param type entity type
     * @param entities store
     * @return all entities of the type in insertion order
     */
    public static List<Entity> getAllEntities(String type, NormalizedEntities entities) {
        return List.copyOf(entities.entityMap(type).values());
    }

    /**
     * Shallow-merges fields into an existing entity.
     *
     * @param entities store
     * @param type entity type
     * @param id entity id
     * @param updates fields to set
     * @return updated store, or the same store when the entity does not exist
     */
    public static NormalizedEntities updateEntity(NormalizedEntities entities, String type, String id,
                                                  Map<String, ?> updates) {
        Objects.requireNonNull(updates, "updates must not be null");
        Optional<Entity> existing = entities.find(type, id);
        if (existing.isEmpty()) {
            return entities;
        }
        return putEntity(entities, type, id, existing.get().merge(updates));
    }

    /**
     * Inserts or replaces an entity.
     *
     * @param entities store
     * @param type entity type
     * @param id entity id
     * @param entity new record
     * @return updated store
     */
    public static NormalizedEntities putEntity(NormalizedEntities entities, String type, String id, Entity entity) {
        Objects.requireNonNull(entity, "entity must not be null");
        Map<String, Map<String, Entity>> copy = entities.toMutableMap();
        copy.computeIfAbsent(type, key -> new LinkedHashMap<>()).put(id, entity);
        return NormalizedEntities.of(copy);
    }

    /**
     * @param entities store
     * @param type entity type
     * @param id entity id
     * @return store without the entity, or the same store when it does not exist
     */
    public static NormalizedEntities removeEntity(NormalizedEntities entities, String type, String id) {
        if (!entities.contains(type, id)) {
            return entities;
        }
        Map<String, Map<String, Entity>> copy = entities.toMutableMap();
        copy.get(type).remove(id);
        return NormalizedEntities.of(copy);
    }

    /**
     * Merges two stores, shallow-merging records present in both.
     *
     * @param base existing store
     * @param incoming store to merge in
     * @return combined store
     */
    public static NormalizedEntities mergeEntities(NormalizedEntities base, NormalizedEntities incoming) {
        return mergeEntities(base, incoming, MergeStrategy.MERGE);
    }

    /**
     * Merges two stores.
     *
     * @param base existing store
     * @param incoming store to merge in
     * @param strategy how to resolve ids present in both
     * @return combined store
     */
    public static NormalizedEntities mergeEntities(NormalizedEntities base, NormalizedEntities incoming,
                                                   MergeStrategy strategy) {
        Objects.requireNonNull(strategy, "strategy must not be null");
        if (incoming.types().isEmpty()) {
            return base;
        }
        Map<String, Map<String, Entity>> copy = base.toMutableMap();
        incoming.types().forEach((type, entities) -> {
            Map<String, Entity> target = copy.computeIfAbsent(type, key -> new LinkedHashMap<>());
            entities.forEach((id, entity) -> {
                Entity existing = target.get(id);
                Entity merged = existing == null ? entity : switch (strategy) {
                    case OVERWRITE -> entity;
                    case KEEP -> existing;
                    case MERGE -> existing.merge(entity);
                };
                target.put(id, merged);
            });
        });
        return NormalizedEntities.of(copy);
    }
}
