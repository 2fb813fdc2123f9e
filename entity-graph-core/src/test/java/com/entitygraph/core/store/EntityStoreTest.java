package com.entitygraph.core.store;

import com.entitygraph.core.model.Entity;
import com.entitygraph.core.model.NormalizedEntities;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link EntityStore}.
 */
class EntityStoreTest {

    private NormalizedEntities store;

    @BeforeEach
    void setUp() {
        store = NormalizedEntities.of(Map.of(
            "users", Map.of(
                "u1", Entity.of(Map.of("id", "u1", "name", "Alice")),
                "u2", Entity.of(Map.of("id", "u2", "name", "Bob")))));
    }

    @Test
    void getEntity_returnsPresentEntity() {
        assertThat(EntityStore.getEntity("users", "u1", store))
            .map(entity -> entity.get("name"))
            .contains("Alice");
        assertThat(EntityStore.getEntity("users", "missing", store)).isEmpty();
        assertThat(EntityStore.getEntity("posts", "u1", store)).isEmpty();
    }

    @Test
    void getEntities_skipsMissingIdsAndKeepsOrder() {
        List<Entity> found = EntityStore.getEntities("users", List.of("u2", "nope", "u1"), store);

        assertThat(found).extracting(Entity::id).containsExactly("u2", "u1");
    }

    @Test
    void getAllEntities_ofUnknownType_isEmpty() {
        assertThat(EntityStore.getAllEntities("posts", store)).isEmpty();
        assertThat(EntityStore.getAllEntities("users", store)).hasSize(2);
    }

    @Test
    void updateEntity_mergesFieldsWithoutTouchingInput() {
        NormalizedEntities updated = EntityStore.updateEntity(store, "users", "u1", Map.of("email", "a@x"));

        assertThat(updated.find("users", "u1").orElseThrow().fields())
            .containsEntry("name", "Alice")
            .containsEntry("email", "a@x");
        assertThat(store.find("users", "u1").orElseThrow().has("email")).isFalse();
    }

    @Test
    void updateEntity_absentEntity_returnsSameStore() {
        assertThat(EntityStore.updateEntity(store, "users", "u9", Map.of("name", "X"))).isSameAs(store);
    }

    @Test
    void putEntity_createsTypeWhenMissing() {
        NormalizedEntities updated = EntityStore.putEntity(store, "posts", "p1", Entity.of(Map.of("id", "p1")));

        assertThat(updated.contains("posts", "p1")).isTrue();
        assertThat(store.hasType("posts")).isFalse();
    }

    @Test
    void removeEntity_removesOnlyThatEntity() {
        NormalizedEntities updated = EntityStore.removeEntity(store, "users", "u1");

        assertThat(updated.contains("users", "u1")).isFalse();
        assertThat(updated.contains("users", "u2")).isTrue();
        assertThat(store.contains("users", "u1")).isTrue();
    }

    @Test
    void removeEntity_absentEntity_returnsSameStore() {
        assertThat(EntityStore.removeEntity(store, "users", "u9")).isSameAs(store);
    }

    @Test
    void mergeEntities_emptyIncoming_returnsBase() {
        assertThat(EntityStore.mergeEntities(store, NormalizedEntities.empty())).isSameAs(store);
    }

    @Test
    void mergeEntities_appliesStrategyToSharedIds() {
        NormalizedEntities incoming = NormalizedEntities.of(Map.of(
            "users", Map.of("u1", Entity.of(Map.of("id", "u1", "email", "a@x"))),
            "posts", Map.of("p1", Entity.of(Map.of("id", "p1")))));

        NormalizedEntities merged = EntityStore.mergeEntities(store, incoming);
        NormalizedEntities overwritten = EntityStore.mergeEntities(store, incoming, MergeStrategy.OVERWRITE);
        NormalizedEntities kept = EntityStore.mergeEntities(store, incoming, MergeStrategy.KEEP);

        assertThat(merged.find("users", "u1").orElseThrow().fields())
            .containsOnlyKeys("id", "name", "email");
        assertThat(overwritten.find("users", "u1").orElseThrow().fields())
            .containsOnlyKeys("id", "email");
        assertThat(kept.find("users", "u1").orElseThrow().fields())
            .containsOnlyKeys("id", "name");
        assertThat(merged.contains("posts", "p1")).isTrue();
        assertThat(kept.contains("posts", "p1")).isTrue();
    }
}
