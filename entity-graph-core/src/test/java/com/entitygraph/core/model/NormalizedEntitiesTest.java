package com.entitygraph.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link NormalizedEntities}.
 */
class NormalizedEntitiesTest {

    private static NormalizedEntities sample() {
        Map<String, Map<String, Entity>> types = new LinkedHashMap<>();
        types.put("users", Map.of("u1", Entity.of(Map.of("id", "u1"))));
        types.put("posts", new LinkedHashMap<>());
        return NormalizedEntities.of(types);
    }

    @Test
    void find_andContains_lookUpByTypeAndId() {
        NormalizedEntities store = sample();

        assertThat(store.find("users", "u1")).isPresent();
        assertThat(store.find("users", "u2")).isEmpty();
        assertThat(store.find("comments", "c1")).isEmpty();
        assertThat(store.find("users", null)).isEmpty();
        assertThat(store.contains("users", "u1")).isTrue();
        assertThat(store.contains("users", null)).isFalse();
    }

    @Test
    void counts_includeEmptyTypes() {
        NormalizedEntities store = sample();

        assertThat(store.counts()).containsExactly(entry("users", 1), entry("posts", 0));
        assertThat(store.totalCount()).isEqualTo(1);
        assertThat(store.hasType("posts")).isTrue();
        assertThat(store.entityMap("comments")).isEmpty();
    }

    @Test
    void toMutableMap_doesNotAffectStore() {
        NormalizedEntities store = sample();

        Map<String, Map<String, Entity>> copy = store.toMutableMap();
        copy.get("users").remove("u1");
        copy.put("comments", new LinkedHashMap<>());

        assertThat(store.contains("users", "u1")).isTrue();
        assertThat(store.hasType("comments")).isFalse();
    }

    @Test
    void types_areUnmodifiable() {
        NormalizedEntities store = sample();

        assertThatThrownBy(() -> store.types().put("x", Map.of()))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> store.entityMap("users").clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void json_roundTripsAsPlainNestedObject() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        String json = "{\"users\":{\"u1\":{\"id\":\"u1\",\"name\":\"Alice\"}},\"posts\":{}}";

        NormalizedEntities store = mapper.readValue(json, NormalizedEntities.class);

        assertThat(store.find("users", "u1").map(entity -> entity.get("name"))).contains("Alice");
        assertThat(mapper.writeValueAsString(store)).isEqualTo(json);
    }
}
