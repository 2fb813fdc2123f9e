package com.entitygraph.core.integrity.rules;

import com.entitygraph.core.integrity.ConstraintDefinition;
import com.entitygraph.core.model.Entity;
import com.entitygraph.core.model.NormalizedEntities;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Constraints}.
 */
class ConstraintsTest {

    @Test
    void unique_rejectsRepeatedValue() {
        ConstraintDefinition constraint = Constraints.unique("users", "email");
        Entity first = Entity.of(Map.of("id", "1", "email", "a@x"));
        Entity second = Entity.of(Map.of("id", "2", "email", "a@x"));
        Entity other = Entity.of(Map.of("id", "3", "email", "b@x"));
        NormalizedEntities store = NormalizedEntities.of(Map.of("users", Map.of("1", first, "2", second, "3", other)));

        assertThat(constraint.name()).isEqualTo("unique-users-email");
        assertThat(constraint.validate().test(first, store)).isFalse();
        assertThat(constraint.validate().test(other, store)).isTrue();
        assertThat(constraint.message().apply(first))
            .isEqualTo("Field \"email\" must be unique. Value \"a@x\" already exists.");
    }

    @Test
    void unique_ignoresMissingValues() {
        ConstraintDefinition constraint = Constraints.unique("users", "email");
        Entity first = Entity.of(Map.of("id", "1"));
        Entity second = Entity.of(Map.of("id", "2"));
        NormalizedEntities store = NormalizedEntities.of(Map.of("users", Map.of("1", first, "2", second)));

        assertThat(constraint.validate().test(first, store)).isTrue();
    }

    @Test
    void range_checksBothBounds() {
        ConstraintDefinition constraint = Constraints.range("reviews", "stars", 0.0, 5.0);
        Entity tooHigh = Entity.of(Map.of("id", "1", "stars", 7));

        assertThat(constraint.name()).isEqualTo("range-reviews-stars");
        assertThat(constraint.validate().test(tooHigh, NormalizedEntities.empty())).isFalse();
        assertThat(constraint.validate().test(Entity.of(Map.of("id", "2", "stars", 4.5)), NormalizedEntities.empty()))
            .isTrue();
        assertThat(constraint.validate().test(Entity.of(Map.of("id", "3")), NormalizedEntities.empty())).isTrue();
        assertThat(constraint.message().apply(tooHigh)).isEqualTo("Field \"stars\" must be >= 0 and <= 5. Got 7.");
    }

    @Test
    void range_withOnlyMinimum() {
        ConstraintDefinition constraint = Constraints.range("items", "stock", 0.0, null);

        assertThat(constraint.validate().test(Entity.of(Map.of("id", "1", "stock", -1)), NormalizedEntities.empty()))
            .isFalse();
        assertThat(constraint.validate().test(Entity.of(Map.of("id", "2", "stock", 1_000_000)),
            NormalizedEntities.empty())).isTrue();
    }

    @Test
    void pattern_matchesStringValues() {
        ConstraintDefinition constraint = Constraints.pattern("users", "email", Pattern.compile("@"), "an email address");

        assertThat(constraint.name()).isEqualTo("pattern-users-email");
        assertThat(constraint.validate().test(Entity.of(Map.of("id", "1", "email", "a@x")), NormalizedEntities.empty()))
            .isTrue();
        assertThat(constraint.validate().test(Entity.of(Map.of("id", "2", "email", "nope")), NormalizedEntities.empty()))
            .isFalse();
        assertThat(constraint.message().apply(Entity.of(Map.of("id", "2"))))
            .isEqualTo("Field \"email\" must match an email address");
    }

    @Test
    void oneOf_comparesAsStrings() {
        ConstraintDefinition constraint = Constraints.oneOf("posts", "status", List.of("draft", "published"));

        assertThat(constraint.name()).isEqualTo("enum-posts-status");
        assertThat(constraint.validate().test(Entity.of(Map.of("id", "1", "status", "draft")),
            NormalizedEntities.empty())).isTrue();
        assertThat(constraint.message().apply(Entity.of(Map.of("id", "2", "status", "archived"))))
            .isEqualTo("Field \"status\" must be one of [draft, published]. Got \"archived\".");
    }
}
