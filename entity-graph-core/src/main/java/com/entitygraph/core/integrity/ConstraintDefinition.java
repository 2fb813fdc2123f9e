package com.entitygraph.core.integrity;

import com.entitygraph.core.model.Entity;
import com.entitygraph.core.model.NormalizedEntities;
import com.entitygraph.core.model.Severity;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Custom rule applied to every entity of one type.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * ConstraintDefinition title = ConstraintDefinition.of("non-empty-title", "posts",
 *     (post, all) -> post.get("title") instanceof String s && !s.isEmpty(),
 *     "Post must have a non-empty title");
 * }</pre>
 *
 * @param name constraint name, prefixed to violation messages
 * @param entity entity type the constraint applies to
 * @param validate returns false when the entity violates the constraint
 * @param message builds the violation message for a failing entity
 * @param severity violation severity, defaults to {@link Severity#ERROR}
 * @param repair produces the repaired record, may be null
 */
public record ConstraintDefinition(
    String name,
    String entity,
    BiPredicate<Entity, NormalizedEntities> validate,
    Function<Entity, String> message,
    Severity severity,
    BiFunction<Entity, NormalizedEntities, Entity> repair
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public ConstraintDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(validate, "validate must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (severity == null) {
            severity = Severity.ERROR;
        }
    }

    /**
     * Error-severity constraint with a fixed message and no repair.
     *
     * @param name constraint name
     * @param entity entity type
     * @param validate validation predicate
     * @param message violation message
     * @return constraint
     */
    public static ConstraintDefinition of(String name, String entity,
                                          BiPredicate<Entity, NormalizedEntities> validate, String message) {
        return new ConstraintDefinition(name, entity, validate, ignored -> message, Severity.ERROR, null);
    }

    public ConstraintDefinition withSeverity(Severity level) {
        return new ConstraintDefinition(name, entity, validate, message, level, repair);
    }

    public ConstraintDefinition withRepair(BiFunction<Entity, NormalizedEntities, Entity> repairFunction) {
        return new ConstraintDefinition(name, entity, validate, message, severity, repairFunction);
    }
}
