package com.entitygraph.core.integrity.rules;

import com.entitygraph.core.integrity.ConstraintDefinition;
import com.entitygraph.core.model.Entity;
import com.entitygraph.core.model.Severity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Built-in constraints. All report at {@link Severity#ERROR}.
 */
public final class Constraints {

    private Constraints() {
        // Utility class
    }

    /**
     * Requires a field value to be unique within its type. Entities without the field
     * are not compared.
     *
     * @param entityType entity type
     * @param field field that must be unique
     * @return constraint named {@code unique-<type>-<field>}
     */
    public static ConstraintDefinition unique(String entityType, String field) {
        return new ConstraintDefinition("unique-" + entityType + "-" + field, entityType,
            (entity, entities) -> {
                Object value = entity.get(field);
                if (value == null) {
                    return true;
                }
                for (Entity other : entities.entityMap(entityType).values()) {
                    if (other != entity && Objects.equals(String.valueOf(other.get(field)), String.valueOf(value))) {
                        return false;
                    }
                }
                return true;
            },
            entity -> "Field \"" + field + "\" must be unique. Value \"" + entity.get(field) + "\" already exists.",
            Severity.ERROR, null);
    }

    /**
     * Requires a numeric field to lie within bounds. Non-numeric values pass.
     *
     * @param entityType entity type
     * @param field numeric field
     * @param min inclusive lower bound, null for none
     * @param max inclusive upper bound, null for none
     * @return constraint named {@code range-<type>-<field>}
     */
    public static ConstraintDefinition range(String entityType, String field, Double min, Double max) {
        List<String> bounds = new ArrayList<>();
        if (min != null) {
            bounds.add(">= " + format(min));
        }
        if (max != null) {
            bounds.add("<= " + format(max));
        }
        String expectation = String.join(" and ", bounds);
        return new ConstraintDefinition("range-" + entityType + "-" + field, entityType,
            (entity, entities) -> {
                if (!(entity.get(field) instanceof Number number)) {
                    return true;
                }
                double value = number.doubleValue();
                return (min == null || value >= min) && (max == null || value <= max);
            },
            entity -> "Field \"" + field + "\" must be " + expectation + ". Got " + entity.get(field) + ".",
            Severity.ERROR, null);
    }

    /**
     * Requires a string field to match a pattern. Non-string values pass.
     *
     * @param entityType entity type
     * @param field string field
     * @param pattern pattern the value must contain a match for; anchor it to match the whole value
     * @param description what the pattern means, used in the message
     * @return constraint named {@code pattern-<type>-<field>}
     */
    public static ConstraintDefinition pattern(String entityType, String field, Pattern pattern, String description) {
        return new ConstraintDefinition("pattern-" + entityType + "-" + field, entityType,
            (entity, entities) -> !(entity.get(field) instanceof String text) || pattern.matcher(text).find(),
            entity -> "Field \"" + field + "\" must match " + description,
            Severity.ERROR, null);
    }

    /**
     * Requires a field value to be one of a set. Values compare by their string form,
     * so {@code 1} and {@code "1"} are the same member.
     *
     * @param entityType entity type
     * @param field field
     * @param allowedValues allowed values
     * @return constraint named {@code enum-<type>-<field>}
     */
    public static ConstraintDefinition oneOf(String entityType, String field, Collection<?> allowedValues) {
        List<String> allowed = allowedValues.stream().map(String::valueOf).toList();
        String listing = String.join(", ", allowed);
        return new ConstraintDefinition("enum-" + entityType + "-" + field, entityType,
            (entity, entities) -> allowed.contains(String.valueOf(entity.get(field))),
            entity -> "Field \"" + field + "\" must be one of [" + listing + "]. Got \"" + entity.get(field) + "\".",
            Severity.ERROR, null);
    }

    private static String format(double bound) {
        return bound == Math.rint(bound) ? Long.toString((long) bound) : Double.toString(bound);
    }
}
