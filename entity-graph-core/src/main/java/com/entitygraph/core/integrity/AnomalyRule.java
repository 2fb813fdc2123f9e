package com.entitygraph.core.integrity;

import com.entitygraph.core.model.AnomalyResult;
import com.entitygraph.core.model.NormalizedEntities;
import com.entitygraph.core.model.Severity;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Whole-store scan producing zero or more findings.
 *
 * @param name rule name, prefixed to violation messages
 * @param entity entity type the rule inspects, null for cross-type rules
 * @param detect scan function
 * @param severity violation severity, defaults to {@link Severity#WARNING}
 */
public record AnomalyRule(
    String name,
    String entity,
    Function<NormalizedEntities, List<AnomalyResult>> detect,
    Severity severity
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public AnomalyRule {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(detect, "detect must not be null");
        if (severity == null) {
            severity = Severity.WARNING;
        }
    }
}
