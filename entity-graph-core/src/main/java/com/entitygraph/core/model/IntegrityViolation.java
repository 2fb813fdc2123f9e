package com.entitygraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A single integrity finding. Pure data, never thrown.
 *
 * @param type violation category
 * @param severity severity, only {@link Severity#ERROR} invalidates a report
 * @param entityType type of the offending entity
 * @param entityId id of the offending entity, empty when a rule reports no id
 * @param message human readable message
 * @param field field involved, for referential violations
 * @param related referenced entity, for dangling references
 * @param repair suggested mechanical repair, null when none applies
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntegrityViolation(
    ViolationType type,
    Severity severity,
    String entityType,
    String entityId,
    String message,
    String field,
    EntityRef related,
    RepairSuggestion repair
) {
    /**
     * Compact constructor with validation.
     */
    public IntegrityViolation {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(entityType, "entityType must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (entityId == null) {
            entityId = "";
        }
    }

    /**
     * @return true if this violation has {@link Severity#ERROR}
     */
    @JsonIgnore
    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * @return true if a repair is attached
     */
    public boolean hasRepair() {
        return repair != null;
    }
}
