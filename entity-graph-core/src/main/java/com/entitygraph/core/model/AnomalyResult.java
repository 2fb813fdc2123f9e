package com.entitygraph.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * One finding of an anomaly rule.
 *
 * @param entityType type of the flagged entity
 * @param entityId id of the flagged entity, null when the finding is store-wide
 * @param description what is wrong
 * @param suggestion human readable hint, informational only
 * @param data extra details for reporting
 * @param repair explicit mechanical repair, null when none should be applied
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnomalyResult(
    String entityType,
    String entityId,
    String description,
    String suggestion,
    Object data,
    RepairSuggestion repair
) {
    /**
     * Compact constructor with validation.
     */
    public AnomalyResult {
        Objects.requireNonNull(entityType, "entityType must not be null");
        Objects.requireNonNull(description, "description must not be null");
    }

    /**
     * Finding without hint, data or repair.
     *
     * @param entityType entity type
     * @param entityId entity id
     * @param description description
     * @return anomaly result
     */
    public static AnomalyResult of(String entityType, String entityId, String description) {
        return new AnomalyResult(entityType, entityId, description, null, null, null);
    }
}
