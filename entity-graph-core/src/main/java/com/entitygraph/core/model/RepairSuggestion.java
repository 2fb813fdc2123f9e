package com.entitygraph.core.model;

import com.entitygraph.core.util.Values;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;
import java.util.Objects;

/**
 * Mechanical repair attached to a violation.
 *
 * @param action repair action
 * @param data replacement fields for {@link RepairAction#UPDATE}, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RepairSuggestion(
    RepairAction action,
    Map<String, Object> data
) {
    /**
     * Compact constructor with validation.
     */
    public RepairSuggestion {
        Objects.requireNonNull(action, "action must not be null");
        if (data != null) {
            data = Values.freezeFields(data);
        }
    }

    public static RepairSuggestion delete() {
        return new RepairSuggestion(RepairAction.DELETE, null);
    }

    public static RepairSuggestion nullify() {
        return new RepairSuggestion(RepairAction.NULLIFY, null);
    }

    public static RepairSuggestion update(Map<String, ?> data) {
        Objects.requireNonNull(data, "data must not be null");
        return new RepairSuggestion(RepairAction.UPDATE, Values.freezeFields(data));
    }
}
