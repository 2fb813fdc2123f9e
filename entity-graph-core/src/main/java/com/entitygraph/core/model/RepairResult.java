package com.entitygraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a repair pass.
 *
 * @param entities repaired store, or the original store on a dry run
 * @param repairs repairs attempted, in violation order
 * @param remaining violations left unresolved (no repair, deferred or failed)
 */
public record RepairResult(
    NormalizedEntities entities,
    List<AppliedRepair> repairs,
    List<IntegrityViolation> remaining
) {
    /**
     * Compact constructor with validation.
     */
    public RepairResult {
        Objects.requireNonNull(entities, "entities must not be null");
        repairs = repairs != null ? List.copyOf(repairs) : List.of();
        remaining = remaining != null ? List.copyOf(remaining) : List.of();
    }

    /**
     * @return true when every selected violation was resolved
     */
    @JsonIgnore
    public boolean isComplete() {
        return remaining.isEmpty();
    }
}
