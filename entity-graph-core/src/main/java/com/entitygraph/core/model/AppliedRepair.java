package com.entitygraph.core.model;

import java.util.Objects;

/**
 * Outcome of one repair attempt.
 *
 * @param violation the violation being repaired
 * @param action applied action name: a {@link RepairAction} wire name or {@link #CUSTOM_HANDLER}
 * @param success false when the repair threw
 */
public record AppliedRepair(
    IntegrityViolation violation,
    String action,
    boolean success
) {
    /** Action name recorded when a caller-supplied handler performed the repair. */
    public static final String CUSTOM_HANDLER = "custom-handler";

    /**
     * Compact constructor with validation.
     */
    public AppliedRepair {
        Objects.requireNonNull(violation, "violation must not be null");
        Objects.requireNonNull(action, "action must not be null");
    }
}
