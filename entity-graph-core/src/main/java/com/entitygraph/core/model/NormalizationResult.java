package com.entitygraph.core.model;

import java.util.Objects;

/**
 * Output of a normalization pass.
 *
 * @param result normalized skeleton: an id, a list of ids, or a map of normalized fields
 * @param entities entities extracted from the input
 */
public record NormalizationResult(
    Object result,
    NormalizedEntities entities
) {
    /**
     * Compact constructor with validation.
     */
    public NormalizationResult {
        Objects.requireNonNull(entities, "entities must not be null");
    }
}
