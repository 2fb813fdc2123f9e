package com.entitygraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Category of an integrity violation.
 */
public enum ViolationType {
    /** A relation field points to a missing entity, or a required relation is absent. */
    @JsonProperty("referential")
    REFERENTIAL,

    /** A custom constraint rejected the entity. */
    @JsonProperty("constraint")
    CONSTRAINT,

    /** A whole-store anomaly rule flagged the entity. */
    @JsonProperty("anomaly")
    ANOMALY,

    /** A relation-target entity no live relation references. */
    @JsonProperty("orphan")
    ORPHAN
}
