package com.entitygraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a relation expects to happen to referencing entities when the target disappears.
 *
 * <p>Drives the repair suggested for a dangling reference.
 */
public enum OnDelete {
    /** Delete the referencing entity. */
    @JsonProperty("cascade")
    CASCADE,

    /** Clear the reference (null for singular relations, drop the id for array relations). */
    @JsonProperty("set-null")
    SET_NULL,

    /** The reference must be fixed by hand. */
    @JsonProperty("restrict")
    RESTRICT,

    /** No automatic repair. */
    @JsonProperty("no-action")
    NO_ACTION
}
