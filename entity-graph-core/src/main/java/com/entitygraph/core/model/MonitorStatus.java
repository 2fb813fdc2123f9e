package com.entitygraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Consistency monitor state.
 */
public enum MonitorStatus {
    /** No check has run yet. */
    @JsonProperty("idle")
    IDLE,

    /** A check is in progress. */
    @JsonProperty("checking")
    CHECKING,

    /** Last check found no violation. */
    @JsonProperty("valid")
    VALID,

    /** Last check or repair left violations. */
    @JsonProperty("invalid")
    INVALID,

    /** A repair is in progress. */
    @JsonProperty("repairing")
    REPAIRING,

    /** The checker threw; cleared by the next successful check. */
    @JsonProperty("error")
    ERROR
}
