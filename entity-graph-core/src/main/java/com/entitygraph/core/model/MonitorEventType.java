package com.entitygraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Kinds of events emitted by the consistency monitor.
 */
public enum MonitorEventType {
    @JsonProperty("check-start")
    CHECK_START,

    @JsonProperty("check-complete")
    CHECK_COMPLETE,

    @JsonProperty("violation-detected")
    VIOLATION_DETECTED,

    @JsonProperty("repair-start")
    REPAIR_START,

    @JsonProperty("repair-complete")
    REPAIR_COMPLETE,

    @JsonProperty("drift-detected")
    DRIFT_DETECTED,

    @JsonProperty("snapshot-created")
    SNAPSHOT_CREATED,

    @JsonProperty("status-change")
    STATUS_CHANGE,

    @JsonProperty("error")
    ERROR
}
