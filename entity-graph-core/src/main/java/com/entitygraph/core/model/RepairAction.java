package com.entitygraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Mechanical repair attached to a violation.
 */
public enum RepairAction {
    /** Remove the entity. */
    @JsonProperty("delete")
    DELETE,

    /** Shallow-merge replacement fields into the entity. */
    @JsonProperty("update")
    UPDATE,

    /** Create a missing entity. Never applied automatically. */
    @JsonProperty("create")
    CREATE,

    /** Set the violating field to null. */
    @JsonProperty("nullify")
    NULLIFY;

    /**
     * @return lowercase name as it appears in reports
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
