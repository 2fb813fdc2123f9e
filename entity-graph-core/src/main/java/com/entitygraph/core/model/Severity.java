package com.entitygraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Severity of an integrity violation.
 *
 * <p>Only {@link #ERROR} makes an {@link IntegrityReport} invalid.
 */
public enum Severity {
    /** Breaks integrity; makes the report invalid. */
    @JsonProperty("error")
    ERROR,

    /** Suspicious but tolerated. */
    @JsonProperty("warning")
    WARNING,

    /** Informational only. */
    @JsonProperty("info")
    INFO
}
