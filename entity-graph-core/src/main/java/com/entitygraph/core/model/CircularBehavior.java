package com.entitygraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What the denormalizer emits when it revisits an entity already on the current path.
 */
public enum CircularBehavior {
    /** Emit null; array elements that resolve to null are dropped. */
    @JsonProperty("skip")
    SKIP,

    /** Emit the bare id. */
    @JsonProperty("id-only")
    ID_ONLY,

    /** Emit the stored record without resolving its relations. */
    @JsonProperty("shallow")
    SHALLOW
}
