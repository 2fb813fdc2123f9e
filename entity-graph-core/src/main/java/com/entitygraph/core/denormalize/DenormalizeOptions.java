package com.entitygraph.core.denormalize;

import com.entitygraph.core.model.CircularBehavior;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Options for {@link Denormalizer}.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * DenormalizeOptions options = DenormalizeOptions.builder()
 *     .maxDepth(2)
 *     .excludeFields("password")
 *     .circularBehavior(CircularBehavior.SKIP)
 *     .build();
 * }</pre>
 *
 * @param maxDepth entities deeper than this resolve to their bare id; {@link #UNBOUNDED} for no limit
 * @param includeFields when non-empty, only these fields (plus the id) are emitted
 * @param excludeFields fields never emitted, wins over includeFields; the id is always kept
 * @param memoize reuse results per (type, id, depth) within one call
 * @param circularBehavior what to emit for an entity already on the current path
 */
public record DenormalizeOptions(
    int maxDepth,
    Set<String> includeFields,
    Set<String> excludeFields,
    boolean memoize,
    CircularBehavior circularBehavior
) {
    /** Depth limit meaning no limit. */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private static final DenormalizeOptions DEFAULTS = builder().build();

    /**
     * Compact constructor with validation and defaults.
     */
    public DenormalizeOptions {
        if (maxDepth < 0) {
            maxDepth = UNBOUNDED;
        }
        includeFields = includeFields != null ? Set.copyOf(includeFields) : Set.of();
        excludeFields = excludeFields != null ? Set.copyOf(excludeFields) : Set.of();
        if (circularBehavior == null) {
            circularBehavior = CircularBehavior.ID_ONLY;
        }
    }

    /**
     * @return unbounded depth, all fields, memoized, id-only cycles
     */
    public static DenormalizeOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return builder initialized with these options
     */
    public Builder toBuilder() {
        return new Builder()
            .maxDepth(maxDepth)
            .includeFields(includeFields)
            .excludeFields(excludeFields)
            .memoize(memoize)
            .circularBehavior(circularBehavior);
    }

    /**
     * Decides whether a stored field is emitted.
     *
     * @param field field name
     * @param idAttribute id field of the entity being emitted
     * @return true if the field is emitted
     */
    public boolean includesField(String field, String idAttribute) {
        if (field.equals(idAttribute)) {
            return true;
        }
        if (excludeFields.contains(field)) {
            return false;
        }
        return includeFields.isEmpty() || includeFields.contains(field);
    }

    /**
     * Builder for DenormalizeOptions.
     */
    public static class Builder {
        private int maxDepth = UNBOUNDED;
        private final Set<String> includeFields = new LinkedHashSet<>();
        private final Set<String> excludeFields = new LinkedHashSet<>();
        private boolean memoize = true;
        private CircularBehavior circularBehavior = CircularBehavior.ID_ONLY;

        public Builder maxDepth(int depth) {
            this.maxDepth = depth;
            return this;
        }

        public Builder includeFields(String... fields) {
            return includeFields(List.of(fields));
        }

        public Builder includeFields(Iterable<String> fields) {
            fields.forEach(includeFields::add);
            return this;
        }

        public Builder excludeFields(String... fields) {
            return excludeFields(List.of(fields));
        }

        public Builder excludeFields(Iterable<String> fields) {
            fields.forEach(excludeFields::add);
            return this;
        }

        public Builder memoize(boolean enabled) {
            this.memoize = enabled;
            return this;
        }

        public Builder circularBehavior(CircularBehavior behavior) {
            this.circularBehavior = behavior;
            return this;
        }

        public DenormalizeOptions build() {
            return new DenormalizeOptions(maxDepth, includeFields, excludeFields, memoize, circularBehavior);
        }
    }
}
