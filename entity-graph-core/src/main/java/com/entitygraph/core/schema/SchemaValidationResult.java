package com.entitygraph.core.schema;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link SchemaRegistry#validate()}.
 *
 * @param valid true when there are no errors
 * @param errors problems that break normalization or integrity checks
 * @param warnings diagnostics only
 */
public record SchemaValidationResult(
    boolean valid,
    List<Issue> errors,
    List<Issue> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public SchemaValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static SchemaValidationResult of(List<Issue> errors, List<Issue> warnings) {
        return new SchemaValidationResult(errors.isEmpty(), errors, warnings);
    }

    /**
     * A single validation finding.
     *
     * @param schema registered name the finding belongs to
     * @param type finding kind
     * @param message human readable message
     */
    public record Issue(String schema, IssueType type, String message) {

        /**
         * Compact constructor with validation.
         */
        public Issue {
            Objects.requireNonNull(schema, "schema must not be null");
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    /**
     * Kinds of validation findings.
     */
    public enum IssueType {
        /** A relation targets an entity type that is not registered. */
        MISSING_RELATION,

        /** A relation targets a name bound to a non-entity schema. */
        INVALID_DEFINITION,

        /** An entity type no other schema references. */
        UNUSED_SCHEMA
    }
}
