package com.entitygraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Declares an expected referential-integrity rule between two entity types.
 *
 * <p>Separate from, but normally mirroring, the relations of an entity schema.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * RelationDefinition author = RelationDefinition.required("posts", "author", "users")
 *     .withOnDelete(OnDelete.CASCADE);
 * }</pre>
 *
 * @param from source entity type
 * @param field field on the source holding the id (or ids)
 * @param to target entity type
 * @param required whether the reference must be present and resolvable
 * @param isArray whether the field holds a list of ids
 * @param onDelete repair policy for dangling references, defaults to {@link OnDelete#NO_ACTION}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RelationDefinition(
    @JsonProperty("from") String from,
    @JsonProperty("field") String field,
    @JsonProperty("to") String to,
    @JsonProperty("required") boolean required,
    @JsonProperty("isArray") boolean isArray,
    @JsonProperty("onDelete") OnDelete onDelete
) {
    /**
     * Compact constructor with validation.
     */
    public RelationDefinition {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (onDelete == null) {
            onDelete = OnDelete.NO_ACTION;
        }
    }

    /**
     * Optional singular relation.
     *
     * @param from source type
     * @param field reference field
     * @param to target type
     * @return relation definition
     */
    public static RelationDefinition optional(String from, String field, String to) {
        return new RelationDefinition(from, field, to, false, false, OnDelete.NO_ACTION);
    }

    /**
     * Required singular relation.
     *
     * @param from source type
     * @param field reference field
     * @param to target type
     * @return relation definition
     */
    public static RelationDefinition required(String from, String field, String to) {
        return new RelationDefinition(from, field, to, true, false, OnDelete.NO_ACTION);
    }

    /**
     * Array relation (the field holds a list of ids).
     *
     * @param from source type
     * @param field reference field
     * @param to target type
     * @return relation definition
     */
    public static RelationDefinition array(String from, String field, String to) {
        return new RelationDefinition(from, field, to, false, true, OnDelete.NO_ACTION);
    }

    /**
     * @param policy delete policy
     * @return copy with the given policy
     */
    public RelationDefinition withOnDelete(OnDelete policy) {
        return new RelationDefinition(from, field, to, required, isArray, policy);
    }

    /**
     * @return copy marked as required
     */
    public RelationDefinition asRequired() {
        return new RelationDefinition(from, field, to, true, isArray, onDelete);
    }
}
