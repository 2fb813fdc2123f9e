package com.entitygraph.core.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serializable form of a registry's entity schemas.
 *
 * <p>Functions (process, merge and migration strategies, union resolvers) are not
 * exported. Example YAML:
 * <pre>{@code
 * version: "1.0.0"
 * schemas:
 *   users: {}
 *   posts:
 *     relations:
 *       author: { schema: users }
 *       tags: { schema: tags, type: array }
 * }</pre>
 *
 * @param version export format version
 * @param schemas registered name to schema definition
 * @param exportedAt ISO-8601 export time, may be null in hand-written files
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExportedSchemas(
    @JsonProperty("version") String version,
    @JsonProperty("schemas") Map<String, ExportedSchema> schemas,
    @JsonProperty("exportedAt") String exportedAt
) {
    /** Current export format version. */
    public static final String FORMAT_VERSION = "1.0.0";

    /**
     * Compact constructor applying defaults.
     */
    public ExportedSchemas {
        if (version == null) {
            version = FORMAT_VERSION;
        }
        schemas = schemas != null ? Collections.unmodifiableMap(new LinkedHashMap<>(schemas)) : Map.of();
    }

    /**
     * One exported entity schema.
     *
     * @param idAttribute id field, null for the default
     * @param relations field name to relation
     * @param excludeFields fields dropped during normalization
     * @param version schema version, null for 1
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record ExportedSchema(
        @JsonProperty("idAttribute") String idAttribute,
        @JsonProperty("relations") Map<String, ExportedRelation> relations,
        @JsonProperty("excludeFields") List<String> excludeFields,
        @JsonProperty("version") Integer version
    ) {
        /**
         * Compact constructor applying defaults.
         */
        public ExportedSchema {
            relations = relations != null ? Collections.unmodifiableMap(new LinkedHashMap<>(relations)) : Map.of();
            excludeFields = excludeFields != null ? List.copyOf(excludeFields) : List.of();
        }
    }

    /**
     * One exported relation.
     *
     * @param schema target entity type; for unions the first member
     * @param type relation shape, defaults to {@link RelationKind#ENTITY}
     * @param schemas union tag to entity type, unions only
     * @param discriminator union discriminator field, unions only
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record ExportedRelation(
        @JsonProperty("schema") String schema,
        @JsonProperty("type") RelationKind type,
        @JsonProperty("schemas") Map<String, String> schemas,
        @JsonProperty("discriminator") String discriminator
    ) {
        /**
         * Compact constructor with validation.
         */
        public ExportedRelation {
            Objects.requireNonNull(schema, "schema must not be null");
            if (type == null) {
                type = RelationKind.ENTITY;
            }
            schemas = schemas != null ? Collections.unmodifiableMap(new LinkedHashMap<>(schemas)) : Map.of();
        }

        public static ExportedRelation entity(String target) {
            return new ExportedRelation(target, RelationKind.ENTITY, null, null);
        }

        public static ExportedRelation array(String target) {
            return new ExportedRelation(target, RelationKind.ARRAY, null, null);
        }
    }

    /**
     * Shapes an exported relation can take.
     */
    public enum RelationKind {
        @JsonProperty("entity")
        ENTITY,

        @JsonProperty("array")
        ARRAY,

        @JsonProperty("union")
        UNION
    }
}
