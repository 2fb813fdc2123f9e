package com.entitygraph.core.model;

import com.entitygraph.core.util.Values;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A flat entity record: an insertion-ordered field map holding an id field plus payload.
 *
 * <p>Relation fields hold ids, id lists or nested id structures rather than nested
 * records. The field map is deep-frozen on construction, so an {@code Entity} can be
 * shared between stores and snapshots. Field values may be {@code null}.
 *
 * <p>Serializes to and from a plain JSON object.
 *
 * @param fields field name to value
 */
public record Entity(Map<String, Object> fields) {

    /** Default name of the id field. */
    public static final String DEFAULT_ID_FIELD = "id";

    /**
     * Compact constructor with validation.
     */
    public Entity {
        Objects.requireNonNull(fields, "fields must not be null");
        fields = Values.freezeFields(fields);
    }

    /**
     * Creates an entity from a field map.
     *
     * @param fields field map
     * @return new entity
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Entity of(Map<String, Object> fields) {
        return new Entity(fields);
    }

    @Override
    @JsonValue
    public Map<String, Object> fields() {
        return fields;
    }

    /**
     * @param field field name
     * @return field value, or null when absent or null
     */
    public Object get(String field) {
        return fields.get(field);
    }

    /**
     * @param field field name
     * @return true if the field is present, even with a null value
     */
    public boolean has(String field) {
        return fields.containsKey(field);
    }

    /**
     * Reads the id using the given id field.
     *
     * @param idField id field name
     * @return id as string, or null when the field is absent or null
     */
    public String id(String idField) {
        return Values.idString(fields.get(idField));
    }

    /**
     * Reads the id using {@link #DEFAULT_ID_FIELD}.
     *
     * @return id as string, or null
     */
    public String id() {
        return id(DEFAULT_ID_FIELD);
    }

    /**
     * Returns a copy with one field set.
     *
     * @param field field name
     * @param value new value, may be null
     * @return updated copy
     */
    public Entity with(String field, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(field, value);
        return new Entity(copy);
    }

    /**
     * Returns a copy with the given fields shallow-merged over this record (last write wins).
     *
     * @param updates fields to apply
     * @return merged copy
     */
    public Entity merge(Map<String, ?> updates) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.putAll(updates);
        return new Entity(copy);
    }

    /**
     * Returns a copy with another entity's fields shallow-merged over this one.
     *
     * @param other incoming record
     * @return merged copy
     */
    public Entity merge(Entity other) {
        return merge(other.fields());
    }
}
