package com.entitygraph.core.normalize;

/**
 * Thrown when an entity in the input has no id.
 */
public class MissingIdException extends NormalizationException {

    private final String entityType;
    private final String idAttribute;

    public MissingIdException(String entityType, String idAttribute) {
        super("Entity of type \"" + entityType + "\" has no \"" + idAttribute + "\" attribute");
        this.entityType = entityType;
        this.idAttribute = idAttribute;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getIdAttribute() {
        return idAttribute;
    }
}
