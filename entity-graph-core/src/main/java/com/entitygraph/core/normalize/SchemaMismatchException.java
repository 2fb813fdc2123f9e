package com.entitygraph.core.normalize;

/**
 * Thrown when a value has the wrong shape for its schema, or a union value carries an
 * unknown tag.
 */
public class SchemaMismatchException extends NormalizationException {

    public SchemaMismatchException(String message) {
        super(message);
    }
}
