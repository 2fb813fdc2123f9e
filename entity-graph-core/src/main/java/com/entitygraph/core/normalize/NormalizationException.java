package com.entitygraph.core.normalize;

/**
 * Thrown when input does not fit the schema it is normalized with. Nothing is
 * returned from a failed normalization.
 */
public class NormalizationException extends RuntimeException {

    public NormalizationException(String message) {
        super(message);
    }
}
