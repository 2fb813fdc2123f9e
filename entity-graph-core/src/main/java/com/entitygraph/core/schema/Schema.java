package com.entitygraph.core.schema;

/**
 * A node of a normalization schema.
 *
 * <p>Schemas describe how a nested input maps onto the flat store. They are built with
 * the {@link Schemas} factories and usually registered in a {@link SchemaRegistry}.
 *
 * @see EntitySchema
 * @see ArraySchema
 * @see ObjectSchema
 * @see UnionSchema
 * @see ValueSchema
 */
public interface Schema {

    /**
     * Returns the variant of this schema node, used for dispatch.
     *
     * @return schema kind
     */
    SchemaKind kind();
}
