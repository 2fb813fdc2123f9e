package com.entitygraph.core.schema;

import java.util.Map;
import java.util.function.Function;

/**
 * Factories for schema nodes.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * EntitySchema user = Schemas.entity("users");
 * EntitySchema post = Schemas.entity("posts", Map.of(
 *     "author", user,
 *     "comments", Schemas.array(Schemas.entity("comments", Map.of("author", user)))));
 * }</pre>
 */
public final class Schemas {

    private Schemas() {
        // Utility class
    }

    public static EntitySchema entity(String name) {
        return new EntitySchema(name);
    }

    public static EntitySchema entity(String name, Map<String, ? extends Schema> relations) {
        return new EntitySchema(name, relations, EntitySchema.Options.defaults());
    }

    public static EntitySchema entity(String name, Map<String, ? extends Schema> relations,
                                      EntitySchema.Options options) {
        return new EntitySchema(name, relations, options);
    }

    public static ArraySchema array(Schema element) {
        return new ArraySchema(element);
    }

    public static ObjectSchema object(Map<String, Schema> shape) {
        return new ObjectSchema(shape);
    }

    /**
     * Union resolved by a discriminator field.
     *
     * @param schemas tag to member schema
     * @param discriminatorField field holding the tag, null for {@value UnionSchema#DEFAULT_DISCRIMINATOR}
     * @return union schema
     */
    public static UnionSchema union(Map<String, EntitySchema> schemas, String discriminatorField) {
        return new UnionSchema(schemas, discriminatorField, null);
    }

    /**
     * Union resolved by a function of the raw input.
     *
     * @param schemas tag to member schema
     * @param resolver computes the tag
     * @return union schema
     */
    public static UnionSchema union(Map<String, EntitySchema> schemas,
                                    Function<Map<String, Object>, String> resolver) {
        return new UnionSchema(schemas, null, resolver);
    }

    public static ValueSchema value() {
        return ValueSchema.INSTANCE;
    }
}
