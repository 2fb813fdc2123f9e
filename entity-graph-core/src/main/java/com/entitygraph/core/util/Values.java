package com.entitygraph.core.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the loosely typed values held in entity fields.
 *
 * <p>Entity payloads are trees of {@link Map}, {@link List} and scalar values, the
 * shape Jackson produces when it binds JSON to {@code Object}. Maps keep insertion
 * order and may contain {@code null} values, so the JDK's {@code Map.copyOf} cannot
 * be used here.
 */
public final class Values {

    private Values() {
        // Utility class
    }

    /**
     * Returns a deep, unmodifiable copy of a value tree.
     *
     * <p>Maps become insertion-ordered unmodifiable maps, lists become unmodifiable
     * lists, scalars are returned as-is.
     *
     * @param value value to freeze, may be null
     * @return frozen copy
     */
    public static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(String.valueOf(key), freeze(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object nested : list) {
                copy.add(freeze(nested));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /**
     * Deep-freezes every value of a field map.
     *
     * @param fields field map
     * @return unmodifiable, insertion-ordered copy
     */
    public static Map<String, Object> freezeFields(Map<String, ?> fields) {
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((key, value) -> copy.put(key, freeze(value)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Casts a value to a string-keyed map when it is one.
     *
     * @param value candidate value
     * @return the map, or null when the value is not a map
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?>) {
            return (Map<String, Object>) value;
        }
        return null;
    }

    /**
     * Renders an id value as the string key used in entity maps.
     *
     * <p>Integral numbers lose any trailing {@code .0} so that {@code 1} and
     * {@code 1.0} address the same entity.
     *
     * @param id id value, may be null
     * @return id string, or null for a null id
     */
    public static String idString(Object id) {
        if (id == null) {
            return null;
        }
        if (id instanceof Double || id instanceof Float) {
            double number = ((Number) id).doubleValue();
            if (number == Math.rint(number) && !Double.isInfinite(number)) {
                return Long.toString((long) number);
            }
        }
        return String.valueOf(id);
    }

    /**
     * Returns an unmodifiable copy that keeps the source's iteration order.
     *
     * @param source map to copy
     * @param <K> key type
     * @param <V> value type
     * @return ordered, unmodifiable copy
     */
    public static <K, V> Map<K, V> orderedCopy(Map<K, V> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
