package com.entitygraph.core.integrity.rules;

import com.entitygraph.core.integrity.AnomalyRule;
import com.entitygraph.core.model.AnomalyResult;
import com.entitygraph.core.model.NormalizedEntities;
import com.entitygraph.core.model.Severity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Built-in anomaly rules.
 */
public final class AnomalyRules {

    private AnomalyRules() {
        // Utility class
    }

    /**
     * Flags entities sharing the same values for a field tuple. The first entity with
     * a given tuple is kept; later ones are reported as duplicates of it.
     *
     * @param entityType entity type
     * @param fields fields forming the tuple
     * @return warning-severity rule named {@code duplicate-<type>}
     */
    public static AnomalyRule duplicates(String entityType, List<String> fields) {
        List<String> tuple = List.copyOf(fields);
        return new AnomalyRule("duplicate-" + entityType, entityType, entities -> {
            List<AnomalyResult> results = new ArrayList<>();
            Map<String, String> seen = new HashMap<>();
            entities.entityMap(entityType).forEach((id, entity) -> {
                String key = tuple.stream()
                    .map(field -> String.valueOf(Objects.requireNonNullElse(entity.get(field), "")))
                    .collect(Collectors.joining("|"));
                String first = seen.putIfAbsent(key, id);
                if (first != null) {
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("duplicateOf", first);
                    data.put("fields", tuple);
                    results.add(new AnomalyResult(entityType, id,
                        "Duplicate detected: same values as entity \"" + first + "\" for fields ["
                            + String.join(", ", tuple) + "]",
                        "Consider merging or removing duplicate entity", data, null));
                }
            });
            return results;
        }, Severity.WARNING);
    }

    /**
     * Flags entities whose timestamp field is older than a maximum age.
     *
     * @param entityType entity type
     * @param timestampField field holding epoch milliseconds or an ISO-8601 instant
     * @param maxAge maximum tolerated age
     * @return info-severity rule named {@code stale-<type>}
     */
    public static AnomalyRule stale(String entityType, String timestampField, Duration maxAge) {
        return stale(entityType, timestampField, maxAge, Clock.systemUTC());
    }

    /**
     * Stale-data rule reading the current time from a clock.
     *
     * @param entityType entity type
     * @param timestampField field holding epoch milliseconds or an ISO-8601 instant
     * @param maxAge maximum tolerated age
     * @param clock time source
     * @return info-severity rule named {@code stale-<type>}
     */
    public static AnomalyRule stale(String entityType, String timestampField, Duration maxAge, Clock clock) {
        long maxAgeMillis = maxAge.toMillis();
        return new AnomalyRule("stale-" + entityType, entityType, entities -> {
            List<AnomalyResult> results = new ArrayList<>();
            long now = clock.millis();
            entities.entityMap(entityType).forEach((id, entity) -> {
                Long timestamp = epochMillis(entity.get(timestampField));
                if (timestamp == null) {
                    return;
                }
                long age = now - timestamp;
                if (age > maxAgeMillis) {
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("timestamp", entity.get(timestampField));
                    data.put("age", age);
                    results.add(new AnomalyResult(entityType, id,
                        "Stale data: last updated " + Math.round(age / 60_000.0) + " minutes ago",
                        "Consider refreshing this entity from its source", data, null));
                }
            });
            return results;
        }, Severity.INFO);
    }

    /**
     * Flags entities with null or absent required fields.
     *
     * @param entityType entity type
     * @param requiredFields fields that must be present
     * @return error-severity rule named {@code required-fields-<type>}
     */
    public static AnomalyRule requiredFields(String entityType, List<String> requiredFields) {
        List<String> required = List.copyOf(requiredFields);
        return new AnomalyRule("required-fields-" + entityType, entityType, entities -> {
            List<AnomalyResult> results = new ArrayList<>();
            entities.entityMap(entityType).forEach((id, entity) -> {
                List<String> missing = required.stream()
                    .filter(field -> entity.get(field) == null)
                    .toList();
                if (!missing.isEmpty()) {
                    results.add(new AnomalyResult(entityType, id,
                        "Missing required fields: " + String.join(", ", missing),
                        "Populate missing fields or remove the entity", Map.of("missingFields", missing), null));
                }
            });
            return results;
        }, Severity.ERROR);
    }

    /**
     * Cross-entity rule backed by an arbitrary scan.
     *
     * @param name rule name
     * @param check scan function
     * @return warning-severity rule
     */
    public static AnomalyRule consistency(String name, Function<NormalizedEntities, List<AnomalyResult>> check) {
        return new AnomalyRule(name, null, check, Severity.WARNING);
    }

    private static Long epochMillis(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Instant.parse(text).toEpochMilli();
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }
}
