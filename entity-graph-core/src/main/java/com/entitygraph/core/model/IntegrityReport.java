package com.entitygraph.core.model;

import com.entitygraph.core.util.Values;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one integrity check.
 *
 * @param valid true when no violation has error severity
 * @param timestamp check completion time, epoch milliseconds
 * @param duration check duration in milliseconds
 * @param entityCounts entity count per checked type, 0 for absent types
 * @param violations violations in detection order
 * @param stats violation counts by severity
 */
public record IntegrityReport(
    boolean valid,
    long timestamp,
    double duration,
    Map<String, Integer> entityCounts,
    List<IntegrityViolation> violations,
    ViolationStats stats
) {
    /**
     * Compact constructor with validation.
     */
    public IntegrityReport {
        entityCounts = entityCounts != null ? Values.orderedCopy(entityCounts) : Map.of();
        violations = violations != null ? List.copyOf(violations) : List.of();
        Objects.requireNonNull(stats, "stats must not be null");
    }

    /**
     * Builds a report, deriving validity and statistics from the violations.
     *
     * @param timestamp completion time, epoch milliseconds
     * @param duration duration in milliseconds
     * @param entityCounts per-type counts
     * @param violations detected violations
     * @return report
     */
    public static IntegrityReport of(long timestamp, double duration,
                                     Map<String, Integer> entityCounts,
                                     List<IntegrityViolation> violations) {
        boolean valid = violations.stream().noneMatch(IntegrityViolation::isError);
        return new IntegrityReport(valid, timestamp, duration, entityCounts, violations,
            ViolationStats.of(violations));
    }

    /**
     * @param severity severity to filter by
     * @return violations with that severity
     */
    public List<IntegrityViolation> violationsWithSeverity(Severity severity) {
        return violations.stream()
            .filter(violation -> violation.severity() == severity)
            .toList();
    }

    /**
     * @return true if the report holds any violation, whatever its severity
     */
    public boolean hasViolations() {
        return !violations.isEmpty();
    }
}
