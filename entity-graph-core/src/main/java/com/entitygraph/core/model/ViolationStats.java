package com.entitygraph.core.model;

import java.util.List;

/**
 * Violation counts by severity.
 *
 * @param total all violations
 * @param errors error-severity violations
 * @param warnings warning-severity violations
 * @param info info-severity violations
 */
public record ViolationStats(
    int total,
    int errors,
    int warnings,
    int info
) {
    /**
     * Counts violations by severity.
     *
     * @param violations violations to count
     * @return statistics
     */
    public static ViolationStats of(List<IntegrityViolation> violations) {
        int errors = 0;
        int warnings = 0;
        int info = 0;
        for (IntegrityViolation violation : violations) {
            switch (violation.severity()) {
                case ERROR -> errors++;
                case WARNING -> warnings++;
                case INFO -> info++;
            }
        }
        return new ViolationStats(violations.size(), errors, warnings, info);
    }
}
