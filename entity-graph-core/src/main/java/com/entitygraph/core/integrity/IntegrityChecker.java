package com.entitygraph.core.integrity;

import com.entitygraph.core.integrity.impl.DefaultIntegrityChecker;
import com.entitygraph.core.model.IntegrityReport;
import com.entitygraph.core.model.IntegrityViolation;
import com.entitygraph.core.model.NormalizedEntities;
import com.entitygraph.core.model.RelationDefinition;
import com.entitygraph.core.model.RepairResult;

import java.util.List;

/**
 * Validates a store against referential rules, constraints and anomaly rules, and
 * repairs what can be repaired mechanically.
 *
 * <p>Data problems never throw: they are reported as {@link IntegrityViolation}s.
 * Exceptions thrown by constraint or anomaly callbacks propagate to the caller.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * IntegrityChecker checker = IntegrityChecker.create(IntegrityCheckerConfig.builder()
 *     .entities("users", "posts")
 *     .relation(RelationDefinition.required("posts", "author", "users").withOnDelete(OnDelete.CASCADE))
 *     .build());
 *
 * IntegrityReport report = checker.check(store);
 * if (!report.valid()) {
 *     store = checker.repair(store, report).entities();
 * }
 * }</pre>
 */
public interface IntegrityChecker {

    /**
     * Creates a checker.
     *
     * @param config initial configuration
     * @return new checker
     */
    static IntegrityChecker create(IntegrityCheckerConfig config) {
        return new DefaultIntegrityChecker(config);
    }

    /**
     * Checks every configured entity type.
     *
     * @param entities store to check
     * @return report
     */
    IntegrityReport check(NormalizedEntities entities);

    /**
     * Checks one entity against referential rules and constraints.
     *
     * @param entityType entity type
     * @param entityId entity id
     * @param entities store
     * @return violations, or a single error when the entity does not exist
     */
    List<IntegrityViolation> checkEntity(String entityType, String entityId, NormalizedEntities entities);

    /**
     * Repairs with default options.
     *
     * @param entities store the report was produced from
     * @param report integrity report
     * @return repair result
     */
    default RepairResult repair(NormalizedEntities entities, IntegrityReport report) {
        return repair(entities, report, RepairOptions.defaults());
    }

    /**
     * Applies the repairs attached to a report's violations to a copy of the store.
     *
     * @param entities store the report was produced from, left unchanged
     * @param report integrity report
     * @param options repair options
     * @return repaired store, applied repairs and unresolved violations
     */
    RepairResult repair(NormalizedEntities entities, IntegrityReport report, RepairOptions options);

    void addConstraint(ConstraintDefinition constraint);

    void addRelation(RelationDefinition relation);

    void addAnomalyRule(AnomalyRule rule);

    /**
     * @return current configuration including added rules
     */
    IntegrityCheckerConfig getConfig();
}
