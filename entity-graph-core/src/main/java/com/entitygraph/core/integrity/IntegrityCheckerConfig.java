package com.entitygraph.core.integrity;

import com.entitygraph.core.model.Entity;
import com.entitygraph.core.model.RelationDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of an {@link IntegrityChecker}.
 *
 * @param entities entity types to scan, in scan order
 * @param relations referential rules
 * @param constraints per-entity rules
 * @param anomalyRules whole-store rules
 * @param idField id field name, defaults to {@code id}
 * @param detectOrphans report relation targets nothing references
 * @param failFast stop scanning at the first error
 */
public record IntegrityCheckerConfig(
    List<String> entities,
    List<RelationDefinition> relations,
    List<ConstraintDefinition> constraints,
    List<AnomalyRule> anomalyRules,
    String idField,
    boolean detectOrphans,
    boolean failFast
) {
    /**
     * Compact constructor with defaults.
     */
    public IntegrityCheckerConfig {
        entities = entities != null ? List.copyOf(entities) : List.of();
        relations = relations != null ? List.copyOf(relations) : List.of();
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        anomalyRules = anomalyRules != null ? List.copyOf(anomalyRules) : List.of();
        if (idField == null || idField.isBlank()) {
            idField = Entity.DEFAULT_ID_FIELD;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for IntegrityCheckerConfig.
     */
    public static class Builder {
        private final List<String> entities = new ArrayList<>();
        private final List<RelationDefinition> relations = new ArrayList<>();
        private final List<ConstraintDefinition> constraints = new ArrayList<>();
        private final List<AnomalyRule> anomalyRules = new ArrayList<>();
        private String idField;
        private boolean detectOrphans;
        private boolean failFast;

        public Builder entities(String... types) {
            entities.addAll(List.of(types));
            return this;
        }

        public Builder entities(List<String> types) {
            entities.addAll(types);
            return this;
        }

        public Builder relation(RelationDefinition relation) {
            relations.add(relation);
            return this;
        }

        public Builder relations(List<RelationDefinition> definitions) {
            relations.addAll(definitions);
            return this;
        }

        public Builder constraint(ConstraintDefinition constraint) {
            constraints.add(constraint);
            return this;
        }

        public Builder constraints(List<ConstraintDefinition> definitions) {
            constraints.addAll(definitions);
            return this;
        }

        public Builder anomalyRule(AnomalyRule rule) {
            anomalyRules.add(rule);
            return this;
        }

        public Builder anomalyRules(List<AnomalyRule> rules) {
            anomalyRules.addAll(rules);
            return this;
        }

        public Builder idField(String field) {
            this.idField = field;
            return this;
        }

        public Builder detectOrphans(boolean enabled) {
            this.detectOrphans = enabled;
            return this;
        }

        public Builder failFast(boolean enabled) {
            this.failFast = enabled;
            return this;
        }

        public IntegrityCheckerConfig build() {
            return new IntegrityCheckerConfig(entities, relations, constraints, anomalyRules,
                idField, detectOrphans, failFast);
        }
    }
}
