package com.entitygraph.core.integrity.impl;

import com.entitygraph.core.integrity.AnomalyRule;
import com.entitygraph.core.integrity.ConstraintDefinition;
import com.entitygraph.core.integrity.IntegrityChecker;
import com.entitygraph.core.integrity.IntegrityCheckerConfig;
import com.entitygraph.core.integrity.RepairHandler;
import com.entitygraph.core.integrity.RepairOptions;
import com.entitygraph.core.model.AnomalyResult;
import com.entitygraph.core.model.AppliedRepair;
import com.entitygraph.core.model.Entity;
import com.entitygraph.core.model.EntityRef;
import com.entitygraph.core.model.IntegrityReport;
import com.entitygraph.core.model.IntegrityViolation;
import com.entitygraph.core.model.NormalizedEntities;
import com.entitygraph.core.model.RelationDefinition;
import com.entitygraph.core.model.RepairAction;
import com.entitygraph.core.model.RepairResult;
import com.entitygraph.core.model.RepairSuggestion;
import com.entitygraph.core.model.Severity;
import com.entitygraph.core.model.ViolationType;
import com.entitygraph.core.util.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Default {@link IntegrityChecker}.
 *
 * <p>Per configured type and entity, referential rules run before constraints. Orphan
 * detection and anomaly rules run after the scan. With {@code failFast}, scanning
 * stops after the entity that produced the first error and the later phases are skipped.
 *
 * <p>Rules added after construction are visible to subsequent checks; the rule lists
 * are safe to read while another thread adds to them.
 */
public class DefaultIntegrityChecker implements IntegrityChecker {

    private static final Logger log = LoggerFactory.getLogger(DefaultIntegrityChecker.class);

    private final IntegrityCheckerConfig config;
    private final List<RelationDefinition> relations;
    private final List<ConstraintDefinition> constraints;
    private final List<AnomalyRule> anomalyRules;
    private final Clock clock;

    public DefaultIntegrityChecker(IntegrityCheckerConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Creates a checker reading report timestamps from the given clock.
     *
     * @param config configuration
     * @param clock clock for report timestamps
     */
    public DefaultIntegrityChecker(IntegrityCheckerConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.relations = new CopyOnWriteArrayList<>(config.relations());
        this.constraints = new CopyOnWriteArrayList<>(config.constraints());
        this.anomalyRules = new CopyOnWriteArrayList<>(config.anomalyRules());
    }

    @Override
    public IntegrityReport check(NormalizedEntities entities) {
        Objects.requireNonNull(entities, "entities must not be null");
        long start = System.nanoTime();
        List<IntegrityViolation> violations = new ArrayList<>();
        Map<String, Integer> entityCounts = new LinkedHashMap<>();

        scan:
        for (String type : config.entities()) {
            Map<String, Entity> entityMap = entities.entityMap(type);
            entityCounts.put(type, entityMap.size());
            for (Map.Entry<String, Entity> entry : entityMap.entrySet()) {
                checkReferences(type, entry.getKey(), entry.getValue(), entities, violations);
                checkConstraints(type, entry.getKey(), entry.getValue(), entities, violations);
                if (config.failFast() && hasError(violations)) {
                    break scan;
                }
            }
        }
        // Types skipped by failFast still report their counts
        config.entities().forEach(type -> entityCounts.putIfAbsent(type, entities.entityMap(type).size()));

        if (!config.failFast() || !hasError(violations)) {
            if (config.detectOrphans()) {
                detectOrphans(entities, violations);
            }
        }
        if (!config.failFast() || !hasError(violations)) {
            runAnomalyRules(entities, violations);
        }

        double durationMillis = (System.nanoTime() - start) / 1_000_000.0;
        IntegrityReport report = IntegrityReport.of(clock.millis(), durationMillis, entityCounts, violations);
        log.debug("Integrity check of {} types found {} violations ({} errors) in {} ms",
            entityCounts.size(), report.stats().total(), report.stats().errors(),
            String.format("%.2f", durationMillis));
        return report;
    }

    @Override
    public List<IntegrityViolation> checkEntity(String entityType, String entityId, NormalizedEntities entities) {
        Entity entity = entities.find(entityType, entityId).orElse(null);
        if (entity == null) {
            return List.of(new IntegrityViolation(ViolationType.REFERENTIAL, Severity.ERROR, entityType, entityId,
                "Entity not found", null, null, null));
        }
        List<IntegrityViolation> violations = new ArrayList<>();
        checkReferences(entityType, entityId, entity, entities, violations);
        checkConstraints(entityType, entityId, entity, entities, violations);
        return List.copyOf(violations);
    }

    @Override
    public RepairResult repair(NormalizedEntities entities, IntegrityReport report, RepairOptions options) {
        Objects.requireNonNull(entities, "entities must not be null");
        Objects.requireNonNull(report, "report must not be null");
        RepairOptions effective = options != null ? options : RepairOptions.defaults();

        Map<String, Map<String, Entity>> working = entities.toMutableMap();
        List<AppliedRepair> repairs = new ArrayList<>();
        List<IntegrityViolation> remaining = new ArrayList<>();

        for (IntegrityViolation violation : report.violations()) {
            if (effective.errorsOnly() && !violation.isError()) {
                continue;
            }

            RepairHandler handler = effective.handlers().get(violation.type());
            if (handler != null) {
                try {
                    if (!effective.dryRun()) {
                        working = handler.handle(violation, NormalizedEntities.of(working)).toMutableMap();
                    }
                    repairs.add(new AppliedRepair(violation, AppliedRepair.CUSTOM_HANDLER, true));
                } catch (RuntimeException e) {
                    log.warn("Repair handler failed for {} violation on {}:{}: {}",
                        violation.type(), violation.entityType(), violation.entityId(), e.getMessage());
                    repairs.add(new AppliedRepair(violation, AppliedRepair.CUSTOM_HANDLER, false));
                    remaining.add(violation);
                }
                continue;
            }

            RepairSuggestion suggestion = violation.repair();
            if (suggestion == null || suggestion.action() == RepairAction.CREATE) {
                remaining.add(violation);
                continue;
            }

            try {
                if (!effective.dryRun()) {
                    apply(working, violation, suggestion);
                }
                repairs.add(new AppliedRepair(violation, suggestion.action().wireName(), true));
            } catch (RuntimeException e) {
                log.warn("Repair '{}' failed for {}:{}: {}", suggestion.action().wireName(),
                    violation.entityType(), violation.entityId(), e.getMessage());
                repairs.add(new AppliedRepair(violation, suggestion.action().wireName(), false));
                remaining.add(violation);
            }
        }

        NormalizedEntities result = effective.dryRun() ? entities : NormalizedEntities.of(working);
        log.debug("Repair {}: {} repairs, {} remaining", effective.dryRun() ? "dry run" : "pass",
            repairs.size(), remaining.size());
        return new RepairResult(result, repairs, remaining);
    }

    @Override
    public void addConstraint(ConstraintDefinition constraint) {
        constraints.add(Objects.requireNonNull(constraint, "constraint must not be null"));
    }

    @Override
    public void addRelation(RelationDefinition relation) {
        relations.add(Objects.requireNonNull(relation, "relation must not be null"));
    }

    @Override
    public void addAnomalyRule(AnomalyRule rule) {
        anomalyRules.add(Objects.requireNonNull(rule, "rule must not be null"));
    }

    @Override
    public IntegrityCheckerConfig getConfig() {
        return new IntegrityCheckerConfig(config.entities(), List.copyOf(relations), List.copyOf(constraints),
            List.copyOf(anomalyRules), config.idField(), config.detectOrphans(), config.failFast());
    }

    private void checkReferences(String type, String key, Entity entity, NormalizedEntities entities,
                                 List<IntegrityViolation> violations) {
        String entityId = entityId(key, entity);
        for (RelationDefinition relation : relations) {
            if (!relation.from().equals(type)) {
                continue;
            }
            Object value = entity.get(relation.field());
            if (relation.isArray()) {
                if (value instanceof List<?> refs) {
                    for (Object ref : refs) {
                        String refId = Values.idString(ref);
                        if (refId != null && !entities.contains(relation.to(), refId)) {
                            violations.add(dangling(type, entityId, relation, refId,
                                arrayRepair(relation, refs, refId)));
                        }
                    }
                }
            } else if (value != null) {
                String refId = Values.idString(value);
                if (!entities.contains(relation.to(), refId)) {
                    violations.add(dangling(type, entityId, relation, refId, singularRepair(relation)));
                }
            } else if (relation.required()) {
                violations.add(new IntegrityViolation(ViolationType.REFERENTIAL, Severity.ERROR, type, entityId,
                    "Required relation \"" + relation.field() + "\" is missing", relation.field(), null,
                    RepairSuggestion.delete()));
            }
        }
    }

    private static IntegrityViolation dangling(String type, String entityId, RelationDefinition relation,
                                               String refId, RepairSuggestion repair) {
        return new IntegrityViolation(ViolationType.REFERENTIAL,
            relation.required() ? Severity.ERROR : Severity.WARNING, type, entityId,
            "Missing referenced " + relation.to() + " with ID \"" + refId + "\"", relation.field(),
            new EntityRef(relation.to(), refId), repair);
    }

    private static RepairSuggestion singularRepair(RelationDefinition relation) {
        return switch (relation.onDelete()) {
            case CASCADE -> RepairSuggestion.delete();
            case SET_NULL -> RepairSuggestion.nullify();
            case RESTRICT, NO_ACTION -> null;
        };
    }

    private static RepairSuggestion arrayRepair(RelationDefinition relation, List<?> refs, String refId) {
        return switch (relation.onDelete()) {
            case CASCADE -> RepairSuggestion.delete();
            case SET_NULL -> {
                Map<String, Object> data = new HashMap<>();
                data.put(relation.field(), withoutRef(refs, refId));
                yield RepairSuggestion.update(data);
            }
            case RESTRICT, NO_ACTION -> null;
        };
    }

    private static List<Object> withoutRef(List<?> refs, String refId) {
        List<Object> kept = new ArrayList<>(refs.size());
        for (Object ref : refs) {
            if (!refId.equals(Values.idString(ref))) {
                kept.add(ref);
            }
        }
        return kept;
    }

    // Several dangling ids in one array each carry an update; removal runs against the current list.
    private static boolean isDanglingArrayRef(IntegrityViolation violation, Entity existing) {
        return violation.type() == ViolationType.REFERENTIAL
            && violation.related() != null
            && violation.field() != null
            && existing.get(violation.field()) instanceof List<?>;
    }

    private void checkConstraints(String type, String key, Entity entity, NormalizedEntities entities,
                                  List<IntegrityViolation> violations) {
        for (ConstraintDefinition constraint : constraints) {
            if (!constraint.entity().equals(type) || constraint.validate().test(entity, entities)) {
                continue;
            }
            RepairSuggestion repair = constraint.repair() != null
                ? RepairSuggestion.update(constraint.repair().apply(entity, entities).fields())
                : null;
            violations.add(new IntegrityViolation(ViolationType.CONSTRAINT, constraint.severity(), type,
                entityId(key, entity), "[" + constraint.name() + "] " + constraint.message().apply(entity),
                null, null, repair));
        }
    }

    private void detectOrphans(NormalizedEntities entities, List<IntegrityViolation> violations) {
        Map<String, Set<String>> referenced = new HashMap<>();
        for (String type : config.entities()) {
            for (Entity entity : entities.entityMap(type).values()) {
                for (RelationDefinition relation : relations) {
                    if (!relation.from().equals(type)) {
                        continue;
                    }
                    Set<String> ids = referenced.computeIfAbsent(relation.to(), target -> new HashSet<>());
                    Object value = entity.get(relation.field());
                    if (relation.isArray() && value instanceof List<?> refs) {
                        refs.forEach(ref -> ids.add(Values.idString(ref)));
                    } else if (value != null) {
                        ids.add(Values.idString(value));
                    }
                }
            }
        }

        for (String type : config.entities()) {
            boolean isTarget = relations.stream().anyMatch(relation -> relation.to().equals(type));
            if (!isTarget) {
                continue;
            }
            Set<String> ids = referenced.getOrDefault(type, Set.of());
            for (String entityId : entities.entityMap(type).keySet()) {
                if (!ids.contains(entityId)) {
                    violations.add(new IntegrityViolation(ViolationType.ORPHAN, Severity.WARNING, type, entityId,
                        "Orphaned " + type + " entity not referenced by any relation", null, null,
                        RepairSuggestion.delete()));
                }
            }
        }
    }

    private void runAnomalyRules(NormalizedEntities entities, List<IntegrityViolation> violations) {
        for (AnomalyRule rule : anomalyRules) {
            List<AnomalyResult> results = rule.detect().apply(entities);
            if (results == null) {
                continue;
            }
            for (AnomalyResult result : results) {
                violations.add(new IntegrityViolation(ViolationType.ANOMALY, rule.severity(), result.entityType(),
                    result.entityId(), "[" + rule.name() + "] " + result.description(), null, null,
                    result.repair()));
            }
        }
    }

    private static void apply(Map<String, Map<String, Entity>> working, IntegrityViolation violation,
                              RepairSuggestion suggestion) {
        Map<String, Entity> entityMap = working.get(violation.entityType());
        if (entityMap == null) {
            return;
        }
        Entity existing = entityMap.get(violation.entityId());
        switch (suggestion.action()) {
            case DELETE -> entityMap.remove(violation.entityId());
            case UPDATE -> {
                if (existing != null && isDanglingArrayRef(violation, existing)) {
                    entityMap.put(violation.entityId(), existing.with(violation.field(),
                        withoutRef((List<?>) existing.get(violation.field()), violation.related().entityId())));
                } else if (existing != null && suggestion.data() != null) {
                    entityMap.put(violation.entityId(), existing.merge(suggestion.data()));
                }
            }
            case NULLIFY -> {
                if (existing != null && violation.field() != null) {
                    entityMap.put(violation.entityId(), existing.with(violation.field(), null));
                }
            }
            case CREATE -> throw new IllegalStateException("create repairs are never applied automatically");
        }
    }

    private String entityId(String key, Entity entity) {
        String id = entity.id(config.idField());
        return id != null ? id : key;
    }

    private static boolean hasError(List<IntegrityViolation> violations) {
        return violations.stream().anyMatch(IntegrityViolation::isError);
    }
}
