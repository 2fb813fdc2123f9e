package com.entitygraph.core.config;

import com.entitygraph.core.denormalize.CachingDenormalizer;
import com.entitygraph.core.denormalize.DenormalizeOptions;
import com.entitygraph.core.integrity.AnomalyRule;
import com.entitygraph.core.integrity.ConstraintDefinition;
import com.entitygraph.core.integrity.IntegrityChecker;
import com.entitygraph.core.integrity.IntegrityCheckerConfig;
import com.entitygraph.core.integrity.rules.AnomalyRules;
import com.entitygraph.core.integrity.rules.Constraints;
import com.entitygraph.core.model.CircularBehavior;
import com.entitygraph.core.model.RelationDefinition;
import com.entitygraph.core.monitor.ConsistencyMonitorConfig;
import com.entitygraph.core.schema.Schema;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Root configuration of an entity graph deployment.
 *
 * <p>Loaded from {@code entitygraph.yaml}. Every section is optional; absent sections and
 * fields fall back to the library defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * integrity:
 *   entities: [users, posts]
 *   detectOrphans: true
 *   relations:
 *     - { from: posts, field: author, to: users, required: true, onDelete: cascade }
 *   rules:
 *     unique: [ { entity: users, field: email } ]
 *
 * monitor:
 *   checkIntervalMs: 30000
 *   autoRepair: false
 *
 * denormalize:
 *   maxDepth: 3
 *   circularBehavior: id-only
 * }</pre>
 *
 * @param integrity integrity checker settings
 * @param monitor consistency monitor settings
 * @param denormalize denormalizer settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EntityGraphConfig(
    @JsonProperty("integrity") IntegritySettings integrity,
    @JsonProperty("monitor") MonitorSettings monitor,
    @JsonProperty("denormalize") DenormalizeSettings denormalize
) {
    /**
     * Compact constructor with defaults.
     */
    public EntityGraphConfig {
        if (integrity == null) {
            integrity = IntegritySettings.defaults();
        }
        if (monitor == null) {
            monitor = MonitorSettings.defaults();
        }
        if (denormalize == null) {
            denormalize = DenormalizeSettings.defaults();
        }
    }

    /**
     * Creates the default configuration: no checked types, on-demand monitoring, unbounded denormalization.
     *
     * @return default configuration
     */
    public static EntityGraphConfig defaults() {
        return new EntityGraphConfig(null, null, null);
    }

    /**
     * Integrity checker settings.
     *
     * @param entities entity types to check
     * @param idField id field name
     * @param detectOrphans whether to report entities nothing references
     * @param failFast whether to stop at the first error
     * @param relations referential rules
     * @param rules built-in constraints and anomaly rules
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IntegritySettings(
        @JsonProperty("entities") List<String> entities,
        @JsonProperty("idField") String idField,
        @JsonProperty("detectOrphans") Boolean detectOrphans,
        @JsonProperty("failFast") Boolean failFast,
        @JsonProperty("relations") List<RelationDefinition> relations,
        @JsonProperty("rules") RuleSettings rules
    ) {
        public IntegritySettings {
            entities = entities != null ? List.copyOf(entities) : List.of();
            relations = relations != null ? List.copyOf(relations) : List.of();
            if (rules == null) {
                rules = RuleSettings.defaults();
            }
        }

        public static IntegritySettings defaults() {
            return new IntegritySettings(null, null, null, null, null, null);
        }

        /**
         * @param types entity types to check when none are configured
         * @return these settings, or a copy checking the given types
         */
        public IntegritySettings withDefaultEntities(Collection<String> types) {
            if (!entities.isEmpty()) {
                return this;
            }
            return new IntegritySettings(List.copyOf(types), idField, detectOrphans, failFast, relations, rules);
        }

        /**
         * Builds the checker configuration, instantiating the built-in rules.
         *
         * @return checker configuration
         */
        public IntegrityCheckerConfig toCheckerConfig() {
            IntegrityCheckerConfig.Builder builder = IntegrityCheckerConfig.builder()
                .entities(entities)
                .relations(relations)
                .constraints(rules.constraints())
                .anomalyRules(rules.anomalyRules())
                .detectOrphans(Boolean.TRUE.equals(detectOrphans))
                .failFast(Boolean.TRUE.equals(failFast));
            if (idField != null && !idField.isBlank()) {
                builder.idField(idField);
            }
            return builder.build();
        }
    }

    /**
     * Built-in rules, by kind.
     *
     * @param duplicates duplicate detection over field tuples
     * @param requiredFields required field checks
     * @param stale staleness checks on timestamp fields
     * @param unique unique field constraints
     * @param ranges numeric range constraints
     * @param patterns regular expression constraints
     * @param enums allowed value constraints
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RuleSettings(
        @JsonProperty("duplicates") List<FieldSetRule> duplicates,
        @JsonProperty("requiredFields") List<FieldSetRule> requiredFields,
        @JsonProperty("stale") List<StaleRule> stale,
        @JsonProperty("unique") List<FieldRule> unique,
        @JsonProperty("ranges") List<RangeRule> ranges,
        @JsonProperty("patterns") List<PatternRule> patterns,
        @JsonProperty("enums") List<EnumRule> enums
    ) {
        public RuleSettings {
            duplicates = duplicates != null ? List.copyOf(duplicates) : List.of();
            requiredFields = requiredFields != null ? List.copyOf(requiredFields) : List.of();
            stale = stale != null ? List.copyOf(stale) : List.of();
            unique = unique != null ? List.copyOf(unique) : List.of();
            ranges = ranges != null ? List.copyOf(ranges) : List.of();
            patterns = patterns != null ? List.copyOf(patterns) : List.of();
            enums = enums != null ? List.copyOf(enums) : List.of();
        }

        public static RuleSettings defaults() {
            return new RuleSettings(null, null, null, null, null, null, null);
        }

        /**
         * @return anomaly rules for duplicates, required fields and staleness
         */
        public List<AnomalyRule> anomalyRules() {
            List<AnomalyRule> result = new ArrayList<>();
            duplicates.forEach(rule -> result.add(AnomalyRules.duplicates(rule.entity(), rule.fields())));
            requiredFields.forEach(rule -> result.add(AnomalyRules.requiredFields(rule.entity(), rule.fields())));
            stale.forEach(rule -> result.add(
                AnomalyRules.stale(rule.entity(), rule.field(), Duration.ofMillis(rule.maxAgeMs()))));
            return result;
        }

        /**
         * @return constraints for unique, range, pattern and enum rules
         */
        public List<ConstraintDefinition> constraints() {
            List<ConstraintDefinition> result = new ArrayList<>();
            unique.forEach(rule -> result.add(Constraints.unique(rule.entity(), rule.field())));
            ranges.forEach(rule -> result.add(Constraints.range(rule.entity(), rule.field(), rule.min(), rule.max())));
            patterns.forEach(rule -> result.add(Constraints.pattern(
                rule.entity(), rule.field(), Pattern.compile(rule.regex()), rule.description())));
            enums.forEach(rule -> result.add(Constraints.oneOf(rule.entity(), rule.field(), rule.values())));
            return result;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FieldRule(
        @JsonProperty("entity") String entity,
        @JsonProperty("field") String field
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FieldSetRule(
        @JsonProperty("entity") String entity,
        @JsonProperty("fields") List<String> fields
    ) {
        public FieldSetRule {
            fields = fields != null ? List.copyOf(fields) : List.of();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StaleRule(
        @JsonProperty("entity") String entity,
        @JsonProperty("field") String field,
        @JsonProperty("maxAgeMs") long maxAgeMs
    ) {}

    /**
     * Numeric range; either bound may be omitted.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RangeRule(
        @JsonProperty("entity") String entity,
        @JsonProperty("field") String field,
        @JsonProperty("min") Double min,
        @JsonProperty("max") Double max
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PatternRule(
        @JsonProperty("entity") String entity,
        @JsonProperty("field") String field,
        @JsonProperty("regex") String regex,
        @JsonProperty("description") String description
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EnumRule(
        @JsonProperty("entity") String entity,
        @JsonProperty("field") String field,
        @JsonProperty("values") List<String> values
    ) {
        public EnumRule {
            values = values != null ? List.copyOf(values) : List.of();
        }
    }

    /**
     * Consistency monitor settings.
     *
     * @param checkIntervalMs period of scheduled checks, 0 for on demand
     * @param autoRepair whether to repair after a failed check
     * @param maxSnapshots retained snapshots
     * @param maxHistory retained events
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MonitorSettings(
        @JsonProperty("checkIntervalMs") Long checkIntervalMs,
        @JsonProperty("autoRepair") Boolean autoRepair,
        @JsonProperty("maxSnapshots") Integer maxSnapshots,
        @JsonProperty("maxHistory") Integer maxHistory
    ) {
        public static MonitorSettings defaults() {
            return new MonitorSettings(0L, false, ConsistencyMonitorConfig.DEFAULT_MAX_SNAPSHOTS,
                ConsistencyMonitorConfig.DEFAULT_MAX_HISTORY);
        }

        /**
         * Starts a monitor configuration from these settings; callbacks are left to the caller.
         *
         * @param checker checker the monitor drives
         * @return pre-filled builder
         */
        public ConsistencyMonitorConfig.Builder toMonitorConfig(IntegrityChecker checker) {
            return ConsistencyMonitorConfig.builder(checker)
                .checkInterval(Duration.ofMillis(checkIntervalMs != null ? checkIntervalMs : 0L))
                .autoRepair(Boolean.TRUE.equals(autoRepair))
                .maxSnapshots(maxSnapshots != null ? maxSnapshots : ConsistencyMonitorConfig.DEFAULT_MAX_SNAPSHOTS)
                .maxHistory(maxHistory != null ? maxHistory : ConsistencyMonitorConfig.DEFAULT_MAX_HISTORY);
        }
    }

    /**
     * Denormalizer settings.
     *
     * @param maxDepth maximum depth, negative for unbounded
     * @param circularBehavior cycle handling
     * @param cacheSize entries of a caching denormalizer
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DenormalizeSettings(
        @JsonProperty("maxDepth") Integer maxDepth,
        @JsonProperty("circularBehavior") CircularBehavior circularBehavior,
        @JsonProperty("cacheSize") Integer cacheSize
    ) {
        public static DenormalizeSettings defaults() {
            return new DenormalizeSettings(-1, CircularBehavior.ID_ONLY, 256);
        }

        /**
         * @return denormalize options; fields not set keep the option defaults
         */
        public DenormalizeOptions toOptions() {
            DenormalizeOptions.Builder builder = DenormalizeOptions.builder();
            if (maxDepth != null) {
                builder.maxDepth(maxDepth);
            }
            if (circularBehavior != null) {
                builder.circularBehavior(circularBehavior);
            }
            return builder.build();
        }

        /**
         * @param schema schema of the inputs
         * @return caching denormalizer bounded by {@code cacheSize}, or the default bound when unset
         */
        public CachingDenormalizer toCachingDenormalizer(Schema schema) {
            int bound = cacheSize != null ? cacheSize : CachingDenormalizer.DEFAULT_MAX_ENTRIES;
            return new CachingDenormalizer(schema, toOptions(), bound);
        }
    }
}
