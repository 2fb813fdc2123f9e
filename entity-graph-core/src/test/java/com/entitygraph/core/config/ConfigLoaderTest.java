package com.entitygraph.core.config;

import com.entitygraph.core.denormalize.CachingDenormalizer;
import com.entitygraph.core.denormalize.DenormalizeOptions;
import com.entitygraph.core.integrity.IntegrityChecker;
import com.entitygraph.core.integrity.IntegrityCheckerConfig;
import com.entitygraph.core.model.CircularBehavior;
import com.entitygraph.core.model.OnDelete;
import com.entitygraph.core.model.RelationDefinition;
import com.entitygraph.core.monitor.ConsistencyMonitorConfig;
import com.entitygraph.core.schema.Schemas;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_missingFile_returnsDefaults() {
        EntityGraphConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(EntityGraphConfig.defaults());
        assertThat(config.integrity().entities()).isEmpty();
        assertThat(config.monitor().checkIntervalMs()).isZero();
        assertThat(config.denormalize().circularBehavior()).isEqualTo(CircularBehavior.ID_ONLY);
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path file = Files.writeString(tempDir.resolve("entitygraph.yaml"), "");

        assertThat(ConfigLoader.load(file)).isEqualTo(EntityGraphConfig.defaults());
    }

    @Test
    void load_malformedFile_returnsDefaults() throws IOException {
        Path file = Files.writeString(tempDir.resolve("entitygraph.yaml"), "integrity: [unclosed");

        assertThat(ConfigLoader.load(file)).isEqualTo(EntityGraphConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(EntityGraphConfig.defaults());
    }

    @Test
    void load_fullFile_buildsCheckerAndMonitorSettings() throws IOException {
        Path file = Files.writeString(tempDir.resolve("entitygraph.yaml"), """
            integrity:
              entities: [users, posts]
              detectOrphans: true
              relations:
                - { from: posts, field: author, to: users, required: true, onDelete: cascade }
                - { from: users, field: posts, to: posts, isArray: true, onDelete: set-null }
              rules:
                unique:
                  - { entity: users, field: email }
                ranges:
                  - { entity: posts, field: stars, min: 0, max: 5 }
                patterns:
                  - { entity: users, field: email, regex: "@", description: an email address }
                enums:
                  - { entity: posts, field: status, values: [draft, published] }
                duplicates:
                  - { entity: posts, fields: [title, author] }
                requiredFields:
                  - { entity: users, fields: [name] }
                stale:
                  - { entity: users, field: updatedAt, maxAgeMs: 60000 }
            monitor:
              checkIntervalMs: 30000
              autoRepair: true
              maxSnapshots: 3
            denormalize:
              maxDepth: 2
              circularBehavior: shallow
              cacheSize: 8
              unknownSetting: ignored
            """);

        EntityGraphConfig config = ConfigLoader.load(file);
        IntegrityCheckerConfig checkerConfig = config.integrity().toCheckerConfig();

        assertThat(checkerConfig.entities()).containsExactly("users", "posts");
        assertThat(checkerConfig.detectOrphans()).isTrue();
        assertThat(checkerConfig.relations()).containsExactly(
            RelationDefinition.required("posts", "author", "users").withOnDelete(OnDelete.CASCADE),
            RelationDefinition.array("users", "posts", "posts").withOnDelete(OnDelete.SET_NULL));
        assertThat(checkerConfig.constraints()).extracting(constraint -> constraint.name()).containsExactly(
            "unique-users-email", "range-posts-stars", "pattern-users-email", "enum-posts-status");
        assertThat(checkerConfig.anomalyRules()).extracting(rule -> rule.name()).containsExactly(
            "duplicate-posts", "required-fields-users", "stale-users");

        ConsistencyMonitorConfig monitorConfig = config.monitor()
            .toMonitorConfig(IntegrityChecker.create(checkerConfig))
            .build();
        assertThat(monitorConfig.checkInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(monitorConfig.autoRepair()).isTrue();
        assertThat(monitorConfig.maxSnapshots()).isEqualTo(3);
        assertThat(monitorConfig.maxHistory()).isEqualTo(ConsistencyMonitorConfig.DEFAULT_MAX_HISTORY);

        DenormalizeOptions options = config.denormalize().toOptions();
        assertThat(options.maxDepth()).isEqualTo(2);
        assertThat(options.circularBehavior()).isEqualTo(CircularBehavior.SHALLOW);
        assertThat(config.denormalize().toCachingDenormalizer(Schemas.value()).maxEntries()).isEqualTo(8);
    }

    @Test
    void load_nonPositiveCacheSize_fallsBackToDefaultBound() throws IOException {
        Path file = Files.writeString(tempDir.resolve("entitygraph.yaml"), """
            denormalize:
              maxDepth: 3
              cacheSize: 0
            """);

        EntityGraphConfig config = ConfigLoader.load(file);

        assertThat(config.denormalize().cacheSize()).isNull();
        assertThat(config.denormalize().maxDepth()).isEqualTo(3);
        assertThat(config.denormalize().toCachingDenormalizer(Schemas.value()).maxEntries())
            .isEqualTo(CachingDenormalizer.DEFAULT_MAX_ENTRIES);
    }

    @Test
    void withDefaultEntities_onlyAppliesWhenNoneConfigured() {
        EntityGraphConfig.IntegritySettings empty = EntityGraphConfig.IntegritySettings.defaults();
        EntityGraphConfig.IntegritySettings configured = new EntityGraphConfig.IntegritySettings(
            List.of("users"), null, null, null, null, null);

        assertThat(empty.withDefaultEntities(List.of("posts")).entities()).containsExactly("posts");
        assertThat(configured.withDefaultEntities(List.of("posts"))).isSameAs(configured);
    }

    @Test
    void denormalizeDefaults_areUnbounded() {
        DenormalizeOptions options = EntityGraphConfig.DenormalizeSettings.defaults().toOptions();

        assertThat(options.maxDepth()).isEqualTo(DenormalizeOptions.UNBOUNDED);
    }

    @Test
    void denormalizeSettings_withoutCacheSize_usesDefaultBound() {
        EntityGraphConfig.DenormalizeSettings settings = new EntityGraphConfig.DenormalizeSettings(null, null, null);

        assertThat(settings.toCachingDenormalizer(Schemas.value()).maxEntries())
            .isEqualTo(CachingDenormalizer.DEFAULT_MAX_ENTRIES);
    }
}
