package com.entitygraph.core.config;

import com.entitygraph.core.config.EntityGraphConfig.DenormalizeSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads {@code entitygraph.yaml} into an {@link EntityGraphConfig}.
 *
 * <p>Loading never fails: a missing, unreadable, empty or malformed file yields
 * {@link EntityGraphConfig#defaults()}, and a settings section whose values are out of range
 * is reset to that section's defaults. Every fallback is logged.
 *
 * <pre>{@code
 * EntityGraphConfig config = ConfigLoader.load(Paths.get("entitygraph.yaml"));
 * IntegrityChecker checker = IntegrityChecker.create(config.integrity().toCheckerConfig());
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * @param configPath path to {@code entitygraph.yaml}
     * @return the file's configuration, or defaults where it is unusable
     */
    public static EntityGraphConfig load(Path configPath) {
        return read(configPath)
            .map(ConfigLoader::withValidDenormalizeSettings)
            .orElseGet(EntityGraphConfig::defaults);
    }

    private static Optional<EntityGraphConfig> read(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            log.warn("No configuration file at {}, using defaults", configPath);
            return Optional.empty();
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            EntityGraphConfig config = YAML_MAPPER.readValue(reader, EntityGraphConfig.class);
            if (config == null) {
                log.warn("Configuration file {} is empty, using defaults", configPath);
                return Optional.empty();
            }
            log.info("Loaded configuration from {} ({} checked type(s))",
                configPath, config.integrity().entities().size());
            return Optional.of(config);
        } catch (IOException | RuntimeException e) {
            log.error("Cannot read configuration file {}: {}. Using defaults.", configPath, e.getMessage());
            return Optional.empty();
        }
    }

    private static EntityGraphConfig withValidDenormalizeSettings(EntityGraphConfig config) {
        DenormalizeSettings denormalize = config.denormalize();
        if (denormalize.cacheSize() == null || denormalize.cacheSize() > 0) {
            return config;
        }
        log.warn("denormalize.cacheSize must be positive, was {}. Using the default bound.", denormalize.cacheSize());
        return new EntityGraphConfig(config.integrity(), config.monitor(),
            new DenormalizeSettings(denormalize.maxDepth(), denormalize.circularBehavior(), null));
    }
}
