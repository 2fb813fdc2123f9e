package com.entitygraph.core.config;

import com.entitygraph.core.schema.ExportedSchemas;
import com.entitygraph.core.schema.SchemaRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads and writes exported schema files. Files ending in {@code .json} are JSON,
 * anything else is YAML.
 *
 * <p>Unlike {@link ConfigLoader}, schema files have no sensible default, so I/O and
 * parse failures propagate.
 */
public class SchemaLoader {

    private static final Logger log = LoggerFactory.getLogger(SchemaLoader.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private SchemaLoader() {
        // Utility class
    }

    /**
     * Reads an exported schema file.
     *
     * @param path schema file
     * @return exported schemas
     * @throws IOException if the file cannot be read or parsed
     */
    public static ExportedSchemas read(Path path) throws IOException {
        log.debug("Reading schemas from: {}", path);
        ExportedSchemas exported = mapperFor(path).readValue(path.toFile(), ExportedSchemas.class);
        if (exported == null) {
            throw new IOException("Schema file is empty: " + path);
        }
        return exported;
    }

    /**
     * Reads a schema file into a new registry.
     *
     * @param path schema file
     * @return registry holding the file's schemas
     * @throws IOException if the file cannot be read or parsed
     */
    public static SchemaRegistry load(Path path) throws IOException {
        SchemaRegistry registry = new SchemaRegistry();
        registry.importSchemas(read(path));
        log.info("Loaded {} schema(s) from: {}", registry.getNames().size(), path);
        return registry;
    }

    /**
     * Writes a registry's exportable schemas.
     *
     * @param registry registry to export
     * @param path target file, overwritten
     * @throws IOException if the file cannot be written
     */
    public static void write(SchemaRegistry registry, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapperFor(path).writeValue(path.toFile(), registry.exportSchemas());
        log.debug("Wrote schemas to: {}", path);
    }

    private static ObjectMapper mapperFor(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".json") ? JSON_MAPPER : YAML_MAPPER;
    }
}
