package com.entitygraph.cli;

import com.entitygraph.core.model.NormalizedEntities;
import com.entitygraph.core.report.ReportFormatter;
import com.entitygraph.core.report.ReportFormatters;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * Shared file handling and exit codes of the commands.
 */
final class CliSupport {

    /** Success; for checks, a valid store; for diffs, no drift. */
    static final int EXIT_OK = 0;

    /** The command ran and found problems: violations, drift, invalid schemas, bad input. */
    static final int EXIT_FAILED = 1;

    /** The command could not run: unreadable files, unknown schemas or formats. */
    static final int EXIT_ERROR = 2;

    static final ObjectMapper JSON = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private CliSupport() {
        // Utility class
    }

    static NormalizedEntities readStore(Path path) throws IOException {
        NormalizedEntities store = JSON.readValue(path.toFile(), NormalizedEntities.class);
        return store != null ? store : NormalizedEntities.empty();
    }

    static Object readDocument(Path path) throws IOException {
        return JSON.readValue(path.toFile(), Object.class);
    }

    static void writeJson(Object value, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        JSON.writeValue(path.toFile(), value);
    }

    static String toJson(Object value) throws IOException {
        return JSON.writeValueAsString(value);
    }

    /**
     * @param id formatter id
     * @return formatter
     * @throws IllegalArgumentException naming the registered formatters when the id is unknown
     */
    static ReportFormatter formatter(String id) {
        return ReportFormatters.find(id).orElseThrow(() -> new IllegalArgumentException(
            "Unknown format '" + id + "'. Available: " + ReportFormatters.available().stream()
                .map(ReportFormatter::getId)
                .collect(Collectors.joining(", "))));
    }
}
