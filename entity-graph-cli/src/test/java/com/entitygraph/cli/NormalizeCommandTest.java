package com.entitygraph.cli;

import com.entitygraph.cli.CommandRunner.Result;
import com.entitygraph.core.model.NormalizedEntities;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static com.entitygraph.cli.CommandRunner.fixture;
import static com.entitygraph.cli.CommandRunner.run;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link NormalizeCommand}.
 */
class NormalizeCommandTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void normalize_nestedPost_printsResultAndEntities() throws IOException {
        Result result = run("normalize", fixture("post.json").toString(),
            "-s", fixture("schemas.yaml").toString(), "-r", "posts");

        assertThat(result.exitCode()).isZero();
        JsonNode json = MAPPER.readTree(result.out());
        assertThat(json.get("result").asText()).isEqualTo("p1");
        JsonNode entities = json.get("entities");
        assertThat(entities.get("posts").get("p1").get("author").asText()).isEqualTo("u1");
        assertThat(entities.get("posts").get("p1").get("comments").get(0).asText()).isEqualTo("c1");
        assertThat(entities.get("comments").get("c1").get("author").asText()).isEqualTo("u2");
        assertThat(entities.get("users").get("u1").has("password")).isFalse();
    }

    @Test
    void normalize_withOutput_writesStore() throws IOException {
        Path output = tempDir.resolve("store.json");

        Result result = run("normalize", fixture("post.json").toString(),
            "-s", fixture("schemas.yaml").toString(), "-r", "posts", "-o", output.toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("✓ Wrote 4 entities to");
        NormalizedEntities store = MAPPER.readValue(output.toFile(), NormalizedEntities.class);
        assertThat(store.counts()).containsEntry("users", 2).containsEntry("posts", 1).containsEntry("comments", 1);
    }

    @Test
    void normalize_arrayFlagOnObject_exitsOne() {
        Result result = run("normalize", fixture("post.json").toString(),
            "-s", fixture("schemas.yaml").toString(), "-r", "posts", "--array");

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("✗ Normalization failed").contains("Expected a list");
    }

    @Test
    void normalize_unknownRoot_exitsTwo() {
        Result result = run("normalize", fixture("post.json").toString(),
            "-s", fixture("schemas.yaml").toString(), "-r", "videos");

        assertThat(result.exitCode()).isEqualTo(2);
        assertThat(result.err()).contains("videos");
    }
}
