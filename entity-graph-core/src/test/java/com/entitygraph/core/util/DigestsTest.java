package com.entitygraph.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Digests}.
 */
class DigestsTest {

    @Test
    void shortDigest_withSingleComponent_isDeterministic() {
        String first = Digests.shortDigest("users");
        String second = Digests.shortDigest("users");

        assertThat(first).isEqualTo(second);
        assertThat(first).hasSize(16);
    }

    @Test
    void shortDigest_withMultipleComponents_isDeterministic() {
        String first = Digests.shortDigest("users", "u1", "3");
        String second = Digests.shortDigest("users", "u1", "3");

        assertThat(first).isEqualTo(second);
        assertThat(first).hasSize(16);
    }

    @Test
    void shortDigest_withDifferentInputs_differs() {
        assertThat(Digests.shortDigest("users")).isNotEqualTo(Digests.shortDigest("posts"));
    }

    @Test
    void shortDigest_isPrefixOfFullDigestOfJoinedComponents() {
        assertThat(Digests.fullDigest("users:u1")).startsWith(Digests.shortDigest("users", "u1"));
    }

    @Test
    void shortDigest_withNullComponents_throwsException() {
        assertThatThrownBy(() -> Digests.shortDigest((String[]) null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("At least one component required");
    }

    @Test
    void shortDigest_withEmptyArray_throwsException() {
        assertThatThrownBy(() -> Digests.shortDigest())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("At least one component required");
    }

    @Test
    void fullDigest_withValidInput_returns64CharacterHash() {
        String hash = Digests.fullDigest("test-input");

        assertThat(hash).hasSize(64);
        assertThat(hash).matches("[0-9a-f]{64}");
    }

    @Test
    void fullDigest_matchesKnownSha256() {
        assertThat(Digests.fullDigest("abc"))
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" ", "  ", "\t", "\n"})
    void fullDigest_withInvalidInput_throwsException(String input) {
        assertThatThrownBy(() -> Digests.fullDigest(input))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Input must not be null or blank");
    }
}
