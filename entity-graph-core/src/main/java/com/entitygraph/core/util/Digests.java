package com.entitygraph.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 digests rendered as lowercase hex.
 *
 * <p>Used for state hashes and other deterministic identifiers. The same input
 * always yields the same digest across runs and JVMs.
 */
public final class Digests {

    private static final int SHORT_LENGTH = 16;

    private Digests() {
        // Utility class
    }

    /**
     * Generates a short (16 hex chars) digest from one or more components joined with {@code ':'}.
     *
     * @param components components to combine
     * @return 16-character hex digest
     * @throws IllegalArgumentException if no component is given
     */
    public static String shortDigest(String... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("At least one component required");
        }
        return fullDigest(String.join(":", components)).substring(0, SHORT_LENGTH);
    }

    /**
     * Generates a full SHA-256 digest.
     *
     * @param input input text
     * @return 64-character hex digest
     * @throws IllegalArgumentException if input is null or blank
     */
    public static String fullDigest(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Input must not be null or blank");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
