package com.projectcontext.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Generates identifiers for projects and audit events.
 *
 * <p>Hash-based ids are the first 16 hex characters of a SHA-256 digest over the
 * components joined by {@code ':'}, so the same input always yields the same id.
 * Project ids are human-readable slugs derived from the project name.
 */
public final class IdGenerator {

    private static final int SHORT_ID_LENGTH = 16;

    private IdGenerator() {
        // Utility class
    }

    /**
     * Generates a deterministic 16-character id from one or more components.
     *
     * @param components id components, at least one
     * @return 16 lowercase hex characters
     */
    public static String generate(String... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("At least one component required");
        }
        return generateFullHash(String.join(":", components)).substring(0, SHORT_ID_LENGTH);
    }

    /**
     * Generates a deterministic 16-character id from a single string.
     *
     * @param input non-blank input
     * @return 16 lowercase hex characters
     */
    public static String generateFromString(String input) {
        requireNonBlank(input);
        return generateFullHash(input).substring(0, SHORT_ID_LENGTH);
    }

    /**
     * Returns the full SHA-256 digest of the input as 64 hex characters.
     *
     * @param input non-blank input
     * @return 64 lowercase hex characters
     */
    public static String generateFullHash(String input) {
        requireNonBlank(input);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Derives a project id slug from a display name.
     *
     * <p>Accents are stripped, letters lower-cased, and every run of characters
     * outside {@code [a-z0-9]} becomes a single {@code '-'}. For example
     * {@code "Orchestrator_Project"} becomes {@code "orchestrator-project"}.
     *
     * @param name display name
     * @return slug, never empty
     */
    public static String slug(String name) {
        requireNonBlank(name);
        String ascii = Normalizer.normalize(name, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        String slug = ascii.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("^-+|-+$", "");
        if (slug.isEmpty()) {
            return "project-" + generateFromString(name).substring(0, 8);
        }
        return slug;
    }

    private static void requireNonBlank(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Input must not be null or blank");
        }
    }
}
