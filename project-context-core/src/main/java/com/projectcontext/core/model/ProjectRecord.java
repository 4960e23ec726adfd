package com.projectcontext.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * One registered workspace.
 *
 * <p>Aliases are case-insensitive and stored lower-cased and trimmed, so two
 * aliases that differ only in case collapse into one entry. Uniqueness across
 * the whole registry is enforced by the registry store on write, not here.
 *
 * @param id stable unique identifier, immutable once assigned
 * @param name canonical display name
 * @param aliases alternate names, lower-cased
 * @param path absolute filesystem root
 * @param vcsRemotes remote URLs associated with this workspace
 * @param markers relative paths that must exist under {@code path}
 * @param createdAt registration time
 * @param lastActiveAt last time the project was switched to or registered
 * @param tags free-form tags
 * @param description optional free-form description
 */
public record ProjectRecord(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("aliases") Set<String> aliases,
    @JsonProperty("path") String path,
    @JsonProperty("vcsRemotes") Set<String> vcsRemotes,
    @JsonProperty("markers") Set<String> markers,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("lastActiveAt") Instant lastActiveAt,
    @JsonProperty("tags") List<String> tags,
    @JsonProperty("description") String description
) {
    /**
     * Compact constructor with validation.
     */
    public ProjectRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(path, "path must not be null");
        aliases = normalizeAliases(aliases);
        vcsRemotes = immutableOrderedSet(vcsRemotes);
        markers = immutableOrderedSet(markers);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * Creates a record with only the required fields, timestamps set to {@code now}.
     *
     * @param id project id
     * @param name display name
     * @param path absolute root path
     * @param now creation time
     * @return new record
     */
    public static ProjectRecord of(String id, String name, String path, Instant now) {
        return new ProjectRecord(id, name, Set.of(), path, Set.of(), Set.of(), now, now, List.of(), null);
    }

    /**
     * Returns the canonical name followed by every alias.
     *
     * @return all names this project answers to
     */
    public List<String> allNames() {
        return Stream.concat(Stream.of(name), aliases.stream()).toList();
    }

    /**
     * Returns true if {@code reference} equals the id, the name or one of the aliases,
     * ignoring case.
     *
     * @param reference id, name or alias
     * @return true if this project is referenced
     */
    public boolean answersTo(String reference) {
        if (reference == null || reference.isBlank()) {
            return false;
        }
        String trimmed = reference.trim();
        return id.equalsIgnoreCase(trimmed)
            || name.equalsIgnoreCase(trimmed)
            || aliases.contains(trimmed.toLowerCase(Locale.ROOT));
    }

    public ProjectRecord withAliases(Collection<String> newAliases) {
        return new ProjectRecord(id, name, new LinkedHashSet<>(newAliases), path, vcsRemotes, markers,
            createdAt, lastActiveAt, tags, description);
    }

    public ProjectRecord withAlias(String alias) {
        Set<String> updated = new LinkedHashSet<>(aliases);
        updated.add(alias);
        return withAliases(updated);
    }

    public ProjectRecord withoutAlias(String alias) {
        Set<String> updated = new LinkedHashSet<>(aliases);
        updated.remove(alias.trim().toLowerCase(Locale.ROOT));
        return withAliases(updated);
    }

    public ProjectRecord withLastActiveAt(Instant instant) {
        return new ProjectRecord(id, name, aliases, path, vcsRemotes, markers,
            createdAt, instant, tags, description);
    }

    private static Set<String> normalizeAliases(Set<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Set.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String alias : raw) {
            if (alias != null) {
                normalized.add(alias.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableSet(normalized);
    }

    private static Set<String> immutableOrderedSet(Set<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(raw));
    }
}
