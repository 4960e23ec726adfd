package com.projectcontext.core.model;

import java.util.Collection;
import java.util.Comparator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The whole universe of registered projects plus the active project pointer.
 *
 * <p>Instances are immutable snapshots; every {@code with*} method returns a new
 * registry. {@code activeProjectId} and {@code previousProjectId} are weak
 * references: a dangling value is tolerated by readers (see {@link #activeProject()})
 * and rejected only by the store's write path.
 *
 * @param version schema version
 * @param projects projects keyed by id
 * @param activeProjectId currently active project id, nullable
 * @param previousProjectId project that was active before the current one, nullable
 */
public record Registry(
    int version,
    Map<String, ProjectRecord> projects,
    String activeProjectId,
    String previousProjectId
) {
    /** Schema version written by this build. */
    public static final int CURRENT_VERSION = 1;

    /**
     * Compact constructor with validation.
     */
    public Registry {
        projects = projects == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(projects));
    }

    /**
     * Creates an empty registry at the current schema version.
     *
     * @return empty registry
     */
    public static Registry empty() {
        return new Registry(CURRENT_VERSION, Map.of(), null, null);
    }

    public Optional<ProjectRecord> project(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(projects.get(id));
    }

    public boolean contains(String id) {
        return id != null && projects.containsKey(id);
    }

    public Collection<ProjectRecord> allProjects() {
        return projects.values();
    }

    /**
     * Returns the active project, or empty when none is set or the reference dangles.
     *
     * @return active project
     */
    public Optional<ProjectRecord> activeProject() {
        return project(activeProjectId);
    }

    /**
     * Finds a project by exact id, name or alias, ignoring case. An id match wins
     * over a name or alias match.
     *
     * @param reference id, name or alias
     * @return matching project
     */
    public Optional<ProjectRecord> findByReference(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        ProjectRecord byId = projects.get(reference.trim());
        if (byId != null) {
            return Optional.of(byId);
        }
        return projects.values().stream()
            .filter(project -> project.answersTo(reference))
            .min(Comparator.comparing(ProjectRecord::id));
    }

    public Registry withProject(ProjectRecord project) {
        Objects.requireNonNull(project, "project must not be null");
        Map<String, ProjectRecord> updated = new LinkedHashMap<>(projects);
        updated.put(project.id(), project);
        return new Registry(version, updated, activeProjectId, previousProjectId);
    }

    public Registry withoutProject(String id) {
        Map<String, ProjectRecord> updated = new LinkedHashMap<>(projects);
        updated.remove(id);
        return new Registry(version, updated, activeProjectId, previousProjectId);
    }

    public Registry withActive(String activeId, String previousId) {
        return new Registry(version, projects, activeId, previousId);
    }
}
