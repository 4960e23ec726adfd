package com.projectcontext.core.registry;

import com.projectcontext.core.model.ProjectRecord;
import com.projectcontext.core.model.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * CRUD and active-project operations over a {@link RegistryStore}.
 *
 * <p>Every mutation is a locked read-modify-write: load, change, save. Invariant
 * checks happen in {@link RegistryStore#save(Registry)}, so a rejected change
 * leaves the persisted registry as it was.
 */
public class ProjectRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProjectRegistry.class);

    private final RegistryStore store;
    private final Clock clock;

    public ProjectRegistry(RegistryStore store) {
        this(store, Clock.systemUTC());
    }

    public ProjectRegistry(RegistryStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public RegistryStore getStore() {
        return store;
    }

    /**
     * Returns a snapshot of the persisted registry.
     *
     * @return registry snapshot
     */
    public Registry snapshot() {
        return store.load();
    }

    public List<ProjectRecord> list() {
        return store.load().allProjects().stream()
            .sorted(Comparator.comparing(ProjectRecord::id))
            .toList();
    }

    public Optional<ProjectRecord> find(String reference) {
        return store.load().findByReference(reference);
    }

    /**
     * Returns the project referenced by id, name or alias.
     *
     * @param reference id, name or alias
     * @return project
     * @throws ProjectNotFoundException if nothing matches
     */
    public ProjectRecord get(String reference) {
        return find(reference).orElseThrow(() -> new ProjectNotFoundException(reference));
    }

    public Optional<ProjectRecord> current() {
        return store.load().activeProject();
    }

    /**
     * Registers a new project. The first registered project becomes active.
     *
     * @param project project to add; {@code createdAt}/{@code lastActiveAt} default to now
     * @return stored record
     * @throws RegistryInvariantViolationException if the id is taken or an alias clashes
     */
    public ProjectRecord register(ProjectRecord project) {
        Objects.requireNonNull(project, "project must not be null");
        return store.withLock(() -> {
            Registry registry = store.load();
            if (registry.contains(project.id())) {
                throw new RegistryInvariantViolationException(
                    List.of("project id '" + project.id() + "' is already registered"));
            }
            Instant now = clock.instant();
            ProjectRecord stored = new ProjectRecord(project.id(), project.name(), project.aliases(),
                project.path(), project.vcsRemotes(), project.markers(),
                project.createdAt() == null ? now : project.createdAt(),
                project.lastActiveAt() == null ? now : project.lastActiveAt(),
                project.tags(), project.description());

            Registry updated = registry.withProject(stored);
            if (updated.activeProjectId() == null || !updated.contains(updated.activeProjectId())) {
                updated = updated.withActive(stored.id(), updated.previousProjectId());
            }
            store.save(updated);
            log.info("Registered project '{}' at {}", stored.id(), stored.path());
            return stored;
        });
    }

    /**
     * Replaces an existing project. The id cannot change.
     *
     * @param project new state of the project
     * @return stored record
     * @throws ProjectNotFoundException if no project has this id
     */
    public ProjectRecord update(ProjectRecord project) {
        Objects.requireNonNull(project, "project must not be null");
        return store.withLock(() -> {
            Registry registry = store.load();
            if (!registry.contains(project.id())) {
                throw new ProjectNotFoundException(project.id());
            }
            store.save(registry.withProject(project));
            log.debug("Updated project '{}'", project.id());
            return project;
        });
    }

    /**
     * Removes a project. If it was active, the most recently active remaining
     * project becomes active, or none when the registry is now empty.
     *
     * @param reference id, name or alias
     * @return removed project
     */
    public ProjectRecord remove(String reference) {
        return store.withLock(() -> {
            Registry registry = store.load();
            ProjectRecord project = registry.findByReference(reference)
                .orElseThrow(() -> new ProjectNotFoundException(reference));

            Registry updated = registry.withoutProject(project.id());
            String active = updated.activeProjectId();
            String previous = updated.previousProjectId();
            if (project.id().equals(previous)) {
                previous = null;
            }
            if (project.id().equals(active)) {
                active = mostRecentlyActive(updated).map(ProjectRecord::id).orElse(null);
                log.info("Active project '{}' removed, now active: {}", project.id(), active);
            }
            if (previous != null && previous.equals(active)) {
                previous = null;
            }
            store.save(updated.withActive(active, previous));
            log.info("Removed project '{}'", project.id());
            return project;
        });
    }

    public ProjectRecord addAlias(String reference, String alias) {
        requireAlias(alias);
        return store.withLock(() -> {
            Registry registry = store.load();
            ProjectRecord project = registry.findByReference(reference)
                .orElseThrow(() -> new ProjectNotFoundException(reference));
            ProjectRecord updated = project.withAlias(alias);
            store.save(registry.withProject(updated));
            log.info("Added alias '{}' to project '{}'", alias.trim().toLowerCase(Locale.ROOT), project.id());
            return updated;
        });
    }

    public ProjectRecord removeAlias(String reference, String alias) {
        requireAlias(alias);
        return store.withLock(() -> {
            Registry registry = store.load();
            ProjectRecord project = registry.findByReference(reference)
                .orElseThrow(() -> new ProjectNotFoundException(reference));
            ProjectRecord updated = project.withoutAlias(alias);
            store.save(registry.withProject(updated));
            log.info("Removed alias '{}' from project '{}'", alias, project.id());
            return updated;
        });
    }

    /**
     * Makes the referenced project active and remembers the previous one.
     *
     * @param reference id, name or alias
     * @return newly active project
     */
    public ProjectRecord switchTo(String reference) {
        return store.withLock(() -> {
            Registry registry = store.load();
            ProjectRecord target = registry.findByReference(reference)
                .orElseThrow(() -> new ProjectNotFoundException(reference));
            return activate(registry, target);
        });
    }

    /**
     * Swaps the active and previously active projects.
     *
     * @return newly active project
     * @throws ProjectNotFoundException if there is no previous project to return to
     */
    public ProjectRecord switchBack() {
        return store.withLock(() -> {
            Registry registry = store.load();
            String previous = registry.previousProjectId();
            ProjectRecord target = registry.project(previous)
                .orElseThrow(() -> new ProjectNotFoundException(previous == null ? "<previous>" : previous));
            return activate(registry, target);
        });
    }

    private ProjectRecord activate(Registry registry, ProjectRecord target) {
        String current = registry.activeProjectId();
        String previous = target.id().equals(current) ? registry.previousProjectId() : current;
        ProjectRecord touched = target.withLastActiveAt(clock.instant());
        store.save(registry.withProject(touched).withActive(touched.id(), previous));
        log.info("Switched active project to '{}'", touched.id());
        return touched;
    }

    private static Optional<ProjectRecord> mostRecentlyActive(Registry registry) {
        return registry.allProjects().stream()
            .max(Comparator.comparing((ProjectRecord p) -> p.lastActiveAt() == null ? Instant.EPOCH : p.lastActiveAt())
                .thenComparing(ProjectRecord::id, Comparator.reverseOrder()));
    }

    private static void requireAlias(String alias) {
        if (alias == null || alias.isBlank()) {
            throw new IllegalArgumentException("Alias must not be null or blank");
        }
    }
}
