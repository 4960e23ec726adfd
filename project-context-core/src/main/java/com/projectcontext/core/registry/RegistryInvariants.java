package com.projectcontext.core.registry;

import com.projectcontext.core.model.ProjectRecord;
import com.projectcontext.core.model.Registry;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Invariants every persisted registry must satisfy.
 *
 * <ul>
 *   <li>each alias belongs to at most one project</li>
 *   <li>aliases are not blank</li>
 *   <li>{@code activeProjectId}, if set, names an existing project</li>
 *   <li>each project is stored under its own id</li>
 *   <li>project paths are absolute</li>
 * </ul>
 */
public final class RegistryInvariants {

    private RegistryInvariants() {
        // Utility class
    }

    /**
     * Returns every violated invariant; an empty list means the registry is valid.
     *
     * @param registry registry to check
     * @return violation messages
     */
    public static List<String> violations(Registry registry) {
        List<String> violations = new ArrayList<>();
        Map<String, String> aliasOwners = new HashMap<>();

        for (Map.Entry<String, ProjectRecord> entry : registry.projects().entrySet()) {
            ProjectRecord project = entry.getValue();
            if (!entry.getKey().equals(project.id())) {
                violations.add("project '" + project.id() + "' is stored under key '" + entry.getKey() + "'");
            }
            if (project.id().isBlank()) {
                violations.add("project id must not be blank");
            }
            if (!isAbsolute(project.path())) {
                violations.add("project '" + project.id() + "' path must be absolute: " + project.path());
            }
            for (String alias : project.aliases()) {
                if (alias.isBlank()) {
                    violations.add("project '" + project.id() + "' has a blank alias");
                    continue;
                }
                String owner = aliasOwners.putIfAbsent(alias, project.id());
                if (owner != null && !owner.equals(project.id())) {
                    violations.add("alias '" + alias + "' is used by both '" + owner + "' and '" + project.id() + "'");
                }
            }
        }

        String active = registry.activeProjectId();
        if (active != null && !registry.projects().containsKey(active)) {
            violations.add("active project '" + active + "' is not registered");
        }
        return violations;
    }

    /**
     * Throws if the registry violates any invariant.
     *
     * @param registry registry to check
     * @throws RegistryInvariantViolationException listing every violation
     */
    public static void check(Registry registry) {
        List<String> violations = violations(registry);
        if (!violations.isEmpty()) {
            throw new RegistryInvariantViolationException(violations);
        }
    }

    private static boolean isAbsolute(String path) {
        try {
            Path parsed = Paths.get(path);
            return parsed.isAbsolute();
        } catch (RuntimeException e) {
            return false;
        }
    }
}
