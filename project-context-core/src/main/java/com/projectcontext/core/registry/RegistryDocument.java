package com.projectcontext.core.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.projectcontext.core.model.ProjectRecord;
import com.projectcontext.core.model.Registry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk shape of the registry: projects as an array rather than a map.
 *
 * @param version schema version
 * @param activeProjectId active project id, nullable
 * @param previousProjectId previously active project id, nullable
 * @param projects registered projects
 */
record RegistryDocument(
    @JsonProperty("version") Integer version,
    @JsonProperty("activeProjectId") String activeProjectId,
    @JsonProperty("previousProjectId") String previousProjectId,
    @JsonProperty("projects") List<ProjectRecord> projects
) {
    RegistryDocument {
        projects = projects == null ? List.of() : List.copyOf(projects);
    }

    static RegistryDocument from(Registry registry) {
        List<ProjectRecord> projects = new ArrayList<>(registry.projects().values());
        projects.sort(Comparator.comparing(ProjectRecord::id));
        return new RegistryDocument(registry.version(), registry.activeProjectId(),
            registry.previousProjectId(), projects);
    }

    /**
     * Converts to the in-memory registry.
     *
     * @return registry
     * @throws IllegalArgumentException if two projects share an id
     */
    Registry toRegistry() {
        Map<String, ProjectRecord> byId = new LinkedHashMap<>();
        for (ProjectRecord project : projects) {
            if (byId.put(project.id(), project) != null) {
                throw new IllegalArgumentException("duplicate project id '" + project.id() + "'");
            }
        }
        if (version == null) {
            throw new IllegalArgumentException("missing version");
        }
        return new Registry(version, byId, activeProjectId, previousProjectId);
    }
}
