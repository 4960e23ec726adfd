package com.projectcontext.core.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.projectcontext.core.model.ProjectRecord;
import com.projectcontext.core.model.Registry;
import com.projectcontext.core.util.FileLocks;
import com.projectcontext.core.util.FileUtils;
import com.projectcontext.core.util.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Registry store backed by a single JSON document.
 *
 * <p>Writes go through {@link FileUtils#writeAtomically(Path, byte[])} so a crash
 * leaves either the old or the new document. {@link #withLock(Supplier)} serializes
 * writers through {@link FileLocks} on a sibling {@code .lock} file.
 */
public class FileRegistryStore implements RegistryStore {

    private static final Logger log = LoggerFactory.getLogger(FileRegistryStore.class);

    private final Path file;
    private final Path lockFile;
    private final ObjectMapper mapper;

    public FileRegistryStore(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null").toAbsolutePath();
        this.lockFile = this.file.resolveSibling(this.file.getFileName() + ".lock");
        this.mapper = JsonMappers.strictJson().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getFile() {
        return file;
    }

    @Override
    public Registry load() {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            log.debug("No registry at {}, starting empty", file);
            return Registry.empty();
        } catch (IOException e) {
            throw new RegistryException("Failed to read registry " + file, e);
        }

        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (IOException e) {
            throw new CorruptRegistryException(file, "not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new CorruptRegistryException(file, "document is not a JSON object", null);
        }
        JsonNode versionNode = root.get("version");
        if (versionNode == null || !versionNode.isInt()) {
            throw new CorruptRegistryException(file, "missing or non-integer 'version'", null);
        }
        int version = versionNode.intValue();
        if (version < 1) {
            throw new CorruptRegistryException(file, "invalid 'version' " + version, null);
        }
        if (version > Registry.CURRENT_VERSION) {
            throw new UnsupportedRegistryVersionException(file, version, Registry.CURRENT_VERSION);
        }

        Registry registry;
        try {
            registry = mapper.treeToValue(root, RegistryDocument.class).toRegistry();
        } catch (JsonProcessingException e) {
            throw new CorruptRegistryException(file, e.getOriginalMessage(), e);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new CorruptRegistryException(file, e.getMessage(), e);
        }

        warnAboutInconsistencies(registry);
        log.debug("Loaded {} projects from {}", registry.projects().size(), file);
        return registry;
    }

    @Override
    public void save(Registry registry) {
        Objects.requireNonNull(registry, "registry must not be null");
        RegistryInvariants.check(registry);
        Registry toWrite = registry.version() == Registry.CURRENT_VERSION
            ? registry
            : new Registry(Registry.CURRENT_VERSION, registry.projects(),
                registry.activeProjectId(), registry.previousProjectId());
        try {
            byte[] content = mapper.writeValueAsBytes(RegistryDocument.from(toWrite));
            FileUtils.writeAtomically(file, content);
            log.debug("Saved {} projects to {}", toWrite.projects().size(), file);
        } catch (IOException e) {
            throw new RegistryException("Failed to write registry " + file, e);
        }
    }

    @Override
    public <T> T withLock(Supplier<T> action) {
        Objects.requireNonNull(action, "action must not be null");
        try {
            return FileLocks.withLock(lockFile, action::get);
        } catch (IOException e) {
            throw new RegistryException("Failed to lock " + lockFile, e);
        }
    }

    private void warnAboutInconsistencies(Registry registry) {
        String active = registry.activeProjectId();
        if (active != null && !registry.contains(active)) {
            log.warn("Registry {} references unknown active project '{}'", file, active);
        }
        Map<String, String> owners = new HashMap<>();
        for (ProjectRecord project : registry.allProjects()) {
            for (String alias : project.aliases()) {
                String owner = owners.putIfAbsent(alias, project.id());
                if (owner != null) {
                    log.warn("Alias '{}' is claimed by both '{}' and '{}'", alias, owner, project.id());
                }
            }
        }
    }
}
