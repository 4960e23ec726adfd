package com.projectcontext.core.engine;

import com.projectcontext.core.config.ConfigLoader;
import com.projectcontext.core.config.EngineConfig;
import com.projectcontext.core.detector.Detector;
import com.projectcontext.core.registry.FileRegistryStore;
import com.projectcontext.core.registry.ProjectRegistry;
import com.projectcontext.core.safeguard.AuditLog;
import com.projectcontext.core.safeguard.Safeguard;
import com.projectcontext.core.safeguard.SafeguardPolicy;
import com.projectcontext.core.validator.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything rooted at one context home directory: configuration, registry,
 * audit log and the engine wired over them.
 *
 * <p>Layout of the home directory:
 * <pre>
 * ~/.project-context/
 *   project-context.yaml   optional configuration
 *   registry.json          registry document
 *   registry.json.lock     registry write lock
 *   audit.log              JSON Lines audit log
 *   audit.log.lock         audit append lock
 * </pre>
 */
public final class ProjectContext {

    private static final Logger log = LoggerFactory.getLogger(ProjectContext.class);

    private final Path home;
    private final EngineConfig config;
    private final ProjectRegistry registry;
    private final AuditLog auditLog;
    private final ContextResolutionEngine engine;

    private ProjectContext(Path home, EngineConfig config) {
        this.home = home;
        this.config = config;
        FileRegistryStore store = new FileRegistryStore(home.resolve(config.registry().file()));
        this.registry = new ProjectRegistry(store);
        this.auditLog = new AuditLog(home.resolve(config.registry().auditLog()));
        this.engine = new ContextResolutionEngine(
            store,
            Detector.withDefaultStrategies(config.detection()),
            new Validator(config.validation()),
            new Safeguard(auditLog),
            SafeguardPolicy.from(config.safeguard()));
    }

    /**
     * Opens the context home, loading {@code project-context.yaml} if present.
     *
     * @param home context home directory
     * @return context
     */
    public static ProjectContext open(Path home) {
        Objects.requireNonNull(home, "home must not be null");
        Path absolute = home.toAbsolutePath().normalize();
        EngineConfig config = ConfigLoader.load(absolute.resolve(ConfigLoader.CONFIG_FILE_NAME));
        log.debug("Opened project context at {}", absolute);
        return new ProjectContext(absolute, config);
    }

    /**
     * Opens the context home with an explicit configuration.
     *
     * @param home context home directory
     * @param config configuration
     * @return context
     */
    public static ProjectContext open(Path home, EngineConfig config) {
        Objects.requireNonNull(home, "home must not be null");
        Objects.requireNonNull(config, "config must not be null");
        return new ProjectContext(home.toAbsolutePath().normalize(), config);
    }

    public Path getHome() {
        return home;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public ProjectRegistry getRegistry() {
        return registry;
    }

    public AuditLog getAuditLog() {
        return auditLog;
    }

    public ContextResolutionEngine getEngine() {
        return engine;
    }
}
