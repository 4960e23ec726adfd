package com.projectcontext.cli;

import com.projectcontext.ProjectContextCLI;
import com.projectcontext.core.config.EngineConfig.PolicyAction;
import com.projectcontext.core.engine.ProjectContext;
import com.projectcontext.core.engine.Resolution;
import com.projectcontext.core.engine.ResolveRequest;
import com.projectcontext.core.safeguard.ConfirmationCallback;
import com.projectcontext.core.safeguard.SafeguardPolicy;
import com.projectcontext.core.vcs.GitRemoteReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;

/**
 * Resolves the project an operation applies to and applies the safeguard.
 *
 * <p>Exit code 0 when the operation may proceed, 2 when it was blocked.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Resolve from the current directory
 * project-context resolve build
 *
 * # State the intended project and refuse without asking on mismatch
 * project-context resolve deploy --project api --on-mismatch block
 *
 * # Mention a project by name
 * project-context resolve test --name "billing"
 * }</pre>
 */
@Command(
    name = "resolve",
    description = "Resolve which project an operation applies to",
    mixinStandardHelpOptions = true
)
public class ResolveCommand extends ContextCommand {

    private static final Logger log = LoggerFactory.getLogger(ResolveCommand.class);

    @ParentCommand
    private ProjectContextCLI parent;

    @Parameters(index = "0", description = "Operation label, recorded in the audit log")
    private String operation;

    @Option(names = "--cwd", description = "Working directory (default: current directory)")
    private Path cwd;

    @Option(names = "--remote", description = "VCS remote URL (default: origin of the enclosing git repository)")
    private String remote;

    @Option(names = "--name", description = "Project name mentioned by the caller")
    private String mentionedName;

    @Option(names = "--project", description = "Project the caller intends to work on (id, name or alias)")
    private String statedProject;

    @Option(names = "--actor", description = "Who is asking (default: current user)")
    private String actor;

    @Option(names = "--on-mismatch", description = "Action on mismatch: ${COMPLETION-CANDIDATES}")
    private PolicyAction onMismatch;

    @Option(names = "--on-low-confidence", description = "Action on low confidence: ${COMPLETION-CANDIDATES}")
    private PolicyAction onLowConfidence;

    @Option(names = "--timeout", description = "Confirmation timeout in seconds")
    private Long timeoutSeconds;

    @Option(names = "--no-prompt", description = "Never ask; anything needing confirmation is blocked")
    private boolean noPrompt;

    @Override
    protected ProjectContextCLI cli() {
        return parent;
    }

    @Override
    protected int execute(ProjectContext context) {
        Path workingDirectory = (cwd == null ? Paths.get("") : cwd).toAbsolutePath().normalize();
        ResolveRequest request = new ResolveRequest(operation, workingDirectory, remoteFor(workingDirectory),
            mentionedName, statedProject, actor == null ? System.getProperty("user.name") : actor);

        SafeguardPolicy policy = context.getEngine().getDefaultPolicy();
        if (onMismatch != null) {
            policy = policy.withOnMismatch(onMismatch);
        }
        if (onLowConfidence != null) {
            policy = policy.withOnLowConfidence(onLowConfidence);
        }
        if (timeoutSeconds != null) {
            policy = policy.withConfirmationTimeout(Duration.ofSeconds(timeoutSeconds));
        }
        ConfirmationCallback callback = noPrompt ? null : new ConsoleConfirmation(System.in, System.out);

        Resolution resolution = context.getEngine().resolve(request, policy, callback);

        String project = resolution.resolvedProjectId() == null ? "<none>" : resolution.resolvedProjectId();
        System.out.println("Project: " + project);
        System.out.println(String.format(Locale.ROOT, "Confidence: %.2f", resolution.confidence()));
        resolution.warnings().forEach(warning -> System.out.println("⚠ " + warning));

        String decision = resolution.decision().name().toLowerCase(Locale.ROOT);
        if (resolution.permitsOperation()) {
            System.out.println("✓ Decision: " + decision);
            return 0;
        }
        System.err.println("✗ Decision: " + decision);
        return ProjectContextCLI.EXIT_BLOCKED;
    }

    private String remoteFor(Path workingDirectory) {
        if (remote != null) {
            return remote;
        }
        try {
            return new GitRemoteReader().readOriginUrl(workingDirectory).orElse(null);
        } catch (IOException e) {
            log.warn("Could not read git remote for {}: {}", workingDirectory, e.getMessage());
            return null;
        }
    }
}
