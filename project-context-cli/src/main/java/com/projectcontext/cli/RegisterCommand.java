package com.projectcontext.cli;

import com.projectcontext.ProjectContextCLI;
import com.projectcontext.core.engine.ProjectContext;
import com.projectcontext.core.model.ProjectRecord;
import com.projectcontext.core.util.IdGenerator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Registers a project.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * project-context register "Billing API" ~/work/billing-api --alias api --alias billing \
 *     --remote git@github.com:acme/billing-api.git --marker pom.xml
 * }</pre>
 */
@Command(
    name = "register",
    description = "Register a project",
    mixinStandardHelpOptions = true
)
public class RegisterCommand extends ContextCommand {

    @ParentCommand
    private ProjectContextCLI parent;

    @Parameters(index = "0", description = "Project display name")
    private String name;

    @Parameters(index = "1", description = "Project root directory")
    private Path path;

    @Option(names = "--id", description = "Project id (default: derived from the name)")
    private String id;

    @Option(names = "--alias", description = "Alias (repeatable)")
    private List<String> aliases = new ArrayList<>();

    @Option(names = "--remote", description = "VCS remote URL (repeatable)")
    private List<String> remotes = new ArrayList<>();

    @Option(names = "--marker", description = "Relative path that must exist under the root (repeatable)")
    private List<String> markers = new ArrayList<>();

    @Option(names = "--tag", description = "Tag (repeatable)")
    private List<String> tags = new ArrayList<>();

    @Option(names = "--description", description = "Free-form description")
    private String description;

    @Override
    protected ProjectContextCLI cli() {
        return parent;
    }

    @Override
    protected int execute(ProjectContext context) {
        String projectId = id == null || id.isBlank() ? IdGenerator.slug(name) : id.trim();
        ProjectRecord project = new ProjectRecord(projectId, name, new LinkedHashSet<>(aliases),
            path.toAbsolutePath().normalize().toString(), new LinkedHashSet<>(remotes), new LinkedHashSet<>(markers),
            null, null, tags, description);

        ProjectRecord stored = context.getRegistry().register(project);
        System.out.println("✓ Registered " + stored.id() + " at " + stored.path());
        if (!stored.aliases().isEmpty()) {
            System.out.println("  Aliases: " + String.join(", ", stored.aliases()));
        }
        return 0;
    }
}
