package com.projectcontext.cli;

import com.projectcontext.ProjectContextCLI;
import com.projectcontext.core.engine.ProjectContext;
import com.projectcontext.core.model.ProjectRecord;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

/**
 * Adds or removes a project alias.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * project-context alias billing-api api
 * project-context alias billing-api api --remove
 * }</pre>
 */
@Command(
    name = "alias",
    description = "Add or remove a project alias",
    mixinStandardHelpOptions = true
)
public class AliasCommand extends ContextCommand {

    @ParentCommand
    private ProjectContextCLI parent;

    @Parameters(index = "0", description = "Project id, name or alias")
    private String project;

    @Parameters(index = "1", description = "Alias")
    private String alias;

    @Option(names = "--remove", description = "Remove the alias instead of adding it")
    private boolean remove;

    @Override
    protected ProjectContextCLI cli() {
        return parent;
    }

    @Override
    protected int execute(ProjectContext context) {
        ProjectRecord updated = remove
            ? context.getRegistry().removeAlias(project, alias)
            : context.getRegistry().addAlias(project, alias);
        System.out.println("✓ " + updated.id() + " aliases: "
            + (updated.aliases().isEmpty() ? "(none)" : String.join(", ", updated.aliases())));
        return 0;
    }
}
