package com.projectcontext.cli;

import com.projectcontext.ProjectContextCLI;
import com.projectcontext.core.engine.ProjectContext;
import com.projectcontext.core.model.ProjectRecord;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

/**
 * Removes a project from the registry. Files on disk are not touched.
 */
@Command(
    name = "remove",
    description = "Remove a project from the registry",
    mixinStandardHelpOptions = true
)
public class RemoveCommand extends ContextCommand {

    @ParentCommand
    private ProjectContextCLI parent;

    @Parameters(index = "0", description = "Project id, name or alias")
    private String project;

    @Override
    protected ProjectContextCLI cli() {
        return parent;
    }

    @Override
    protected int execute(ProjectContext context) {
        ProjectRecord removed = context.getRegistry().remove(project);
        System.out.println("✓ Removed " + removed.id());
        context.getRegistry().current()
            .ifPresent(active -> System.out.println("  Active project: " + active.id()));
        return 0;
    }
}
