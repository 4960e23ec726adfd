package com.projectcontext.cli;

import com.projectcontext.ProjectContextCLI;
import com.projectcontext.core.engine.ProjectContext;
import com.projectcontext.core.model.ProjectRecord;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.Optional;

/**
 * Prints the active project. Exit code 1 when none is active.
 */
@Command(
    name = "current",
    description = "Show the active project",
    mixinStandardHelpOptions = true
)
public class CurrentCommand extends ContextCommand {

    @ParentCommand
    private ProjectContextCLI parent;

    @Override
    protected ProjectContextCLI cli() {
        return parent;
    }

    @Override
    protected int execute(ProjectContext context) {
        Optional<ProjectRecord> active = context.getRegistry().current();
        if (active.isEmpty()) {
            System.err.println("✗ No active project");
            return 1;
        }
        ProjectRecord project = active.get();
        System.out.println(project.id() + " - " + project.name());
        System.out.println("  Path: " + project.path());
        return 0;
    }
}
