package com.projectcontext.cli;

import com.projectcontext.ProjectContextCLI;
import com.projectcontext.core.engine.ProjectContext;
import com.projectcontext.core.model.ProjectRecord;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.Optional;

/**
 * Lists registered projects; the active one is marked with {@code *}.
 */
@Command(
    name = "list",
    description = "List registered projects",
    mixinStandardHelpOptions = true
)
public class ListCommand extends ContextCommand {

    @ParentCommand
    private ProjectContextCLI parent;

    @Override
    protected ProjectContextCLI cli() {
        return parent;
    }

    @Override
    protected int execute(ProjectContext context) {
        List<ProjectRecord> projects = context.getRegistry().list();
        if (projects.isEmpty()) {
            System.out.println("No projects registered.");
            System.out.println("  Use 'project-context register <name> <path>' to add one.");
            return 0;
        }

        String active = context.getRegistry().current().map(ProjectRecord::id).orElse(null);
        System.out.println("Registered Projects:");
        System.out.println();
        for (ProjectRecord project : projects) {
            String marker = project.id().equals(active) ? "*" : "•";
            System.out.printf("  %s %s (ID: %s)%n", marker, project.name(), project.id());
            System.out.printf("    Path: %s%n", project.path());
            if (!project.aliases().isEmpty()) {
                System.out.printf("    Aliases: %s%n", String.join(", ", project.aliases()));
            }
            Optional.ofNullable(project.description())
                .ifPresent(description -> System.out.printf("    %s%n", description));
        }
        return 0;
    }
}
