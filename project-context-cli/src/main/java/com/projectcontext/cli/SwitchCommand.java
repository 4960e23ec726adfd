package com.projectcontext.cli;

import com.projectcontext.ProjectContextCLI;
import com.projectcontext.core.engine.ProjectContext;
import com.projectcontext.core.model.ProjectRecord;
import com.projectcontext.core.model.Registry;
import com.projectcontext.core.registry.ProjectNotFoundException;
import com.projectcontext.core.validator.Validator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;

/**
 * Switches the active project.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * project-context switch api
 * project-context switch --back
 * project-context switch api --no-validate
 * }</pre>
 *
 * <p>The target's root directory and declared markers are checked first; a
 * project with a broken structure is refused unless {@code --no-validate} is given.
 */
@Command(
    name = "switch",
    description = "Switch the active project",
    mixinStandardHelpOptions = true
)
public class SwitchCommand extends ContextCommand {

    @ParentCommand
    private ProjectContextCLI parent;

    @Parameters(index = "0", arity = "0..1", description = "Project id, name or alias")
    private String project;

    @Option(names = "--back", description = "Switch back to the previously active project")
    private boolean back;

    @Option(names = "--no-validate", description = "Skip the structural check of the target project")
    private boolean noValidate;

    @Override
    protected ProjectContextCLI cli() {
        return parent;
    }

    @Override
    protected int execute(ProjectContext context) {
        if (back == (project != null)) {
            System.err.println("✗ Give either a project or --back");
            return 1;
        }
        if (!noValidate) {
            ProjectRecord target = back ? previous(context.getRegistry().snapshot()) : context.getRegistry().get(project);
            List<String> problems = Validator.structuralProblems(target);
            if (!problems.isEmpty()) {
                System.err.println("✗ Switch blocked:");
                problems.forEach(problem -> System.err.println("  • " + problem));
                System.err.println("  Use --no-validate to switch anyway");
                return 1;
            }
        }
        ProjectRecord active = back
            ? context.getRegistry().switchBack()
            : context.getRegistry().switchTo(project);
        System.out.println("✓ Active project: " + active.id() + " (" + active.path() + ")");
        return 0;
    }

    private static ProjectRecord previous(Registry registry) {
        String previous = registry.previousProjectId();
        return registry.project(previous)
            .orElseThrow(() -> new ProjectNotFoundException(previous == null ? "<previous>" : previous));
    }
}
