package com.projectcontext;

import ch.qos.logback.classic.Level;
import com.projectcontext.cli.AliasCommand;
import com.projectcontext.cli.AuditCommand;
import com.projectcontext.cli.CurrentCommand;
import com.projectcontext.cli.ListCommand;
import com.projectcontext.cli.RegisterCommand;
import com.projectcontext.cli.RemoveCommand;
import com.projectcontext.cli.ResolveCommand;
import com.projectcontext.cli.SwitchCommand;
import com.projectcontext.core.engine.ProjectContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Main CLI entry point for Project Context.
 *
 * <p>Keeps a registry of workspaces ("projects") and resolves which one an
 * operation applies to, blocking or asking for confirmation when the working
 * context contradicts the project the caller named.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code resolve} - Resolve the project for an operation</li>
 *   <li>{@code register} - Register a project</li>
 *   <li>{@code alias} - Add or remove a project alias</li>
 *   <li>{@code remove} - Remove a project</li>
 *   <li>{@code switch} - Switch the active project</li>
 *   <li>{@code current} - Show the active project</li>
 *   <li>{@code list} - List registered projects</li>
 *   <li>{@code audit} - Show or trim the audit log</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --home} - Context home directory (default {@code $PROJECT_CONTEXT_HOME} or {@code ~/.project-context})</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Register a project
 * project-context register "Billing API" ~/work/billing-api --alias api
 *
 * # Resolve before deploying
 * project-context resolve deploy --project api
 *
 * # Switch back to the previous project
 * project-context switch --back
 * }</pre>
 */
@Command(
    name = "project-context",
    mixinStandardHelpOptions = true,
    version = "Project Context 1.0.0-SNAPSHOT",
    description = "Resolves which registered project an operation applies to",
    subcommands = {
        ResolveCommand.class,
        RegisterCommand.class,
        AliasCommand.class,
        RemoveCommand.class,
        SwitchCommand.class,
        CurrentCommand.class,
        ListCommand.class,
        AuditCommand.class
    }
)
public class ProjectContextCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ProjectContextCLI.class);

    /** Environment variable overriding the default context home. */
    public static final String HOME_ENV = "PROJECT_CONTEXT_HOME";

    /** Exit code of a resolution that was blocked. */
    public static final int EXIT_BLOCKED = 2;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Option(names = "--home", description = "Context home directory")
    private Path home;

    private ProjectContext context;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("Project Context - workspace resolution and safeguards");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'project-context --help' to see available commands");
        System.out.println("Use 'project-context <command> --help' for command-specific help");
    }

    /**
     * Opens the context home on first use.
     *
     * @return project context
     */
    public ProjectContext context() {
        if (context == null) {
            Path resolvedHome = resolveHome();
            log.debug("Using context home {}", resolvedHome);
            context = ProjectContext.open(resolvedHome);
        }
        return context;
    }

    Path resolveHome() {
        if (home != null) {
            return home;
        }
        String fromEnv = System.getenv(HOME_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Paths.get(fromEnv);
        }
        return Paths.get(System.getProperty("user.home"), ".project-context");
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    private int executionStrategy(CommandLine.ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any command runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        ProjectContextCLI cli = new ProjectContextCLI();
        return new CommandLine(cli)
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
