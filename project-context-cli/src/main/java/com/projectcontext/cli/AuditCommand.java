package com.projectcontext.cli;

import com.projectcontext.ProjectContextCLI;
import com.projectcontext.core.engine.ProjectContext;
import com.projectcontext.core.model.AuditEvent;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.Locale;

/**
 * Shows or trims the audit log.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * project-context audit tail -n 20
 * project-context audit trim --keep 1000
 * }</pre>
 */
@Command(
    name = "audit",
    description = "Show or trim the audit log",
    mixinStandardHelpOptions = true,
    subcommands = {AuditCommand.Tail.class, AuditCommand.Trim.class}
)
public class AuditCommand implements Runnable {

    @ParentCommand
    private ProjectContextCLI parent;

    @Override
    public void run() {
        System.out.println("Use 'project-context audit tail' or 'project-context audit trim --keep N'");
    }

    ProjectContextCLI root() {
        return parent;
    }

    @Command(name = "tail", description = "Show the newest audit records", mixinStandardHelpOptions = true)
    public static class Tail extends ContextCommand {

        @ParentCommand
        private AuditCommand audit;

        @Option(names = {"-n", "--lines"}, description = "Number of records (default: ${DEFAULT-VALUE})", defaultValue = "10")
        private int count;

        @Override
        protected ProjectContextCLI cli() {
            return audit.root();
        }

        @Override
        protected int execute(ProjectContext context) {
            List<AuditEvent> events = context.getAuditLog().tail(count);
            if (events.isEmpty()) {
                System.out.println("Audit log is empty.");
                return 0;
            }
            for (AuditEvent event : events) {
                String project = event.validation() == null || event.validation().resolvedProjectId() == null
                    ? "-"
                    : event.validation().resolvedProjectId();
                System.out.printf("%s  %-10s %-20s %-10s %s%n", event.timestamp(),
                    event.decision().name().toLowerCase(Locale.ROOT), event.operation(), project,
                    event.note() == null ? "" : event.note());
            }
            return 0;
        }
    }

    @Command(name = "trim", description = "Keep only the newest audit records", mixinStandardHelpOptions = true)
    public static class Trim extends ContextCommand {

        @ParentCommand
        private AuditCommand audit;

        @Option(names = "--keep", required = true, description = "Number of records to keep")
        private int keep;

        @Override
        protected ProjectContextCLI cli() {
            return audit.root();
        }

        @Override
        protected int execute(ProjectContext context) {
            AuditEvent trim = context.getAuditLog().trim(keep, System.getProperty("user.name"));
            System.out.println("✓ Audit log trimmed: " + trim.note());
            return 0;
        }
    }
}
