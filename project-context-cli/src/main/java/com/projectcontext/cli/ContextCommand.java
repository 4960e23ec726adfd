package com.projectcontext.cli;

import com.projectcontext.ProjectContextCLI;
import com.projectcontext.core.engine.ProjectContext;
import com.projectcontext.core.registry.ProjectNotFoundException;
import com.projectcontext.core.registry.RegistryException;
import com.projectcontext.core.registry.RegistryInvariantViolationException;
import com.projectcontext.core.safeguard.AuditLogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Base class for commands that work on the context home.
 *
 * <p>Failures are reported on stderr with a {@code ✗} marker and exit code 1.
 */
abstract class ContextCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ContextCommand.class);

    /**
     * Returns the root command holding the global options.
     *
     * @return root command
     */
    protected abstract ProjectContextCLI cli();

    /**
     * Runs the command.
     *
     * @param context opened context home
     * @return exit code
     * @throws Exception on failure
     */
    protected abstract int execute(ProjectContext context) throws Exception;

    @Override
    public Integer call() {
        try {
            return execute(cli().context());
        } catch (ProjectNotFoundException e) {
            System.err.println("✗ " + e.getMessage());
            return 1;
        } catch (RegistryInvariantViolationException e) {
            System.err.println("✗ Rejected:");
            e.getViolations().forEach(violation -> System.err.println("  - " + violation));
            return 1;
        } catch (RegistryException | AuditLogException e) {
            log.error("Command failed", e);
            System.err.println("✗ " + e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Command failed", e);
            System.err.println("✗ Failed: " + e.getMessage());
            return 1;
        }
    }
}
