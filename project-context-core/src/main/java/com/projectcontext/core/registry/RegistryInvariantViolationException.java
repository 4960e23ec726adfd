package com.projectcontext.core.registry;

import java.util.List;

/**
 * A write was rejected because it would break a registry invariant.
 *
 * <p>The previously persisted registry is left untouched.
 */
public class RegistryInvariantViolationException extends RegistryException {

    private final List<String> violations;

    public RegistryInvariantViolationException(List<String> violations) {
        super("Registry write rejected: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
