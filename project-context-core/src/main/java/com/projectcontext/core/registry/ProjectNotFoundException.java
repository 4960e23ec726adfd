package com.projectcontext.core.registry;

/**
 * No registered project answers to the given id, name or alias.
 */
public class ProjectNotFoundException extends RegistryException {

    private final String reference;

    public ProjectNotFoundException(String reference) {
        super("No registered project matches '" + reference + "'");
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
