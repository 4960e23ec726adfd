package com.projectcontext.core.safeguard;

import com.projectcontext.core.model.ValidationResult;

import java.util.Locale;
import java.util.Objects;

/**
 * What a confirmation callback is asked to approve.
 *
 * @param operation operation label
 * @param actor who asked, nullable
 * @param validation validation result that triggered the confirmation
 */
public record ConfirmationRequest(
    String operation,
    String actor,
    ValidationResult validation
) {
    /**
     * Compact constructor with validation.
     */
    public ConfirmationRequest {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(validation, "validation must not be null");
    }

    /**
     * Builds a one-line question suitable for a human prompt.
     *
     * @return prompt text
     */
    public String prompt() {
        String target = validation.resolvedProjectId() == null ? "<unknown project>" : validation.resolvedProjectId();
        return "Proceed with '" + operation + "' on project '" + target + "' despite "
            + validation.status().name().toLowerCase(Locale.ROOT).replace('_', ' ') + "?";
    }
}
