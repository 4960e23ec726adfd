package com.projectcontext.core.safeguard;

import com.projectcontext.core.config.EngineConfig.PolicyAction;
import com.projectcontext.core.config.EngineConfig.SafeguardSettings;
import com.projectcontext.core.model.ValidationStatus;

import java.time.Duration;
import java.util.Objects;

/**
 * What the safeguard does with each validation status.
 *
 * @param onMismatch action for {@code mismatch}
 * @param onLowConfidence action for {@code lowConfidence}
 * @param confirmationTimeout how long a confirmation may take
 */
public record SafeguardPolicy(
    PolicyAction onMismatch,
    PolicyAction onLowConfidence,
    Duration confirmationTimeout
) {
    /**
     * Compact constructor with validation.
     */
    public SafeguardPolicy {
        Objects.requireNonNull(onMismatch, "onMismatch must not be null");
        Objects.requireNonNull(onLowConfidence, "onLowConfidence must not be null");
        Objects.requireNonNull(confirmationTimeout, "confirmationTimeout must not be null");
        if (confirmationTimeout.isNegative() || confirmationTimeout.isZero()) {
            throw new IllegalArgumentException("confirmationTimeout must be positive: " + confirmationTimeout);
        }
    }

    public static SafeguardPolicy from(SafeguardSettings settings) {
        return new SafeguardPolicy(settings.onMismatch(), settings.onLowConfidence(), settings.confirmationTimeout());
    }

    public static SafeguardPolicy defaults() {
        return from(SafeguardSettings.defaults());
    }

    /**
     * Returns the action for a status that requires a policy decision.
     *
     * @param status mismatch or low confidence
     * @return configured action
     * @throws IllegalArgumentException for statuses that are always allowed
     */
    public PolicyAction actionFor(ValidationStatus status) {
        return switch (status) {
            case MISMATCH -> onMismatch;
            case LOW_CONFIDENCE -> onLowConfidence;
            default -> throw new IllegalArgumentException("No policy applies to status " + status);
        };
    }

    public SafeguardPolicy withOnMismatch(PolicyAction action) {
        return new SafeguardPolicy(action, onLowConfidence, confirmationTimeout);
    }

    public SafeguardPolicy withOnLowConfidence(PolicyAction action) {
        return new SafeguardPolicy(onMismatch, action, confirmationTimeout);
    }

    public SafeguardPolicy withConfirmationTimeout(Duration timeout) {
        return new SafeguardPolicy(onMismatch, onLowConfidence, timeout);
    }
}
