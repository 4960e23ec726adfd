package com.projectcontext.core.safeguard;

import com.projectcontext.core.config.EngineConfig.PolicyAction;
import com.projectcontext.core.config.EngineConfig.SafeguardSettings;
import com.projectcontext.core.model.ValidationStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SafeguardPolicy}.
 */
class SafeguardPolicyTest {

    @Test
    void defaults_confirmBothWithThirtySecondTimeout() {
        SafeguardPolicy policy = SafeguardPolicy.defaults();

        assertThat(policy.actionFor(ValidationStatus.MISMATCH)).isEqualTo(PolicyAction.CONFIRM);
        assertThat(policy.actionFor(ValidationStatus.LOW_CONFIDENCE)).isEqualTo(PolicyAction.CONFIRM);
        assertThat(policy.confirmationTimeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void from_settings_copiesActions() {
        SafeguardPolicy policy = SafeguardPolicy.from(
            new SafeguardSettings(PolicyAction.BLOCK, PolicyAction.CONFIRM, 5L));

        assertThat(policy.onMismatch()).isEqualTo(PolicyAction.BLOCK);
        assertThat(policy.onLowConfidence()).isEqualTo(PolicyAction.CONFIRM);
        assertThat(policy.confirmationTimeout()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void actionFor_okStatus_throwsException() {
        assertThatThrownBy(() -> SafeguardPolicy.defaults().actionFor(ValidationStatus.OK))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("No policy applies");
    }

    @Test
    void constructor_withZeroTimeout_throwsException() {
        assertThatThrownBy(() -> SafeguardPolicy.defaults().withConfirmationTimeout(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("confirmationTimeout must be positive");
    }
}
