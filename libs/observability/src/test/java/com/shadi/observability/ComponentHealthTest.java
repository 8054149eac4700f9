package com.shadi.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ComponentHealth")
class ComponentHealthTest {

    @Test
    @DisplayName("factories should set the matching status")
    void factoriesShouldSetStatus() {
        assertThat(ComponentHealth.healthy("jwks", 4).status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(ComponentHealth.degraded("identity-provider", "slow", 900).status())
                .isEqualTo(HealthStatus.DEGRADED);
        ComponentHealth down = ComponentHealth.unhealthy("identity-provider", "refused", 12);
        assertThat(down.status()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(down.message()).isEqualTo("refused");
        assertThat(down.latencyMs()).isEqualTo(12);
    }

    @Test
    @DisplayName("should reject a blank name")
    void shouldRejectBlankName() {
        assertThatThrownBy(() -> ComponentHealth.healthy("", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
