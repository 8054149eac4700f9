package com.shadi.authz;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AuthorizationDecision")
class AuthorizationDecisionTest {

    @Test
    @DisplayName("allow carries GRANTED")
    void allow() {
        AuthorizationDecision decision = AuthorizationDecision.allow(true);

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.reason()).isEqualTo(DecisionReason.GRANTED);
        assertThat(decision.degraded()).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = DecisionReason.class, names = "GRANTED", mode = EnumSource.Mode.EXCLUDE)
    @DisplayName("every other reason denies")
    void everyOtherReasonDenies(DecisionReason reason) {
        assertThat(AuthorizationDecision.deny(reason).allowed()).isFalse();
    }

    @Test
    @DisplayName("allowed must agree with the reason")
    void allowedMustAgreeWithReason() {
        assertThatThrownBy(() -> new AuthorizationDecision(true, DecisionReason.MISSING_PERMISSION, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AuthorizationDecision(false, DecisionReason.GRANTED, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
