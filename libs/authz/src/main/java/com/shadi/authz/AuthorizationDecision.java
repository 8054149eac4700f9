package com.shadi.authz;

/**
 * Outcome of one authorization check. Never persisted.
 *
 * @param allowed  true iff {@code reason} is {@link DecisionReason#GRANTED}
 * @param reason   why
 * @param degraded the decision was computed from permission data older than its TTL
 */
public record AuthorizationDecision(boolean allowed, DecisionReason reason, boolean degraded) {

    public AuthorizationDecision {
        if (reason == null) {
            throw new IllegalArgumentException("reason must not be null");
        }
        if (allowed != (reason == DecisionReason.GRANTED)) {
            throw new IllegalArgumentException("allowed=%s contradicts reason %s".formatted(allowed, reason));
        }
    }

    public static AuthorizationDecision allow(boolean degraded) {
        return new AuthorizationDecision(true, DecisionReason.GRANTED, degraded);
    }

    public static AuthorizationDecision deny(DecisionReason reason) {
        return deny(reason, false);
    }

    public static AuthorizationDecision deny(DecisionReason reason, boolean degraded) {
        return new AuthorizationDecision(false, reason, degraded);
    }
}
