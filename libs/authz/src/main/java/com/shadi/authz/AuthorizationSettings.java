package com.shadi.authz;

import java.util.Set;

/**
 * @param highRiskActions actions that are never granted from degraded (stale) permissions
 */
public record AuthorizationSettings(Set<String> highRiskActions) {

    public static final Set<String> DEFAULT_HIGH_RISK_ACTIONS = Set.of(Permission.MANAGE_PAYMENTS.value());

    public AuthorizationSettings {
        highRiskActions = highRiskActions == null ? DEFAULT_HIGH_RISK_ACTIONS : Set.copyOf(highRiskActions);
    }

    public static AuthorizationSettings defaults() {
        return new AuthorizationSettings(null);
    }

    public boolean isHighRisk(String action) {
        return action != null && highRiskActions.contains(action);
    }
}
