package com.shadi.authzservice.api;

import com.shadi.authz.DecisionReason;

/** The caller is authenticated but may not use the endpoint. */
public class PermissionDeniedException extends RuntimeException {

    private final DecisionReason reason;

    public PermissionDeniedException(String action, DecisionReason reason) {
        super("missing permission " + action);
        this.reason = reason;
    }

    public DecisionReason reason() {
        return reason;
    }
}
