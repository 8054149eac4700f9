package com.shadi.authz.idp;

/**
 * Failure to obtain a subject's permissions from the identity provider.
 * <p>
 * Checked: the two subclasses call for opposite reactions (keep serving cached data versus
 * revoke it), so every caller has to decide which one it is handling.
 */
public abstract class IdentityProviderException extends Exception {

    private final String subjectId;

    protected IdentityProviderException(String subjectId, String message, Throwable cause) {
        super(message, cause);
        this.subjectId = subjectId;
    }

    /** Subject whose permissions were requested; null when the failure is not subject specific. */
    public String subjectId() {
        return subjectId;
    }
}
