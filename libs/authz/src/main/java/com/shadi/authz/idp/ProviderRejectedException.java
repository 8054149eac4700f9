package com.shadi.authz.idp;

/**
 * The provider answered, but not with permissions for this subject: unknown or deleted subject,
 * a client error, or a body that cannot be trusted. Cached permissions must be revoked.
 */
public class ProviderRejectedException extends IdentityProviderException {

    public ProviderRejectedException(String subjectId, String message) {
        super(subjectId, message, null);
    }

    public ProviderRejectedException(String subjectId, String message, Throwable cause) {
        super(subjectId, message, cause);
    }
}
