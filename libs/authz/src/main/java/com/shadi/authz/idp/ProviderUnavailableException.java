package com.shadi.authz.idp;

/**
 * The provider could not be asked: timeout, connection failure, 5xx, throttling or no
 * management token. Says nothing about the subject's permissions.
 */
public class ProviderUnavailableException extends IdentityProviderException {

    public ProviderUnavailableException(String subjectId, String message) {
        super(subjectId, message, null);
    }

    public ProviderUnavailableException(String subjectId, String message, Throwable cause) {
        super(subjectId, message, cause);
    }
}
