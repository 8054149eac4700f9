package com.shadi.authz.claims;

/**
 * The bearer token cannot be trusted: bad signature, expired, wrong issuer or audience,
 * malformed, unknown signing key or missing subject.
 * <p>
 * Unchecked because no caller can recover; the decision point turns it into a
 * {@code TOKEN_INVALID} denial and the web layer into a 401.
 */
public class TokenInvalidException extends RuntimeException {

    public TokenInvalidException(String message) {
        super(message);
    }

    public TokenInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
