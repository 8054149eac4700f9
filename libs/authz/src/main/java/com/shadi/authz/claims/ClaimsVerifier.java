package com.shadi.authz.claims;

/**
 * Verifies a raw bearer token and extracts the caller's identity. Performs no permission lookups.
 */
public interface ClaimsVerifier {

    /**
     * @throws TokenInvalidException if the token cannot be trusted for any reason
     */
    VerifiedIdentity verify(String token);
}
