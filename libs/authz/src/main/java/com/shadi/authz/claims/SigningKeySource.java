package com.shadi.authz.claims;

import java.security.PublicKey;
import java.util.Optional;

/**
 * Supplies the public keys that token signatures are checked against, looked up by key id.
 */
@FunctionalInterface
public interface SigningKeySource {

    /**
     * @return the RS256 verification key for {@code keyId}, or empty if none is known
     */
    Optional<PublicKey> signingKey(String keyId);
}
