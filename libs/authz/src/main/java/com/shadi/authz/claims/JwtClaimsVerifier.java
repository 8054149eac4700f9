package com.shadi.authz.claims;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.LocatorAdapter;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.InvalidKeyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.Key;
import java.time.Clock;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * {@link ClaimsVerifier} backed by jjwt.
 * <p>
 * Only RS256 is accepted whatever the header claims, so a token cannot pick a weaker algorithm
 * or smuggle an HMAC signature made with the public key. The signing key is located by the
 * header's {@code kid} through a {@link SigningKeySource}.
 */
public class JwtClaimsVerifier implements ClaimsVerifier {

    private static final Logger log = LoggerFactory.getLogger(JwtClaimsVerifier.class);

    static final String ALGORITHM = "RS256";

    /** Namespaced custom claims added by the platform's login rule. */
    public static final String ROLES_CLAIM = "https://shadi.com/roles";
    public static final String PERMISSIONS_CLAIM = "https://shadi.com/permissions";

    /** Standard claim filled when RBAC is enabled on the API. */
    public static final String STANDARD_PERMISSIONS_CLAIM = "permissions";

    public static final String ORGANIZATION_CLAIM = "org_id";

    private final JwtParser parser;

    public JwtClaimsVerifier(ClaimsVerifierSettings settings, SigningKeySource keySource, Clock clock) {
        if (settings == null || keySource == null || clock == null) {
            throw new IllegalArgumentException("settings, keySource and clock are required");
        }
        this.parser = Jwts.parser()
                .keyLocator(new KeyIdLocator(keySource))
                .requireIssuer(settings.issuer())
                .requireAudience(settings.audience())
                .clockSkewSeconds(settings.clockSkew().toSeconds())
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    @Override
    public VerifiedIdentity verify(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenInvalidException("token is missing");
        }
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            throw new TokenInvalidException("token verification failed: " + e.getMessage(), e);
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new TokenInvalidException("token has no subject");
        }
        if (claims.getExpiration() == null) {
            throw new TokenInvalidException("token has no expiry");
        }

        Set<String> permissions = new LinkedHashSet<>(stringSet(claims.get(PERMISSIONS_CLAIM)));
        permissions.addAll(stringSet(claims.get(STANDARD_PERMISSIONS_CLAIM)));

        return new VerifiedIdentity(
                subject,
                stringSet(claims.get(ROLES_CLAIM)),
                permissions,
                organizationHint(claims.get(ORGANIZATION_CLAIM)),
                claims.getExpiration().toInstant());
    }

    /** A hint of any other type is dropped rather than failing an otherwise valid token. */
    private static String organizationHint(Object claim) {
        if (claim instanceof String organizationId && !organizationId.isBlank()) {
            return organizationId;
        }
        if (claim != null) {
            log.debug("Ignoring {} claim of type {}", ORGANIZATION_CLAIM, claim.getClass().getSimpleName());
        }
        return null;
    }

    private static Set<String> stringSet(Object claim) {
        if (!(claim instanceof Collection<?> values)) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>();
        for (Object value : values) {
            if (value != null) {
                result.add(value.toString());
            }
        }
        return result;
    }

    private static final class KeyIdLocator extends LocatorAdapter<Key> {

        private final SigningKeySource keySource;

        KeyIdLocator(SigningKeySource keySource) {
            this.keySource = keySource;
        }

        @Override
        protected Key locate(JwsHeader header) {
            if (!ALGORITHM.equals(header.getAlgorithm())) {
                throw new UnsupportedJwtException("unsupported algorithm " + header.getAlgorithm()
                        + ", only " + ALGORITHM + " is accepted");
            }
            String keyId = header.getKeyId();
            if (keyId == null || keyId.isBlank()) {
                throw new InvalidKeyException("token header has no kid");
            }
            return keySource.signingKey(keyId)
                    .orElseThrow(() -> new InvalidKeyException("no signing key for kid " + keyId));
        }
    }
}
