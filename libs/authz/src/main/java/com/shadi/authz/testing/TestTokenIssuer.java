package com.shadi.authz.testing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadi.authz.claims.ClaimsVerifierSettings;
import com.shadi.authz.claims.JwtClaimsVerifier;
import com.shadi.authz.claims.SigningKeySource;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;

import java.math.BigInteger;
import java.security.KeyPair;
import java.security.PublicKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Issues RS256 tokens the way the identity provider would, and doubles as the
 * {@link SigningKeySource} that verifies them.
 * <pre>{@code
 * TestTokenIssuer issuer = new TestTokenIssuer(clock);
 * String token = issuer.token("u1").permissions("read:events").sign();
 * }</pre>
 */
public final class TestTokenIssuer implements SigningKeySource {

    public static final String DEFAULT_ISSUER = "https://shadi-test.auth0.local/";
    public static final String DEFAULT_AUDIENCE = "https://api.shadi.test";
    public static final String KEY_ID = "test-signing-key";

    private final KeyPair keyPair = Jwts.SIG.RS256.keyPair().build();
    private final String issuer;
    private final String audience;
    private final Clock clock;

    public TestTokenIssuer(Clock clock) {
        this(DEFAULT_ISSUER, DEFAULT_AUDIENCE, clock);
    }

    public TestTokenIssuer(String issuer, String audience, Clock clock) {
        this.issuer = issuer;
        this.audience = audience;
        this.clock = clock;
    }

    /** Verifier settings that accept this issuer's tokens. */
    public ClaimsVerifierSettings verifierSettings() {
        return new ClaimsVerifierSettings(issuer, audience, Duration.ZERO);
    }

    public PublicKey publicKey() {
        return keyPair.getPublic();
    }

    @Override
    public Optional<PublicKey> signingKey(String keyId) {
        return KEY_ID.equals(keyId) ? Optional.of(keyPair.getPublic()) : Optional.empty();
    }

    /** A JWKS document publishing this issuer's key. */
    public String jwksJson() {
        RSAPublicKey key = (RSAPublicKey) keyPair.getPublic();
        Map<String, Object> jwk = new LinkedHashMap<>();
        jwk.put("kty", "RSA");
        jwk.put("use", "sig");
        jwk.put("alg", "RS256");
        jwk.put("kid", KEY_ID);
        jwk.put("n", base64Url(key.getModulus()));
        jwk.put("e", base64Url(key.getPublicExponent()));
        try {
            return new ObjectMapper().writeValueAsString(Map.of("keys", List.of(jwk)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot render JWKS", e);
        }
    }

    public TokenBuilder token(String subject) {
        return new TokenBuilder(subject);
    }

    private static String base64Url(BigInteger value) {
        byte[] bytes = value.toByteArray();
        if (bytes.length > 1 && bytes[0] == 0) {
            bytes = Arrays.copyOfRange(bytes, 1, bytes.length);
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Token under construction. Defaults: valid for 10 minutes, this issuer and audience, signed
     * RS256 with {@link #KEY_ID}.
     */
    public final class TokenBuilder {

        private String subject;
        private String tokenIssuer = issuer;
        private String tokenAudience = audience;
        private String keyId = KEY_ID;
        private Duration expiresIn = Duration.ofMinutes(10);
        private boolean hmacSigned;
        private boolean foreignKey;
        private final Map<String, Object> claims = new LinkedHashMap<>();

        private TokenBuilder(String subject) {
            this.subject = subject;
        }

        public TokenBuilder permissions(String... permissions) {
            claims.put(JwtClaimsVerifier.PERMISSIONS_CLAIM, List.of(permissions));
            return this;
        }

        public TokenBuilder roles(String... roles) {
            claims.put(JwtClaimsVerifier.ROLES_CLAIM, List.of(roles));
            return this;
        }

        public TokenBuilder organization(String organizationId) {
            claims.put(JwtClaimsVerifier.ORGANIZATION_CLAIM, organizationId);
            return this;
        }

        public TokenBuilder claim(String name, Object value) {
            claims.put(name, value);
            return this;
        }

        public TokenBuilder issuer(String tokenIssuer) {
            this.tokenIssuer = tokenIssuer;
            return this;
        }

        public TokenBuilder audience(String tokenAudience) {
            this.tokenAudience = tokenAudience;
            return this;
        }

        public TokenBuilder keyId(String keyId) {
            this.keyId = keyId;
            return this;
        }

        /** Negative values produce a token that has already expired. */
        public TokenBuilder expiresIn(Duration expiresIn) {
            this.expiresIn = expiresIn;
            return this;
        }

        public TokenBuilder withoutSubject() {
            this.subject = null;
            return this;
        }

        /** Signs HS256 with a random secret instead of RS256. */
        public TokenBuilder hmacSigned() {
            this.hmacSigned = true;
            return this;
        }

        /** Signs RS256 with a key pair nobody publishes. */
        public TokenBuilder signedWithForeignKey() {
            this.foreignKey = true;
            return this;
        }

        public String sign() {
            Instant now = clock.instant();
            JwtBuilder builder = Jwts.builder()
                    .header().keyId(keyId).and()
                    .issuer(tokenIssuer)
                    .audience().add(tokenAudience).and()
                    .issuedAt(Date.from(now))
                    .expiration(Date.from(now.plus(expiresIn)))
                    .claims(claims);
            if (subject != null) {
                builder.subject(subject);
            }
            if (hmacSigned) {
                return builder.signWith(Jwts.SIG.HS256.key().build(), Jwts.SIG.HS256).compact();
            }
            KeyPair signingPair = foreignKey ? Jwts.SIG.RS256.keyPair().build() : keyPair;
            return builder.signWith(signingPair.getPrivate(), Jwts.SIG.RS256).compact();
        }
    }
}
