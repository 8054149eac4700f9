package com.shadi.authz.claims;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.RSAPublicKeySpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Signing keys published by the identity provider at {@code https://{domain}/.well-known/jwks.json}.
 * <p>
 * The key set is cached for {@code cacheTtl} (one hour by default). A token carrying an unknown
 * {@code kid} triggers one early refresh so that key rotation is picked up, rate limited by
 * {@code minRefreshInterval} so a flood of forged kids cannot hammer the endpoint. When a refresh
 * fails the previous key set stays in use.
 */
public class JwksSigningKeySource implements SigningKeySource {

    private static final Logger log = LoggerFactory.getLogger(JwksSigningKeySource.class);

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(1);
    public static final Duration DEFAULT_MIN_REFRESH_INTERVAL = Duration.ofSeconds(30);

    private final URI jwksUri;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final Duration cacheTtl;
    private final Duration minRefreshInterval;
    private final Clock clock;
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile KeySet keySet = KeySet.EMPTY;

    public JwksSigningKeySource(URI jwksUri, HttpClient httpClient, ObjectMapper objectMapper,
                                Duration requestTimeout, Clock clock) {
        this(jwksUri, httpClient, objectMapper, requestTimeout, DEFAULT_CACHE_TTL,
                DEFAULT_MIN_REFRESH_INTERVAL, clock);
    }

    public JwksSigningKeySource(URI jwksUri, HttpClient httpClient, ObjectMapper objectMapper,
                                Duration requestTimeout, Duration cacheTtl, Duration minRefreshInterval,
                                Clock clock) {
        if (jwksUri == null || httpClient == null || objectMapper == null || clock == null) {
            throw new IllegalArgumentException("jwksUri, httpClient, objectMapper and clock are required");
        }
        this.jwksUri = jwksUri;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.cacheTtl = cacheTtl;
        this.minRefreshInterval = minRefreshInterval;
        this.clock = clock;
    }

    @Override
    public Optional<PublicKey> signingKey(String keyId) {
        KeySet current = keySet;
        Instant now = clock.instant();
        if (current.isExpired(now, cacheTtl)) {
            current = refresh(current);
        }
        PublicKey key = current.keys().get(keyId);
        if (key == null && current.mayRefreshEarly(clock.instant(), minRefreshInterval)) {
            log.info("Signing key {} not in cached JWKS, refreshing", keyId);
            current = refresh(current);
            key = current.keys().get(keyId);
        }
        return Optional.ofNullable(key);
    }

    /** Number of keys currently cached. */
    public int cachedKeyCount() {
        return keySet.keys().size();
    }

    /**
     * Refreshes unless another thread already replaced {@code seen} while this one waited for the
     * lock. Returns whichever key set is current afterwards.
     */
    private KeySet refresh(KeySet seen) {
        refreshLock.lock();
        try {
            if (keySet != seen) {
                return keySet;
            }
            Instant attemptedAt = clock.instant();
            try {
                keySet = new KeySet(fetchKeys(), attemptedAt, attemptedAt);
                log.debug("Loaded {} signing keys from {}", keySet.keys().size(), jwksUri);
            } catch (IOException e) {
                log.warn("JWKS refresh from {} failed, keeping {} cached keys: {}",
                        jwksUri, seen.keys().size(), e.getMessage());
                keySet = new KeySet(seen.keys(), seen.fetchedAt(), attemptedAt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while refreshing JWKS from {}", jwksUri);
            }
            return keySet;
        } finally {
            refreshLock.unlock();
        }
    }

    private Map<String, PublicKey> fetchKeys() throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(jwksUri)
                .GET()
                .header("Accept", "application/json")
                .timeout(requestTimeout)
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("JWKS endpoint returned HTTP " + response.statusCode());
        }

        JsonNode keys = objectMapper.readTree(response.body()).path("keys");
        if (!keys.isArray()) {
            throw new IOException("JWKS document has no 'keys' array");
        }

        Map<String, PublicKey> parsed = new HashMap<>();
        for (JsonNode jwk : keys) {
            String kid = jwk.path("kid").asText(null);
            if (kid == null || !"RSA".equals(jwk.path("kty").asText(null))) {
                continue;
            }
            String use = jwk.path("use").asText(null);
            String alg = jwk.path("alg").asText(null);
            if ((use != null && !"sig".equals(use)) || (alg != null && !JwtClaimsVerifier.ALGORITHM.equals(alg))) {
                log.debug("Skipping JWK {} (use={}, alg={})", kid, use, alg);
                continue;
            }
            try {
                parsed.put(kid, rsaPublicKey(jwk));
            } catch (GeneralSecurityException | IllegalArgumentException e) {
                log.warn("Skipping unparseable JWK {}: {}", kid, e.getMessage());
            }
        }
        return Map.copyOf(parsed);
    }

    private static PublicKey rsaPublicKey(JsonNode jwk) throws GeneralSecurityException {
        String n = jwk.path("n").asText(null);
        String e = jwk.path("e").asText(null);
        if (n == null || e == null) {
            throw new IllegalArgumentException("RSA key without modulus or exponent");
        }
        BigInteger modulus = new BigInteger(1, Base64.getUrlDecoder().decode(n));
        BigInteger exponent = new BigInteger(1, Base64.getUrlDecoder().decode(e));
        return KeyFactory.getInstance("RSA").generatePublic(new RSAPublicKeySpec(modulus, exponent));
    }

    /**
     * @param fetchedAt   when {@code keys} were last loaded successfully, null if never
     * @param attemptedAt when a refresh was last attempted, null if never
     */
    private record KeySet(Map<String, PublicKey> keys, Instant fetchedAt, Instant attemptedAt) {

        static final KeySet EMPTY = new KeySet(Map.of(), null, null);

        boolean isExpired(Instant now, Duration ttl) {
            Instant reference = attemptedAt != null ? attemptedAt : fetchedAt;
            return reference == null || !now.isBefore(reference.plus(ttl));
        }

        boolean mayRefreshEarly(Instant now, Duration minInterval) {
            return attemptedAt == null || !now.isBefore(attemptedAt.plus(minInterval));
        }
    }
}
