package com.shadi.authz.claims;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.shadi.authz.testing.MutableClock;
import com.shadi.authz.testing.TestTokenIssuer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JwksSigningKeySource")
class JwksSigningKeySourceTest {

    private static final String JWKS_PATH = "/.well-known/jwks.json";

    private WireMockServer server;
    private MutableClock clock;
    private TestTokenIssuer issuer;
    private JwksSigningKeySource keySource;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(wireMockConfig().dynamicPort());
        server.start();
        clock = new MutableClock(Instant.parse("2026-06-01T10:00:00Z"));
        issuer = new TestTokenIssuer(clock);
        keySource = new JwksSigningKeySource(
                URI.create(server.baseUrl() + JWKS_PATH),
                HttpClient.newHttpClient(),
                new ObjectMapper(),
                Duration.ofSeconds(2),
                Duration.ofHours(1),
                Duration.ofSeconds(30),
                clock);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("loads keys once and serves later lookups from cache")
    void cachesKeySet() {
        server.stubFor(get(urlEqualTo(JWKS_PATH)).willReturn(okJson(issuer.jwksJson())));

        assertThat(keySource.signingKey(TestTokenIssuer.KEY_ID)).contains(issuer.publicKey());
        assertThat(keySource.signingKey(TestTokenIssuer.KEY_ID)).contains(issuer.publicKey());

        server.verify(1, getRequestedFor(urlEqualTo(JWKS_PATH)));
        assertThat(keySource.cachedKeyCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("refetches after the cache TTL")
    void refetchesAfterTtl() {
        server.stubFor(get(urlEqualTo(JWKS_PATH)).willReturn(okJson(issuer.jwksJson())));
        keySource.signingKey(TestTokenIssuer.KEY_ID);

        clock.advance(Duration.ofMinutes(61));
        keySource.signingKey(TestTokenIssuer.KEY_ID);

        server.verify(2, getRequestedFor(urlEqualTo(JWKS_PATH)));
    }

    @Test
    @DisplayName("refreshes early for an unknown kid, at most once per interval")
    void unknownKidRefreshIsRateLimited() {
        server.stubFor(get(urlEqualTo(JWKS_PATH)).willReturn(okJson(issuer.jwksJson())));
        keySource.signingKey(TestTokenIssuer.KEY_ID);

        clock.advance(Duration.ofSeconds(31));
        assertThat(keySource.signingKey("rotated-in")).isEmpty();
        assertThat(keySource.signingKey("rotated-in")).isEmpty();

        server.verify(2, getRequestedFor(urlEqualTo(JWKS_PATH)));
    }

    @Test
    @DisplayName("keeps the previous keys when a refresh fails")
    void keepsKeysOnFailure() {
        server.stubFor(get(urlEqualTo(JWKS_PATH)).willReturn(okJson(issuer.jwksJson())));
        keySource.signingKey(TestTokenIssuer.KEY_ID);

        server.stubFor(get(urlEqualTo(JWKS_PATH)).willReturn(aResponse().withStatus(503)));
        clock.advance(Duration.ofMinutes(61));

        assertThat(keySource.signingKey(TestTokenIssuer.KEY_ID)).contains(issuer.publicKey());
    }

    @Test
    @DisplayName("knows no keys when the endpoint was never reachable")
    void unreachableFromStart() {
        server.stubFor(get(urlEqualTo(JWKS_PATH)).willReturn(aResponse().withStatus(500)));

        assertThat(keySource.signingKey(TestTokenIssuer.KEY_ID)).isEmpty();
    }

    @Test
    @DisplayName("skips keys that are not RSA signing keys")
    void skipsNonSigningKeys() {
        server.stubFor(get(urlEqualTo(JWKS_PATH)).willReturn(okJson("""
                {"keys":[
                  {"kty":"EC","kid":"ec-key","crv":"P-256","x":"AA","y":"AA"},
                  {"kty":"RSA","kid":"enc-key","use":"enc","n":"AQAB","e":"AQAB"}
                ]}""")));

        assertThat(keySource.signingKey("ec-key")).isEmpty();
        assertThat(keySource.signingKey("enc-key")).isEmpty();
        assertThat(keySource.cachedKeyCount()).isZero();
    }

    @Test
    @DisplayName("backs the verifier end to end")
    void backsVerifier() {
        server.stubFor(get(urlEqualTo(JWKS_PATH)).willReturn(okJson(issuer.jwksJson())));
        JwtClaimsVerifier verifier = new JwtClaimsVerifier(issuer.verifierSettings(), keySource, clock);

        assertThat(verifier.verify(issuer.token("u1").sign()).subjectId()).isEqualTo("u1");
    }
}
