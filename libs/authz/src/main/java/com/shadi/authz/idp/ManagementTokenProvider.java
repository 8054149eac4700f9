package com.shadi.authz.idp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Machine-to-machine access token for the management API, obtained with the OAuth2
 * {@code client_credentials} grant and reused until shortly before it expires.
 */
public class ManagementTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(ManagementTokenProvider.class);

    /** A token this close to expiry is replaced rather than used. */
    static final Duration EXPIRY_MARGIN = Duration.ofSeconds(30);

    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final ManagementApiSettings settings;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private String accessToken;
    private Instant expiresAt;

    public ManagementTokenProvider(ManagementApiSettings settings, HttpClient httpClient,
                                   ObjectMapper objectMapper, Clock clock) {
        this.settings = settings;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Returns a usable token, requesting a new one when none is cached or the cached one is
     * about to expire.
     *
     * @throws IOException if the token endpoint cannot be reached or refuses the credentials
     */
    public String currentToken() throws IOException, InterruptedException {
        lock.lock();
        try {
            if (accessToken != null && clock.instant().plus(EXPIRY_MARGIN).isBefore(expiresAt)) {
                return accessToken;
            }
            return requestToken();
        } finally {
            lock.unlock();
        }
    }

    /** Drops the cached token, e.g. after the management API answered 401. */
    public void invalidate() {
        lock.lock();
        try {
            accessToken = null;
            expiresAt = null;
        } finally {
            lock.unlock();
        }
    }

    private String requestToken() throws IOException, InterruptedException {
        String body = objectMapper.writeValueAsString(Map.of(
                "grant_type", "client_credentials",
                "client_id", settings.clientId(),
                "client_secret", settings.clientSecret(),
                "audience", settings.audience()));

        HttpRequest request = HttpRequest.newBuilder(settings.tokenUri())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .timeout(settings.requestTimeout())
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("token endpoint returned HTTP " + response.statusCode());
        }

        JsonNode json = objectMapper.readTree(response.body());
        String token = json.path("access_token").asText(null);
        if (token == null || token.isBlank()) {
            throw new IOException("token endpoint response has no access_token");
        }
        long expiresIn = json.path("expires_in").asLong(DEFAULT_EXPIRES_IN_SECONDS);

        accessToken = token;
        expiresAt = clock.instant().plusSeconds(expiresIn);
        log.debug("Obtained management API token valid for {}s", expiresIn);
        return token;
    }
}
