package com.shadi.authz.claims;

import java.time.Duration;

/**
 * @param issuer    required {@code iss}, e.g. {@code https://shadi.eu.auth0.com/}
 * @param audience  required {@code aud}, the API identifier
 * @param clockSkew tolerance applied to {@code exp} and {@code nbf}
 */
public record ClaimsVerifierSettings(String issuer, String audience, Duration clockSkew) {

    public static final Duration DEFAULT_CLOCK_SKEW = Duration.ofSeconds(30);

    public ClaimsVerifierSettings {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be null or blank");
        }
        if (audience == null || audience.isBlank()) {
            throw new IllegalArgumentException("audience must not be null or blank");
        }
        if (clockSkew == null) {
            clockSkew = DEFAULT_CLOCK_SKEW;
        }
        if (clockSkew.isNegative()) {
            throw new IllegalArgumentException("clockSkew must not be negative");
        }
    }
}
