package com.shadi.authz.sync;

import com.shadi.authz.testing.InMemoryIdentityProvider;
import com.shadi.authz.testing.MutableClock;
import com.shadi.authz.testing.TestSnapshots;
import com.shadi.observability.HealthStatus;
import com.shadi.observability.MetricFactory;
import com.shadi.observability.SpanHelper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IdentityProviderHealthCheck")
class IdentityProviderHealthCheckTest {

    private MutableClock clock;
    private InMemoryIdentityProvider provider;
    private SyncOrchestrator orchestrator;
    private IdentityProviderHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-06-01T10:00:00Z"));
        provider = new InMemoryIdentityProvider().put(TestSnapshots.subject("u1").build());
        SyncSettings settings = SyncSettings.defaults();
        orchestrator = new SyncOrchestrator(
                new PermissionCache(settings.maxStaleness(), settings.maxEntries(), clock),
                provider, Runnable::run, settings,
                new MetricFactory(new SimpleMeterRegistry(), "authz-test"),
                new SpanHelper(OpenTelemetry.noop().getTracer("test")), clock);
        healthCheck = new IdentityProviderHealthCheck(orchestrator);
    }

    @Test
    @DisplayName("is healthy before any refresh")
    void healthyInitially() {
        assertThat(healthCheck.check().status()).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    @DisplayName("is degraded after a refresh found the provider unavailable, healthy again after a success")
    void tracksLastOutcome() {
        provider.goDown();
        assertThatThrownBy(() -> orchestrator.ensureFresh("u1", SyncTrigger.LOGIN))
                .isInstanceOf(StaleAndUnreachableException.class);

        assertThat(healthCheck.check().status()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(healthCheck.check().name()).isEqualTo(IdentityProviderHealthCheck.NAME);

        provider.comeBack();
        clock.advance(Duration.ofSeconds(1));
        orchestrator.ensureFresh("u1", SyncTrigger.LOGIN);

        assertThat(healthCheck.check().status()).isEqualTo(HealthStatus.HEALTHY);
    }
}
