package com.shadi.authzservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadi.authz.AuthorizationService;
import com.shadi.authz.AuthorizationSettings;
import com.shadi.authz.claims.ClaimsVerifier;
import com.shadi.authz.claims.ClaimsVerifierSettings;
import com.shadi.authz.claims.JwksSigningKeySource;
import com.shadi.authz.claims.JwtClaimsVerifier;
import com.shadi.authz.claims.SigningKeySource;
import com.shadi.authz.idp.IdentityProviderClient;
import com.shadi.authz.idp.ManagementApiClient;
import com.shadi.authz.idp.ManagementApiSettings;
import com.shadi.authz.idp.ManagementTokenProvider;
import com.shadi.authz.scope.ResourceDirectory;
import com.shadi.authz.scope.ScopeResolver;
import com.shadi.authz.sync.IdentityProviderHealthCheck;
import com.shadi.authz.sync.PermissionCache;
import com.shadi.authz.sync.RefreshSweeper;
import com.shadi.authz.sync.SyncOrchestrator;
import com.shadi.authz.sync.SyncSettings;
import com.shadi.authzservice.infrastructure.persistence.JdbcResourceDirectory;
import com.shadi.observability.HealthCheckRegistry;
import com.shadi.observability.MetricFactory;
import com.shadi.observability.SpanHelper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Wires the authorization engine from {@link AuthzProperties}.
 *
 * <p>Tests replace {@link SigningKeySource} and {@link IdentityProviderClient} with {@code
 * @Primary} fakes; every other bean is the production one.
 */
@Configuration
public class AuthzEngineConfig {

    private static final int REFRESH_QUEUE_CAPACITY = 10_000;

    @Bean
    public Clock authzClock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(
            MeterRegistry meterRegistry,
            @Value("${spring.application.name:authz-service}") String serviceName) {
        return new MetricFactory(meterRegistry, serviceName);
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer("com.shadi.authz"));
    }

    @Bean
    public HttpClient identityProviderHttpClient(ManagementApiSettings managementApiSettings) {
        return ManagementApiClient.defaultHttpClient(managementApiSettings);
    }

    @Bean
    public SigningKeySource jwksSigningKeySource(
            AuthzProperties properties,
            HttpClient identityProviderHttpClient,
            ObjectMapper objectMapper,
            Clock authzClock) {
        AuthzProperties.IdentityProvider idp = properties.identityProvider();
        return new JwksSigningKeySource(
                URI.create(idp.jwksUri()),
                identityProviderHttpClient,
                objectMapper,
                idp.requestTimeout(),
                authzClock);
    }

    @Bean
    public ClaimsVerifier claimsVerifier(
            AuthzProperties properties, SigningKeySource signingKeySource, Clock authzClock) {
        AuthzProperties.IdentityProvider idp = properties.identityProvider();
        return new JwtClaimsVerifier(
                new ClaimsVerifierSettings(idp.issuer(), idp.audience(), idp.clockSkew()),
                signingKeySource,
                authzClock);
    }

    @Bean
    public ManagementApiSettings managementApiSettings(AuthzProperties properties) {
        AuthzProperties.IdentityProvider idp = properties.identityProvider();
        return new ManagementApiSettings(
                URI.create(idp.managementUrl()),
                idp.clientId(),
                idp.clientSecret(),
                null,
                idp.requestTimeout(),
                idp.connectTimeout());
    }

    @Bean
    public IdentityProviderClient managementApiClient(
            ManagementApiSettings settings,
            HttpClient identityProviderHttpClient,
            ObjectMapper objectMapper,
            Clock authzClock) {
        ManagementTokenProvider tokens =
                new ManagementTokenProvider(
                        settings, identityProviderHttpClient, objectMapper, authzClock);
        return new ManagementApiClient(settings, tokens, identityProviderHttpClient, objectMapper);
    }

    @Bean
    public ResourceDirectory resourceDirectory(
            JdbcTemplate jdbcTemplate, AuthzProperties properties) {
        return new JdbcResourceDirectory(jdbcTemplate, properties.resourceStore());
    }

    @Bean
    public SyncSettings syncSettings(AuthzProperties properties) {
        AuthzProperties.Sync sync = properties.sync();
        return new SyncSettings(
                sync.ttl(), sync.maxStaleness(), sync.waitTimeout(), sync.maxEntries());
    }

    @Bean
    public PermissionCache permissionCache(SyncSettings syncSettings, Clock authzClock) {
        return new PermissionCache(
                syncSettings.maxStaleness(), syncSettings.maxEntries(), authzClock);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService permissionRefreshExecutor(AuthzProperties properties) {
        int threads = properties.sync().refreshThreads();
        return new ThreadPoolExecutor(
                threads,
                threads,
                60,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(REFRESH_QUEUE_CAPACITY),
                namedThreads("permission-refresh-"));
    }

    @Bean
    public SyncOrchestrator syncOrchestrator(
            PermissionCache permissionCache,
            IdentityProviderClient identityProviderClient,
            ExecutorService permissionRefreshExecutor,
            SyncSettings syncSettings,
            MetricFactory metricFactory,
            SpanHelper spanHelper,
            Clock authzClock) {
        return new SyncOrchestrator(
                permissionCache,
                identityProviderClient,
                permissionRefreshExecutor,
                syncSettings,
                metricFactory,
                spanHelper,
                authzClock);
    }

    @Bean(destroyMethod = "shutdownNow")
    @ConditionalOnProperty(prefix = "shadi.authz.sync", name = "sweep-enabled", havingValue = "true")
    public ScheduledExecutorService permissionSweepScheduler() {
        return Executors.newSingleThreadScheduledExecutor(namedThreads("permission-sweep-"));
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnProperty(prefix = "shadi.authz.sync", name = "sweep-enabled", havingValue = "true")
    public RefreshSweeper refreshSweeper(
            SyncOrchestrator syncOrchestrator,
            PermissionCache permissionCache,
            ScheduledExecutorService permissionSweepScheduler,
            AuthzProperties properties,
            Clock authzClock) {
        AuthzProperties.Sync sync = properties.sync();
        return new RefreshSweeper(
                syncOrchestrator,
                permissionCache,
                permissionSweepScheduler,
                sync.sweepInterval(),
                sync.sweepLead(),
                authzClock);
    }

    @Bean
    public ScopeResolver scopeResolver() {
        return new ScopeResolver();
    }

    @Bean
    public AuthorizationService authorizationService(
            ClaimsVerifier claimsVerifier,
            ResourceDirectory resourceDirectory,
            SyncOrchestrator syncOrchestrator,
            ScopeResolver scopeResolver,
            AuthzProperties properties,
            MetricFactory metricFactory) {
        return new AuthorizationService(
                claimsVerifier,
                resourceDirectory,
                syncOrchestrator,
                scopeResolver,
                new AuthorizationSettings(properties.highRiskActions()),
                metricFactory);
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry(SyncOrchestrator syncOrchestrator, Clock authzClock) {
        HealthCheckRegistry registry = new HealthCheckRegistry(authzClock);
        registry.register(
                IdentityProviderHealthCheck.NAME, new IdentityProviderHealthCheck(syncOrchestrator));
        return registry;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
