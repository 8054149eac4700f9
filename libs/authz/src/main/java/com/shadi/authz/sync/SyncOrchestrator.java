package com.shadi.authz.sync;

import com.shadi.authz.SubjectSnapshot;
import com.shadi.authz.idp.IdentityProviderClient;
import com.shadi.authz.idp.IdentityProviderException;
import com.shadi.authz.idp.ProviderRejectedException;
import com.shadi.authz.idp.ProviderUnavailableException;
import com.shadi.observability.CorrelationContext;
import com.shadi.observability.CorrelationContextHolder;
import com.shadi.observability.MetricFactory;
import com.shadi.observability.SpanHelper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.SpanKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the {@link PermissionCache} current and is the only component that writes to it.
 * <p>
 * At most one refresh per subject is in flight at any time: concurrent callers for the same
 * subject attach to the running refresh instead of calling the identity provider again, while
 * refreshes for different subjects run in parallel on the refresh executor. There is no global
 * lock.
 * <p>
 * A refresh writes the cache before its waiters are released, so anyone reading after a
 * completed refresh sees the new entry. A caller that gives up waiting (see
 * {@link SyncSettings#waitTimeout()}) is answered from the cache as if the provider were
 * unavailable; the refresh itself is never cancelled and still populates the cache.
 */
public class SyncOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final PermissionCache cache;
    private final IdentityProviderClient identityProvider;
    private final Executor refreshExecutor;
    private final SyncSettings settings;
    private final SpanHelper spanHelper;
    private final Clock clock;

    private final ConcurrentHashMap<String, CompletableFuture<RefreshOutcome>> inFlight = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> lastProviderSuccess = new AtomicReference<>();
    private final AtomicReference<Instant> lastProviderFailure = new AtomicReference<>();

    private final Counter fetchSuccess;
    private final Counter fetchRejected;
    private final Counter fetchUnavailable;
    private final Counter coalesced;
    private final Counter abandoned;
    private final Timer fetchTimer;

    public SyncOrchestrator(PermissionCache cache, IdentityProviderClient identityProvider,
                            Executor refreshExecutor, SyncSettings settings,
                            MetricFactory metrics, SpanHelper spanHelper, Clock clock) {
        this.cache = cache;
        this.identityProvider = identityProvider;
        this.refreshExecutor = refreshExecutor;
        this.settings = settings;
        this.spanHelper = spanHelper;
        this.clock = clock;

        this.fetchSuccess = metrics.counter("authz.sync.fetches", "Identity provider fetches", "outcome", "success");
        this.fetchRejected = metrics.counter("authz.sync.fetches", "Identity provider fetches", "outcome", "rejected");
        this.fetchUnavailable = metrics.counter("authz.sync.fetches", "Identity provider fetches", "outcome", "unavailable");
        this.coalesced = metrics.counter("authz.sync.coalesced", "Callers that joined an in-flight refresh");
        this.abandoned = metrics.counter("authz.sync.abandoned", "Waits that timed out before the refresh finished");
        this.fetchTimer = metrics.timer("authz.sync.fetch.duration", "Identity provider fetch latency");
        metrics.gauge("authz.cache.entries", "Subjects with cached permissions", cache::size);
    }

    /**
     * Returns a snapshot for {@code subjectId} that is fresh, or explicitly degraded, or revoked.
     *
     * @throws StaleAndUnreachableException when no fresh data could be obtained and nothing is cached
     */
    public SyncResult ensureFresh(String subjectId, SyncTrigger trigger) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be null or blank");
        }
        if (trigger == null) {
            throw new IllegalArgumentException("trigger must not be null");
        }

        if (trigger == SyncTrigger.STALE) {
            Optional<CacheEntry> cached = cache.get(subjectId);
            if (cached.isPresent() && cached.get().isFresh(clock.instant())) {
                return SyncResult.fresh(cached.get());
            }
        } else if (trigger == SyncTrigger.FORCE_SYNC) {
            cache.invalidate(subjectId);
            log.info("Forced permission resync for subject {}", subjectId);
        }

        return await(subjectId, joinOrStart(subjectId, trigger.name(), trigger == SyncTrigger.STALE));
    }

    /**
     * Starts (or joins) a refresh without waiting for it, as the background sweep does for entries
     * about to go stale.
     */
    public CompletableFuture<SyncResult.Status> refreshInBackground(String subjectId) {
        return joinOrStart(subjectId, "SWEEP", false).thenApply(RefreshOutcome::status);
    }

    /** Drops the subject's cached permissions, e.g. on logout. */
    public void invalidate(String subjectId) {
        cache.invalidate(subjectId);
        log.debug("Invalidated cached permissions for subject {}", subjectId);
    }

    /** Cached entry without any refresh, for diagnostics. */
    public Optional<CacheEntry> peek(String subjectId) {
        return cache.get(subjectId);
    }

    /** When the identity provider last answered (success or rejection), null if never. */
    public Instant lastProviderSuccess() {
        return lastProviderSuccess.get();
    }

    /** When a refresh last found the identity provider unavailable, null if never. */
    public Instant lastProviderFailure() {
        return lastProviderFailure.get();
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private CompletableFuture<RefreshOutcome> joinOrStart(String subjectId, String reason, boolean skipIfFresh) {
        CompletableFuture<RefreshOutcome> created = new CompletableFuture<>();
        CompletableFuture<RefreshOutcome> existing = inFlight.putIfAbsent(subjectId, created);
        if (existing != null) {
            coalesced.increment();
            log.debug("Joining in-flight refresh for subject {}", subjectId);
            return existing;
        }

        CorrelationContext callerContext = CorrelationContextHolder.get().orElse(null);
        try {
            refreshExecutor.execute(() -> {
                if (callerContext != null) {
                    CorrelationContextHolder.runWithContext(callerContext,
                            () -> runRefresh(subjectId, reason, skipIfFresh, created));
                } else {
                    runRefresh(subjectId, reason, skipIfFresh, created);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Refresh executor rejected refresh for subject {}", subjectId, e);
            inFlight.remove(subjectId, created);
            created.complete(RefreshOutcome.unavailable(
                    new ProviderUnavailableException(subjectId, "refresh executor saturated", e)));
        }
        return created;
    }

    private void runRefresh(String subjectId, String reason, boolean skipIfFresh,
                            CompletableFuture<RefreshOutcome> future) {
        try {
            future.complete(refresh(subjectId, reason, skipIfFresh));
        } catch (RuntimeException e) {
            log.error("Permission refresh for subject {} failed unexpectedly", subjectId, e);
            future.complete(RefreshOutcome.unavailable(
                    new ProviderUnavailableException(subjectId, "refresh failed: " + e.getMessage(), e)));
        } finally {
            inFlight.remove(subjectId, future);
        }
    }

    private RefreshOutcome refresh(String subjectId, String reason, boolean skipIfFresh) {
        if (skipIfFresh) {
            // another refresh may have finished between the caller's cache check and now
            Optional<CacheEntry> cached = cache.get(subjectId);
            if (cached.isPresent() && cached.get().isFresh(clock.instant())) {
                return RefreshOutcome.fresh(cached.get());
            }
        }

        Timer.Sample sample = Timer.start();
        try {
            SubjectSnapshot snapshot = spanHelper.withSpan("authz.sync.refresh", SpanKind.CLIENT,
                    Map.of("sync.trigger", reason), () -> identityProvider.fetch(subjectId));
            CacheEntry entry = cache.put(subjectId, snapshot, settings.ttl());
            fetchSuccess.increment();
            lastProviderSuccess.set(clock.instant());
            log.debug("Refreshed permissions for subject {} ({}): {} memberships",
                    subjectId, reason, snapshot.memberships().size());
            return RefreshOutcome.fresh(entry);
        } catch (ProviderRejectedException e) {
            cache.invalidate(subjectId);
            fetchRejected.increment();
            lastProviderSuccess.set(clock.instant());
            log.warn("Identity provider rejected subject {}, revoking cached permissions: {}",
                    subjectId, e.getMessage());
            return RefreshOutcome.rejected();
        } catch (IdentityProviderException e) {
            fetchUnavailable.increment();
            lastProviderFailure.set(clock.instant());
            log.warn("Identity provider unavailable while refreshing subject {}: {}", subjectId, e.getMessage());
            return RefreshOutcome.unavailable(e);
        } finally {
            sample.stop(fetchTimer);
        }
    }

    private SyncResult await(String subjectId, CompletableFuture<RefreshOutcome> refresh) {
        RefreshOutcome outcome;
        try {
            outcome = refresh.get(settings.waitTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandoned.increment();
            log.warn("Gave up waiting {} for permission refresh of subject {}", settings.waitTimeout(), subjectId);
            return fallBack(subjectId, "refresh did not finish within " + settings.waitTimeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fallBack(subjectId, "interrupted while waiting for refresh", e);
        } catch (ExecutionException e) {
            // refresh futures are only ever completed normally
            return fallBack(subjectId, "refresh failed", e.getCause());
        }

        return switch (outcome.status()) {
            case FRESH -> SyncResult.fresh(outcome.entry());
            case REJECTED -> SyncResult.rejected(subjectId);
            case DEGRADED -> fallBack(subjectId, outcome.failure().getMessage(), outcome.failure());
        };
    }

    private SyncResult fallBack(String subjectId, String reason, Throwable cause) {
        Optional<CacheEntry> cached = cache.get(subjectId);
        if (cached.isEmpty()) {
            throw new StaleAndUnreachableException(subjectId, reason, cause);
        }
        CacheEntry entry = cached.get();
        if (entry.isFresh(clock.instant())) {
            return SyncResult.fresh(entry);
        }
        log.info("Serving degraded permissions for subject {} fetched {} ago ({})",
                subjectId, entry.age(clock.instant()), reason);
        return SyncResult.degraded(entry);
    }

    /**
     * What a single refresh produced. {@code DEGRADED} here means the provider was unavailable;
     * whether a stale entry can stand in is decided per waiter.
     */
    private record RefreshOutcome(SyncResult.Status status, CacheEntry entry, IdentityProviderException failure) {

        static RefreshOutcome fresh(CacheEntry entry) {
            return new RefreshOutcome(SyncResult.Status.FRESH, entry, null);
        }

        static RefreshOutcome rejected() {
            return new RefreshOutcome(SyncResult.Status.REJECTED, null, null);
        }

        static RefreshOutcome unavailable(IdentityProviderException failure) {
            return new RefreshOutcome(SyncResult.Status.DEGRADED, null, failure);
        }
    }
}
