package com.shadi.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that opens a span around a unit of work
 * and stamps it with the current {@link CorrelationContext}.
 * <p>
 * The helper does not configure the SDK. Exporters and samplers are set up by the hosting
 * service; with no SDK installed every span is a no-op.
 */
public final class SpanHelper {

    /**
     * Work executed inside a span. The checked exception type is preserved so callers can keep
     * their own exception contracts (e.g. identity provider failures) instead of catching
     * {@code Exception}.
     */
    @FunctionalInterface
    public interface SpanWork<T, E extends Exception> {
        T run() throws E;
    }

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside an INTERNAL span.
     */
    public <T, E extends Exception> T withSpan(String spanName, SpanWork<T, E> work) throws E {
        return withSpan(spanName, SpanKind.INTERNAL, Map.of(), work);
    }

    /**
     * Runs {@code work} inside a span of the given kind. The span is marked ERROR and the
     * exception recorded if {@code work} throws; the exception is rethrown unchanged.
     */
    public <T, E extends Exception> T withSpan(String spanName, SpanKind kind,
                                               Map<String, String> attributes,
                                               SpanWork<T, E> work) throws E {
        SpanBuilder spanBuilder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.organizationId() != null) {
                span.setAttribute("organization.id", ctx.organizationId());
            }
            if (ctx.subjectId() != null) {
                span.setAttribute("subject.id", ctx.subjectId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.run();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Void variant for work that throws no checked exceptions.
     */
    public void inSpan(String spanName, Runnable runnable) {
        withSpan(spanName, () -> {
            runnable.run();
            return null;
        });
    }
}
