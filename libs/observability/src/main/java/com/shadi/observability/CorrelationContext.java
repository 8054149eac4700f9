package com.shadi.observability;

/**
 * Immutable correlation context that follows a request through the authorization engine.
 * <p>
 * The web layer opens a context per request; once the bearer token has been verified the
 * authorization service enriches it with the subject (and the organization hint carried by the
 * token) so every log line about a decision or a permission sync can be traced back to who asked.
 *
 * @param correlationId  unique ID for the business flow, propagated from {@code X-Correlation-ID}
 * @param organizationId organization (vendor tenant) the request is acting in, if known
 * @param subjectId      identity provider subject id of the caller (nullable before verification)
 * @param requestId      unique ID for this specific request
 * @param spanId         current OpenTelemetry span ID (nullable if tracing is not active)
 * @param traceId        current OpenTelemetry trace ID (nullable if tracing is not active)
 */
public record CorrelationContext(
        String correlationId,
        String organizationId,
        String subjectId,
        String requestId,
        String spanId,
        String traceId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for organization ID. */
    public static final String MDC_ORGANIZATION_ID = "organizationId";

    /** MDC key for subject ID. */
    public static final String MDC_SUBJECT_ID = "subjectId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for span ID. */
    public static final String MDC_SPAN_ID = "spanId";

    /** MDC key for trace ID. */
    public static final String MDC_TRACE_ID = "traceId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Opens a context carrying only a correlation id, as the HTTP filter does before the caller
     * is known.
     */
    public static CorrelationContext forRequest(String correlationId, String requestId) {
        return new CorrelationContext(correlationId, null, null, requestId, null, null);
    }

    /**
     * Returns a copy bound to the verified subject. A null organization keeps the current one.
     */
    public CorrelationContext withSubject(String subjectId, String organizationId) {
        return new CorrelationContext(
                correlationId,
                organizationId != null ? organizationId : this.organizationId,
                subjectId,
                requestId,
                spanId,
                traceId);
    }
}
