package com.shadi.authzservice.infrastructure.web;

import com.shadi.authz.DecisionReason;
import com.shadi.authz.claims.TokenInvalidException;
import com.shadi.authz.sync.StaleAndUnreachableException;
import com.shadi.authzservice.api.PermissionDeniedException;
import com.shadi.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses carrying a timestamp and the
 * request's correlation id.
 *
 * <pre>
 * {
 *   "type": "https://shadi.com/errors/unauthorized",
 *   "title": "Unauthorized",
 *   "status": 401,
 *   "detail": "Bearer token is missing or invalid",
 *   "timestamp": "2026-06-01T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Details never echo token verification failures or organization membership; those are logged.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(TokenInvalidException.class)
    public ProblemDetail handleTokenInvalid(TokenInvalidException ex) {
        log.info("Unauthorized: {}", ex.getMessage());
        return problem(
                HttpStatus.UNAUTHORIZED,
                "Unauthorized",
                "unauthorized",
                "Bearer token is missing or invalid");
    }

    @ExceptionHandler(PermissionDeniedException.class)
    public ProblemDetail handlePermissionDenied(PermissionDeniedException ex) {
        if (ex.reason() == DecisionReason.STALE_AND_UNREACHABLE) {
            log.warn("Caller permissions unavailable: {}", ex.getMessage());
            return unavailable();
        }
        log.info("Forbidden ({}): {}", ex.reason(), ex.getMessage());
        return problem(
                HttpStatus.FORBIDDEN, "Forbidden", "forbidden", "Not permitted to perform this operation");
    }

    @ExceptionHandler(StaleAndUnreachableException.class)
    public ProblemDetail handleStaleAndUnreachable(StaleAndUnreachableException ex) {
        log.warn("Identity provider unreachable: {}", ex.getMessage());
        return unavailable();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(
                HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Request body is not valid JSON");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "internal",
                "An unexpected error occurred");
    }

    private ProblemDetail unavailable() {
        return problem(
                HttpStatus.SERVICE_UNAVAILABLE,
                "Service Unavailable",
                "identity-provider-unavailable",
                "Permissions cannot be loaded right now, retry later");
    }

    private ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create("https://shadi.com/errors/" + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
