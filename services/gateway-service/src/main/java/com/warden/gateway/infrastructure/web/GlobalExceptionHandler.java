package com.warden.gateway.infrastructure.web;

import com.warden.gate.AccessDeniedException;
import com.warden.gate.ToolExecutionException;
import com.warden.observability.CorrelationContextHolder;
import com.warden.security.AuthenticationException;
import com.warden.security.credential.CredentialNotFoundException;
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
 * Maps gate and request failures to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://warden.dev/errors/unauthorized",
 *   "title": "Unauthorized",
 *   "status": 401,
 *   "detail": "authentication failed",
 *   "timestamp": "2026-03-01T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <table>
 *   <caption>Status mapping</caption>
 *   <tr><th>Exception</th><th>Status</th><th>Detail</th></tr>
 *   <tr><td>{@link AuthenticationException}</td><td>401</td><td>always "authentication failed"</td></tr>
 *   <tr><td>{@link AccessDeniedException}</td><td>403</td><td>permission and namespace</td></tr>
 *   <tr><td>{@link ToolExecutionException}</td><td>502</td><td>executor message</td></tr>
 *   <tr><td>{@link CredentialNotFoundException}</td><td>404</td><td>key id</td></tr>
 *   <tr><td>bad input</td><td>400</td><td>what was wrong</td></tr>
 *   <tr><td>anything else</td><td>500</td><td>generic</td></tr>
 * </table>
 *
 * <p>The specific authentication reason never reaches the caller. It is in the log and the audit
 * trail under the same correlation id.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://warden.dev/errors/";

    @ExceptionHandler(AuthenticationException.class)
    public ProblemDetail handleAuthentication(AuthenticationException ex) {
        log.debug("Unauthorized: reason={}", ex.reason());
        return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized", AuthenticationException.GENERIC_MESSAGE);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleAccessDenied(AccessDeniedException ex) {
        log.debug("Forbidden: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.FORBIDDEN, "Forbidden", "forbidden", ex.getMessage());
        problem.setProperty("permission", ex.permission());
        problem.setProperty("namespace", ex.namespace());
        return problem;
    }

    @ExceptionHandler(ToolExecutionException.class)
    public ProblemDetail handleToolExecution(ToolExecutionException ex) {
        ProblemDetail problem =
                problem(HttpStatus.BAD_GATEWAY, "Tool Execution Failed", "tool-execution", ex.getMessage());
        problem.setProperty("tool", ex.toolName());
        return problem;
    }

    @ExceptionHandler(CredentialNotFoundException.class)
    public ProblemDetail handleCredentialNotFound(CredentialNotFoundException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Request body is not valid JSON");
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
                HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal", "An unexpected error occurred");
    }

    private ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
