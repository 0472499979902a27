package com.warden.gateway.infrastructure.web;

import com.warden.observability.CorrelationContext;
import com.warden.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds a correlation id to every request and echoes it in the response.
 *
 * <p>The id flows through:
 *
 * <ol>
 *   <li>{@code X-Correlation-ID} request header → this filter → {@link CorrelationContextHolder}
 *   <li>CorrelationContextHolder → SLF4J MDC → every log line of the request
 *   <li>{@code SecurityGate} → subject and scheme bound to the same context after authentication
 *   <li>audit lines → {@code correlation_id} field
 *   <li>ProblemDetail responses → {@code correlationId} property
 *   <li>this filter → response header
 * </ol>
 *
 * <p>A client-supplied id is kept when it is non-blank and at most {@value
 * #MAX_CORRELATION_ID_LENGTH} characters; otherwise a UUID is generated. A fresh request id is
 * generated for every request.
 *
 * <p>Runs at {@link Ordered#HIGHEST_PRECEDENCE} so the context is bound before any other filter
 * or handler logs.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    /** Upper bound for client-supplied ids; longer values are replaced. */
    static final int MAX_CORRELATION_ID_LENGTH = 128;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null
                || correlationId.isBlank()
                || correlationId.length() > MAX_CORRELATION_ID_LENGTH) {
            correlationId = UUID.randomUUID().toString();
        }

        // populates the MDC as well
        CorrelationContextHolder.set(
                new CorrelationContext(correlationId, UUID.randomUUID().toString(), null, null));
        // echoed for client-side correlation
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }
}
