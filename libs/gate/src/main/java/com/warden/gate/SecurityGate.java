package com.warden.gate;

import com.warden.audit.AuditEvents;
import com.warden.audit.AuditSink;
import com.warden.observability.CorrelationContextHolder;
import com.warden.observability.SecurityMetrics;
import com.warden.observability.SpanHelper;
import com.warden.security.AuthScheme;
import com.warden.security.AuthenticationException;
import com.warden.security.AuthenticatorDispatcher;
import com.warden.security.AuthorizationHeader;
import com.warden.security.Identity;
import com.warden.security.rbac.AuthorizationDecision;
import com.warden.security.rbac.AuthorizationEngine;
import com.warden.security.rbac.PermissionMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Authenticates, authorizes, executes and audits one tool invocation.
 * <p>
 * The steps run in order and the first failure ends the request:
 * <ol>
 *   <li>parse the {@code Authorization} header</li>
 *   <li>authenticate through the {@link AuthenticatorDispatcher}</li>
 *   <li>map the tool call to a permission and ask the {@link AuthorizationEngine}</li>
 *   <li>run the {@link ToolExecutor}</li>
 * </ol>
 * Every authentication and authorization outcome is audited; an operation event is written only
 * when the executor was reached. Failures before execution never touch the executor.
 */
public final class SecurityGate {

    private static final Logger log = LoggerFactory.getLogger(SecurityGate.class);

    public static final String SPAN_TOOL_EXECUTE = "tool.execute";
    public static final String ATTR_TOOL = "tool.name";
    public static final String ATTR_NAMESPACE = "warden.namespace";
    public static final String SCHEME_TAG_NONE = "none";
    public static final String SCHEME_TAG_UNSUPPORTED = "unsupported";

    private final AuthenticatorDispatcher dispatcher;
    private final AuthorizationEngine engine;
    private final PermissionMapper permissionMapper;
    private final ToolCallResolver resolver;
    private final ToolExecutor executor;
    private final AuditSink audit;
    private final SecurityMetrics metrics;
    private final SpanHelper spans;
    private final Clock clock;

    public SecurityGate(AuthenticatorDispatcher dispatcher,
                        AuthorizationEngine engine,
                        PermissionMapper permissionMapper,
                        ToolCallResolver resolver,
                        ToolExecutor executor,
                        AuditSink audit,
                        SecurityMetrics metrics,
                        SpanHelper spans,
                        Clock clock) {
        this.dispatcher = require(dispatcher, "dispatcher");
        this.engine = require(engine, "engine");
        this.permissionMapper = require(permissionMapper, "permissionMapper");
        this.resolver = require(resolver, "resolver");
        this.executor = require(executor, "executor");
        this.audit = require(audit, "audit");
        this.metrics = require(metrics, "metrics");
        this.spans = require(spans, "spans");
        this.clock = require(clock, "clock");
    }

    /**
     * Runs a tool call through the gate.
     *
     * @return the executor's result when it succeeded
     * @throws AuthenticationException the caller could not be authenticated
     * @throws AccessDeniedException   the caller lacks the required permission
     * @throws ToolExecutionException  the executor failed
     */
    public ToolResult invoke(GateRequest request) {
        Instant start = clock.instant();

        Identity identity = authenticate(request.authorizationHeader());
        ToolTarget target = resolver.resolve(request.toolName(), request.arguments());
        String permission = permissionMapper.requiredPermission(target.action(), target.resource());
        check(identity, permission, target.action(), target.resource(), target.namespace());

        InvocationContext context = new InvocationContext(identity, request.deadline(),
                correlationId(request.correlationId()));
        return execute(context, request, target, permission, start);
    }

    /**
     * Authenticates the header and authorizes an explicit action, without executing anything.
     * Used by administrative endpoints.
     *
     * @return the authorized identity
     */
    public Identity authorize(String authorizationHeader, String action, String resource, String namespace) {
        return authorizePermission(authorizationHeader,
                permissionMapper.requiredPermission(action, resource), action, resource, namespace);
    }

    /**
     * Same as {@link #authorize(String, String, String, String)} but with the required permission
     * given explicitly instead of derived from action and resource.
     */
    public Identity authorizePermission(String authorizationHeader, String permission,
                                        String action, String resource, String namespace) {
        Identity identity = authenticate(authorizationHeader);
        check(identity, permission, action, resource, namespace);
        return identity;
    }

    /**
     * Parses the header and authenticates the credential. Both outcomes are audited.
     */
    public Identity authenticate(String authorizationHeader) {
        String attemptedScheme = null;
        try {
            AuthorizationHeader header = AuthorizationHeader.parse(authorizationHeader);
            attemptedScheme = header.scheme();
            Identity identity = dispatcher.authenticate(header.scheme(), header.credential());

            audit.authentication(identity.subject(), identity.scheme(), true, null);
            metrics.authentication(metricScheme(identity.scheme()), true);
            CorrelationContextHolder.bindSubject(identity.subject(), identity.scheme());
            log.debug("Authenticated: subject={}, scheme={}", identity.subject(), identity.scheme());
            return identity;
        } catch (AuthenticationException e) {
            String scheme = e.scheme() != null ? e.scheme() : attemptedScheme;
            log.warn("Authentication failed: reason={}, scheme={}", e.detail(), scheme);
            audit.authentication(AuditEvents.UNKNOWN_USER, scheme, false, e.detail());
            metrics.authentication(metricScheme(scheme), false);
            throw e;
        } catch (RuntimeException e) {
            log.error("Authenticator failed unexpectedly: scheme={}", attemptedScheme, e);
            AuthenticationException failure = new AuthenticationException(
                    AuthenticationException.Reason.AUTHENTICATOR_ERROR, attemptedScheme, e);
            audit.authentication(AuditEvents.UNKNOWN_USER, attemptedScheme, false, failure.detail());
            metrics.authentication(metricScheme(attemptedScheme), false);
            throw failure;
        }
    }

    /** Meter tag for a scheme: canonical names only, so caller input cannot create new series. */
    static String metricScheme(String scheme) {
        if (scheme == null) {
            return SCHEME_TAG_NONE;
        }
        return AuthScheme.fromString(scheme).map(AuthScheme::value).orElse(SCHEME_TAG_UNSUPPORTED);
    }

    private void check(Identity identity, String permission, String action, String resource, String namespace) {
        AuthorizationDecision decision = engine.check(identity.permissions(), permission, namespace);

        audit.authorization(identity.subject(), action, resource, namespace, permission,
                decision.granted(), decision.reason());
        metrics.authorization(decision.granted());

        if (!decision.granted()) {
            log.warn("Authorization failed: subject={}, permission={}, namespace={}",
                    identity.subject(), permission, namespace);
            throw new AccessDeniedException(identity.subject(), permission, namespace);
        }
    }

    private ToolResult execute(InvocationContext context, GateRequest request, ToolTarget target,
                               String permission, Instant start) {
        String tool = request.toolName();
        ToolResult result;
        try {
            result = spans.inSpan(SPAN_TOOL_EXECUTE,
                    Map.of(ATTR_TOOL, tool, ATTR_NAMESPACE, target.namespace()),
                    () -> {
                        ToolResult r = executor.execute(context, tool, request.arguments());
                        if (r == null || !r.success()) {
                            SpanHelper.markCurrentFailed(r == null ? "no result" : r.error());
                        }
                        return r;
                    });
        } catch (RuntimeException e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            recordOperation(context, target, tool, permission, start, message);
            log.error("Tool execution threw: tool={}, subject={}", tool, context.identity().subject(), e);
            throw new ToolExecutionException(tool, message, e);
        }

        if (result == null || !result.success()) {
            String message = result == null ? "executor returned no result"
                    : result.error() == null ? "tool execution failed" : result.error();
            recordOperation(context, target, tool, permission, start, message);
            log.warn("Tool execution failed: tool={}, subject={}, error={}",
                    tool, context.identity().subject(), message);
            throw new ToolExecutionException(tool, message);
        }

        recordOperation(context, target, tool, permission, start, null);
        log.info("Tool executed: tool={}, subject={}, namespace={}",
                tool, context.identity().subject(), target.namespace());
        return result;
    }

    private void recordOperation(InvocationContext context, ToolTarget target, String tool, String permission,
                                 Instant start, String errorMessage) {
        Duration elapsed = Duration.between(start, clock.instant());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("permission", permission);
        metadata.put("tool_action", target.action());
        audit.operation(context.identity().subject(), tool, target.resource(), target.namespace(),
                elapsed, errorMessage, metadata);
        metrics.operation(tool, errorMessage == null, elapsed);
    }

    private static String correlationId(String requested) {
        if (requested != null && !requested.isBlank()) {
            return requested;
        }
        String bound = CorrelationContextHolder.currentCorrelationId();
        return bound != null ? bound : UUID.randomUUID().toString();
    }

    private static <T> T require(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        return value;
    }
}
