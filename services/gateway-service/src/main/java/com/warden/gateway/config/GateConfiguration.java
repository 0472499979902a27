package com.warden.gateway.config;

import com.warden.audit.AsyncAuditSink;
import com.warden.audit.AuditSink;
import com.warden.audit.LoggingAuditSink;
import com.warden.gate.SecurityGate;
import com.warden.gate.ToolCallResolver;
import com.warden.gate.ToolExecutor;
import com.warden.gateway.execution.AcknowledgingToolExecutor;
import com.warden.observability.SecurityMetrics;
import com.warden.observability.SpanHelper;
import com.warden.security.ApiKeyAuthenticator;
import com.warden.security.AuthenticatorDispatcher;
import com.warden.security.TokenAuthenticator;
import com.warden.security.credential.CredentialRecord;
import com.warden.security.credential.CredentialStore;
import com.warden.security.credential.InMemoryCredentialStore;
import com.warden.security.rbac.AuthorizationEngine;
import com.warden.security.rbac.PermissionMapper;
import com.warden.security.rbac.PermissionPolicy;
import com.warden.security.rbac.PermissionPolicyLoader;
import com.warden.security.rbac.PolicyLoadException;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Wires the security gate from {@link WardenProperties}.
 *
 * <p>Bean graph:
 *
 * <ol>
 *   <li>{@code warden.security.api-keys} → {@link InMemoryCredentialStore} → {@link
 *       ApiKeyAuthenticator}
 *   <li>{@code warden.security.token} → {@link TokenAuthenticator}
 *   <li>both authenticators → {@link AuthenticatorDispatcher}
 *   <li>{@code warden.security.policy-location} → {@link PermissionPolicy} → {@link
 *       AuthorizationEngine}
 *   <li>{@code warden.audit} → {@link LoggingAuditSink}, wrapped in {@link AsyncAuditSink} when
 *       async
 *   <li>all of the above plus metrics, spans and the {@link ToolExecutor} → {@link SecurityGate}
 * </ol>
 *
 * <p>The RBAC policy is loaded while the context starts; a missing or invalid policy fails
 * startup. A token secret shorter than 32 bytes fails startup the same way. Supplying a {@link
 * ToolExecutor}, {@link Clock} or {@link OpenTelemetry} bean replaces the default.
 */
@Configuration(proxyBeanMethods = false)
public class GateConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GateConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public OpenTelemetry openTelemetry() {
        return GlobalOpenTelemetry.get();
    }

    @Bean
    public CredentialStore credentialStore(WardenProperties properties, Clock clock) {
        var store = new InMemoryCredentialStore(clock);
        for (WardenProperties.ApiKey key : properties.security().apiKeys()) {
            store.register(
                    key.key(),
                    new CredentialRecord(
                            key.id(), key.name(), key.permissions(), clock.instant(), key.expiresAt(), null));
        }
        log.info("Credential store ready: keys={}", properties.security().apiKeys().size());
        return store;
    }

    @Bean
    public TokenAuthenticator tokenAuthenticator(WardenProperties properties, Clock clock) {
        WardenProperties.Token token = properties.security().token();
        return new TokenAuthenticator(token.secret(), token.issuer(), clock);
    }

    @Bean
    public AuthenticatorDispatcher authenticatorDispatcher(
            CredentialStore credentialStore, TokenAuthenticator tokenAuthenticator) {
        return new AuthenticatorDispatcher(
                List.of(new ApiKeyAuthenticator(credentialStore), tokenAuthenticator));
    }

    @Bean
    public PermissionPolicy permissionPolicy(WardenProperties properties, ResourceLoader resourceLoader) {
        String location = properties.security().policyLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new PolicyLoadException(location, "resource not found");
        }
        try (InputStream in = resource.getInputStream()) {
            return PermissionPolicyLoader.load(location, in);
        } catch (IOException e) {
            throw new PolicyLoadException(location, e.getMessage(), e);
        }
    }

    @Bean
    public AuthorizationEngine authorizationEngine(
            PermissionPolicy permissionPolicy, WardenProperties properties) {
        return new AuthorizationEngine(permissionPolicy, properties.security().requireRolePrefix());
    }

    @Bean
    public PermissionMapper permissionMapper(WardenProperties properties) {
        return new PermissionMapper(properties.security().permissionDomain());
    }

    @Bean
    public AuditSink auditSink(WardenProperties properties, Clock clock) {
        AuditSink sink = new LoggingAuditSink();
        WardenProperties.Audit audit = properties.audit();
        if (audit.async()) {
            log.info("Audit writing is asynchronous: queueCapacity={}", audit.queueCapacity());
            return new AsyncAuditSink(sink, audit.queueCapacity(), clock);
        }
        return sink;
    }

    @Bean
    public SecurityMetrics securityMetrics(MeterRegistry meterRegistry, WardenProperties properties) {
        return new SecurityMetrics(meterRegistry, properties.service().name());
    }

    @Bean
    public SpanHelper spanHelper(OpenTelemetry openTelemetry) {
        return new SpanHelper(openTelemetry.getTracer("com.warden.gateway"));
    }

    @Bean
    @ConditionalOnMissingBean(ToolExecutor.class)
    public ToolExecutor toolExecutor(Clock clock) {
        return new AcknowledgingToolExecutor(clock);
    }

    @Bean
    public SecurityGate securityGate(
            AuthenticatorDispatcher dispatcher,
            AuthorizationEngine engine,
            PermissionMapper mapper,
            ToolExecutor executor,
            AuditSink auditSink,
            SecurityMetrics metrics,
            SpanHelper spans,
            Clock clock) {
        return new SecurityGate(
                dispatcher, engine, mapper, new ToolCallResolver(), executor, auditSink, metrics, spans, clock);
    }
}
