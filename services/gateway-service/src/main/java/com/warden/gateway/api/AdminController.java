package com.warden.gateway.api;

import com.warden.gate.SecurityGate;
import com.warden.gateway.config.WardenProperties;
import com.warden.security.AuthorizationHeader;
import com.warden.security.Identity;
import com.warden.security.TokenAuthenticator;
import com.warden.security.credential.CredentialRecord;
import com.warden.security.credential.CredentialStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administrative endpoints, each behind its own {@code warden:*} permission.
 *
 * <p>Admin permissions are checked against namespace {@value #ADMIN_NAMESPACE}, so only roles
 * without a namespace restriction (or with {@code "*"}) can grant them.
 */
@RestController
@RequestMapping("/api/v1")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    public static final String ADMIN_NAMESPACE = "*";
    public static final String PERMISSION_ISSUE_TOKEN = "warden:tokens:issue";
    public static final String PERMISSION_LIST_KEYS = "warden:keys:list";
    public static final String PERMISSION_REVOKE_KEY = "warden:keys:revoke";

    private final SecurityGate gate;
    private final TokenAuthenticator tokenAuthenticator;
    private final CredentialStore credentialStore;
    private final WardenProperties properties;
    private final Clock clock;

    public AdminController(
            SecurityGate gate,
            TokenAuthenticator tokenAuthenticator,
            CredentialStore credentialStore,
            WardenProperties properties,
            Clock clock) {
        this.gate = gate;
        this.tokenAuthenticator = tokenAuthenticator;
        this.credentialStore = credentialStore;
        this.properties = properties;
        this.clock = clock;
    }

    @PostMapping("/tokens")
    @ResponseStatus(HttpStatus.CREATED)
    public IssueTokenResponse issueToken(
            @RequestHeader(value = AuthorizationHeader.HEADER_NAME, required = false) String authorization,
            @Valid @RequestBody IssueTokenRequest request) {
        Identity caller =
                gate.authorizePermission(
                        authorization, PERMISSION_ISSUE_TOKEN, "issue", "tokens", ADMIN_NAMESPACE);

        WardenProperties.Token settings = properties.security().token();
        Duration lifetime =
                request.lifetimeSeconds() == null
                        ? settings.defaultLifetime()
                        : Duration.ofSeconds(request.lifetimeSeconds());
        if (lifetime.compareTo(settings.maxLifetime()) > 0) {
            throw new IllegalArgumentException(
                    "lifetimeSeconds exceeds the maximum of " + settings.maxLifetime().toSeconds());
        }

        Instant expiresAt = clock.instant().plus(lifetime);
        String token =
                tokenAuthenticator.issueToken(
                        request.userId(), request.username(), request.permissions(), lifetime);
        log.info("Token issued by {} for userId={}", caller.subject(), request.userId());
        return new IssueTokenResponse(token, expiresAt);
    }

    @GetMapping("/keys")
    public List<KeyView> listKeys(
            @RequestHeader(value = AuthorizationHeader.HEADER_NAME, required = false) String authorization) {
        gate.authorizePermission(authorization, PERMISSION_LIST_KEYS, "list", "keys", ADMIN_NAMESPACE);
        return credentialStore.list().stream().map(KeyView::from).toList();
    }

    @DeleteMapping("/keys/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void revokeKey(
            @RequestHeader(value = AuthorizationHeader.HEADER_NAME, required = false) String authorization,
            @PathVariable("id") String id) {
        Identity caller =
                gate.authorizePermission(authorization, PERMISSION_REVOKE_KEY, "revoke", "keys", ADMIN_NAMESPACE);
        credentialStore.revoke(id);
        log.info("Key {} revoked by {}", id, caller.subject());
    }

    public record IssueTokenRequest(
            @NotBlank String userId,
            String username,
            List<String> permissions,
            @Positive Long lifetimeSeconds) {}

    public record IssueTokenResponse(String token, Instant expiresAt) {}

    /** Key metadata without the secret. */
    public record KeyView(
            String id,
            String name,
            List<String> permissions,
            Instant createdAt,
            Instant expiresAt,
            Instant lastUsedAt) {

        static KeyView from(CredentialRecord record) {
            return new KeyView(
                    record.id(),
                    record.displayName(),
                    record.permissions(),
                    record.createdAt(),
                    record.expiresAt(),
                    record.lastUsedAt());
        }
    }
}
