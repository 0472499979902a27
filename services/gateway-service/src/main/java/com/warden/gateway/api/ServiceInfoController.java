package com.warden.gateway.api;

import com.warden.gateway.config.WardenProperties;
import com.warden.security.AuthenticatorDispatcher;
import com.warden.security.rbac.AuthorizationEngine;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated service info: name, environment, accepted schemes and policy size.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final WardenProperties properties;
    private final AuthenticatorDispatcher dispatcher;
    private final AuthorizationEngine engine;
    private final Clock clock;

    public ServiceInfoController(
            WardenProperties properties,
            AuthenticatorDispatcher dispatcher,
            AuthorizationEngine engine,
            Clock clock) {
        this.properties = properties;
        this.dispatcher = dispatcher;
        this.engine = engine;
        this.clock = clock;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        WardenProperties.Service service = properties.service();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", service.name());
        info.put("environment", service.environment());
        info.put("description", service.description() != null ? service.description() : "");
        info.put("status", "running");
        info.put("schemes", new TreeSet<>(dispatcher.schemes()));
        info.put("roles", engine.policy().size());
        info.put("timestamp", clock.instant().toString());
        return info;
    }
}
