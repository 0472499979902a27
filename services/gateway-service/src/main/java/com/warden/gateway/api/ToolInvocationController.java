package com.warden.gateway.api;

import com.warden.gate.GateRequest;
import com.warden.gate.SecurityGate;
import com.warden.gate.ToolCallResolver;
import com.warden.gate.ToolResult;
import com.warden.observability.CorrelationContextHolder;
import com.warden.security.AuthorizationHeader;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Runs a tool through the security gate.
 *
 * <pre>
 * POST /api/v1/tools/k8s_list_pods?namespace=staging
 * Authorization: ApiKey &lt;key&gt;
 * {"labelSelector": "app=web"}
 * </pre>
 *
 * <p>Failures are mapped by {@link com.warden.gateway.infrastructure.web.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/tools")
public class ToolInvocationController {

    private final SecurityGate gate;
    private final Clock clock;

    public ToolInvocationController(SecurityGate gate, Clock clock) {
        this.gate = gate;
        this.clock = clock;
    }

    @PostMapping("/{tool}")
    public ToolInvocationResponse invoke(
            @PathVariable("tool") String tool,
            @RequestHeader(value = AuthorizationHeader.HEADER_NAME, required = false) String authorization,
            @RequestParam(value = "namespace", required = false) String namespace,
            @RequestParam(value = "timeoutMs", required = false) Long timeoutMs,
            @RequestBody(required = false) Map<String, Object> body) {

        Map<String, Object> arguments = new LinkedHashMap<>();
        if (body != null) {
            arguments.putAll(body);
        }
        if (namespace != null && !namespace.isBlank()) {
            arguments.put(ToolCallResolver.NAMESPACE_ARGUMENT, namespace);
        }
        if (timeoutMs != null && timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        Instant deadline = timeoutMs == null ? null : clock.instant().plus(Duration.ofMillis(timeoutMs));

        ToolResult result =
                gate.invoke(
                        new GateRequest(
                                authorization,
                                tool,
                                arguments,
                                deadline,
                                CorrelationContextHolder.currentCorrelationId()));
        return new ToolInvocationResponse(result.success(), result.message(), result.data());
    }

    public record ToolInvocationResponse(boolean success, String message, Map<String, Object> data) {}
}
