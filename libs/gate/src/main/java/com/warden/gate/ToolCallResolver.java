package com.warden.gate;

import java.util.Locale;
import java.util.Map;

/**
 * Works out action, resource and namespace from a tool name and its arguments.
 * <p>
 * Names of the form {@code k8s_<action>_<resource>} give the action directly (e.g.,
 * {@code k8s_scale_deployment} is "scale"); {@code get} on a logs tool is treated as "logs".
 * Other names fall back to keyword matching. The namespace comes from the {@code namespace}
 * argument and defaults to {@value #DEFAULT_NAMESPACE}.
 */
public final class ToolCallResolver {

    public static final String DEFAULT_NAMESPACE = "default";
    public static final String NAMESPACE_ARGUMENT = "namespace";
    public static final String UNKNOWN = "unknown";

    private static final String PREFIX = "k8s";

    public ToolTarget resolve(String toolName, Map<String, Object> arguments) {
        String name = toolName == null ? "" : toolName.toLowerCase(Locale.ROOT);
        return new ToolTarget(action(name), resource(name), namespace(arguments));
    }

    static String action(String name) {
        String[] parts = name.split("_");
        if (parts.length >= 3 && PREFIX.equals(parts[0])) {
            if ("get".equals(parts[1]) && name.contains("logs")) {
                return "logs";
            }
            return parts[1];
        }
        if (name.contains("list")) {
            return "list";
        }
        if (name.contains("get") && name.contains("logs")) {
            return "logs";
        }
        if (name.contains("get")) {
            return "get";
        }
        for (String keyword : new String[] {"scale", "logs", "restart", "delete", "create"}) {
            if (name.contains(keyword)) {
                return keyword;
            }
        }
        return UNKNOWN;
    }

    static String resource(String name) {
        if (name.contains("pod")) {
            return "pods";
        }
        if (name.contains("deployment")) {
            return "deployments";
        }
        if (name.contains("service")) {
            return "services";
        }
        if (name.contains("secret")) {
            return "secrets";
        }
        if (name.contains("configmap")) {
            return "configmaps";
        }
        return UNKNOWN;
    }

    static String namespace(Map<String, Object> arguments) {
        if (arguments != null && arguments.get(NAMESPACE_ARGUMENT) instanceof String ns && !ns.isBlank()) {
            return ns;
        }
        return DEFAULT_NAMESPACE;
    }
}
