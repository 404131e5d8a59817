package com.firefly.provisioningengine.engine;

import java.util.Map;

/**
 * Deterministic resource names. A given scenario and resource kind always map to the same name, which is
 * what lets the existence check find resources created by an earlier run.
 */
public class ResourceNaming {
    public static final String DEFAULT_TEMPLATE = "{scenario}-{kind}";

    private final String workspaceName;
    private final String template;

    public ResourceNaming(String workspaceName, String template) {
        this.workspaceName = workspaceName;
        this.template = template == null || template.isBlank() ? DEFAULT_TEMPLATE : template;
    }

    public String nameFor(String resourceKind, String scenarioId, Map<String, String> overrides) {
        String override = overrides == null ? null : overrides.get(resourceKind + "_name");
        if (override != null && !override.isBlank()) {
            return override;
        }
        if ("workspace".equals(resourceKind) && workspaceName != null && !workspaceName.isBlank()) {
            return workspaceName;
        }
        return template.replace("{scenario}", scenarioId).replace("{kind}", resourceKind);
    }
}
