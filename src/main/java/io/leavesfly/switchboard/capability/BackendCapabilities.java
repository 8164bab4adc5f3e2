package io.leavesfly.switchboard.capability;

import io.leavesfly.switchboard.transport.ToolDescriptor;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单个后端某一时刻声明的能力快照
 */
@Getter
public class BackendCapabilities {

    public static final BackendCapabilities EMPTY = new BackendCapabilities(Map.of(), List.of(), List.of());

    private final Map<String, ToolDescriptor> tools;
    private final Set<String> prompts;
    private final Set<String> resources;

    public BackendCapabilities(Map<String, ToolDescriptor> tools, List<String> prompts, List<String> resources) {
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
        this.prompts = Collections.unmodifiableSet(new LinkedHashSet<>(prompts));
        this.resources = Collections.unmodifiableSet(new LinkedHashSet<>(resources));
    }

    public Set<String> names(CapabilityKind kind) {
        switch (kind) {
            case TOOL:
                return tools.keySet();
            case PROMPT:
                return prompts;
            case RESOURCE:
                return resources;
            default:
                return Set.of();
        }
    }
}
