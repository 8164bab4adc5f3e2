package io.leavesfly.switchboard.capability;

/**
 * 能力类型
 */
public enum CapabilityKind {
    TOOL,
    PROMPT,
    RESOURCE
}
