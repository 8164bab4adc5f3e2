package io.leavesfly.switchboard.exception;

import lombok.Getter;

/**
 * 公开名称在一次重建重试后仍无法解析
 */
@Getter
public class CapabilityNotFoundException extends SwitchboardException {

    private final String publicName;

    public CapabilityNotFoundException(String publicName) {
        super("No server found for capability: " + publicName);
        this.publicName = publicName;
    }
}
