package io.leavesfly.switchboard.exception;

import lombok.Getter;

/**
 * 两个不同的后端标识规范化后得到相同的值
 */
@Getter
public class NameCollisionException extends SwitchboardException {

    private final String identifier;
    private final String existingIdentifier;
    private final String canonicalName;

    public NameCollisionException(String identifier, String existingIdentifier, String canonicalName) {
        super(String.format("Server name '%s' conflicts with existing '%s' (both map to '%s')",
                identifier, existingIdentifier, canonicalName));
        this.identifier = identifier;
        this.existingIdentifier = existingIdentifier;
        this.canonicalName = canonicalName;
    }
}
