package io.leavesfly.switchboard.exception;

import lombok.Getter;

/**
 * 执行请求被拒绝
 */
@Getter
public class ExecutionDeniedException extends SwitchboardException {

    private final String publicName;

    public ExecutionDeniedException(String publicName) {
        super(String.format("Execution of '%s' was denied", publicName));
        this.publicName = publicName;
    }
}
