package io.leavesfly.switchboard.exception;

import lombok.Getter;

/**
 * 审批等待超时
 */
@Getter
public class ConfirmationTimeoutException extends SwitchboardException {

    private final String toolName;

    public ConfirmationTimeoutException(String toolName, long timeoutMs) {
        super(String.format("Tool confirmation timeout for %s after %dms", toolName, timeoutMs));
        this.toolName = toolName;
    }
}
