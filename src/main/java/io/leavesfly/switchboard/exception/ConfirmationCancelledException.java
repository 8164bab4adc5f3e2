package io.leavesfly.switchboard.exception;

import lombok.Getter;

/**
 * 审批请求被取消
 */
@Getter
public class ConfirmationCancelledException extends SwitchboardException {

    private final String executionId;

    public ConfirmationCancelledException(String executionId, String message) {
        super(message);
        this.executionId = executionId;
    }
}
