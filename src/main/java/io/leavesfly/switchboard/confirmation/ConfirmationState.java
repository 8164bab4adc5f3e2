package io.leavesfly.switchboard.confirmation;

/**
 * 审批状态，PENDING 之外均为终态
 */
public enum ConfirmationState {
    PENDING,
    APPROVED,
    DENIED,
    TIMED_OUT,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
