package io.leavesfly.switchboard.exception;

import lombok.Getter;

/**
 * 单个后端连接失败
 */
@Getter
public class ConnectionException extends SwitchboardException {

    /**
     * 后端标识
     */
    private final String identifier;

    /**
     * 失败原因（不含前缀）
     */
    private final String reason;

    public ConnectionException(String identifier, String reason) {
        super(String.format("Failed to connect to server '%s': %s", identifier, reason));
        this.identifier = identifier;
        this.reason = reason;
    }

    public ConnectionException(String identifier, String reason, Throwable cause) {
        super(String.format("Failed to connect to server '%s': %s", identifier, reason), cause);
        this.identifier = identifier;
        this.reason = reason;
    }
}
