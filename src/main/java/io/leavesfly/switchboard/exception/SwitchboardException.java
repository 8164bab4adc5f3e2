package io.leavesfly.switchboard.exception;

/**
 * Switchboard 基础异常
 * 所有路由、连接、审批相关的异常都继承自此类
 */
public class SwitchboardException extends RuntimeException {

    public SwitchboardException(String message) {
        super(message);
    }

    public SwitchboardException(String message, Throwable cause) {
        super(message, cause);
    }
}
