package io.leavesfly.switchboard.exception;

/**
 * 配置异常
 * 配置文件无法读取或校验失败时抛出
 */
public class ConfigException extends SwitchboardException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
