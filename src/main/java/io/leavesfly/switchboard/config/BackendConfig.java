package io.leavesfly.switchboard.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.leavesfly.switchboard.connection.ConnectionMode;
import io.leavesfly.switchboard.exception.ConfigException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个后端（MCP 服务器）的连接配置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackendConfig {

    public static final long DEFAULT_TIMEOUT_MS = 30_000L;

    /**
     * 传输类型
     */
    @JsonProperty("type")
    private TransportType type;

    /**
     * stdio：启动命令
     */
    @JsonProperty("command")
    private String command;

    /**
     * stdio：命令参数
     */
    @JsonProperty("args")
    @Builder.Default
    private List<String> args = new ArrayList<>();

    /**
     * stdio：子进程环境变量
     */
    @JsonProperty("env")
    @Builder.Default
    private Map<String, String> env = new HashMap<>();

    /**
     * sse / http：服务地址
     */
    @JsonProperty("url")
    private String url;

    /**
     * sse / http：自定义请求头
     */
    @JsonProperty("headers")
    @Builder.Default
    private Map<String, String> headers = new HashMap<>();

    /**
     * 请求超时（毫秒）
     */
    @JsonProperty("timeout")
    @Builder.Default
    private long timeout = DEFAULT_TIMEOUT_MS;

    /**
     * 该后端自身的连接要求
     */
    @JsonProperty("connection_mode")
    @Builder.Default
    private ConnectionMode connectionMode = ConnectionMode.LENIENT;

    public ConnectionMode getConnectionMode() {
        return connectionMode != null ? connectionMode : ConnectionMode.LENIENT;
    }

    public List<String> getArgs() {
        return args != null ? args : new ArrayList<>();
    }

    public Map<String, String> getEnv() {
        return env != null ? env : new HashMap<>();
    }

    public Map<String, String> getHeaders() {
        return headers != null ? headers : new HashMap<>();
    }

    /**
     * 校验配置
     *
     * @param identifier 后端标识（用于错误信息）
     */
    public void validate(String identifier) {
        if (type == null) {
            throw new ConfigException("Server '" + identifier + "' has no transport type");
        }
        switch (type) {
            case STDIO:
                if (command == null || command.isBlank()) {
                    throw new ConfigException("Stdio server '" + identifier + "' requires a non-empty command");
                }
                break;
            case SSE:
            case HTTP:
                if (url == null || url.isBlank()) {
                    throw new ConfigException("Server '" + identifier + "' requires a url for transport " + type);
                }
                break;
            default:
                break;
        }
        if (timeout <= 0) {
            throw new ConfigException("Server '" + identifier + "' timeout must be positive, got " + timeout);
        }
    }

    /**
     * 传输类型枚举
     */
    public enum TransportType {
        @JsonProperty("stdio") STDIO,

        @JsonProperty("sse") SSE,

        @JsonProperty("http") HTTP
    }
}
