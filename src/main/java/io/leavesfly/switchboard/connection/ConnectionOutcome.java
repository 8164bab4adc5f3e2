package io.leavesfly.switchboard.connection;

import io.leavesfly.switchboard.config.BackendConfig;
import io.leavesfly.switchboard.transport.TransportClient;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 单个后端连接尝试的结果
 */
@Getter
@ToString(of = {"identifier", "error"})
@AllArgsConstructor
public class ConnectionOutcome {

    private final String identifier;

    private final BackendConfig config;

    /**
     * 连接成功时的客户端，失败时为 null
     */
    private final TransportClient client;

    /**
     * 失败原因，成功时为 null
     */
    private final String error;

    public static ConnectionOutcome success(String identifier, BackendConfig config, TransportClient client) {
        return new ConnectionOutcome(identifier, config, client, null);
    }

    public static ConnectionOutcome failure(String identifier, BackendConfig config, String error) {
        return new ConnectionOutcome(identifier, config, null, error);
    }

    public boolean isSuccess() {
        return client != null && error == null;
    }
}
