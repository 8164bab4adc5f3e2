package io.leavesfly.switchboard.capability;

import io.leavesfly.switchboard.transport.TransportClient;
import lombok.Getter;
import lombok.ToString;

/**
 * 已注册的后端
 * 身份由调用方提供的标识决定（例如配置中的键）
 */
@Getter
@ToString(of = {"identifier", "sanitizedIdentifier", "connected"})
public class Backend {

    private final String identifier;

    /**
     * 规范化后的标识，用作限定名前缀
     */
    private final String sanitizedIdentifier;

    private final TransportClient client;

    private volatile boolean connected;

    private volatile String lastError;

    public Backend(String identifier, String sanitizedIdentifier, TransportClient client) {
        this.identifier = identifier;
        this.sanitizedIdentifier = sanitizedIdentifier;
        this.client = client;
        this.connected = client != null && client.isConnected();
    }

    public void markConnected() {
        this.connected = true;
        this.lastError = null;
    }

    public void markDisconnected(String error) {
        this.connected = false;
        this.lastError = error;
    }
}
