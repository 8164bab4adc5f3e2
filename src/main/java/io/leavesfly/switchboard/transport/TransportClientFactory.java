package io.leavesfly.switchboard.transport;

import io.leavesfly.switchboard.config.BackendConfig;

/**
 * 传输客户端工厂
 * 为每个后端创建一个尚未连接的客户端
 */
@FunctionalInterface
public interface TransportClientFactory {

    TransportClient create(String identifier, BackendConfig config);
}
