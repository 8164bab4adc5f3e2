package io.leavesfly.switchboard.transport;

import com.fasterxml.jackson.databind.JsonNode;
import io.leavesfly.switchboard.config.BackendConfig;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * 单个后端连接的传输客户端
 * <p>
 * 每个后端一个实例。所有操作的失败都以 Mono.error 返回，由调用方决定是否致命。
 */
public interface TransportClient {

    /**
     * 建立连接并完成握手
     */
    Mono<Void> connect(BackendConfig config);

    /**
     * 列出工具（名称 -> 定义）
     */
    Mono<Map<String, ToolDescriptor>> listTools();

    /**
     * 列出提示词名称
     */
    Mono<List<String>> listPrompts();

    /**
     * 列出资源 URI
     */
    Mono<List<String>> listResources();

    /**
     * 调用工具
     *
     * @param name 后端原始工具名（不带限定前缀）
     * @param args 工具参数
     */
    Mono<JsonNode> callTool(String name, Map<String, Object> args);

    /**
     * 获取提示词
     */
    Mono<JsonNode> getPrompt(String name, Map<String, Object> args);

    /**
     * 读取资源
     */
    Mono<JsonNode> readResource(String uri);

    /**
     * 断开连接
     */
    Mono<Void> disconnect();

    /**
     * 是否已连接
     */
    boolean isConnected();
}
