package io.leavesfly.switchboard.transport.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.switchboard.config.BackendConfig;
import io.leavesfly.switchboard.transport.TransportClient;
import io.leavesfly.switchboard.transport.TransportClientFactory;
import org.springframework.stereotype.Component;

/**
 * 默认的传输客户端工厂，为每个后端创建 MCP 客户端
 */
@Component
public class McpTransportClientFactory implements TransportClientFactory {

    private final ObjectMapper objectMapper;

    public McpTransportClientFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public TransportClient create(String identifier, BackendConfig config) {
        return new McpTransportClient(identifier, objectMapper);
    }
}
