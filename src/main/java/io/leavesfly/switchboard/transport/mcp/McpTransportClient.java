package io.leavesfly.switchboard.transport.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.switchboard.config.BackendConfig;
import io.leavesfly.switchboard.exception.ConnectionException;
import io.leavesfly.switchboard.transport.ToolDescriptor;
import io.leavesfly.switchboard.transport.TransportClient;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientSseClientTransport;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.spec.McpClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 MCP Java SDK 的传输客户端
 * <p>
 * 支持 stdio / sse / streamable http 三种传输。SDK 的同步客户端是阻塞的，
 * 所有调用都切换到 boundedElastic 调度器上执行。
 */
@Slf4j
public class McpTransportClient implements TransportClient {

    private static final String CLIENT_NAME = "switchboard";
    private static final String CLIENT_VERSION = "0.1.0";
    private static final String DEFAULT_SSE_ENDPOINT = "/sse";
    private static final String DEFAULT_HTTP_ENDPOINT = "/mcp";

    private final String identifier;
    private final ObjectMapper objectMapper;

    private volatile McpSyncClient client;

    public McpTransportClient(String identifier, ObjectMapper objectMapper) {
        this.identifier = identifier;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> connect(BackendConfig config) {
        return Mono.<Void>fromRunnable(() -> {
            if (client != null) {
                log.debug("MCP client '{}' already connected", identifier);
                return;
            }
            Duration timeout = Duration.ofMillis(config.getTimeout());
            McpSyncClient created = McpClient.sync(createTransport(config))
                    .clientInfo(new McpSchema.Implementation(CLIENT_NAME, CLIENT_VERSION))
                    .requestTimeout(timeout)
                    .initializationTimeout(timeout)
                    .build();
            try {
                created.initialize();
            } catch (RuntimeException e) {
                created.close();
                throw new ConnectionException(identifier, describe(e), e);
            }
            client = created;
            log.info("Connected to MCP server '{}' via {}", identifier, config.getType());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Map<String, ToolDescriptor>> listTools() {
        return call(sync -> {
            Map<String, ToolDescriptor> tools = new LinkedHashMap<>();
            String cursor = null;
            do {
                McpSchema.ListToolsResult page = sync.listTools(cursor);
                for (McpSchema.Tool tool : page.tools()) {
                    tools.put(tool.name(), ToolDescriptor.builder()
                            .name(tool.name())
                            .description(tool.description())
                            .inputSchema(tool.inputSchema() != null ? objectMapper.valueToTree(tool.inputSchema()) : null)
                            .build());
                }
                cursor = page.nextCursor();
            } while (cursor != null);
            return tools;
        });
    }

    @Override
    public Mono<List<String>> listPrompts() {
        return call(sync -> {
            List<String> prompts = new ArrayList<>();
            if (!supports(sync, Capability.PROMPTS)) {
                return prompts;
            }
            String cursor = null;
            do {
                McpSchema.ListPromptsResult page = sync.listPrompts(cursor);
                page.prompts().forEach(prompt -> prompts.add(prompt.name()));
                cursor = page.nextCursor();
            } while (cursor != null);
            return prompts;
        });
    }

    @Override
    public Mono<List<String>> listResources() {
        return call(sync -> {
            List<String> resources = new ArrayList<>();
            if (!supports(sync, Capability.RESOURCES)) {
                return resources;
            }
            String cursor = null;
            do {
                McpSchema.ListResourcesResult page = sync.listResources(cursor);
                page.resources().forEach(resource -> resources.add(resource.uri()));
                cursor = page.nextCursor();
            } while (cursor != null);
            return resources;
        });
    }

    @Override
    public Mono<JsonNode> callTool(String name, Map<String, Object> args) {
        return call(sync -> objectMapper.valueToTree(
                sync.callTool(new McpSchema.CallToolRequest(name, args != null ? args : Map.of()))));
    }

    @Override
    public Mono<JsonNode> getPrompt(String name, Map<String, Object> args) {
        return call(sync -> objectMapper.valueToTree(
                sync.getPrompt(new McpSchema.GetPromptRequest(name, args != null ? args : Map.of()))));
    }

    @Override
    public Mono<JsonNode> readResource(String uri) {
        return call(sync -> objectMapper.valueToTree(sync.readResource(new McpSchema.ReadResourceRequest(uri))));
    }

    @Override
    public Mono<Void> disconnect() {
        return Mono.<Void>fromRunnable(() -> {
            McpSyncClient current = client;
            client = null;
            if (current != null && !current.closeGracefully()) {
                log.warn("MCP client '{}' did not close gracefully", identifier);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public boolean isConnected() {
        return client != null;
    }

    private <T> Mono<T> call(SyncCall<T> action) {
        return Mono.fromCallable(() -> {
            McpSyncClient current = client;
            if (current == null) {
                throw new IllegalStateException("MCP client '" + identifier + "' is not connected");
            }
            return action.apply(current);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private McpClientTransport createTransport(BackendConfig config) {
        switch (config.getType()) {
            case STDIO:
                ServerParameters parameters = ServerParameters.builder(config.getCommand())
                        .args(config.getArgs())
                        .env(config.getEnv())
                        .build();
                return new StdioClientTransport(parameters);
            case SSE: {
                URI uri = URI.create(config.getUrl());
                return HttpClientSseClientTransport.builder(baseUri(uri))
                        .sseEndpoint(endpoint(uri, DEFAULT_SSE_ENDPOINT))
                        .customizeRequest(request -> config.getHeaders().forEach(request::header))
                        .build();
            }
            case HTTP: {
                URI uri = URI.create(config.getUrl());
                return HttpClientStreamableHttpTransport.builder(baseUri(uri))
                        .endpoint(endpoint(uri, DEFAULT_HTTP_ENDPOINT))
                        .customizeRequest(request -> config.getHeaders().forEach(request::header))
                        .build();
            }
            default:
                throw new ConnectionException(identifier, "Unsupported transport type: " + config.getType());
        }
    }

    private static String baseUri(URI uri) {
        return uri.getScheme() + "://" + uri.getRawAuthority();
    }

    private static String endpoint(URI uri, String defaultEndpoint) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty() || "/".equals(path)) {
            path = defaultEndpoint;
        }
        return uri.getRawQuery() != null ? path + "?" + uri.getRawQuery() : path;
    }

    private static boolean supports(McpSyncClient sync, Capability capability) {
        McpSchema.ServerCapabilities capabilities = sync.getServerCapabilities();
        if (capabilities == null) {
            return true;
        }
        return capability == Capability.PROMPTS ? capabilities.prompts() != null : capabilities.resources() != null;
    }

    private static String describe(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }

    private enum Capability {
        PROMPTS,
        RESOURCES
    }

    @FunctionalInterface
    private interface SyncCall<T> {
        T apply(McpSyncClient client) throws Exception;
    }
}
