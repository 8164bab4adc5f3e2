package io.leavesfly.switchboard.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.leavesfly.switchboard.config.BackendConfig;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 测试用的内存传输客户端
 */
public class FakeTransportClient implements TransportClient {

    private final String label;
    private final Map<String, ToolDescriptor> tools = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<String> prompts = new CopyOnWriteArrayList<>();
    private final List<String> resources = new CopyOnWriteArrayList<>();
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final AtomicInteger disconnects = new AtomicInteger();
    private final AtomicInteger listToolsCount = new AtomicInteger();

    private final AtomicInteger connects = new AtomicInteger();

    private volatile boolean connected;
    private volatile Duration connectDelay = Duration.ZERO;
    private volatile String connectError;
    private volatile String listError;
    private volatile String disconnectError;

    public FakeTransportClient(String label) {
        this.label = label;
    }

    /**
     * 创建一个已连接、声明了给定工具的客户端
     */
    public static FakeTransportClient connected(String label, String... toolNames) {
        FakeTransportClient client = new FakeTransportClient(label).withTools(toolNames);
        client.connected = true;
        return client;
    }

    public FakeTransportClient withTools(String... names) {
        for (String name : names) {
            tools.put(name, ToolDescriptor.builder().name(name).description(name + " from " + label).build());
        }
        return this;
    }

    public FakeTransportClient withTool(ToolDescriptor descriptor) {
        tools.put(descriptor.getName(), descriptor);
        return this;
    }

    public FakeTransportClient withPrompts(String... names) {
        prompts.addAll(List.of(names));
        return this;
    }

    public FakeTransportClient withResources(String... uris) {
        resources.addAll(List.of(uris));
        return this;
    }

    public FakeTransportClient failingConnect(String error) {
        this.connectError = error;
        return this;
    }

    public FakeTransportClient withConnectDelay(Duration delay) {
        this.connectDelay = delay;
        return this;
    }

    public FakeTransportClient failingList(String error) {
        this.listError = error;
        return this;
    }

    public FakeTransportClient failingDisconnect(String error) {
        this.disconnectError = error;
        return this;
    }

    public void removeTool(String name) {
        tools.remove(name);
    }

    public List<String> getCalls() {
        return new ArrayList<>(calls);
    }

    public int getDisconnectCount() {
        return disconnects.get();
    }

    public int getConnectCount() {
        return connects.get();
    }

    public int getListToolsCount() {
        return listToolsCount.get();
    }

    public String getLabel() {
        return label;
    }

    @Override
    public Mono<Void> connect(BackendConfig config) {
        Mono<Void> attempt = Mono.defer(() -> {
            connects.incrementAndGet();
            if (connectError != null) {
                return Mono.error(new IllegalStateException(connectError));
            }
            connected = true;
            return Mono.empty();
        });
        return connectDelay.isZero() ? attempt : Mono.delay(connectDelay).then(attempt);
    }

    @Override
    public Mono<Map<String, ToolDescriptor>> listTools() {
        return Mono.defer(() -> {
            listToolsCount.incrementAndGet();
            if (listError != null) {
                return Mono.error(new IllegalStateException(listError));
            }
            synchronized (tools) {
                return Mono.just(new LinkedHashMap<>(tools));
            }
        });
    }

    @Override
    public Mono<List<String>> listPrompts() {
        return Mono.fromSupplier(() -> new ArrayList<>(prompts));
    }

    @Override
    public Mono<List<String>> listResources() {
        return Mono.fromSupplier(() -> new ArrayList<>(resources));
    }

    @Override
    public Mono<JsonNode> callTool(String name, Map<String, Object> args) {
        return Mono.fromSupplier(() -> {
            calls.add("tool:" + name);
            return result(name, args);
        });
    }

    @Override
    public Mono<JsonNode> getPrompt(String name, Map<String, Object> args) {
        return Mono.fromSupplier(() -> {
            calls.add("prompt:" + name);
            return result(name, args);
        });
    }

    @Override
    public Mono<JsonNode> readResource(String uri) {
        return Mono.fromSupplier(() -> {
            calls.add("resource:" + uri);
            return result(uri, Map.of());
        });
    }

    @Override
    public Mono<Void> disconnect() {
        return Mono.defer(() -> {
            disconnects.incrementAndGet();
            connected = false;
            if (disconnectError != null) {
                return Mono.error(new IllegalStateException(disconnectError));
            }
            return Mono.empty();
        });
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    private JsonNode result(String name, Map<String, Object> args) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("server", label);
        node.put("name", name);
        node.put("argCount", args == null ? 0 : args.size());
        return node;
    }
}
