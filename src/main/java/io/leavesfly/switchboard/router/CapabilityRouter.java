package io.leavesfly.switchboard.router;

import com.fasterxml.jackson.databind.JsonNode;
import io.leavesfly.switchboard.capability.Backend;
import io.leavesfly.switchboard.capability.CapabilityEntry;
import io.leavesfly.switchboard.capability.CapabilityIndex;
import io.leavesfly.switchboard.capability.CapabilityKind;
import io.leavesfly.switchboard.capability.ResolvedName;
import io.leavesfly.switchboard.config.BackendConfig;
import io.leavesfly.switchboard.confirmation.ConfirmationProvider;
import io.leavesfly.switchboard.connection.ConnectionMode;
import io.leavesfly.switchboard.connection.ConnectionOrchestrator;
import io.leavesfly.switchboard.connection.ConnectionOutcome;
import io.leavesfly.switchboard.exception.CapabilityNotFoundException;
import io.leavesfly.switchboard.exception.ExecutionDeniedException;
import io.leavesfly.switchboard.exception.NameCollisionException;
import io.leavesfly.switchboard.naming.NameSanitizer;
import io.leavesfly.switchboard.transport.ToolDescriptor;
import io.leavesfly.switchboard.transport.TransportClient;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;

/**
 * 能力路由器
 * <p>
 * 对外的唯一入口：注册与移除后端、维护能力索引，
 * 按公开名称找到所属后端，经过审批后以原始名称调用后端。
 * 公开名称查找未命中时刷新一次索引并重试一次。
 */
@Slf4j
public class CapabilityRouter {

    private final NameSanitizer sanitizer;

    private final CapabilityIndex index;

    private final ConnectionOrchestrator orchestrator;

    private final ConfirmationProvider confirmationProvider;

    /**
     * 后端标识 -> 后端
     */
    private final Map<String, Backend> backends = new ConcurrentHashMap<>();

    /**
     * 正在进行的单个连接：后端标识 -> 共享的连接结果
     */
    private final Map<String, Mono<Backend>> pendingConnects = new ConcurrentHashMap<>();

    public CapabilityRouter(ConnectionOrchestrator orchestrator, ConfirmationProvider confirmationProvider) {
        this(orchestrator, confirmationProvider, CapabilityIndex.DEFAULT_DELIMITER);
    }

    public CapabilityRouter(ConnectionOrchestrator orchestrator, ConfirmationProvider confirmationProvider,
                            String delimiter) {
        this.sanitizer = new NameSanitizer();
        this.index = new CapabilityIndex(delimiter);
        this.orchestrator = orchestrator;
        this.confirmationProvider = confirmationProvider;
    }

    // ==================== 后端管理 ====================

    /**
     * 注册已连接的客户端并刷新其能力
     * <p>
     * 规范化标识与另一个已注册标识冲突时直接抛出 {@link NameCollisionException}，状态不变。
     * 同一标识重复注册会覆盖旧的后端（旧客户端不会被断开）。
     */
    public Mono<Backend> registerBackend(String identifier, TransportClient client) {
        Backend backend = register(identifier, client);
        return index.refreshOne(backend).thenReturn(backend);
    }

    /**
     * 批量初始化
     * 所有连接并发进行，全部结束后才更新索引，然后按连接模式评估结果
     *
     * @param descriptors 后端标识 -> 配置
     * @param mode        批次成功策略
     */
    public Mono<Void> initialize(Map<String, BackendConfig> descriptors, ConnectionMode mode) {
        return Mono.defer(() -> {
            Map<String, String> failures = new LinkedHashMap<>();
            Map<String, BackendConfig> toConnect = new LinkedHashMap<>();

            synchronized (this) {
                descriptors.forEach((identifier, config) -> {
                    if (backends.containsKey(identifier)) {
                        log.debug("Server '{}' already registered, skipping", identifier);
                        return;
                    }
                    if (pendingConnects.containsKey(identifier)) {
                        log.debug("Server '{}' is already connecting, skipping", identifier);
                        return;
                    }
                    try {
                        // 先占用规范形式，同一批次内的冲突也能检测到
                        sanitizer.registerCanonical(identifier);
                        toConnect.put(identifier, config);
                    } catch (NameCollisionException e) {
                        log.error("{}", e.getMessage());
                        failures.put(identifier, e.getMessage());
                        orchestrator.recordFailure(identifier, e.getMessage());
                    }
                });
            }

            log.info("Connecting to {} server(s) in {} mode", toConnect.size(), mode);
            return orchestrator.connectAll(toConnect)
                    .flatMap(outcomes -> {
                        for (ConnectionOutcome outcome : outcomes) {
                            if (outcome.isSuccess()) {
                                synchronized (this) {
                                    putBackend(outcome.getIdentifier(), sanitizer.sanitize(outcome.getIdentifier()),
                                            outcome.getClient());
                                }
                            } else {
                                sanitizer.unregister(outcome.getIdentifier());
                                failures.put(outcome.getIdentifier(), outcome.getError());
                            }
                        }
                        return index.rebuildAll(backends.values());
                    })
                    .then(Mono.fromRunnable(() ->
                            orchestrator.evaluate(mode, descriptors.size(), failures, descriptors)));
        });
    }

    /**
     * 动态连接单个后端
     * 已注册时直接返回；同一标识的并发调用共享同一次连接；失败总是传播给调用方
     */
    public Mono<Backend> connectOne(String identifier, BackendConfig config) {
        return Mono.defer(() -> {
            Backend existing = backends.get(identifier);
            if (existing != null) {
                log.debug("Server '{}' already registered", identifier);
                return Mono.just(existing);
            }
            return pendingConnects.computeIfAbsent(identifier, id -> shareConnect(id, config));
        });
    }

    private Mono<Backend> shareConnect(String identifier, BackendConfig config) {
        AtomicReference<Mono<Backend>> self = new AtomicReference<>();
        Mono<Backend> shared = attemptConnect(identifier, config)
                .doOnTerminate(() -> pendingConnects.remove(identifier, self.get()))
                .cache();
        self.set(shared);
        return shared;
    }

    private Mono<Backend> attemptConnect(String identifier, BackendConfig config) {
        return Mono.defer(() -> {
            String canonical;
            try {
                synchronized (this) {
                    canonical = sanitizer.registerCanonical(identifier);
                }
            } catch (NameCollisionException e) {
                orchestrator.recordFailure(identifier, e.getMessage());
                return Mono.error(e);
            }
            return orchestrator.connectOne(identifier, config)
                    .doOnError(e -> {
                        synchronized (this) {
                            // 规范名称可能已被同一标识的已注册后端使用
                            if (!backends.containsKey(identifier)) {
                                sanitizer.unregister(identifier);
                            }
                        }
                    })
                    .flatMap(client -> {
                        Backend backend;
                        synchronized (this) {
                            backend = putBackend(identifier, canonical, client);
                        }
                        return index.refreshOne(backend).thenReturn(backend);
                    });
        });
    }

    /**
     * 移除后端
     * 断开连接失败只记录日志；原先冲突的名称会恢复为原始名称
     */
    public Mono<Void> removeBackend(String identifier) {
        return Mono.defer(() -> {
            orchestrator.clearFailure(identifier);
            Backend backend;
            synchronized (this) {
                backend = backends.remove(identifier);
                if (backend == null) {
                    return Mono.empty();
                }
                sanitizer.unregister(identifier);
            }
            index.removeBackend(backend);
            log.info("Removed server '{}'", identifier);
            return disconnectQuietly(backend);
        });
    }

    /**
     * 断开全部后端，并清空注册表、索引与连接错误
     */
    public Mono<Void> disconnectAll() {
        return Mono.defer(() -> {
            List<Backend> snapshot = new ArrayList<>(backends.values());
            return Flux.fromIterable(snapshot)
                    .flatMap(this::disconnectQuietly)
                    .then(Mono.fromRunnable(() -> {
                        synchronized (this) {
                            backends.clear();
                            sanitizer.clear();
                        }
                        index.clear();
                        orchestrator.clearAllFailures();
                        log.info("Disconnected from {} server(s)", snapshot.size());
                    }));
        });
    }

    /**
     * 全量重建索引
     */
    public Mono<Void> refresh() {
        return Mono.defer(() -> index.rebuildAll(new ArrayList<>(backends.values())));
    }

    // ==================== 调用 ====================

    /**
     * 调用工具
     *
     * @param publicName 公开名称（原始名或限定名）
     * @param args       参数
     * @param scopeId    审批名单范围，可为 null
     */
    public Mono<JsonNode> invoke(String publicName, Map<String, Object> args, String scopeId) {
        return route(CapabilityKind.TOOL, publicName, args, scopeId,
                (backend, raw) -> backend.getClient().callTool(raw, args == null ? Map.of() : args));
    }

    public Mono<JsonNode> invoke(String publicName, Map<String, Object> args) {
        return invoke(publicName, args, null);
    }

    /**
     * 获取提示词
     */
    public Mono<JsonNode> getPrompt(String publicName, Map<String, Object> args, String scopeId) {
        return route(CapabilityKind.PROMPT, publicName, args, scopeId,
                (backend, raw) -> backend.getClient().getPrompt(raw, args == null ? Map.of() : args));
    }

    /**
     * 读取资源
     */
    public Mono<JsonNode> readResource(String publicUri, String scopeId) {
        return route(CapabilityKind.RESOURCE, publicUri, Map.of(), scopeId,
                (backend, raw) -> backend.getClient().readResource(raw));
    }

    private Mono<JsonNode> route(CapabilityKind kind, String publicName, Map<String, Object> args, String scopeId,
                                 BiFunction<Backend, String, Mono<JsonNode>> call) {
        return resolve(kind, publicName)
                .flatMap(entry -> {
                    Backend owner = entry.getOwner();
                    String description = describe(kind, entry);
                    return confirmationProvider.requestConfirmation(publicName, args, description, scopeId)
                            .flatMap(approved -> {
                                if (!Boolean.TRUE.equals(approved)) {
                                    log.info("Execution of '{}' denied", publicName);
                                    return Mono.error(new ExecutionDeniedException(publicName));
                                }
                                log.debug("Routing {} '{}' to server '{}' as '{}'",
                                        kind, publicName, owner.getIdentifier(), entry.getRawName());
                                return call.apply(owner, entry.getRawName());
                            });
                });
    }

    /**
     * 查找公开名称，未命中时刷新一次再重试一次
     */
    private Mono<CapabilityEntry> resolve(CapabilityKind kind, String publicName) {
        return Mono.defer(() -> {
            Optional<CapabilityEntry> hit = index.lookupEntry(kind, publicName);
            if (hit.isPresent()) {
                return Mono.just(hit.get());
            }
            log.debug("{} '{}' not in index, refreshing", kind, publicName);
            return refreshForMiss(kind, publicName)
                    .then(Mono.defer(() -> index.lookupEntry(kind, publicName)
                            .map(Mono::just)
                            .orElseGet(() -> Mono.error(new CapabilityNotFoundException(publicName)))));
        });
    }

    /**
     * 名称带有已知后端前缀时先只刷新该后端，仍未命中再全量重建
     */
    private Mono<Void> refreshForMiss(CapabilityKind kind, String publicName) {
        Optional<Backend> candidate = index.guessOwner(publicName)
                .map(b -> backends.get(b.getIdentifier()));
        if (candidate.isEmpty()) {
            return refresh();
        }
        return index.refreshOne(candidate.get())
                .then(Mono.defer(() -> index.lookupEntry(kind, publicName).isPresent()
                        ? Mono.<Void>empty()
                        : refresh()));
    }

    // ==================== 查询 ====================

    /**
     * 全部工具（公开名称 -> 描述）
     */
    public Map<String, ToolDescriptor> listAllTools() {
        return index.getToolDescriptors();
    }

    public List<String> listAllPrompts() {
        return new ArrayList<>(index.snapshot(CapabilityKind.PROMPT).keySet());
    }

    public List<String> listAllResources() {
        return new ArrayList<>(index.snapshot(CapabilityKind.RESOURCE).keySet());
    }

    public Optional<Backend> lookup(String publicName) {
        return index.lookup(publicName);
    }

    public Optional<ResolvedName> resolveQualified(String qualifiedName) {
        return index.resolveQualified(qualifiedName);
    }

    /**
     * 已注册的后端（按标识排序）
     */
    public Map<String, Backend> getClients() {
        return Collections.unmodifiableMap(new TreeMap<>(backends));
    }

    public Optional<Backend> getBackend(String identifier) {
        return Optional.ofNullable(backends.get(identifier));
    }

    public Map<String, String> getFailedConnections() {
        return orchestrator.getFailedConnections();
    }

    public ConfirmationProvider getConfirmationProvider() {
        return confirmationProvider;
    }

    public CapabilityIndex getIndex() {
        return index;
    }

    public NameSanitizer getSanitizer() {
        return sanitizer;
    }

    // ==================== 内部实现 ====================

    private synchronized Backend register(String identifier, TransportClient client) {
        // 检查在任何修改之前进行，失败时注册表保持原样
        sanitizer.checkAvailable(identifier);
        String canonical = sanitizer.registerCanonical(identifier);
        return putBackend(identifier, canonical, client);
    }

    private Backend putBackend(String identifier, String canonical, TransportClient client) {
        Backend backend = new Backend(identifier, canonical, client);
        backend.markConnected();
        Backend previous = backends.put(identifier, backend);
        if (previous != null) {
            log.warn("Server '{}' was already registered, replacing it", identifier);
        } else {
            log.info("Registered server '{}'", identifier);
        }
        orchestrator.clearFailure(identifier);
        return backend;
    }

    private Mono<Void> disconnectQuietly(Backend backend) {
        return Mono.defer(() -> backend.getClient().disconnect())
                .doOnSuccess(v -> backend.markDisconnected(null))
                .onErrorResume(e -> {
                    log.warn("Error disconnecting from server '{}': {}", backend.getIdentifier(), e.getMessage());
                    backend.markDisconnected(e.getMessage());
                    return Mono.empty();
                });
    }

    private String describe(CapabilityKind kind, CapabilityEntry entry) {
        String server = entry.getOwner().getIdentifier();
        switch (kind) {
            case PROMPT:
                return String.format("Get prompt '%s' from server '%s'", entry.getRawName(), server);
            case RESOURCE:
                return String.format("Read resource '%s' from server '%s'", entry.getRawName(), server);
            case TOOL:
            default:
                return String.format("Call tool '%s' on server '%s'", entry.getRawName(), server);
        }
    }
}
