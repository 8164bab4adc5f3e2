package io.leavesfly.switchboard.connection;

import io.leavesfly.switchboard.config.BackendConfig;
import io.leavesfly.switchboard.exception.BatchConnectionPolicyException;
import io.leavesfly.switchboard.exception.ConnectionException;
import io.leavesfly.switchboard.transport.TransportClient;
import io.leavesfly.switchboard.transport.TransportClientFactory;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * 连接编排器
 * <p>
 * 负责创建传输客户端并建立连接，批量连接时并发进行且等待全部结束，
 * 然后按连接模式评估本批次是否成功。
 * 同时记录每个后端最近一次连接失败的原因。
 */
@Slf4j
public class ConnectionOrchestrator {

    public static final String STRICT_FAILURE_SUMMARY = "Failed to connect to required strict servers";

    public static final String LENIENT_FAILURE_SUMMARY = "Failed to connect to at least one server";

    private final TransportClientFactory clientFactory;

    /**
     * 后端标识 -> 最近一次连接失败原因
     */
    private final Map<String, String> failedConnections = new ConcurrentHashMap<>();

    public ConnectionOrchestrator(TransportClientFactory clientFactory) {
        this.clientFactory = clientFactory;
    }

    /**
     * 连接单个后端
     * 失败以 ConnectionException 传播，同时记录失败原因
     */
    public Mono<TransportClient> connectOne(String identifier, BackendConfig config) {
        return Mono.defer(() -> {
                    TransportClient client = clientFactory.create(identifier, config);
                    return client.connect(config)
                            .timeout(Duration.ofMillis(config.getTimeout()))
                            .thenReturn(client)
                            .onErrorResume(e -> closeQuietly(identifier, client).then(Mono.error(e)));
                })
                .doOnSuccess(client -> {
                    clearFailure(identifier);
                    log.info("Connected to server '{}' ({})", identifier, config.getType());
                })
                .onErrorMap(e -> !(e instanceof ConnectionException),
                        e -> new ConnectionException(identifier, describe(e, config), e))
                .doOnError(e -> {
                    recordFailure(identifier, rootMessage(e));
                    log.warn("{}", e.getMessage());
                });
    }

    /**
     * 并发连接一批后端，等待全部结束
     * 单个失败不会中断其他连接，结果中保留每个后端的结局
     */
    public Mono<List<ConnectionOutcome>> connectAll(Map<String, BackendConfig> descriptors) {
        return Flux.fromIterable(descriptors.entrySet())
                .flatMap(entry -> connectOne(entry.getKey(), entry.getValue())
                        .map(client -> ConnectionOutcome.success(entry.getKey(), entry.getValue(), client))
                        .onErrorResume(e -> Mono.just(
                                ConnectionOutcome.failure(entry.getKey(), entry.getValue(), rootMessage(e)))))
                .collectList();
    }

    /**
     * 评估批量连接结果
     * <ul>
     *   <li>STRICT：任一失败即整体失败</li>
     *   <li>LENIENT：至少一个成功即可（空批次视为成功）</li>
     *   <li>无论批次模式如何，自身要求 STRICT 的后端失败都会导致整体失败</li>
     * </ul>
     *
     * @param mode      批次模式
     * @param attempted 本批次尝试的后端数
     * @param failures  失败的后端 -> 原因（包含注册阶段的失败）
     * @param configs   本批次的后端配置，用于读取单个后端的连接要求
     * @throws BatchConnectionPolicyException 未满足策略
     */
    public void evaluate(ConnectionMode mode, int attempted, Map<String, String> failures,
                         Map<String, BackendConfig> configs) {
        if (failures.isEmpty()) {
            return;
        }

        if (mode == ConnectionMode.STRICT) {
            throw new BatchConnectionPolicyException(STRICT_FAILURE_SUMMARY, failures);
        }

        Map<String, String> strictFailures = new LinkedHashMap<>();
        failures.forEach((id, error) -> {
            BackendConfig config = configs.get(id);
            if (config != null && config.getConnectionMode() == ConnectionMode.STRICT) {
                strictFailures.put(id, error);
            }
        });
        if (!strictFailures.isEmpty()) {
            throw new BatchConnectionPolicyException(STRICT_FAILURE_SUMMARY, strictFailures);
        }

        int succeeded = attempted - failures.size();
        if (attempted > 0 && succeeded < 1) {
            throw new BatchConnectionPolicyException(LENIENT_FAILURE_SUMMARY, failures);
        }
        log.warn("Some servers failed to connect, continuing with {} of {}: {}",
                succeeded, attempted, failures.keySet());
    }

    public void recordFailure(String identifier, String error) {
        failedConnections.put(identifier, error == null ? "unknown error" : error);
    }

    public void clearFailure(String identifier) {
        failedConnections.remove(identifier);
    }

    public void clearAllFailures() {
        failedConnections.clear();
    }

    /**
     * 最近一次连接失败的后端及原因（快照）
     */
    public Map<String, String> getFailedConnections() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(failedConnections));
    }

    private Mono<Void> closeQuietly(String identifier, TransportClient client) {
        return client.disconnect()
                .onErrorResume(e -> {
                    log.debug("Error closing failed client for '{}': {}", identifier, e.getMessage());
                    return Mono.empty();
                });
    }

    private String describe(Throwable e, BackendConfig config) {
        if (e instanceof TimeoutException) {
            return "connection timed out after " + config.getTimeout() + "ms";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * ConnectionException 的消息已带有前缀，记录时只取原因部分
     */
    private String rootMessage(Throwable e) {
        if (e instanceof ConnectionException) {
            return ((ConnectionException) e).getReason();
        }
        return e.getMessage();
    }
}
