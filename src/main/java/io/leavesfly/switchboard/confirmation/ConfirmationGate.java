package io.leavesfly.switchboard.confirmation;

import io.leavesfly.switchboard.confirmation.allowlist.AllowListProvider;
import io.leavesfly.switchboard.exception.ConfirmationCancelledException;
import io.leavesfly.switchboard.exception.ConfirmationTimeoutException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.concurrent.Queues;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * 事件驱动的审批闸门
 * <p>
 * 每次请求生成唯一的执行 ID，请求通过 {@link #asFlux()} 发布给 UI，
 * UI 通过 {@link #handleConfirmationResponse} 回复。等待方在以下任一情况结束：
 * <ul>
 *   <li>收到回复：按回复批准或拒绝，"批准并记住"会写入名单</li>
 *   <li>超时：以 {@link ConfirmationTimeoutException} 结束</li>
 *   <li>取消：以 {@link ConfirmationCancelledException} 结束</li>
 * </ul>
 * 针对未知或已结束执行 ID 的回复与取消都会被忽略。
 */
@Slf4j
public class ConfirmationGate implements ConfirmationProvider {

    private final AllowListProvider allowList;

    private final long timeoutMs;

    private final Scheduler timer;

    /**
     * 执行 ID -> 等待中的审批
     */
    private final Map<String, PendingConfirmation> pending = new ConcurrentHashMap<>();

    /**
     * 待处理的审批请求队列
     */
    private final Sinks.Many<ConfirmationRequest> requestQueue;

    public ConfirmationGate(AllowListProvider allowList, long timeoutMs) {
        this(allowList, timeoutMs, Schedulers.parallel());
    }

    public ConfirmationGate(AllowListProvider allowList, long timeoutMs, Scheduler timer) {
        this.allowList = allowList;
        this.timeoutMs = timeoutMs;
        this.timer = timer;
        // 订阅方全部取消后仍保留队列，UI 可以重新订阅
        this.requestQueue = Sinks.many().multicast().onBackpressureBuffer(Queues.SMALL_BUFFER_SIZE, false);
    }

    @Override
    public Mono<Boolean> requestConfirmation(String toolName, Map<String, Object> args,
                                             String description, String scopeId) {
        return allowList.isAllowed(toolName, scopeId)
                .onErrorResume(e -> {
                    log.warn("Failed to check allowed list for '{}': {}", toolName, e.getMessage());
                    return Mono.just(false);
                })
                .flatMap(allowed -> {
                    if (Boolean.TRUE.equals(allowed)) {
                        log.debug("'{}' is in allowed list, skipping confirmation", toolName);
                        return Mono.just(true);
                    }
                    return awaitResponse(toolName, args, description, scopeId);
                });
    }

    /**
     * 审批请求流，UI 层订阅
     */
    public Flux<ConfirmationRequest> asFlux() {
        return requestQueue.asFlux();
    }

    /**
     * 处理外部回复
     */
    public Mono<Void> handleConfirmationResponse(ConfirmationResponse response) {
        return Mono.defer(() -> {
            PendingConfirmation confirmation = pending.get(response.getExecutionId());
            if (confirmation == null) {
                log.debug("Ignoring response for unknown execution {}", response.getExecutionId());
                return Mono.empty();
            }
            ConfirmationState terminal = response.isApproved() ? ConfirmationState.APPROVED : ConfirmationState.DENIED;
            if (!confirmation.complete(terminal)) {
                log.debug("Ignoring response for finished execution {}", response.getExecutionId());
                return Mono.empty();
            }
            pending.remove(response.getExecutionId(), confirmation);

            ConfirmationRequest request = confirmation.getRequest();
            log.info("'{}' {} (execution {})", request.getToolName(),
                    response.isApproved() ? "approved" : "denied", request.getExecutionId());

            Mono<Void> remember = Mono.empty();
            if (response.isApproved() && response.isRememberChoice()) {
                String scope = response.getScopeId() != null ? response.getScopeId() : request.getScopeId();
                remember = allowList.allow(request.getToolName(), scope)
                        .onErrorResume(e -> {
                            log.warn("Failed to remember approval of '{}': {}", request.getToolName(), e.getMessage());
                            return Mono.empty();
                        });
            }
            return remember.then(Mono.fromRunnable(() -> confirmation.sink().success(response.isApproved())));
        });
    }

    /**
     * 取消单个审批，返回前等待方已经结束
     */
    public void cancelConfirmation(String executionId) {
        cancelConfirmation(executionId, "Confirmation cancelled");
    }

    public void cancelConfirmation(String executionId, String reason) {
        PendingConfirmation confirmation = pending.get(executionId);
        if (confirmation == null || !confirmation.complete(ConfirmationState.CANCELLED)) {
            return;
        }
        pending.remove(executionId, confirmation);
        log.info("Confirmation for '{}' cancelled (execution {})",
                confirmation.getRequest().getToolName(), executionId);
        confirmation.sink().error(new ConfirmationCancelledException(executionId, reason));
    }

    /**
     * 取消全部等待中的审批
     */
    public void cancelAll() {
        for (String executionId : new ArrayList<>(pending.keySet())) {
            cancelConfirmation(executionId, "All confirmations cancelled");
        }
    }

    /**
     * 等待中的审批请求快照（按创建时间排序）
     */
    public List<ConfirmationRequest> getPendingConfirmations() {
        List<ConfirmationRequest> snapshot = new ArrayList<>();
        for (PendingConfirmation confirmation : pending.values()) {
            if (confirmation.getState() == ConfirmationState.PENDING) {
                snapshot.add(confirmation.getRequest());
            }
        }
        snapshot.sort(Comparator.comparing(ConfirmationRequest::getTimestamp));
        return Collections.unmodifiableList(snapshot);
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public AllowListProvider getAllowList() {
        return allowList;
    }

    private Mono<Boolean> awaitResponse(String toolName, Map<String, Object> args,
                                        String description, String scopeId) {
        return Mono.<Boolean>create(sink -> {
            String executionId = UUID.randomUUID().toString();
            ConfirmationRequest request = ConfirmationRequest.builder()
                    .executionId(executionId)
                    .toolName(toolName)
                    .args(args == null ? Map.of() : args)
                    .description(description)
                    .timestamp(Instant.now())
                    .scopeId(scopeId)
                    .build();

            PendingConfirmation confirmation = new PendingConfirmation(request, sink);
            pending.put(executionId, confirmation);
            confirmation.setTimeoutHandle(timer.schedule(() -> onTimeout(executionId), timeoutMs, TimeUnit.MILLISECONDS));

            // 订阅方取消（例如上层 dispose）时清理，不再发出信号
            sink.onCancel(() -> {
                if (confirmation.complete(ConfirmationState.CANCELLED)) {
                    pending.remove(executionId, confirmation);
                    log.debug("Confirmation wait for '{}' disposed by subscriber", toolName);
                }
            });

            emit(request);
            log.debug("Confirmation request sent for '{}' (execution {})", toolName, executionId);
        });
    }

    private void onTimeout(String executionId) {
        PendingConfirmation confirmation = pending.get(executionId);
        if (confirmation == null || !confirmation.complete(ConfirmationState.TIMED_OUT)) {
            return;
        }
        pending.remove(executionId, confirmation);
        String toolName = confirmation.getRequest().getToolName();
        log.warn("Confirmation for '{}' timed out after {}ms", toolName, timeoutMs);
        confirmation.sink().error(new ConfirmationTimeoutException(toolName, timeoutMs));
    }

    private void emit(ConfirmationRequest request) {
        Sinks.EmitResult result;
        synchronized (requestQueue) {
            result = requestQueue.tryEmitNext(request);
        }
        if (result.isFailure()) {
            log.warn("Failed to publish confirmation request {}: {}", request.getExecutionId(), result);
        }
    }
}
