package io.leavesfly.switchboard.confirmation;

import io.leavesfly.switchboard.confirmation.allowlist.InMemoryAllowListProvider;
import io.leavesfly.switchboard.exception.ConfirmationCancelledException;
import io.leavesfly.switchboard.exception.ConfirmationTimeoutException;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConfirmationGate 单元测试
 */
class ConfirmationGateTest {

    private static final long LONG_TIMEOUT = 10_000L;

    private ConfirmationRequest onlyPending(ConfirmationGate gate) {
        List<ConfirmationRequest> pending = gate.getPendingConfirmations();
        assertEquals(1, pending.size());
        return pending.get(0);
    }

    @Test
    void testApproveResolvesTrue() throws Exception {
        ConfirmationGate gate = new ConfirmationGate(new InMemoryAllowListProvider(), LONG_TIMEOUT);

        CompletableFuture<Boolean> result = gate.requestConfirmation("toolA", Map.of("q", 1), "desc", null).toFuture();
        ConfirmationRequest request = onlyPending(gate);
        assertEquals("toolA", request.getToolName());
        assertEquals("desc", request.getDescription());
        assertNotNull(request.getTimestamp());

        gate.handleConfirmationResponse(ConfirmationResponse.approve(request.getExecutionId())).block();

        assertTrue(result.get(1, TimeUnit.SECONDS));
        assertTrue(gate.getPendingConfirmations().isEmpty());
    }

    @Test
    void testDenyResolvesFalse() throws Exception {
        ConfirmationGate gate = new ConfirmationGate(new InMemoryAllowListProvider(), LONG_TIMEOUT);

        CompletableFuture<Boolean> result = gate.requestConfirmation("toolA", Map.of(), null, null).toFuture();
        gate.handleConfirmationResponse(ConfirmationResponse.deny(onlyPending(gate).getExecutionId())).block();

        assertFalse(result.get(1, TimeUnit.SECONDS));
    }

    @Test
    void testRememberChoiceSkipsLaterConfirmations() throws Exception {
        InMemoryAllowListProvider allowList = new InMemoryAllowListProvider();
        ConfirmationGate gate = new ConfirmationGate(allowList, LONG_TIMEOUT);

        CompletableFuture<Boolean> first = gate.requestConfirmation("toolA", Map.of(), null, "user-1").toFuture();
        gate.handleConfirmationResponse(ConfirmationResponse.approveAndRemember(onlyPending(gate).getExecutionId()))
                .block();
        assertTrue(first.get(1, TimeUnit.SECONDS));
        assertTrue(allowList.isAllowed("toolA", "user-1").block());

        // 第二次请求直接通过，不产生等待中的审批
        Boolean second = gate.requestConfirmation("toolA", Map.of(), null, "user-1").block();
        assertEquals(Boolean.TRUE, second);
        assertTrue(gate.getPendingConfirmations().isEmpty());

        // 其他范围仍需审批
        CompletableFuture<Boolean> otherScope = gate.requestConfirmation("toolA", Map.of(), null, "user-2").toFuture();
        assertEquals(1, gate.getPendingConfirmations().size());
        gate.cancelAll();
        assertTrue(otherScope.isCompletedExceptionally());
    }

    @Test
    void testGloballyAllowedShortCircuitsAnyScope() {
        InMemoryAllowListProvider allowList = new InMemoryAllowListProvider();
        allowList.allow("toolA", null).block();
        ConfirmationGate gate = new ConfirmationGate(allowList, LONG_TIMEOUT);
        List<ConfirmationRequest> emitted = new CopyOnWriteArrayList<>();
        Disposable subscription = gate.asFlux().subscribe(emitted::add);

        assertEquals(Boolean.TRUE, gate.requestConfirmation("toolA", Map.of(), null, "user-1").block());
        assertTrue(emitted.isEmpty(), "已批准的名称不应发布审批请求");
        subscription.dispose();
    }

    @Test
    void testTimeoutRejectsAndLateResponseIsIgnored() {
        ConfirmationGate gate = new ConfirmationGate(new InMemoryAllowListProvider(), 100);
        List<ConfirmationRequest> emitted = new CopyOnWriteArrayList<>();
        Disposable subscription = gate.asFlux().subscribe(emitted::add);

        ConfirmationTimeoutException e = assertThrows(ConfirmationTimeoutException.class,
                () -> gate.requestConfirmation("slowTool", Map.of(), null, null).block());
        assertTrue(e.getMessage().contains("slowTool"), "超时错误应包含名称");
        assertTrue(gate.getPendingConfirmations().isEmpty());

        // 迟到的回复静默忽略
        String executionId = emitted.get(0).getExecutionId();
        assertDoesNotThrow(() -> gate.handleConfirmationResponse(ConfirmationResponse.approve(executionId)).block());
        assertTrue(gate.getPendingConfirmations().isEmpty());
        subscription.dispose();
    }

    @Test
    void testCancelAllRejectsEveryPendingConfirmation() {
        ConfirmationGate gate = new ConfirmationGate(new InMemoryAllowListProvider(), LONG_TIMEOUT);

        CompletableFuture<Boolean> first = gate.requestConfirmation("toolA", Map.of(), null, null).toFuture();
        CompletableFuture<Boolean> second = gate.requestConfirmation("toolB", Map.of(), null, null).toFuture();
        assertEquals(2, gate.getPendingConfirmations().size());

        gate.cancelAll();

        // 取消是同步的，返回时两个等待方都已结束
        assertTrue(first.isCompletedExceptionally());
        assertTrue(second.isCompletedExceptionally());
        ExecutionException e = assertThrows(ExecutionException.class, first::get);
        assertInstanceOf(ConfirmationCancelledException.class, e.getCause());
        assertTrue(gate.getPendingConfirmations().isEmpty());
    }

    @Test
    void testCancelSingleConfirmation() {
        ConfirmationGate gate = new ConfirmationGate(new InMemoryAllowListProvider(), LONG_TIMEOUT);

        CompletableFuture<Boolean> first = gate.requestConfirmation("toolA", Map.of(), null, null).toFuture();
        CompletableFuture<Boolean> second = gate.requestConfirmation("toolB", Map.of(), null, null).toFuture();
        String firstId = gate.getPendingConfirmations().stream()
                .filter(r -> r.getToolName().equals("toolA"))
                .findFirst()
                .orElseThrow()
                .getExecutionId();

        gate.cancelConfirmation(firstId);

        assertTrue(first.isCompletedExceptionally());
        assertFalse(second.isDone());
        assertEquals(1, gate.getPendingConfirmations().size());

        // 再次取消与取消未知 ID 都是空操作
        assertDoesNotThrow(() -> gate.cancelConfirmation(firstId));
        assertDoesNotThrow(() -> gate.cancelConfirmation("unknown"));
        gate.cancelAll();
    }

    @Test
    void testDuplicateResponseIsNoOp() throws Exception {
        ConfirmationGate gate = new ConfirmationGate(new InMemoryAllowListProvider(), LONG_TIMEOUT);

        CompletableFuture<Boolean> result = gate.requestConfirmation("toolA", Map.of(), null, null).toFuture();
        String executionId = onlyPending(gate).getExecutionId();

        gate.handleConfirmationResponse(ConfirmationResponse.approve(executionId)).block();
        assertDoesNotThrow(() -> gate.handleConfirmationResponse(ConfirmationResponse.deny(executionId)).block());
        assertDoesNotThrow(() -> gate.handleConfirmationResponse(ConfirmationResponse.deny("unknown")).block());

        assertTrue(result.get(1, TimeUnit.SECONDS), "第一次回复生效");
    }

    @Test
    void testRequestsArePublished() {
        ConfirmationGate gate = new ConfirmationGate(new InMemoryAllowListProvider(), LONG_TIMEOUT);
        List<ConfirmationRequest> emitted = new CopyOnWriteArrayList<>();
        Disposable subscription = gate.asFlux().subscribe(emitted::add);

        gate.requestConfirmation("toolA", Map.of("path", "/tmp"), "Call tool", "user-1").toFuture();

        assertEquals(1, emitted.size());
        ConfirmationRequest request = emitted.get(0);
        assertEquals("toolA", request.getToolName());
        assertEquals(Map.of("path", "/tmp"), request.getArgs());
        assertEquals("user-1", request.getScopeId());
        assertEquals(request.getExecutionId(), onlyPending(gate).getExecutionId());

        gate.cancelAll();
        subscription.dispose();
    }

    @Test
    void testDisposingWaiterRemovesPendingConfirmation() {
        ConfirmationGate gate = new ConfirmationGate(new InMemoryAllowListProvider(), LONG_TIMEOUT);

        Disposable waiter = gate.requestConfirmation("toolA", Map.of(), null, null).subscribe();
        assertEquals(1, gate.getPendingConfirmations().size());

        waiter.dispose();

        assertTrue(gate.getPendingConfirmations().isEmpty());
    }
}
