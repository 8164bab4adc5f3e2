package io.leavesfly.switchboard.confirmation;

import lombok.Getter;
import reactor.core.Disposable;
import reactor.core.publisher.MonoSink;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 等待中的审批
 * 状态只能从 PENDING 迁移一次
 */
class PendingConfirmation {

    @Getter
    private final ConfirmationRequest request;

    private final MonoSink<Boolean> sink;

    private final AtomicReference<ConfirmationState> state = new AtomicReference<>(ConfirmationState.PENDING);

    private volatile Disposable timeoutHandle;

    PendingConfirmation(ConfirmationRequest request, MonoSink<Boolean> sink) {
        this.request = request;
        this.sink = sink;
    }

    void setTimeoutHandle(Disposable timeoutHandle) {
        this.timeoutHandle = timeoutHandle;
    }

    ConfirmationState getState() {
        return state.get();
    }

    /**
     * 迁移到终态
     *
     * @return 本次调用是否完成了迁移
     */
    boolean complete(ConfirmationState terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminal);
        }
        if (!state.compareAndSet(ConfirmationState.PENDING, terminal)) {
            return false;
        }
        Disposable handle = timeoutHandle;
        if (handle != null) {
            handle.dispose();
        }
        return true;
    }

    MonoSink<Boolean> sink() {
        return sink;
    }
}
