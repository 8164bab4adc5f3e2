package io.leavesfly.switchboard.confirmation;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * 固定应答：全部批准或全部拒绝
 */
@Slf4j
public class AutoConfirmationProvider implements ConfirmationProvider {

    private final boolean approve;

    public AutoConfirmationProvider(boolean approve) {
        this.approve = approve;
    }

    @Override
    public Mono<Boolean> requestConfirmation(String toolName, Map<String, Object> args,
                                             String description, String scopeId) {
        log.debug("Auto-{} '{}'", approve ? "approving" : "denying", toolName);
        return Mono.just(approve);
    }

    public boolean isApprove() {
        return approve;
    }
}
