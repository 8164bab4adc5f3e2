package io.leavesfly.switchboard.confirmation;

import io.leavesfly.switchboard.config.ConfirmationConfig;
import io.leavesfly.switchboard.confirmation.allowlist.AllowListProvider;
import lombok.extern.slf4j.Slf4j;

/**
 * 按配置创建审批实现
 */
@Slf4j
public final class ConfirmationProviderFactory {

    private ConfirmationProviderFactory() {
    }

    public static ConfirmationProvider create(ConfirmationConfig config, AllowListProvider allowList) {
        switch (config.getMode()) {
            case AUTO_APPROVE:
                log.info("Tool confirmation: auto-approve");
                return new AutoConfirmationProvider(true);
            case AUTO_DENY:
                log.info("Tool confirmation: auto-deny");
                return new AutoConfirmationProvider(false);
            case EVENT_BASED:
            default:
                log.debug("Tool confirmation: event-based, timeout {}ms", config.getTimeoutMs());
                return new ConfirmationGate(allowList, config.getTimeoutMs());
        }
    }
}
