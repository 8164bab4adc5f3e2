package io.leavesfly.switchboard.router;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.switchboard.config.SwitchboardConfig;
import io.leavesfly.switchboard.confirmation.ConfirmationProvider;
import io.leavesfly.switchboard.confirmation.ConfirmationProviderFactory;
import io.leavesfly.switchboard.confirmation.allowlist.AllowListProvider;
import io.leavesfly.switchboard.confirmation.allowlist.AllowListProviderFactory;
import io.leavesfly.switchboard.connection.ConnectionOrchestrator;
import io.leavesfly.switchboard.transport.TransportClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * 路由器工厂（Spring Service）
 * 负责按配置组装名单、审批、连接编排与路由器，并连接配置中的全部后端
 */
@Slf4j
@Service
public class SwitchboardFactory {

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TransportClientFactory transportClientFactory;

    /**
     * 只组装，不连接
     */
    public CapabilityRouter createRouter(SwitchboardConfig config) {
        AllowListProvider allowList = AllowListProviderFactory.create(config.getConfirmation(), objectMapper);
        ConfirmationProvider confirmation = ConfirmationProviderFactory.create(config.getConfirmation(), allowList);
        ConnectionOrchestrator orchestrator = new ConnectionOrchestrator(transportClientFactory);
        return new CapabilityRouter(orchestrator, confirmation, config.getQualifiedNameDelimiter());
    }

    /**
     * 组装并按配置初始化全部后端
     */
    public Mono<CapabilityRouter> create(SwitchboardConfig config) {
        return Mono.defer(() -> {
            CapabilityRouter router = createRouter(config);
            if (config.getBackends().isEmpty()) {
                log.info("No servers configured");
                return Mono.just(router);
            }
            return router.initialize(config.getBackends(), config.getConnectionMode())
                    .thenReturn(router);
        });
    }
}
