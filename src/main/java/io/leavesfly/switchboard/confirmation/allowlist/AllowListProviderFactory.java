package io.leavesfly.switchboard.confirmation.allowlist;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.switchboard.config.ConfirmationConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * 按配置创建名单实现
 */
@Slf4j
public final class AllowListProviderFactory {

    private AllowListProviderFactory() {
    }

    public static AllowListProvider create(ConfirmationConfig config, ObjectMapper objectMapper) {
        if (config.getAllowedToolsStorage() == ConfirmationConfig.Storage.FILE) {
            FileAllowListProvider provider = new FileAllowListProvider(
                    FileAllowListProvider.resolvePath(config.getAllowedToolsFile()), objectMapper);
            log.debug("Using file allowed list: {}", provider.getFile());
            return provider;
        }
        return new InMemoryAllowListProvider();
    }
}
