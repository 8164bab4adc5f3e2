package io.leavesfly.switchboard.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.leavesfly.switchboard.capability.CapabilityIndex;
import io.leavesfly.switchboard.connection.ConnectionMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Switchboard 全局配置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwitchboardConfig {

    /**
     * 后端配置，键为后端标识
     */
    @JsonProperty("mcp_servers")
    @Builder.Default
    private Map<String, BackendConfig> backends = new LinkedHashMap<>();

    /**
     * 初始化批次的成功策略
     */
    @JsonProperty("connection_mode")
    @Builder.Default
    private ConnectionMode connectionMode = ConnectionMode.LENIENT;

    /**
     * 限定名分隔符
     */
    @JsonProperty("qualified_name_delimiter")
    @Builder.Default
    private String qualifiedNameDelimiter = CapabilityIndex.DEFAULT_DELIMITER;

    @JsonProperty("tool_confirmation")
    @Builder.Default
    private ConfirmationConfig confirmation = ConfirmationConfig.builder().build();

    /**
     * 校验配置
     */
    public void validate() {
        if (backends == null) {
            backends = new LinkedHashMap<>();
        }
        if (connectionMode == null) {
            connectionMode = ConnectionMode.LENIENT;
        }
        if (confirmation == null) {
            confirmation = ConfirmationConfig.builder().build();
        }
        if (qualifiedNameDelimiter == null || qualifiedNameDelimiter.isEmpty()) {
            throw new IllegalStateException("qualified_name_delimiter must not be empty");
        }
        if (confirmation.getTimeoutMs() <= 0) {
            throw new IllegalStateException("tool_confirmation.timeout_ms must be positive");
        }
        if (confirmation.getAllowedToolsStorage() == ConfirmationConfig.Storage.FILE
                && (confirmation.getAllowedToolsFile() == null || confirmation.getAllowedToolsFile().isBlank())) {
            throw new IllegalStateException("tool_confirmation.allowed_tools_file is required for file storage");
        }
        backends.forEach((name, backend) -> backend.validate(name));
    }
}
