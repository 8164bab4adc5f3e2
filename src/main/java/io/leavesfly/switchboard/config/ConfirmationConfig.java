package io.leavesfly.switchboard.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 工具执行审批配置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfirmationConfig {

    public static final long DEFAULT_TIMEOUT_MS = 120_000L;

    /**
     * 审批模式
     */
    @JsonProperty("mode")
    @Builder.Default
    private Mode mode = Mode.EVENT_BASED;

    /**
     * 等待审批的超时时间（毫秒）
     */
    @JsonProperty("timeout_ms")
    @Builder.Default
    private long timeoutMs = DEFAULT_TIMEOUT_MS;

    /**
     * 已批准工具列表的存储方式
     */
    @JsonProperty("allowed_tools_storage")
    @Builder.Default
    private Storage allowedToolsStorage = Storage.MEMORY;

    /**
     * file 存储时的文件路径
     */
    @JsonProperty("allowed_tools_file")
    private String allowedToolsFile;

    public enum Mode {
        @JsonProperty("event-based") EVENT_BASED,

        @JsonProperty("auto-approve") AUTO_APPROVE,

        @JsonProperty("auto-deny") AUTO_DENY;

        public String getValue() {
            return name().toLowerCase().replace('_', '-');
        }

        public static Mode fromValue(String value) {
            for (Mode mode : values()) {
                if (mode.getValue().equalsIgnoreCase(value)) {
                    return mode;
                }
            }
            throw new IllegalArgumentException("Unknown confirmation mode: " + value
                    + " (expected event-based, auto-approve or auto-deny)");
        }
    }

    public enum Storage {
        @JsonProperty("memory") MEMORY,

        @JsonProperty("file") FILE
    }
}
