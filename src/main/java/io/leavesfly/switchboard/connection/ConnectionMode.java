package io.leavesfly.switchboard.connection;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 连接成功要求
 * <p>
 * 作为批量策略时：STRICT 要求本批次全部后端连接成功，LENIENT 至少一个成功；
 * 作为单个后端的要求时：STRICT 表示该后端必须连接成功。
 */
public enum ConnectionMode {

    @JsonProperty("strict") STRICT,

    @JsonProperty("lenient") LENIENT;

    /**
     * 解析命令行取值（不区分大小写）
     */
    public static ConnectionMode fromValue(String value) {
        for (ConnectionMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown connection mode: " + value + " (expected strict or lenient)");
    }
}
