package io.leavesfly.switchboard.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 批量连接未满足成功策略
 * 汇总本批次所有失败后端的错误信息
 */
@Getter
public class BatchConnectionPolicyException extends SwitchboardException {

    /**
     * 失败的后端 -> 错误信息
     */
    private final Map<String, String> failures;

    public BatchConnectionPolicyException(String summary, Map<String, String> failures) {
        super(summary + ". Errors: " + describe(failures));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    private static String describe(Map<String, String> failures) {
        return failures.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("; "));
    }
}
