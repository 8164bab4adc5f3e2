package io.leavesfly.switchboard.confirmation;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * 能力执行前的审批
 */
public interface ConfirmationProvider {

    /**
     * 请求审批
     *
     * @param toolName    公开名称
     * @param args        调用参数
     * @param description 展示给审批人的描述，可为 null
     * @param scopeId     名单范围，null 表示全局
     * @return 是否批准；超时或取消以错误结束
     */
    Mono<Boolean> requestConfirmation(String toolName, Map<String, Object> args, String description, String scopeId);
}
