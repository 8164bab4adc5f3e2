package io.leavesfly.switchboard.confirmation.allowlist;

import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * 已批准能力名单
 * <p>
 * scopeId 为 null 表示全局范围。查询时先查给定范围，再回退到全局范围。
 */
public interface AllowListProvider {

    /**
     * 是否已批准
     */
    Mono<Boolean> isAllowed(String toolName, String scopeId);

    /**
     * 加入名单
     */
    Mono<Void> allow(String toolName, String scopeId);

    /**
     * 从名单移除
     */
    Mono<Void> disallow(String toolName, String scopeId);

    /**
     * 某个范围内已批准的名称（不含全局回退）
     */
    Mono<Set<String>> getAllowed(String scopeId);
}
