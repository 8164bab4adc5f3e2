package io.leavesfly.switchboard.confirmation.allowlist;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内名单，重启后丢失
 */
@Slf4j
public class InMemoryAllowListProvider implements AllowListProvider {

    static final String GLOBAL_SCOPE = "__global__";

    private final Map<String, Set<String>> allowedByScope = new ConcurrentHashMap<>();

    @Override
    public Mono<Boolean> isAllowed(String toolName, String scopeId) {
        return Mono.fromSupplier(() -> contains(scopeKey(scopeId), toolName)
                || (scopeId != null && contains(GLOBAL_SCOPE, toolName)));
    }

    @Override
    public Mono<Void> allow(String toolName, String scopeId) {
        return Mono.fromRunnable(() -> {
            allowedByScope.computeIfAbsent(scopeKey(scopeId), k -> ConcurrentHashMap.newKeySet()).add(toolName);
            log.info("'{}' added to allowed list (scope: {})", toolName, scopeId == null ? "global" : scopeId);
        });
    }

    @Override
    public Mono<Void> disallow(String toolName, String scopeId) {
        return Mono.fromRunnable(() -> {
            Set<String> tools = allowedByScope.get(scopeKey(scopeId));
            if (tools != null && tools.remove(toolName)) {
                log.info("'{}' removed from allowed list (scope: {})", toolName, scopeId == null ? "global" : scopeId);
            }
        });
    }

    @Override
    public Mono<Set<String>> getAllowed(String scopeId) {
        return Mono.fromSupplier(() -> {
            Set<String> tools = allowedByScope.get(scopeKey(scopeId));
            return tools == null ? Collections.<String>emptySet() : Collections.unmodifiableSet(new TreeSet<>(tools));
        });
    }

    private boolean contains(String scope, String toolName) {
        Set<String> tools = allowedByScope.get(scope);
        return tools != null && tools.contains(toolName);
    }

    private static String scopeKey(String scopeId) {
        return scopeId == null ? GLOBAL_SCOPE : scopeId;
    }
}
