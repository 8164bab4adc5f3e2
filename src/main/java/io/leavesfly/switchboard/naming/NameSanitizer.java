package io.leavesfly.switchboard.naming;

import io.leavesfly.switchboard.exception.NameCollisionException;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 后端标识规范化器
 * <p>
 * 将任意后端标识映射为可安全嵌入限定名的规范形式：
 * 字母、数字、连字符、下划线之外的字符替换为占位符，连续占位符折叠为一个。
 * 同时维护 规范形式 -> 原始标识 的注册表，检测两个不同标识规范化后相同的冲突。
 */
@Slf4j
public class NameSanitizer {

    public static final char PLACEHOLDER = '_';

    private static final Pattern UNSAFE_RUN = Pattern.compile("[^A-Za-z0-9_-]+");

    private final Map<String, String> canonicalToIdentifier = new HashMap<>();

    /**
     * 规范化标识（纯函数）
     */
    public String sanitize(String identifier) {
        if (identifier == null) {
            return "";
        }
        // 一段连续的非法字符只产生一个占位符
        return UNSAFE_RUN.matcher(identifier).replaceAll(String.valueOf(PLACEHOLDER));
    }

    /**
     * 注册标识的规范形式
     *
     * @return 规范形式
     * @throws NameCollisionException 规范形式已被另一个标识占用
     */
    public synchronized String registerCanonical(String identifier) {
        String canonical = sanitize(identifier);
        String existing = canonicalToIdentifier.get(canonical);
        if (existing != null && !existing.equals(identifier)) {
            throw new NameCollisionException(identifier, existing, canonical);
        }
        if (existing == null) {
            canonicalToIdentifier.put(canonical, identifier);
            log.debug("Registered canonical name '{}' for '{}'", canonical, identifier);
        }
        return canonical;
    }

    /**
     * 检查注册是否会冲突（不修改状态）
     */
    public synchronized void checkAvailable(String identifier) {
        String canonical = sanitize(identifier);
        String existing = canonicalToIdentifier.get(canonical);
        if (existing != null && !existing.equals(identifier)) {
            throw new NameCollisionException(identifier, existing, canonical);
        }
    }

    /**
     * 注销标识，释放其规范形式
     */
    public synchronized void unregister(String identifier) {
        String canonical = sanitize(identifier);
        if (identifier != null && identifier.equals(canonicalToIdentifier.get(canonical))) {
            canonicalToIdentifier.remove(canonical);
            log.debug("Released canonical name '{}'", canonical);
        }
    }

    /**
     * 根据规范形式查找原始标识
     */
    public synchronized Optional<String> findIdentifier(String canonical) {
        return Optional.ofNullable(canonicalToIdentifier.get(canonical));
    }

    public synchronized boolean isRegistered(String identifier) {
        return identifier != null && identifier.equals(canonicalToIdentifier.get(sanitize(identifier)));
    }

    public synchronized void clear() {
        canonicalToIdentifier.clear();
    }

    public synchronized int size() {
        return canonicalToIdentifier.size();
    }
}
