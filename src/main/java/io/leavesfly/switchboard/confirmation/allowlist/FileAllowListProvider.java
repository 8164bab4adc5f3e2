package io.leavesfly.switchboard.confirmation.allowlist;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 基于 JSON 文件的名单
 * <p>
 * 文件格式：{@code {"范围": ["名称", ...]}}，全局范围的键为 {@code __global__}。
 * 首次访问时加载，每次变更后整体重写（先写临时文件再原子替换）。
 * 变更作用在副本上，文件替换成功后才更新内存中的名单，写入失败时两者保持一致。
 */
@Slf4j
public class FileAllowListProvider implements AllowListProvider {

    private static final TypeReference<Map<String, List<String>>> FILE_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;

    /**
     * 范围 -> 名称，延迟加载
     */
    private Map<String, Set<String>> allowedByScope;

    public FileAllowListProvider(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    /**
     * 展开路径开头的 ~
     */
    public static Path resolvePath(String location) {
        if (location.equals("~") || location.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(location.substring(1).replaceFirst("^/", ""));
        }
        return Path.of(location);
    }

    public Path getFile() {
        return file;
    }

    @Override
    public Mono<Boolean> isAllowed(String toolName, String scopeId) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                Map<String, Set<String>> data = load();
                return contains(data, scopeKey(scopeId), toolName)
                        || (scopeId != null && contains(data, InMemoryAllowListProvider.GLOBAL_SCOPE, toolName));
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> allow(String toolName, String scopeId) {
        return Mono.<Void>fromRunnable(() -> {
            synchronized (this) {
                Map<String, Set<String>> data = copy(load());
                if (data.computeIfAbsent(scopeKey(scopeId), k -> new TreeSet<>()).add(toolName)) {
                    save(data);
                    allowedByScope = data;
                    log.info("'{}' persisted to allowed list {} (scope: {})",
                            toolName, file, scopeId == null ? "global" : scopeId);
                }
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> disallow(String toolName, String scopeId) {
        return Mono.<Void>fromRunnable(() -> {
            synchronized (this) {
                Map<String, Set<String>> data = copy(load());
                Set<String> tools = data.get(scopeKey(scopeId));
                if (tools != null && tools.remove(toolName)) {
                    if (tools.isEmpty()) {
                        data.remove(scopeKey(scopeId));
                    }
                    save(data);
                    allowedByScope = data;
                    log.info("'{}' removed from allowed list {}", toolName, file);
                }
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Set<String>> getAllowed(String scopeId) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                Set<String> tools = load().get(scopeKey(scopeId));
                return tools == null
                        ? Collections.<String>emptySet()
                        : Collections.unmodifiableSet(new TreeSet<>(tools));
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private Map<String, Set<String>> load() {
        if (allowedByScope != null) {
            return allowedByScope;
        }
        Map<String, Set<String>> data = new TreeMap<>();
        if (Files.exists(file)) {
            try {
                Map<String, List<String>> raw = objectMapper.readValue(file.toFile(), FILE_TYPE);
                if (raw != null) {
                    raw.forEach((scope, tools) -> data.put(scope, new TreeSet<>(tools)));
                }
                log.debug("Loaded allowed list from {}", file);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read allowed list file: " + file, e);
            }
        }
        allowedByScope = data;
        return data;
    }

    private void save(Map<String, Set<String>> data) {
        Path tmp = null;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), data);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw new UncheckedIOException("Failed to write allowed list file: " + file, e);
        }
    }

    private static Map<String, Set<String>> copy(Map<String, Set<String>> data) {
        Map<String, Set<String>> copy = new TreeMap<>();
        data.forEach((scope, tools) -> copy.put(scope, new TreeSet<>(tools)));
        return copy;
    }

    private static boolean contains(Map<String, Set<String>> data, String scope, String toolName) {
        Set<String> tools = data.get(scope);
        return tools != null && tools.contains(toolName);
    }

    private static String scopeKey(String scopeId) {
        return scopeId == null ? InMemoryAllowListProvider.GLOBAL_SCOPE : scopeId;
    }
}
