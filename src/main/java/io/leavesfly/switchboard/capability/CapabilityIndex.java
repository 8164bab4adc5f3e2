package io.leavesfly.switchboard.capability;

import io.leavesfly.switchboard.transport.ToolDescriptor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuples;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 能力索引
 * <p>
 * 维护公开名称到后端的映射：
 * <ul>
 *   <li>某个原始名称只由一个后端声明时，以原始名称公开</li>
 *   <li>多个后端声明同一原始名称时，每个后端各自以
 *       {@code 规范化标识 + 分隔符 + 原始名称} 公开，原始名称本身不再公开</li>
 *   <li>冲突消失后（后端移除或不再声明），剩余唯一后端重新以原始名称公开</li>
 * </ul>
 * 冲突检测按能力类型（工具、提示词、资源）各自独立进行。
 * <p>
 * 查询后端在锁外并发进行，结果应用到表时持有对象锁，
 * 因此并发调用方看到的总是某一次应用之后的完整状态。
 */
@Slf4j
public class CapabilityIndex {

    /**
     * 默认限定名分隔符
     */
    public static final String DEFAULT_DELIMITER = "::";

    /**
     * 规范化标识的字符集，分隔符不应完全由这些字符组成
     */
    private static final Pattern SANITIZED_ALPHABET = Pattern.compile("[A-Za-z0-9_-]+");

    /**
     * 原始名称公开的认领优先，其次按原始名称、后端标识
     */
    private static final Comparator<CapabilityEntry> CLAIM_ORDER =
            Comparator.comparing(CapabilityEntry::isQualified)
                    .thenComparing(CapabilityEntry::getRawName)
                    .thenComparing(entry -> entry.getOwner().getIdentifier());

    private final String delimiter;

    /**
     * 参与索引的后端：标识 -> 后端
     */
    private final Map<String, Backend> backends = new HashMap<>();

    /**
     * 规范化标识 -> 后端，用于限定名解析
     */
    private final Map<String, Backend> bySanitized = new HashMap<>();

    /**
     * 各后端最近一次声明的能力
     */
    private final Map<String, BackendCapabilities> contributions = new HashMap<>();

    private final Map<CapabilityKind, KindTable> tables = new EnumMap<>(CapabilityKind.class);

    public CapabilityIndex() {
        this(DEFAULT_DELIMITER);
    }

    public CapabilityIndex(String delimiter) {
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("Qualified name delimiter must not be empty");
        }
        if (SANITIZED_ALPHABET.matcher(delimiter).matches()) {
            log.warn("Qualified name delimiter '{}' uses identifier characters, "
                    + "qualified names may clash with raw capability names", delimiter);
        }
        this.delimiter = delimiter;
        for (CapabilityKind kind : CapabilityKind.values()) {
            tables.put(kind, new KindTable());
        }
    }

    public String getDelimiter() {
        return delimiter;
    }

    /**
     * 生成限定名
     */
    public String qualify(Backend backend, String rawName) {
        return backend.getSanitizedIdentifier() + delimiter + rawName;
    }

    /**
     * 全量重建
     * 并发查询所有已连接后端，任一后端查询失败只会使其能力为空，不会中断重建
     */
    public Mono<Void> rebuildAll(Collection<Backend> candidates) {
        List<Backend> connected = candidates.stream()
                .filter(Backend::isConnected)
                .collect(Collectors.toList());

        return Flux.fromIterable(connected)
                .flatMap(backend -> fetch(backend).map(caps -> Tuples.of(backend, caps)))
                .collectList()
                .doOnNext(results -> {
                    Map<Backend, BackendCapabilities> snapshot = new LinkedHashMap<>();
                    results.forEach(t -> snapshot.put(t.getT1(), t.getT2()));
                    applyRebuild(snapshot);
                })
                .then();
    }

    /**
     * 增量刷新单个后端
     * 只重新计算该后端前后声明过的原始名称
     */
    public Mono<Void> refreshOne(Backend backend) {
        if (!backend.isConnected()) {
            return Mono.fromRunnable(() -> removeBackend(backend));
        }
        return fetch(backend)
                .doOnNext(caps -> applyContribution(backend, caps))
                .then();
    }

    /**
     * 从索引中移除后端，与其冲突的名称会恢复为原始名称
     */
    public synchronized void removeBackend(Backend backend) {
        String id = backend.getIdentifier();
        if (!backends.containsKey(id)) {
            return;
        }
        applyContribution(backend, BackendCapabilities.EMPTY);
        Backend removed = backends.remove(id);
        contributions.remove(id);
        if (removed != null) {
            bySanitized.remove(removed.getSanitizedIdentifier());
        }
        log.debug("Removed server '{}' from capability index", id);
    }

    /**
     * 按公开名称查找工具所属后端
     */
    public Optional<Backend> lookup(String publicName) {
        return lookup(CapabilityKind.TOOL, publicName);
    }

    public Optional<Backend> lookup(CapabilityKind kind, String publicName) {
        return lookupEntry(kind, publicName).map(CapabilityEntry::getOwner);
    }

    public synchronized Optional<CapabilityEntry> lookupEntry(CapabilityKind kind, String publicName) {
        if (publicName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tables.get(kind).published.get(publicName));
    }

    /**
     * 解析限定名
     * <p>
     * 依次尝试分隔符的每个出现位置，优先最长的已知规范化标识前缀，
     * 且要求该后端确实声明了剩余部分作为原始名称。
     * 与冲突状态无关，因此冲突消失后旧的限定名仍能解析。
     */
    public synchronized Optional<ResolvedName> resolveQualified(CapabilityKind kind, String name) {
        if (name == null) {
            return Optional.empty();
        }
        int idx = name.lastIndexOf(delimiter);
        while (idx > 0) {
            String prefix = name.substring(0, idx);
            String raw = name.substring(idx + delimiter.length());
            Backend backend = bySanitized.get(prefix);
            if (backend != null && !raw.isEmpty() && owns(kind, backend, raw)) {
                return Optional.of(new ResolvedName(backend, raw));
            }
            idx = name.lastIndexOf(delimiter, idx - 1);
        }
        return Optional.empty();
    }

    public Optional<ResolvedName> resolveQualified(String name) {
        return resolveQualified(CapabilityKind.TOOL, name);
    }

    /**
     * 猜测限定名前缀对应的已知后端，不要求该后端声明过剩余部分
     * 用于缓存未命中时决定刷新哪个后端
     */
    public synchronized Optional<Backend> guessOwner(String name) {
        if (name == null) {
            return Optional.empty();
        }
        int idx = name.lastIndexOf(delimiter);
        while (idx > 0) {
            Backend backend = bySanitized.get(name.substring(0, idx));
            if (backend != null) {
                return Optional.of(backend);
            }
            idx = name.lastIndexOf(delimiter, idx - 1);
        }
        return Optional.empty();
    }

    /**
     * 当前公开名称表的快照（按名称排序）
     */
    public synchronized Map<String, CapabilityEntry> snapshot(CapabilityKind kind) {
        return Collections.unmodifiableMap(new TreeMap<>(tables.get(kind).published));
    }

    /**
     * 当前处于冲突状态的原始名称
     */
    public synchronized Set<String> getConflicts(CapabilityKind kind) {
        return tables.get(kind).owners.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * 以公开名称列出全部工具描述
     * 冲突工具的描述会附加来源后端
     */
    public synchronized Map<String, ToolDescriptor> getToolDescriptors() {
        Map<String, ToolDescriptor> result = new TreeMap<>();
        tables.get(CapabilityKind.TOOL).published.forEach((publicName, entry) -> {
            BackendCapabilities caps = contributions.get(entry.getOwner().getIdentifier());
            ToolDescriptor original = caps != null ? caps.getTools().get(entry.getRawName()) : null;
            ToolDescriptor.ToolDescriptorBuilder builder = original != null
                    ? original.toBuilder()
                    : ToolDescriptor.builder();
            builder.name(publicName);
            if (entry.isQualified()) {
                String description = original != null ? original.getDescription() : null;
                String via = entry.getOwner().getIdentifier();
                builder.description(description == null || description.isBlank()
                        ? "Tool from " + via
                        : description + " (via " + via + ")");
            }
            result.put(publicName, builder.build());
        });
        return result;
    }

    public synchronized void clear() {
        backends.clear();
        bySanitized.clear();
        contributions.clear();
        tables.values().forEach(KindTable::clear);
    }

    // ==================== 内部实现 ====================

    private Mono<BackendCapabilities> fetch(Backend backend) {
        String id = backend.getIdentifier();
        Mono<Map<String, ToolDescriptor>> tools = Mono.defer(() -> backend.getClient().listTools())
                .defaultIfEmpty(Map.of())
                .onErrorResume(e -> {
                    log.warn("Failed to list tools from server '{}': {}", id, e.getMessage());
                    return Mono.just(Map.of());
                });
        Mono<List<String>> prompts = Mono.defer(() -> backend.getClient().listPrompts())
                .defaultIfEmpty(List.of())
                .onErrorResume(e -> {
                    log.warn("Failed to list prompts from server '{}': {}", id, e.getMessage());
                    return Mono.just(List.of());
                });
        Mono<List<String>> resources = Mono.defer(() -> backend.getClient().listResources())
                .defaultIfEmpty(List.of())
                .onErrorResume(e -> {
                    log.warn("Failed to list resources from server '{}': {}", id, e.getMessage());
                    return Mono.just(List.of());
                });
        return Mono.zip(tools, prompts, resources)
                .map(t -> new BackendCapabilities(t.getT1(), t.getT2(), t.getT3()));
    }

    private synchronized void applyRebuild(Map<Backend, BackendCapabilities> snapshot) {
        clear();
        snapshot.forEach((backend, caps) -> {
            track(backend, caps);
            for (CapabilityKind kind : CapabilityKind.values()) {
                KindTable table = tables.get(kind);
                for (String raw : caps.names(kind)) {
                    table.owners.computeIfAbsent(raw, k -> new TreeMap<>()).put(backend.getIdentifier(), backend);
                }
            }
        });
        for (CapabilityKind kind : CapabilityKind.values()) {
            KindTable table = tables.get(kind);
            for (String raw : new ArrayList<>(table.owners.keySet())) {
                recompute(kind, raw);
            }
        }
        log.info("Capability index rebuilt: {} servers, {} tools, {} prompts, {} resources",
                snapshot.size(),
                tables.get(CapabilityKind.TOOL).published.size(),
                tables.get(CapabilityKind.PROMPT).published.size(),
                tables.get(CapabilityKind.RESOURCE).published.size());
    }

    private synchronized void applyContribution(Backend backend, BackendCapabilities caps) {
        String id = backend.getIdentifier();
        BackendCapabilities previous = contributions.getOrDefault(id, BackendCapabilities.EMPTY);
        track(backend, caps);

        for (CapabilityKind kind : CapabilityKind.values()) {
            KindTable table = tables.get(kind);
            Set<String> affected = new LinkedHashSet<>(previous.names(kind));
            affected.addAll(caps.names(kind));

            for (String raw : previous.names(kind)) {
                Map<String, Backend> owners = table.owners.get(raw);
                if (owners != null) {
                    owners.remove(id);
                }
            }
            for (String raw : caps.names(kind)) {
                table.owners.computeIfAbsent(raw, k -> new TreeMap<>()).put(id, backend);
            }
            for (String raw : affected) {
                recompute(kind, raw);
            }
        }
    }

    private void track(Backend backend, BackendCapabilities caps) {
        Backend previous = backends.put(backend.getIdentifier(), backend);
        if (previous != null && !previous.getSanitizedIdentifier().equals(backend.getSanitizedIdentifier())) {
            bySanitized.remove(previous.getSanitizedIdentifier());
        }
        bySanitized.put(backend.getSanitizedIdentifier(), backend);
        contributions.put(backend.getIdentifier(), caps);
    }

    private boolean owns(CapabilityKind kind, Backend backend, String raw) {
        BackendCapabilities caps = contributions.get(backend.getIdentifier());
        return caps != null && caps.names(kind).contains(raw);
    }

    /**
     * 重新计算某个原始名称的公开项
     * 先撤回该名称原有的认领，再按当前所属后端重新认领，最后裁决前后涉及的每个公开名称
     */
    private void recompute(CapabilityKind kind, String raw) {
        KindTable table = tables.get(kind);
        Set<String> affected = new LinkedHashSet<>();

        List<CapabilityEntry> previousClaims = table.claimsByRaw.remove(raw);
        int previousCount = previousClaims == null ? 0 : previousClaims.size();
        if (previousClaims != null) {
            for (CapabilityEntry claim : previousClaims) {
                Set<String> claimants = table.claimants.get(claim.getPublicName());
                if (claimants != null) {
                    claimants.remove(raw);
                }
                affected.add(claim.getPublicName());
            }
        }

        Map<String, Backend> owners = table.owners.get(raw);
        if (owners == null || owners.isEmpty()) {
            table.owners.remove(raw);
        } else {
            List<CapabilityEntry> claims = new ArrayList<>();
            if (owners.size() == 1) {
                Backend owner = owners.values().iterator().next();
                if (previousCount > 1) {
                    log.info("{} '{}' is no longer in conflict, exposed again under its original name", kind, raw);
                }
                claims.add(new CapabilityEntry(raw, raw, owner, kind));
            } else {
                if (previousCount <= 1) {
                    log.warn("{} name conflict detected for '{}' across servers {}, exposing qualified names",
                            kind, raw, owners.keySet());
                }
                for (Backend owner : owners.values()) {
                    claims.add(new CapabilityEntry(qualify(owner, raw), raw, owner, kind));
                }
            }
            table.claimsByRaw.put(raw, claims);
            for (CapabilityEntry claim : claims) {
                table.claimants.computeIfAbsent(claim.getPublicName(), k -> new TreeSet<>()).add(raw);
                affected.add(claim.getPublicName());
            }
        }

        for (String publicName : affected) {
            settle(kind, table, publicName);
        }
    }

    /**
     * 裁决公开名称的归属
     * <p>
     * 限定名可能恰好等于另一个后端声明的原始名称，此时同一公开名称有多个认领方：
     * 以原始名称公开的一方优先，其余按原始名称、后端标识排序。
     * 落选方不公开，认领方变化后重新裁决，因此落选方会在冲突消失后恢复。
     */
    private void settle(CapabilityKind kind, KindTable table, String publicName) {
        List<CapabilityEntry> candidates = new ArrayList<>();
        Set<String> claimants = table.claimants.getOrDefault(publicName, Collections.emptySet());
        for (String raw : claimants) {
            for (CapabilityEntry claim : table.claimsByRaw.getOrDefault(raw, List.of())) {
                if (claim.getPublicName().equals(publicName)) {
                    candidates.add(claim);
                }
            }
        }
        if (candidates.isEmpty()) {
            table.claimants.remove(publicName);
            table.published.remove(publicName);
            return;
        }

        candidates.sort(CLAIM_ORDER);
        CapabilityEntry winner = candidates.get(0);
        CapabilityEntry previous = table.published.put(publicName, winner);
        if (candidates.size() > 1 && !sameClaim(previous, winner)) {
            for (CapabilityEntry hidden : candidates.subList(1, candidates.size())) {
                log.warn("{} public name '{}' is claimed by '{}' of server '{}' and '{}' of server '{}', "
                                + "only the former is exposed",
                        kind, publicName, winner.getRawName(), winner.getOwner().getIdentifier(),
                        hidden.getRawName(), hidden.getOwner().getIdentifier());
            }
        }
    }

    private static boolean sameClaim(CapabilityEntry a, CapabilityEntry b) {
        return a != null && b != null
                && a.getRawName().equals(b.getRawName())
                && a.getOwner().getIdentifier().equals(b.getOwner().getIdentifier());
    }

    /**
     * 单一能力类型的索引表
     */
    private static class KindTable {

        /**
         * 原始名称 -> (后端标识 -> 后端)，按标识排序保证结果确定
         */
        final Map<String, Map<String, Backend>> owners = new HashMap<>();

        /**
         * 原始名称 -> 其认领的公开项（唯一所属时一个，冲突时每个后端一个限定名）
         */
        final Map<String, List<CapabilityEntry>> claimsByRaw = new HashMap<>();

        /**
         * 公开名称 -> 认领它的原始名称
         */
        final Map<String, Set<String>> claimants = new HashMap<>();

        /**
         * 公开名称 -> 裁决后的公开项
         */
        final Map<String, CapabilityEntry> published = new HashMap<>();

        void clear() {
            owners.clear();
            claimsByRaw.clear();
            claimants.clear();
            published.clear();
        }
    }
}
