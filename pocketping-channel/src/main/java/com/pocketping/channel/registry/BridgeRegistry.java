package com.pocketping.channel.registry;

import com.pocketping.channel.adapter.BridgeAdapter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the platform adapters enabled for this bridge, with static
 * metadata for every platform the bridge knows about.
 */
@Slf4j
public class BridgeRegistry {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PlatformMeta {
        private String id;
        private String name;
        private List<String> aliases;
        private int order;
    }

    private final Map<String, PlatformMeta> platforms = new ConcurrentHashMap<>();
    private final Map<String, String> aliasMap = new ConcurrentHashMap<>();
    private final Map<String, BridgeAdapter> adapters = new ConcurrentHashMap<>();

    public BridgeRegistry() {
        registerDefaults();
    }

    private void registerDefaults() {
        describe(PlatformMeta.builder()
                .id("telegram").name("Telegram").aliases(List.of("tg"))
                .order(1).build());

        describe(PlatformMeta.builder()
                .id("discord").name("Discord").aliases(List.of("dc"))
                .order(2).build());

        describe(PlatformMeta.builder()
                .id("slack").name("Slack").aliases(List.of())
                .order(3).build());
    }

    public void describe(PlatformMeta meta) {
        platforms.put(meta.getId(), meta);
        if (meta.getAliases() != null) {
            meta.getAliases().forEach(alias -> aliasMap.put(alias, meta.getId()));
        }
    }

    /**
     * Enable an adapter. A second adapter with the same name replaces the first.
     */
    public void register(BridgeAdapter adapter) {
        BridgeAdapter previous = adapters.put(adapter.getName(), adapter);
        if (previous != null && previous != adapter) {
            previous.close();
        }
        log.info("Bridge registered: {}", adapter.getName());
    }

    public void unregister(String name) {
        BridgeAdapter removed = adapters.remove(normalize(name));
        if (removed != null) {
            removed.close();
            log.info("Bridge unregistered: {}", removed.getName());
        }
    }

    /**
     * Normalize a platform identifier (resolve aliases).
     */
    public String normalize(String platform) {
        if (platform == null)
            return null;
        String lower = platform.toLowerCase().trim();
        return aliasMap.getOrDefault(lower, lower);
    }

    public Optional<BridgeAdapter> get(String platform) {
        return Optional.ofNullable(adapters.get(normalize(platform)));
    }

    /** Adapter of the given type, when that platform is enabled. */
    public <T extends BridgeAdapter> Optional<T> get(String platform, Class<T> type) {
        return get(platform).filter(type::isInstance).map(type::cast);
    }

    public Optional<PlatformMeta> meta(String platform) {
        return Optional.ofNullable(platforms.get(normalize(platform)));
    }

    public boolean isEmpty() {
        return adapters.isEmpty();
    }

    /** Enabled adapters, in platform order. */
    public List<BridgeAdapter> listAll() {
        return adapters.values().stream()
                .sorted(Comparator.comparingInt(this::orderOf).thenComparing(BridgeAdapter::getName))
                .toList();
    }

    public List<String> names() {
        return listAll().stream().map(BridgeAdapter::getName).toList();
    }

    public void closeAll() {
        for (BridgeAdapter adapter : adapters.values()) {
            try {
                adapter.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close bridge {}: {}", adapter.getName(), e.getMessage());
            }
        }
        adapters.clear();
    }

    private int orderOf(BridgeAdapter adapter) {
        PlatformMeta meta = platforms.get(adapter.getName());
        return meta != null ? meta.getOrder() : Integer.MAX_VALUE;
    }
}
