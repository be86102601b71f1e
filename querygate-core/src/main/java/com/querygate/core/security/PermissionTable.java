package com.querygate.core.security;

import org.jspecify.annotations.Nullable;

import java.util.Locale;
import java.util.Map;

/**
 * 权限表 (Immutable)
 * <p>
 * 以小写 API Key 为键。构建完成后不再修改，重载时整体替换，
 * 因此并发读取无需加锁。
 * </p>
 */
public final class PermissionTable {

    private static final PermissionTable EMPTY = new PermissionTable("<empty>", Map.of());

    private final String source;
    private final Map<String, PermissionEntry> entries;

    public PermissionTable(String source, Map<String, PermissionEntry> entries) {
        this.source = source;
        this.entries = Map.copyOf(entries);
    }

    public static PermissionTable empty() {
        return EMPTY;
    }

    /**
     * 按 API Key 查找（大小写不敏感）
     */
    @Nullable
    public PermissionEntry lookup(@Nullable String apiKey) {
        if (apiKey == null) {
            return null;
        }
        return entries.get(normalizeApiKey(apiKey));
    }

    public static String normalizeApiKey(String apiKey) {
        return apiKey.toLowerCase(Locale.ROOT);
    }

    public String getSource() {
        return source;
    }

    public int userCount() {
        return entries.size();
    }

    public int callCount() {
        return entries.values().stream().mapToInt(e -> e.allowedCalls().size()).sum();
    }

    @Override
    public String toString() {
        return "PermissionTable[source=" + source + ", users=" + userCount() + ", calls=" + callCount() + "]";
    }
}
