package com.querygate.core.security;

import java.util.Set;

/**
 * 单个用户的权限条目
 *
 * @param userName 展示用用户名
 * @param apiKey 小写化后的 API Key
 * @param allowedCalls 允许调用的规范键集合
 */
public record PermissionEntry(String userName, String apiKey, Set<String> allowedCalls) {

    public PermissionEntry {
        allowedCalls = Set.copyOf(allowedCalls);
    }

    public boolean isAllowed(String callKey) {
        return allowedCalls.contains(callKey);
    }

    @Override
    public String toString() {
        // 不输出 API Key 与允许列表
        return "PermissionEntry[userName=" + userName + ", allowedCalls=" + allowedCalls.size() + "]";
    }
}
