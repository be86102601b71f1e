package com.querygate.core.config;

import com.querygate.core.guardian.DefaultGuardianSetResolver;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.time.Duration;

/**
 * QueryGate Core 全局配置对象
 * <p>
 * 职责：作为 Core 层的唯一配置入口，屏蔽 Spring Boot 或其他外部环境的差异。
 * </p>
 */
@Data
@Builder
@ToString
public class QueryGateConfig {

    // ================= 权限 =================

    /**
     * 权限文件路径 (YAML 或 JSON)
     */
    private String permissionFile;

    /**
     * 是否监听权限文件变化并自动重载
     */
    @Builder.Default
    private boolean watchPermissionFile = false;

    /**
     * 重载防抖延迟，避免一次保存触发多次重载
     */
    @Builder.Default
    private long reloadDebounceMillis = 500;

    // ================= Guardian Set =================

    /**
     * 核心桥所在链的 RPC 地址
     */
    private String rpcUrl;

    /**
     * 核心桥合约地址
     */
    private String coreBridgeAddress;

    /**
     * 一次解析（连接 + 两次合约读取）的总超时
     */
    @Builder.Default
    private Duration guardianSetTimeout = DefaultGuardianSetResolver.DEFAULT_TIMEOUT;

    /**
     * 验证
     */
    public void validate() {
        if (permissionFile == null || permissionFile.isBlank()) {
            throw new IllegalArgumentException("permissionFile cannot be blank");
        }
        if (reloadDebounceMillis < 0) {
            throw new IllegalArgumentException("reloadDebounceMillis cannot be negative");
        }
        if (guardianSetTimeout == null || guardianSetTimeout.isNegative() || guardianSetTimeout.isZero()) {
            throw new IllegalArgumentException("guardianSetTimeout must be positive");
        }
    }
}
