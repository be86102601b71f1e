package com.querygate.runtime;

import com.querygate.api.guardian.GuardianSet;
import com.querygate.api.guardian.GuardianSetResolver;
import com.querygate.api.security.QueryAuthorizer;
import com.querygate.core.config.QueryGateConfig;
import com.querygate.core.event.EventBus;
import com.querygate.core.guardian.Web3jContractCallerFactory;
import com.querygate.core.reload.PermissionFileWatcher;
import com.querygate.core.security.PermissionRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import java.io.Closeable;

/**
 * 已启动的 QueryGate 组件集合
 */
@Slf4j
@Getter
public class QueryGateRuntime implements Closeable {

    private final QueryGateConfig config;
    private final EventBus eventBus;
    private final PermissionRegistry permissionRegistry;
    private final QueryAuthorizer queryAuthorizer;
    private final GuardianSetResolver guardianSetResolver;
    private final Web3jContractCallerFactory contractCallerFactory;
    @Nullable
    private final PermissionFileWatcher permissionFileWatcher;

    QueryGateRuntime(QueryGateConfig config, EventBus eventBus, PermissionRegistry permissionRegistry,
                     QueryAuthorizer queryAuthorizer, GuardianSetResolver guardianSetResolver,
                     Web3jContractCallerFactory contractCallerFactory,
                     @Nullable PermissionFileWatcher permissionFileWatcher) {
        this.config = config;
        this.eventBus = eventBus;
        this.permissionRegistry = permissionRegistry;
        this.queryAuthorizer = queryAuthorizer;
        this.guardianSetResolver = guardianSetResolver;
        this.contractCallerFactory = contractCallerFactory;
        this.permissionFileWatcher = permissionFileWatcher;
    }

    /**
     * 使用配置中的 RPC 地址与核心桥地址解析当前 Guardian Set
     */
    public GuardianSet fetchCurrentGuardianSet() {
        if (config.getRpcUrl() == null || config.getCoreBridgeAddress() == null) {
            throw new IllegalStateException("rpcUrl and coreBridgeAddress must be configured");
        }
        return guardianSetResolver.fetchCurrentGuardianSet(config.getRpcUrl(), config.getCoreBridgeAddress());
    }

    @Override
    public void close() {
        log.info("QueryGate shutting down...");
        if (permissionFileWatcher != null) {
            permissionFileWatcher.close();
        }
        contractCallerFactory.close();
    }
}
