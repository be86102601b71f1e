package com.querygate.runtime;

import com.querygate.core.codec.QueryRequestCodec;
import com.querygate.core.config.QueryGateConfig;
import com.querygate.core.event.EventBus;
import com.querygate.core.guardian.DefaultGuardianSetResolver;
import com.querygate.core.guardian.Web3jContractCallerFactory;
import com.querygate.core.reload.PermissionFileWatcher;
import com.querygate.core.security.DefaultQueryAuthorizer;
import com.querygate.core.security.PermissionRegistry;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * QueryGate Native 启动器
 * 宿主应用通过此类一键组装授权与 Guardian Set 解析组件，无需 Spring 容器
 */
@Slf4j
public final class NativeQueryGate {

    private NativeQueryGate() {
    }

    /**
     * 启动 QueryGate。权限文件加载失败时抛出异常，不会以残缺的权限表启动。
     */
    public static QueryGateRuntime start(QueryGateConfig config) {
        config.validate();
        long start = System.currentTimeMillis();
        log.info("Starting QueryGate Native Runtime...");

        // 准备基础设施
        EventBus eventBus = new EventBus();
        PermissionRegistry registry = new PermissionRegistry(Path.of(config.getPermissionFile()), eventBus);

        // 准备核心组件
        DefaultQueryAuthorizer authorizer = new DefaultQueryAuthorizer(registry, new QueryRequestCodec());
        Web3jContractCallerFactory callerFactory = new Web3jContractCallerFactory();
        DefaultGuardianSetResolver resolver = new DefaultGuardianSetResolver(callerFactory, config.getGuardianSetTimeout());

        PermissionFileWatcher watcher = null;
        if (config.isWatchPermissionFile()) {
            watcher = new PermissionFileWatcher(registry, config.getReloadDebounceMillis());
        }

        QueryGateRuntime runtime = new QueryGateRuntime(config, eventBus, registry, authorizer, resolver,
                callerFactory, watcher);

        // 注册关闭钩子
        Runtime.getRuntime().addShutdownHook(new Thread(runtime::close, "querygate-shutdown"));

        log.info("QueryGate Native started in {} ms", System.currentTimeMillis() - start);
        return runtime;
    }
}
