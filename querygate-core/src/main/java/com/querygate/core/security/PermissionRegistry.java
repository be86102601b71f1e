package com.querygate.core.security;

import com.querygate.api.event.PermissionsReloadedEvent;
import com.querygate.api.exception.PermissionConfigException;
import com.querygate.core.event.EventBus;
import com.querygate.core.loader.PermissionFileLoader;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 权限注册表 (Core层)
 * <p>
 * 职责：持有当前生效的 {@link PermissionTable}。重载时在旁路构建完整的新表，
 * 再通过一次原子引用替换发布；读者永远看到完整的旧表或完整的新表。
 * </p>
 */
@Slf4j
public class PermissionRegistry {

    private final Path permissionFile;
    private final EventBus eventBus;
    private final AtomicReference<PermissionTable> current;

    /**
     * 构造时立即加载，失败则抛出 {@link PermissionConfigException}，服务不得启动。
     */
    public PermissionRegistry(Path permissionFile, EventBus eventBus) {
        this.permissionFile = permissionFile;
        this.eventBus = eventBus;
        this.current = new AtomicReference<>(PermissionFileLoader.load(permissionFile));
    }

    /**
     * 当前权限表。每个请求应只读取一次并在整个授权过程中使用同一引用。
     */
    public PermissionTable current() {
        return current.get();
    }

    public Path getPermissionFile() {
        return permissionFile;
    }

    /**
     * 从文件重新加载。失败时抛出异常，旧表保持不变。
     */
    public PermissionTable reload() {
        PermissionTable table = PermissionFileLoader.load(permissionFile);
        replace(table);
        return table;
    }

    /**
     * 整体替换权限表。新表已生效后才通知监听器，监听器异常只记录日志。
     */
    public void replace(PermissionTable table) {
        PermissionTable previous = current.getAndSet(table);
        log.info("Permission table replaced: {} users -> {} users (source: {})",
                previous.userCount(), table.userCount(), table.getSource());
        try {
            eventBus.publish(new PermissionsReloadedEvent(table.getSource(), table.userCount(), table.callCount()));
        } catch (RuntimeException e) {
            log.warn("Permissions reload listener failed, new table remains active", e);
        }
    }
}
