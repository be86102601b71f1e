package com.querygate.core.reload;

import com.querygate.api.exception.PermissionConfigException;
import com.querygate.core.security.PermissionRegistry;
import com.querygate.core.security.PermissionTable;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 权限文件监听器
 * 职责：监听权限文件所在目录，文件变化后防抖触发重载。
 * 重载失败只记录日志，继续使用旧表。
 */
@Slf4j
public class PermissionFileWatcher implements Closeable {

    private final PermissionRegistry registry;
    private final long debounceMillis;
    private final Path file;
    private final WatchService watchService;

    // 防抖调度器：防止一次保存触发多次重载
    private final ScheduledExecutorService debounceExecutor = Executors.newSingleThreadScheduledExecutor(
            r -> {
                Thread t = new Thread(r, "querygate-permissions-reload");
                t.setDaemon(true);
                return t;
            }
    );
    private ScheduledFuture<?> debounceTask;
    private volatile boolean closed;

    public PermissionFileWatcher(PermissionRegistry registry, long debounceMillis) {
        this.registry = registry;
        this.debounceMillis = debounceMillis;
        this.file = registry.getPermissionFile().toAbsolutePath().normalize();
        try {
            this.watchService = FileSystems.getDefault().newWatchService();
            Path dir = file.getParent();
            // 编辑器常以“写临时文件再改名”的方式保存，因此同时关注 CREATE
            dir.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);
        } catch (IOException e) {
            throw new PermissionConfigException("Failed to watch permissions file \"" + file + "\"", e);
        }
        startWatchLoop();
        log.info("Watching permissions file: {}", file);
    }

    private void startWatchLoop() {
        Thread t = new Thread(() -> {
            while (!closed) {
                try {
                    WatchKey key = watchService.take();
                    for (WatchEvent<?> event : key.pollEvents()) {
                        if (event.kind() == StandardWatchEventKinds.OVERFLOW
                                || file.getFileName().equals(event.context())) {
                            scheduleReload();
                        }
                    }
                    if (!key.reset()) {
                        log.warn("Permissions directory is no longer accessible: {}", file.getParent());
                        break;
                    }
                } catch (InterruptedException | ClosedWatchServiceException e) {
                    break;
                } catch (Exception e) {
                    log.error("Error in permissions watch loop", e);
                }
            }
        });
        t.setDaemon(true);
        t.setName("querygate-permissions-watcher");
        t.start();
    }

    private synchronized void scheduleReload() {
        if (closed) {
            return;
        }
        if (debounceTask != null && !debounceTask.isDone()) {
            debounceTask.cancel(false);
        }
        debounceTask = debounceExecutor.schedule(this::reload, debounceMillis, TimeUnit.MILLISECONDS);
    }

    private void reload() {
        log.info("Permissions file changed, reloading: {}", file);
        try {
            PermissionTable table = registry.reload();
            log.info("Permissions reloaded: {} users", table.userCount());
        } catch (PermissionConfigException e) {
            log.warn("Rejected permissions reload, keeping previous table: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Permissions reload failed, keeping previous table", e);
        }
    }

    @Override
    public void close() {
        closed = true;
        debounceExecutor.shutdownNow();
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Failed to close permissions watch service", e);
        }
        log.info("Stopped watching permissions file: {}", file);
    }
}
