package com.querygate.core.reload;

import com.querygate.api.event.PermissionsReloadedEvent;
import com.querygate.core.event.EventBus;
import com.querygate.core.security.PermissionRegistry;
import com.querygate.core.security.PermissionTable;
import com.querygate.core.support.QueryFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.querygate.core.support.QueryFixtures.PERMISSIONS_JSON;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PermissionFileWatcher 测试")
class PermissionFileWatcherTest {

    @TempDir
    Path tempDir;

    private Path file;
    private EventBus eventBus;
    private PermissionRegistry registry;
    private PermissionFileWatcher watcher;

    @BeforeEach
    void setUp() throws Exception {
        file = QueryFixtures.writeFile(tempDir, "permissions.json", PERMISSIONS_JSON);
        eventBus = new EventBus();
        registry = new PermissionRegistry(file, eventBus);
        watcher = new PermissionFileWatcher(registry, 50);
    }

    @AfterEach
    void tearDown() {
        watcher.close();
    }

    @Test
    @DisplayName("文件修改后自动重载")
    void testReloadOnChange() throws Exception {
        CountDownLatch reloaded = new CountDownLatch(1);
        eventBus.subscribe(PermissionsReloadedEvent.class, e -> reloaded.countDown());

        Files.writeString(file, PERMISSIONS_JSON.replace("ABC123", "ROTATED"));

        assertTrue(reloaded.await(10, TimeUnit.SECONDS), "permissions were not reloaded");
        assertNull(registry.current().lookup("abc123"));
        assertNotNull(registry.current().lookup("rotated"));
    }

    @Test
    @DisplayName("非法内容不会替换旧表，修复后恢复重载")
    void testInvalidChangeKeepsTable() throws Exception {
        PermissionTable before = registry.current();
        CountDownLatch reloaded = new CountDownLatch(1);
        eventBus.subscribe(PermissionsReloadedEvent.class, e -> reloaded.countDown());

        Files.writeString(file, "{ \"Permissions\": [ { \"userName\": \"alice\" } ] }");
        assertFalse(reloaded.await(1, TimeUnit.SECONDS));
        assertSame(before, registry.current());

        Files.writeString(file, PERMISSIONS_JSON.replace("bob-key", "bob-key-2"));
        assertTrue(reloaded.await(10, TimeUnit.SECONDS), "watcher stopped after a rejected reload");
        assertNotNull(registry.current().lookup("bob-key-2"));
    }

    @Test
    @DisplayName("同目录其他文件变化不触发重载")
    void testIgnoresOtherFiles() throws Exception {
        CountDownLatch reloaded = new CountDownLatch(1);
        eventBus.subscribe(PermissionsReloadedEvent.class, e -> reloaded.countDown());

        Files.writeString(tempDir.resolve("other.json"), "{}");

        assertFalse(reloaded.await(500, TimeUnit.MILLISECONDS));
    }
}
