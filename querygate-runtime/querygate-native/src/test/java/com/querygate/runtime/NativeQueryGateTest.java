package com.querygate.runtime;

import com.querygate.api.exception.PermissionConfigException;
import com.querygate.api.exception.QueryDeniedException;
import com.querygate.api.query.EthCallData;
import com.querygate.api.query.EthCallQueryRequest;
import com.querygate.api.query.PerChainQuery;
import com.querygate.api.query.QueryRequest;
import com.querygate.api.query.SignedQueryRequest;
import com.querygate.api.security.DenyReason;
import com.querygate.core.codec.QueryRequestCodec;
import com.querygate.core.config.QueryGateConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HexFormat;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NativeQueryGate 集成测试")
class NativeQueryGateTest {

    private static final String PERMISSIONS_YAML = """
            Permissions:
              - userName: "alice"
                apiKey: "ABC123"
                allowedCalls:
                  - ethCall:
                      chain: 2
                      contractAddress: "0xb4fbf271143f4fbf7b91a5ded31805e42b2208d6"
                      call: "0x06fdde03"
            """;

    @TempDir
    Path tempDir;

    private static SignedQueryRequest request(int chainId) {
        HexFormat hex = HexFormat.of();
        EthCallData call = new EthCallData(hex.parseHex("b4fbf271143f4fbf7b91a5ded31805e42b2208d6"),
                hex.parseHex("06fdde03"));
        QueryRequest request = new QueryRequest(7,
                List.of(new PerChainQuery(chainId, new EthCallQueryRequest("0x28d9630", List.of(call)))));
        return new SignedQueryRequest(new QueryRequestCodec().encode(request), new byte[65]);
    }

    @Test
    @DisplayName("启动后组件可用")
    void testStart() throws Exception {
        Path file = Files.writeString(tempDir.resolve("permissions.yaml"), PERMISSIONS_YAML);

        try (QueryGateRuntime runtime = NativeQueryGate.start(QueryGateConfig.builder()
                .permissionFile(file.toString())
                .build())) {
            assertEquals(1, runtime.getPermissionRegistry().current().userCount());
            assertNull(runtime.getPermissionFileWatcher());

            assertEquals(7, runtime.getQueryAuthorizer().authorize("abc123", request(2)).nonce());
            QueryDeniedException e = assertThrows(QueryDeniedException.class,
                    () -> runtime.getQueryAuthorizer().authorize("abc123", request(5)));
            assertEquals(DenyReason.CALL_NOT_AUTHORIZED, e.getReason());
        }
    }

    @Test
    @DisplayName("关闭运行时释放合约调用资源")
    void testCloseReleasesCallerFactory() throws Exception {
        Path file = Files.writeString(tempDir.resolve("permissions.yaml"), PERMISSIONS_YAML);

        QueryGateRuntime runtime = NativeQueryGate.start(QueryGateConfig.builder()
                .permissionFile(file.toString())
                .build());
        assertFalse(runtime.getContractCallerFactory().isClosed());

        runtime.close();

        assertTrue(runtime.getContractCallerFactory().isClosed());
    }

    @Test
    @DisplayName("开启监听时创建文件监听器")
    void testStartWithWatcher() throws Exception {
        Path file = Files.writeString(tempDir.resolve("permissions.yaml"), PERMISSIONS_YAML);

        try (QueryGateRuntime runtime = NativeQueryGate.start(QueryGateConfig.builder()
                .permissionFile(file.toString())
                .watchPermissionFile(true)
                .build())) {
            assertNotNull(runtime.getPermissionFileWatcher());
        }
    }

    @Test
    @DisplayName("权限文件非法时拒绝启动")
    void testStartFailsOnBadFile() throws Exception {
        Path file = Files.writeString(tempDir.resolve("permissions.yaml"), PERMISSIONS_YAML.replace("chain: 2", "chain: 70000"));

        assertThrows(PermissionConfigException.class, () -> NativeQueryGate.start(QueryGateConfig.builder()
                .permissionFile(file.toString())
                .build()));
    }

    @Test
    @DisplayName("未配置核心桥时无法解析 Guardian Set")
    void testGuardianSetRequiresConfig() throws Exception {
        Path file = Files.writeString(tempDir.resolve("permissions.yaml"), PERMISSIONS_YAML);

        try (QueryGateRuntime runtime = NativeQueryGate.start(QueryGateConfig.builder()
                .permissionFile(file.toString())
                .build())) {
            assertThrows(IllegalStateException.class, runtime::fetchCurrentGuardianSet);
        }
    }
}
