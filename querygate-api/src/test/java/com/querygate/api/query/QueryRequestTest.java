package com.querygate.api.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("查询请求结构校验")
class QueryRequestTest {

    private static final EthCallData CALL = new EthCallData(new byte[20], new byte[]{6, -3, -34, 3});

    private static QueryRequest single(int chainId, ChainSpecificQuery query) {
        return new QueryRequest(1, List.of(new PerChainQuery(chainId, query)));
    }

    @Nested
    @DisplayName("请求与单链查询")
    class RequestTests {

        @Test
        @DisplayName("合法请求通过校验")
        void testValid() {
            assertDoesNotThrow(() -> single(2, new EthCallQueryRequest("0x28d9630", List.of(CALL))).validate());
        }

        @Test
        @DisplayName("空请求与超量请求被拒绝")
        void testQueryCount() {
            assertThrows(IllegalArgumentException.class, () -> new QueryRequest(1, List.of()).validate());

            PerChainQuery pcq = new PerChainQuery(2, new EthCallQueryRequest("0x1", List.of(CALL)));
            assertThrows(IllegalArgumentException.class,
                    () -> new QueryRequest(1, Collections.nCopies(256, pcq)).validate());
        }

        @Test
        @DisplayName("nonce 必须为 uint32")
        void testNonceRange() {
            assertThrows(IllegalArgumentException.class,
                    () -> new QueryRequest(0x1_0000_0000L, single(2, new EthCallQueryRequest("0x1", List.of(CALL)))
                            .perChainQueries()).validate());
        }

        @Test
        @DisplayName("链 ID 必须非零")
        void testChainId() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> single(0, new EthCallQueryRequest("0x1", List.of(CALL))).validate());
            assertTrue(e.getMessage().startsWith("invalid per chain query 0"));
        }
    }

    @Nested
    @DisplayName("eth_call 变体")
    class VariantTests {

        @Test
        @DisplayName("区块 ID 必须以 0x 开头")
        void testBlockId() {
            assertThrows(IllegalArgumentException.class,
                    () -> new EthCallQueryRequest("28d9630", List.of(CALL)).validate());
            assertThrows(IllegalArgumentException.class,
                    () -> new EthCallQueryRequest("", List.of(CALL)).validate());
        }

        @Test
        @DisplayName("调用地址须为 20 字节且数据非空")
        void testCallData() {
            assertThrows(IllegalArgumentException.class,
                    () -> new EthCallQueryRequest("0x1", List.of(new EthCallData(new byte[19], new byte[4]))).validate());
            assertThrows(IllegalArgumentException.class,
                    () -> new EthCallQueryRequest("0x1", List.of(new EthCallData(new byte[20], new byte[0]))).validate());
            assertThrows(IllegalArgumentException.class,
                    () -> new EthCallQueryRequest("0x1", List.of()).validate());
        }

        @Test
        @DisplayName("按时间戳查询的提示必须成对出现")
        void testTimestampHints() {
            assertDoesNotThrow(() -> new EthCallByTimestampQueryRequest(1_700_000_000_000_000L, null, null,
                    List.of(CALL)).validate());
            assertDoesNotThrow(() -> new EthCallByTimestampQueryRequest(1_700_000_000_000_000L, "0x1", "0x2",
                    List.of(CALL)).validate());
            assertThrows(IllegalArgumentException.class, () -> new EthCallByTimestampQueryRequest(
                    1_700_000_000_000_000L, "0x1", "", List.of(CALL)).validate());
            assertThrows(IllegalArgumentException.class, () -> new EthCallByTimestampQueryRequest(
                    0, "", "", List.of(CALL)).validate());
        }

        @Test
        @DisplayName("最终性只接受 finalized 与 safe")
        void testFinality() {
            assertDoesNotThrow(() -> new EthCallWithFinalityQueryRequest("0x1", "safe", List.of(CALL)).validate());
            assertThrows(IllegalArgumentException.class,
                    () -> new EthCallWithFinalityQueryRequest("0x1", "latest", List.of(CALL)).validate());
        }

        @Test
        @DisplayName("类型码双向映射")
        void testQueryTypeCodes() {
            assertEquals(QueryType.ETH_CALL, QueryType.fromCode(1));
            assertEquals(3, QueryType.ETH_CALL_WITH_FINALITY.code());
            assertNull(QueryType.fromCode(9));
        }
    }
}
