package com.querygate.core.security;

import com.querygate.api.exception.InvalidAddressException;
import com.querygate.api.exception.InvalidSelectorException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CallKeyCodec 单元测试")
class CallKeyCodecTest {

    private static final String ADDRESS = "b4fbf271143f4fbf7b91a5ded31805e42b2208d6";
    private static final String KEY = "ethCall:2:" + ADDRESS + ":06fdde03";

    @Nested
    @DisplayName("编码")
    class EncodeTests {

        @Test
        @DisplayName("应生成带版本前缀的小写规范键")
        void testEncode() {
            assertEquals(KEY, CallKeyCodec.encode(2, "0x" + ADDRESS, "0x06fdde03"));
        }

        @Test
        @DisplayName("十六进制大小写与 0x 前缀不影响结果")
        void testEncodeIsCaseAndPrefixInsensitive() {
            String upper = CallKeyCodec.encode(2, "0xB4FBF271143F4FBF7B91A5DED31805E42B2208D6", "0X06FDDE03");
            String bare = CallKeyCodec.encode(2, ADDRESS, "06fdde03");
            assertEquals(KEY, upper);
            assertEquals(KEY, bare);
            assertArrayEquals(CallKeyCodec.validateSelector("0xAbCdEf01"), CallKeyCodec.validateSelector("abcdef01"));
        }

        @Test
        @DisplayName("不同链的同一调用应得到不同的键")
        void testDistinctChains() {
            assertNotEquals(CallKeyCodec.encode(2, ADDRESS, "06fdde03"), CallKeyCodec.encode(3, ADDRESS, "06fdde03"));
        }

        @Test
        @DisplayName("左侧补零的 32 字节地址应规范为 20 字节")
        void testUniversalAddress() {
            String padded = "0x000000000000000000000000" + ADDRESS;
            assertEquals(KEY, CallKeyCodec.encode(2, padded, "06fdde03"));
        }
    }

    @Nested
    @DisplayName("地址校验")
    class AddressTests {

        @Test
        @DisplayName("非十六进制字符应被拒绝")
        void testNonHex() {
            assertThrows(InvalidAddressException.class, () -> CallKeyCodec.validateAddress("0xzz" + ADDRESS.substring(2)));
        }

        @Test
        @DisplayName("长度不是 20 或 32 字节应被拒绝")
        void testWrongLength() {
            assertThrows(InvalidAddressException.class, () -> CallKeyCodec.validateAddress("0x" + ADDRESS.substring(2)));
            assertThrows(InvalidAddressException.class, () -> CallKeyCodec.validateAddress("0x"));
            assertThrows(InvalidAddressException.class, () -> CallKeyCodec.validateAddress("0x0" + ADDRESS));
        }

        @Test
        @DisplayName("32 字节地址高位非零应被拒绝")
        void testNonZeroPadding() {
            assertThrows(InvalidAddressException.class,
                    () -> CallKeyCodec.validateAddress("0x010000000000000000000000" + ADDRESS));
        }

        @Test
        @DisplayName("原始字节地址应按同样规则规范化")
        void testToAddress() {
            byte[] address = HexFormat.of().parseHex(ADDRESS);
            byte[] padded = new byte[32];
            System.arraycopy(address, 0, padded, 12, 20);
            assertArrayEquals(address, CallKeyCodec.toAddress(padded));
            assertThrows(InvalidAddressException.class, () -> CallKeyCodec.toAddress(new byte[19]));
        }
    }

    @Nested
    @DisplayName("选择器校验")
    class SelectorTests {

        @Test
        @DisplayName("选择器必须恰好 4 字节")
        void testSelectorLength() {
            assertThrows(InvalidSelectorException.class, () -> CallKeyCodec.validateSelector("0x06fdde"));
            assertThrows(InvalidSelectorException.class, () -> CallKeyCodec.validateSelector("0x06fdde0300"));
            assertThrows(InvalidSelectorException.class, () -> CallKeyCodec.validateSelector(""));
        }

        @Test
        @DisplayName("奇数位或非法字符应被拒绝")
        void testMalformedSelector() {
            assertThrows(InvalidSelectorException.class, () -> CallKeyCodec.validateSelector("06fdde0"));
            assertThrows(InvalidSelectorException.class, () -> CallKeyCodec.validateSelector("name()"));
            assertThrows(InvalidSelectorException.class, () -> CallKeyCodec.validateSelector(null));
        }
    }

    @Nested
    @DisplayName("解析")
    class ParseTests {

        @Test
        @DisplayName("解析后再编码应得到同一个键")
        void testParseRecoversTriple() {
            EthCallDescriptor descriptor = CallKeyCodec.parse(KEY);

            assertEquals(2, descriptor.chain());
            assertEquals(ADDRESS, HexFormat.of().formatHex(descriptor.contractAddress()));
            assertEquals("06fdde03", HexFormat.of().formatHex(descriptor.selector()));
            assertEquals(KEY, descriptor.canonicalKey());
        }

        @Test
        @DisplayName("未知前缀或非规范格式应被拒绝")
        void testParseRejectsMalformedKeys() {
            assertThrows(IllegalArgumentException.class, () -> CallKeyCodec.parse("solanaAccount:2:" + ADDRESS + ":06fdde03"));
            assertThrows(IllegalArgumentException.class, () -> CallKeyCodec.parse("ethCall:two:" + ADDRESS + ":06fdde03"));
            assertThrows(IllegalArgumentException.class, () -> CallKeyCodec.parse("ethCall:2:0x" + ADDRESS + ":06fdde03"));
            assertThrows(IllegalArgumentException.class, () -> CallKeyCodec.parse("ethCall:2:" + ADDRESS));
        }
    }

    @Test
    @DisplayName("描述符按内容比较")
    void testDescriptorEquality() {
        EthCallDescriptor a = CallKeyCodec.parse(KEY);
        EthCallDescriptor b = EthCallDescriptor.fromCallData(2, HexFormat.of().parseHex(ADDRESS),
                HexFormat.of().parseHex("06fdde030000000000000000000000000000000000000000000000000000000000000001"));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
