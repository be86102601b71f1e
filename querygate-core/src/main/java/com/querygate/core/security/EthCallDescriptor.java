package com.querygate.core.security;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * eth_call 调用描述
 *
 * @param chain 链 ID
 * @param contractAddress 20 字节合约地址
 * @param selector 4 字节函数选择器
 */
public record EthCallDescriptor(int chain, byte[] contractAddress, byte[] selector) implements CallDescriptor {

    public EthCallDescriptor {
        contractAddress = contractAddress.clone();
        selector = selector.clone();
    }

    /**
     * 从调用数据构造，选择器取前 4 字节，其余为调用参数，不参与授权。
     */
    public static EthCallDescriptor fromCallData(int chain, byte[] contractAddress, byte[] data) {
        return new EthCallDescriptor(chain, contractAddress, Arrays.copyOf(data, CallKeyCodec.SELECTOR_LENGTH));
    }

    @Override
    public String canonicalKey() {
        return CallKeyCodec.encode(chain, contractAddress, selector);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EthCallDescriptor other)) return false;
        return chain == other.chain
                && Arrays.equals(contractAddress, other.contractAddress)
                && Arrays.equals(selector, other.selector);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * chain + Arrays.hashCode(contractAddress)) + Arrays.hashCode(selector);
    }

    @Override
    public String toString() {
        HexFormat hex = HexFormat.of();
        return "EthCallDescriptor[chain=" + chain + ", contractAddress=0x" + hex.formatHex(contractAddress)
                + ", selector=0x" + hex.formatHex(selector) + "]";
    }
}
