package com.querygate.api.query;

import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * 单个 eth_call 调用
 *
 * @param to 合约地址
 * @param data 调用数据，前 4 字节为函数选择器
 */
public record EthCallData(byte[] to, byte[] data) {

    public static final int ADDRESS_LENGTH = 20;
    public static final int MAX_CALLS = 255;

    public EthCallData {
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(data, "data");
    }

    public void validate() {
        if (to.length != ADDRESS_LENGTH) {
            throw new IllegalArgumentException("invalid length for To contract: " + to.length);
        }
        if (data.length == 0) {
            throw new IllegalArgumentException("call data may not be empty");
        }
    }

    static void validateAll(List<EthCallData> callData) {
        if (callData.isEmpty()) {
            throw new IllegalArgumentException("does not contain any call data");
        }
        if (callData.size() > MAX_CALLS) {
            throw new IllegalArgumentException("too many call data entries");
        }
        for (int i = 0; i < callData.size(); i++) {
            try {
                callData.get(i).validate();
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("invalid call data " + i + ": " + e.getMessage(), e);
            }
        }
    }

    static void requireHexBlockId(String name, String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(name + " may not be empty");
        }
        if (!value.startsWith("0x")) {
            throw new IllegalArgumentException(name + " must be a hex number or hash starting with 0x");
        }
    }

    @Override
    public String toString() {
        HexFormat hex = HexFormat.of();
        return "EthCallData[to=0x" + hex.formatHex(to) + ", data=0x" + hex.formatHex(data) + "]";
    }
}
