package com.querygate.api.guardian;

import java.util.List;

/**
 * Guardian Set：验证者公钥地址列表及其版本索引
 * 每次解析都会重新生成，本层不做缓存。
 *
 * @param index Guardian Set 索引
 * @param keys 按合约中顺序排列的 guardian 地址（0x 开头的小写十六进制）
 */
public record GuardianSet(long index, List<String> keys) {

    public GuardianSet {
        keys = keys == null ? List.of() : List.copyOf(keys);
    }

    public int size() {
        return keys.size();
    }

    /**
     * 达到法定人数所需的签名数 (2/3 + 1)
     */
    public int quorum() {
        return keys.size() * 2 / 3 + 1;
    }
}
