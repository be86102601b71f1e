package com.querygate.api.query;

import java.util.List;

/**
 * 跨链查询请求，由若干单链查询组成
 *
 * @param nonce 请求随机数 (uint32)
 * @param perChainQueries 按顺序排列的单链查询
 */
public record QueryRequest(long nonce, List<PerChainQuery> perChainQueries) {

    public static final int MAX_PER_CHAIN_QUERIES = 255;

    public QueryRequest {
        perChainQueries = perChainQueries == null ? List.of() : List.copyOf(perChainQueries);
    }

    /**
     * 结构校验
     */
    public void validate() {
        if (nonce < 0 || nonce > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("nonce must fit in an unsigned 32-bit integer");
        }
        if (perChainQueries.isEmpty()) {
            throw new IllegalArgumentException("request does not contain any per chain queries");
        }
        if (perChainQueries.size() > MAX_PER_CHAIN_QUERIES) {
            throw new IllegalArgumentException("too many per chain queries");
        }
        for (int i = 0; i < perChainQueries.size(); i++) {
            try {
                perChainQueries.get(i).validate();
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("invalid per chain query " + i + ": " + e.getMessage(), e);
            }
        }
    }
}
