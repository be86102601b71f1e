package com.querygate.api.query;

/**
 * 针对单条链的查询
 *
 * @param chainId 链 ID (uint16)
 * @param query 具体查询
 */
public record PerChainQuery(int chainId, ChainSpecificQuery query) {

    public static final int MAX_CHAIN_ID = 0xFFFF;

    public void validate() {
        if (chainId <= 0 || chainId > MAX_CHAIN_ID) {
            throw new IllegalArgumentException("invalid chain id: " + chainId);
        }
        if (query == null) {
            throw new IllegalArgumentException("query is missing");
        }
        query.validate();
    }
}
