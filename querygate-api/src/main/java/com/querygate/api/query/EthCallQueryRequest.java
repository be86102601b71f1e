package com.querygate.api.query;

import java.util.List;

/**
 * 在指定区块上执行的 eth_call 批量查询
 *
 * @param blockId 区块号或区块哈希（0x 开头）
 * @param callData 调用列表
 */
public record EthCallQueryRequest(String blockId, List<EthCallData> callData) implements ChainSpecificQuery {

    public EthCallQueryRequest {
        callData = callData == null ? List.of() : List.copyOf(callData);
    }

    @Override
    public QueryType type() {
        return QueryType.ETH_CALL;
    }

    @Override
    public void validate() {
        EthCallData.requireHexBlockId("block id", blockId);
        EthCallData.validateAll(callData);
    }
}
