package com.querygate.api.query;

import java.util.List;
import java.util.Set;

/**
 * 指定最终性级别的 eth_call 查询
 *
 * @param blockId 区块号或区块哈希（0x 开头）
 * @param finality finalized 或 safe
 * @param callData 调用列表
 */
public record EthCallWithFinalityQueryRequest(String blockId, String finality, List<EthCallData> callData)
        implements ChainSpecificQuery {

    private static final Set<String> FINALITY_LEVELS = Set.of("finalized", "safe");

    public EthCallWithFinalityQueryRequest {
        callData = callData == null ? List.of() : List.copyOf(callData);
    }

    @Override
    public QueryType type() {
        return QueryType.ETH_CALL_WITH_FINALITY;
    }

    @Override
    public void validate() {
        EthCallData.requireHexBlockId("block id", blockId);
        if (finality == null || !FINALITY_LEVELS.contains(finality)) {
            throw new IllegalArgumentException("finality must be \"finalized\" or \"safe\", is \"" + finality + "\"");
        }
        EthCallData.validateAll(callData);
    }
}
