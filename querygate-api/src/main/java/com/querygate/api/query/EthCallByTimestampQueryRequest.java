package com.querygate.api.query;

import java.util.List;

/**
 * 按时间戳定位区块的 eth_call 查询
 *
 * @param targetTimestamp 目标时间戳（微秒）
 * @param targetBlockIdHint 目标区块提示，可为空
 * @param followingBlockIdHint 后继区块提示，可为空，但须与 targetBlockIdHint 同时出现
 * @param callData 调用列表
 */
public record EthCallByTimestampQueryRequest(long targetTimestamp, String targetBlockIdHint,
                                             String followingBlockIdHint, List<EthCallData> callData)
        implements ChainSpecificQuery {

    public EthCallByTimestampQueryRequest {
        targetBlockIdHint = targetBlockIdHint == null ? "" : targetBlockIdHint;
        followingBlockIdHint = followingBlockIdHint == null ? "" : followingBlockIdHint;
        callData = callData == null ? List.of() : List.copyOf(callData);
    }

    @Override
    public QueryType type() {
        return QueryType.ETH_CALL_BY_TIMESTAMP;
    }

    @Override
    public void validate() {
        if (targetTimestamp == 0) {
            throw new IllegalArgumentException("target timestamp may not be zero");
        }
        if (targetBlockIdHint.isEmpty() != followingBlockIdHint.isEmpty()) {
            throw new IllegalArgumentException("block id hints must both be set or both be empty");
        }
        if (!targetBlockIdHint.isEmpty()) {
            EthCallData.requireHexBlockId("target block id hint", targetBlockIdHint);
            EthCallData.requireHexBlockId("following block id hint", followingBlockIdHint);
        }
        EthCallData.validateAll(callData);
    }
}
