package com.querygate.api.query;

/**
 * 单链查询体（封闭变体集合）
 * 新增查询类型时需同步扩展解码与授权的分派点。
 */
public sealed interface ChainSpecificQuery
        permits EthCallQueryRequest, EthCallByTimestampQueryRequest, EthCallWithFinalityQueryRequest {

    QueryType type();

    void validate();
}
