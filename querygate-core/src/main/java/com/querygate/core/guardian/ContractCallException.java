package com.querygate.core.guardian;

import com.querygate.api.exception.QueryGateException;

/**
 * 节点已响应，但合约调用返回错误或回滚
 */
public class ContractCallException extends QueryGateException {

    public ContractCallException(String message) {
        super(message);
    }
}
