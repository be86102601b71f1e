package com.querygate.core.spi;

import java.time.Duration;

/**
 * 合约调用客户端工厂
 */
public interface ContractCallerFactory {

    /**
     * @param rpcUrl RPC 节点地址
     * @param timeout 传输层超时，作用于连接、读取以及整个调用
     */
    ContractCaller open(String rpcUrl, Duration timeout);
}
