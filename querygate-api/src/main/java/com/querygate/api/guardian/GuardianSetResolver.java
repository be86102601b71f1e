package com.querygate.api.guardian;

import com.querygate.api.exception.GuardianSetException;

/**
 * Core 提供 - Guardian Set 解析服务
 * 通常在启动或由调用方拥有的刷新计划中调用；重试策略由调用方决定。
 */
public interface GuardianSetResolver {

    /**
     * 从核心桥合约读取当前 Guardian Set。
     *
     * @param rpcUrl 链 RPC 地址
     * @param coreBridgeAddress 核心桥合约地址
     * @return 当前 Guardian Set
     * @throws GuardianSetException 连接失败、合约调用失败或超时
     */
    GuardianSet fetchCurrentGuardianSet(String rpcUrl, String coreBridgeAddress);
}
