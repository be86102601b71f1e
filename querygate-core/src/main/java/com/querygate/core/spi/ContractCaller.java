package com.querygate.core.spi;

import java.util.concurrent.CompletableFuture;

/**
 * 面向单个 RPC 节点的只读合约调用
 * <p>
 * 返回的 Future 在连接失败时以 {@link java.io.IOException} 异常完成，
 * 合约调用失败或回滚时以 {@link com.querygate.core.guardian.ContractCallException} 异常完成。
 * 调用方取消 Future 时实现应尽快放弃请求。
 * </p>
 */
public interface ContractCaller extends AutoCloseable {

    /**
     * 执行 eth_call（latest 区块）
     *
     * @param contractAddress 0x 开头的合约地址
     * @param encodedFunction 0x 开头的 ABI 编码调用数据
     * @return 0x 开头的返回数据
     */
    CompletableFuture<String> call(String contractAddress, String encodedFunction);

    @Override
    void close();
}
