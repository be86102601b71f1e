package com.querygate.api.exception;

import lombok.Getter;

/**
 * Guardian Set 读取失败
 * <p>
 * 通过 {@link Failure} 区分“节点不可达”“合约状态异常”“超时”，调用方可据此选择不同的重试/退避策略。
 * </p>
 */
@Getter
public class GuardianSetException extends QueryGateException {

    public enum Failure {
        /** RPC 节点无法连接 */
        CONNECTION,
        /** 合约调用失败、回滚或返回数据无法解析 */
        CONTRACT_CALL,
        /** 超过整体截止时间 */
        TIMEOUT,
        /** 调用线程被中断 */
        CANCELLED
    }

    private final Failure failure;

    public GuardianSetException(Failure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public GuardianSetException(Failure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }
}
