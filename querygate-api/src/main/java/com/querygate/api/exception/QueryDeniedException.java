package com.querygate.api.exception;

import com.querygate.api.security.DenyReason;
import lombok.Getter;
import org.jspecify.annotations.Nullable;

/**
 * 查询授权拒绝异常
 * <p>
 * 单个请求级别的错误，可恢复：调用方据此返回拒绝响应，服务本身不受影响。
 * </p>
 *
 * @author QueryGate
 */
@Getter
public class QueryDeniedException extends QueryGateException {

    private final DenyReason reason;

    /**
     * 未通过授权检查的规范调用键，仅 {@link DenyReason#CALL_NOT_AUTHORIZED} 时存在
     */
    @Nullable
    private final String callKey;

    public QueryDeniedException(DenyReason reason, String message) {
        this(reason, message, null, null);
    }

    public QueryDeniedException(DenyReason reason, String message, Throwable cause) {
        this(reason, message, null, cause);
    }

    public QueryDeniedException(DenyReason reason, String message, @Nullable String callKey, @Nullable Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.callKey = callKey;
    }

    public static QueryDeniedException notAuthorized(String callKey) {
        return new QueryDeniedException(DenyReason.CALL_NOT_AUTHORIZED,
                "call \"" + callKey + "\" not authorized", callKey, null);
    }
}
