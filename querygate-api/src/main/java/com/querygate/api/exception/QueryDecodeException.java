package com.querygate.api.exception;

/**
 * 查询请求载荷无法解码
 */
public class QueryDecodeException extends QueryGateException {

    public QueryDecodeException(String message) {
        super(message);
    }

    public QueryDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
