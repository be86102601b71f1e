package com.querygate.api.exception;

/**
 * QueryGate 基础异常
 *
 * @author QueryGate
 */
public class QueryGateException extends RuntimeException {

    public QueryGateException(String message) {
        super(message);
    }

    public QueryGateException(String message, Throwable cause) {
        super(message, cause);
    }
}
