package com.querygate.api.exception;

/**
 * 函数选择器格式非法（必须恰好 4 字节）
 */
public class InvalidSelectorException extends QueryGateException {

    public InvalidSelectorException(String message) {
        super(message);
    }
}
