package com.querygate.api.exception;

/**
 * 合约地址格式非法
 */
public class InvalidAddressException extends QueryGateException {

    public InvalidAddressException(String message) {
        super(message);
    }
}
