package com.querygate.api.security;

/**
 * 授权拒绝原因
 *
 * @author QueryGate
 */
public enum DenyReason {
    INVALID_API_KEY,
    MALFORMED_REQUEST,
    INVALID_REQUEST,
    UNSUPPORTED_QUERY_TYPE,
    ADDRESS_PARSE_ERROR,
    CALL_DATA_TOO_SHORT,
    CALL_NOT_AUTHORIZED
}
