package com.querygate.api.query;

import java.util.HexFormat;
import java.util.Objects;

/**
 * 带签名的查询请求信封
 * <p>
 * queryRequest 为序列化后的 {@link QueryRequest}；signature 由上游层负责校验，授权逻辑只读取载荷。
 * </p>
 */
public record SignedQueryRequest(byte[] queryRequest, byte[] signature) {

    public SignedQueryRequest {
        Objects.requireNonNull(queryRequest, "queryRequest");
        signature = signature == null ? new byte[0] : signature;
    }

    public static SignedQueryRequest unsigned(byte[] queryRequest) {
        return new SignedQueryRequest(queryRequest, new byte[0]);
    }

    @Override
    public String toString() {
        return "SignedQueryRequest[queryRequest=" + queryRequest.length + " bytes, signature="
                + HexFormat.of().formatHex(signature) + "]";
    }
}
