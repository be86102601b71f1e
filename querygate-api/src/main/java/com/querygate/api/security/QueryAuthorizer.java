package com.querygate.api.security;

import com.querygate.api.exception.QueryDeniedException;
import com.querygate.api.query.QueryRequest;
import com.querygate.api.query.SignedQueryRequest;

/**
 * Core 提供 - 查询授权服务
 * 请求处理层在把查询派发给链上执行之前调用此接口。
 *
 * @author QueryGate
 */
public interface QueryAuthorizer {

    /**
     * 检查 API Key 是否有权执行请求中的全部调用。
     * <p>
     * 任意一个调用未授权即整体拒绝，不存在部分授权。
     * 注意：此处不校验请求签名。
     * </p>
     *
     * @param apiKey API Key，大小写不敏感
     * @param request 带签名的查询请求
     * @return 解码后的查询请求
     * @throws QueryDeniedException 拒绝时抛出，携带具体原因
     */
    QueryRequest authorize(String apiKey, SignedQueryRequest request);
}
