package com.querygate.core.security;

import com.querygate.api.exception.InvalidAddressException;
import com.querygate.api.exception.QueryDecodeException;
import com.querygate.api.exception.QueryDeniedException;
import com.querygate.api.query.ChainSpecificQuery;
import com.querygate.api.query.EthCallData;
import com.querygate.api.query.EthCallQueryRequest;
import com.querygate.api.query.PerChainQuery;
import com.querygate.api.query.QueryRequest;
import com.querygate.api.query.SignedQueryRequest;
import com.querygate.api.security.DenyReason;
import com.querygate.api.security.QueryAuthorizer;
import com.querygate.core.spi.QueryRequestDecoder;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * 默认查询授权实现
 * <p>
 * 职责：解码请求、校验结构、逐个核对调用是否在用户的允许集合中。
 * 纯内存计算，无 I/O、无阻塞、不修改权限表，可被任意多个线程并发调用。
 * </p>
 */
@Slf4j
public class DefaultQueryAuthorizer implements QueryAuthorizer {

    private final Supplier<PermissionTable> tableSupplier;
    private final QueryRequestDecoder decoder;

    public DefaultQueryAuthorizer(PermissionRegistry registry, QueryRequestDecoder decoder) {
        this(registry::current, decoder);
    }

    public DefaultQueryAuthorizer(Supplier<PermissionTable> tableSupplier, QueryRequestDecoder decoder) {
        this.tableSupplier = tableSupplier;
        this.decoder = decoder;
    }

    @Override
    public QueryRequest authorize(String apiKey, SignedQueryRequest request) {
        // 每个请求只取一次快照，重载不会影响进行中的授权
        return authorize(apiKey, request, tableSupplier.get());
    }

    /**
     * 基于指定权限表授权
     */
    public QueryRequest authorize(String apiKey, SignedQueryRequest request, PermissionTable table) {
        // 1. API Key 查表
        PermissionEntry entry = table.lookup(apiKey);
        if (entry == null) {
            log.debug("DENY: unknown api key");
            throw new QueryDeniedException(DenyReason.INVALID_API_KEY, "invalid api key");
        }

        // TODO: 签名校验的归属（上游层或此处）需按威胁模型确认，目前不校验 request.signature()

        // 2. 解码
        QueryRequest queryRequest;
        try {
            queryRequest = decoder.decode(request.queryRequest());
        } catch (QueryDecodeException e) {
            log.debug("DENY: user [{}] sent a malformed request: {}", entry.userName(), e.getMessage());
            throw new QueryDeniedException(DenyReason.MALFORMED_REQUEST,
                    "failed to unmarshal request: " + e.getMessage(), e);
        }

        // 3. 结构校验
        try {
            queryRequest.validate();
        } catch (IllegalArgumentException e) {
            log.debug("DENY: user [{}] sent an invalid request: {}", entry.userName(), e.getMessage());
            throw new QueryDeniedException(DenyReason.INVALID_REQUEST,
                    "failed to validate request: " + e.getMessage(), e);
        }

        // 4. 每个调用都必须被允许，任意一个失败即整体拒绝
        for (PerChainQuery pcq : queryRequest.perChainQueries()) {
            checkQuery(entry, pcq.chainId(), pcq.query());
        }

        log.debug("ALLOW: user [{}] request with {} per chain queries", entry.userName(),
                queryRequest.perChainQueries().size());
        return queryRequest;
    }

    private void checkQuery(PermissionEntry entry, int chainId, ChainSpecificQuery query) {
        if (query instanceof EthCallQueryRequest ethCall) {
            for (EthCallData callData : ethCall.callData()) {
                checkEthCall(entry, chainId, callData);
            }
            return;
        }
        log.debug("DENY: user [{}] requested unsupported query type {} on chain {}",
                entry.userName(), query.type(), chainId);
        throw new QueryDeniedException(DenyReason.UNSUPPORTED_QUERY_TYPE,
                "unsupported query type " + query.type());
    }

    private void checkEthCall(PermissionEntry entry, int chainId, EthCallData callData) {
        byte[] contractAddress;
        // 结构校验已保证 to 为 20 字节，此分支只在 toAddress 规则与校验不一致时触发
        try {
            contractAddress = CallKeyCodec.toAddress(callData.to());
        } catch (InvalidAddressException e) {
            log.debug("DENY: user [{}] sent an unparseable contract address", entry.userName());
            throw new QueryDeniedException(DenyReason.ADDRESS_PARSE_ERROR,
                    "failed to parse contract address: " + e.getMessage(), e);
        }
        if (callData.data().length < CallKeyCodec.SELECTOR_LENGTH) {
            log.debug("DENY: user [{}] sent {} bytes of call data", entry.userName(), callData.data().length);
            throw new QueryDeniedException(DenyReason.CALL_DATA_TOO_SHORT,
                    "eth call data must be at least four bytes");
        }

        String callKey = EthCallDescriptor.fromCallData(chainId, contractAddress, callData.data()).canonicalKey();
        if (!entry.isAllowed(callKey)) {
            log.debug("DENY: user [{}] requested an unauthorized call \"{}\"", entry.userName(), callKey);
            throw QueryDeniedException.notAuthorized(callKey);
        }
    }
}
