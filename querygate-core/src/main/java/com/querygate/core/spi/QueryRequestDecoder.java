package com.querygate.core.spi;

import com.querygate.api.exception.QueryDecodeException;
import com.querygate.api.query.QueryRequest;

/**
 * 查询请求解码 SPI
 * 默认实现为 {@link com.querygate.core.codec.QueryRequestCodec}。
 */
public interface QueryRequestDecoder {

    /**
     * @param payload 签名信封中的请求载荷
     * @throws QueryDecodeException 载荷格式错误
     */
    QueryRequest decode(byte[] payload);
}
