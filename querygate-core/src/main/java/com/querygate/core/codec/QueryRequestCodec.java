package com.querygate.core.codec;

import com.querygate.api.exception.QueryDecodeException;
import com.querygate.api.query.ChainSpecificQuery;
import com.querygate.api.query.EthCallByTimestampQueryRequest;
import com.querygate.api.query.EthCallData;
import com.querygate.api.query.EthCallQueryRequest;
import com.querygate.api.query.EthCallWithFinalityQueryRequest;
import com.querygate.api.query.PerChainQuery;
import com.querygate.api.query.QueryRequest;
import com.querygate.api.query.QueryType;
import com.querygate.core.spi.QueryRequestDecoder;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 查询请求二进制编解码（大端序）
 * <pre>
 * QueryRequest  := version:u8(=1) nonce:u32 count:u8 PerChainQuery*
 * PerChainQuery := chainId:u16 type:u8 length:u32 body[length]
 * EthCall               := blockId:str calls
 * EthCallByTimestamp    := targetTimestamp:u64 targetBlockHint:str followingBlockHint:str calls
 * EthCallWithFinality   := blockId:str finality:str calls
 * calls := count:u8 (to:bytes20 dataLength:u32 data)*
 * str   := length:u32 utf8[length]
 * </pre>
 */
public class QueryRequestCodec implements QueryRequestDecoder {

    public static final int MSG_VERSION = 1;

    @Override
    public QueryRequest decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new QueryDecodeException("query request payload is empty");
        }
        ByteBuffer buf = ByteBuffer.wrap(payload);
        try {
            int version = Byte.toUnsignedInt(buf.get());
            if (version != MSG_VERSION) {
                throw new QueryDecodeException("unsupported message version: " + version);
            }
            long nonce = Integer.toUnsignedLong(buf.getInt());
            int count = Byte.toUnsignedInt(buf.get());
            List<PerChainQuery> queries = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                queries.add(decodePerChainQuery(buf, i));
            }
            if (buf.hasRemaining()) {
                throw new QueryDecodeException("excess bytes in query request: " + buf.remaining());
            }
            return new QueryRequest(nonce, queries);
        } catch (BufferUnderflowException e) {
            throw new QueryDecodeException("query request is truncated", e);
        }
    }

    private PerChainQuery decodePerChainQuery(ByteBuffer buf, int index) {
        int chainId = Short.toUnsignedInt(buf.getShort());
        int typeCode = Byte.toUnsignedInt(buf.get());
        QueryType type = QueryType.fromCode(typeCode);
        if (type == null) {
            throw new QueryDecodeException("per chain query " + index + " has unsupported query type: " + typeCode);
        }
        int length = readLength(buf);
        ByteBuffer body = buf.slice(buf.position(), length);
        buf.position(buf.position() + length);

        ChainSpecificQuery query = switch (type) {
            case ETH_CALL -> new EthCallQueryRequest(readString(body), readCalls(body));
            case ETH_CALL_BY_TIMESTAMP -> new EthCallByTimestampQueryRequest(
                    body.getLong(), readString(body), readString(body), readCalls(body));
            case ETH_CALL_WITH_FINALITY -> new EthCallWithFinalityQueryRequest(
                    readString(body), readString(body), readCalls(body));
        };
        if (body.hasRemaining()) {
            throw new QueryDecodeException("excess bytes in per chain query " + index + ": " + body.remaining());
        }
        return new PerChainQuery(chainId, query);
    }

    private List<EthCallData> readCalls(ByteBuffer buf) {
        int count = Byte.toUnsignedInt(buf.get());
        List<EthCallData> calls = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            byte[] to = new byte[EthCallData.ADDRESS_LENGTH];
            buf.get(to);
            byte[] data = new byte[readLength(buf)];
            buf.get(data);
            calls.add(new EthCallData(to, data));
        }
        return calls;
    }

    private String readString(ByteBuffer buf) {
        byte[] raw = new byte[readLength(buf)];
        buf.get(raw);
        return new String(raw, StandardCharsets.UTF_8);
    }

    // 长度字段不可信，先与剩余字节比较再分配
    private int readLength(ByteBuffer buf) {
        long length = Integer.toUnsignedLong(buf.getInt());
        if (length > buf.remaining()) {
            throw new QueryDecodeException("length " + length + " exceeds remaining " + buf.remaining() + " bytes");
        }
        return (int) length;
    }

    /**
     * 编码查询请求（客户端与测试使用）
     */
    public byte[] encode(QueryRequest request) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeByte(MSG_VERSION);
            out.writeInt((int) request.nonce());
            out.writeByte(requireU8(request.perChainQueries().size(), "per chain queries"));
            for (PerChainQuery pcq : request.perChainQueries()) {
                out.writeShort(pcq.chainId());
                out.writeByte(pcq.query().type().code());
                byte[] body = encodeQuery(pcq.query());
                out.writeInt(body.length);
                out.write(body);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    private byte[] encodeQuery(ChainSpecificQuery query) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        if (query instanceof EthCallQueryRequest q) {
            writeString(out, q.blockId());
            writeCalls(out, q.callData());
        } else if (query instanceof EthCallByTimestampQueryRequest q) {
            out.writeLong(q.targetTimestamp());
            writeString(out, q.targetBlockIdHint());
            writeString(out, q.followingBlockIdHint());
            writeCalls(out, q.callData());
        } else if (query instanceof EthCallWithFinalityQueryRequest q) {
            writeString(out, q.blockId());
            writeString(out, q.finality());
            writeCalls(out, q.callData());
        } else {
            throw new IllegalStateException("unknown query type: " + query.getClass().getName());
        }
        out.flush();
        return bytes.toByteArray();
    }

    private void writeCalls(DataOutputStream out, List<EthCallData> calls) throws IOException {
        out.writeByte(requireU8(calls.size(), "call data entries"));
        for (EthCallData call : calls) {
            if (call.to().length != EthCallData.ADDRESS_LENGTH) {
                throw new IllegalArgumentException("contract address must be " + EthCallData.ADDRESS_LENGTH + " bytes");
            }
            out.write(call.to());
            out.writeInt(call.data().length);
            out.write(call.data());
        }
    }

    private void writeString(DataOutputStream out, String value) throws IOException {
        byte[] raw = value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8);
        out.writeInt(raw.length);
        out.write(raw);
    }

    private int requireU8(int count, String what) {
        if (count > 0xFF) {
            throw new IllegalArgumentException("too many " + what + ": " + count);
        }
        return count;
    }
}
