package com.querygate.core.guardian;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.Utils;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint32;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 核心桥合约的 Guardian Set 相关 ABI
 * <pre>
 * function getCurrentGuardianSetIndex() external view returns (uint32)
 * function getGuardianSet(uint32 index) external view returns (GuardianSet memory)
 * struct GuardianSet { address[] keys; uint32 expirationTime; }
 * </pre>
 */
final class CoreBridgeAbi {

    // 返回值为单个动态 tuple，头部是指向 tuple 体的偏移量
    private static final int WORD_HEX_LENGTH = 64;
    private static final BigInteger TUPLE_OFFSET = BigInteger.valueOf(32);

    private CoreBridgeAbi() {
    }

    static Function getCurrentGuardianSetIndex() {
        return new Function("getCurrentGuardianSetIndex", List.of(), List.of(new TypeReference<Uint32>() {
        }));
    }

    static Function getGuardianSet(long index) {
        return new Function("getGuardianSet", List.of(new Uint32(index)), List.of());
    }

    static String encode(Function function) {
        return FunctionEncoder.encode(function);
    }

    static long decodeIndex(String returnData) {
        List<Type> values = FunctionReturnDecoder.decode(returnData, getCurrentGuardianSetIndex().getOutputParameters());
        if (values.isEmpty()) {
            throw new ContractCallException("getCurrentGuardianSetIndex returned no data");
        }
        return ((Uint32) values.get(0)).getValue().longValueExact();
    }

    @SuppressWarnings("unchecked")
    static List<String> decodeGuardianKeys(String returnData) {
        String hex = Numeric.cleanHexPrefix(returnData == null ? "" : returnData);
        if (hex.length() < WORD_HEX_LENGTH * 3) {
            throw new ContractCallException("getGuardianSet returned " + hex.length() / 2 + " bytes");
        }
        BigInteger offset = Numeric.toBigInt(hex.substring(0, WORD_HEX_LENGTH));
        if (!TUPLE_OFFSET.equals(offset)) {
            throw new ContractCallException("getGuardianSet returned an unexpected tuple offset " + offset);
        }
        // tuple 体本身即 (address[], uint32) 的标准参数编码
        List<TypeReference<?>> outputs = List.of(
                new TypeReference<DynamicArray<Address>>() {
                },
                new TypeReference<Uint32>() {
                });
        List<Type> values = FunctionReturnDecoder.decode("0x" + hex.substring(WORD_HEX_LENGTH), Utils.convert(outputs));
        if (values.size() != 2) {
            throw new ContractCallException("getGuardianSet returned malformed data");
        }
        DynamicArray<Address> keys = (DynamicArray<Address>) values.get(0);
        return keys.getValue().stream()
                .map(Address::getValue)
                .collect(Collectors.toList());
    }
}
