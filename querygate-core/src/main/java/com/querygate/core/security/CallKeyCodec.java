package com.querygate.core.security;

import com.querygate.api.exception.InvalidAddressException;
import com.querygate.api.exception.InvalidSelectorException;
import org.web3j.utils.Numeric;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * 规范调用键编解码
 * <p>
 * 格式：{@code ethCall:<chain>:<40 位小写十六进制地址>:<8 位小写十六进制选择器>}，
 * 例如 {@code ethCall:2:b4fbf271143f4fbf7b91a5ded31805e42b2208d6:06fdde03}。
 * </p>
 * <p>
 * 这是权限加载器与授权器之间的契约，两端必须只通过此类生成键。
 * 前缀即版本：新的调用类型使用新的前缀，互不冲突。
 * </p>
 */
public final class CallKeyCodec {

    public static final String ETH_CALL_PREFIX = "ethCall";
    public static final int ADDRESS_LENGTH = 20;
    public static final int SELECTOR_LENGTH = 4;

    // 32 字节左侧补零的通用地址格式
    private static final int UNIVERSAL_ADDRESS_LENGTH = 32;
    private static final char SEPARATOR = ':';
    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]*");
    private static final HexFormat LOWER_HEX = HexFormat.of();

    private CallKeyCodec() {
    }

    /**
     * 生成 eth_call 的规范键。
     *
     * @param chain 链 ID
     * @param address 20 字节合约地址
     * @param selector 4 字节函数选择器
     */
    public static String encode(int chain, byte[] address, byte[] selector) {
        if (address == null || address.length != ADDRESS_LENGTH) {
            throw new InvalidAddressException("contract address must be " + ADDRESS_LENGTH + " bytes");
        }
        if (selector == null || selector.length != SELECTOR_LENGTH) {
            throw new InvalidSelectorException("selector must be " + SELECTOR_LENGTH + " bytes");
        }
        return ETH_CALL_PREFIX + SEPARATOR + chain + SEPARATOR
                + LOWER_HEX.formatHex(address) + SEPARATOR + LOWER_HEX.formatHex(selector);
    }

    /**
     * 生成 eth_call 的规范键，十六进制输入大小写及 0x 前缀均不影响结果。
     */
    public static String encode(int chain, String address, String selector) {
        return encode(chain, validateAddress(address), validateSelector(selector));
    }

    /**
     * 解析十六进制合约地址。
     * 接受 20 字节地址，或前 12 字节为零的 32 字节地址。
     *
     * @return 20 字节地址
     */
    public static byte[] validateAddress(String input) {
        byte[] raw;
        try {
            raw = decodeHex(input);
        } catch (IllegalArgumentException e) {
            throw new InvalidAddressException("invalid contract address \"" + input + "\": " + e.getMessage());
        }
        try {
            return toAddress(raw);
        } catch (InvalidAddressException e) {
            throw new InvalidAddressException("invalid contract address \"" + input + "\": " + e.getMessage());
        }
    }

    /**
     * 将原始字节规范为 20 字节地址。
     */
    public static byte[] toAddress(byte[] raw) {
        if (raw == null) {
            throw new InvalidAddressException("address is missing");
        }
        if (raw.length == ADDRESS_LENGTH) {
            return raw.clone();
        }
        if (raw.length == UNIVERSAL_ADDRESS_LENGTH) {
            int padding = UNIVERSAL_ADDRESS_LENGTH - ADDRESS_LENGTH;
            for (int i = 0; i < padding; i++) {
                if (raw[i] != 0) {
                    throw new InvalidAddressException("32-byte address is not a left-padded 20-byte address");
                }
            }
            return Arrays.copyOfRange(raw, padding, UNIVERSAL_ADDRESS_LENGTH);
        }
        throw new InvalidAddressException("address has length " + raw.length + ", must be "
                + ADDRESS_LENGTH + " or " + UNIVERSAL_ADDRESS_LENGTH + " bytes");
    }

    /**
     * 解析十六进制函数选择器，解码后必须恰好 4 字节，不做截断或补齐。
     */
    public static byte[] validateSelector(String input) {
        byte[] raw;
        try {
            raw = decodeHex(input);
        } catch (IllegalArgumentException e) {
            throw new InvalidSelectorException("invalid selector \"" + input + "\": " + e.getMessage());
        }
        if (raw.length != SELECTOR_LENGTH) {
            throw new InvalidSelectorException("selector \"" + input + "\" has an invalid length, must be four bytes");
        }
        return raw;
    }

    /**
     * 解析规范键（{@link #encode} 的逆操作）。
     */
    public static EthCallDescriptor parse(String key) {
        if (key == null) {
            throw new IllegalArgumentException("call key is missing");
        }
        String[] parts = key.split(String.valueOf(SEPARATOR), -1);
        if (parts.length != 4) {
            throw new IllegalArgumentException("call key \"" + key + "\" must have four colon separated fields");
        }
        if (!ETH_CALL_PREFIX.equals(parts[0])) {
            throw new IllegalArgumentException("unsupported call key type \"" + parts[0] + "\"");
        }
        int chain;
        try {
            chain = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("call key \"" + key + "\" has an invalid chain", e);
        }
        if (parts[2].length() != ADDRESS_LENGTH * 2 || parts[3].length() != SELECTOR_LENGTH * 2) {
            throw new IllegalArgumentException("call key \"" + key + "\" is not in canonical form");
        }
        return new EthCallDescriptor(chain, validateAddress(parts[2]), validateSelector(parts[3]));
    }

    private static byte[] decodeHex(String input) {
        if (input == null) {
            throw new IllegalArgumentException("value is missing");
        }
        String clean = input.trim();
        // Numeric.cleanHexPrefix 只识别小写 0x
        if (clean.regionMatches(true, 0, "0x", 0, 2)) {
            clean = clean.substring(2);
        }
        if (!HEX.matcher(clean).matches()) {
            throw new IllegalArgumentException("not a hex string");
        }
        if (clean.length() % 2 != 0) {
            throw new IllegalArgumentException("odd number of hex digits");
        }
        return Numeric.hexStringToByteArray(clean);
    }
}
