package com.querygate.core.loader;

import com.querygate.api.exception.InvalidAddressException;
import com.querygate.api.exception.InvalidSelectorException;
import com.querygate.api.exception.PermissionConfigException;
import com.querygate.core.security.CallKeyCodec;
import com.querygate.core.security.PermissionEntry;
import com.querygate.core.security.PermissionTable;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 权限文件加载器
 * <p>
 * 读取 YAML / JSON 权限文件，逐条校验并规范化，生成 {@link PermissionTable}。
 * 遇到第一个错误即失败，不返回部分结果。
 * </p>
 * 文件结构：
 * <pre>
 * Permissions:
 *   - userName: alice
 *     apiKey: "ABC123"
 *     allowedCalls:
 *       - ethCall:
 *           chain: 2
 *           contractAddress: "0xb4fbf271143f4fbf7b91a5ded31805e42b2208d6"
 *           call: "0x06fdde03"
 * </pre>
 */
@Slf4j
public final class PermissionFileLoader {

    static final String ROOT_KEY = "Permissions";
    static final String ETH_CALL_TAG = "ethCall";

    private PermissionFileLoader() {
    }

    public static PermissionTable load(Path file) {
        String fileName = file.toString();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(reader, fileName);
        } catch (IOException e) {
            throw new PermissionConfigException("failed to read permissions file \"" + fileName + "\": " + e.getMessage(), e);
        }
    }

    public static PermissionTable load(Reader reader, String fileName) {
        Object document = parse(reader, fileName);
        PermissionTable table = buildTable(document, fileName);
        log.info("Loaded permissions file \"{}\": {} users, {} allowed calls",
                fileName, table.userCount(), table.callCount());
        return table;
    }

    private static Object parse(Reader reader, String fileName) {
        // 1. 安全构造器：只产出 Map / List / 标量，拒绝重复键
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new SafeConstructor(options));
        try {
            return yaml.load(reader);
        } catch (YAMLException e) {
            throw new PermissionConfigException("failed to parse permissions file \"" + fileName + "\": " + e.getMessage(), e);
        }
    }

    private static PermissionTable buildTable(Object document, String fileName) {
        if (document == null) {
            throw new PermissionConfigException("permissions file \"" + fileName + "\" is empty");
        }
        if (!(document instanceof Map<?, ?> root)) {
            throw new PermissionConfigException("permissions file \"" + fileName + "\" must contain a mapping at the top level");
        }
        Object users = root.containsKey(ROOT_KEY) ? root.get(ROOT_KEY) : root.get("permissions");
        if (users == null) {
            log.warn("Permissions file \"{}\" does not declare any users", fileName);
            return new PermissionTable(fileName, Map.of());
        }
        if (!(users instanceof List<?> userList)) {
            throw new PermissionConfigException("\"" + ROOT_KEY + "\" in permissions file \"" + fileName + "\" must be a list");
        }

        Map<String, PermissionEntry> entries = new HashMap<>();
        for (Object user : userList) {
            PermissionEntry entry = buildEntry(user, fileName);
            // 2. API Key 小写后必须唯一
            if (entries.containsKey(entry.apiKey())) {
                throw new PermissionConfigException("API key \"" + entry.apiKey() + "\" in permissions file \""
                        + fileName + "\" is a duplicate");
            }
            entries.put(entry.apiKey(), entry);
        }
        return new PermissionTable(fileName, entries);
    }

    private static PermissionEntry buildEntry(Object user, String fileName) {
        if (!(user instanceof Map<?, ?> fields)) {
            throw new PermissionConfigException("user entry in permissions file \"" + fileName + "\" must be a mapping");
        }
        String userName = requireString(fields, "userName", "user", fileName);
        String apiKey = PermissionTable.normalizeApiKey(requireString(fields, "apiKey", "user \"" + userName + "\"", fileName));
        String owner = "user \"" + userName + "\" (API key \"" + apiKey + "\")";

        Object declared = fields.get("allowedCalls");
        if (declared != null && !(declared instanceof List)) {
            throw new PermissionConfigException("\"allowedCalls\" for " + owner + " in permissions file \""
                    + fileName + "\" must be a list");
        }

        // 3. 每条允许调用生成规范键，单用户内不允许重复
        Set<String> allowedCalls = new LinkedHashSet<>();
        if (declared != null) {
            for (Object call : (List<?>) declared) {
                String callKey = buildCallKey(call, owner, fileName);
                if (!allowedCalls.add(callKey)) {
                    throw new PermissionConfigException("\"" + callKey + "\" is a duplicate allowed call for "
                            + owner + " in permissions file \"" + fileName + "\"");
                }
            }
        }
        return new PermissionEntry(userName, apiKey, allowedCalls);
    }

    private static String buildCallKey(Object call, String owner, String fileName) {
        if (!(call instanceof Map<?, ?> tagged) || tagged.size() != 1) {
            throw new PermissionConfigException("allowed call for " + owner + " in permissions file \""
                    + fileName + "\" must declare exactly one call type");
        }
        Map.Entry<?, ?> tag = tagged.entrySet().iterator().next();
        if (!ETH_CALL_TAG.equals(tag.getKey())) {
            throw new PermissionConfigException("unsupported call type \"" + tag.getKey() + "\" for " + owner
                    + " in permissions file \"" + fileName + "\"");
        }
        if (!(tag.getValue() instanceof Map<?, ?> ethCall)) {
            throw new PermissionConfigException("\"" + ETH_CALL_TAG + "\" for " + owner + " in permissions file \""
                    + fileName + "\" must be a mapping");
        }
        return buildEthCallKey(ethCall, owner, fileName);
    }

    private static String buildEthCallKey(Map<?, ?> ethCall, String owner, String fileName) {
        Object chain = ethCall.get("chain");
        if (!(chain instanceof Integer chainId) || chainId < 0 || chainId > 0xFFFF) {
            throw new PermissionConfigException("invalid chain \"" + chain + "\" for " + owner
                    + " in permissions file \"" + fileName + "\", must be an integer between 0 and 65535");
        }
        String contractAddress = requireString(ethCall, "contractAddress", owner, fileName);
        String call = requireString(ethCall, "call", owner, fileName);

        byte[] address;
        try {
            address = CallKeyCodec.validateAddress(contractAddress);
        } catch (InvalidAddressException e) {
            throw new PermissionConfigException("invalid contract address \"" + contractAddress + "\" for "
                    + owner + " in permissions file \"" + fileName + "\"", e);
        }
        byte[] selector;
        try {
            selector = CallKeyCodec.validateSelector(call);
        } catch (InvalidSelectorException e) {
            throw new PermissionConfigException("invalid eth call \"" + call + "\" for " + owner
                    + " in permissions file \"" + fileName + "\", must be four bytes of hex", e);
        }
        return CallKeyCodec.encode(chainId, address, selector);
    }

    private static String requireString(Map<?, ?> fields, String name, String owner, String fileName) {
        Object value = fields.get(name);
        if (!(value instanceof String text) || text.isBlank()) {
            // 未加引号的十六进制在 YAML 中会被解析成数字
            throw new PermissionConfigException("\"" + name + "\" for " + owner + " in permissions file \""
                    + fileName + "\" must be a non-empty quoted string, is \"" + value + "\"");
        }
        return text;
    }
}
