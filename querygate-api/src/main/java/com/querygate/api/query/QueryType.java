package com.querygate.api.query;

import org.jspecify.annotations.Nullable;

/**
 * 单链查询类型，code 为线上格式中的类型字节
 */
public enum QueryType {
    ETH_CALL(1),
    ETH_CALL_BY_TIMESTAMP(2),
    ETH_CALL_WITH_FINALITY(3);

    private final int code;

    QueryType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    @Nullable
    public static QueryType fromCode(int code) {
        for (QueryType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        return null;
    }
}
