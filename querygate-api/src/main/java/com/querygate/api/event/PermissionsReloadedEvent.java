package com.querygate.api.event;

import lombok.Getter;

/**
 * 权限表替换完成事件
 * 场景：依赖权限表的缓存失效、运维审计
 */
@Getter
public class PermissionsReloadedEvent extends QueryGateEvent {

    private final String source;
    private final int userCount;
    private final int callCount;

    public PermissionsReloadedEvent(String source, int userCount, int callCount) {
        this.source = source;
        this.userCount = userCount;
        this.callCount = callCount;
    }

    @Override
    public String toString() {
        return "PermissionsReloadedEvent[source=" + source + ", users=" + userCount + ", calls=" + callCount + "]";
    }
}
