package com.querygate.api.exception;

/**
 * 权限配置异常
 * <p>
 * 权限文件无法读取、格式错误、API Key 重复、地址/选择器非法、允许调用重复或调用类型不受支持时抛出。
 * 加载阶段遇到此异常即整体失败，不会产生部分可用的权限表。
 * </p>
 *
 * @author QueryGate
 */
public class PermissionConfigException extends QueryGateException {

    public PermissionConfigException(String message) {
        super(message);
    }

    public PermissionConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
