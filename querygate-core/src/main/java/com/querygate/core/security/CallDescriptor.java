package com.querygate.core.security;

/**
 * 一个被允许或被请求的调用（封闭变体集合）
 * 两个描述符当且仅当规范键相等时视为同一调用。
 */
public sealed interface CallDescriptor permits EthCallDescriptor {

    String canonicalKey();
}
