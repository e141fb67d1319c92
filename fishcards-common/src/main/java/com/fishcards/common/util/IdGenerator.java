package com.fishcards.common.util;

import java.util.UUID;

/**
 * ID 生成器工具类。
 */
public final class IdGenerator {

    private IdGenerator() {
    }

    /**
     * 生成短 UUID（去掉连字符）。
     */
    public static String shortUuid() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * 生成带前缀的请求 ID，如 "gen-xxxx"。
     */
    public static String requestId(String prefix) {
        return prefix + "-" + System.currentTimeMillis() + "-" + shortUuid().substring(0, 9);
    }
}
