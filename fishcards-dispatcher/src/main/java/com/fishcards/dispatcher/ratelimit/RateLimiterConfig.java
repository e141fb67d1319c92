package com.fishcards.dispatcher.ratelimit;

import lombok.Builder;
import lombok.Value;

/**
 * 令牌桶参数快照。
 */
@Value
@Builder(toBuilder = true)
public class RateLimiterConfig {

    public static final long DEFAULT_MAX_WAIT_TIME_MS = 30_000L;

    /** 桶容量 */
    int capacity;

    /** 每个补充周期加入的令牌数 */
    double refillRate;

    /** 补充周期（毫秒） */
    long refillIntervalMs;

    /** acquire 最长等待时间（毫秒） */
    @Builder.Default
    long maxWaitTimeMs = DEFAULT_MAX_WAIT_TIME_MS;

    void validate() {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity 必须大于 0: " + capacity);
        }
        if (refillRate <= 0) {
            throw new IllegalArgumentException("refillRate 必须大于 0: " + refillRate);
        }
        if (refillIntervalMs <= 0) {
            throw new IllegalArgumentException("refillIntervalMs 必须大于 0: " + refillIntervalMs);
        }
        if (maxWaitTimeMs < 0) {
            throw new IllegalArgumentException("maxWaitTimeMs 不能为负数: " + maxWaitTimeMs);
        }
    }
}
