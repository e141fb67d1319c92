package com.fishcards.dispatcher.ratelimit;

/**
 * 常用的令牌桶参数组合。只是配置，不持有任何状态。
 */
public enum RateLimiterPreset {

    /** 生产默认：10 个突发额度，每秒补 1 个，最多等 30 秒 */
    CONSERVATIVE(10, 1, 1000, 30_000),

    /** 高吞吐：20 个突发额度，每秒补 5 个，最多等 15 秒 */
    AGGRESSIVE(20, 5, 1000, 15_000),

    /** 开发环境：更宽松 */
    DEVELOPMENT(50, 10, 1000, 10_000);

    private final int capacity;
    private final double refillRate;
    private final long refillIntervalMs;
    private final long maxWaitTimeMs;

    RateLimiterPreset(int capacity, double refillRate, long refillIntervalMs, long maxWaitTimeMs) {
        this.capacity = capacity;
        this.refillRate = refillRate;
        this.refillIntervalMs = refillIntervalMs;
        this.maxWaitTimeMs = maxWaitTimeMs;
    }

    public RateLimiterConfig toConfig() {
        return RateLimiterConfig.builder()
                .capacity(capacity)
                .refillRate(refillRate)
                .refillIntervalMs(refillIntervalMs)
                .maxWaitTimeMs(maxWaitTimeMs)
                .build();
    }
}
