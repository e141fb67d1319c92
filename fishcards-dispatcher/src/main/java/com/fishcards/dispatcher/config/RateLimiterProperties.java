package com.fishcards.dispatcher.config;

import com.fishcards.dispatcher.ratelimit.RateLimiterConfig;
import com.fishcards.dispatcher.ratelimit.RateLimiterPreset;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 出站限流配置项。
 */
@Data
@ConfigurationProperties(prefix = "fishcards.dispatcher")
public class RateLimiterProperties {

    /** 是否在调用 AI 前获取令牌 */
    private boolean enabled = true;

    /** 预设名称；配置后忽略下面的单项参数 */
    private RateLimiterPreset preset;

    /** 桶容量 */
    private int capacity = 10;

    /** 每个周期补充的令牌数 */
    private double refillRate = 1;

    /** 补充周期（毫秒） */
    private long refillIntervalMs = 1000;

    /** 获取令牌的最长等待时间（毫秒） */
    private long maxWaitTimeMs = RateLimiterConfig.DEFAULT_MAX_WAIT_TIME_MS;

    public RateLimiterConfig toConfig() {
        if (preset != null) {
            return preset.toConfig();
        }
        return RateLimiterConfig.builder()
                .capacity(capacity)
                .refillRate(refillRate)
                .refillIntervalMs(refillIntervalMs)
                .maxWaitTimeMs(maxWaitTimeMs)
                .build();
    }
}
