package com.fishcards.dispatcher.ratelimit;

import lombok.Builder;
import lombok.Value;

/**
 * 部分配置更新，字段为 null 表示保持原值。
 */
@Value
@Builder
public class RateLimiterConfigUpdate {
    Integer capacity;
    Double refillRate;
    Long refillIntervalMs;
    Long maxWaitTimeMs;
}
