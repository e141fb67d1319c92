package com.fishcards.dispatcher.ratelimit;

import com.fishcards.common.exception.RateLimitTimeoutException;

/**
 * 出站调用限流器接口。
 * <p>
 * 实例由构造方显式持有；多个请求要共享限流，就共享同一个实例。
 */
public interface RateLimiter {

    /**
     * 阻塞直到拿到 {@code tokens} 个令牌。
     *
     * @throws RateLimitTimeoutException 自调用开始超过最大等待时间仍未拿到
     */
    void acquire(int tokens);

    default void acquire() {
        acquire(1);
    }

    /**
     * 非阻塞地尝试消费令牌。
     *
     * @return true 表示已消费，false 表示令牌不足（未消费）
     */
    boolean tryAcquire(int tokens);

    /** 仅检查，不消费 */
    boolean canAcquire(int tokens);

    /** 当前可用令牌数（向下取整） */
    int getAvailableTokens();

    /** 距离下一个令牌可用的毫秒数，已有令牌时为 0 */
    long getTimeUntilNextToken();

    /** 恢复满桶（用于测试隔离） */
    void reset();

    /** 合并配置；容量变小时把当前令牌截到新容量 */
    void updateConfig(RateLimiterConfigUpdate update);

    RateLimiterConfig getConfig();
}
