package com.fishcards.common.exception;

/**
 * 令牌桶在最大等待时间内未能拿到足够令牌时抛出。
 */
public class RateLimitTimeoutException extends FishcardsException {

    private final int tokensRequired;
    private final long maxWaitTimeMs;

    public RateLimitTimeoutException(int tokensRequired, long maxWaitTimeMs) {
        super("RATE_LIMIT_TIMEOUT", "限流等待超时: " + maxWaitTimeMs + "ms 内无法获取 " + tokensRequired + " 个令牌");
        this.tokensRequired = tokensRequired;
        this.maxWaitTimeMs = maxWaitTimeMs;
    }

    public RateLimitTimeoutException(int tokensRequired, long maxWaitTimeMs, Throwable cause) {
        super("RATE_LIMIT_TIMEOUT", "等待令牌时被中断", cause);
        this.tokensRequired = tokensRequired;
        this.maxWaitTimeMs = maxWaitTimeMs;
    }

    public int getTokensRequired() {
        return tokensRequired;
    }

    public long getMaxWaitTimeMs() {
        return maxWaitTimeMs;
    }
}
