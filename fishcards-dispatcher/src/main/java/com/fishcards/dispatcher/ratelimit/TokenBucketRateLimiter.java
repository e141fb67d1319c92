package com.fishcards.dispatcher.ratelimit;

import com.fishcards.common.exception.RateLimitTimeoutException;
import com.fishcards.common.logging.GenerationLogger;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 基于内存的令牌桶限流器。
 * <p>
 * 令牌惰性补充，没有后台定时器：每次检查时按已经过的完整周期数补充，
 * 并把 {@code lastRefillTime} 前移整数个周期（而不是设为当前时间），避免漂移。
 * <p>
 * {@code (tokens, lastRefillTime)} 是唯一的共享可变状态，读改写全部在锁内完成；
 * acquire 等待时在锁外休眠，休眠时长夹在 [100ms, 1000ms]。
 */
@Slf4j
public class TokenBucketRateLimiter implements RateLimiter {

    static final long MIN_SLEEP_MS = 100;
    static final long MAX_SLEEP_MS = 1000;

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final GenerationLogger generationLogger;

    private RateLimiterConfig config;
    private double tokens;
    private long lastRefillTime;

    public TokenBucketRateLimiter(RateLimiterConfig config) {
        this(config, Clock.systemUTC(), new GenerationLogger(false));
    }

    public TokenBucketRateLimiter(RateLimiterConfig config, Clock clock, GenerationLogger generationLogger) {
        config.validate();
        this.config = config;
        this.clock = clock;
        this.generationLogger = generationLogger;
        this.tokens = config.getCapacity();
        this.lastRefillTime = clock.millis();
    }

    @Override
    public void acquire(int tokensRequired) {
        checkTokens(tokensRequired);
        long startTime = clock.millis();

        while (true) {
            long sleepMs;
            long maxWaitTimeMs;
            lock.lock();
            try {
                long now = clock.millis();
                refill(now);
                if (tokens >= tokensRequired) {
                    tokens -= tokensRequired;
                    return;
                }
                maxWaitTimeMs = config.getMaxWaitTimeMs();
                long untilNextRefill = config.getRefillIntervalMs() - (now - lastRefillTime);
                sleepMs = Math.max(MIN_SLEEP_MS, Math.min(untilNextRefill, MAX_SLEEP_MS));
            } finally {
                lock.unlock();
            }

            if (clock.millis() - startTime >= maxWaitTimeMs) {
                log.debug("限流等待超时: 需要 {} 个令牌, 最长等待 {}ms", tokensRequired, maxWaitTimeMs);
                throw new RateLimitTimeoutException(tokensRequired, maxWaitTimeMs);
            }

            try {
                Thread.sleep(sleepMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RateLimitTimeoutException(tokensRequired, maxWaitTimeMs, e);
            }
        }
    }

    @Override
    public boolean tryAcquire(int tokensRequired) {
        checkTokens(tokensRequired);
        lock.lock();
        try {
            refill(clock.millis());
            if (tokens >= tokensRequired) {
                tokens -= tokensRequired;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean canAcquire(int tokensRequired) {
        lock.lock();
        try {
            refill(clock.millis());
            return tokens >= tokensRequired;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getAvailableTokens() {
        lock.lock();
        try {
            refill(clock.millis());
            return (int) Math.floor(tokens);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long getTimeUntilNextToken() {
        lock.lock();
        try {
            long now = clock.millis();
            refill(now);
            if (tokens >= 1) {
                return 0;
            }
            return Math.max(0, config.getRefillIntervalMs() - (now - lastRefillTime));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            tokens = config.getCapacity();
            lastRefillTime = clock.millis();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void updateConfig(RateLimiterConfigUpdate update) {
        lock.lock();
        try {
            RateLimiterConfig old = config;
            RateLimiterConfig.RateLimiterConfigBuilder builder = old.toBuilder();
            if (update.getCapacity() != null) {
                builder.capacity(update.getCapacity());
            }
            if (update.getRefillRate() != null) {
                builder.refillRate(update.getRefillRate());
            }
            if (update.getRefillIntervalMs() != null) {
                builder.refillIntervalMs(update.getRefillIntervalMs());
            }
            if (update.getMaxWaitTimeMs() != null) {
                builder.maxWaitTimeMs(update.getMaxWaitTimeMs());
            }
            RateLimiterConfig merged = builder.build();
            merged.validate();

            config = merged;
            tokens = Math.min(tokens, merged.getCapacity());

            logIfChanged("capacity", old.getCapacity(), merged.getCapacity());
            logIfChanged("refillRate", old.getRefillRate(), merged.getRefillRate());
            logIfChanged("refillIntervalMs", old.getRefillIntervalMs(), merged.getRefillIntervalMs());
            logIfChanged("maxWaitTimeMs", old.getMaxWaitTimeMs(), merged.getMaxWaitTimeMs());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RateLimiterConfig getConfig() {
        lock.lock();
        try {
            return config;
        } finally {
            lock.unlock();
        }
    }

    /** 调用方必须持有锁 */
    private void refill(long now) {
        long elapsed = now - lastRefillTime;
        long cycles = elapsed / config.getRefillIntervalMs();
        if (cycles >= 1) {
            tokens = Math.min(config.getCapacity(), tokens + cycles * config.getRefillRate());
            lastRefillTime += cycles * config.getRefillIntervalMs();
        }
    }

    private void logIfChanged(String property, Object oldValue, Object newValue) {
        if (!oldValue.equals(newValue)) {
            generationLogger.logConfigChange(property, oldValue, newValue);
        }
    }

    private static void checkTokens(int tokensRequired) {
        if (tokensRequired < 1) {
            throw new IllegalArgumentException("tokensRequired 必须至少为 1: " + tokensRequired);
        }
    }
}
