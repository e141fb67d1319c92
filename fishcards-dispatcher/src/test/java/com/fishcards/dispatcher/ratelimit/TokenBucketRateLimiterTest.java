package com.fishcards.dispatcher.ratelimit;

import com.fishcards.common.exception.RateLimitTimeoutException;
import com.fishcards.common.logging.GenerationLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class TokenBucketRateLimiterTest {

    private static final int CAPACITY = 5;

    private MutableClock clock;
    private GenerationLogger generationLogger;
    private TokenBucketRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000_000L);
        generationLogger = mock(GenerationLogger.class);
        limiter = new TokenBucketRateLimiter(RateLimiterConfig.builder()
                .capacity(CAPACITY)
                .refillRate(2)
                .refillIntervalMs(1000)
                .maxWaitTimeMs(0)
                .build(), clock, generationLogger);
    }

    @Test
    @DisplayName("满桶时立即取完全部容量，之后再取 1 个拿不到")
    void drainsFullCapacityImmediately() {
        for (int i = 0; i < CAPACITY; i++) {
            limiter.acquire(1);
        }

        assertThat(limiter.getAvailableTokens()).isZero();
        assertThat(limiter.canAcquire(1)).isFalse();
        assertThat(limiter.tryAcquire(1)).isFalse();
    }

    @Test
    @DisplayName("maxWaitTimeMs=0 且无令牌时立即超时")
    void zeroMaxWaitFailsImmediately() {
        limiter.acquire(CAPACITY);

        assertThatThrownBy(() -> limiter.acquire(1))
                .isInstanceOfSatisfying(RateLimitTimeoutException.class, e -> {
                    assertThat(e.getTokensRequired()).isEqualTo(1);
                    assertThat(e.getMaxWaitTimeMs()).isZero();
                    assertThat(e.getErrorCode()).isEqualTo("RATE_LIMIT_TIMEOUT");
                });
    }

    @Test
    @DisplayName("经过一个完整周期补充 refillRate 个令牌")
    void refillsAfterOneInterval() {
        limiter.acquire(CAPACITY);

        clock.advance(999);
        assertThat(limiter.getAvailableTokens()).isZero();

        clock.advance(1);
        assertThat(limiter.getAvailableTokens()).isEqualTo(2);
    }

    @Test
    @DisplayName("补充不会漂移：不足一个周期的余量保留到下一次")
    void refillDoesNotDrift() {
        limiter.acquire(CAPACITY);

        clock.advance(1500);
        assertThat(limiter.getAvailableTokens()).isEqualTo(2);
        assertThat(limiter.getTimeUntilNextToken()).isZero();

        limiter.acquire(2);
        assertThat(limiter.getTimeUntilNextToken()).isEqualTo(500);

        clock.advance(500);
        assertThat(limiter.getAvailableTokens()).isEqualTo(2);
    }

    @Test
    void refillIsCappedAtCapacity() {
        limiter.acquire(1);
        clock.advance(60_000);

        assertThat(limiter.getAvailableTokens()).isEqualTo(CAPACITY);
    }

    @Test
    void resetRestoresFullBucket() {
        limiter.acquire(CAPACITY);

        limiter.reset();

        assertThat(limiter.getAvailableTokens()).isEqualTo(CAPACITY);
    }

    @Test
    @DisplayName("缩小容量时当前令牌被截断，并记录配置变更")
    void updateConfigClampsTokensAndLogsChanges() {
        limiter.updateConfig(RateLimiterConfigUpdate.builder().capacity(3).build());

        assertThat(limiter.getAvailableTokens()).isEqualTo(3);
        assertThat(limiter.getConfig().getCapacity()).isEqualTo(3);
        assertThat(limiter.getConfig().getRefillRate()).isEqualTo(2.0);
        verify(generationLogger).logConfigChange("capacity", 5, 3);
        verify(generationLogger, never()).logConfigChange(eq("refillRate"), any(), any());
    }

    @Test
    void updateConfigRejectsInvalidValuesAndKeepsOldConfig() {
        assertThatThrownBy(() -> limiter.updateConfig(RateLimiterConfigUpdate.builder().capacity(0).build()))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(limiter.getConfig().getCapacity()).isEqualTo(CAPACITY);
    }

    @Test
    void constructorValidatesConfig() {
        assertThatThrownBy(() -> new TokenBucketRateLimiter(RateLimiterConfig.builder()
                .capacity(1).refillRate(0).refillIntervalMs(1000).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenBucketRateLimiter(RateLimiterConfig.builder()
                .capacity(1).refillRate(1).refillIntervalMs(1000).maxWaitTimeMs(-1).build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultMaxWaitIsThirtySeconds() {
        RateLimiterConfig config = RateLimiterConfig.builder().capacity(1).refillRate(1).refillIntervalMs(1000).build();

        assertThat(config.getMaxWaitTimeMs()).isEqualTo(30_000L);
    }

    @Test
    void rejectsNonPositiveTokenCount() {
        assertThatThrownBy(() -> limiter.acquire(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> limiter.tryAcquire(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("并发消费不会超发")
    void concurrentTryAcquireNeverOverspends() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        try {
            for (int i = 0; i < 40; i++) {
                pool.submit(() -> {
                    start.await();
                    if (limiter.tryAcquire(1)) {
                        granted.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(granted.get()).isEqualTo(CAPACITY);
    }

    @Test
    @DisplayName("真实时钟下阻塞等待到下一次补充")
    void acquireBlocksUntilRefillWithRealClock() {
        TokenBucketRateLimiter realTime = new TokenBucketRateLimiter(RateLimiterConfig.builder()
                .capacity(1)
                .refillRate(1)
                .refillIntervalMs(200)
                .maxWaitTimeMs(5_000)
                .build(), Clock.systemUTC(), generationLogger);
        realTime.acquire();

        long start = System.nanoTime();
        realTime.acquire();
        long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(waitedMs).isGreaterThanOrEqualTo(100);
    }
}
