package com.fishcards.dispatcher.config;

import com.fishcards.common.logging.GenerationLogger;
import com.fishcards.dispatcher.ratelimit.RateLimiter;
import com.fishcards.dispatcher.ratelimit.RateLimiterConfig;
import com.fishcards.dispatcher.ratelimit.TokenBucketRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 调度模块配置。
 * <p>
 * 整个进程只构造一个令牌桶实例，通过注入在所有生成请求之间共享。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RateLimiterProperties.class)
public class DispatcherModuleConfig {

    @Bean
    public RateLimiter generationRateLimiter(RateLimiterProperties properties, GenerationLogger generationLogger) {
        RateLimiterConfig config = properties.toConfig();
        log.info("初始化令牌桶限流器: 容量={}, 每 {}ms 补充 {} 个, 最长等待 {}ms, 预设={}",
                config.getCapacity(), config.getRefillIntervalMs(), config.getRefillRate(),
                config.getMaxWaitTimeMs(), properties.getPreset());
        return new TokenBucketRateLimiter(config, Clock.systemUTC(), generationLogger);
    }
}
