package com.fishcards.ai.config;

import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * AI 模块自动配置。
 * <p>
 * 整体超时由每次调用的 {@code Call.timeout()} 控制，这里只设置连接与读写的底线。
 */
@Configuration
@ComponentScan(basePackages = "com.fishcards.ai")
@EnableConfigurationProperties({AiProperties.class, GenerationProperties.class})
public class AiModuleConfig {

    @Bean
    public OkHttpClient aiHttpClient(AiProperties properties) {
        Duration requestTimeout = Duration.ofMillis(properties.getRequestTimeoutMs());
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .readTimeout(requestTimeout)
                .writeTimeout(requestTimeout)
                .retryOnConnectionFailure(false)
                .build();
    }
}
