package com.fishcards.config;

import com.fishcards.ai.config.AiProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时检查 AI 提供商配置。
 * <p>
 * 使用 openrouter 时必须配置 API Key，可通过环境变量 OPENROUTER_API_KEY 提供；
 * 未配置时服务仍能启动，但生成请求会以 500 失败。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyStartupCheck implements CommandLineRunner {

    private final AiProperties aiProperties;

    @Override
    public void run(String... args) {
        String provider = aiProperties.getProvider();
        if (!"openrouter".equalsIgnoreCase(provider)) {
            log.info("AI 提供商: {}（无需 API Key）", provider);
            return;
        }
        String apiKey = aiProperties.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("==============================================");
            log.warn("  未配置 OpenRouter API Key！");
            log.warn("  请在 application.yml 中设置 fishcards.ai.api-key");
            log.warn("  或通过环境变量: OPENROUTER_API_KEY");
            log.warn("  本地调试可设置 fishcards.ai.provider=mock");
            log.warn("==============================================");
            return;
        }
        log.info("AI 提供商: openrouter, 默认模型: {}, 超时 {}ms",
                aiProperties.getDefaultModel(), aiProperties.getRequestTimeoutMs());
    }
}
