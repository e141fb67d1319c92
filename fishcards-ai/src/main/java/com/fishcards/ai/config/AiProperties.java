package com.fishcards.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * AI 模块配置项。
 */
@Data
@ConfigurationProperties(prefix = "fishcards.ai")
public class AiProperties {

    /** 当前使用的 AI 提供商: openrouter / mock */
    private String provider = "openrouter";

    /** 服务端持有的 OpenRouter API Key */
    private String apiKey;

    /** 默认模型 */
    private String defaultModel = "openai/gpt-4o-mini";

    /** 单次 API 调用的超时时间（毫秒），到点取消请求 */
    private long requestTimeoutMs = 30_000;

    /** 建立连接的超时时间（秒） */
    private int connectTimeoutSeconds = 10;

    /** OpenRouter 配置 */
    private OpenRouterConfig openrouter = new OpenRouterConfig();

    @Data
    public static class OpenRouterConfig {
        private String baseUrl = "https://openrouter.ai/api/v1";
        private double temperature = 0.2;
        private int maxTokens = 2000;

        /** 可选的来源标识头 HTTP-Referer */
        private String referer;

        /** 可选的应用名称头 X-Title */
        private String title;
    }
}
