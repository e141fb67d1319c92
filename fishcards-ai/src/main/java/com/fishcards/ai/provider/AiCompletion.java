package com.fishcards.ai.provider;

import lombok.Builder;
import lombok.Value;

/**
 * AI 调用成功的原始输出，附带实测耗时。
 */
@Value
@Builder
public class AiCompletion {

    /** 模型返回的 message.content 原文 */
    String content;

    /** 从发起请求到拿到响应的墙钟耗时（毫秒） */
    long durationMs;

    /** usage.total_tokens，上游未返回时为 null */
    Integer totalTokens;
}
