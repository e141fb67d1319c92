package com.fishcards.ai.provider;

import lombok.Builder;
import lombok.Value;

/**
 * 一次 AI 调用的输入。源文本长度已由上游校验。
 */
@Value
@Builder
public class AiGenerationRequest {

    String sourceText;

    String model;

    /** 密钥，只用于请求头，不记录日志、不落库 */
    String apiKey;

    /** 超时（毫秒），到点取消进行中的请求 */
    @Builder.Default
    long timeoutMs = 30_000;

    String userId;

    String requestId;

    @Override
    public String toString() {
        return "AiGenerationRequest(model=" + model + ", sourceTextLength="
                + (sourceText != null ? sourceText.length() : 0)
                + ", timeoutMs=" + timeoutMs + ", requestId=" + requestId + ")";
    }
}
