package com.fishcards.ai.provider;

import com.fishcards.common.exception.AiApiException;

/**
 * 闪卡生成的 AI 提供商接口。
 * 通过适配器模式支持不同的实现（OpenRouter、本地 mock 等）。
 */
public interface AiProvider {

    /**
     * 发起一次生成调用（阻塞式，等待完整响应）。
     * <p>
     * 不做自动重试；调用方需要重试时应重新发起。
     *
     * @param request 调用参数
     * @return 模型返回的原始内容与耗时
     * @throws AiApiException 任何上游或传输失败，details 中带 generationDurationMs
     */
    AiCompletion generate(AiGenerationRequest request);

    /**
     * 是否需要服务端 API Key。需要时编排层在取令牌之前就拒绝缺 Key 的调用。
     */
    default boolean requiresApiKey() {
        return false;
    }

    /**
     * 获取提供商名称。
     */
    String getProviderName();
}
