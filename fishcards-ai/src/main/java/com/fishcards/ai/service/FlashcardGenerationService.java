package com.fishcards.ai.service;

import com.fishcards.ai.config.AiProperties;
import com.fishcards.ai.config.GenerationProperties;
import com.fishcards.ai.normalize.NormalizedProposals;
import com.fishcards.ai.normalize.ProposalNormalizer;
import com.fishcards.ai.provider.AiCompletion;
import com.fishcards.ai.provider.AiGenerationRequest;
import com.fishcards.ai.provider.AiProvider;
import com.fishcards.ai.provider.AiProviderFactory;
import com.fishcards.common.dto.ErrorLogEntry;
import com.fishcards.common.dto.GenerationRecord;
import com.fishcards.common.dto.GenerationResponse;
import com.fishcards.common.exception.AiApiException;
import com.fishcards.common.exception.PersistenceException;
import com.fishcards.common.exception.RateLimitTimeoutException;
import com.fishcards.common.exception.ValidationException;
import com.fishcards.common.logging.GenerationLogger;
import com.fishcards.common.store.GenerationStore;
import com.fishcards.common.util.IdGenerator;
import com.fishcards.common.util.SourceTextHasher;
import com.fishcards.dispatcher.config.RateLimiterProperties;
import com.fishcards.dispatcher.ratelimit.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 闪卡生成编排服务。
 * <p>
 * 成功路径：校验 → 计算指纹 → 检查提供商配置 → 取令牌 → 调用 AI → 规整 → 写生成记录 → 返回。
 * 调用 AI 或规整阶段的任何 {@link AiApiException} 先尽力写一条错误日志，再原样抛出；
 * 写生成记录失败直接以 {@link PersistenceException} 抛出，不再尝试写错误日志。
 * <p>
 * 不做自动重试。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlashcardGenerationService {

    private final AiProviderFactory providerFactory;
    private final ProposalNormalizer normalizer;
    private final GenerationStore generationStore;
    private final RateLimiter generationRateLimiter;
    private final RateLimiterProperties rateLimiterProperties;
    private final AiProperties aiProperties;
    private final GenerationProperties generationProperties;
    private final GenerationLogger generationLogger;

    /**
     * 使用服务端配置的默认模型与 API Key 生成。
     */
    public GenerationResponse createGeneration(String userId, String sourceText) {
        return createGeneration(userId, sourceText, aiProperties.getDefaultModel(), aiProperties.getApiKey());
    }

    public GenerationResponse createGeneration(String userId, String sourceText, String model, String apiKey) {
        validate(userId, sourceText, model);

        String requestId = IdGenerator.requestId("gen");
        String sourceTextHash = SourceTextHasher.sha256Hex(sourceText);
        int sourceTextLength = sourceText.length();

        log.info("[{}] 开始生成: model={}, 源文本 {} 字符, hash={}",
                requestId, model, sourceTextLength, sourceTextHash.substring(0, 12));

        // 配置错误（未知提供商、缺 Key）直接 500，不占令牌也不记错误日志
        AiProvider provider = providerFactory.getProvider();
        if (provider.requiresApiKey() && (apiKey == null || apiKey.isBlank())) {
            log.error("[{}] 服务端未配置 {} API Key", requestId, provider.getProviderName());
            throw new AiApiException("服务端未配置 API Key", 500);
        }

        AiCompletion completion;
        NormalizedProposals normalized;
        try {
            acquirePermit(requestId);
            completion = provider.generate(AiGenerationRequest.builder()
                    .sourceText(sourceText)
                    .model(model)
                    .apiKey(apiKey)
                    .timeoutMs(aiProperties.getRequestTimeoutMs())
                    .userId(userId)
                    .requestId(requestId)
                    .build());
            normalized = normalizer.normalize(completion.getContent());
        } catch (AiApiException e) {
            log.warn("[{}] 生成失败: {} ({}) - {}", requestId, e.getErrorCode(), e.getStatus(), e.getMessage());
            recordErrorLog(userId, model, sourceTextHash, sourceTextLength, e);
            throw e;
        }

        int generatedCount = normalized.getProposals().size();
        GenerationRecord saved = persist(GenerationRecord.builder()
                .userId(userId)
                .model(model)
                .generatedCount(generatedCount)
                .acceptedUneditedCount(0)
                .acceptedEditedCount(0)
                .sourceTextHash(sourceTextHash)
                .sourceTextLength(sourceTextLength)
                .generationDurationMs(completion.getDurationMs())
                .build());

        log.info("[{}] 生成完成: id={}, {} 张候选, 解析路径={}, 耗时 {}ms",
                requestId, saved.getId(), generatedCount, normalized.getParsePath(), completion.getDurationMs());

        return GenerationResponse.builder()
                .generationId(saved.getId())
                .flashcardsProposals(normalized.getProposals())
                .metadata(GenerationResponse.Metadata.builder()
                        .generatedCount(generatedCount)
                        .sourceTextLength(sourceTextLength)
                        .generationDurationMs(completion.getDurationMs())
                        .build())
                .build();
    }

    // ======================== 各阶段 ========================

    private void validate(String userId, String sourceText, String model) {
        List<String> issues = new ArrayList<>();
        if (userId == null || userId.isBlank()) {
            issues.add("userId 不能为空");
        }
        if (model == null || model.isBlank()) {
            issues.add("model 不能为空");
        }
        if (sourceText == null) {
            issues.add("source_text 不能为空");
        } else {
            int min = generationProperties.getMinSourceLength();
            int max = generationProperties.getMaxSourceLength();
            if (sourceText.length() < min || sourceText.length() > max) {
                issues.add("source_text 长度必须在 " + min + " 到 " + max + " 字符之间，当前 " + sourceText.length());
            }
        }
        if (!issues.isEmpty()) {
            throw new ValidationException(String.join("; ", issues), issues);
        }
    }

    /**
     * 取一个令牌。桶空时先记一条限流事件；等待超时转为 429。
     */
    private void acquirePermit(String requestId) {
        if (!rateLimiterProperties.isEnabled()) {
            return;
        }
        if (!generationRateLimiter.canAcquire(1)) {
            generationLogger.logRateLimit(requestId, generationRateLimiter.getTimeUntilNextToken(),
                    generationRateLimiter.getAvailableTokens(), null);
        }
        try {
            generationRateLimiter.acquire(1);
        } catch (RateLimitTimeoutException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("tokensRequired", e.getTokensRequired());
            details.put("maxWaitTimeMs", e.getMaxWaitTimeMs());
            throw new AiApiException("本地限流等待超时，请稍后重试", 429, details, e);
        }
    }

    private GenerationRecord persist(GenerationRecord record) {
        try {
            return generationStore.insertGeneration(record);
        } catch (PersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceException("写入生成记录失败", e);
        }
    }

    /**
     * 尽力写错误日志，失败只记警告，不覆盖原始异常。
     */
    private void recordErrorLog(String userId, String model, String sourceTextHash,
                                int sourceTextLength, AiApiException error) {
        try {
            generationStore.insertErrorLog(ErrorLogEntry.builder()
                    .userId(userId)
                    .model(model)
                    .sourceTextHash(sourceTextHash)
                    .sourceTextLength(sourceTextLength)
                    .errorCode(error.getErrorCode())
                    .errorMessage(error.getMessage())
                    .build());
        } catch (RuntimeException logFailure) {
            log.warn("写入生成错误日志失败（已忽略）: {}", logFailure.getMessage());
        }
    }
}
