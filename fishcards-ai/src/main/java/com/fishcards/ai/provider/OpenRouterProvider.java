package com.fishcards.ai.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fishcards.ai.config.AiProperties;
import com.fishcards.ai.prompt.PromptTemplates;
import com.fishcards.common.exception.AiApiException;
import com.fishcards.common.logging.GenerationLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * OpenRouter（OpenAI 兼容 Chat Completions）实现。
 * <p>
 * 每次调用只发一个 POST；通过 {@link Call#timeout()} 在超时边界取消请求，
 * 取消后连接资源随 Response 关闭一并释放。成功与失败都带上墙钟耗时。
 * <p>
 * 失败映射：上游 429 透传为 429，其他非 2xx、传输失败、超时、空内容一律 502。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenRouterProvider implements AiProvider {

    static final String OPERATION = "chatCompletion";

    private final OkHttpClient aiHttpClient;
    private final AiProperties properties;
    private final PromptTemplates promptTemplates;
    private final GenerationLogger generationLogger;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");

    @Override
    public AiCompletion generate(AiGenerationRequest request) {
        if (request.getApiKey() == null || request.getApiKey().isBlank()) {
            throw new AiApiException("服务端未配置 OpenRouter API Key", 500);
        }

        AiProperties.OpenRouterConfig config = properties.getOpenrouter();
        String url = config.getBaseUrl() + "/chat/completions";
        long startNanos = System.nanoTime();

        generationLogger.logRequestStart(request.getRequestId(), request.getModel(), OPERATION,
                2, true, request.getUserId());

        Call call = null;
        try {
            // 非法请求头（如 Key 含换行）或 base-url 在构建阶段即抛 IllegalArgumentException
            call = aiHttpClient.newCall(buildRequest(url, config, request));
            call.timeout().timeout(request.getTimeoutMs(), TimeUnit.MILLISECONDS);

            try (Response response = call.execute()) {
                String body = response.body() != null ? response.body().string() : "";
                long duration = elapsedMs(startNanos);

                if (!response.isSuccessful()) {
                    log.error("OpenRouter API 调用失败: {} - {}", response.code(), truncate(body));
                    throw upstreamError(response, body, duration);
                }

                AiCompletion completion = parseCompletion(body, duration);
                log.info("OpenRouter 响应长度: {} 字符, 耗时 {}ms", completion.getContent().length(), duration);
                generationLogger.logRequestSuccess(request.getRequestId(), request.getModel(), OPERATION,
                        duration, completion.getTotalTokens(), request.getUserId());
                return completion;
            }

        } catch (AiApiException e) {
            logFailure(request, e, elapsedMs(startNanos));
            throw e;
        } catch (IOException e) {
            long duration = elapsedMs(startNanos);
            boolean timedOut = (call != null && call.isCanceled()) || e instanceof InterruptedIOException;
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("generationDurationMs", duration);
            details.put("timeoutMs", request.getTimeoutMs());
            details.put("cause", e.getClass().getSimpleName());
            String message = timedOut
                    ? "OpenRouter 请求超时（" + request.getTimeoutMs() + "ms），已取消"
                    : "调用 OpenRouter API 时发生网络错误";
            log.warn("{}: {}", message, e.getMessage());
            AiApiException failure = new AiApiException(message, 502, details, e);
            logFailure(request, failure, duration);
            throw failure;
        } catch (RuntimeException e) {
            long duration = elapsedMs(startNanos);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("generationDurationMs", duration);
            details.put("cause", e.getClass().getSimpleName());
            log.error("调用 OpenRouter API 时发生未知错误: {}", e.getMessage());
            AiApiException failure = new AiApiException("调用 OpenRouter API 时发生未知错误", 502, details, e);
            logFailure(request, failure, duration);
            throw failure;
        }
    }

    // ======================== 请求构建 ========================

    private Request buildRequest(String url, AiProperties.OpenRouterConfig config, AiGenerationRequest request) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .addHeader("Authorization", "Bearer " + request.getApiKey())
                .addHeader("Content-Type", "application/json")
                .post(RequestBody.create(buildRequestBody(config, request), JSON_MEDIA));
        if (config.getReferer() != null && !config.getReferer().isBlank()) {
            builder.addHeader("HTTP-Referer", config.getReferer());
        }
        if (config.getTitle() != null && !config.getTitle().isBlank()) {
            builder.addHeader("X-Title", config.getTitle());
        }
        return builder.build();
    }

    /**
     * 构建 Chat Completions 请求体：固定系统指令 + 嵌入源文本的用户消息，要求 JSON 对象输出。
     */
    String buildRequestBody(AiProperties.OpenRouterConfig config, AiGenerationRequest request) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", request.getModel());
        root.put("temperature", config.getTemperature());
        root.put("max_tokens", config.getMaxTokens());
        root.putObject("response_format").put("type", "json_object");

        ArrayNode messages = root.putArray("messages");
        ObjectNode systemMsg = messages.addObject();
        systemMsg.put("role", "system");
        systemMsg.put("content", promptTemplates.getSystemInstruction());

        ObjectNode userMsg = messages.addObject();
        userMsg.put("role", "user");
        userMsg.put("content", promptTemplates.getUserMessage(request.getSourceText()));

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new AiApiException("构建请求体失败", 500, Map.of(), e);
        }
    }

    // ======================== 响应解析 ========================

    private AiCompletion parseCompletion(String body, long duration) {
        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new AiApiException("OpenRouter 返回的响应不是合法 JSON", 502,
                    Map.of("generationDurationMs", duration, "upstreamBody", truncate(body)), e);
        }

        JsonNode content = json.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new AiApiException("OpenRouter API 返回空内容", 502,
                    Map.of("generationDurationMs", duration));
        }

        JsonNode totalTokens = json.path("usage").path("total_tokens");
        return AiCompletion.builder()
                .content(content.asText())
                .durationMs(duration)
                .totalTokens(totalTokens.isNumber() ? totalTokens.asInt() : null)
                .build();
    }

    private AiApiException upstreamError(Response response, String body, long duration) {
        int upstreamStatus = response.code();
        int status = upstreamStatus == 429 ? 429 : 502;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("upstreamStatus", upstreamStatus);
        details.put("upstreamBody", truncate(body));
        details.put("generationDurationMs", duration);
        String retryAfter = response.header("Retry-After");
        if (retryAfter != null) {
            details.put("retryAfter", retryAfter);
        }

        String message = status == 429
                ? "OpenRouter 限流 (429)，请稍后重试"
                : "OpenRouter API 返回错误: " + upstreamStatus;
        return new AiApiException(message, status, details);
    }

    private void logFailure(AiGenerationRequest request, AiApiException e, long duration) {
        generationLogger.logRequestError(request.getRequestId(), request.getModel(), OPERATION, duration,
                e.getClass().getSimpleName(), e.getErrorCode(), e.getStatus(), request.getUserId());
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String truncate(String text) {
        if (text == null) return "";
        return text.length() > 1000 ? text.substring(0, 1000) + "..." : text;
    }

    @Override
    public boolean requiresApiKey() {
        return true;
    }

    @Override
    public String getProviderName() {
        return "openrouter";
    }
}
