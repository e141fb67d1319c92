package com.fishcards.common.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AI 服务调用异常：上游非 2xx、超时/中断、空内容、无法解析或结构非法的闪卡。
 * <p>
 * 状态码约定：上游 429 原样透传，其余上游/传输失败统一为 502，
 * AI 层自身配置错误（如缺少 API Key）为 500。
 * 错误码由状态码决定，调用方据此区分限流、上游故障和内部配置错误。
 */
public final class AiApiException extends GenerationException {

    public static final String CODE_AI_API_ERROR = "AI_API_ERROR";
    public static final String CODE_RATE_LIMIT_EXCEEDED = "RATE_LIMIT_EXCEEDED";
    public static final String CODE_INTERNAL_ERROR = "INTERNAL_SERVER_ERROR";

    private final Map<String, Object> details;

    public AiApiException(String message, int status) {
        this(message, status, Map.of(), null);
    }

    public AiApiException(String message, int status, Map<String, Object> details) {
        this(message, status, details, null);
    }

    public AiApiException(String message, int status, Map<String, Object> details, Throwable cause) {
        super(codeFor(status), status, message, cause);
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static String codeFor(int status) {
        if (status == 429) {
            return CODE_RATE_LIMIT_EXCEEDED;
        }
        if (status == 500) {
            return CODE_INTERNAL_ERROR;
        }
        return CODE_AI_API_ERROR;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public Kind kind() {
        return Kind.AI_API;
    }
}
