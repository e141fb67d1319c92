package com.fishcards.common.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 生成流水线的结构化日志。
 * <p>
 * 在 SLF4J 之上增加：级别过滤、敏感字段脱敏、长字符串截断、用户 ID 掩码。
 * 开发模式输出彩色单行，其他环境输出单行 JSON，两者字段语义完全一致。
 * 所有条目写入名为 {@code com.fishcards.generation} 的 SLF4J Logger。
 */
public class GenerationLogger {

    public static final String REDACTED = "[REDACTED]";
    public static final String SERVICE = "openrouter";

    static final int MAX_VALUE_LENGTH = 500;
    private static final String ANSI_RESET = "\u001B[0m";

    /** 键名包含任一片段（不区分大小写）即脱敏 */
    private static final List<String> SENSITIVE_KEYS = List.of(
            "apikey", "api_key", "token", "password", "secret", "authorization",
            "bearer", "content", "messages", "sourcetext", "source_text");

    private static final Logger OUTPUT = LoggerFactory.getLogger("com.fishcards.generation");

    private final boolean development;
    private final LogLevel minLevel;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GenerationLogger(boolean development) {
        this(development, null, Clock.systemUTC());
    }

    public GenerationLogger(boolean development, LogLevel minLevel) {
        this(development, minLevel, Clock.systemUTC());
    }

    public GenerationLogger(boolean development, LogLevel minLevel, Clock clock) {
        this.development = development;
        this.minLevel = minLevel != null ? minLevel : (development ? LogLevel.DEBUG : LogLevel.INFO);
        this.clock = clock;
    }

    // ======================== 四个级别 ========================

    public void debug(String message, Map<String, ?> context) {
        write(LogLevel.DEBUG, message, context);
    }

    public void info(String message, Map<String, ?> context) {
        write(LogLevel.INFO, message, context);
    }

    public void warn(String message, Map<String, ?> context) {
        write(LogLevel.WARN, message, context);
    }

    public void error(String message, Map<String, ?> context) {
        write(LogLevel.ERROR, message, context);
    }

    // ======================== 固定事件 ========================

    public void logRequestStart(String requestId, String model, String operation,
                                int messageCount, boolean hasSchema, String userId) {
        info("AI 请求开始", fields(
                "requestId", requestId,
                "model", model,
                "operation", operation,
                "messageCount", messageCount,
                "hasSchema", hasSchema,
                "userId", userId));
    }

    public void logRequestSuccess(String requestId, String model, String operation,
                                  long duration, Integer usageTotal, String userId) {
        info("AI 请求完成", fields(
                "requestId", requestId,
                "model", model,
                "operation", operation,
                "duration", duration,
                "usageTotal", usageTotal,
                "userId", userId));
    }

    public void logRequestError(String requestId, String model, String operation, long duration,
                                String errorType, String errorCode, Integer statusCode, String userId) {
        error("AI 请求失败", fields(
                "requestId", requestId,
                "model", model,
                "operation", operation,
                "duration", duration,
                "errorType", errorType,
                "errorCode", errorCode,
                "statusCode", statusCode,
                "userId", userId));
    }

    public void logRateLimit(String requestId, long waitTime, int bucketLevel, Long retryAfter) {
        warn("触发限流", fields(
                "requestId", requestId,
                "waitTime", waitTime,
                "bucketLevel", bucketLevel,
                "retryAfter", retryAfter));
    }

    public void logConfigChange(String property, Object oldValue, Object newValue) {
        boolean sensitive = isSensitiveKey(property);
        info("配置已变更", fields(
                "property", property,
                "oldValue", sensitive ? REDACTED : oldValue,
                "newValue", sensitive ? REDACTED : newValue));
    }

    // ======================== 渲染 ========================

    public boolean isEnabled(LogLevel level) {
        return level.isAtLeast(minLevel);
    }

    public boolean isDevelopment() {
        return development;
    }

    public LogLevel getMinLevel() {
        return minLevel;
    }

    /**
     * 将一条日志渲染成单行文本（不做级别过滤）。
     */
    public String format(LogLevel level, String message, Map<String, ?> context) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", Instant.now(clock).toString());
        entry.put("level", level.name().toLowerCase(Locale.ROOT));
        entry.put("message", message);
        entry.put("context", sanitizeContext(context));
        entry.put("service", SERVICE);

        if (development) {
            return level.ansiColor() + "[" + entry.get("timestamp") + "] " + level.name()
                    + " [" + SERVICE + "]" + ANSI_RESET + " " + message + " " + toJson(entry.get("context"));
        }
        return toJson(entry);
    }

    /**
     * 对上下文的每个顶层键做脱敏、截断，并对 userId 掩码。
     */
    public Map<String, Object> sanitizeContext(Map<String, ?> context) {
        if (context == null || context.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> sanitized = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : context.entrySet()) {
            String key = e.getKey();
            Object value = e.getValue();
            if (value == null) {
                continue;
            }
            if (isSensitiveKey(key)) {
                sanitized.put(key, REDACTED);
            } else if ("userId".equals(key)) {
                sanitized.put(key, sanitizeUserId(String.valueOf(value)));
            } else if (value instanceof String s && s.length() > MAX_VALUE_LENGTH) {
                sanitized.put(key, s.substring(0, MAX_VALUE_LENGTH) + "...");
            } else {
                sanitized.put(key, value);
            }
        }
        return sanitized;
    }

    /**
     * 开发模式下完整显示，其他环境只保留首尾各 4 位。
     */
    public String sanitizeUserId(String userId) {
        if (userId == null || userId.isEmpty()) {
            return null;
        }
        if (development) {
            return userId;
        }
        if (userId.length() <= 8) {
            return "user-***";
        }
        return userId.substring(0, 4) + "***" + userId.substring(userId.length() - 4);
    }

    public static boolean isSensitiveKey(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        return SENSITIVE_KEYS.stream().anyMatch(lower::contains);
    }

    private void write(LogLevel level, String message, Map<String, ?> context) {
        if (!isEnabled(level)) {
            return;
        }
        String line = format(level, message, context);
        switch (level) {
            case DEBUG -> OUTPUT.debug(line);
            case INFO -> OUTPUT.info(line);
            case WARN -> OUTPUT.warn(line);
            case ERROR -> OUTPUT.error(line);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            OUTPUT.warn("结构化日志序列化失败: {}", e.getOriginalMessage());
            return String.valueOf(value);
        }
    }

    /**
     * 按键值对构造有序上下文，值为 null 的字段在渲染时被省略。
     */
    static Map<String, Object> fields(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }
}
