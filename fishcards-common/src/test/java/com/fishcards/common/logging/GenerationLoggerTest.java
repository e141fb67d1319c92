package com.fishcards.common.logging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GenerationLoggerTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    private final GenerationLogger production = new GenerationLogger(false, null, FIXED);
    private final GenerationLogger development = new GenerationLogger(true, null, FIXED);

    @Test
    @DisplayName("apiKey 等敏感键被替换为脱敏标记")
    void redactsSensitiveKeys() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("apiKey", "sk-or-v1-secret");
        context.put("Authorization", "Bearer sk-or-v1-secret");
        context.put("source_text", "długi tekst");
        context.put("messages", "[...]");
        context.put("model", "openai/gpt-4o-mini");

        Map<String, Object> sanitized = production.sanitizeContext(context);

        assertThat(sanitized)
                .containsEntry("apiKey", GenerationLogger.REDACTED)
                .containsEntry("Authorization", GenerationLogger.REDACTED)
                .containsEntry("source_text", GenerationLogger.REDACTED)
                .containsEntry("messages", GenerationLogger.REDACTED)
                .containsEntry("model", "openai/gpt-4o-mini");
    }

    @Test
    void sensitiveKeyMatchIsCaseInsensitiveSubstring() {
        assertThat(GenerationLogger.isSensitiveKey("OPENROUTER_API_KEY")).isTrue();
        assertThat(GenerationLogger.isSensitiveKey("refreshToken")).isTrue();
        assertThat(GenerationLogger.isSensitiveKey("contentPreview")).isTrue();
        assertThat(GenerationLogger.isSensitiveKey("duration")).isFalse();
        assertThat(GenerationLogger.isSensitiveKey(null)).isFalse();
    }

    @Test
    @DisplayName("非开发模式下 userId 只保留首尾 4 位")
    void masksUserIdOutsideDevelopment() {
        assertThat(production.sanitizeUserId("abcdefghij")).isEqualTo("abcd***ghij");
        assertThat(production.sanitizeUserId("short")).isEqualTo("user-***");
        assertThat(development.sanitizeUserId("abcdefghij")).isEqualTo("abcdefghij");

        assertThat(production.sanitizeContext(Map.of("userId", "abcdefghij")))
                .containsEntry("userId", "abcd***ghij");
    }

    @Test
    void truncatesLongStrings() {
        String longValue = "x".repeat(GenerationLogger.MAX_VALUE_LENGTH + 20);

        Object rendered = production.sanitizeContext(Map.of("note", longValue)).get("note");

        assertThat(rendered).isEqualTo("x".repeat(GenerationLogger.MAX_VALUE_LENGTH) + "...");
    }

    @Test
    void dropsNullValues() {
        Map<String, Object> context = new HashMap<>();
        context.put("retryAfter", null);
        context.put("waitTime", 250L);

        assertThat(production.sanitizeContext(context)).containsOnlyKeys("waitTime");
    }

    @Test
    @DisplayName("默认级别：开发模式 DEBUG，其他 INFO")
    void levelFiltering() {
        assertThat(development.isEnabled(LogLevel.DEBUG)).isTrue();
        assertThat(production.isEnabled(LogLevel.DEBUG)).isFalse();
        assertThat(production.isEnabled(LogLevel.INFO)).isTrue();

        GenerationLogger warnOnly = new GenerationLogger(false, LogLevel.WARN, FIXED);
        assertThat(warnOnly.isEnabled(LogLevel.INFO)).isFalse();
        assertThat(warnOnly.isEnabled(LogLevel.ERROR)).isTrue();
    }

    @Test
    @DisplayName("生产模式输出单行 JSON")
    void productionFormatIsJson() throws Exception {
        String line = production.format(LogLevel.WARN, "触发限流", Map.of("waitTime", 400, "apiKey", "sk-1"));

        assertThat(line).doesNotContain("\n").doesNotContain("sk-1");
        JsonNode json = new ObjectMapper().readTree(line);
        assertThat(json.get("timestamp").asText()).isEqualTo("2026-01-15T10:00:00Z");
        assertThat(json.get("level").asText()).isEqualTo("warn");
        assertThat(json.get("message").asText()).isEqualTo("触发限流");
        assertThat(json.get("service").asText()).isEqualTo(GenerationLogger.SERVICE);
        assertThat(json.path("context").path("waitTime").asInt()).isEqualTo(400);
        assertThat(json.path("context").path("apiKey").asText()).isEqualTo(GenerationLogger.REDACTED);
    }

    @Test
    void developmentFormatIsColoredLine() {
        String line = development.format(LogLevel.ERROR, "AI 请求失败", Map.of("statusCode", 502));

        assertThat(line)
                .startsWith(LogLevel.ERROR.ansiColor())
                .contains("ERROR")
                .contains("AI 请求失败")
                .contains("\"statusCode\":502");
    }

    @Test
    void configChangeFieldsPassThroughUnchanged() {
        Map<String, Object> fields = GenerationLogger.fields("property", "capacity", "oldValue", 10, "newValue", 5);

        assertThat(production.sanitizeContext(fields))
                .containsEntry("property", "capacity")
                .containsEntry("oldValue", 10)
                .containsEntry("newValue", 5);
    }
}
