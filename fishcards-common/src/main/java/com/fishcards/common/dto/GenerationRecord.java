package com.fishcards.common.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * 一次成功生成的审计记录，创建后只追加、不修改。
 * <p>
 * 不变量：{@code generatedCount} 等于本次调用产出的候选闪卡数量。
 */
@Value
@Builder(toBuilder = true)
public class GenerationRecord {

    Long id;

    @JsonProperty("user_id")
    String userId;

    String model;

    @JsonProperty("generated_count")
    int generatedCount;

    @JsonProperty("accepted_unedited_count")
    int acceptedUneditedCount;

    @JsonProperty("accepted_edited_count")
    int acceptedEditedCount;

    /** 源文本 SHA-256 指纹（小写十六进制） */
    @JsonProperty("source_text_hash")
    String sourceTextHash;

    @JsonProperty("source_text_length")
    int sourceTextLength;

    @JsonProperty("generation_duration_ms")
    long generationDurationMs;

    /** yyyy-MM-dd HH:mm:ss */
    @JsonProperty("created_at")
    String createdAt;

    @JsonProperty("updated_at")
    String updatedAt;
}
