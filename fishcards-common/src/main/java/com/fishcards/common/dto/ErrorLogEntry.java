package com.fishcards.common.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * 生成失败日志，尽力写入，只追加。
 */
@Value
@Builder
public class ErrorLogEntry {

    Long id;

    @JsonProperty("user_id")
    String userId;

    String model;

    @JsonProperty("source_text_hash")
    String sourceTextHash;

    @JsonProperty("source_text_length")
    int sourceTextLength;

    @JsonProperty("error_code")
    String errorCode;

    @JsonProperty("error_message")
    String errorMessage;

    @JsonProperty("created_at")
    String createdAt;
}
