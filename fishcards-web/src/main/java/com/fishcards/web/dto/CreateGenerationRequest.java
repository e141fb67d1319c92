package com.fishcards.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POST /api/generations 请求体。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateGenerationRequest {

    @JsonProperty("source_text")
    private String sourceText;
}
