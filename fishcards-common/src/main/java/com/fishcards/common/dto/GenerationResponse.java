package com.fishcards.common.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 一次生成返回给调用方的结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationResponse {

    @JsonProperty("generation_id")
    private Long generationId;

    @JsonProperty("flashcards_proposals")
    private List<FlashcardProposal> flashcardsProposals;

    private Metadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {

        @JsonProperty("generated_count")
        private int generatedCount;

        @JsonProperty("source_text_length")
        private int sourceTextLength;

        @JsonProperty("generation_duration_ms")
        private long generationDurationMs;
    }
}
