package com.fishcards.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AI 生成的闪卡候选，等待用户采纳或编辑，本身不落库。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlashcardProposal {

    public static final String SOURCE_AI = "ai";

    /** 正面（问题），去除首尾空白后非空，最多 200 字符 */
    private String front;

    /** 背面（答案），去除首尾空白后非空，最多 500 字符 */
    private String back;

    /** 来源，固定为 "ai" */
    @Builder.Default
    private String source = SOURCE_AI;

    public static FlashcardProposal ai(String front, String back) {
        return new FlashcardProposal(front, back, SOURCE_AI);
    }
}
