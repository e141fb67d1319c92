package com.fishcards.ai.normalize;

import com.fishcards.common.dto.FlashcardProposal;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 规整结果：通过校验的候选闪卡，以及解析路径和被丢弃的条目数。
 */
@Value
@Builder
public class NormalizedProposals {

    List<FlashcardProposal> proposals;

    ParsePath parsePath;

    /** 缺字段、类型不对或去空白后为空而被丢弃的候选数 */
    int droppedCount;
}
