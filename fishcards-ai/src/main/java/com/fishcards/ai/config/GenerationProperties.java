package com.fishcards.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 生成流水线的输入输出约束。
 */
@Data
@ConfigurationProperties(prefix = "fishcards.generation")
public class GenerationProperties {

    /** 源文本最少字符数 */
    private int minSourceLength = 1000;

    /** 源文本最多字符数 */
    private int maxSourceLength = 10000;

    /** 单次生成最多候选数 */
    private int maxProposals = 50;

    /** 正面最大长度 */
    private int maxFrontLength = 200;

    /** 背面最大长度 */
    private int maxBackLength = 500;
}
