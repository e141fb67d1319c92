package com.fishcards.ai.normalize;

/**
 * 模型输出最终通过哪条路径解析成功。
 */
public enum ParsePath {

    /** 整段内容直接是合法 JSON */
    DIRECT,

    /** 截取第一个 '{' 到最后一个 '}' 之间的子串后解析成功 */
    BRACE_EXTRACTION
}
