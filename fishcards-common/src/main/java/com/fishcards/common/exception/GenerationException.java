package com.fishcards.common.exception;

/**
 * 闪卡生成流水线的封闭错误类型。
 * <p>
 * 只允许三种变体，调用方可以对 {@link #kind()} 做穷尽的 switch，
 * 而不必逐个 instanceof 试探：
 * <ul>
 *   <li>{@link ValidationException}：调用方输入不合法，未发起任何网络请求</li>
 *   <li>{@link AiApiException}：访问或解析上游模型失败</li>
 *   <li>{@link PersistenceException}：成功路径上写库失败</li>
 * </ul>
 */
public abstract sealed class GenerationException extends FishcardsException
        permits ValidationException, AiApiException, PersistenceException {

    public enum Kind {
        VALIDATION, AI_API, PERSISTENCE
    }

    private final int status;

    protected GenerationException(String errorCode, int status, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.status = status;
    }

    /** 对外暴露的 HTTP 语义状态码 */
    public int getStatus() {
        return status;
    }

    public abstract Kind kind();
}
