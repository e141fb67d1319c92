package com.fishcards.common.exception;

import java.util.List;

/**
 * 调用方输入不合法（如源文本长度超出范围）。
 * <p>
 * 在任何网络请求之前抛出，不会写入生成错误日志。
 */
public final class ValidationException extends GenerationException {

    public static final String CODE = "VALIDATION_ERROR";

    private final List<String> issues;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<String> issues) {
        super(CODE, 400, message, null);
        this.issues = List.copyOf(issues);
    }

    public List<String> getIssues() {
        return issues;
    }

    @Override
    public Kind kind() {
        return Kind.VALIDATION;
    }
}
