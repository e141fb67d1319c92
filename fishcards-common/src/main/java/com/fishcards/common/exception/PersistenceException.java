package com.fishcards.common.exception;

/**
 * 持久化异常：成功路径上写入生成记录失败，属于致命错误，不返回任何部分结果。
 */
public final class PersistenceException extends GenerationException {

    public static final String CODE = "DATABASE_ERROR";

    public PersistenceException(String message) {
        super(CODE, 500, message, null);
    }

    public PersistenceException(String message, Throwable cause) {
        super(CODE, 500, message, cause);
    }

    @Override
    public Kind kind() {
        return Kind.PERSISTENCE;
    }
}
