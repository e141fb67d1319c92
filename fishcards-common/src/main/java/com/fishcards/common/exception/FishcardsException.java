package com.fishcards.common.exception;

/**
 * 系统基础异常，所有业务异常的父类。
 */
public class FishcardsException extends RuntimeException {

    private final String errorCode;

    public FishcardsException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public FishcardsException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
