package com.fishcards.common.logging;

/**
 * 结构化日志级别，按严重程度递增。
 */
public enum LogLevel {
    DEBUG("\u001B[36m"),
    INFO("\u001B[32m"),
    WARN("\u001B[33m"),
    ERROR("\u001B[31m");

    private final String ansiColor;

    LogLevel(String ansiColor) {
        this.ansiColor = ansiColor;
    }

    public String ansiColor() {
        return ansiColor;
    }

    public boolean isAtLeast(LogLevel threshold) {
        return ordinal() >= threshold.ordinal();
    }
}
