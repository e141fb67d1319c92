package com.fishcards.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 源文本指纹：UTF-8 字节的 SHA-256，小写十六进制，共 64 个字符。
 * <p>
 * 纯函数，相同输入在任何平台上都得到相同输出，用于审计关联和去重。
 */
public final class SourceTextHasher {

    private static final HexFormat HEX = HexFormat.of();

    private SourceTextHasher() {
    }

    public static String sha256Hex(String sourceText) {
        if (sourceText == null) {
            throw new IllegalArgumentException("sourceText 不能为 null");
        }
        byte[] digest = sha256().digest(sourceText.getBytes(StandardCharsets.UTF_8));
        return HEX.formatHex(digest);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // 所有 JRE 都必须提供 SHA-256
            throw new IllegalStateException("JRE 不支持 SHA-256", e);
        }
    }
}
