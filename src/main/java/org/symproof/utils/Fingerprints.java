package org.symproof.utils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 内容寻址用的 SHA-256 指纹。
 */
public final class Fingerprints {

    /** 缓存键与 source_hash 使用的十六进制前缀长度 */
    public static final int KEY_LENGTH = 32;

    private Fingerprints() {
    }

    public static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // 每个 JDK 都必须提供 SHA-256
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /**
     * 截断后的 SHA-256，用作缓存键和 source_hash。
     */
    public static String shortHash(String text) {
        return sha256(text).substring(0, KEY_LENGTH);
    }
}
